package org.ftpmcp.ftp.content;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.util.Objects;
import java.util.Optional;

/**
 * 严格解码（分类流程的第二阶段）：按候选编码完整解码整个缓冲区，遇到任何非法/不可映射的字节序列直接失败，
 * 而不是用替换字符兜底。
 * <p>
 * 额外规则：解码结果中出现 U+0000 视为失败（正常文本不会包含 NUL，这通常意味着二进制内容恰好能被单字节编码“解码”）；
 * 开头的 BOM（U+FEFF）会被去掉。
 */
public final class StrictDecoder {

    private static final char BOM = '\uFEFF';

    private StrictDecoder() {
    }

    public static Optional<String> decode(byte[] bytes, Charset charset) {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(charset, "charset");
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        String text;
        try {
            text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
        if (text.indexOf('\u0000') >= 0) {
            return Optional.empty();
        }
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        return Optional.of(text);
    }
}
