package org.ftpmcp.ftp.content;

import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * 基于 ICU4J {@link CharsetDetector} 的编码探测。
 * <p>
 * 规则：
 * <ul>
 *   <li>纯 7-bit 可打印 ASCII（含常见空白控制符）直接报告为 UTF-8、置信度 1.0：ASCII 是 UTF-8 的严格子集，
 *   而 ICU 对纯 ASCII 只会给出很低的 UTF-8 置信度。</li>
 *   <li>其余情况取 ICU 候选列表中第一个当前 JVM 可用的编码，置信度按 ICU 的 0-100 分值换算到 [0,1]。</li>
 * </ul>
 */
public class IcuEncodingDetector implements EncodingDetector {

    private final CharsetRegistry registry;

    public IcuEncodingDetector(CharsetRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public Detection detect(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length == 0) {
            return Detection.none();
        }
        if (isPlainAscii(bytes)) {
            return new Detection(StandardCharsets.UTF_8.name(), 1.0);
        }

        CharsetDetector detector = new CharsetDetector();
        detector.setText(bytes);
        CharsetMatch[] matches = detector.detectAll();
        if (matches == null) {
            return Detection.none();
        }
        for (CharsetMatch match : matches) {
            if (registry.lookup(match.getName()).isPresent()) {
                return new Detection(match.getName(), match.getConfidence() / 100.0);
            }
        }
        return Detection.none();
    }

    static boolean isPlainAscii(byte[] bytes) {
        for (byte b : bytes) {
            int c = b & 0xFF;
            boolean printable = c >= 0x20 && c < 0x7F;
            boolean whitespace = c == '\t' || c == '\n' || c == '\r' || c == '\f';
            if (!printable && !whitespace) {
                return false;
            }
        }
        return true;
    }
}
