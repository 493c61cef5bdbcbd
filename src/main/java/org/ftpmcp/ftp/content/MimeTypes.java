package org.ftpmcp.ftp.content;

import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

/**
 * 按文件扩展名推断 MIME 类型（基于 Spring 内置的扩展名映射表）。
 */
public final class MimeTypes {

    public static final String OCTET_STREAM = MediaType.APPLICATION_OCTET_STREAM_VALUE;
    public static final String TEXT_PLAIN = MediaType.TEXT_PLAIN_VALUE;

    private MimeTypes() {
    }

    public static String resolve(String path) {
        if (path == null || path.isBlank()) {
            return OCTET_STREAM;
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        if (name.isEmpty()) {
            return OCTET_STREAM;
        }
        return MediaTypeFactory.getMediaType(name)
                .map(MediaType::toString)
                .orElse(OCTET_STREAM);
    }

    /**
     * 内容被判定为文本、但扩展名只能得到通用二进制类型时，改用 {@code text/plain}。
     */
    public static String effective(String mimeType, ClassificationResult classification) {
        if (classification != null && classification.text() && (mimeType == null || OCTET_STREAM.equals(mimeType))) {
            return TEXT_PLAIN;
        }
        return mimeType == null ? OCTET_STREAM : mimeType;
    }
}
