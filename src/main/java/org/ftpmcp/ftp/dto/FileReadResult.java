package org.ftpmcp.ftp.dto;

/**
 * {@code ftp_read_file} 的返回结果。
 *
 * @param path       远程路径
 * @param uri        {@code ftp://host:port/path}
 * @param mimeType   MIME 类型
 * @param encoding   文本编码名（小写，例如 utf-8）；二进制为 base64
 * @param binary     是否为二进制（base64）
 * @param confidence 编码检测置信度 [0,1]
 * @param sizeBytes  文件字节数
 * @param content    文本内容或 base64 字符串
 */
public record FileReadResult(
        String path,
        String uri,
        String mimeType,
        String encoding,
        boolean binary,
        double confidence,
        long sizeBytes,
        String content
) {
}
