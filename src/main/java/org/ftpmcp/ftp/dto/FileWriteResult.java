package org.ftpmcp.ftp.dto;

import java.time.Instant;

/**
 * {@code ftp_upload_file} / {@code ftp_write_file} 的返回结果。
 *
 * @param path         远程路径
 * @param uri          {@code ftp://host:port/path}
 * @param encoding     写入使用的文本编码；上传原始字节时为 null
 * @param bytesWritten 写入字节数
 * @param wroteAt      写入完成时间
 */
public record FileWriteResult(
        String path,
        String uri,
        String encoding,
        long bytesWritten,
        Instant wroteAt
) {
}
