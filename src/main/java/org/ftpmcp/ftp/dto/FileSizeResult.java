package org.ftpmcp.ftp.dto;

/**
 * {@code ftp_get_file_size} 的返回结果。
 */
public record FileSizeResult(
        String path,
        long sizeBytes
) {
}
