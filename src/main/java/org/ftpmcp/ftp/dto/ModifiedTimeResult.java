package org.ftpmcp.ftp.dto;

import java.time.Instant;

/**
 * {@code ftp_get_modified_time} 的返回结果（MDTM 按 UTC 返回）。
 */
public record ModifiedTimeResult(
        String path,
        Instant modifiedAt
) {
}
