package org.ftpmcp.ftp.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * 目录列表项。
 * <p>
 * 输出字段名固定为 {@code name, path, isDirectory, size, modified, permissions, raw}。
 *
 * @param name        名称（无法识别的行为整行原文）
 * @param path        完整远程路径
 * @param directory   是否为目录（序列化为 {@code isDirectory}）
 * @param size        大小（未知或目录为 null）
 * @param modified    修改时间（服务器本地时间，未知为 null）
 * @param permissions Unix 权限串（例如 {@code -rw-r--r--}；DOS 列表为 null）
 * @param raw         服务器返回的原始行
 */
public record RemoteFileEntry(
        String name,
        String path,
        @JsonProperty("isDirectory") boolean directory,
        Long size,
        LocalDateTime modified,
        String permissions,
        String raw
) {
}
