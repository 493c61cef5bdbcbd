package org.ftpmcp.ftp.listing;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 目录列表（LIST 响应）中的一行解析结果。
 * <p>
 * 无论哪种方言解析成功与否，{@link #rawLine} 都会原样保留，调用方可在结构化字段缺失时直接展示原始行。
 *
 * @param name        文件名/目录名（只去掉首尾空白，内部空格保持不变）
 * @param directory   是否为目录
 * @param size        文件大小（目录或无法解析时为 null）
 * @param modifiedAt  修改时间（LIST 不带时区，按服务器本地时间理解；无法解析时为 null）
 * @param permissions 原始权限串（例如 {@code drwxr-xr-x}；没有权限列的方言为 null）
 * @param rawLine     原始行（未做任何修改）
 */
public record DirectoryEntry(
        String name,
        boolean directory,
        Long size,
        LocalDateTime modifiedAt,
        String permissions,
        String rawLine
) {

    public DirectoryEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rawLine, "rawLine");
    }

    /**
     * 任何方言都无法识别的行：名称为去掉首尾空白后的原始行，其余字段为空。
     */
    public static DirectoryEntry unparsed(String rawLine) {
        return new DirectoryEntry(rawLine.trim(), false, null, null, null, rawLine);
    }
}
