package org.ftpmcp.ftp.dto;

/**
 * 删除、建目录、删目录、重命名等操作的返回结果。
 *
 * @param operation  操作名（delete/mkdir/rmdir/rename）
 * @param path       操作的远程路径
 * @param targetPath 重命名后的路径（其它操作为 null）
 * @param uri        {@code ftp://host:port/path}
 */
public record RemoteOperationResult(
        String operation,
        String path,
        String targetPath,
        String uri
) {
}
