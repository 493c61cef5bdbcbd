package org.ftpmcp.ftp.dto;

import java.util.List;

/**
 * {@code ftp_list_directory} 的返回结果。
 *
 * @param host     FTP 主机
 * @param port     端口
 * @param path     列出的远程目录
 * @param ssl      是否使用 FTPS
 * @param passive  是否使用被动模式
 * @param entries  条目列表（与服务器返回的行一一对应）
 * @param warnings 非致命告警（例如存在无法识别的行）
 */
public record DirectoryListResult(
        String host,
        int port,
        String path,
        boolean ssl,
        boolean passive,
        List<RemoteFileEntry> entries,
        List<String> warnings
) {
}
