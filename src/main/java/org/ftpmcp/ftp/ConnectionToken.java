package org.ftpmcp.ftp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 连接令牌（connectionToken）解码后的内容：base64 编码的 JSON，或 {@code server:port:username:password:dir}。
 * <p>
 * 所有字段都可选；缺失的字段沿用 {@code app.ftp.*} 中的默认值。
 *
 * @param server           服务器地址（与 host 等价，host 优先）
 * @param host             服务器地址
 * @param port             端口
 * @param username         用户名
 * @param password         密码
 * @param dir              默认远程目录
 * @param ssl              是否使用显式 FTPS
 * @param passive          是否使用被动模式
 * @param ignoreCertErrors 是否忽略证书错误
 * @param timeoutSeconds   超时秒数
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConnectionToken(
        String server,
        String host,
        Integer port,
        String username,
        String password,
        String dir,
        Boolean ssl,
        Boolean passive,
        Boolean ignoreCertErrors,
        Integer timeoutSeconds
) {

    public String resolvedHost() {
        if (host != null && !host.isBlank()) {
            return host.trim();
        }
        return server == null || server.isBlank() ? null : server.trim();
    }

    @Override
    public String toString() {
        // 不输出密码
        return "ConnectionToken[host=" + resolvedHost() + ", port=" + port + ", username=" + username + ", dir=" + dir + "]";
    }
}
