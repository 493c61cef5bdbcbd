package org.ftpmcp.ftp;

import java.time.Duration;

/**
 * 一次工具调用实际使用的连接参数：默认值来自 {@link FtpServerProperties}，可被 {@link ConnectionToken} 逐项覆盖。
 */
public record FtpConnectionSettings(
        String host,
        int port,
        String username,
        String password,
        String defaultPath,
        boolean ssl,
        boolean passive,
        boolean ignoreCertErrors,
        Duration timeout,
        String controlEncoding
) {

    public static FtpConnectionSettings fromProperties(FtpServerProperties properties) {
        return new FtpConnectionSettings(
                properties.getHost(),
                properties.getPort(),
                properties.getUsername(),
                properties.getPassword(),
                properties.getDefaultPath(),
                properties.isSsl(),
                properties.isPassive(),
                properties.isIgnoreCertErrors(),
                properties.getTimeout(),
                properties.getControlEncoding()
        );
    }

    /**
     * 用令牌中给出的字段覆盖当前值；令牌为 null 时原样返回。
     */
    public FtpConnectionSettings withToken(ConnectionToken token) {
        if (token == null) {
            return this;
        }
        String tokenHost = token.resolvedHost();
        return new FtpConnectionSettings(
                tokenHost != null ? tokenHost : host,
                token.port() != null && token.port() > 0 ? token.port() : port,
                token.username() != null ? token.username() : username,
                token.password() != null ? token.password() : password,
                token.dir() != null && !token.dir().isBlank() ? token.dir() : defaultPath,
                token.ssl() != null ? token.ssl() : ssl,
                token.passive() != null ? token.passive() : passive,
                token.ignoreCertErrors() != null ? token.ignoreCertErrors() : ignoreCertErrors,
                token.timeoutSeconds() != null && token.timeoutSeconds() > 0
                        ? Duration.ofSeconds(token.timeoutSeconds())
                        : timeout,
                controlEncoding
        );
    }

    public FtpConnectionSettings requireHost() {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("未配置 FTP 主机：请设置 app.ftp.host 或在调用时传入 connectionToken");
        }
        return this;
    }

    public boolean anonymous() {
        return username == null || username.isBlank();
    }

    @Override
    public String toString() {
        return "FtpConnectionSettings[host=" + host + ", port=" + port + ", username=" + username
                + ", ssl=" + ssl + ", passive=" + passive + "]";
    }
}
