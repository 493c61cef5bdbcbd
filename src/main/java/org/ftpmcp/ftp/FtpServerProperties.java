package org.ftpmcp.ftp;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * FTP MCP Server 的业务配置（{@code app.ftp.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>{@link #host}/{@link #port}/{@link #username}/{@link #password} 是默认连接参数；
 *   工具调用可通过 connectionToken 覆盖（见 {@link #allowConnectionToken}）。</li>
 *   <li>{@link #readMaxBytes} 限制单次下载的大小，避免把超大文件整体读入内存。</li>
 *   <li>{@link #textMinConfidence} 是“文本/二进制”判定的编码置信度阈值。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.ftp")
public class FtpServerProperties {

    /**
     * 默认 FTP 主机名；为空时必须由 connectionToken 提供。
     */
    private String host;

    @Min(1)
    @Max(65_535)
    private int port = 21;

    /**
     * 用户名；为空时使用 anonymous 登录。
     */
    private String username;

    private String password;

    /**
     * 是否使用显式 FTPS（AUTH TLS）。
     */
    private boolean ssl = false;

    /**
     * 是否使用被动模式数据连接。
     */
    private boolean passive = true;

    /**
     * 是否忽略服务端证书校验（仅 FTPS 有效，不安全，仅用于自签名证书的测试环境）。
     */
    private boolean ignoreCertErrors = false;

    /**
     * 连接、控制通道与数据通道的超时时间。
     */
    @NotNull
    private Duration timeout = Duration.ofSeconds(30);

    /**
     * 工具未传 path 时使用的默认远程目录。
     */
    @NotBlank
    private String defaultPath = "/";

    /**
     * 控制通道编码（也用于读取 LIST 响应文本）。
     */
    @NotBlank
    private String controlEncoding = "UTF-8";

    /**
     * {@code ftp_read_file} 允许下载的最大字节数（超过则报错）。
     */
    @NotNull
    private DataSize readMaxBytes = DataSize.ofMegabytes(16);

    /**
     * 文本判定的编码置信度阈值 [0,1]。
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double textMinConfidence = 0.80;

    /**
     * 是否允许工具调用方通过 connectionToken 覆盖默认连接参数。
     */
    private boolean allowConnectionToken = true;

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public boolean isSsl() {
        return ssl;
    }

    public void setSsl(boolean ssl) {
        this.ssl = ssl;
    }

    public boolean isPassive() {
        return passive;
    }

    public void setPassive(boolean passive) {
        this.passive = passive;
    }

    public boolean isIgnoreCertErrors() {
        return ignoreCertErrors;
    }

    public void setIgnoreCertErrors(boolean ignoreCertErrors) {
        this.ignoreCertErrors = ignoreCertErrors;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public String getDefaultPath() {
        return defaultPath;
    }

    public void setDefaultPath(String defaultPath) {
        this.defaultPath = defaultPath;
    }

    public String getControlEncoding() {
        return controlEncoding;
    }

    public void setControlEncoding(String controlEncoding) {
        this.controlEncoding = controlEncoding;
    }

    public DataSize getReadMaxBytes() {
        return readMaxBytes;
    }

    public void setReadMaxBytes(DataSize readMaxBytes) {
        this.readMaxBytes = readMaxBytes;
    }

    public double getTextMinConfidence() {
        return textMinConfidence;
    }

    public void setTextMinConfidence(double textMinConfidence) {
        this.textMinConfidence = textMinConfidence;
    }

    public boolean isAllowConnectionToken() {
        return allowConnectionToken;
    }

    public void setAllowConnectionToken(boolean allowConnectionToken) {
        this.allowConnectionToken = allowConnectionToken;
    }
}
