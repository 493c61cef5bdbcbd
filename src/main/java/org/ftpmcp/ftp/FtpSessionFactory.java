package org.ftpmcp.ftp;

import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPReply;
import org.apache.commons.net.ftp.FTPSClient;
import org.apache.commons.net.util.TrustManagerUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * 打开/关闭一次 FTP 会话。
 * <p>
 * 会话是一次性的：连接、登录、执行一个操作、登出、断开；不做连接池也不做重试。
 */
public class FtpSessionFactory {

    private static final Logger logger = LoggerFactory.getLogger(FtpSessionFactory.class);

    private static final String ANONYMOUS_USER = "anonymous";
    private static final String ANONYMOUS_PASSWORD = "anonymous@";

    /**
     * 建立连接并完成登录；失败时已打开的连接会被关闭。
     */
    public FTPClient open(FtpConnectionSettings settings) throws IOException {
        FtpConnectionSettings s = settings.requireHost();
        FTPClient client = createClient(s);
        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, s.timeout().toMillis());
        client.setControlEncoding(s.controlEncoding());
        client.setConnectTimeout(timeoutMillis);
        client.setDefaultTimeout(timeoutMillis);
        client.setDataTimeout(s.timeout());
        client.setParserFactory(RawListingEntryParser.FACTORY);

        try {
            logger.debug("连接 FTP 服务器 {}:{}（ssl={}, passive={}）", s.host(), s.port(), s.ssl(), s.passive());
            client.connect(s.host(), s.port());
            if (!FTPReply.isPositiveCompletion(client.getReplyCode())) {
                throw new IOException("FTP 服务器拒绝连接：" + replyOf(client));
            }

            String user = s.anonymous() ? ANONYMOUS_USER : s.username();
            String password = s.password() != null ? s.password() : (s.anonymous() ? ANONYMOUS_PASSWORD : "");
            if (!client.login(user, password)) {
                throw new IOException("FTP 登录失败（用户 " + user + "）：" + replyOf(client));
            }
            logger.debug("已登录 {}:{}，用户 {}", s.host(), s.port(), user);

            if (client instanceof FTPSClient ftps) {
                ftps.execPBSZ(0);
                ftps.execPROT("P");
            }
            if (s.passive()) {
                client.enterLocalPassiveMode();
            } else {
                client.enterLocalActiveMode();
            }
            // 数据连接的地址可能与控制连接不同（NAT、容器端口映射）
            client.setRemoteVerificationEnabled(false);
            if (!client.setFileType(FTP.BINARY_FILE_TYPE)) {
                throw new IOException("无法切换到二进制传输模式：" + replyOf(client));
            }
            return client;
        } catch (IOException e) {
            close(client);
            throw e;
        }
    }

    /**
     * 登出并断开；关闭过程中的异常只记录，不再抛出。
     */
    public void close(FTPClient client) {
        if (client == null || !client.isConnected()) {
            return;
        }
        try {
            client.logout();
        } catch (IOException e) {
            logger.warn("FTP 登出失败", e);
        }
        try {
            client.disconnect();
        } catch (IOException e) {
            logger.warn("断开 FTP 连接失败", e);
        }
    }

    static String replyOf(FTPClient client) {
        String reply = client.getReplyString();
        return reply == null ? "(无响应)" : reply.trim();
    }

    private static FTPClient createClient(FtpConnectionSettings settings) {
        if (!settings.ssl()) {
            return new FTPClient();
        }
        FTPSClient client = new FTPSClient(false);
        if (settings.ignoreCertErrors()) {
            client.setTrustManager(TrustManagerUtils.getAcceptAllTrustManager());
        }
        return client;
    }
}
