package org.ftpmcp.ftp;

import org.apache.ftpserver.ConnectionConfigFactory;
import org.apache.ftpserver.DataConnectionConfigurationFactory;
import org.apache.ftpserver.FtpServer;
import org.apache.ftpserver.FtpServerFactory;
import org.apache.ftpserver.ftplet.FtpException;
import org.apache.ftpserver.ftplet.UserManager;
import org.apache.ftpserver.listener.Listener;
import org.apache.ftpserver.listener.ListenerFactory;
import org.apache.ftpserver.usermanager.PropertiesUserManagerFactory;
import org.apache.ftpserver.usermanager.impl.BaseUser;
import org.apache.ftpserver.usermanager.impl.WritePermission;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * 测试用的本地 FTP 服务器：随机端口、仅监听 127.0.0.1、单个可写用户。
 */
final class EmbeddedFtpServer implements AutoCloseable {

    static final String HOST = "127.0.0.1";
    static final String USER = "user";
    static final String PASSWORD = "password";

    private final FtpServer server;
    private final Listener listener;

    private EmbeddedFtpServer(FtpServer server, Listener listener) {
        this.server = server;
        this.listener = listener;
    }

    static EmbeddedFtpServer start(Path homeDirectory) throws FtpException {
        UserManager userManager = new PropertiesUserManagerFactory().createUserManager();
        BaseUser user = new BaseUser();
        user.setName(USER);
        user.setPassword(PASSWORD);
        user.setEnabled(true);
        user.setAuthorities(List.of(new WritePermission()));
        user.setHomeDirectory(homeDirectory.toAbsolutePath().toString());
        userManager.save(user);

        DataConnectionConfigurationFactory dataConfig = new DataConnectionConfigurationFactory();
        dataConfig.setActiveEnabled(false);
        dataConfig.setPassiveAddress(HOST);
        dataConfig.setPassiveExternalAddress(HOST);

        ListenerFactory listenerFactory = new ListenerFactory();
        listenerFactory.setServerAddress(HOST);
        listenerFactory.setPort(0);
        listenerFactory.setDataConnectionConfiguration(dataConfig.createDataConnectionConfiguration());
        Listener listener = listenerFactory.createListener();

        ConnectionConfigFactory connectionConfig = new ConnectionConfigFactory();
        connectionConfig.setAnonymousLoginEnabled(false);

        FtpServerFactory factory = new FtpServerFactory();
        factory.setUserManager(userManager);
        factory.addListener("default", listener);
        factory.setConnectionConfig(connectionConfig.createConnectionConfig());

        FtpServer server = factory.createServer();
        server.start();
        return new EmbeddedFtpServer(server, listener);
    }

    int port() {
        return listener.getPort();
    }

    FtpConnectionSettings settings() {
        return settings(PASSWORD);
    }

    FtpConnectionSettings settings(String password) {
        return new FtpConnectionSettings(HOST, port(), USER, password, "/", false, true, false,
                Duration.ofSeconds(10), "UTF-8");
    }

    @Override
    public void close() {
        server.stop();
    }
}
