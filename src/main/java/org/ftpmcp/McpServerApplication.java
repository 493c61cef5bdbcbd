package org.ftpmcp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * FTP MCP Server 启动入口。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class McpServerApplication {

    private static final String LOG_PATH = "LOG_PATH";
    private static final String DEFAULT_LOG_DIR = "logs";

    public static void main(String[] args) {
        prepareLogDirectory(resolveLogDirectory());
        SpringApplication.run(McpServerApplication.class, args);
    }

    /**
     * 滚动日志文件所在目录：-DLOG_PATH 优先，其次环境变量，最后是工作目录下的 logs。
     */
    static Path resolveLogDirectory() {
        String configured = System.getProperty(LOG_PATH);
        if (configured == null || configured.isBlank()) {
            configured = System.getenv(LOG_PATH);
        }
        return Path.of(configured == null || configured.isBlank() ? DEFAULT_LOG_DIR : configured);
    }

    // 此时 Logback 尚未初始化；创建失败时写 stderr 并继续启动，只剩控制台日志
    private static void prepareLogDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            System.err.println("无法创建日志目录 " + directory.toAbsolutePath() + "，文件日志将不可用：" + e.getMessage());
        }
    }
}
