package org.ftpmcp.ftp;

import org.ftpmcp.ftp.content.CharsetRegistry;
import org.ftpmcp.ftp.content.ContentClassifier;
import org.ftpmcp.ftp.content.EncodingDetector;
import org.ftpmcp.ftp.content.IcuEncodingDetector;
import org.ftpmcp.ftp.listing.ListingParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * FTP MCP 服务的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>编码注册表在这里显式初始化一次（{@link CharsetRegistry#initialize()} 可重复调用）。</li>
 *   <li>所有组件都是无状态的单例，可被并发的工具调用共享；FTP 会话按调用创建。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class FtpServerConfiguration {

    @Bean
    public CharsetRegistry charsetRegistry() {
        return CharsetRegistry.initialize();
    }

    @Bean
    public EncodingDetector encodingDetector(CharsetRegistry charsetRegistry) {
        return new IcuEncodingDetector(charsetRegistry);
    }

    @Bean
    public ContentClassifier contentClassifier(EncodingDetector encodingDetector,
                                               CharsetRegistry charsetRegistry,
                                               FtpServerProperties properties) {
        return new ContentClassifier(encodingDetector, charsetRegistry, properties.getTextMinConfidence());
    }

    @Bean
    public ListingParser listingParser() {
        return new ListingParser();
    }

    @Bean
    public ConnectionTokenDecoder connectionTokenDecoder() {
        return new ConnectionTokenDecoder();
    }

    @Bean
    public FtpSessionFactory ftpSessionFactory() {
        return new FtpSessionFactory();
    }

    @Bean
    public RemoteFileService remoteFileService(FtpSessionFactory ftpSessionFactory, ListingParser listingParser) {
        return new RemoteFileService(ftpSessionFactory, listingParser);
    }
}
