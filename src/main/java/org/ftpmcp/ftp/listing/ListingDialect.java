package org.ftpmcp.ftp.listing;

import java.util.Optional;

/**
 * 一种目录列表行格式（方言）的解析策略。
 * <p>
 * 实现必须是无状态的纯函数：同一行多次解析得到相同结果；无法识别时返回 {@link Optional#empty()}，不抛异常。
 */
@FunctionalInterface
public interface ListingDialect {

    Optional<DirectoryEntry> parse(String line);
}
