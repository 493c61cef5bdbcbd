package org.ftpmcp.ftp.listing;

import java.util.ArrayList;
import java.util.List;

/**
 * 目录列表行的空白分词工具。
 * <p>
 * 这里不使用正则 split：需要同时得到“前 N 个 token + 剩余部分”以及 token 在原始行中的字符偏移，
 * 手写扫描更直接，也避免对超长行做多次正则匹配。
 */
final class ListingTokens {

    private ListingTokens() {
    }

    /**
     * 按空白切分，最多返回 {@code maxParts} 段；最后一段为剩余内容（去掉前导空白，保留内部空白）。
     */
    static List<String> split(String input, int maxParts) {
        List<String> parts = new ArrayList<>(Math.min(maxParts, 16));
        int length = input.length();
        int i = 0;
        while (i < length && parts.size() < maxParts - 1) {
            while (i < length && Character.isWhitespace(input.charAt(i))) {
                i++;
            }
            if (i >= length) {
                break;
            }
            int start = i;
            while (i < length && !Character.isWhitespace(input.charAt(i))) {
                i++;
            }
            parts.add(input.substring(start, i));
        }

        int start = i;
        while (start < length && Character.isWhitespace(input.charAt(start))) {
            start++;
        }
        if (start < length) {
            parts.add(input.substring(start));
        }
        return parts;
    }

    /**
     * 按空白切分出全部 token（不限数量）。
     */
    static List<String> tokens(String input) {
        return split(input, Integer.MAX_VALUE);
    }

    /**
     * 跳过前 {@code tokensToSkip} 个 token 后，下一个 token 在原始串中的起始下标；不存在时返回 -1。
     */
    static int indexAfterTokens(String input, int tokensToSkip) {
        int length = input.length();
        int i = 0;
        int seen = 0;
        while (i < length) {
            while (i < length && Character.isWhitespace(input.charAt(i))) {
                i++;
            }
            if (i >= length) {
                return -1;
            }
            if (seen == tokensToSkip) {
                return i;
            }
            while (i < length && !Character.isWhitespace(input.charAt(i))) {
                i++;
            }
            seen++;
        }
        return -1;
    }

    /**
     * 解析非负整数；格式不合法、为负数或溢出时返回 null。
     */
    static Long parseSize(String token) {
        if (token == null || token.isEmpty()) {
            return null;
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
        }
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static boolean isInteger(String token) {
        return parseSize(token) != null;
    }

    /**
     * 去掉尾部空白（保留前导与内部空白）。
     */
    static String stripTrailing(String value) {
        int end = value.length();
        while (end > 0 && Character.isWhitespace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }
}
