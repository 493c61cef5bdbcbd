package org.ftpmcp.ftp;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * 远程路径工具。
 * <p>
 * 注意：{@link #normalize} 只做格式规范化（斜杠方向、根前缀、默认值），不处理 {@code ..} 之类的路径穿越。
 * 远程服务器本身负责访问控制，这里按“可信操作者”模型把路径原样传给服务器。
 */
public final class RemotePaths {

    public static final String ROOT = "/";

    private RemotePaths() {
    }

    /**
     * 规范化用户传入的远程路径。
     * <ol>
     *   <li>{@code rawPath} 为空白时使用 {@code fallbackPath}；两者都为空白时使用 {@code /}</li>
     *   <li>所有反斜杠替换为正斜杠</li>
     *   <li>不以 {@code /} 开头时补上</li>
     * </ol>
     */
    public static String normalize(String rawPath, String fallbackPath) {
        String resolved = isBlank(rawPath) ? fallbackPath : rawPath;
        if (isBlank(resolved)) {
            resolved = ROOT;
        }
        resolved = resolved.replace('\\', '/');
        if (!resolved.startsWith(ROOT)) {
            resolved = ROOT + resolved;
        }
        return resolved;
    }

    /**
     * 路径所在目录：{@code /a/b.txt -> /a}，{@code /b.txt -> /}。
     */
    public static String parentDirectory(String path) {
        if (isBlank(path)) {
            return ROOT;
        }
        String trimmed = path;
        while (trimmed.length() > 1 && trimmed.endsWith(ROOT)) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int lastSlash = trimmed.lastIndexOf('/');
        return lastSlash > 0 ? trimmed.substring(0, lastSlash) : ROOT;
    }

    /**
     * 拼接目录与名称，避免出现重复的斜杠。
     */
    public static String combine(String directory, String name) {
        String dir = isBlank(directory) ? ROOT : directory;
        String child = name == null ? "" : name;
        while (child.startsWith(ROOT)) {
            child = child.substring(1);
        }
        return dir.endsWith(ROOT) ? dir + child : dir + ROOT + child;
    }

    /**
     * 用于结果展示的 {@code ftp://host:port/path} 形式（每一级路径单独做百分号编码）。
     */
    public static String toUri(String host, int port, String path) {
        String normalized = normalize(path, ROOT);
        StringBuilder sb = new StringBuilder("ftp://").append(host).append(':').append(port);
        String[] segments = normalized.split("/", -1);
        for (int i = 1; i < segments.length; i++) {
            sb.append('/');
            if (!segments[i].isEmpty()) {
                sb.append(URLEncoder.encode(segments[i], StandardCharsets.UTF_8).replace("+", "%20"));
            }
        }
        return sb.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
