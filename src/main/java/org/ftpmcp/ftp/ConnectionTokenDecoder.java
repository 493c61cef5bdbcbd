package org.ftpmcp.ftp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

/**
 * connectionToken 解码器。
 * <p>
 * 支持两种载荷（均需 base64 编码，可带 {@code Bearer } 前缀）：
 * <ul>
 *   <li>JSON 对象：{@code {"server":"ftp.example.com","port":21,"username":"u","password":"p","dir":"/"}}，
 *   字段名大小写不敏感，未知字段忽略。</li>
 *   <li>冒号分隔：{@code server:port:username:password:dir}（端口不是数字时使用 21）。</li>
 * </ul>
 */
public class ConnectionTokenDecoder {

    private static final String BEARER_PREFIX = "bearer ";
    private static final int DEFAULT_PORT = 21;

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .build();

    public ConnectionToken decode(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("connectionToken 不能为空");
        }
        String trimmed = token.trim();
        if (trimmed.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            trimmed = trimmed.substring(BEARER_PREFIX.length()).trim();
        }

        String payload = new String(decodeBase64(trimmed), StandardCharsets.UTF_8).trim();
        if (payload.startsWith("{")) {
            try {
                return objectMapper.readValue(payload, ConnectionToken.class);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("connectionToken 的 JSON 内容不合法", e);
            }
        }

        String[] parts = payload.split(":", 5);
        if (parts.length < 5) {
            throw new IllegalArgumentException("connectionToken 格式不合法（需要 JSON 或 server:port:username:password:dir）");
        }
        return new ConnectionToken(
                parts[0],
                parts[0],
                parsePort(parts[1]),
                parts[2],
                parts[3],
                parts[4],
                null,
                null,
                null,
                null
        );
    }

    private static byte[] decodeBase64(String value) {
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            try {
                return Base64.getUrlDecoder().decode(value);
            } catch (IllegalArgumentException urlSafe) {
                throw new IllegalArgumentException("connectionToken 不是合法的 base64", e);
            }
        }
    }

    private static int parsePort(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return DEFAULT_PORT;
        }
    }
}
