package org.ftpmcp.ftp.listing;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Unix {@code ls -l} 风格的目录列表行：
 * <pre>
 * drwxr-xr-x  2 owner group     4096 Jan 10 10:00 folder
 * -rw-r--r--  1 owner group     1234 Jan 20  2023 my file.txt
 * </pre>
 * <p>
 * 字段识别是“宽松”的：链接数、组名可能缺失；日期/大小解析失败只会让对应字段为空，不会导致整行失败。
 * 只有权限前缀无法识别或名称为空时才判定为不匹配。
 */
public final class UnixListingDialect implements ListingDialect {

    private static final int PREFIX_LENGTH = 10;
    private static final int MIN_TOKENS = 7;
    private static final String PERMISSION_CHARS = "rwxsStTlL-";
    // ACL / 扩展属性标记，例如 drwxr-xr-x+ 或 -rw-r--r--@
    private static final String ATTRIBUTE_MARKERS = "+@.";

    private final Clock clock;

    public UnixListingDialect() {
        this(Clock.systemDefaultZone());
    }

    /**
     * @param clock 用于补全“不带年份”的日期（{@code Jan 10 10:00}）
     */
    public UnixListingDialect(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<DirectoryEntry> parse(String line) {
        if (line == null || line.length() < PREFIX_LENGTH) {
            return Optional.empty();
        }
        char type = line.charAt(0);
        if (type != 'd' && type != '-') {
            return Optional.empty();
        }
        for (int i = 1; i < PREFIX_LENGTH; i++) {
            if (PERMISSION_CHARS.indexOf(line.charAt(i)) < 0) {
                return Optional.empty();
            }
        }
        String permissions = line.substring(0, PREFIX_LENGTH);

        int offset = PREFIX_LENGTH;
        if (line.length() > PREFIX_LENGTH
                && ATTRIBUTE_MARKERS.indexOf(line.charAt(PREFIX_LENGTH)) >= 0
                && (line.length() == PREFIX_LENGTH + 1 || Character.isWhitespace(line.charAt(PREFIX_LENGTH + 1)))) {
            offset++;
        }

        String remainder = line.substring(offset).trim();
        List<String> tokens = ListingTokens.tokens(remainder);
        if (tokens.size() < MIN_TOKENS) {
            return Optional.empty();
        }

        // 链接数（可选）-> owner -> group -> size -> month day time/year -> name
        int idx = 0;
        if (ListingTokens.isInteger(tokens.get(idx))) {
            idx++;
        }
        idx += 2;

        Long size = ListingTokens.parseSize(tokens.get(idx));
        if (size != null) {
            idx++;
        } else if (ListingDates.isMonthName(tokens.get(idx))) {
            // 没有 group 列：group 位置上的整数其实是 size
            size = ListingTokens.parseSize(tokens.get(idx - 1));
        }

        LocalDateTime modifiedAt = null;
        if (idx + 2 < tokens.size()) {
            modifiedAt = ListingDates.parseUnix(
                    tokens.get(idx),
                    tokens.get(idx + 1),
                    tokens.get(idx + 2),
                    LocalDateTime.now(clock)
            );
            idx += 3;
        }

        String name = idx < tokens.size() ? String.join(" ", tokens.subList(idx, tokens.size())).trim() : "";
        if (name.isEmpty()) {
            name = tokens.get(tokens.size() - 1);
        }
        if (name.isBlank()) {
            return Optional.empty();
        }

        return Optional.of(new DirectoryEntry(name, type == 'd', size, modifiedAt, permissions, line));
    }
}
