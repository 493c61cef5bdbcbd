package org.ftpmcp.ftp.listing;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * DOS/Windows（IIS FTP）风格的目录列表行：
 * <pre>
 * 01-10-23  02:14PM       &lt;DIR&gt;          folder
 * 01-10-23  02:14PM                 1234 file.txt
 * </pre>
 * <p>
 * 与 Unix 方言不同，这里日期是识别方言的关键：日期/时间无法解析时直接判定为不匹配。
 */
public final class DosListingDialect implements ListingDialect {

    private static final String DIRECTORY_MARKER = "<DIR>";

    @Override
    public Optional<DirectoryEntry> parse(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        List<String> parts = ListingTokens.split(line, 4);
        if (parts.size() < 4) {
            return Optional.empty();
        }

        LocalDateTime modifiedAt = ListingDates.parseDos(parts.get(0), parts.get(1));
        if (modifiedAt == null) {
            return Optional.empty();
        }

        String dirOrSize = parts.get(2);
        boolean directory = DIRECTORY_MARKER.equalsIgnoreCase(dirOrSize);
        Long size = directory ? null : ListingTokens.parseSize(dirOrSize);

        // 名称从原始行第 4 个 token 的位置截取，保留名称内部的连续空格
        int nameStart = ListingTokens.indexAfterTokens(line, 3);
        String name = nameStart >= 0 ? ListingTokens.stripTrailing(line.substring(nameStart)) : parts.get(3).trim();
        if (name.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new DirectoryEntry(name, directory, size, modifiedAt, null, line));
    }
}
