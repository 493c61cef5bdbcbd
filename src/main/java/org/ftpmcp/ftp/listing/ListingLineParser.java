package org.ftpmcp.ftp.listing;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 单行目录列表解析器：按固定优先级依次尝试各方言，第一个成功的结果生效。
 * <p>
 * 默认顺序为 Unix -> DOS；全部失败时返回 {@link DirectoryEntry#unparsed(String)}，因此本类对任何输入行都有结果，
 * 不会丢弃或拒绝某一行。
 */
public class ListingLineParser {

    private final List<ListingDialect> dialects;

    public ListingLineParser() {
        this(List.of(new UnixListingDialect(), new DosListingDialect()));
    }

    public ListingLineParser(List<ListingDialect> dialects) {
        this.dialects = List.copyOf(Objects.requireNonNull(dialects, "dialects"));
    }

    public DirectoryEntry parse(String line) {
        Objects.requireNonNull(line, "line");
        for (ListingDialect dialect : dialects) {
            Optional<DirectoryEntry> entry = dialect.parse(line);
            if (entry.isPresent()) {
                return entry.get();
            }
        }
        return DirectoryEntry.unparsed(line);
    }
}
