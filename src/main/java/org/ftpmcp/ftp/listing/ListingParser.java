package org.ftpmcp.ftp.listing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 整段目录列表（LIST 响应文本）解析器。
 * <p>
 * 规则：
 * <ul>
 *   <li>兼容 {@code \r\n}、{@code \r}、{@code \n} 三种换行。</li>
 *   <li>结尾换行产生的最后一个空行会被丢弃（只丢一个）；其余每一行（包括空行、{@code total 48} 之类的汇总行）都对应一条结果。</li>
 *   <li>输出顺序与输入行顺序一致；格式异常的行以“未解析条目”形式返回，不抛异常。</li>
 * </ul>
 */
public class ListingParser {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    private final ListingLineParser lineParser;

    public ListingParser() {
        this(new ListingLineParser());
    }

    public ListingParser(ListingLineParser lineParser) {
        this.lineParser = Objects.requireNonNull(lineParser, "lineParser");
    }

    public List<DirectoryEntry> parse(String rawListingText) {
        Objects.requireNonNull(rawListingText, "rawListingText");
        if (rawListingText.isEmpty()) {
            return List.of();
        }
        String[] lines = LINE_BREAK.split(rawListingText, -1);
        int count = lines.length;
        if (lines[count - 1].isEmpty()) {
            count--;
        }
        List<DirectoryEntry> entries = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            entries.add(lineParser.parse(lines[i]));
        }
        return entries;
    }
}
