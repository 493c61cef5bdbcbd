package org.ftpmcp.ftp.listing;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 目录列表中日期/时间字段的解析。
 * <p>
 * 统一使用英文月份名、大小写不敏感、严格日历校验（例如 {@code Feb 30} 视为无效）。
 * 所有方法在无法解析时返回 null，由调用方决定是“字段缺失”还是“方言不匹配”。
 */
final class ListingDates {

    private static final DateTimeFormatter UNIX_MONTH_DAY = formatter("MMM d");
    private static final DateTimeFormatter UNIX_TIME = formatter("H:mm");
    private static final DateTimeFormatter UNIX_YEAR_DATE = formatter("MMM d uuuu");

    private static final List<DateTimeFormatter> DOS_DATES = List.of(
            formatter("MM-dd-uu"),
            formatter("MM-dd-uuuu"),
            formatter("MM/dd/uu"),
            formatter("MM/dd/uuuu"),
            formatter("uuuu-MM-dd")
    );

    private static final List<DateTimeFormatter> DOS_TIMES = List.of(
            formatter("hh:mma"),
            formatter("h:mma"),
            formatter("HH:mm"),
            formatter("H:mm"),
            formatter("HH:mm:ss")
    );

    private static final Set<String> MONTHS = Set.of(
            "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec"
    );

    private ListingDates() {
    }

    /**
     * 解析 Unix {@code ls -l} 风格的日期：{@code MMM d HH:mm}（当年）或 {@code MMM d yyyy}（零点）。
     * <p>
     * 不带年份的日期如果比 {@code now} 晚超过一天，则认为是上一年（与 {@code ls -l} 的显示规则一致）。
     */
    static LocalDateTime parseUnix(String month, String day, String timeOrYear, LocalDateTime now) {
        String monthDay = month + " " + day;
        try {
            if (timeOrYear.indexOf(':') >= 0) {
                MonthDay md = MonthDay.parse(monthDay, UNIX_MONTH_DAY);
                LocalTime time = LocalTime.parse(timeOrYear, UNIX_TIME);
                LocalDateTime candidate = md.atYear(now.getYear()).atTime(time);
                if (candidate.isAfter(now.plusDays(1))) {
                    candidate = md.atYear(now.getYear() - 1).atTime(time);
                }
                return candidate;
            }
            return LocalDate.parse(monthDay + " " + timeOrYear, UNIX_YEAR_DATE).atStartOfDay();
        } catch (DateTimeException e) {
            return null;
        }
    }

    /**
     * 解析 DOS/IIS 风格的 {@code 01-10-23  02:14PM}。
     */
    static LocalDateTime parseDos(String date, String time) {
        LocalDate parsedDate = null;
        for (int i = 0; i < DOS_DATES.size() && parsedDate == null; i++) {
            parsedDate = tryParseDate(date, DOS_DATES.get(i));
        }
        if (parsedDate == null) {
            return null;
        }
        for (DateTimeFormatter f : DOS_TIMES) {
            LocalTime parsedTime = tryParseTime(time, f);
            if (parsedTime != null) {
                return parsedDate.atTime(parsedTime);
            }
        }
        return null;
    }

    static boolean isMonthName(String token) {
        return token != null && MONTHS.contains(token.toLowerCase(Locale.ROOT));
    }

    private static LocalDate tryParseDate(String text, DateTimeFormatter formatter) {
        try {
            return LocalDate.parse(text, formatter);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static LocalTime tryParseTime(String text, DateTimeFormatter formatter) {
        try {
            return LocalTime.parse(text, formatter);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
