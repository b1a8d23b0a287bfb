package io.github.samzhu.tokenboard.util;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 日期工具類。
 *
 * <p>所有日期計算均使用 UTC 時區，日期字串格式為 {@code YYYY-MM-DD}。
 */
public final class DateUtils {

    /** {@code YYYY-MM-DD} 格式 */
    public static final String DATE_PATTERN = "^\\d{4}-\\d{2}-\\d{2}$";

    private static final Pattern DATE = Pattern.compile(DATE_PATTERN);

    private DateUtils() {
        // 工具類不允許實例化
    }

    /**
     * 將 epoch 毫秒轉為 UTC 日期字串。
     *
     * @param timestampMs epoch 毫秒
     * @return {@code YYYY-MM-DD}
     */
    public static String toUtcDate(long timestampMs) {
        return Instant.ofEpochMilli(timestampMs).atZone(ZoneOffset.UTC).toLocalDate().toString();
    }

    /**
     * 取得 clock 所在的 UTC 日期。
     */
    public static LocalDate today(Clock clock) {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    /**
     * 解析 {@code YYYY-MM-DD} 字串，格式不符或日期不存在時回傳 empty。
     *
     * @param value 日期字串，可能為 null
     * @return 解析後的日期
     */
    public static Optional<LocalDate> parse(String value) {
        if (value == null || !DATE.matcher(value).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * 判斷字串符合 {@code YYYY-MM-DD} 格式但不是存在的日期，例如 {@code 2025-02-30}。
     *
     * @param value 日期字串，可能為 null
     * @return 格式正確但日期不存在時為 true
     */
    public static boolean isInvalidCalendarDate(String value) {
        return value != null && DATE.matcher(value).matches() && parse(value).isEmpty();
    }

    /**
     * 產生日期區間內的所有日期（含首尾）。
     *
     * @param startDate 起始日期
     * @param endDate 結束日期
     * @return 日期列表，起始晚於結束時為空列表
     */
    public static List<LocalDate> datesBetween(LocalDate startDate, LocalDate endDate) {
        List<LocalDate> dates = new ArrayList<>();
        LocalDate current = startDate;
        while (!current.isAfter(endDate)) {
            dates.add(current);
            current = current.plusDays(1);
        }
        return dates;
    }
}
