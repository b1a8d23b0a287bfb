package io.github.samzhu.tokenboard.dto.contribution;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import io.github.samzhu.tokenboard.util.DateUtils;

/**
 * 日期區間（含首尾），格式 {@code YYYY-MM-DD}。
 */
public record DateRange(
    @NotNull @Pattern(regexp = DateUtils.DATE_PATTERN) String start,
    @NotNull @Pattern(regexp = DateUtils.DATE_PATTERN) String end
) {
    /**
     * 沒有任何資料時使用的空區間。
     */
    public static DateRange empty() {
        return new DateRange("", "");
    }
}
