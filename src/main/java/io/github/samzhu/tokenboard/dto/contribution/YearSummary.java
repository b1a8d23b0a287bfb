package io.github.samzhu.tokenboard.dto.contribution;

import java.math.BigDecimal;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 年度摘要。
 *
 * @param year 四位數年份
 * @param totalTokens 該年總 tokens
 * @param totalCost 該年總成本
 * @param range 該年出現的最早與最晚日期
 */
public record YearSummary(
    @NotNull @Pattern(regexp = "^\\d{4}$") String year,
    @PositiveOrZero long totalTokens,
    @NotNull @PositiveOrZero BigDecimal totalCost,
    @NotNull @Valid DateRange range
) {
}
