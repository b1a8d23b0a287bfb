package io.github.samzhu.tokenboard.dto.contribution;

import java.math.BigDecimal;
import java.util.List;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 整體摘要。
 *
 * @param totalTokens 總 tokens
 * @param totalCost 總成本 (USD)
 * @param totalDays 有紀錄的天數
 * @param activeDays tokens &gt; 0 的天數
 * @param averagePerDay 每個活躍日的平均成本
 * @param maxCostInSingleDay 單日最高成本
 * @param sources 出現過的來源（排序、去重）
 * @param models 出現過的模型（排序、去重）
 */
public record DataSummary(
    @PositiveOrZero long totalTokens,
    @NotNull @PositiveOrZero BigDecimal totalCost,
    @PositiveOrZero int totalDays,
    @PositiveOrZero int activeDays,
    @NotNull @PositiveOrZero BigDecimal averagePerDay,
    @NotNull @PositiveOrZero BigDecimal maxCostInSingleDay,
    @NotNull List<@NotNull @Pattern(regexp = SourceContribution.SOURCE_PATTERN) String> sources,
    @NotNull List<@NotNull String> models
) {
}
