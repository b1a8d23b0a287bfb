package io.github.samzhu.tokenboard.dto.contribution;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import io.github.samzhu.tokenboard.dto.TokenBreakdown;
import io.github.samzhu.tokenboard.util.DateUtils;

/**
 * 單日貢獻。
 *
 * <p>{@code totals.tokens} 等於所有 sources 的 token 總和，
 * {@code totals.cost} 等於所有 sources 的成本總和。
 *
 * @param date UTC 日期 {@code YYYY-MM-DD}
 * @param totals 當日總計
 * @param intensity 熱度等級 0-4（相對於單日最高成本）
 * @param tokenBreakdown 當日 token 細分
 * @param sources 依 (source, modelId) 分組的明細
 */
public record DailyContribution(
    @NotNull @Pattern(regexp = DateUtils.DATE_PATTERN) String date,
    @NotNull @Valid DailyTotals totals,
    @Min(0) @Max(4) int intensity,
    @NotNull @Valid TokenBreakdown tokenBreakdown,
    @NotNull List<@NotNull @Valid SourceContribution> sources
) {
}
