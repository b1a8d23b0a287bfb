package io.github.samzhu.tokenboard.dto.contribution;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * 貢獻圖資料。
 *
 * <p>同時是聚合輸出（{@code POST /api/v1/graph}）與提交內容（{@code POST /api/v1/submit}）的格式：
 * <pre>
 * {
 *   "meta": {"generatedAt", "version", "dateRange": {"start", "end"}},
 *   "summary": {...},
 *   "years": [...],
 *   "contributions": [{"date", "totals", "intensity", "tokenBreakdown", "sources": [...]}]
 * }
 * </pre>
 *
 * @param meta 匯出資訊
 * @param summary 整體摘要
 * @param years 年度摘要，依年份排序
 * @param contributions 每日貢獻，依日期排序
 */
public record TokenContributionData(
    @NotNull @Valid ExportMeta meta,
    @NotNull @Valid DataSummary summary,
    @NotNull List<@NotNull @Valid YearSummary> years,
    @NotNull List<@NotNull @Valid DailyContribution> contributions
) {
}
