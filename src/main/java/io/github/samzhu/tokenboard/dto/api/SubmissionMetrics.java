package io.github.samzhu.tokenboard.dto.api;

import java.math.BigDecimal;
import java.util.List;

import io.github.samzhu.tokenboard.dto.contribution.DateRange;

/**
 * 合併後的用戶累計指標。
 */
public record SubmissionMetrics(
    long totalTokens,
    BigDecimal totalCost,
    DateRange dateRange,
    int activeDays,
    List<String> sources
) {
}
