package io.github.samzhu.tokenboard.dto.api;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import io.github.samzhu.tokenboard.dto.TokenBreakdown;
import io.github.samzhu.tokenboard.dto.contribution.DateRange;

/**
 * 用戶個人統計回應。
 */
public record UserProfileResponse(
    String username,
    String displayName,
    String avatarUrl,
    long totalTokens,
    BigDecimal totalCost,
    TokenBreakdown tokens,
    int activeDays,
    DateRange dateRange,
    List<String> sources,
    List<String> models,
    int submitCount,
    Instant lastSubmittedAt
) {
}
