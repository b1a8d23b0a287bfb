package io.github.samzhu.tokenboard.dto.api;

import java.math.BigDecimal;
import java.util.List;

/**
 * 排行榜項目。
 *
 * @param rank 名次（從 1 開始）
 * @param username 用戶名稱
 * @param displayName 顯示名稱
 * @param totalTokens 總 tokens
 * @param totalCost 總成本
 * @param activeDays 活躍天數
 * @param sources 使用過的來源
 */
public record LeaderboardEntry(
    int rank,
    String username,
    String displayName,
    long totalTokens,
    BigDecimal totalCost,
    int activeDays,
    List<String> sources
) {
}
