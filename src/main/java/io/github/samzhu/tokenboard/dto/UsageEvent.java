package io.github.samzhu.tokenboard.dto;

import java.math.BigDecimal;

import io.github.samzhu.tokenboard.util.DateUtils;

/**
 * 正規化後的單筆用量事件（一則 AI 助理訊息）。
 *
 * <p>由各來源的 session 解析器產生，是聚合的輸入單位。
 * 每筆事件計為一則訊息。
 *
 * @param source 來源產品，例如 {@code claude}、{@code codex}
 * @param modelId 原始模型名稱
 * @param providerId 供應商 ID，可能為 null
 * @param timestamp 事件時間（Unix 毫秒）
 * @param tokens token 細分
 * @param cost 來源自行回報的成本，可能為 null；僅在找不到定價時使用
 */
public record UsageEvent(
    String source,
    String modelId,
    String providerId,
    long timestamp,
    TokenBreakdown tokens,
    BigDecimal cost
) {
    public UsageEvent {
        tokens = TokenBreakdown.orZero(tokens);
    }

    /**
     * 事件所屬的 UTC 日期（{@code YYYY-MM-DD}）。
     */
    public String utcDate() {
        return DateUtils.toUtcDate(timestamp);
    }
}
