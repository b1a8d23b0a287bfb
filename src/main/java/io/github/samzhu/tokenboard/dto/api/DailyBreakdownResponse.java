package io.github.samzhu.tokenboard.dto.api;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import io.github.samzhu.tokenboard.dto.TokenBreakdown;

/**
 * 單日明細回應。
 *
 * @param date 日期
 * @param totalTokens 當日總 tokens
 * @param cost 當日成本
 * @param messages 當日訊息數
 * @param tokens 當日 token 細分
 * @param sources 依來源的 tokens 與成本
 * @param models 依模型的 tokens 與成本
 */
public record DailyBreakdownResponse(
    LocalDate date,
    long totalTokens,
    BigDecimal cost,
    long messages,
    TokenBreakdown tokens,
    Map<String, UsageAmount> sources,
    Map<String, UsageAmount> models
) {
    /**
     * tokens 與成本。
     */
    public record UsageAmount(long tokens, BigDecimal cost) {}
}
