package io.github.samzhu.tokenboard.dto;

import java.math.BigDecimal;

/**
 * 單一模型的每 token 定價。
 *
 * <p>欄位名稱沿用公開定價表的格式，cache 單價可為 null（視為 0）。
 *
 * @param modelId 定價表中的模型 key
 * @param inputCostPerToken 輸入單價 (USD/token)
 * @param outputCostPerToken 輸出單價 (USD/token)
 * @param cacheReadInputTokenCost 快取讀取單價 (USD/token)
 * @param cacheCreationInputTokenCost 快取寫入單價 (USD/token)
 */
public record PricingEntry(
    String modelId,
    BigDecimal inputCostPerToken,
    BigDecimal outputCostPerToken,
    BigDecimal cacheReadInputTokenCost,
    BigDecimal cacheCreationInputTokenCost
) {
}
