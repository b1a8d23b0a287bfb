package io.github.samzhu.tokenboard.dto.api;

import java.util.List;

import jakarta.validation.constraints.NotNull;

import io.github.samzhu.tokenboard.dto.PricingEntry;
import io.github.samzhu.tokenboard.dto.UsageEvent;

/**
 * 貢獻圖聚合請求。
 *
 * @param events 正規化後的用量事件
 * @param pricing 每 token 定價；省略時使用伺服器預設定價表
 */
public record GraphRequest(
    @NotNull List<@NotNull UsageEvent> events,
    List<PricingEntry> pricing
) {
}
