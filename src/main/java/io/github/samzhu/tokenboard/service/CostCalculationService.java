package io.github.samzhu.tokenboard.service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.tokenboard.config.TokenboardProperties;
import io.github.samzhu.tokenboard.config.TokenboardProperties.ModelPricing;
import io.github.samzhu.tokenboard.dto.PricingEntry;
import io.github.samzhu.tokenboard.dto.PricingTable;
import io.github.samzhu.tokenboard.dto.TokenBreakdown;
import io.github.samzhu.tokenboard.dto.UsageEvent;

/**
 * LLM 用量成本計算服務。
 *
 * <p>計算公式（單價為每 token 美元）：
 * <pre>
 * 成本 = input × 輸入單價
 *      + output × 輸出單價
 *      + cacheRead × 快取讀取單價
 *      + cacheWrite × 快取寫入單價
 *      + reasoning × 輸出單價
 * </pre>
 *
 * <p>缺少的快取單價視為 0。找不到定價時回退為事件自行回報的成本，沒有回報則為 0。
 *
 * <p>預設定價表來自 {@code tokenboard.pricing}（每百萬 tokens 單價），啟動時轉換為每 token 單價。
 *
 * @see ModelPricingResolver
 */
@Service
public class CostCalculationService {

    private static final Logger log = LoggerFactory.getLogger(CostCalculationService.class);

    private final ModelPricingResolver pricingResolver;
    private final PricingTable defaultPricingTable;

    public CostCalculationService(ModelPricingResolver pricingResolver, TokenboardProperties properties) {
        this.pricingResolver = pricingResolver;
        this.defaultPricingTable = toPricingTable(properties.pricing());
        log.info("CostCalculationService initialized with {} model pricing configurations",
            defaultPricingTable.size());
    }

    /**
     * 由設定檔建立的預設定價表。
     */
    public PricingTable defaultPricingTable() {
        return defaultPricingTable;
    }

    /**
     * 計算單筆事件的成本。
     *
     * @param event 用量事件
     * @param table 定價表
     * @return 成本（美元）
     */
    public BigDecimal calculateCost(UsageEvent event, PricingTable table) {
        Optional<PricingEntry> pricing = pricingResolver.resolve(event.modelId(), table);
        if (pricing.isPresent()) {
            return calculateCost(event.tokens(), pricing.get());
        }

        BigDecimal reported = event.cost() != null && event.cost().signum() > 0 ? event.cost() : BigDecimal.ZERO;
        log.debug("No pricing for model '{}', using reported cost {}", event.modelId(), reported);
        return reported;
    }

    /**
     * 以指定定價計算 token 成本。
     *
     * @param tokens token 細分
     * @param pricing 定價
     * @return 成本（美元），不做捨入
     */
    public BigDecimal calculateCost(TokenBreakdown tokens, PricingEntry pricing) {
        BigDecimal inputCost = tokenCost(tokens.input(), pricing.inputCostPerToken());
        BigDecimal outputCost = tokenCost(tokens.output(), pricing.outputCostPerToken());
        BigDecimal cacheReadCost = tokenCost(tokens.cacheRead(), pricing.cacheReadInputTokenCost());
        BigDecimal cacheWriteCost = tokenCost(tokens.cacheWrite(), pricing.cacheCreationInputTokenCost());

        // reasoning tokens 以輸出單價計費
        BigDecimal reasoningCost = tokenCost(tokens.reasoning(), pricing.outputCostPerToken());

        return inputCost.add(outputCost).add(cacheReadCost).add(cacheWriteCost).add(reasoningCost);
    }

    private BigDecimal tokenCost(long tokens, BigDecimal pricePerToken) {
        if (tokens <= 0 || pricePerToken == null) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(tokens).multiply(pricePerToken);
    }

    static PricingTable toPricingTable(Map<String, ModelPricing> pricing) {
        if (pricing == null || pricing.isEmpty()) {
            return PricingTable.empty();
        }
        Map<String, PricingEntry> entries = new LinkedHashMap<>();
        pricing.forEach((model, p) -> entries.put(model, new PricingEntry(
            model,
            perToken(p.inputPerMillion()),
            perToken(p.outputPerMillion()),
            perToken(p.cacheReadPerMillion()),
            perToken(p.cacheWritePerMillion())
        )));
        return PricingTable.of(entries);
    }

    private static BigDecimal perToken(BigDecimal perMillion) {
        return perMillion != null ? perMillion.movePointLeft(6) : null;
    }
}
