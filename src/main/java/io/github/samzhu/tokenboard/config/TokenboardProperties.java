package io.github.samzhu.tokenboard.config;

import java.math.BigDecimal;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tokenboard 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link ModelPricing} - 預設定價表，用於事件聚合時的成本計算</li>
 *   <li>{@link SubmissionConfig} - 合併交易的重試設定</li>
 *   <li>{@link GraphConfig} - 貢獻圖輸出的版本資訊</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * tokenboard:
 *   submission:
 *     max-attempts: 3
 *     retry-backoff-ms: 50
 *   graph:
 *     version: 1.0.0
 *   pricing:
 *     claude-sonnet-4-20250514:
 *       input-per-million: 3.00
 *       output-per-million: 15.00
 *       cache-read-per-million: 0.30
 *       cache-write-per-million: 3.75
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "tokenboard")
public record TokenboardProperties(
    Map<String, ModelPricing> pricing,
    SubmissionConfig submission,
    GraphConfig graph
) {
    public TokenboardProperties {
        if (pricing == null) {
            pricing = Map.of();
        }
        if (submission == null) {
            submission = SubmissionConfig.defaults();
        }
        if (graph == null) {
            graph = GraphConfig.defaults();
        }
    }

    /**
     * LLM 模型的 token 定價設定。
     *
     * <p>價格單位為「美元 / 百萬 tokens」，載入時轉換為每 token 單價。
     * Cache 單價可省略，視為 0。
     *
     * @param inputPerMillion 輸入 token 單價 (USD/百萬)
     * @param outputPerMillion 輸出 token 單價 (USD/百萬)，reasoning tokens 同樣以此計價
     * @param cacheReadPerMillion Prompt Cache 讀取單價 (USD/百萬)
     * @param cacheWritePerMillion Prompt Cache 寫入單價 (USD/百萬)
     */
    public record ModelPricing(
        BigDecimal inputPerMillion,
        BigDecimal outputPerMillion,
        BigDecimal cacheReadPerMillion,
        BigDecimal cacheWritePerMillion
    ) {}

    /**
     * 提交合併交易設定。
     *
     * <p>同一用戶的多台裝置同時提交時，後到的交易會遇到 write conflict，
     * 整筆交易依此設定重試。
     *
     * @param maxAttempts 最多執行次數（含第一次），預設 3
     * @param retryBackoffMs 每次重試前等待的毫秒數（線性遞增），預設 50
     */
    public record SubmissionConfig(
        int maxAttempts,
        long retryBackoffMs
    ) {
        public SubmissionConfig {
            if (maxAttempts <= 0) {
                maxAttempts = 3;
            }
            if (retryBackoffMs < 0) {
                retryBackoffMs = 50;
            }
        }

        /**
         * 建立預設重試設定。
         */
        public static SubmissionConfig defaults() {
            return new SubmissionConfig(3, 50);
        }
    }

    /**
     * 貢獻圖輸出設定。
     *
     * @param version 寫入 {@code meta.version} 的版本字串
     */
    public record GraphConfig(
        String version
    ) {
        public GraphConfig {
            if (version == null || version.isBlank()) {
                version = "1.0.0";
            }
        }

        public static GraphConfig defaults() {
            return new GraphConfig("1.0.0");
        }
    }
}
