package io.github.samzhu.tokenboard.document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.tokenboard.dto.TokenBreakdown;

/**
 * 用戶日明細文件。
 *
 * <p>記錄單一用戶在特定 UTC 日期的用量，依來源再依裝置分區：
 * <pre>
 * sourceBreakdown
 *   └─ {source}
 *        ├─ totals            = Σ devices[*].totals
 *        ├─ models            = Σ devices[*].models
 *        └─ devices
 *             └─ {deviceId}   該裝置最近一次提交的快照（整筆取代，不累加）
 * totals         = Σ sourceBreakdown[*].totals
 * modelBreakdown = Σ sourceBreakdown[*].models（顯示用）
 * </pre>
 *
 * <p>文件 ID 格式：{@code {date}_{userId}}，例如 {@code 2025-06-01_user-uuid-123}
 *
 * <p>{@code schemaVersion} 小於 {@value #SCHEMA_VERSION} 的文件寫於裝置分區之前；
 * 這類來源第一次被任何裝置更新時，其既有總計會移入 {@value #LEGACY_DEVICE_ID} 分區。
 *
 * @param id 文件 ID
 * @param userId 用戶 ID
 * @param date UTC 日期
 * @param totals 當日總計
 * @param sourceBreakdown 依來源的明細
 * @param modelBreakdown 依模型的明細（跨來源、裝置）
 * @param schemaVersion 文件結構版本
 * @param createdAt 建立時間
 * @param updatedAt 最後更新時間
 */
@Document(collection = "daily_breakdown")
public record DailyBreakdown(
    @Id String id,
    String userId,
    LocalDate date,
    UsageTotals totals,
    Map<String, SourceBreakdown> sourceBreakdown,
    Map<String, UsageTotals> modelBreakdown,
    int schemaVersion,
    Instant createdAt,
    Instant updatedAt
) {
    /** 目前的文件結構版本（裝置分區） */
    public static final int SCHEMA_VERSION = 2;

    /** 裝置分區之前的資料所在的分區 key */
    public static final String LEGACY_DEVICE_ID = "__legacy__";

    /**
     * 產生文件 ID。
     *
     * @param date 日期
     * @param userId 用戶 ID
     * @return 格式為 {@code YYYY-MM-DD_userId} 的 ID
     */
    public static String createId(LocalDate date, String userId) {
        return date.toString() + "_" + userId;
    }

    /**
     * 用量總計：token 細分、成本與訊息數。
     *
     * @param tokens token 細分
     * @param cost 成本 (USD)
     * @param messages 訊息數
     */
    public record UsageTotals(
        TokenBreakdown tokens,
        BigDecimal cost,
        long messages
    ) {
        public static final UsageTotals ZERO = new UsageTotals(TokenBreakdown.ZERO, BigDecimal.ZERO, 0);

        public UsageTotals {
            tokens = TokenBreakdown.orZero(tokens);
            if (cost == null) {
                cost = BigDecimal.ZERO;
            }
        }

        /**
         * 五種 token 的總和。
         */
        public long totalTokens() {
            return tokens.total();
        }

        public UsageTotals plus(UsageTotals other) {
            if (other == null) {
                return this;
            }
            return new UsageTotals(tokens.plus(other.tokens), cost.add(other.cost),
                Math.addExact(messages, other.messages));
        }
    }

    /**
     * 單一來源的明細。
     *
     * @param totals 來源總計
     * @param models 依模型的總計
     * @param devices 依裝置的快照；舊版文件可能為 null
     */
    public record SourceBreakdown(
        UsageTotals totals,
        Map<String, UsageTotals> models,
        Map<String, DevicePartition> devices
    ) {
    }

    /**
     * 單一裝置對某來源某日的快照。
     *
     * @param totals 快照總計
     * @param models 依模型的總計
     */
    public record DevicePartition(
        UsageTotals totals,
        Map<String, UsageTotals> models
    ) {
    }
}
