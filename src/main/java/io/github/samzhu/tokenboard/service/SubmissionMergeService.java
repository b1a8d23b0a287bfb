package io.github.samzhu.tokenboard.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import org.springframework.stereotype.Service;

import io.github.samzhu.tokenboard.document.DailyBreakdown;
import io.github.samzhu.tokenboard.document.DailyBreakdown.DevicePartition;
import io.github.samzhu.tokenboard.document.DailyBreakdown.SourceBreakdown;
import io.github.samzhu.tokenboard.document.DailyBreakdown.UsageTotals;
import io.github.samzhu.tokenboard.dto.TokenBreakdown;
import io.github.samzhu.tokenboard.dto.contribution.DailyContribution;
import io.github.samzhu.tokenboard.dto.contribution.SourceContribution;

/**
 * 日明細合併邏輯。
 *
 * <p>每個 (用戶, 日期, 來源) 以裝置分區保存。一次提交對某裝置某日某來源而言是完整快照而非增量，
 * 因此合併時整筆取代該裝置的分區：重送同一份提交結果不變，不同裝置的資料互相相加。
 *
 * <p>單日合併步驟：
 * <ol>
 *   <li>合併提交中重複的 (source, modelId) 項目</li>
 *   <li>依來源分組為此裝置的快照</li>
 *   <li>提交中出現的來源：以快照取代此裝置分區（不存在則建立）</li>
 *   <li>提交中未出現的來源：完全不動</li>
 *   <li>重算來源總計、當日總計與模型明細</li>
 * </ol>
 *
 * <p>此類別不存取資料庫，交易與寫入由 {@link SubmissionService} 負責。
 */
@Service
public class SubmissionMergeService {

    /**
     * 用戶累計統計，由全部日明細重算。
     *
     * @param totalTokens 總 tokens
     * @param totalCost 總成本
     * @param tokens token 細分總和
     * @param messages 訊息總數
     * @param activeDays tokens &gt; 0 的天數
     * @param dateStart 最早日期，沒有資料時為 null
     * @param dateEnd 最晚日期，沒有資料時為 null
     * @param sources 使用過的來源（排序）
     * @param models 使用過的模型（排序）
     */
    public record UserAggregate(
        long totalTokens,
        BigDecimal totalCost,
        TokenBreakdown tokens,
        long messages,
        int activeDays,
        String dateStart,
        String dateEnd,
        List<String> sources,
        List<String> models
    ) {
    }

    /**
     * 將一台裝置對某日的提交合併進既有日明細。
     *
     * @param existing 既有日明細，不存在時為 null
     * @param userId 用戶 ID
     * @param deviceId 裝置 ID
     * @param incoming 該日的提交內容
     * @param now 寫入時間
     * @return 合併後的日明細
     */
    public DailyBreakdown mergeDay(DailyBreakdown existing, String userId, String deviceId,
                                   DailyContribution incoming, Instant now) {
        LocalDate date = LocalDate.parse(incoming.date());
        Map<String, DevicePartition> snapshots = toDeviceSnapshots(incoming.sources());

        TreeMap<String, SourceBreakdown> sources = new TreeMap<>();
        if (existing != null && existing.sourceBreakdown() != null) {
            sources.putAll(existing.sourceBreakdown());
        }

        snapshots.forEach((source, snapshot) -> {
            TreeMap<String, DevicePartition> devices = new TreeMap<>();
            SourceBreakdown current = sources.get(source);
            if (current != null) {
                if (current.devices() != null && !current.devices().isEmpty()) {
                    devices.putAll(current.devices());
                } else {
                    // 裝置分區之前寫入的來源，移入 legacy 分區保留
                    devices.put(DailyBreakdown.LEGACY_DEVICE_ID, new DevicePartition(
                        current.totals() != null ? current.totals() : UsageTotals.ZERO,
                        current.models() != null ? new TreeMap<>(current.models()) : new TreeMap<>()));
                }
            }
            devices.put(deviceId, snapshot);
            sources.put(source, rebuildSource(devices));
        });

        UsageTotals dayTotals = UsageTotals.ZERO;
        TreeMap<String, UsageTotals> modelBreakdown = new TreeMap<>();
        for (SourceBreakdown source : sources.values()) {
            dayTotals = dayTotals.plus(source.totals());
            if (source.models() != null) {
                source.models().forEach((model, totals) -> modelBreakdown.merge(model, totals, UsageTotals::plus));
            }
        }

        String id = DailyBreakdown.createId(date, userId);
        Instant createdAt = existing != null && existing.createdAt() != null ? existing.createdAt() : now;
        return new DailyBreakdown(id, userId, date, dayTotals, sources, modelBreakdown,
            DailyBreakdown.SCHEMA_VERSION, createdAt, now);
    }

    /**
     * 由用戶全部日明細重算累計統計。
     *
     * @param rows 用戶的全部日明細
     * @return 累計統計
     */
    public UserAggregate summarize(Collection<DailyBreakdown> rows) {
        UsageTotals totals = UsageTotals.ZERO;
        int activeDays = 0;
        TreeSet<LocalDate> dates = new TreeSet<>();
        TreeSet<String> sources = new TreeSet<>();
        TreeSet<String> models = new TreeSet<>();

        for (DailyBreakdown row : rows) {
            UsageTotals dayTotals = row.totals() != null ? row.totals() : UsageTotals.ZERO;
            totals = totals.plus(dayTotals);
            if (dayTotals.totalTokens() > 0) {
                activeDays++;
            }
            if (row.date() != null) {
                dates.add(row.date());
            }
            if (row.sourceBreakdown() != null) {
                row.sourceBreakdown().forEach((source, breakdown) -> {
                    sources.add(source);
                    if (breakdown.models() != null) {
                        models.addAll(breakdown.models().keySet());
                    }
                });
            }
        }

        return new UserAggregate(
            totals.totalTokens(),
            totals.cost(),
            totals.tokens(),
            totals.messages(),
            activeDays,
            dates.isEmpty() ? null : dates.first().toString(),
            dates.isEmpty() ? null : dates.last().toString(),
            List.copyOf(sources),
            List.copyOf(models)
        );
    }

    /**
     * 將提交的 SourceContribution 依來源分組，重複的 (source, modelId) 相加。
     */
    Map<String, DevicePartition> toDeviceSnapshots(List<SourceContribution> contributions) {
        TreeMap<String, TreeMap<String, UsageTotals>> bySource = new TreeMap<>();
        for (SourceContribution contribution : contributions) {
            UsageTotals totals = new UsageTotals(contribution.tokens(), contribution.cost(), contribution.messages());
            bySource.computeIfAbsent(contribution.source(), s -> new TreeMap<>())
                .merge(contribution.modelId(), totals, UsageTotals::plus);
        }

        TreeMap<String, DevicePartition> snapshots = new TreeMap<>();
        bySource.forEach((source, models) -> {
            UsageTotals sourceTotals = models.values().stream().reduce(UsageTotals.ZERO, UsageTotals::plus);
            snapshots.put(source, new DevicePartition(sourceTotals, models));
        });
        return snapshots;
    }

    private SourceBreakdown rebuildSource(TreeMap<String, DevicePartition> devices) {
        UsageTotals totals = UsageTotals.ZERO;
        TreeMap<String, UsageTotals> models = new TreeMap<>();
        for (DevicePartition partition : devices.values()) {
            totals = totals.plus(partition.totals());
            if (partition.models() != null) {
                partition.models().forEach((model, modelTotals) -> models.merge(model, modelTotals, UsageTotals::plus));
            }
        }
        return new SourceBreakdown(totals, models, devices);
    }
}
