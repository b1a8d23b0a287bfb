package io.github.samzhu.tokenboard.service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.tokenboard.config.TokenboardProperties;
import io.github.samzhu.tokenboard.dto.PricingTable;
import io.github.samzhu.tokenboard.dto.TokenBreakdown;
import io.github.samzhu.tokenboard.dto.UsageEvent;
import io.github.samzhu.tokenboard.dto.contribution.DailyContribution;
import io.github.samzhu.tokenboard.dto.contribution.DailyTotals;
import io.github.samzhu.tokenboard.dto.contribution.DataSummary;
import io.github.samzhu.tokenboard.dto.contribution.DateRange;
import io.github.samzhu.tokenboard.dto.contribution.ExportMeta;
import io.github.samzhu.tokenboard.dto.contribution.SourceContribution;
import io.github.samzhu.tokenboard.dto.contribution.TokenContributionData;
import io.github.samzhu.tokenboard.dto.contribution.YearSummary;

/**
 * 用量事件聚合服務。
 *
 * <p>將正規化後的用量事件轉換為貢獻圖資料：
 * <ol>
 *   <li>以定價表計算每筆事件成本（每筆事件計為一則訊息）</li>
 *   <li>依 UTC 日期分組，日內再依 (source, modelId) 分組</li>
 *   <li>以整體單日最高成本為基準計算每日熱度等級</li>
 *   <li>建立年度摘要與整體摘要</li>
 * </ol>
 *
 * <p>熱度等級（嚴格大於）：
 * <pre>
 * cost == 0            → 0
 * cost / max &gt; 0.75    → 4
 * cost / max &gt; 0.5     → 3
 * cost / max &gt; 0.25    → 2
 * 其餘                 → 1
 * </pre>
 *
 * <p>所有輸出均排序，相同事件集合與相同時鐘產生相同的輸出，供上游計算提交指紋。
 */
@Service
public class ContributionAggregationService {

    private static final Logger log = LoggerFactory.getLogger(ContributionAggregationService.class);

    static final String UNKNOWN = "unknown";

    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal THREE = BigDecimal.valueOf(3);
    private static final BigDecimal FOUR = BigDecimal.valueOf(4);

    private final CostCalculationService costService;
    private final Clock clock;
    private final String version;

    public ContributionAggregationService(CostCalculationService costService, Clock clock,
                                          TokenboardProperties properties) {
        this.costService = costService;
        this.clock = clock;
        this.version = properties.graph().version();
    }

    /**
     * 以預設定價表聚合事件。
     */
    public TokenContributionData aggregate(List<UsageEvent> events) {
        return aggregate(events, costService.defaultPricingTable());
    }

    /**
     * 聚合事件為貢獻圖資料。
     *
     * @param events 用量事件
     * @param pricingTable 定價表
     * @return 貢獻圖資料
     */
    public TokenContributionData aggregate(List<UsageEvent> events, PricingTable pricingTable) {
        // date -> (source, modelId) -> 累計
        TreeMap<String, TreeMap<SourceModelKey, SourceAccumulator>> days = new TreeMap<>();

        for (UsageEvent event : events) {
            BigDecimal cost = costService.calculateCost(event, pricingTable);
            SourceModelKey key = new SourceModelKey(
                Objects.requireNonNullElse(event.source(), UNKNOWN),
                Objects.requireNonNullElse(event.modelId(), UNKNOWN));
            days.computeIfAbsent(event.utcDate(), d -> new TreeMap<>())
                .computeIfAbsent(key, k -> new SourceAccumulator())
                .add(event, cost);
        }

        List<DayAccumulator> dayTotals = new ArrayList<>();
        BigDecimal maxCost = BigDecimal.ZERO;
        for (var dayEntry : days.entrySet()) {
            DayAccumulator day = new DayAccumulator(dayEntry.getKey());
            for (var sourceEntry : dayEntry.getValue().entrySet()) {
                day.add(sourceEntry.getKey(), sourceEntry.getValue());
            }
            dayTotals.add(day);
            if (day.cost.compareTo(maxCost) > 0) {
                maxCost = day.cost;
            }
        }

        List<DailyContribution> contributions = new ArrayList<>(dayTotals.size());
        for (DayAccumulator day : dayTotals) {
            contributions.add(new DailyContribution(
                day.date,
                new DailyTotals(day.tokens.total(), day.cost, day.messages),
                intensity(day.cost, maxCost),
                day.tokens,
                day.sources
            ));
        }

        TokenContributionData data = new TokenContributionData(
            new ExportMeta(Instant.now(clock).toString(), version, dateRange(contributions)),
            buildSummary(contributions, maxCost),
            buildYears(contributions),
            contributions
        );

        log.debug("Aggregated {} events into {} days, maxCost={}", events.size(), contributions.size(), maxCost);
        return data;
    }

    /**
     * 依相對成本計算熱度等級，邊界為嚴格大於。
     *
     * @param cost 當日成本
     * @param maxCost 單日最高成本
     * @return 0 到 4
     */
    static int intensity(BigDecimal cost, BigDecimal maxCost) {
        if (cost.signum() <= 0 || maxCost.signum() <= 0) {
            return 0;
        }
        // 以交叉相乘比較 cost/max 與門檻，避免除法捨入
        if (cost.multiply(FOUR).compareTo(maxCost.multiply(THREE)) > 0) {
            return 4;
        }
        if (cost.multiply(TWO).compareTo(maxCost) > 0) {
            return 3;
        }
        if (cost.multiply(FOUR).compareTo(maxCost) > 0) {
            return 2;
        }
        return 1;
    }

    private DateRange dateRange(List<DailyContribution> contributions) {
        if (contributions.isEmpty()) {
            return DateRange.empty();
        }
        return new DateRange(contributions.get(0).date(), contributions.get(contributions.size() - 1).date());
    }

    private List<YearSummary> buildYears(List<DailyContribution> contributions) {
        TreeMap<String, List<DailyContribution>> byYear = new TreeMap<>();
        for (DailyContribution day : contributions) {
            byYear.computeIfAbsent(day.date().substring(0, 4), y -> new ArrayList<>()).add(day);
        }

        List<YearSummary> years = new ArrayList<>(byYear.size());
        byYear.forEach((year, yearDays) -> {
            long tokens = 0;
            BigDecimal cost = BigDecimal.ZERO;
            for (DailyContribution day : yearDays) {
                tokens = Math.addExact(tokens, day.totals().tokens());
                cost = cost.add(day.totals().cost());
            }
            years.add(new YearSummary(year, tokens, cost,
                new DateRange(yearDays.get(0).date(), yearDays.get(yearDays.size() - 1).date())));
        });
        return years;
    }

    private DataSummary buildSummary(List<DailyContribution> contributions, BigDecimal maxCost) {
        long totalTokens = 0;
        BigDecimal totalCost = BigDecimal.ZERO;
        int activeDays = 0;
        TreeSet<String> sources = new TreeSet<>();
        TreeSet<String> models = new TreeSet<>();

        for (DailyContribution day : contributions) {
            totalTokens = Math.addExact(totalTokens, day.totals().tokens());
            totalCost = totalCost.add(day.totals().cost());
            if (day.totals().tokens() > 0) {
                activeDays++;
            }
            for (SourceContribution source : day.sources()) {
                sources.add(source.source());
                models.add(source.modelId());
            }
        }

        BigDecimal averagePerDay = activeDays > 0
            ? totalCost.divide(BigDecimal.valueOf(activeDays), MathContext.DECIMAL64)
            : BigDecimal.ZERO;

        return new DataSummary(totalTokens, totalCost, contributions.size(), activeDays,
            averagePerDay, maxCost, List.copyOf(sources), List.copyOf(models));
    }

    record SourceModelKey(String source, String modelId) implements Comparable<SourceModelKey> {

        private static final Comparator<SourceModelKey> ORDER = Comparator
            .comparing(SourceModelKey::source)
            .thenComparing(SourceModelKey::modelId);

        @Override
        public int compareTo(SourceModelKey other) {
            return ORDER.compare(this, other);
        }
    }

    private static final class SourceAccumulator {
        private TokenBreakdown tokens = TokenBreakdown.ZERO;
        private BigDecimal cost = BigDecimal.ZERO;
        private long messages;
        private String providerId;

        void add(UsageEvent event, BigDecimal eventCost) {
            tokens = tokens.plus(event.tokens());
            cost = cost.add(eventCost);
            messages++;
            // 取字典序最小的 providerId，與事件順序無關
            if (event.providerId() != null
                    && (providerId == null || event.providerId().compareTo(providerId) < 0)) {
                providerId = event.providerId();
            }
        }
    }

    private static final class DayAccumulator {
        private final String date;
        private final List<SourceContribution> sources = new ArrayList<>();
        private TokenBreakdown tokens = TokenBreakdown.ZERO;
        private BigDecimal cost = BigDecimal.ZERO;
        private long messages;

        DayAccumulator(String date) {
            this.date = date;
        }

        void add(SourceModelKey key, SourceAccumulator acc) {
            sources.add(new SourceContribution(key.source(), key.modelId(), acc.providerId,
                acc.tokens, acc.cost, acc.messages));
            tokens = tokens.plus(acc.tokens);
            cost = cost.add(acc.cost);
            messages = Math.addExact(messages, acc.messages);
        }
    }
}
