package io.github.samzhu.tokenboard.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;

import io.github.samzhu.tokenboard.dto.TokenBreakdown;
import io.github.samzhu.tokenboard.dto.contribution.DailyContribution;
import io.github.samzhu.tokenboard.dto.contribution.DailyTotals;
import io.github.samzhu.tokenboard.dto.contribution.DataSummary;
import io.github.samzhu.tokenboard.dto.contribution.DateRange;
import io.github.samzhu.tokenboard.dto.contribution.ExportMeta;
import io.github.samzhu.tokenboard.dto.contribution.SourceContribution;
import io.github.samzhu.tokenboard.dto.contribution.TokenContributionData;
import io.github.samzhu.tokenboard.dto.contribution.YearSummary;
import io.github.samzhu.tokenboard.service.SubmissionValidationService.ValidationResult;

class SubmissionValidationServiceTest {

    private static ValidatorFactory validatorFactory;

    private SubmissionValidationService validationService;

    @BeforeAll
    static void createValidatorFactory() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
    }

    @AfterAll
    static void closeValidatorFactory() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        // 伺服器的今天是 2025-06-10 (UTC)
        Clock clock = Clock.fixed(Instant.parse("2025-06-10T15:00:00Z"), ZoneOffset.UTC);
        validationService = new SubmissionValidationService(validatorFactory.getValidator(), clock);
    }

    @Test
    void shouldAcceptConsistentSubmission() {
        // Given
        TokenContributionData data = payload(List.of(
            day("2025-06-01", "claude", 1000, "0.50"),
            day("2025-06-02", "codex", 2000, "1.00")));

        // When
        ValidationResult result = validationService.validate(data);

        // Then
        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.fingerprint()).hasSize(16);
    }

    @Test
    void shouldRejectTomorrowsDate() {
        // Given
        TokenContributionData data = payload(List.of(
            day("2025-06-10", "claude", 1000, "0.50"),
            day("2025-06-11", "claude", 1000, "0.50")));

        // When
        ValidationResult result = validationService.validate(data);

        // Then
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).contains(
            "Future date found in contributions: 2025-06-11",
            "Date range extends into the future: 2025-06-11");
    }

    @Test
    void shouldRejectDuplicateDates() {
        // Given
        TokenContributionData data = payload(List.of(
            day("2025-06-01", "claude", 1000, "0.50"),
            day("2025-06-01", "codex", 500, "0.25")));

        // When
        ValidationResult result = validationService.validate(data);

        // Then
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("Duplicate date found: 2025-06-01");
    }

    @Test
    void shouldRejectTokenTotalMismatch() {
        // Given: 宣告 10000，實際 5000
        TokenContributionData data = withSummaryTokens(payload(List.of(
            day("2025-06-01", "claude", 5000, "0.50"))), 10_000);

        // When
        ValidationResult result = validationService.validate(data);

        // Then
        assertThat(result.errors()).containsExactly("Token total mismatch: summary=10000, calculated=5000");
    }

    @Test
    void shouldTolerateSmallTokenMismatch() {
        // Given: 差 100（不超過 max(1%, 100)）
        TokenContributionData small = withSummaryTokens(payload(List.of(
            day("2025-06-01", "claude", 5000, "0.50"))), 5100);
        // 差 101，但在 1% 之內
        TokenContributionData withinPercent = withSummaryTokens(payload(List.of(
            day("2025-06-01", "claude", 50_000, "0.50"))), 50_101);

        // When & Then
        assertThat(validationService.validate(small).valid()).isTrue();
        assertThat(validationService.validate(withinPercent).valid()).isTrue();
    }

    @Test
    void shouldCollectAllErrorsAtOnce() {
        // Given: 未來日期 + 重複日期 + 總計不符
        TokenContributionData data = withSummaryTokens(payload(List.of(
            day("2025-06-01", "claude", 1000, "0.50"),
            day("2025-06-01", "claude", 1000, "0.50"),
            day("2025-07-01", "claude", 1000, "0.50"))), 999_999);

        // When
        ValidationResult result = validationService.validate(data);

        // Then
        assertThat(result.errors()).hasSize(4)
            .anyMatch(e -> e.startsWith("Future date found"))
            .anyMatch(e -> e.startsWith("Date range extends into the future"))
            .anyMatch(e -> e.startsWith("Duplicate date found"))
            .anyMatch(e -> e.startsWith("Token total mismatch"));
    }

    @Test
    void shouldReportStructuralViolationsWithPaths() {
        // Given
        SourceContribution badSource = new SourceContribution("vim", "m", null,
            new TokenBreakdown(-1, 0, 0, 0, 0), new BigDecimal("0.1"), 1);
        DailyContribution badDay = new DailyContribution("2025/06/01",
            new DailyTotals(0, BigDecimal.ZERO, 1), 5, TokenBreakdown.ZERO, List.of(badSource));
        TokenContributionData data = payload(List.of(badDay));

        // When
        ValidationResult result = validationService.validate(data);

        // Then
        assertThat(result.valid()).isFalse();
        assertThat(result.fingerprint()).isNull();
        assertThat(result.errors())
            .anyMatch(e -> e.startsWith("contributions[0].date: "))
            .anyMatch(e -> e.startsWith("contributions[0].intensity: "))
            .anyMatch(e -> e.startsWith("contributions[0].sources[0].source: "))
            .anyMatch(e -> e.startsWith("contributions[0].sources[0].tokens.input: "));
    }

    @Test
    void shouldReportMissingSections() {
        // Given
        TokenContributionData data = new TokenContributionData(null, null, List.of(), List.of());

        // When
        ValidationResult result = validationService.validate(data);

        // Then
        assertThat(result.valid()).isFalse();
        assertThat(result.errors())
            .anyMatch(e -> e.startsWith("meta: "))
            .anyMatch(e -> e.startsWith("summary: "));
    }

    @Test
    void shouldWarnOnCostAndActiveDayMismatch() {
        // Given
        TokenContributionData base = payload(List.of(day("2025-06-01", "claude", 1000, "5.00")));
        DataSummary s = base.summary();
        TokenContributionData data = new TokenContributionData(base.meta(),
            new DataSummary(s.totalTokens(), new BigDecimal("6.00"), s.totalDays(), 3,
                s.averagePerDay(), s.maxCostInSingleDay(), s.sources(), s.models()),
            base.years(), base.contributions());

        // When
        ValidationResult result = validationService.validate(data);

        // Then
        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).containsExactly(
            "Cost total minor mismatch: summary=6.00, calculated=5.00",
            "Active days mismatch: summary=3, calculated=1");
    }

    @Test
    void shouldWarnWhenSourcesDoNotMatchDayTotal() {
        // Given: 當日總計 1000，但 sources 合計 2000
        SourceContribution source = new SourceContribution("claude", "m", null,
            new TokenBreakdown(2000, 0, 0, 0, 0), new BigDecimal("0.5"), 1);
        DailyContribution inconsistent = new DailyContribution("2025-06-01",
            new DailyTotals(1000, new BigDecimal("0.5"), 1), 4, new TokenBreakdown(1000, 0, 0, 0, 0),
            List.of(source));

        // When
        ValidationResult result = validationService.validate(payload(List.of(inconsistent)));

        // Then
        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).containsExactly("Day 2025-06-01: source tokens (2000) don't match total (1000)");
    }

    @Test
    void shouldWarnOnDatesOutsideDeclaredRangeAndYearMismatch() {
        // Given
        TokenContributionData base = payload(List.of(
            day("2025-06-01", "claude", 3000, "0.50"),
            day("2025-06-05", "claude", 3000, "0.50")));
        TokenContributionData data = new TokenContributionData(
            new ExportMeta(base.meta().generatedAt(), base.meta().version(), new DateRange("2025-06-02", "2025-06-04")),
            base.summary(),
            List.of(new YearSummary("2025", 1000, BigDecimal.ONE, new DateRange("2025-06-01", "2025-06-05"))),
            base.contributions());

        // When
        ValidationResult result = validationService.validate(data);

        // Then
        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).containsExactly(
            "Contribution date 2025-06-01 is before dateRange.start 2025-06-02",
            "Contribution date 2025-06-05 is after dateRange.end 2025-06-04",
            "Year 2025 token mismatch: summary=1000, calculated=6000");
    }

    @Test
    void shouldNormalizeModelIds() {
        // Given
        SourceContribution blank = new SourceContribution("claude", "  ", null,
            new TokenBreakdown(100, 0, 0, 0, 0), BigDecimal.ZERO, 1);
        SourceContribution missing = new SourceContribution("claude", null, null,
            new TokenBreakdown(100, 0, 0, 0, 0), BigDecimal.ZERO, 1);
        SourceContribution padded = new SourceContribution("codex", " gpt-5 ", null,
            new TokenBreakdown(100, 0, 0, 0, 0), BigDecimal.ZERO, 1);
        DailyContribution day = new DailyContribution("2025-06-01", new DailyTotals(300, BigDecimal.ZERO, 3), 0,
            new TokenBreakdown(300, 0, 0, 0, 0), List.of(blank, missing, padded));

        // When
        ValidationResult result = validationService.validate(payload(List.of(day)));

        // Then
        assertThat(result.valid()).isTrue();
        assertThat(result.data().contributions().get(0).sources())
            .extracting(SourceContribution::modelId)
            .containsExactly("unknown", "unknown", "gpt-5");
    }

    @Test
    void fingerprintShouldIgnoreTotalsAndOrder() {
        // Given
        TokenContributionData first = payload(List.of(
            day("2025-06-01", "claude", 1000, "0.50"),
            day("2025-06-02", "codex", 2000, "1.00")));
        TokenContributionData sameShape = payload(List.of(
            day("2025-06-02", "codex", 9000, "4.00"),
            day("2025-06-01", "claude", 7000, "3.00")));
        TokenContributionData otherSources = payload(List.of(
            day("2025-06-01", "claude", 1000, "0.50"),
            day("2025-06-02", "gemini", 2000, "1.00")));

        // When
        String a = validationService.fingerprint(first);
        String b = validationService.fingerprint(sameShape);
        String c = validationService.fingerprint(otherSources);

        // Then
        assertThat(a).isEqualTo(b).matches("[0-9a-f]{16}");
        assertThat(c).isNotEqualTo(a);
    }

    @Test
    void shouldRejectImpossibleCalendarDate() {
        // Given: 2025-02-30 符合 YYYY-MM-DD 格式但不存在
        TokenContributionData data = payload(List.of(day("2025-02-30", "claude", 1000, "0.50")));

        // When
        ValidationResult result = validationService.validate(data);

        // Then
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).contains(
            "contributions[0].date: invalid calendar date",
            "meta.dateRange.start: invalid calendar date",
            "meta.dateRange.end: invalid calendar date",
            "years[0].range.start: invalid calendar date",
            "years[0].range.end: invalid calendar date");
    }

    @Test
    void shouldRejectImpossibleMonth() {
        TokenContributionData data = payload(List.of(
            day("2025-06-01", "claude", 1000, "0.50"),
            day("2025-13-45", "codex", 1000, "0.50")));

        ValidationResult result = validationService.validate(data);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).contains("contributions[1].date: invalid calendar date");
    }

    @Test
    void shouldRejectTokenCountsOverflowingWithinSource() {
        // Given: input + output 超出 long 範圍
        TokenBreakdown tokens = new TokenBreakdown(Long.MAX_VALUE, 1, 0, 0, 0);
        DailyContribution day = new DailyContribution("2025-06-01",
            new DailyTotals(Long.MAX_VALUE, new BigDecimal("1.00"), 1), 4, tokens,
            List.of(new SourceContribution("claude", "model-claude", null, tokens, new BigDecimal("1.00"), 1)));

        // When
        ValidationResult result = validationService.validate(payload(List.of(day)));

        // Then
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).contains(SubmissionValidationService.COUNTS_OUT_OF_RANGE);
    }

    @Test
    void shouldRejectTokenCountsOverflowingAcrossDays() {
        // Given: 單日合法，兩日加總超出 long 範圍
        long half = Long.MAX_VALUE / 2 + 1;
        TokenContributionData data = payload(List.of(
            day("2025-06-01", "claude", half, "0.50"),
            day("2025-06-02", "claude", half, "0.50")));

        // When
        ValidationResult result = validationService.validate(data);

        // Then
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).contains(SubmissionValidationService.COUNTS_OUT_OF_RANGE);
    }

    @Test
    void shouldRejectMessageCountsOverflowing() {
        TokenBreakdown tokens = new TokenBreakdown(10, 0, 0, 0, 0);
        DailyContribution day = new DailyContribution("2025-06-01",
            new DailyTotals(20, new BigDecimal("0.02"), 1), 4, new TokenBreakdown(20, 0, 0, 0, 0),
            List.of(new SourceContribution("claude", "model-a", null, tokens, new BigDecimal("0.01"), Long.MAX_VALUE),
                new SourceContribution("claude", "model-b", null, tokens, new BigDecimal("0.01"), 1)));

        ValidationResult result = validationService.validate(payload(List.of(day)));

        assertThat(result.errors()).contains(SubmissionValidationService.COUNTS_OUT_OF_RANGE);
    }

    @Test
    void shouldDetectMismatchBetweenLargeTotalsWithoutOverflow() {
        // Given: 差值乘以 100 會超出 long 範圍
        long large = Long.MAX_VALUE / 10;
        TokenContributionData data = withSummaryTokens(payload(List.of(
            day("2025-06-01", "claude", large, "0.50"))), large * 2);

        // When
        ValidationResult result = validationService.validate(data);

        // Then
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly(String.format(
            "Token total mismatch: summary=%d, calculated=%d", large * 2, large));
    }

    // === 測試資料 ===

    private static DailyContribution day(String date, String source, long inputTokens, String cost) {
        TokenBreakdown tokens = new TokenBreakdown(inputTokens, 0, 0, 0, 0);
        BigDecimal dayCost = new BigDecimal(cost);
        return new DailyContribution(date, new DailyTotals(inputTokens, dayCost, 1), 4, tokens,
            List.of(new SourceContribution(source, "model-" + source, null, tokens, dayCost, 1)));
    }

    /**
     * 依貢獻資料建立內部一致的提交內容。
     */
    private static TokenContributionData payload(List<DailyContribution> days) {
        long totalTokens = 0;
        BigDecimal totalCost = BigDecimal.ZERO;
        BigDecimal maxCost = BigDecimal.ZERO;
        int activeDays = 0;
        TreeSet<String> sources = new TreeSet<>();
        TreeSet<String> models = new TreeSet<>();
        for (DailyContribution day : days) {
            totalTokens += day.totals().tokens();
            totalCost = totalCost.add(day.totals().cost());
            maxCost = maxCost.max(day.totals().cost());
            if (day.totals().tokens() > 0) {
                activeDays++;
            }
            for (SourceContribution source : day.sources()) {
                if (source.source() != null && source.source().matches(SourceContribution.SOURCE_PATTERN)) {
                    sources.add(source.source());
                }
                if (source.modelId() != null) {
                    models.add(source.modelId());
                }
            }
        }

        List<DailyContribution> sorted = new ArrayList<>(days);
        sorted.sort(Comparator.comparing(DailyContribution::date));
        String start = sorted.get(0).date();
        String end = sorted.get(sorted.size() - 1).date();
        boolean validRange = start.matches("\\d{4}-\\d{2}-\\d{2}");
        DateRange range = validRange ? new DateRange(start, end) : new DateRange("2025-06-01", "2025-06-01");

        DataSummary summary = new DataSummary(totalTokens, totalCost, days.size(), activeDays,
            activeDays > 0 ? totalCost.divide(BigDecimal.valueOf(activeDays), java.math.MathContext.DECIMAL64)
                : BigDecimal.ZERO,
            maxCost, List.copyOf(sources), List.copyOf(models));
        List<YearSummary> years = validRange
            ? List.of(new YearSummary(start.substring(0, 4), totalTokens, totalCost, range))
            : List.of();
        return new TokenContributionData(new ExportMeta("2025-06-10T00:00:00Z", "1.2.0", range),
            summary, years, days);
    }

    private static TokenContributionData withSummaryTokens(TokenContributionData data, long totalTokens) {
        DataSummary s = data.summary();
        return new TokenContributionData(data.meta(),
            new DataSummary(totalTokens, s.totalCost(), s.totalDays(), s.activeDays(), s.averagePerDay(),
                s.maxCostInSingleDay(), s.sources(), s.models()),
            data.years(), data.contributions());
    }
}
