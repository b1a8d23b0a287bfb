package io.github.samzhu.tokenboard.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import io.github.samzhu.tokenboard.dto.contribution.DailyContribution;
import io.github.samzhu.tokenboard.dto.contribution.DateRange;
import io.github.samzhu.tokenboard.dto.contribution.SourceContribution;
import io.github.samzhu.tokenboard.dto.contribution.TokenContributionData;
import io.github.samzhu.tokenboard.dto.contribution.YearSummary;
import io.github.samzhu.tokenboard.util.DateUtils;
import io.github.samzhu.tokenboard.util.FingerprintUtils;

/**
 * 提交內容驗證服務。
 *
 * <p>驗證分為兩層，所有問題一次收集後回傳，不會在第一個錯誤就中止：
 * <ul>
 *   <li>結構檢查 - 以 Bean Validation 註解檢查必填欄位、非負數值、日期格式</li>
 *   <li>語意檢查 - 數學一致性與日期合理性</li>
 * </ul>
 *
 * <h3>錯誤（拒絕整筆提交）</h3>
 * <ul>
 *   <li>任何日期晚於伺服器的今天（UTC）</li>
 *   <li>宣告的 {@code summary.totalTokens} 與重算值相差超過 max(1%, 100)</li>
 *   <li>同一日期出現兩次</li>
 * </ul>
 *
 * <h3>警告（接受，但回報給呼叫端）</h3>
 * <ul>
 *   <li>成本總和相差超過 max(1%, 0.1)</li>
 *   <li>活躍天數與重算值不同</li>
 *   <li>單日 sources 的 tokens 與當日總計相差超過 5%（當日總計大於 100 時才檢查）</li>
 *   <li>貢獻日期落在宣告的日期區間之外</li>
 *   <li>年度 tokens 與重算值相差超過 1%（重算值大於 1000 時才檢查）</li>
 * </ul>
 */
@Service
public class SubmissionValidationService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionValidationService.class);

    static final String UNKNOWN_MODEL = "unknown";

    static final String INVALID_CALENDAR_DATE = "invalid calendar date";
    static final String COUNTS_OUT_OF_RANGE = "Token or message counts out of range";

    private static final BigDecimal ONE_PERCENT = new BigDecimal("0.01");
    private static final BigDecimal COST_TOLERANCE = new BigDecimal("0.1");

    private final Validator validator;
    private final Clock clock;

    public SubmissionValidationService(Validator validator, Clock clock) {
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * 驗證結果。
     *
     * @param errors 錯誤，非空時拒絕提交
     * @param warnings 警告
     * @param data 正規化後的提交內容
     * @param fingerprint 提交指紋；結構不完整時為 null
     */
    public record ValidationResult(
        List<String> errors,
        List<String> warnings,
        TokenContributionData data,
        String fingerprint
    ) {
        public boolean valid() {
            return errors.isEmpty();
        }
    }

    /**
     * 正規化並驗證提交內容。
     *
     * @param submission 原始提交內容
     * @return 驗證結果
     */
    public ValidationResult validate(TokenContributionData submission) {
        TokenContributionData data = normalize(submission);
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        List<String> structural = new ArrayList<>();
        for (ConstraintViolation<TokenContributionData> violation : validator.validate(data)) {
            structural.add(violation.getPropertyPath() + ": " + violation.getMessage());
        }
        // violation 的順序不固定
        structural.sort(null);
        errors.addAll(structural);

        List<DailyContribution> days = data.contributions() != null
            ? data.contributions().stream().filter(d -> d != null).toList()
            : List.of();

        checkCalendarDates(data, errors);
        boolean countsInRange = checkCountRanges(days, errors);

        checkFutureDates(data, days, errors);
        if (countsInRange) {
            checkTotals(data, days, errors, warnings);
            checkYears(data, days, warnings);
        }
        checkDays(data, days, countsInRange, errors, warnings);

        String fingerprint = structural.isEmpty() ? fingerprint(data) : null;

        if (!errors.isEmpty()) {
            log.info("Submission rejected: {} errors, {} warnings", errors.size(), warnings.size());
            log.debug("Validation errors: {}", errors);
        } else if (!warnings.isEmpty()) {
            log.debug("Submission accepted with warnings: {}", warnings);
        }
        return new ValidationResult(List.copyOf(errors), List.copyOf(warnings), data, fingerprint);
    }

    /**
     * 缺少或空白的 modelId 改為 {@code "unknown"}，其餘去除首尾空白。
     */
    TokenContributionData normalize(TokenContributionData data) {
        if (data.contributions() == null) {
            return data;
        }
        List<DailyContribution> contributions = new ArrayList<>(data.contributions().size());
        for (DailyContribution day : data.contributions()) {
            if (day == null || day.sources() == null) {
                contributions.add(day);
                continue;
            }
            List<SourceContribution> sources = new ArrayList<>(day.sources().size());
            for (SourceContribution source : day.sources()) {
                sources.add(source != null ? source.withModelId(normalizeModelId(source.modelId())) : null);
            }
            contributions.add(new DailyContribution(day.date(), day.totals(), day.intensity(),
                day.tokenBreakdown(), sources));
        }
        return new TokenContributionData(data.meta(), data.summary(), data.years(), contributions);
    }

    private static String normalizeModelId(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            return UNKNOWN_MODEL;
        }
        return modelId.trim();
    }

    /**
     * 符合日期格式但不存在的日期（例如 {@code 2025-02-30}）視為錯誤，路徑與結構錯誤一致。
     */
    private void checkCalendarDates(TokenContributionData data, List<String> errors) {
        DateRange range = dateRange(data);
        if (range != null) {
            addIfInvalidDate("meta.dateRange.start", range.start(), errors);
            addIfInvalidDate("meta.dateRange.end", range.end(), errors);
        }
        if (data.years() != null) {
            for (int i = 0; i < data.years().size(); i++) {
                YearSummary year = data.years().get(i);
                if (year != null && year.range() != null) {
                    addIfInvalidDate("years[" + i + "].range.start", year.range().start(), errors);
                    addIfInvalidDate("years[" + i + "].range.end", year.range().end(), errors);
                }
            }
        }
        if (data.contributions() != null) {
            for (int i = 0; i < data.contributions().size(); i++) {
                DailyContribution day = data.contributions().get(i);
                if (day != null) {
                    addIfInvalidDate("contributions[" + i + "].date", day.date(), errors);
                }
            }
        }
    }

    private static void addIfInvalidDate(String path, String value, List<String> errors) {
        if (DateUtils.isInvalidCalendarDate(value)) {
            errors.add(path + ": " + INVALID_CALENDAR_DATE);
        }
    }

    /**
     * 以精確運算加總提交中的 token 與訊息數；任何加總超出 {@code long} 範圍時記錄錯誤並回傳 false，
     * 後續依賴加總的檢查會略過。
     */
    private boolean checkCountRanges(List<DailyContribution> days, List<String> errors) {
        try {
            long dayTokens = 0;
            long sourceTokens = 0;
            long messages = 0;
            for (DailyContribution day : days) {
                if (day.totals() != null) {
                    dayTokens = Math.addExact(dayTokens, day.totals().tokens());
                }
                if (day.tokenBreakdown() != null) {
                    day.tokenBreakdown().total();
                }
                if (day.sources() == null) {
                    continue;
                }
                for (SourceContribution source : day.sources()) {
                    if (source == null) {
                        continue;
                    }
                    if (source.tokens() != null) {
                        sourceTokens = Math.addExact(sourceTokens, source.tokens().total());
                    }
                    messages = Math.addExact(messages, source.messages());
                }
            }
            return true;
        } catch (ArithmeticException e) {
            errors.add(COUNTS_OUT_OF_RANGE);
            return false;
        }
    }

    private void checkFutureDates(TokenContributionData data, List<DailyContribution> days, List<String> errors) {
        LocalDate today = DateUtils.today(clock);

        DateRange range = dateRange(data);
        if (range != null) {
            DateUtils.parse(range.end())
                .filter(end -> end.isAfter(today))
                .ifPresent(end -> errors.add("Date range extends into the future: " + range.end()));
        }

        for (DailyContribution day : days) {
            DateUtils.parse(day.date())
                .filter(date -> date.isAfter(today))
                .ifPresent(date -> errors.add("Future date found in contributions: " + day.date()));
        }
    }

    private void checkTotals(TokenContributionData data, List<DailyContribution> days,
                             List<String> errors, List<String> warnings) {
        if (data.summary() == null) {
            return;
        }
        long calculatedTokens = 0;
        BigDecimal calculatedCost = BigDecimal.ZERO;
        int activeDays = 0;
        for (DailyContribution day : days) {
            if (day.totals() == null) {
                continue;
            }
            calculatedTokens = Math.addExact(calculatedTokens, day.totals().tokens());
            if (day.totals().cost() != null) {
                calculatedCost = calculatedCost.add(day.totals().cost());
            }
            if (day.totals().tokens() > 0) {
                activeDays++;
            }
        }

        long declaredTokens = data.summary().totalTokens();
        long tokenDiff = Math.abs(calculatedTokens - declaredTokens);
        if (exceedsPercent(tokenDiff, declaredTokens, 1) && tokenDiff > 100) {
            errors.add(String.format("Token total mismatch: summary=%d, calculated=%d",
                declaredTokens, calculatedTokens));
        }

        BigDecimal declaredCost = data.summary().totalCost();
        if (declaredCost != null) {
            BigDecimal costDiff = calculatedCost.subtract(declaredCost).abs();
            if (costDiff.compareTo(declaredCost.multiply(ONE_PERCENT)) > 0
                    && costDiff.compareTo(COST_TOLERANCE) > 0) {
                warnings.add(String.format("Cost total minor mismatch: summary=%s, calculated=%s",
                    declaredCost.setScale(2, RoundingMode.HALF_UP).toPlainString(),
                    calculatedCost.setScale(2, RoundingMode.HALF_UP).toPlainString()));
            }
        }

        if (activeDays != data.summary().activeDays()) {
            warnings.add(String.format("Active days mismatch: summary=%d, calculated=%d",
                data.summary().activeDays(), activeDays));
        }
    }

    private void checkDays(TokenContributionData data, List<DailyContribution> days, boolean countsInRange,
                           List<String> errors, List<String> warnings) {
        for (DailyContribution day : days) {
            if (!countsInRange || day.totals() == null || day.sources() == null || day.sources().isEmpty()) {
                continue;
            }
            long sourceTokens = 0;
            for (SourceContribution source : day.sources()) {
                if (source != null && source.tokens() != null) {
                    sourceTokens += source.tokens().total();
                }
            }
            long dayTokens = day.totals().tokens();
            if (exceedsPercent(Math.abs(sourceTokens - dayTokens), dayTokens, 5) && dayTokens > 100) {
                warnings.add(String.format("Day %s: source tokens (%d) don't match total (%d)",
                    day.date(), sourceTokens, dayTokens));
            }
        }

        TreeSet<String> sortedDates = new TreeSet<>();
        Set<String> seen = new HashSet<>();
        for (DailyContribution day : days) {
            if (day.date() == null) {
                continue;
            }
            sortedDates.add(day.date());
            if (!seen.add(day.date())) {
                errors.add("Duplicate date found: " + day.date());
            }
        }

        DateRange range = dateRange(data);
        if (range != null && !sortedDates.isEmpty()) {
            String firstDate = sortedDates.first();
            String lastDate = sortedDates.last();
            if (range.start() != null && firstDate.compareTo(range.start()) < 0) {
                warnings.add(String.format("Contribution date %s is before dateRange.start %s",
                    firstDate, range.start()));
            }
            if (range.end() != null && lastDate.compareTo(range.end()) > 0) {
                warnings.add(String.format("Contribution date %s is after dateRange.end %s",
                    lastDate, range.end()));
            }
        }
    }

    private void checkYears(TokenContributionData data, List<DailyContribution> days, List<String> warnings) {
        if (data.years() == null) {
            return;
        }
        for (YearSummary year : data.years()) {
            if (year == null || year.year() == null) {
                continue;
            }
            long yearTokens = days.stream()
                .filter(d -> d.date() != null && d.totals() != null && d.date().startsWith(year.year()))
                .mapToLong(d -> d.totals().tokens())
                .sum();
            long diff = Math.abs(yearTokens - year.totalTokens());
            if (exceedsPercent(diff, year.totalTokens(), 1) && yearTokens > 1000) {
                warnings.add(String.format("Year %s token mismatch: summary=%d, calculated=%d",
                    year.year(), year.totalTokens(), yearTokens));
            }
        }
    }

    /**
     * 計算提交指紋。
     *
     * <p>只涵蓋來源、宣告的日期區間、貢獻天數與首尾日期，不含總計：
     * 總計在合併後會改變，因此指紋只用於標示重複提交，不作為儲存 key。
     *
     * @param data 結構完整的提交內容
     * @return 16 字元十六進位指紋
     */
    public String fingerprint(TokenContributionData data) {
        TreeSet<String> sources = new TreeSet<>(data.summary().sources());
        TreeSet<String> dates = new TreeSet<>();
        data.contributions().forEach(day -> dates.add(day.date()));
        DateRange range = data.meta().dateRange();

        String canonical = "sources=" + String.join(",", sources)
            + "|dateRange=" + range.start() + ".." + range.end()
            + "|days=" + data.contributions().size()
            + "|first=" + (dates.isEmpty() ? "" : dates.first())
            + "|last=" + (dates.isEmpty() ? "" : dates.last());
        return FingerprintUtils.shortFingerprint(canonical);
    }

    private static DateRange dateRange(TokenContributionData data) {
        return data.meta() != null ? data.meta().dateRange() : null;
    }

    private static boolean exceedsPercent(long diff, long base, int percent) {
        // diff > base * percent / 100，以精確十進位運算避免浮點誤差與溢位
        return BigDecimal.valueOf(diff).movePointRight(2)
            .compareTo(BigDecimal.valueOf(base).multiply(BigDecimal.valueOf(percent))) > 0;
    }
}
