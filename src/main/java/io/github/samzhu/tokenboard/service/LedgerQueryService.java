package io.github.samzhu.tokenboard.service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import io.github.samzhu.tokenboard.document.DailyBreakdown;
import io.github.samzhu.tokenboard.document.DailyBreakdown.UsageTotals;
import io.github.samzhu.tokenboard.document.SubmissionSummary;
import io.github.samzhu.tokenboard.document.UserAccount;
import io.github.samzhu.tokenboard.dto.TokenBreakdown;
import io.github.samzhu.tokenboard.dto.api.DailyBreakdownResponse;
import io.github.samzhu.tokenboard.dto.api.DailyBreakdownResponse.UsageAmount;
import io.github.samzhu.tokenboard.dto.api.LeaderboardEntry;
import io.github.samzhu.tokenboard.dto.api.UserProfileResponse;
import io.github.samzhu.tokenboard.dto.contribution.DateRange;
import io.github.samzhu.tokenboard.exception.UserNotFoundException;
import io.github.samzhu.tokenboard.repository.DailyBreakdownRepository;
import io.github.samzhu.tokenboard.repository.SubmissionSummaryRepository;
import io.github.samzhu.tokenboard.repository.UserAccountRepository;
import io.github.samzhu.tokenboard.util.DateUtils;

/**
 * 帳本查詢服務。
 *
 * <p>只讀取已 commit 的資料，提供：
 * <ul>
 *   <li>用戶在日期區間內的日明細 - 預先產生 document IDs 後以 {@code $in} 批次查詢</li>
 *   <li>用戶個人統計 - 直接讀取用戶累計文件</li>
 *   <li>排行榜 - 依總 tokens 降序分頁</li>
 * </ul>
 */
@Service
public class LedgerQueryService {

    private static final Logger log = LoggerFactory.getLogger(LedgerQueryService.class);

    static final int MAX_RANGE_DAYS = 366;
    static final int MAX_PAGE_SIZE = 100;

    private final UserAccountRepository userAccountRepository;
    private final DailyBreakdownRepository dailyBreakdownRepository;
    private final SubmissionSummaryRepository summaryRepository;

    public LedgerQueryService(UserAccountRepository userAccountRepository,
                              DailyBreakdownRepository dailyBreakdownRepository,
                              SubmissionSummaryRepository summaryRepository) {
        this.userAccountRepository = userAccountRepository;
        this.dailyBreakdownRepository = dailyBreakdownRepository;
        this.summaryRepository = summaryRepository;
    }

    /**
     * 查詢用戶在指定期間的日明細，依日期排序。
     *
     * @param username 用戶名稱
     * @param startDate 起始日期（含）
     * @param endDate 結束日期（含）
     * @return 日明細列表
     * @throws UserNotFoundException 用戶不存在
     * @throws IllegalArgumentException 日期區間無效或超過 {@value #MAX_RANGE_DAYS} 天
     */
    public List<DailyBreakdownResponse> getUserDaily(String username, LocalDate startDate, LocalDate endDate) {
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }
        if (ChronoUnit.DAYS.between(startDate, endDate) >= MAX_RANGE_DAYS) {
            throw new IllegalArgumentException("Date range must not exceed " + MAX_RANGE_DAYS + " days");
        }
        UserAccount user = findUser(username);

        List<String> docIds = DateUtils.datesBetween(startDate, endDate).stream()
            .map(date -> DailyBreakdown.createId(date, user.id()))
            .toList();
        log.debug("Querying user daily breakdown: user={}, period={} to {}, docIds={}",
            username, startDate, endDate, docIds.size());

        List<DailyBreakdownResponse> results = dailyBreakdownRepository.findByIdIn(docIds).stream()
            .sorted(Comparator.comparing(DailyBreakdown::date))
            .map(this::toResponse)
            .toList();
        log.info("User daily breakdown query: user={}, period={} to {}, found {} records",
            username, startDate, endDate, results.size());
        return results;
    }

    /**
     * 查詢用戶個人統計；尚未提交過的用戶回傳全零統計。
     *
     * @param username 用戶名稱
     * @return 個人統計
     * @throws UserNotFoundException 用戶不存在
     */
    public UserProfileResponse getUserProfile(String username) {
        UserAccount user = findUser(username);
        return summaryRepository.findById(user.id())
            .map(summary -> new UserProfileResponse(
                user.username(),
                user.displayName(),
                user.avatarUrl(),
                summary.totalTokens(),
                summary.totalCost(),
                TokenBreakdown.orZero(summary.tokens()),
                summary.activeDays(),
                summary.dateStart() != null ? new DateRange(summary.dateStart(), summary.dateEnd()) : DateRange.empty(),
                orEmpty(summary.sourcesUsed()),
                orEmpty(summary.modelsUsed()),
                summary.submitCount(),
                summary.updatedAt()))
            .orElseGet(() -> new UserProfileResponse(
                user.username(), user.displayName(), user.avatarUrl(),
                0, UsageTotals.ZERO.cost(), TokenBreakdown.ZERO, 0, DateRange.empty(),
                List.of(), List.of(), 0, null));
    }

    /**
     * 查詢排行榜。
     *
     * @param page 頁碼（從 0 開始）
     * @param size 每頁筆數，上限 {@value #MAX_PAGE_SIZE}
     * @return 排行榜項目
     */
    public List<LeaderboardEntry> getLeaderboard(int page, int size) {
        if (page < 0 || size <= 0) {
            throw new IllegalArgumentException("page must be >= 0 and size must be > 0");
        }
        int pageSize = Math.min(size, MAX_PAGE_SIZE);
        List<SubmissionSummary> summaries = summaryRepository.findAllByOrderByTotalTokensDescIdAsc(
            PageRequest.of(page, pageSize));

        Map<String, UserAccount> users = userAccountRepository
            .findAllById(summaries.stream().map(SubmissionSummary::userId).toList())
            .stream()
            .collect(Collectors.toMap(UserAccount::id, Function.identity()));

        List<LeaderboardEntry> entries = new ArrayList<>(summaries.size());
        int rank = page * pageSize;
        for (SubmissionSummary summary : summaries) {
            rank++;
            UserAccount user = users.get(summary.userId());
            if (user == null) {
                log.warn("Leaderboard entry without user account: userId={}", summary.userId());
                continue;
            }
            entries.add(new LeaderboardEntry(rank, user.username(), user.displayName(),
                summary.totalTokens(), summary.totalCost(), summary.activeDays(), orEmpty(summary.sourcesUsed())));
        }
        log.info("Leaderboard query: page={}, size={}, found {} entries", page, pageSize, entries.size());
        return entries;
    }

    private UserAccount findUser(String username) {
        return userAccountRepository.findByUsername(username)
            .orElseThrow(() -> new UserNotFoundException(username));
    }

    private DailyBreakdownResponse toResponse(DailyBreakdown day) {
        UsageTotals totals = day.totals() != null ? day.totals() : UsageTotals.ZERO;

        Map<String, UsageAmount> sources = new TreeMap<>();
        if (day.sourceBreakdown() != null) {
            day.sourceBreakdown().forEach((source, breakdown) -> sources.put(source, toAmount(breakdown.totals())));
        }
        Map<String, UsageAmount> models = new TreeMap<>();
        if (day.modelBreakdown() != null) {
            day.modelBreakdown().forEach((model, modelTotals) -> models.put(model, toAmount(modelTotals)));
        }

        return new DailyBreakdownResponse(day.date(), totals.totalTokens(), totals.cost(), totals.messages(),
            totals.tokens(), sources, models);
    }

    private static UsageAmount toAmount(UsageTotals totals) {
        UsageTotals safe = totals != null ? totals : UsageTotals.ZERO;
        return new UsageAmount(safe.totalTokens(), safe.cost());
    }

    private static List<String> orEmpty(List<String> values) {
        return values != null ? values : List.of();
    }
}
