package io.github.samzhu.tokenboard.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.BulkOperations.BulkMode;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import com.mongodb.MongoException;

import io.github.samzhu.tokenboard.config.TokenboardProperties;
import io.github.samzhu.tokenboard.document.ApiToken;
import io.github.samzhu.tokenboard.document.DailyBreakdown;
import io.github.samzhu.tokenboard.document.SubmissionSummary;
import io.github.samzhu.tokenboard.dto.DeviceIdentity;
import io.github.samzhu.tokenboard.dto.api.SubmissionMetrics;
import io.github.samzhu.tokenboard.dto.api.SubmitResponse;
import io.github.samzhu.tokenboard.dto.contribution.DailyContribution;
import io.github.samzhu.tokenboard.dto.contribution.DateRange;
import io.github.samzhu.tokenboard.dto.contribution.TokenContributionData;
import io.github.samzhu.tokenboard.exception.LedgerStoreException;
import io.github.samzhu.tokenboard.repository.DailyBreakdownRepository;
import io.github.samzhu.tokenboard.service.SubmissionMergeService.UserAggregate;

/**
 * 提交合併交易服務。
 *
 * <p>一次提交的所有寫入在同一個 MongoDB 交易中完成，任何錯誤都會中止整筆交易：
 * <ol>
 *   <li>更新 API token 的 {@code lastUsedAt}</li>
 *   <li>upsert 用戶累計文件並 {@code $inc lockVersion}，取得該文件的寫入鎖</li>
 *   <li>以 ID 批次載入本次涉及的日明細</li>
 *   <li>在記憶體中計算所有日明細的合併結果</li>
 *   <li>一次 insert 新的日明細、一次 ordered bulk replace 既有日明細</li>
 *   <li>讀取該用戶全部日明細，重算並寫回用戶累計</li>
 * </ol>
 *
 * <p>同一用戶的兩筆並行交易會在用戶累計文件上發生 write conflict，
 * 後者被中止並依 {@code tokenboard.submission} 設定整筆重試；不同用戶互不影響。
 * 重試耗盡時拋出 {@link LedgerStoreException}，呼叫端可原封不動重送。
 *
 * @see <a href="https://www.mongodb.com/docs/manual/core/transactions-in-applications/">Transactions in Applications</a>
 */
@Service
public class SubmissionService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate transactionTemplate;
    private final DailyBreakdownRepository dailyBreakdownRepository;
    private final SubmissionMergeService mergeService;
    private final Clock clock;
    private final int maxAttempts;
    private final long retryBackoffMs;

    public SubmissionService(MongoTemplate mongoTemplate,
                             TransactionTemplate transactionTemplate,
                             DailyBreakdownRepository dailyBreakdownRepository,
                             SubmissionMergeService mergeService,
                             Clock clock,
                             TokenboardProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.transactionTemplate = transactionTemplate;
        this.dailyBreakdownRepository = dailyBreakdownRepository;
        this.mergeService = mergeService;
        this.clock = clock;
        this.maxAttempts = properties.submission().maxAttempts();
        this.retryBackoffMs = properties.submission().retryBackoffMs();
    }

    /**
     * 合併一台裝置的提交。
     *
     * @param identity 提交裝置
     * @param data 已驗證的提交內容
     * @param fingerprint 提交指紋
     * @param warnings 驗證警告，原樣回傳給呼叫端
     * @return 提交結果
     * @throws LedgerStoreException 交易重試耗盡或資料庫錯誤
     */
    public SubmitResponse submit(DeviceIdentity identity, TokenContributionData data,
                                 String fingerprint, List<String> warnings) {
        log.info("Merging submission: user={}, device={}, days={}",
            identity.username(), identity.tokenId(), data.contributions().size());

        for (int attempt = 1; ; attempt++) {
            try {
                MergeOutcome outcome = transactionTemplate.execute(
                    status -> mergeInTransaction(identity, data, fingerprint));
                log.info("Submission merged: user={}, mode={}, totalTokens={}, attempt={}",
                    identity.username(), outcome.mode(), outcome.summary().totalTokens(), attempt);
                return toResponse(identity, outcome, warnings);
            } catch (RuntimeException e) {
                if (!isRetryable(e)) {
                    if (e instanceof DataAccessException || e instanceof MongoException) {
                        log.error("Submission store failed: user={}, attempt={}", identity.username(), attempt, e);
                        throw new LedgerStoreException(identity.userId(), attempt, e);
                    }
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.error("Submission retries exhausted: user={}, attempts={}", identity.username(), attempt, e);
                    throw new LedgerStoreException(identity.userId(), attempt, e);
                }
                log.warn("Transient failure merging submission, retrying: user={}, attempt={}, error={}",
                    identity.username(), attempt, e.getMessage());
                backoff(identity, attempt, e);
            }
        }
    }

    private MergeOutcome mergeInTransaction(DeviceIdentity identity, TokenContributionData data, String fingerprint) {
        Instant now = clock.instant();
        String userId = identity.userId();

        mongoTemplate.updateFirst(
            Query.query(Criteria.where("_id").is(identity.tokenId())),
            new Update().set("lastUsedAt", now),
            ApiToken.class);

        // 取得用戶累計文件的寫入鎖；submitCount 為 0 表示本次交易才建立
        SubmissionSummary locked = mongoTemplate.findAndModify(
            Query.query(Criteria.where("_id").is(userId)),
            new Update()
                .inc("lockVersion", 1)
                .setOnInsert("userId", userId)
                .setOnInsert("submitCount", 0)
                .setOnInsert("createdAt", now),
            FindAndModifyOptions.options().upsert(true).returnNew(true),
            SubmissionSummary.class);
        boolean created = locked == null || locked.submitCount() == 0;

        List<DailyContribution> days = data.contributions().stream()
            .sorted(Comparator.comparing(DailyContribution::date))
            .toList();
        List<String> ids = days.stream()
            .map(day -> DailyBreakdown.createId(LocalDate.parse(day.date()), userId))
            .toList();
        Map<String, DailyBreakdown> existing = dailyBreakdownRepository.findByIdIn(ids).stream()
            .collect(Collectors.toMap(DailyBreakdown::id, Function.identity()));

        List<DailyBreakdown> inserts = new ArrayList<>();
        List<DailyBreakdown> replacements = new ArrayList<>();
        for (DailyContribution day : days) {
            DailyBreakdown current = existing.get(DailyBreakdown.createId(LocalDate.parse(day.date()), userId));
            DailyBreakdown merged = mergeService.mergeDay(current, userId, identity.tokenId(), day, now);
            if (current == null) {
                inserts.add(merged);
            } else {
                replacements.add(merged);
            }
        }
        writeDays(inserts, replacements);

        UserAggregate aggregate = mergeService.summarize(dailyBreakdownRepository.findByUserId(userId));
        SubmissionSummary summary = new SubmissionSummary(
            userId,
            userId,
            aggregate.totalTokens(),
            aggregate.totalCost(),
            aggregate.tokens(),
            aggregate.messages(),
            aggregate.activeDays(),
            aggregate.dateStart(),
            aggregate.dateEnd(),
            aggregate.sources(),
            aggregate.models(),
            data.meta().version(),
            fingerprint,
            (locked != null ? locked.submitCount() : 0) + 1,
            locked != null ? locked.lockVersion() : 1,
            locked != null && locked.createdAt() != null ? locked.createdAt() : now,
            now
        );
        mongoTemplate.save(summary);

        log.debug("Merged days: user={}, inserted={}, replaced={}", identity.username(),
            inserts.size(), replacements.size());
        return new MergeOutcome(summary, created ? SubmitResponse.MODE_CREATE : SubmitResponse.MODE_MERGE);
    }

    private void writeDays(List<DailyBreakdown> inserts, List<DailyBreakdown> replacements) {
        if (!inserts.isEmpty()) {
            mongoTemplate.insert(inserts, DailyBreakdown.class);
        }
        if (!replacements.isEmpty()) {
            BulkOperations bulkOps = mongoTemplate.bulkOps(BulkMode.ORDERED, DailyBreakdown.class);
            for (DailyBreakdown day : replacements) {
                bulkOps.replaceOne(Query.query(Criteria.where("_id").is(day.id())), day);
            }
            bulkOps.execute();
        }
    }

    private SubmitResponse toResponse(DeviceIdentity identity, MergeOutcome outcome, List<String> warnings) {
        SubmissionSummary summary = outcome.summary();
        DateRange range = summary.dateStart() != null
            ? new DateRange(summary.dateStart(), summary.dateEnd())
            : DateRange.empty();
        SubmissionMetrics metrics = new SubmissionMetrics(
            summary.totalTokens(),
            summary.totalCost(),
            range,
            summary.activeDays(),
            summary.sourcesUsed()
        );
        return new SubmitResponse(true, summary.id(), identity.username(), metrics, outcome.mode(),
            warnings == null || warnings.isEmpty() ? null : warnings);
    }

    /**
     * 判斷錯誤是否可整筆重試：交易衝突、commit 結果未知、暫時性存取錯誤，
     * 或並行建立同一天文件造成的 duplicate key。
     */
    static boolean isRetryable(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TransientDataAccessException || t instanceof DuplicateKeyException) {
                return true;
            }
            if (t instanceof MongoException mongoException
                    && (mongoException.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)
                        || mongoException.hasErrorLabel(MongoException.UNKNOWN_TRANSACTION_COMMIT_RESULT_LABEL))) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private void backoff(DeviceIdentity identity, int attempt, RuntimeException cause) {
        if (retryBackoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(retryBackoffMs * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerStoreException(identity.userId(), attempt, cause);
        }
    }

    private record MergeOutcome(SubmissionSummary summary, String mode) {
    }
}
