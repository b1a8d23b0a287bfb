package io.github.samzhu.tokenboard.repository;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.tokenboard.document.SubmissionSummary;

/**
 * 用戶累計統計資料存取介面。
 */
public interface SubmissionSummaryRepository extends MongoRepository<SubmissionSummary, String> {

    /**
     * 排行榜查詢：依總 tokens 降序，同分時依用戶 ID 升序，使分頁結果穩定。
     *
     * @param pageable 分頁參數
     * @return 該頁的用戶累計統計
     */
    List<SubmissionSummary> findAllByOrderByTotalTokensDescIdAsc(Pageable pageable);
}
