package io.github.samzhu.tokenboard.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.tokenboard.document.DailyBreakdown;

/**
 * 用戶日明細資料存取介面。
 *
 * <p>提供對 {@code daily_breakdown} 集合的查詢。寫入透過
 * {@link io.github.samzhu.tokenboard.service.SubmissionService} 使用 MongoTemplate 批次完成。
 *
 * @see io.github.samzhu.tokenboard.document.DailyBreakdown
 */
public interface DailyBreakdownRepository extends MongoRepository<DailyBreakdown, String> {

    /**
     * 批次查詢多筆文件。
     *
     * @param ids 複合 ID 列表，格式為 {@code YYYY-MM-DD_userId}
     * @return 符合條件的文件列表
     */
    List<DailyBreakdown> findByIdIn(List<String> ids);

    /**
     * 查詢特定用戶的全部日明細，用於重算用戶累計統計。
     *
     * @param userId 用戶 ID
     * @return 該用戶的所有日明細
     */
    List<DailyBreakdown> findByUserId(String userId);
}
