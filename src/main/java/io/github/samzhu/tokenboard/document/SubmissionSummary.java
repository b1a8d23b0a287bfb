package io.github.samzhu.tokenboard.document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.tokenboard.dto.TokenBreakdown;

/**
 * 用戶累計統計文件。
 *
 * <p>所有統計欄位在每次合併提交後，由該用戶全部 {@link DailyBreakdown} 重新計算而得，
 * 從不以累加方式更新。
 *
 * <p>文件 ID：直接使用 {@code userId}
 *
 * <p>{@code lockVersion} 在每次合併交易開始時以 {@code $inc} 更新，
 * 使同一用戶的並行交易在此文件上產生 write conflict 而序列化。
 *
 * @param id 文件 ID（= userId）
 * @param userId 用戶 ID
 * @param totalTokens 總 tokens
 * @param totalCost 總成本 (USD)
 * @param tokens token 細分總和
 * @param messages 訊息總數
 * @param activeDays tokens &gt; 0 的天數
 * @param dateStart 最早日期
 * @param dateEnd 最晚日期
 * @param sourcesUsed 使用過的來源（排序）
 * @param modelsUsed 使用過的模型（排序）
 * @param cliVersion 最近一次提交的 CLI 版本
 * @param submissionHash 最近一次提交的指紋
 * @param submitCount 提交次數
 * @param lockVersion 交易鎖版本
 * @param createdAt 第一次提交時間
 * @param updatedAt 最後更新時間
 */
@Document(collection = "submission_summary")
public record SubmissionSummary(
    @Id String id,
    String userId,
    long totalTokens,
    BigDecimal totalCost,
    TokenBreakdown tokens,
    long messages,
    int activeDays,
    String dateStart,
    String dateEnd,
    List<String> sourcesUsed,
    List<String> modelsUsed,
    String cliVersion,
    String submissionHash,
    int submitCount,
    long lockVersion,
    Instant createdAt,
    Instant updatedAt
) {
}
