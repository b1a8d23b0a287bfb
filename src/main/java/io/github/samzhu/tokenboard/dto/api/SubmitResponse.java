package io.github.samzhu.tokenboard.dto.api;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 提交成功回應。
 *
 * @param success 固定為 true
 * @param submissionId 用戶累計文件 ID
 * @param username 用戶名稱
 * @param metrics 合併後的用戶累計統計
 * @param mode {@code create}（第一次提交）或 {@code merge}
 * @param warnings 驗證警告，沒有時省略
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmitResponse(
    boolean success,
    String submissionId,
    String username,
    SubmissionMetrics metrics,
    String mode,
    List<String> warnings
) {
    public static final String MODE_CREATE = "create";
    public static final String MODE_MERGE = "merge";
}
