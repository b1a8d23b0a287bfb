package io.github.samzhu.tokenboard.dto.api;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 錯誤回應：{@code {"error": "...", "details": [...]}}，沒有細節時省略 details。
 *
 * @param error 錯誤訊息
 * @param details 錯誤細節
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
    String error,
    List<String> details
) {
    public static ApiErrorResponse of(String error) {
        return new ApiErrorResponse(error, null);
    }
}
