package io.github.samzhu.tokenboard.dto.contribution;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonInclude;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

import io.github.samzhu.tokenboard.dto.TokenBreakdown;

/**
 * 單日內某個 (source, modelId) 組合的用量。
 *
 * @param source 來源產品
 * @param modelId 模型名稱
 * @param providerId 供應商 ID，可省略
 * @param tokens token 細分
 * @param cost 成本 (USD)
 * @param messages 訊息數
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceContribution(
    @NotNull @Pattern(regexp = SourceContribution.SOURCE_PATTERN) String source,
    @NotBlank String modelId,
    String providerId,
    @NotNull @Valid TokenBreakdown tokens,
    @NotNull @PositiveOrZero BigDecimal cost,
    @PositiveOrZero long messages
) {
    /** 允許的來源產品 */
    public static final String SOURCE_PATTERN = "^(opencode|claude|codex|gemini|cursor|amp|droid)$";

    public SourceContribution withModelId(String newModelId) {
        return new SourceContribution(source, newModelId, providerId, tokens, cost, messages);
    }
}
