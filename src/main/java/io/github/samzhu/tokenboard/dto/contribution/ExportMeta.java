package io.github.samzhu.tokenboard.dto.contribution;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * 匯出資訊。
 *
 * @param generatedAt 產生時間（ISO-8601）
 * @param version 產生端版本
 * @param dateRange 資料涵蓋的日期區間
 */
public record ExportMeta(
    @NotNull String generatedAt,
    @NotNull String version,
    @NotNull @Valid DateRange dateRange
) {
}
