package io.github.samzhu.tokenboard.dto.contribution;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 單日總計。
 */
public record DailyTotals(
    @PositiveOrZero long tokens,
    @NotNull @PositiveOrZero BigDecimal cost,
    @PositiveOrZero long messages
) {
}
