package io.github.samzhu.tokenboard.dto;

import jakarta.validation.constraints.PositiveOrZero;

/**
 * Token 用量細分。
 *
 * <p>五個欄位皆為非負整數，以逐欄相加組合（{@link #ZERO} 為單位元素），
 * 所有彙總計算皆透過 {@link #plus(TokenBreakdown)} 進行。
 * JSON 中缺少的欄位反序列化為 0。
 *
 * @param input 非快取輸入 tokens
 * @param output 輸出 tokens
 * @param cacheRead 快取讀取 tokens
 * @param cacheWrite 快取寫入 tokens
 * @param reasoning 推理 tokens（以輸出單價計費）
 */
public record TokenBreakdown(
    @PositiveOrZero long input,
    @PositiveOrZero long output,
    @PositiveOrZero long cacheRead,
    @PositiveOrZero long cacheWrite,
    @PositiveOrZero long reasoning
) {
    public static final TokenBreakdown ZERO = new TokenBreakdown(0, 0, 0, 0, 0);

    /**
     * 五個欄位的總和。
     *
     * @throws ArithmeticException 總和超出 {@code long} 範圍
     */
    public long total() {
        return Math.addExact(Math.addExact(Math.addExact(Math.addExact(input, output), cacheRead), cacheWrite),
            reasoning);
    }

    /**
     * 逐欄相加。
     *
     * @param other 另一筆細分，null 視為 {@link #ZERO}
     * @return 新的細分
     * @throws ArithmeticException 任一欄位超出 {@code long} 範圍
     */
    public TokenBreakdown plus(TokenBreakdown other) {
        if (other == null) {
            return this;
        }
        return new TokenBreakdown(
            Math.addExact(input, other.input),
            Math.addExact(output, other.output),
            Math.addExact(cacheRead, other.cacheRead),
            Math.addExact(cacheWrite, other.cacheWrite),
            Math.addExact(reasoning, other.reasoning)
        );
    }

    /**
     * null-safe 取值，null 視為 {@link #ZERO}。
     */
    public static TokenBreakdown orZero(TokenBreakdown tokens) {
        return tokens != null ? tokens : ZERO;
    }
}
