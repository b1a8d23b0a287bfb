package io.github.samzhu.tokenboard.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.tokenboard.dto.PricingEntry;
import io.github.samzhu.tokenboard.dto.PricingTable;

class ModelPricingResolverTest {

    private ModelPricingResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ModelPricingResolver();
    }

    @Test
    void shouldResolveExactKey() {
        // Given
        PricingTable table = table("claude-sonnet-4-20250514", "gpt-4o");

        // When
        Optional<PricingEntry> entry = resolver.resolve("claude-sonnet-4-20250514", table);

        // Then
        assertThat(entry).map(PricingEntry::modelId).contains("claude-sonnet-4-20250514");
    }

    @Test
    void shouldResolveUnderProviderPrefix() {
        // Given
        PricingTable table = table("anthropic/claude-3-5-sonnet-20241022", "openai/gpt-4o");

        // When & Then
        assertThat(resolver.resolve("claude-3-5-sonnet-20241022", table))
            .map(PricingEntry::modelId).contains("anthropic/claude-3-5-sonnet-20241022");
        assertThat(resolver.resolve("gpt-4o", table))
            .map(PricingEntry::modelId).contains("openai/gpt-4o");
    }

    @Test
    void shouldResolveByNormalizedPunctuation() {
        // Given: gpt_4o_mini → gpt-4o-mini
        PricingTable table = table("gpt-4o-mini");

        // When & Then
        assertThat(resolver.resolve("gpt_4o_mini", table)).map(PricingEntry::modelId).contains("gpt-4o-mini");
    }

    @Test
    void shouldStripDateSuffixAndMapFamily() {
        // Given
        PricingTable table = table("gpt-4.1", "openai/o3");

        // When & Then
        assertThat(resolver.resolve("GPT-4.1-2025-04-14", table)).map(PricingEntry::modelId).contains("gpt-4.1");
        assertThat(resolver.resolve("O3", table)).map(PricingEntry::modelId).contains("openai/o3");
    }

    @Test
    void shouldFuzzyMatchKeyInsideQueryOnWordBoundary() {
        // Given
        PricingTable table = table("claude-haiku-4-5", "claude-opus-4", "claude-sonnet-4", "gpt-4o");

        // When & Then
        assertThat(resolver.resolve("azure/gpt-4o-2024-08-06", table)).map(PricingEntry::modelId).contains("gpt-4o");
        assertThat(resolver.resolve("claude-sonnet-4-20250601", table))
            .map(PricingEntry::modelId).contains("claude-sonnet-4");
    }

    @Test
    void shouldNotMatchInsideAWord() {
        // Given
        PricingTable table = table("o3");

        // When & Then
        assertThat(resolver.resolve("o3-mini", table)).map(PricingEntry::modelId).contains("o3");
        assertThat(resolver.resolve("gpt-4o3", table)).isEmpty();
        assertThat(resolver.resolve("pro3x", table)).isEmpty();
    }

    @Test
    void keyInsideQueryShouldWinOverQueryInsideKey() {
        // Given: "aaa-claude-x" 排序在前，但只符合「查詢出現在 key 中」
        PricingTable table = table("aaa-claude-x", "claude");

        // When
        Optional<PricingEntry> entry = resolver.resolve("claude-x", table);

        // Then
        assertThat(entry).map(PricingEntry::modelId).contains("claude");
    }

    @Test
    void shouldFallBackToQueryInsideKey() {
        // Given
        PricingTable table = table("vendor/deepseek-chat-v3");

        // When & Then
        assertThat(resolver.resolve("DeepSeek-Chat", table))
            .map(PricingEntry::modelId).contains("vendor/deepseek-chat-v3");
    }

    @Test
    void fuzzyTiesShouldFollowSortedKeyOrder() {
        // Given: 兩個 key 都出現在查詢中，取排序較前者（位置優先，而非最精確）
        PricingTable table = table("mistral-large", "mistral");

        // When
        Optional<PricingEntry> entry = resolver.resolve("mistral-large-latest", table);

        // Then
        assertThat(entry).map(PricingEntry::modelId).contains("mistral");
    }

    @Test
    void shouldReturnEmptyForUnknownModel() {
        // Given
        PricingTable table = table("gpt-4o", "claude-opus-4");

        // When & Then
        assertThat(resolver.resolve("totally-unknown", table)).isEmpty();
        assertThat(resolver.resolve(null, table)).isEmpty();
        assertThat(resolver.resolve("gpt-4o", PricingTable.empty())).isEmpty();
    }

    @Test
    void resolutionShouldBeDeterministic() {
        // Given
        PricingTable first = table("claude-opus-4", "claude-sonnet-4", "gpt-4o");
        PricingTable second = table("gpt-4o", "claude-sonnet-4", "claude-opus-4");

        // When
        Optional<PricingEntry> a = resolver.resolve("claude-sonnet-4-5-20250929", first);
        Optional<PricingEntry> b = resolver.resolve("claude-sonnet-4-5-20250929", first);
        Optional<PricingEntry> c = resolver.resolve("claude-sonnet-4-5-20250929", second);

        // Then
        assertThat(a).isEqualTo(b).isEqualTo(c);
    }

    @Test
    void normalizeShouldReturnEmptyWhenUnchanged() {
        assertThat(ModelPricingResolver.normalize("gpt-4o")).isEmpty();
        assertThat(ModelPricingResolver.normalize("claude-opus-4-5-20251101")).contains("opus-4-5");
        assertThat(ModelPricingResolver.normalize("claude-3-7-sonnet@20250219")).contains("sonnet-3-7");
        assertThat(ModelPricingResolver.normalize("Gemini-2.5-Pro-Preview")).contains("gemini-2.5-pro");
    }

    @Test
    void containsWordShouldOnlyCheckFirstOccurrence() {
        // 第一個出現位置不在邊界上，即使後面的出現位置在邊界上也不符
        assertThat(ModelPricingResolver.containsWord("xgpt-gpt", "gpt")).isFalse();
        assertThat(ModelPricingResolver.containsWord("foo3-o3", "o3")).isFalse();
        assertThat(ModelPricingResolver.containsWord("gpt-xgpt", "gpt")).isTrue();
        assertThat(ModelPricingResolver.containsWord("xgpty", "gpt")).isFalse();
    }

    @Test
    void fuzzyMatchShouldIgnoreLaterBoundaryOccurrences() {
        // Given
        PricingTable table = table("o3");

        // When & Then
        assertThat(resolver.resolve("foo3-o3", table)).isEmpty();
        assertThat(resolver.resolve("o3-pro", table)).map(PricingEntry::modelId).contains("o3");
    }

    private static PricingTable table(String... keys) {
        Map<String, PricingEntry> entries = new LinkedHashMap<>();
        for (String key : keys) {
            entries.put(key, new PricingEntry(key, new BigDecimal("0.000001"), new BigDecimal("0.000002"), null, null));
        }
        return PricingTable.of(entries);
    }
}
