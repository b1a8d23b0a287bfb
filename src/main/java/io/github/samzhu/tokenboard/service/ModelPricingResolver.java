package io.github.samzhu.tokenboard.service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.tokenboard.dto.PricingEntry;
import io.github.samzhu.tokenboard.dto.PricingTable;

/**
 * 模型定價解析服務。
 *
 * <p>將原始模型名稱對應到定價表中的一筆定價，依序嘗試（先命中者勝出）：
 * <ol>
 *   <li>完全比對 key</li>
 *   <li>加上供應商前綴：{@code anthropic/}、{@code openai/}、{@code google/}、{@code bedrock/}</li>
 *   <li>以正規化後的名稱重複上述兩步</li>
 *   <li>不分大小寫的字詞邊界子字串比對，依 key 排序順序掃描：
 *       先找「key 出現在查詢中」，再找「查詢出現在 key 中」</li>
 * </ol>
 *
 * <p>模糊比對的優先順序是位置性的（排序後第一個符合者），並非語意上的「最佳」比對。
 * 相同查詢與相同定價表永遠得到相同結果，結果快取在 {@link PricingTable} 上。
 *
 * <p>正規化規則：
 * <pre>
 * 1. 轉小寫
 * 2. 移除日期後綴：-20250514、@20250514、-2025-05-14
 * 3. 已知模型家族對應到標準名稱（opus-4-5、sonnet-4、gpt-4o、gemini-2.5-pro ...）
 * 4. 其餘情況將 '.' 與 '_' 換成 '-'
 * </pre>
 */
@Service
public class ModelPricingResolver {

    private static final Logger log = LoggerFactory.getLogger(ModelPricingResolver.class);

    static final List<String> PROVIDER_PREFIXES = List.of("anthropic/", "openai/", "google/", "bedrock/");

    private static final Pattern DATE_SUFFIX = Pattern.compile("(?:[-@]\\d{8}|-\\d{4}-\\d{2}-\\d{2})$");

    /**
     * 解析模型定價，結果會快取於定價表。
     *
     * @param modelId 原始模型名稱
     * @param table 定價表
     * @return 命中的定價，找不到時為 empty
     */
    public Optional<PricingEntry> resolve(String modelId, PricingTable table) {
        if (modelId == null || modelId.isEmpty() || table == null || table.isEmpty()) {
            return Optional.empty();
        }
        return table.resolveCached(modelId, id -> lookup(id, table));
    }

    private Optional<PricingEntry> lookup(String modelId, PricingTable table) {
        Optional<PricingEntry> direct = lookupWithPrefixes(modelId, table);
        if (direct.isPresent()) {
            return direct;
        }

        Optional<String> normalized = normalize(modelId);
        if (normalized.isPresent()) {
            Optional<PricingEntry> byNormalized = lookupWithPrefixes(normalized.get(), table);
            if (byNormalized.isPresent()) {
                log.debug("Resolved pricing by normalized name: {} -> {}", modelId, normalized.get());
                return byNormalized;
            }
        }

        String lowerQuery = modelId.toLowerCase(Locale.ROOT);
        String lowerNormalized = normalized.map(n -> n.toLowerCase(Locale.ROOT)).orElse(null);
        List<String> keys = table.sortedKeys();

        // key 出現在查詢中
        for (int i = 0; i < keys.size(); i++) {
            String lowerKey = table.lowercaseKeyAt(i);
            if (containsWord(lowerQuery, lowerKey)
                    || (lowerNormalized != null && containsWord(lowerNormalized, lowerKey))) {
                log.debug("Fuzzy matched pricing (key in query): {} -> {}", modelId, keys.get(i));
                return table.get(keys.get(i));
            }
        }

        // 查詢出現在 key 中
        for (int i = 0; i < keys.size(); i++) {
            String lowerKey = table.lowercaseKeyAt(i);
            if (containsWord(lowerKey, lowerQuery)
                    || (lowerNormalized != null && containsWord(lowerKey, lowerNormalized))) {
                log.debug("Fuzzy matched pricing (query in key): {} -> {}", modelId, keys.get(i));
                return table.get(keys.get(i));
            }
        }

        log.debug("No pricing found for model: {}", modelId);
        return Optional.empty();
    }

    private Optional<PricingEntry> lookupWithPrefixes(String modelId, PricingTable table) {
        if (table.containsKey(modelId)) {
            return table.get(modelId);
        }
        for (String prefix : PROVIDER_PREFIXES) {
            String key = prefix + modelId;
            if (table.containsKey(key)) {
                return table.get(key);
            }
        }
        return Optional.empty();
    }

    /**
     * 正規化模型名稱。
     *
     * @param modelId 原始模型名稱
     * @return 正規化後的名稱；若與原始名稱相同則為 empty
     */
    static Optional<String> normalize(String modelId) {
        String lower = DATE_SUFFIX.matcher(modelId.toLowerCase(Locale.ROOT)).replaceFirst("");

        String normalized = canonicalFamily(lower);
        if (normalized == null) {
            normalized = lower.replace('.', '-').replace('_', '-');
        }
        return normalized.equals(modelId) ? Optional.empty() : Optional.of(normalized);
    }

    private static String canonicalFamily(String lower) {
        if (lower.contains("opus")) {
            if (lower.contains("4.5") || lower.contains("4-5")) {
                return "opus-4-5";
            } else if (lower.contains("4")) {
                return "opus-4";
            }
        }
        if (lower.contains("sonnet")) {
            if (lower.contains("4.5") || lower.contains("4-5")) {
                return "sonnet-4-5";
            } else if (lower.contains("3.7") || lower.contains("3-7")) {
                return "sonnet-3-7";
            } else if (lower.contains("3.5") || lower.contains("3-5")) {
                return "sonnet-3-5";
            } else if (lower.contains("4")) {
                return "sonnet-4";
            }
        }
        if (lower.contains("haiku") && (lower.contains("4.5") || lower.contains("4-5"))) {
            return "haiku-4-5";
        }
        if (lower.equals("o3")) {
            return "o3";
        }
        if (lower.startsWith("gpt-4o")) {
            return "gpt-4o";
        }
        if (lower.contains("gpt-4.1")) {
            return "gpt-4.1";
        }
        if (lower.contains("gemini-2.5-pro")) {
            return "gemini-2.5-pro";
        }
        if (lower.contains("gemini-2.5-flash")) {
            return "gemini-2.5-flash";
        }
        return null;
    }

    /**
     * 判斷 needle 是否以字詞邊界出現在 haystack 中。
     *
     * <p>邊界定義為字串首尾或非 {@code [a-zA-Z0-9]} 的字元。只檢查第一個出現位置：
     * 第一次出現不在邊界上即視為不符，例如 {@code "o3"} 不符合 {@code "foo3-o3"}。
     */
    static boolean containsWord(String haystack, String needle) {
        if (needle.isEmpty()) {
            return false;
        }
        int index = haystack.indexOf(needle);
        if (index < 0) {
            return false;
        }
        int end = index + needle.length();
        boolean leftOk = index == 0 || !isAlphanumeric(haystack.charAt(index - 1));
        boolean rightOk = end == haystack.length() || !isAlphanumeric(haystack.charAt(end));
        return leftOk && rightOk;
    }

    private static boolean isAlphanumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
