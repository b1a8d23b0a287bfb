package io.github.samzhu.tokenboard.dto;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 不可變的模型定價表。
 *
 * <p>Key 依字典序排序保存，模糊比對時依此順序掃描，
 * 因此相同查詢在相同定價表上永遠得到相同結果。
 * 每個查詢字串的解析結果會被快取。
 */
public final class PricingTable {

    private static final PricingTable EMPTY = new PricingTable(Map.of());

    private final TreeMap<String, PricingEntry> entries;
    private final List<String> sortedKeys;
    private final List<String> lowercaseKeys;
    private final Map<String, Optional<PricingEntry>> resolutions = new ConcurrentHashMap<>();

    private PricingTable(Map<String, PricingEntry> entries) {
        this.entries = new TreeMap<>(entries);
        this.sortedKeys = List.copyOf(this.entries.keySet());
        this.lowercaseKeys = sortedKeys.stream()
            .map(key -> key.toLowerCase(Locale.ROOT))
            .toList();
    }

    public static PricingTable empty() {
        return EMPTY;
    }

    /**
     * 由 key → 定價的對照表建立。
     */
    public static PricingTable of(Map<String, PricingEntry> entries) {
        return new PricingTable(entries);
    }

    /**
     * 由定價列表建立，以 {@link PricingEntry#modelId()} 為 key；重複 key 以後者為準。
     */
    public static PricingTable fromEntries(Collection<PricingEntry> entries) {
        TreeMap<String, PricingEntry> map = new TreeMap<>();
        for (PricingEntry entry : entries) {
            if (entry != null && entry.modelId() != null) {
                map.put(entry.modelId(), entry);
            }
        }
        return new PricingTable(map);
    }

    public Optional<PricingEntry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    /**
     * 依排序順序回傳所有 key。
     */
    public List<String> sortedKeys() {
        return Collections.unmodifiableList(sortedKeys);
    }

    /**
     * 取得第 i 個（排序後）key 的小寫形式。
     */
    public String lowercaseKeyAt(int index) {
        return lowercaseKeys.get(index);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * 取得快取的解析結果，未命中時以 resolver 計算並快取。
     *
     * @param modelId 查詢字串
     * @param resolver 解析函式
     * @return 解析結果
     */
    public Optional<PricingEntry> resolveCached(String modelId,
            Function<String, Optional<PricingEntry>> resolver) {
        return resolutions.computeIfAbsent(modelId, resolver);
    }
}
