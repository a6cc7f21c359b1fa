package com.gastrofeed.catalog.service.merge;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counters produced by one {@link SourceMerger} run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MergeStatistics {
    /** Per-source counters, in the order sources were merged */
    private final Map<String, SourceCounts> sources = new LinkedHashMap<>();

    /** Sources ignored because their table had no code column */
    private final List<String> skippedSources = new ArrayList<>();

    private final List<String> warnings = new ArrayList<>();

    private int totalProducts;

    /** Primary-only records retained (after the optional category filter) */
    private int kept;

    /** Primary-only records dropped by the category filter */
    private int removed;

    public static class SourceCounts {
        private int added;
        private int updated;

        public int getAdded() { return added; }
        public int getUpdated() { return updated; }
    }

    SourceCounts source(String name) {
        return sources.computeIfAbsent(name, k -> new SourceCounts());
    }

    void recordAdded(String source) {
        source(source).added++;
    }

    void recordUpdated(String source) {
        source(source).updated++;
    }

    void skipSource(String source, String reason) {
        skippedSources.add(source);
        warnings.add(reason);
    }

    void warn(String message) {
        warnings.add(message);
    }

    public int getAdded(String source) {
        SourceCounts c = sources.get(source);
        return c != null ? c.added : 0;
    }

    public int getUpdated(String source) {
        SourceCounts c = sources.get(source);
        return c != null ? c.updated : 0;
    }

    public int getTotalAdded() {
        return sources.values().stream().mapToInt(c -> c.added).sum();
    }

    public int getTotalUpdated() {
        return sources.values().stream().mapToInt(c -> c.updated).sum();
    }

    public Map<String, SourceCounts> getSources() { return Collections.unmodifiableMap(sources); }
    public List<String> getSkippedSources() { return Collections.unmodifiableList(skippedSources); }
    public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }
    public int getTotalProducts() { return totalProducts; }
    void setTotalProducts(int totalProducts) { this.totalProducts = totalProducts; }
    public int getKept() { return kept; }
    void setKept(int kept) { this.kept = kept; }
    public int getRemoved() { return removed; }
    void setRemoved(int removed) { this.removed = removed; }

    @Override
    public String toString() {
        return String.format("added=%d updated=%d kept=%d removed=%d total=%d skipped=%s",
                getTotalAdded(), getTotalUpdated(), kept, removed, totalProducts, skippedSources);
    }
}
