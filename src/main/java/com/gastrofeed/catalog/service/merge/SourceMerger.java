package com.gastrofeed.catalog.service.merge;

import com.gastrofeed.catalog.model.ProductRecord;
import com.gastrofeed.catalog.model.ProductTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Merges the primary catalog with named secondary feeds into one canonical table keyed by
 * product code.
 *
 * <h3>Policy</h3>
 * <ol>
 *   <li>Codes are trimmed and upper-cased in every input; inputs are never mutated</li>
 *   <li>Within one source, primary included, the first row of a code wins and takes the
 *       last price given for that code</li>
 *   <li>Primary records seed the table in their original order</li>
 *   <li>Secondary feeds are applied in caller order; a new code is appended and tagged
 *       with the feed name</li>
 *   <li>For a known code, a feed offering more images replaces the image slots (and the
 *       price, when it has one) but no other field</li>
 *   <li>Otherwise only a numerically different price is copied</li>
 * </ol>
 *
 * <p>A record counts as updated only when its price or images actually changed, so merging
 * the same feed twice is a no-op the second time.
 */
@Service
public class SourceMerger {
    private static final Logger log = LoggerFactory.getLogger(SourceMerger.class);

    /** Tag of records that came from the primary catalog. */
    public static final String PRIMARY_SOURCE = "main";

    private final Clock clock;

    public SourceMerger(Clock clock) {
        this.clock = clock;
    }

    public MergeResult merge(ProductTable primary, Map<String, ProductTable> secondary) {
        return merge(primary, secondary, null);
    }

    /**
     * Merges and then filters primary-only records by raw category.
     *
     * @param selectedCategories raw categories to keep; {@code null} keeps everything. Records
     *                           touched by a feed are always kept.
     */
    public MergeResult merge(ProductTable primary, Map<String, ProductTable> secondary,
                             Collection<String> selectedCategories) {
        MergeStatistics stats = new MergeStatistics();
        ProductTable base = primary != null ? primary : ProductTable.empty();
        if (!base.hasColumn(ProductTable.CODE)) {
            String msg = "Primary table has no code column, returning it unchanged";
            log.warn(msg);
            stats.warn(msg);
            stats.setTotalProducts(base.size());
            return new MergeResult(base, stats);
        }

        Instant now = clock.instant();
        Set<String> columns = new LinkedHashSet<>(base.getColumns());
        Map<String, ProductRecord> merged = new LinkedHashMap<>();
        Set<String> primaryCodes = new HashSet<>();
        for (ProductRecord copy : dedupe(base)) {
            if (copy.getSourceTag() == null || copy.getSourceTag().isBlank()) {
                copy.setSourceTag(PRIMARY_SOURCE);
            }
            merged.put(copy.getCode(), copy);
            primaryCodes.add(copy.getCode());
        }

        Set<String> touchedByFeed = new HashSet<>();
        if (secondary != null) {
            for (Map.Entry<String, ProductTable> e : secondary.entrySet()) {
                String source = e.getKey();
                ProductTable table = e.getValue();
                if (table == null || !table.hasColumn(ProductTable.CODE)) {
                    String msg = String.format("Source '%s' has no code column, skipped", source);
                    log.warn(msg);
                    stats.skipSource(source, msg);
                    continue;
                }
                stats.source(source);
                columns.addAll(table.getColumns());
                for (ProductRecord incoming : dedupe(table)) {
                    touchedByFeed.add(incoming.getCode());
                    applyRecord(merged, incoming, source, now, stats);
                }
                log.info("Merged source {}: added={}, updated={}",
                        source, stats.getAdded(source), stats.getUpdated(source));
            }
        }

        int kept = 0;
        int removed = 0;
        List<ProductRecord> out = new ArrayList<>(merged.size());
        for (ProductRecord r : merged.values()) {
            boolean primaryOnly = primaryCodes.contains(r.getCode()) && !touchedByFeed.contains(r.getCode());
            if (primaryOnly) {
                if (selectedCategories != null && !selectedCategories.contains(r.getCategory())) {
                    removed++;
                    continue;
                }
                kept++;
            }
            out.add(r);
        }
        stats.setKept(kept);
        stats.setRemoved(removed);
        stats.setTotalProducts(out.size());
        if (selectedCategories != null) {
            log.info("Category filter: {} categories selected, kept={}, removed={}",
                    selectedCategories.size(), kept, removed);
        }
        log.info("Merge finished: {}", stats);
        return new MergeResult(new ProductTable(columns, out), stats);
    }

    private void applyRecord(Map<String, ProductRecord> merged, ProductRecord incoming, String source,
                             Instant now, MergeStatistics stats) {
        ProductRecord existing = merged.get(incoming.getCode());
        if (existing == null) {
            incoming.setSourceTag(source);
            incoming.setLastUpdated(now);
            merged.put(incoming.getCode(), incoming);
            stats.recordAdded(source);
            return;
        }

        boolean changed = false;
        if (incoming.imageCount() > existing.imageCount()) {
            existing.setImages(incoming.getImages());
            existing.setSourceTag(source);
            changed = true;
        }
        if (priceDiffers(existing.getPrice(), incoming.getPrice())) {
            existing.setPrice(incoming.getPrice());
            changed = true;
        }
        if (changed) {
            existing.setLastUpdated(now);
            stats.recordUpdated(source);
            log.debug("Updated {} from {}", existing.getCode(), source);
        }
    }

    /**
     * Keeps the first record per code and carries the last parseable price of that code
     * over to it.
     */
    private List<ProductRecord> dedupe(ProductTable table) {
        Map<String, ProductRecord> first = new LinkedHashMap<>();
        Map<String, BigDecimal> lastPrice = new LinkedHashMap<>();
        for (ProductRecord r : table.getRecords()) {
            String code = normalizeCode(r.getCode());
            if (code == null) continue;
            first.computeIfAbsent(code, k -> {
                ProductRecord copy = r.copy();
                copy.setCode(k);
                return copy;
            });
            if (r.getPrice() != null) {
                lastPrice.put(code, r.getPrice());
            }
        }
        lastPrice.forEach((code, price) -> first.get(code).setPrice(price));
        return new ArrayList<>(first.values());
    }

    private static boolean priceDiffers(BigDecimal current, BigDecimal candidate) {
        if (candidate == null) return false;
        return current == null || current.compareTo(candidate) != 0;
    }

    static String normalizeCode(String code) {
        if (code == null) return null;
        String c = code.trim().toUpperCase(Locale.ROOT);
        return c.isEmpty() ? null : c;
    }
}
