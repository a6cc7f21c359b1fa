package com.gastrofeed.catalog.service.variant;

import com.gastrofeed.catalog.config.CatalogProperties;
import com.gastrofeed.catalog.model.ProductRecord;
import com.gastrofeed.catalog.model.ProductTable;
import com.gastrofeed.catalog.model.VariantGroup;
import com.gastrofeed.catalog.model.VariantMember;
import com.gastrofeed.catalog.util.NaturalOrder;
import com.gastrofeed.catalog.util.SequenceSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Detects variant families by base-name similarity and links their members to a parent.
 *
 * <h3>Candidates</h3>
 * Records without a parent, not already used as someone's parent, and not excluded (by
 * default: manufacturer on the block-list). Records whose base name is empty are dropped.
 *
 * <h3>Grouping</h3>
 * One greedy pass in table order. A record opens a group only if its base name has at least
 * {@code minBaseNameLength} characters. Each later unassigned record joins when the length
 * ratio of the two base names is at least {@code minLengthRatio} and their similarity is
 * strictly above {@code similarityThreshold}. Assignment is final; singletons are dropped.
 *
 * <h3>Parent</h3>
 * The member with the natural-sort smallest code ({@code A2} before {@code A10}).
 */
@Service
public class VariantMatcher {
    private static final Logger log = LoggerFactory.getLogger(VariantMatcher.class);

    private final CatalogProperties.Variants config;
    private final DifferenceExtractionPipeline differences;
    private Predicate<ProductRecord> exclusion;

    public VariantMatcher(CatalogProperties properties, DifferenceExtractionPipeline differences) {
        this.config = properties.getVariants();
        this.differences = differences;
        this.exclusion = manufacturerBlockList(config.getExcludedManufacturers());
    }

    /**
     * Replaces the default manufacturer block-list.
     */
    public void setExclusion(Predicate<ProductRecord> exclusion) {
        this.exclusion = exclusion != null ? exclusion : r -> false;
    }

    static Predicate<ProductRecord> manufacturerBlockList(List<String> manufacturers) {
        List<String> blocked = new ArrayList<>();
        if (manufacturers != null) {
            for (String m : manufacturers) {
                if (m != null && !m.isBlank()) blocked.add(m.trim().toLowerCase(Locale.ROOT));
            }
        }
        return r -> {
            String manufacturer = r.getManufacturer();
            if (manufacturer == null || blocked.isEmpty()) return false;
            String lower = manufacturer.toLowerCase(Locale.ROOT);
            return blocked.stream().anyMatch(lower::contains);
        };
    }

    /**
     * Groups, assigns parents (overwriting per {@code catalog.variants.override-conflicts}) and
     * extracts differences when enabled.
     */
    public VariantDetectionResult identify(ProductTable table) {
        List<VariantGroup> groups = analyze(table);
        if (groups.isEmpty()) {
            return new VariantDetectionResult(groups, 0, 0);
        }
        int assigned = assign(table, groups, config.isOverrideConflicts());
        int extracted = config.isExtractDifferences() ? differences.extract(table, groups) : 0;
        return new VariantDetectionResult(groups, assigned, extracted);
    }

    /**
     * Computes variant groups without touching the table.
     */
    public List<VariantGroup> analyze(ProductTable table) {
        if (!table.hasColumn(ProductTable.CODE) || !table.hasColumn(ProductTable.NAME)) {
            log.warn("Required columns missing for variant analysis");
            return List.of();
        }

        Set<String> usedAsParent = new HashSet<>();
        for (ProductRecord r : table.getRecords()) {
            if (r.hasParent()) usedAsParent.add(r.getParentCode().trim());
        }

        List<VariantMember> candidates = new ArrayList<>();
        for (ProductRecord r : table.getRecords()) {
            String code = r.getCode();
            if (code == null || code.isBlank()) continue;
            if (r.hasParent() || usedAsParent.contains(code) || exclusion.test(r)) continue;
            String base = BaseNameExtractor.extractBaseName(r.getName());
            if (base.isEmpty()) continue;
            candidates.add(new VariantMember(code, r.getName(), base, false));
        }
        if (candidates.size() < 2) {
            log.info("No suitable products for variant analysis");
            return List.of();
        }

        List<List<VariantMember>> clusters = cluster(candidates);

        List<VariantGroup> groups = new ArrayList<>();
        int variants = 0;
        for (List<VariantMember> cluster : clusters) {
            if (cluster.size() < 2) continue;
            List<String> codes = new ArrayList<>();
            for (VariantMember m : cluster) codes.add(m.getCode());
            String parent = NaturalOrder.smallest(codes).orElseThrow();
            VariantGroup group = new VariantGroup(groups.size() + 1, parent);
            for (VariantMember m : cluster) {
                group.addMember(new VariantMember(m.getCode(), m.getName(), m.getBaseName(), m.getCode().equals(parent)));
            }
            groups.add(group);
            variants += cluster.size();
        }

        if (groups.isEmpty()) {
            log.info("No product variants detected");
        } else {
            log.info("Detected {} variants in {} groups", variants, groups.size());
        }
        return groups;
    }

    private List<List<VariantMember>> cluster(List<VariantMember> candidates) {
        int minLength = config.getMinBaseNameLength();
        boolean[] visited = new boolean[candidates.size()];
        List<List<VariantMember>> clusters = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            if (visited[i]) continue;
            String base1 = candidates.get(i).getBaseName();
            if (base1.length() < minLength) continue;
            List<VariantMember> cluster = new ArrayList<>();
            cluster.add(candidates.get(i));
            visited[i] = true;
            for (int j = i + 1; j < candidates.size(); j++) {
                if (visited[j]) continue;
                String base2 = candidates.get(j).getBaseName();
                if (base2.length() < minLength) continue;
                if (joins(base1, base2)) {
                    cluster.add(candidates.get(j));
                    visited[j] = true;
                }
            }
            clusters.add(cluster);
        }
        return clusters;
    }

    boolean joins(String base1, String base2) {
        double lengthRatio = (double) Math.min(base1.length(), base2.length())
                / Math.max(base1.length(), base2.length());
        if (lengthRatio < config.getMinLengthRatio()) return false;
        return SequenceSimilarity.exceeds(base1, base2, config.getSimilarityThreshold());
    }

    /**
     * Points every non-parent member at its group's parent.
     *
     * @param override overwrite a different existing parent; otherwise keep it
     * @return number of records whose parent was set
     */
    public int assign(ProductTable table, List<VariantGroup> groups, boolean override) {
        Map<String, List<ProductRecord>> byCode = new LinkedHashMap<>();
        for (ProductRecord r : table.getRecords()) {
            if (r.getCode() != null && !r.getCode().isBlank()) {
                byCode.computeIfAbsent(r.getCode(), k -> new ArrayList<>()).add(r);
            }
        }
        int assigned = 0;
        for (VariantGroup group : groups) {
            String parent = group.getParentCode();
            if (parent == null || parent.isBlank()) continue;
            for (VariantMember member : group.getMembers()) {
                String code = member.getCode();
                if (code == null || code.isBlank() || code.equals(parent)) continue;
                for (ProductRecord r : byCode.getOrDefault(code, List.of())) {
                    if (override || !r.hasParent()) {
                        r.setParentCode(parent);
                        assigned++;
                    }
                }
            }
        }
        log.info("Assigned parent codes to {} products", assigned);
        return assigned;
    }
}
