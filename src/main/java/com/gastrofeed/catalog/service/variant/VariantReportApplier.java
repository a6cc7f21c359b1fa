package com.gastrofeed.catalog.service.variant;

import com.gastrofeed.catalog.model.ProductRecord;
import com.gastrofeed.catalog.model.ProductTable;
import com.gastrofeed.catalog.model.VariantGroup;
import com.gastrofeed.catalog.model.VariantMember;
import com.gastrofeed.catalog.util.NaturalOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies an approved (possibly hand-edited) variant-groups report to the catalog.
 *
 * <p>Every code token in the report is compiled with {@link CatalogPattern} and matched
 * against the live codes:
 * <ul>
 *   <li>no match - recorded as unmatched, the member is skipped</li>
 *   <li>one match - resolved</li>
 *   <li>several matches - resolved to the natural-sort smallest, recorded as ambiguous</li>
 * </ul>
 * A group whose parent token is unmatched falls back to its smallest resolved member. A group
 * left with fewer than two products after resolution is dropped.
 * Members that already point at a different parent are overwritten or left alone depending
 * on the override flag; both outcomes are itemized in the {@link AssignmentSummary}.
 *
 * <p>The table is updated in place. Nothing here throws on bad tokens.
 */
@Service
public class VariantReportApplier {
    private static final Logger log = LoggerFactory.getLogger(VariantReportApplier.class);

    private final DifferenceExtractionPipeline differences;

    public VariantReportApplier(DifferenceExtractionPipeline differences) {
        this.differences = differences;
    }

    public VariantReportResult apply(ProductTable table, String reportText, boolean override, boolean extractDifferences) {
        return apply(table, VariantReportParser.parse(reportText), override, extractDifferences);
    }

    public VariantReportResult apply(ProductTable table, List<VariantGroup> rawGroups, boolean override, boolean extractDifferences) {
        AssignmentSummary summary = new AssignmentSummary();
        summary.setGroups(rawGroups.size());
        summary.setTotalProducts(rawGroups.stream().mapToInt(VariantGroup::size).sum());
        if (rawGroups.isEmpty()) {
            log.info("Variant report contains no groups");
            return new VariantReportResult(List.of(), summary);
        }

        CodeIndex index = new CodeIndex(table);
        List<VariantGroup> resolved = new ArrayList<>();

        for (VariantGroup raw : rawGroups) {
            int gid = raw.getGroupId();

            Map<String, VariantMember> members = new LinkedHashMap<>();
            for (VariantMember m : raw.getMembers()) {
                String token = m.getCode();
                List<String> matches = index.resolve(token);
                if (matches.isEmpty()) {
                    summary.getUnmatchedProducts().add(AssignmentIssue.unmatched(gid, token));
                    continue;
                }
                if (matches.size() > 1) {
                    summary.getAmbiguousProducts().add(AssignmentIssue.ambiguousProduct(gid, token, matches.size()));
                }
                String code = matches.get(0);
                members.computeIfAbsent(code, c -> index.member(c, m.getName()));
            }

            String parentToken = raw.getParentCode();
            List<String> parentMatches = parentToken == null || parentToken.isBlank()
                    ? List.of() : index.resolve(parentToken);
            String parent;
            if (parentMatches.isEmpty()) {
                if (parentToken != null && !parentToken.isBlank()) {
                    summary.getUnmatchedParents().add(AssignmentIssue.unmatched(gid, parentToken));
                }
                parent = NaturalOrder.smallest(members.keySet()).orElse(null);
            } else {
                parent = parentMatches.get(0);
                if (parentMatches.size() > 1) {
                    summary.getAmbiguousParents().add(
                            AssignmentIssue.ambiguousParent(gid, parentToken, parentMatches.size(), parent));
                }
            }

            if (members.isEmpty() || parent == null) {
                log.debug("Nothing to assign for group #{}", gid);
                continue;
            }
            members.computeIfAbsent(parent, c -> index.member(c, null));
            if (members.size() < 2) {
                log.debug("Group #{} resolves to a single product, skipped", gid);
                continue;
            }

            VariantGroup group = new VariantGroup(gid, parent);
            for (VariantMember m : members.values()) {
                m.setParent(m.getCode().equals(parent));
                group.addMember(m);
            }
            assign(group, index, override, summary);
            resolved.add(group);
        }

        log.info("Applied variant report: {} groups resolved, {} assignments", resolved.size(), summary.getAssignedCount());
        if (summary.hasIssues()) {
            log.warn("Variant report issues: {}", summary);
        }
        if (extractDifferences && !resolved.isEmpty()) {
            differences.extract(table, resolved);
        }
        return new VariantReportResult(resolved, summary);
    }

    private static void assign(VariantGroup group, CodeIndex index, boolean override, AssignmentSummary summary) {
        int gid = group.getGroupId();
        String parent = group.getParentCode();
        for (VariantMember m : group.getMembers()) {
            if (m.isParent()) continue;
            for (ProductRecord r : index.records(m.getCode())) {
                String current = r.hasParent() ? r.getParentCode() : null;
                if (current == null) {
                    r.setParentCode(parent);
                    summary.incrementAssigned();
                } else if (!current.equals(parent)) {
                    if (override) {
                        // last group applied wins
                        summary.getOverriddenConflicts().add(
                                AssignmentIssue.conflictOverridden(gid, m.getCode(), current, parent));
                        log.info("Group #{}: {} moved from parent {} to {}", gid, m.getCode(), current, parent);
                        r.setParentCode(parent);
                        summary.incrementAssigned();
                    } else {
                        summary.getSkippedConflicts().add(
                                AssignmentIssue.conflictSkipped(gid, m.getCode(), current, parent));
                    }
                }
            }
        }
    }

    /**
     * Live codes keyed by their separator-free form.
     */
    private static final class CodeIndex {
        private final Map<String, Set<String>> byNormalized = new LinkedHashMap<>();
        private final Map<String, List<ProductRecord>> byCode = new LinkedHashMap<>();

        CodeIndex(ProductTable table) {
            for (ProductRecord r : table.getRecords()) {
                String code = r.getCode();
                if (code == null || code.isBlank()) continue;
                byCode.computeIfAbsent(code, k -> new ArrayList<>()).add(r);
                byNormalized.computeIfAbsent(CatalogPattern.normalizeCode(code), k -> new LinkedHashSet<>()).add(code);
            }
        }

        /** Matching live codes in natural order; smallest first. */
        List<String> resolve(String token) {
            CatalogPattern pattern = CatalogPattern.compile(token);
            if (pattern.isEmpty()) return List.of();
            Set<String> matches = new LinkedHashSet<>();
            for (Map.Entry<String, Set<String>> e : byNormalized.entrySet()) {
                if (pattern.matchesNormalized(e.getKey())) matches.addAll(e.getValue());
            }
            return NaturalOrder.sorted(matches);
        }

        List<ProductRecord> records(String code) {
            return byCode.getOrDefault(code, List.of());
        }

        VariantMember member(String code, String fallbackName) {
            List<ProductRecord> records = records(code);
            String name = !records.isEmpty() && records.get(0).getName() != null
                    ? records.get(0).getName() : (fallbackName != null ? fallbackName : "");
            return new VariantMember(code, name, BaseNameExtractor.extractBaseName(name), false);
        }
    }
}
