package com.gastrofeed.catalog.service.variant;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gastrofeed.catalog.model.ProductRecord;
import com.gastrofeed.catalog.model.ProductTable;
import com.gastrofeed.catalog.model.VariantGroup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.gastrofeed.catalog.service.variant.VariantExtractionSchema.VARIANT;
import static org.junit.jupiter.api.Assertions.*;

public class VariantReportApplierTest {

    private static VariantReportApplier applier() {
        VariantExtractionSchema schema = new VariantExtractionSchema(List.of(
                new VariantExtractionSchema.Entry("Vitríny", List.of(VARIANT))));
        return new VariantReportApplier(new DifferenceExtractionPipeline(schema));
    }

    private static ProductRecord record(String code, String name) {
        ProductRecord r = new ProductRecord(code, name);
        r.setCategory("Vitríny");
        return r;
    }

    private static ProductTable catalog() {
        return ProductTable.of(List.of(
                record("LX-0001", "Vitrína chladiaca 2 zóny"),
                record("LX-0002", "Vitrína chladiaca 3 zóny"),
                record("LX-0003", "Vitrína chladiaca 4 zóny")));
    }

    private static String report(String parentToken, String... memberTokens) {
        StringBuilder sb = new StringBuilder("Group #1 - Parent catalog: ").append(parentToken).append('\n');
        for (int i = 0; i < memberTokens.length; i++) {
            sb.append(i + 1).append(". ").append(memberTokens[i]).append(" - Vitrína\n");
        }
        return sb.toString();
    }

    @Test
    public void wildcardParentResolvesToSmallestAndIsReportedAmbiguous() {
        ProductTable table = ProductTable.of(List.of(
                record("LX-0002", "Vitrína chladiaca - čierna"),
                record("LX-0001", "Vitrína chladiaca - biela")));

        VariantReportResult result = applier().apply(table, report("LX-xxxx", "LX-0001", "LX-0002"), true, false);

        assertEquals("LX-0001", result.groups().get(0).getParentCode());
        assertEquals("LX-0001", table.find("LX-0002").orElseThrow().getParentCode());
        assertNull(table.find("LX-0001").orElseThrow().getParentCode());

        AssignmentSummary summary = result.summary();
        assertEquals(1, summary.getAmbiguousParents().size());
        AssignmentIssue issue = summary.getAmbiguousParents().get(0);
        assertEquals(2, issue.getMatchCount());
        assertEquals("LX-0001", issue.getSelected());
        assertEquals("LX-xxxx", issue.getToken());
        assertEquals(1, summary.getAssignedCount());
    }

    @Test
    public void unmatchedTokensAreRecordedAndSkipped() {
        ProductTable table = catalog();

        VariantReportResult result = applier().apply(table, report("ZZ-1", "LX-0002", "LX-9999", "LX-0003"), true, false);

        AssignmentSummary summary = result.summary();
        assertEquals(1, summary.getUnmatchedParents().size());
        assertEquals("ZZ-1", summary.getUnmatchedParents().get(0).getToken());
        assertEquals(1, summary.getUnmatchedProducts().size());
        assertEquals("LX-9999", summary.getUnmatchedProducts().get(0).getToken());
        assertEquals(3, summary.getTotalProducts());

        // parent falls back to the smallest resolved member
        assertEquals("LX-0002", result.groups().get(0).getParentCode());
        assertEquals("LX-0002", table.find("LX-0003").orElseThrow().getParentCode());
        assertNull(table.find("LX-0001").orElseThrow().getParentCode());
    }

    @Test
    public void ambiguousMemberTokenResolvesToSmallest() {
        ProductTable table = catalog();

        VariantReportResult result = applier().apply(table, report("LX-0003", "LX-0003", "LX-000?"), true, false);

        AssignmentIssue issue = result.summary().getAmbiguousProducts().get(0);
        assertEquals(3, issue.getMatchCount());
        assertNull(issue.getSelected());
        assertEquals("LX-0003", table.find("LX-0001").orElseThrow().getParentCode());
        assertNull(table.find("LX-0002").orElseThrow().getParentCode());
    }

    @Test
    public void parentMissingFromMembersIsAdded() {
        ProductTable table = catalog();

        VariantReportResult result = applier().apply(table, report("LX-0001", "LX-0002"), true, false);

        VariantGroup group = result.groups().get(0);
        assertEquals(2, group.size());
        assertTrue(group.getMembers().stream().anyMatch(m -> m.getCode().equals("LX-0001") && m.isParent()));
        assertEquals("LX-0001", table.find("LX-0002").orElseThrow().getParentCode());
    }

    @Test
    public void conflictIsOverriddenOrSkipped() {
        ProductTable overridden = catalog();
        overridden.find("LX-0002").orElseThrow().setParentCode("OLD-1");
        AssignmentSummary s1 = applier().apply(overridden, report("LX-0001", "LX-0001", "LX-0002"), true, false).summary();
        assertEquals("LX-0001", overridden.find("LX-0002").orElseThrow().getParentCode());
        assertEquals("OLD-1", s1.getOverriddenConflicts().get(0).getOldParent());
        assertEquals("LX-0001", s1.getOverriddenConflicts().get(0).getNewParent());
        assertEquals(1, s1.getAssignedCount());

        ProductTable kept = catalog();
        kept.find("LX-0002").orElseThrow().setParentCode("OLD-1");
        AssignmentSummary s2 = applier().apply(kept, report("LX-0001", "LX-0001", "LX-0002"), false, false).summary();
        assertEquals("OLD-1", kept.find("LX-0002").orElseThrow().getParentCode());
        assertEquals("OLD-1", s2.getSkippedConflicts().get(0).getExistingParent());
        assertEquals("LX-0001", s2.getSkippedConflicts().get(0).getDesiredParent());
        assertEquals(0, s2.getAssignedCount());
    }

    @Test
    public void sameParentAgainIsNotAConflict() {
        ProductTable table = catalog();
        table.find("LX-0002").orElseThrow().setParentCode("LX-0001");

        AssignmentSummary summary = applier().apply(table, report("LX-0001", "LX-0001", "LX-0002"), true, false).summary();

        assertFalse(summary.hasIssues());
        assertEquals(0, summary.getAssignedCount());
    }

    @Test
    public void productClaimedByTwoGroupsEndsInLastGroup() {
        ProductTable table = catalog();
        String text = "Group #1 - Parent catalog: LX-0001\n"
                + "1. [PARENT] LX-0001 - a\n"
                + "2. LX-0003 - c\n"
                + "Group #2 - Parent catalog: LX-0002\n"
                + "1. [PARENT] LX-0002 - b\n"
                + "2. LX-0003 - c\n";

        AssignmentSummary summary = applier().apply(table, text, true, false).summary();

        assertEquals("LX-0002", table.find("LX-0003").orElseThrow().getParentCode());
        assertEquals(1, summary.getOverriddenConflicts().size());
        assertEquals(2, summary.getOverriddenConflicts().get(0).getGroupId());
    }

    @Test
    public void extractsDifferencesForResolvedGroups() {
        ProductTable table = catalog();

        applier().apply(table, report("LX-0001", "LX-0001", "LX-0002"), true, true);

        assertEquals("3 zón", table.find("LX-0002").orElseThrow().getAttributes().get(VARIANT));
        assertTrue(table.find("LX-0003").orElseThrow().getAttributes().isEmpty());
    }

    @Test
    public void groupResolvingToOneProductIsDropped() {
        ProductTable table = catalog();

        VariantReportResult result = applier().apply(table, report("LX-0001", "LX-0001", "LX-9999"), true, false);

        assertTrue(result.groups().isEmpty());
        assertEquals(1, result.summary().getUnmatchedProducts().size());
        assertEquals(0, result.summary().getAssignedCount());
        assertTrue(table.getRecords().stream().noneMatch(ProductRecord::hasParent));
    }

    @Test
    public void oversizedGroupNumberIsRenumbered() {
        ProductTable table = catalog();
        String text = "Group #99999999999 - Parent catalog: LX-0001\n"
                + "1. [PARENT] LX-0001 - a\n"
                + "2. LX-0002 - b\n";

        VariantReportResult result = assertDoesNotThrow(() -> applier().apply(table, text, true, false));

        assertEquals(1, result.groups().size());
        assertEquals(1, result.groups().get(0).getGroupId());
        assertEquals("LX-0001", table.find("LX-0002").orElseThrow().getParentCode());
    }

    @Test
    public void emptyReportChangesNothing() {
        ProductTable table = catalog();
        VariantReportResult result = applier().apply(table, "nothing to see", true, true);
        assertTrue(result.groups().isEmpty());
        assertEquals(0, result.summary().getGroups());
        assertTrue(table.getRecords().stream().noneMatch(ProductRecord::hasParent));
    }

    @Test
    public void issuesSerializeWithSnakeCaseKeysAndNoNulls() throws Exception {
        String json = new ObjectMapper().writeValueAsString(AssignmentIssue.ambiguousParent(1, "LX-xxxx", 2, "LX-0001"));
        assertTrue(json.contains("\"group_id\":1"), json);
        assertTrue(json.contains("\"match_count\":2"), json);
        assertTrue(json.contains("\"selected\":\"LX-0001\""), json);
        assertFalse(json.contains("catalog"), json);
    }
}
