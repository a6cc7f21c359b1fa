package com.gastrofeed.catalog.service.report;

import com.gastrofeed.catalog.config.CatalogProperties;
import com.gastrofeed.catalog.model.ProductRecord;
import com.gastrofeed.catalog.model.ProductTable;
import com.gastrofeed.catalog.model.VariantGroup;
import com.gastrofeed.catalog.model.VariantMember;
import com.gastrofeed.catalog.service.variant.AssignmentIssue;
import com.gastrofeed.catalog.service.variant.AssignmentSummary;
import com.gastrofeed.catalog.service.variant.VariantExtractionSchema;
import com.gastrofeed.catalog.service.variant.VariantReportParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.gastrofeed.catalog.service.variant.VariantExtractionSchema.HEIGHT;
import static com.gastrofeed.catalog.service.variant.VariantExtractionSchema.LENGTH;
import static com.gastrofeed.catalog.service.variant.VariantExtractionSchema.WIDTH;
import static org.junit.jupiter.api.Assertions.*;

public class ReportWriterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private ReportWriter writer(boolean enabled) {
        CatalogProperties props = new CatalogProperties();
        props.getReports().setDir(dir.resolve("reports").toString());
        props.getReports().setEnabled(enabled);
        VariantExtractionSchema schema = new VariantExtractionSchema(List.of(
                new VariantExtractionSchema.Entry("Stoly", List.of(WIDTH, LENGTH, HEIGHT))));
        return new ReportWriter(CLOCK, props, schema);
    }

    private static VariantGroup tables() {
        return new VariantGroup(1, "T001")
                .addMember(new VariantMember("T001", "Stôl 400x400x850mm", "Stôl", true))
                .addMember(new VariantMember("T002", "Stôl 400x400x1200mm", "Stôl", false))
                .addMember(new VariantMember("T003", "Stôl 400x400x900mm", "Stôl", false));
    }

    @Test
    public void variantGroupsReportReadsBack() {
        String text = writer(true).renderVariantGroups(List.of(tables()));

        assertTrue(text.startsWith("PRODUCT VARIANT GROUPS REPORT\n"));
        assertTrue(text.contains("Generated: 2024-05-01 10:00:00\n"));
        assertTrue(text.contains("Total groups: 1\nTotal variants: 3\n"));
        assertTrue(text.contains("Group #1 - Parent catalog: T001\n"));
        assertTrue(text.contains("1. [PARENT] T001 - Stôl 400x400x850mm\n   Base name: Stôl\n"));

        List<VariantGroup> parsed = VariantReportParser.parse(text);
        assertEquals(1, parsed.size());
        assertEquals("T001", parsed.get(0).getParentCode());
        assertEquals(3, parsed.get(0).size());
        assertTrue(parsed.get(0).getMembers().get(0).isParent());
        assertFalse(parsed.get(0).getMembers().get(1).isParent());
        assertEquals("T002", parsed.get(0).getMembers().get(1).getCode());
    }

    @Test
    public void differencesReportListsOnlyCategoriesWithRules() {
        ProductRecord t1 = new ProductRecord("T001", "Stôl 400x400x850mm");
        t1.setCategory("Stoly");
        ProductRecord t2 = new ProductRecord("T002", "Stôl 400x400x1200mm");
        t2.setCategory("Stoly");
        t2.getAttributes().put(WIDTH, "400 mm");
        t2.getAttributes().put(LENGTH, "400 mm");
        t2.getAttributes().put(HEIGHT, "1200 mm");
        ProductRecord t3 = new ProductRecord("T003", "Stôl 400x400x900mm");
        t3.setCategory("Chladničky");

        String text = writer(true).renderDifferences(ProductTable.of(List.of(t1, t2, t3)), List.of(tables()));

        assertTrue(text.startsWith("PRODUCT DIFFERENCES REPORT\n"));
        assertTrue(text.contains("1. [PARENT] T001 - Stôl 400x400x850mm\n   Žiadne rozdiely neboli detekované\n"));
        assertTrue(text.contains("2.          T002 - Stôl 400x400x1200mm\n   Rozmery: Šírka: 400 mm, Dĺžka: 400 mm, Výška: 1200 mm\n"));
        assertFalse(text.contains("T003"));
    }

    @Test
    public void assignmentSummaryItemizesIssues() {
        AssignmentSummary summary = new AssignmentSummary();
        summary.setGroups(1);
        summary.setTotalProducts(2);
        summary.setAssignedCount(1);
        summary.getAmbiguousParents().add(AssignmentIssue.ambiguousParent(1, "LX-xxxx", 2, "LX-0001"));

        String text = writer(true).renderAssignmentSummary(summary);

        assertTrue(text.contains("Groups processed: 1\n"));
        assertTrue(text.contains("Assignments made: 1\n"));
        assertTrue(text.contains("Ambiguous parent tokens: 1\n"));
        assertTrue(text.contains("AMBIGUOUS PARENTS\n"));
        assertTrue(text.contains("\"match_count\":2"));
        assertFalse(text.contains("UNMATCHED PARENTS"));
    }

    @Test
    public void writesTimestampedFile() throws Exception {
        Optional<Path> file = writer(true).writeVariantGroups(List.of(tables()));

        assertTrue(file.isPresent());
        assertEquals("product_variants_20240501_100000.txt", file.get().getFileName().toString());
        assertTrue(Files.readString(file.get(), StandardCharsets.UTF_8).contains("Group #1 - Parent catalog: T001"));
    }

    @Test
    public void disabledReportsWriteNothing() {
        assertTrue(writer(false).writeAssignmentSummary(new AssignmentSummary()).isEmpty());
        assertFalse(Files.exists(dir.resolve("reports")));
    }

    @Test
    public void unwritableDirectoryIsNotFatal() throws Exception {
        Files.writeString(dir.resolve("reports"), "a file where the directory should be");
        assertTrue(writer(true).writeVariantGroups(List.of(tables())).isEmpty());
    }
}
