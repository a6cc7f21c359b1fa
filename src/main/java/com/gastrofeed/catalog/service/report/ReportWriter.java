package com.gastrofeed.catalog.service.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gastrofeed.catalog.config.CatalogProperties;
import com.gastrofeed.catalog.model.ProductRecord;
import com.gastrofeed.catalog.model.ProductTable;
import com.gastrofeed.catalog.model.VariantGroup;
import com.gastrofeed.catalog.model.VariantMember;
import com.gastrofeed.catalog.service.variant.AssignmentIssue;
import com.gastrofeed.catalog.service.variant.AssignmentSummary;
import com.gastrofeed.catalog.service.variant.VariantExtractionSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.gastrofeed.catalog.service.variant.VariantExtractionSchema.HEIGHT;
import static com.gastrofeed.catalog.service.variant.VariantExtractionSchema.LENGTH;
import static com.gastrofeed.catalog.service.variant.VariantExtractionSchema.POWER;
import static com.gastrofeed.catalog.service.variant.VariantExtractionSchema.VARIANT;
import static com.gastrofeed.catalog.service.variant.VariantExtractionSchema.VOLUME;
import static com.gastrofeed.catalog.service.variant.VariantExtractionSchema.WIDTH;

/**
 * Renders the plain-text audit reports and saves them as timestamped files.
 *
 * <p>The variant-groups report is also the input format of
 * {@link com.gastrofeed.catalog.service.variant.VariantReportParser}; operators edit it and
 * feed it back, so its line shapes must stay stable.
 *
 * <p>File names:
 * <ul>
 *   <li>{@code product_variants_yyyyMMdd_HHmmss.txt}</li>
 *   <li>{@code product_differences_yyyyMMdd_HHmmss.txt}</li>
 *   <li>{@code variant_assignment_summary_yyyyMMdd_HHmmss.txt}</li>
 * </ul>
 * Write failures are logged and reported as an empty result; they never fail a run.
 */
@Component
public class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private static final DateTimeFormatter GENERATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String RULE = "=".repeat(80);
    private static final String DASHES = "-".repeat(80);

    private final Clock clock;
    private final CatalogProperties.Reports config;
    private final VariantExtractionSchema schema;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ReportWriter(Clock clock, CatalogProperties properties, VariantExtractionSchema schema) {
        this.clock = clock;
        this.config = properties.getReports();
        this.schema = schema;
    }

    public Path getReportDir() {
        String dir = config.getDir();
        if (dir == null || dir.isBlank()) dir = "reports";
        return Path.of(dir);
    }

    public Optional<Path> writeVariantGroups(List<VariantGroup> groups) {
        return write("product_variants_", renderVariantGroups(groups));
    }

    public Optional<Path> writeDifferences(ProductTable table, List<VariantGroup> groups) {
        return write("product_differences_", renderDifferences(table, groups));
    }

    public Optional<Path> writeAssignmentSummary(AssignmentSummary summary) {
        return write("variant_assignment_summary_", renderAssignmentSummary(summary));
    }

    private Optional<Path> write(String prefix, String content) {
        if (!config.isEnabled()) return Optional.empty();
        LocalDateTime now = LocalDateTime.now(clock);
        Path file = getReportDir().resolve(prefix + FILE_STAMP.format(now) + ".txt");
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
            log.info("Report written: {}", file);
            return Optional.of(file);
        } catch (IOException e) {
            log.warn("Failed to write report {}: {}", file, e.toString());
            return Optional.empty();
        }
    }

    public String renderVariantGroups(List<VariantGroup> groups) {
        StringBuilder out = new StringBuilder();
        out.append("PRODUCT VARIANT GROUPS REPORT\n");
        out.append("===========================\n\n");
        out.append("Generated: ").append(generated()).append('\n');
        out.append("Total groups: ").append(groups.size()).append('\n');
        out.append("Total variants: ").append(groups.stream().mapToInt(VariantGroup::size).sum()).append("\n\n");

        for (VariantGroup group : groups) {
            out.append("Group #").append(group.getGroupId())
                    .append(" - Parent catalog: ").append(group.getParentCode()).append('\n');
            out.append(DASHES).append('\n');
            int i = 1;
            for (VariantMember m : group.getMembers()) {
                out.append(i++).append(". ").append(m.isParent() ? "[PARENT]" : "        ")
                        .append(' ').append(m.getCode()).append(" - ").append(m.getName()).append('\n');
                out.append("   Base name: ").append(m.getBaseName()).append('\n');
            }
            out.append('\n').append(RULE).append("\n\n");
        }
        return out.toString();
    }

    /**
     * Lists the extracted attributes per member. Members whose category has no extraction
     * rules are left out.
     */
    public String renderDifferences(ProductTable table, List<VariantGroup> groups) {
        Map<String, ProductRecord> byCode = table.indexByCode();
        StringBuilder out = new StringBuilder();
        out.append("PRODUCT DIFFERENCES REPORT\n");
        out.append(RULE).append("\n\n");
        out.append("Generated: ").append(generated()).append("\n\n");

        int groupIndex = 1;
        for (VariantGroup group : groups) {
            String parent = group.getParentCode();
            out.append("Group #").append(groupIndex++).append(" - Parent catalog: ").append(parent).append('\n');
            out.append(DASHES).append('\n');

            int i = 1;
            for (VariantMember m : group.getMembers()) {
                ProductRecord r = byCode.get(m.getCode());
                if (r == null) continue;
                List<String> columns = schema.columnsFor(r);
                if (columns.isEmpty()) continue;

                out.append(i++).append(". ").append(m.getCode().equals(parent) ? "[PARENT] " : "         ")
                        .append(m.getCode()).append(" - ").append(m.getName()).append('\n');

                List<String> dimensions = new ArrayList<>();
                for (String column : List.of(WIDTH, LENGTH, HEIGHT)) {
                    String value = shown(r, columns, column);
                    if (value != null) dimensions.add(column + ": " + value);
                }
                boolean any = !dimensions.isEmpty();
                if (any) out.append("   Rozmery: ").append(String.join(", ", dimensions)).append('\n');
                for (String column : List.of(POWER, VOLUME, VARIANT)) {
                    String value = shown(r, columns, column);
                    if (value != null) {
                        out.append("   ").append(column).append(": ").append(value).append('\n');
                        any = true;
                    }
                }
                if (!any) out.append("   Žiadne rozdiely neboli detekované\n");
                out.append('\n');
            }
            out.append('\n').append(RULE).append("\n\n");
        }
        return out.toString();
    }

    private static String shown(ProductRecord r, List<String> columns, String column) {
        if (!columns.contains(column)) return null;
        String value = r.getAttributes().get(column);
        return value == null || value.isBlank() ? null : value;
    }

    public String renderAssignmentSummary(AssignmentSummary summary) {
        StringBuilder out = new StringBuilder();
        out.append("VARIANT ASSIGNMENT SUMMARY\n");
        out.append(RULE).append("\n\n");
        out.append("Generated: ").append(generated()).append("\n\n");
        out.append("Groups processed: ").append(summary.getGroups()).append('\n');
        out.append("Products considered: ").append(summary.getTotalProducts()).append('\n');
        out.append("Assignments made: ").append(summary.getAssignedCount()).append('\n');
        out.append("Conflicts overridden: ").append(summary.getOverriddenConflicts().size()).append('\n');
        out.append("Conflicts skipped: ").append(summary.getSkippedConflicts().size()).append('\n');
        out.append("Unmatched parent tokens: ").append(summary.getUnmatchedParents().size()).append('\n');
        out.append("Unmatched product tokens: ").append(summary.getUnmatchedProducts().size()).append('\n');
        out.append("Ambiguous parent tokens: ").append(summary.getAmbiguousParents().size()).append('\n');
        out.append("Ambiguous product tokens: ").append(summary.getAmbiguousProducts().size()).append("\n\n");

        section(out, "UNMATCHED PARENTS", summary.getUnmatchedParents());
        section(out, "UNMATCHED PRODUCTS", summary.getUnmatchedProducts());
        section(out, "AMBIGUOUS PARENTS", summary.getAmbiguousParents());
        section(out, "AMBIGUOUS PRODUCTS", summary.getAmbiguousProducts());
        section(out, "CONFLICTS OVERRIDDEN", summary.getOverriddenConflicts());
        section(out, "CONFLICTS SKIPPED", summary.getSkippedConflicts());
        return out.toString();
    }

    private void section(StringBuilder out, String title, List<AssignmentIssue> items) {
        if (items.isEmpty()) return;
        out.append(title).append('\n');
        out.append(DASHES).append('\n');
        for (AssignmentIssue item : items) {
            try {
                out.append(objectMapper.writeValueAsString(item)).append('\n');
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        }
        out.append('\n');
    }

    private String generated() {
        return GENERATED.format(LocalDateTime.now(clock));
    }
}
