package com.gastrofeed.catalog.service.variant;

import com.gastrofeed.catalog.model.ProductRecord;
import com.gastrofeed.catalog.model.ProductTable;
import com.gastrofeed.catalog.model.VariantGroup;
import com.gastrofeed.catalog.model.VariantMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Fills the structured difference attributes of variant family members.
 *
 * <p>Only members whose category is listed in the {@link VariantExtractionSchema} are
 * touched, and only the columns listed for that category are written. Steps run in order:
 * <ol>
 *   <li>{@link DimensionExtractor} - Šírka, Dĺžka, Výška</li>
 *   <li>{@link PowerExtractor} - Výkon</li>
 *   <li>{@link VolumeExtractor} - Objem</li>
 *   <li>{@link VariantLabelExtractor} - Variant</li>
 * </ol>
 * A step that throws is logged and skipped for that product; the batch continues.
 */
@Component
public class DifferenceExtractionPipeline {
    private static final Logger log = LoggerFactory.getLogger(DifferenceExtractionPipeline.class);

    private final VariantExtractionSchema schema;
    private final List<AttributeExtractor> steps;

    @Autowired
    public DifferenceExtractionPipeline(VariantExtractionSchema schema) {
        this(schema, Arrays.asList(
                new DimensionExtractor(),
                new PowerExtractor(),
                new VolumeExtractor(),
                new VariantLabelExtractor()));
    }

    DifferenceExtractionPipeline(VariantExtractionSchema schema, List<AttributeExtractor> steps) {
        this.schema = schema;
        this.steps = steps;
    }

    /**
     * @return number of products that received at least one attribute
     */
    public int extract(ProductTable table, List<VariantGroup> groups) {
        if (groups == null || groups.isEmpty()) return 0;
        Map<String, ProductRecord> byCode = table.indexByCode();
        int enriched = 0;
        for (VariantGroup group : groups) {
            for (VariantMember member : group.getMembers()) {
                ProductRecord record = byCode.get(member.getCode());
                if (record == null) continue;
                if (extract(record, member.getBaseName())) enriched++;
            }
        }
        log.info("Extracted differences for {} products in {} groups", enriched, groups.size());
        return enriched;
    }

    /**
     * Runs all steps on one record.
     *
     * @return true if any attribute was written
     */
    public boolean extract(ProductRecord record, String baseName) {
        List<String> columns = schema.columnsFor(record);
        if (columns.isEmpty()) {
            log.debug("No extraction rules for category of {}", record.getCode());
            return false;
        }
        String base = baseName != null ? baseName : BaseNameExtractor.extractBaseName(record.getName());
        AttributeExtractor.Input input = new AttributeExtractor.Input(
                record.getCode(), record.getName(), base, record.getParameters());

        boolean written = false;
        for (AttributeExtractor step : steps) {
            if (!step.supports(columns)) continue;
            try {
                Map<String, String> values = step.extract(input);
                for (Map.Entry<String, String> e : values.entrySet()) {
                    if (columns.contains(e.getKey()) && e.getValue() != null && !e.getValue().isBlank()) {
                        record.getAttributes().put(e.getKey(), e.getValue());
                        written = true;
                    }
                }
                log.debug("Applied {} to product {}, values: {}", step.getName(), record.getCode(), values.keySet());
            } catch (Exception e) {
                log.error("Error applying {} to product {}: {}", step.getName(), record.getCode(), e.getMessage(), e);
            }
        }
        return written;
    }

    public VariantExtractionSchema getSchema() {
        return schema;
    }
}
