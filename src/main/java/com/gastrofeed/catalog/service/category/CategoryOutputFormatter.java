package com.gastrofeed.catalog.service.category;

import com.gastrofeed.catalog.config.CatalogProperties;
import com.gastrofeed.catalog.model.ProductRecord;
import com.gastrofeed.catalog.model.ProductTable;
import com.gastrofeed.catalog.util.TextNormalizer;
import org.springframework.stereotype.Component;

/**
 * Final category rewrite for the shop export: {@code Chladenie/Vitríny} becomes
 * {@code Tovary a kategórie > Chladenie > Vitríny}. A blank category becomes the bare
 * prefix. Values already carrying the prefix are left as they are.
 */
@Component
public class CategoryOutputFormatter {
    private final String prefix;
    private final String separator;
    private final String outputSeparator;

    public CategoryOutputFormatter(CatalogProperties properties) {
        CatalogProperties.Categories c = properties.getCategories();
        this.prefix = c.getOutputPrefix();
        this.separator = c.getHierarchySeparator();
        this.outputSeparator = c.getOutputSeparator();
    }

    public String format(String category) {
        if (TextNormalizer.isBlank(category)) return prefix;
        String c = category.trim();
        if (c.startsWith(prefix.trim())) return c;
        return prefix + c.replace(separator, outputSeparator);
    }

    /**
     * Rewrites every record's canonical category (falling back to the raw one).
     */
    public ProductTable applyTo(ProductTable table) {
        for (ProductRecord r : table.getRecords()) {
            String value = r.getCanonicalCategory() != null ? r.getCanonicalCategory() : r.getCategory();
            r.setCanonicalCategory(format(value));
        }
        return table;
    }
}
