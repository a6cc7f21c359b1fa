package com.gastrofeed.catalog.service.variant;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gastrofeed.catalog.config.CatalogConfigurationException;
import com.gastrofeed.catalog.config.CatalogProperties;
import com.gastrofeed.catalog.model.ProductRecord;
import com.gastrofeed.catalog.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Which difference columns are extracted for which category.
 *
 * <p>Backed by a JSON array of {@code {"category": ..., "result_columns": [...]}}. A category
 * that is not listed gets no extraction at all, whatever its product names contain.
 */
@Component
public class VariantExtractionSchema {
    private static final Logger log = LoggerFactory.getLogger(VariantExtractionSchema.class);
    private static final String DEFAULT_PATH = "variant_extractions.json";

    public static final String WIDTH = "Šírka";
    public static final String LENGTH = "Dĺžka";
    public static final String HEIGHT = "Výška";
    public static final String POWER = "Výkon";
    public static final String VOLUME = "Objem";
    public static final String VARIANT = "Variant";

    /** All columns, in report order. */
    public static final List<String> ALL_COLUMNS = List.of(WIDTH, LENGTH, HEIGHT, POWER, VOLUME, VARIANT);

    public static class Entry {
        private String category;
        @JsonProperty("result_columns")
        @JsonAlias("resultColumns")
        private List<String> resultColumns = new ArrayList<>();

        public Entry() {}

        public Entry(String category, List<String> resultColumns) {
            this.category = category;
            this.resultColumns = resultColumns != null ? new ArrayList<>(resultColumns) : new ArrayList<>();
        }

        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }
        public List<String> getResultColumns() { return resultColumns; }
        public void setResultColumns(List<String> resultColumns) { this.resultColumns = resultColumns; }
    }

    private final Map<String, List<String>> byCategory = new LinkedHashMap<>();

    @Autowired
    public VariantExtractionSchema(CatalogProperties properties) {
        this(load(resolvePath(properties.getVariants().getExtractionSchemaPath())));
    }

    public VariantExtractionSchema(List<Entry> entries) {
        if (entries == null) return;
        for (Entry e : entries) {
            if (e == null || e.getCategory() == null || e.getCategory().isBlank()) continue;
            List<String> cols = e.getResultColumns() != null ? e.getResultColumns() : List.of();
            byCategory.putIfAbsent(e.getCategory().trim(), List.copyOf(cols));
        }
    }

    private static Path resolvePath(String configured) {
        if (configured == null || configured.isBlank()) configured = DEFAULT_PATH;
        return Path.of(configured);
    }

    /**
     * @throws CatalogConfigurationException if the file exists but cannot be parsed
     */
    public static List<Entry> load(Path path) {
        if (!Files.exists(path)) {
            log.info("No variant extraction schema at {}, difference extraction disabled", path);
            return List.of();
        }
        try {
            List<Entry> entries = new ObjectMapper().readValue(path.toFile(), new TypeReference<List<Entry>>() {});
            log.info("Loaded extraction rules for {} categories from {}", entries != null ? entries.size() : 0, path);
            return entries != null ? entries : List.of();
        } catch (IOException e) {
            throw new CatalogConfigurationException(path, "Unreadable variant extraction schema", e);
        }
    }

    /**
     * Columns for a category; empty when the category is not listed.
     */
    public List<String> columnsFor(String category) {
        if (category == null || category.isBlank()) return List.of();
        List<String> cols = byCategory.get(category.trim());
        if (cols != null) return cols;
        String normalized = TextNormalizer.normalizeCategory(category);
        for (Map.Entry<String, List<String>> e : byCategory.entrySet()) {
            if (TextNormalizer.normalizeCategory(e.getKey()).equals(normalized)) return e.getValue();
        }
        return List.of();
    }

    /**
     * Columns for a record: its resolved category first, then its raw one.
     */
    public List<String> columnsFor(ProductRecord record) {
        List<String> cols = columnsFor(record.getCanonicalCategory());
        return cols.isEmpty() ? columnsFor(record.getCategory()) : cols;
    }

    public Map<String, List<String>> getCategories() {
        return Collections.unmodifiableMap(byCategory);
    }

    public boolean isEmpty() {
        return byCategory.isEmpty();
    }
}
