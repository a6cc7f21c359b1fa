package com.gastrofeed.catalog.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An ordered set of product records together with the columns its loader declared.
 *
 * <p>Loaders (CSV, XLSX, XML feeds) live outside the core; they report which columns the
 * source actually had so the core can refuse to merge a feed without a {@code code}
 * column instead of silently treating every code as blank.
 */
public class ProductTable {
    public static final String CODE = "code";
    public static final String NAME = "name";
    public static final String PRICE = "price";
    public static final String CATEGORY = "category";
    public static final String IMAGES = "images";
    public static final String MANUFACTURER = "manufacturer";
    public static final String PARAMETERS = "parameters";
    public static final String PARENT_CODE = "parentCode";

    /** Columns declared by {@link #of(List)}. */
    public static final Set<String> STANDARD_COLUMNS = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
            CODE, NAME, PRICE, CATEGORY, IMAGES, MANUFACTURER, PARAMETERS, PARENT_CODE)));

    private final Set<String> columns;
    private final List<ProductRecord> records;

    public ProductTable(Set<String> columns, List<ProductRecord> records) {
        this.columns = columns != null ? new LinkedHashSet<>(columns) : new LinkedHashSet<>();
        this.records = records != null ? new ArrayList<>(records) : new ArrayList<>();
    }

    public static ProductTable of(List<ProductRecord> records) {
        return new ProductTable(STANDARD_COLUMNS, records);
    }

    public static ProductTable empty() {
        return of(List.of());
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public Set<String> getColumns() {
        return Collections.unmodifiableSet(columns);
    }

    public List<ProductRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Optional<ProductRecord> find(String code) {
        if (code == null) return Optional.empty();
        for (ProductRecord r : records) {
            if (code.equals(r.getCode())) return Optional.of(r);
        }
        return Optional.empty();
    }

    /**
     * Index of records by code; the first record wins if a code repeats.
     */
    public Map<String, ProductRecord> indexByCode() {
        Map<String, ProductRecord> index = new LinkedHashMap<>();
        for (ProductRecord r : records) {
            if (r.getCode() != null && !r.getCode().isBlank()) {
                index.putIfAbsent(r.getCode(), r);
            }
        }
        return index;
    }

    /**
     * Deep copy of the table; records are copied with {@link ProductRecord#copy()}.
     */
    public ProductTable copy() {
        List<ProductRecord> copies = new ArrayList<>(records.size());
        for (ProductRecord r : records) copies.add(r.copy());
        return new ProductTable(columns, copies);
    }
}
