package com.gastrofeed.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.gastrofeed.catalog.service.merge.PriceParser;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single product row as it flows through the reconciliation run.
 *
 * <p>Records arrive from the primary catalog or from a secondary feed and end up in the
 * canonical table produced by {@link com.gastrofeed.catalog.service.merge.SourceMerger}.
 * The record is mutable: the merger updates price, images and source tag, the category
 * post-pass fills {@link #getCanonicalCategory()}, and the variant matcher sets
 * {@link #getParentCode()} and the extracted {@link #getAttributes()}.
 *
 * <p>Input tables handed to the core are never mutated; the merger works on copies made
 * with {@link #copy()}.
 *
 * @see ProductTable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProductRecord {
    /** Maximum number of image slots a catalog row carries (defaultImage + image..image7). */
    public static final int MAX_IMAGE_SLOTS = 8;

    /** Catalog code, unique within the canonical table */
    private String code;

    /** Product display name */
    private String name;

    /** Manufacturer as given by the source, used for variant exclusion */
    private String manufacturer;

    /** Free-text category as delivered by the source */
    private String category;

    /** Category after resolution into the target taxonomy */
    private String canonicalCategory;

    /** Current price, null when the source had none or it could not be parsed */
    private BigDecimal price;

    /** Image URLs by slot; blank entries are empty slots */
    private List<String> images = new ArrayList<>();

    /** Free-text parameter blob (short description) used as a secondary extraction source */
    private String parameters;

    /** Extracted variant differences keyed by schema column label, e.g. "Šírka" */
    private Map<String, String> attributes = new LinkedHashMap<>();

    /** Code of the variant family parent, null for standalone products and parents */
    private String parentCode;

    /** Name of the source that last contributed this row */
    private String sourceTag;

    /** Set when a merge changed price or images */
    private Instant lastUpdated;

    /** Source fields the core does not interpret; carried through unchanged */
    private Map<String, String> extra = new LinkedHashMap<>();

    public ProductRecord() {}

    public ProductRecord(String code, String name) {
        this.code = code;
        this.name = name;
    }

    /**
     * Counts non-blank image URLs among the first {@link #MAX_IMAGE_SLOTS} slots.
     */
    public int imageCount() {
        int count = 0;
        if (images == null) return 0;
        for (int i = 0; i < images.size() && i < MAX_IMAGE_SLOTS; i++) {
            String url = images.get(i);
            if (url != null && !url.isBlank()) {
                count++;
            }
        }
        return count;
    }

    public boolean hasParent() {
        return parentCode != null && !parentCode.isBlank();
    }

    /**
     * Deep copy; collections are duplicated so the copy can be mutated freely.
     */
    public ProductRecord copy() {
        ProductRecord r = new ProductRecord(code, name);
        r.manufacturer = manufacturer;
        r.category = category;
        r.canonicalCategory = canonicalCategory;
        r.price = price;
        r.images = images != null ? new ArrayList<>(images) : new ArrayList<>();
        r.parameters = parameters;
        r.attributes = attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>();
        r.parentCode = parentCode;
        r.sourceTag = sourceTag;
        r.lastUpdated = lastUpdated;
        r.extra = extra != null ? new LinkedHashMap<>(extra) : new LinkedHashMap<>();
        return r;
    }

    // Getters and setters
    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getManufacturer() { return manufacturer; }
    public void setManufacturer(String manufacturer) { this.manufacturer = manufacturer; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public String getCanonicalCategory() { return canonicalCategory; }
    public void setCanonicalCategory(String canonicalCategory) { this.canonicalCategory = canonicalCategory; }
    public BigDecimal getPrice() { return price; }
    public void setPrice(BigDecimal price) { this.price = price; }

    /**
     * Sets the price from a feed string such as {@code "1 234,50 €"}. Unparseable text
     * clears the price.
     */
    @JsonIgnore
    public void setPriceText(String text) { this.price = PriceParser.parse(text); }

    public List<String> getImages() { return images; }
    public void setImages(List<String> images) { this.images = images != null ? new ArrayList<>(images) : new ArrayList<>(); }
    public String getParameters() { return parameters; }
    public void setParameters(String parameters) { this.parameters = parameters; }
    public Map<String, String> getAttributes() { return attributes; }
    public void setAttributes(Map<String, String> attributes) { this.attributes = attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>(); }
    public String getParentCode() { return parentCode; }
    public void setParentCode(String parentCode) { this.parentCode = parentCode; }
    public String getSourceTag() { return sourceTag; }
    public void setSourceTag(String sourceTag) { this.sourceTag = sourceTag; }
    public Instant getLastUpdated() { return lastUpdated; }
    public void setLastUpdated(Instant lastUpdated) { this.lastUpdated = lastUpdated; }
    public Map<String, String> getExtra() { return extra; }
    public void setExtra(Map<String, String> extra) { this.extra = extra != null ? new LinkedHashMap<>(extra) : new LinkedHashMap<>(); }

    @Override
    public String toString() {
        return "ProductRecord{" + code + " '" + name + "'}";
    }
}
