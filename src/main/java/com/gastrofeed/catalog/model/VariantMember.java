package com.gastrofeed.catalog.model;

/**
 * A product inside a {@link VariantGroup}.
 */
public class VariantMember {
    private String code;
    private String name;
    private String baseName;
    private boolean parent;

    public VariantMember() {}

    public VariantMember(String code, String name, String baseName, boolean parent) {
        this.code = code;
        this.name = name;
        this.baseName = baseName;
        this.parent = parent;
    }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getBaseName() { return baseName; }
    public void setBaseName(String baseName) { this.baseName = baseName; }
    public boolean isParent() { return parent; }
    public void setParent(boolean parent) { this.parent = parent; }
}
