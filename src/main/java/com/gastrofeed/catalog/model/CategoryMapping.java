package com.gastrofeed.catalog.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One persisted resolution of a free-text source category into the target taxonomy.
 * Serialized as {@code {"oldCategory": ..., "newCategory": ...}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CategoryMapping {
    private String oldCategory;
    private String newCategory;

    public CategoryMapping() {}

    public CategoryMapping(String oldCategory, String newCategory) {
        this.oldCategory = oldCategory;
        this.newCategory = newCategory;
    }

    public String getOldCategory() { return oldCategory; }
    public void setOldCategory(String oldCategory) { this.oldCategory = oldCategory; }
    public String getNewCategory() { return newCategory; }
    public void setNewCategory(String newCategory) { this.newCategory = newCategory; }

    @Override
    public String toString() {
        return oldCategory + " -> " + newCategory;
    }
}
