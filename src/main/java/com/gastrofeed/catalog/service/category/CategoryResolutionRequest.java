package com.gastrofeed.catalog.service.category;

import java.util.List;

/**
 * What the operator sees for an unmapped category: the raw value, the first product that
 * carried it, and ranked suggestions.
 */
public record CategoryResolutionRequest(String rawCategory, String productNameHint,
                                        List<CategorySuggestion> suggestions) {
    public CategoryResolutionRequest {
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }
}
