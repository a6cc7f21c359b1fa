package com.gastrofeed.catalog.service.category;

/**
 * A previously seen target category offered to the operator, with its 0-100+ score.
 */
public record CategorySuggestion(String category, double score) {
}
