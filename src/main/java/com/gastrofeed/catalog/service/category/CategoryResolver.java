package com.gastrofeed.catalog.service.category;

import reactor.core.publisher.Mono;

/**
 * Host-provided decision point for categories with no stored mapping.
 *
 * <p>The returned {@code Mono} completes with the chosen target category (a suggestion or
 * free text). Completing empty, or with a blank value, declines. The pipeline blocks on the
 * result, bounded by {@code catalog.categories.resolver-timeout} when set.
 *
 * @see QueuedCategoryResolver
 */
@FunctionalInterface
public interface CategoryResolver {
    Mono<String> resolve(CategoryResolutionRequest request);
}
