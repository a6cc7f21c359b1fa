package com.gastrofeed.catalog.service.category;

import com.gastrofeed.catalog.config.CatalogProperties;
import com.gastrofeed.catalog.model.ProductRecord;
import com.gastrofeed.catalog.model.ProductTable;
import com.gastrofeed.catalog.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Resolves free-text source categories into the target taxonomy.
 *
 * <h3>Lookup order</h3>
 * <ol>
 *   <li>Blank input resolves to an empty string</li>
 *   <li>{@link CategoryStore} entry for the raw or normalized value</li>
 *   <li>In-memory custom mappings set by the host</li>
 *   <li>The value itself, if it already is a known target category</li>
 *   <li>The configured {@link CategoryResolver}, given ranked suggestions</li>
 * </ol>
 *
 * <p>A resolver answer is stored at once, so the next product with the same raw category
 * is not asked about again. A decline is stored as an identity mapping for the same reason.
 * With no resolver, or when the resolver fails or times out, the raw category passes
 * through unchanged and nothing is stored.
 */
@Service
public class CategoryMapper {
    private static final Logger log = LoggerFactory.getLogger(CategoryMapper.class);

    private final CategoryStore store;
    private final CategorySuggester suggester;
    private final Duration resolverTimeout;
    private final String outputPrefix;

    private final Map<String, String> customMappings = new LinkedHashMap<>();
    private final Set<String> knownCategories = new LinkedHashSet<>();
    private CategoryResolver resolver;

    public CategoryMapper(CategoryStore store, CatalogProperties properties) {
        this.store = store;
        CatalogProperties.Categories c = properties.getCategories();
        this.suggester = new CategorySuggester(c.getSuggestionLimit());
        this.resolverTimeout = c.getResolverTimeout();
        this.outputPrefix = c.getOutputPrefix();
    }

    @Autowired(required = false)
    public void setResolver(CategoryResolver resolver) {
        this.resolver = resolver;
    }

    public void setCustomMappings(Map<String, String> mappings) {
        customMappings.clear();
        if (mappings != null) customMappings.putAll(mappings);
        log.info("Loaded {} custom category mappings", customMappings.size());
    }

    /**
     * Adds categories the host already knows (e.g. from the current shop export) to the
     * suggestion pool.
     */
    public void registerKnownCategories(Collection<String> categories) {
        if (categories == null) return;
        for (String c : categories) {
            if (c != null && !c.isBlank()) knownCategories.add(c.trim());
        }
    }

    public String resolve(String rawCategory, String productNameHint) {
        if (TextNormalizer.isBlank(rawCategory)) return "";
        String original = rawCategory.trim();

        Optional<String> stored = store.find(original);
        if (stored.isPresent()) return stored.get();

        String custom = customMappings.get(original);
        if (custom == null) custom = customMappings.get(TextNormalizer.normalizeCategory(original));
        if (custom != null) return custom;

        if (store.isTargetCategory(original)) return original;

        CategoryResolver r = resolver;
        if (r == null) {
            log.warn("No mapping for '{}' and no resolver configured", original);
            return original;
        }

        List<CategorySuggestion> suggestions = suggester.suggest(original, suggestionPool());
        CategoryResolutionRequest request = new CategoryResolutionRequest(original, productNameHint, suggestions);
        log.info("Unmapped category '{}' (product '{}'), asking resolver with {} suggestions",
                original, productNameHint, suggestions.size());

        Mono<String> answer = Mono.defer(() -> r.resolve(request))
                .map(String::trim)
                .filter(s -> !s.isEmpty());
        if (resolverTimeout != null) {
            answer = answer.timeout(resolverTimeout);
        }

        String chosen;
        try {
            chosen = answer.block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                log.warn("Resolver did not answer for '{}' within {}, keeping raw category", original, resolverTimeout);
            } else {
                log.warn("Resolver failed for '{}': {}", original, cause.toString());
            }
            return original;
        }

        if (chosen == null || chosen.equals(original)) {
            log.info("Resolver declined '{}', remembering it unchanged", original);
            store.add(original, original);
            return original;
        }
        store.add(original, chosen);
        return chosen;
    }

    /**
     * Resolves every record's raw category into its canonical category, in table order.
     */
    public ProductTable applyTo(ProductTable table) {
        int mapped = 0;
        for (ProductRecord r : table.getRecords()) {
            String resolved = resolve(r.getCategory(), r.getName());
            r.setCanonicalCategory(resolved);
            if (!resolved.isEmpty()) mapped++;
        }
        log.info("Resolved categories for {} of {} products", mapped, table.size());
        return table;
    }

    Set<String> suggestionPool() {
        Set<String> pool = new LinkedHashSet<>(store.uniqueCanonicalCategories());
        pool.addAll(knownCategories);
        pool.removeIf(c -> c.startsWith(outputPrefix) || c.startsWith(outputPrefix.trim()));
        return Collections.unmodifiableSet(pool);
    }
}
