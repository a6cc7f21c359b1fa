package com.gastrofeed.catalog.service.category;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gastrofeed.catalog.config.CatalogConfigurationException;
import com.gastrofeed.catalog.config.CatalogProperties;
import com.gastrofeed.catalog.model.CategoryMapping;
import com.gastrofeed.catalog.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered, append-only list of category resolutions backed by a JSON file.
 *
 * <p>The file is a JSON array of {@code {"oldCategory", "newCategory"}} objects. It is read
 * fully on construction and rewritten after every {@link #add}. Lookups compare both the
 * raw and the normalized form (see {@link TextNormalizer#normalizeCategory}) of both
 * sides; the earliest matching entry wins.
 *
 * <p>Reads are lock-free. {@link #add} holds a single writer lock around check-then-append
 * so the same raw category is never stored twice.
 */
@Component
public class CategoryStore {
    private static final Logger log = LoggerFactory.getLogger(CategoryStore.class);
    private static final String DEFAULT_PATH = "categories.json";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Path path;
    private final List<CategoryMapping> mappings = new CopyOnWriteArrayList<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    @Autowired
    public CategoryStore(CatalogProperties properties) {
        this(resolvePath(properties.getCategories().getMappingsPath()));
    }

    public CategoryStore(Path path) {
        this.path = path;
        reload();
    }

    private static Path resolvePath(String configured) {
        if (configured == null || configured.isBlank()) configured = DEFAULT_PATH;
        return Path.of(configured);
    }

    /**
     * Re-reads the backing file, replacing the in-memory list. A missing file means an
     * empty store.
     *
     * @throws CatalogConfigurationException if the file exists but cannot be parsed
     */
    public void reload() {
        writeLock.lock();
        try {
            if (!Files.exists(path)) {
                mappings.clear();
                log.info("No category mappings at {}, starting empty", path);
                return;
            }
            List<CategoryMapping> loaded;
            try {
                loaded = objectMapper.readValue(path.toFile(), new TypeReference<List<CategoryMapping>>() {});
            } catch (IOException e) {
                throw new CatalogConfigurationException(path, "Unreadable category mapping store", e);
            }
            mappings.clear();
            if (loaded != null) {
                for (CategoryMapping m : loaded) {
                    if (m != null && m.getOldCategory() != null) mappings.add(m);
                }
            }
            log.info("Loaded {} category mappings from {}", mappings.size(), path);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Writes the current list to the backing file through a temporary sibling file.
     *
     * @return false if the write failed; the in-memory list is kept either way
     */
    public boolean flush() {
        writeLock.lock();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), new ArrayList<>(mappings));
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            return true;
        } catch (IOException e) {
            log.warn("Failed to persist category mappings to {}: {}", path, e.toString());
            return false;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Target category for a raw category, if any entry matches.
     */
    public Optional<String> find(String rawCategory) {
        if (rawCategory == null) return Optional.empty();
        String raw = rawCategory.trim();
        String normalized = TextNormalizer.normalizeCategory(raw);
        for (CategoryMapping m : mappings) {
            String old = m.getOldCategory();
            if (old.equals(raw) || old.equals(normalized)) return Optional.ofNullable(m.getNewCategory());
            String oldNormalized = TextNormalizer.normalizeCategory(old);
            if (oldNormalized.equals(raw) || oldNormalized.equals(normalized)) {
                return Optional.ofNullable(m.getNewCategory());
            }
        }
        return Optional.empty();
    }

    /**
     * Appends a mapping unless the raw category already resolves, then flushes.
     *
     * @return true if a new entry was appended
     */
    public boolean add(String oldCategory, String newCategory) {
        if (oldCategory == null || oldCategory.isBlank()) return false;
        writeLock.lock();
        try {
            if (find(oldCategory).isPresent()) {
                log.debug("Mapping for '{}' already present, not adding", oldCategory);
                return false;
            }
            mappings.add(new CategoryMapping(oldCategory.trim(), newCategory));
            flush();
            log.info("Saved category mapping '{}' -> '{}'", oldCategory, newCategory);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * True if the value is already the target of some mapping.
     */
    public boolean isTargetCategory(String category) {
        if (category == null || category.isBlank()) return false;
        String normalized = TextNormalizer.normalizeCategory(category);
        for (CategoryMapping m : mappings) {
            String target = m.getNewCategory();
            if (target == null) continue;
            if (target.equals(category.trim()) || TextNormalizer.normalizeCategory(target).equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> uniqueCanonicalCategories() {
        Set<String> out = new LinkedHashSet<>();
        for (CategoryMapping m : mappings) {
            if (m.getNewCategory() != null && !m.getNewCategory().isBlank()) out.add(m.getNewCategory());
        }
        return out;
    }

    public List<CategoryMapping> getMappings() {
        return Collections.unmodifiableList(mappings);
    }

    public int size() {
        return mappings.size();
    }

    public Path getPath() {
        return path;
    }
}
