package com.gastrofeed.catalog.config;

import java.nio.file.Path;

/**
 * Raised when an external store the engine depends on (category mappings, variant
 * extraction schema) exists but cannot be read or parsed. This is the only fatal error
 * of a reconciliation run.
 */
public class CatalogConfigurationException extends RuntimeException {
    private final Path path;

    public CatalogConfigurationException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
