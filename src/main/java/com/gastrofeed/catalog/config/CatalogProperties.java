package com.gastrofeed.catalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {
    private final Categories categories = new Categories();
    private final Variants variants = new Variants();
    private final Reports reports = new Reports();

    public Categories getCategories() {
        return categories;
    }

    public Variants getVariants() {
        return variants;
    }

    public Reports getReports() {
        return reports;
    }

    public static class Categories {
        /**
         * JSON file holding the ordered oldCategory/newCategory list.
         * Defaults to "categories.json" when not set.
         */
        private String mappingsPath;
        /**
         * How long the pipeline waits for an operator to answer a category prompt.
         * Unset means wait indefinitely.
         */
        private Duration resolverTimeout;
        private int suggestionLimit = 5;
        /** Prefix prepended to every category on output. */
        private String outputPrefix = "Tovary a kategórie > ";
        /** Separator in resolved categories that is rewritten on output. */
        private String hierarchySeparator = "/";
        private String outputSeparator = " > ";

        public String getMappingsPath() {
            return mappingsPath;
        }

        public void setMappingsPath(String mappingsPath) {
            this.mappingsPath = mappingsPath;
        }

        public Duration getResolverTimeout() {
            return resolverTimeout;
        }

        public void setResolverTimeout(Duration resolverTimeout) {
            this.resolverTimeout = resolverTimeout;
        }

        public int getSuggestionLimit() {
            return suggestionLimit;
        }

        public void setSuggestionLimit(int suggestionLimit) {
            this.suggestionLimit = suggestionLimit;
        }

        public String getOutputPrefix() {
            return outputPrefix;
        }

        public void setOutputPrefix(String outputPrefix) {
            this.outputPrefix = outputPrefix;
        }

        public String getHierarchySeparator() {
            return hierarchySeparator;
        }

        public void setHierarchySeparator(String hierarchySeparator) {
            this.hierarchySeparator = hierarchySeparator;
        }

        public String getOutputSeparator() {
            return outputSeparator;
        }

        public void setOutputSeparator(String outputSeparator) {
            this.outputSeparator = outputSeparator;
        }
    }

    public static class Variants {
        /**
         * JSON file listing {category, result_columns} extraction rules.
         * Defaults to "variant_extractions.json" when not set.
         */
        private String extractionSchemaPath;
        /** Shorter base names are never grouped. */
        private int minBaseNameLength = 8;
        /** Base-name similarity must be strictly greater than this to join a group. */
        private double similarityThreshold = 0.98;
        private double minLengthRatio = 0.5;
        /** Manufacturers whose products are excluded from variant detection. */
        private List<String> excludedManufacturers = new ArrayList<>(List.of("Liebherr"));
        /** Whether applying groups overwrites an existing, different parent. */
        private boolean overrideConflicts = true;
        private boolean extractDifferences = true;

        public String getExtractionSchemaPath() {
            return extractionSchemaPath;
        }

        public void setExtractionSchemaPath(String extractionSchemaPath) {
            this.extractionSchemaPath = extractionSchemaPath;
        }

        public int getMinBaseNameLength() {
            return minBaseNameLength;
        }

        public void setMinBaseNameLength(int minBaseNameLength) {
            this.minBaseNameLength = minBaseNameLength;
        }

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public double getMinLengthRatio() {
            return minLengthRatio;
        }

        public void setMinLengthRatio(double minLengthRatio) {
            this.minLengthRatio = minLengthRatio;
        }

        public List<String> getExcludedManufacturers() {
            return excludedManufacturers;
        }

        public void setExcludedManufacturers(List<String> excludedManufacturers) {
            this.excludedManufacturers = excludedManufacturers;
        }

        public boolean isOverrideConflicts() {
            return overrideConflicts;
        }

        public void setOverrideConflicts(boolean overrideConflicts) {
            this.overrideConflicts = overrideConflicts;
        }

        public boolean isExtractDifferences() {
            return extractDifferences;
        }

        public void setExtractDifferences(boolean extractDifferences) {
            this.extractDifferences = extractDifferences;
        }
    }

    public static class Reports {
        /**
         * Directory where variant and assignment reports are saved as timestamped text files.
         * Defaults to "reports" when not set.
         */
        private String dir;
        private boolean enabled = true;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
