package com.gastrofeed.catalog.service.variant;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * One step of the difference extraction pipeline.
 *
 * <p>Each step reads a product's name and parameter text and returns values keyed by schema
 * column label (see {@link VariantExtractionSchema}). Steps are stateless: the same input
 * always yields the same values, and a step never writes to the record itself. The
 * pipeline keeps only the columns the product's category asks for.
 *
 * @see DifferenceExtractionPipeline
 */
public interface AttributeExtractor {

    /**
     * Whether any of the requested columns is one this step fills.
     */
    boolean supports(Collection<String> columns);

    /**
     * @return column label to rendered value; empty when nothing was found
     */
    Map<String, String> extract(Input input);

    default String getName() {
        return this.getClass().getSimpleName();
    }

    /**
     * What a step gets to look at.
     *
     * @param name       full product name
     * @param baseName   name with size tokens stripped
     * @param parameters free-text parameter blob, may be empty
     */
    record Input(String code, String name, String baseName, String parameters) {
        public Input {
            name = name != null ? name : "";
            baseName = baseName != null ? baseName : "";
            parameters = parameters != null ? parameters : "";
        }

        /** Name first, then parameters if present. */
        public List<String> texts() {
            return parameters.isEmpty() ? List.of(name) : List.of(name, parameters);
        }
    }
}
