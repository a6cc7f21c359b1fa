package com.gastrofeed.catalog.service.variant;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Volume in litres: {@code 1x20l}, {@code 25 L}, {@code 25 litrov}, {@code objem: 25l}.
 */
public class VolumeExtractor extends QuantityExtractor {
    private static final String NUM = "(\\d+(?:[.,]\\d+)?)";
    private static final String LITERS = "([lL](?:iter|itre|itrov|itra)?s?)(?![a-zA-Z])";

    public VolumeExtractor() {
        super(VariantExtractionSchema.VOLUME, List.of(
                Pattern.compile("(\\d+)\\s*[xX]\\s*" + NUM + "\\s*([lL])(?![a-zA-Z])"),
                Pattern.compile(NUM + "\\s*" + LITERS),
                Pattern.compile("objem[:\\s]+" + NUM + "\\s*" + LITERS, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)));
    }
}
