package com.gastrofeed.catalog.service.variant;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Power in watts: {@code 4 x 2,6 kW}, {@code 6W}, {@code výkon: 2,5 kW}.
 */
public class PowerExtractor extends QuantityExtractor {
    private static final String NUM = "(\\d+(?:[.,]\\d+)?)";
    private static final String UNIT = "([kK]?[wW])(?![a-zA-Z])";

    public PowerExtractor() {
        super(VariantExtractionSchema.POWER, List.of(
                Pattern.compile("(\\d+)\\s*[xX]\\s*" + NUM + "\\s*" + UNIT),
                Pattern.compile(NUM + "\\s*" + UNIT),
                Pattern.compile("výkon[:\\s]+" + NUM + "\\s*" + UNIT, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)));
    }
}
