package com.gastrofeed.catalog.service.variant;

import java.util.regex.Pattern;

/**
 * Strips size tokens from a product name so that variants of one product share a key.
 *
 * <p>Rules applied in order:
 * <ol>
 *   <li>Dimension runs like {@code 400x400x850mm} followed by whitespace</li>
 *   <li>Dimension runs at the end of the name</li>
 *   <li>Dash-prefixed numbers and dimension runs ({@code - 600x700})</li>
 *   <li>Bare numbers with an optional unit word ({@code 2 kW}, {@code 1/1})</li>
 *   <li>Parenthesized dimension runs</li>
 *   <li>Collapse whitespace and trim</li>
 * </ol>
 * The result is a grouping key only; it is never written to the catalog.
 */
public final class BaseNameExtractor {
    private static final String DIM_UNITS = "(?:\\s*mm)?(?:\\s*cm)?(?:\\s*l)?";

    private static final Pattern DIMENSIONS_INSIDE = Pattern.compile("\\s+\\d+(?:[xX\u00D7]\\d+)+" + DIM_UNITS + "(?:\\s|$)");
    private static final Pattern DIMENSIONS_AT_END = Pattern.compile("\\s+\\d+(?:[xX\u00D7]\\d+)+" + DIM_UNITS + "$");
    private static final Pattern DASH_DIMENSIONS = Pattern.compile("\\s*[-\u2013]\\s*\\d+(?:[xX\u00D7]\\d+)*" + DIM_UNITS);
    private static final Pattern BARE_NUMBER = Pattern.compile("\\s*[-\u2013]?\\s*\\d+(?:[/-]\\d+)?(?:\\s*[a-zA-Z]+)?(?:\\s|$)");
    private static final Pattern PAREN_DIMENSIONS = Pattern.compile("\\s*\\(\\d+(?:[xX\u00D7]\\d+)*" + DIM_UNITS + "\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private BaseNameExtractor() {}

    public static String extractBaseName(String name) {
        if (name == null) return "";
        String base = DIMENSIONS_INSIDE.matcher(name).replaceAll(" ");
        base = DIMENSIONS_AT_END.matcher(base).replaceAll("");
        base = DASH_DIMENSIONS.matcher(base).replaceAll("");
        base = BARE_NUMBER.matcher(base).replaceAll(" ");
        base = PAREN_DIMENSIONS.matcher(base).replaceAll("");
        base = WHITESPACE.matcher(base).replaceAll(" ");
        return base.trim();
    }
}
