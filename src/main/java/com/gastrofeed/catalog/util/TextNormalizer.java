package com.gastrofeed.catalog.util;

import org.apache.commons.text.StringEscapeUtils;

import java.text.Normalizer;

/**
 * Utilities for making free-text catalog values comparable.
 *
 * <p>Feeds deliver the same category with HTML entities, non-breaking spaces or
 * compatibility characters depending on how they were exported. Lookups compare the
 * normalized forms so that "Chladenie&amp;nbsp;Vitríny" and "Chladenie Vitríny" hit the
 * same mapping.
 */
public final class TextNormalizer {
    private TextNormalizer() {}

    /**
     * Returns a lookup-stable form of a category string.
     *
     * <p>Rules applied in order:
     * <ol>
     *   <li>Unescape HTML entities ({@code &amp;amp;}, {@code &amp;nbsp;}, numeric references)</li>
     *   <li>Unicode NFKC normalization</li>
     *   <li>Convert remaining non-breaking spaces to regular spaces</li>
     *   <li>Trim</li>
     * </ol>
     */
    public static String normalizeCategory(String input) {
        if (input == null) return null;
        String s = StringEscapeUtils.unescapeHtml4(input);
        s = Normalizer.normalize(s, Normalizer.Form.NFKC);
        s = s.replace('\u00A0', ' ').replace('\u202F', ' ');
        return s.trim();
    }

    /**
     * Collapses whitespace runs into single spaces and trims.
     */
    public static String collapseWhitespace(String input) {
        if (input == null) return null;
        return input.replaceAll("\\s+", " ").trim();
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank() || "nan".equalsIgnoreCase(s.trim()) || "None".equals(s.trim());
    }
}
