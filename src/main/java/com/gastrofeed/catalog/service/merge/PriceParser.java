package com.gastrofeed.catalog.service.merge;

import com.gastrofeed.catalog.util.TextNormalizer;

import java.math.BigDecimal;

/**
 * Parses feed price strings into numbers.
 *
 * <p>Accepts {@code 100}, {@code 100.00}, {@code 100,00}, {@code 1 234,50},
 * {@code 1.234,50} and a trailing or leading currency sign. Anything else is "no value"
 * and yields {@code null}; callers never compare a missing price against a present one.
 *
 * <p>The merge itself works on {@link BigDecimal} prices. Table loaders turn feed
 * text into numbers through {@link com.gastrofeed.catalog.model.ProductRecord#setPriceText}.
 */
public final class PriceParser {
    private PriceParser() {}

    public static BigDecimal parse(String text) {
        if (TextNormalizer.isBlank(text)) return null;
        String s = text.replace('\u00A0', ' ')
                .replace("€", "")
                .replace("EUR", "")
                .replaceAll("\\s+", "");
        if (s.isEmpty()) return null;
        int comma = s.lastIndexOf(',');
        int dot = s.lastIndexOf('.');
        if (comma >= 0 && dot >= 0) {
            // the separator that comes last is the decimal one
            if (comma > dot) {
                s = s.replace(".", "").replace(',', '.');
            } else {
                s = s.replace(",", "");
            }
        } else if (comma >= 0) {
            s = s.replace(',', '.');
        }
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
