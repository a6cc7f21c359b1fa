package com.gastrofeed.catalog.service.variant;

import com.gastrofeed.catalog.service.variant.UnitNormalizer.Measure;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.gastrofeed.catalog.service.variant.VariantExtractionSchema.HEIGHT;
import static com.gastrofeed.catalog.service.variant.VariantExtractionSchema.LENGTH;
import static com.gastrofeed.catalog.service.variant.VariantExtractionSchema.WIDTH;

/**
 * Extracts width, length and height.
 *
 * <p>Search order: a 3-D run ({@code 500x735x880mm}) in the name, a 2-D run in the name, the
 * same two in the parameter text, then labeled fields ({@code šírka: 400}, {@code d: 60 cm})
 * in both texts for whatever is still missing. A match in the name ends the search.
 * Values without a unit are millimetres.
 */
public class DimensionExtractor implements AttributeExtractor {
    private static final String NUM = "(\\d+(?:[.,]\\d+)?)";
    private static final String TIMES = "\\s*[xX\u00D7]\\s*";
    private static final String UNIT = "(?:\\s*(mm|cm|m)(?![a-zA-Z]))?";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Pattern DIM_3D = Pattern.compile(NUM + TIMES + NUM + TIMES + NUM + UNIT, FLAGS);
    // "4 x 2,6 kW" and "2 x 10 l" are multipliers, not dimensions
    private static final Pattern DIM_2D = Pattern.compile(NUM + TIMES + NUM
            + "(?![.,]?\\d)(?!\\s*(?:k?w|l)(?![a-z]))" + UNIT, FLAGS);

    private static final List<Pattern> WIDTH_LABELS = List.of(
            Pattern.compile("šírka[:\\s]+" + NUM + UNIT, FLAGS),
            Pattern.compile("(?<!\\p{L})š\\s*[:\\-]\\s*" + NUM + UNIT, FLAGS));
    private static final List<Pattern> LENGTH_LABELS = List.of(
            Pattern.compile("dĺžka[:\\s]+" + NUM + UNIT, FLAGS),
            Pattern.compile("dlžka[:\\s]+" + NUM + UNIT, FLAGS),
            Pattern.compile("(?<!\\p{L})d\\s*[:\\-]\\s*" + NUM + UNIT, FLAGS));
    private static final List<Pattern> HEIGHT_LABELS = List.of(
            Pattern.compile("výška[:\\s]+" + NUM + UNIT, FLAGS),
            Pattern.compile("vyska[:\\s]+" + NUM + UNIT, FLAGS),
            Pattern.compile("(?<!\\p{L})v\\s*[:\\-]\\s*" + NUM + UNIT, FLAGS));

    @Override
    public boolean supports(Collection<String> columns) {
        return columns.contains(WIDTH) || columns.contains(LENGTH) || columns.contains(HEIGHT);
    }

    @Override
    public Map<String, String> extract(Input input) {
        Map<String, String> out = new LinkedHashMap<>();
        if (matchRun(input.name(), out)) return out;
        if (!input.parameters().isEmpty()) {
            matchRun(input.parameters(), out);
        }
        for (String text : input.texts()) {
            if (!out.containsKey(WIDTH)) firstLabeled(text, WIDTH_LABELS, WIDTH, out);
            if (!out.containsKey(LENGTH)) firstLabeled(text, LENGTH_LABELS, LENGTH, out);
            if (!out.containsKey(HEIGHT)) firstLabeled(text, HEIGHT_LABELS, HEIGHT, out);
        }
        return out;
    }

    private static boolean matchRun(String text, Map<String, String> out) {
        Matcher m3 = DIM_3D.matcher(text);
        if (m3.find()) {
            String unit = m3.group(4);
            put(out, WIDTH, m3.group(1), unit);
            put(out, LENGTH, m3.group(2), unit);
            put(out, HEIGHT, m3.group(3), unit);
            return true;
        }
        Matcher m2 = DIM_2D.matcher(text);
        if (m2.find()) {
            String unit = m2.group(3);
            put(out, WIDTH, m2.group(1), unit);
            put(out, LENGTH, m2.group(2), unit);
            return true;
        }
        return false;
    }

    private static void firstLabeled(String text, List<Pattern> patterns, String column, Map<String, String> out) {
        for (Pattern p : patterns) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                put(out, column, m.group(1), m.group(2));
                return;
            }
        }
    }

    private static void put(Map<String, String> out, String column, String value, String unit) {
        Measure measure = UnitNormalizer.normalize(value, unit != null ? unit : "mm");
        if (measure != null) out.put(column, measure.render());
    }
}
