package com.gastrofeed.catalog.service.variant;

import com.gastrofeed.catalog.service.variant.UnitNormalizer.Measure;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared matching for single-value quantities such as power and volume.
 *
 * <p>Patterns are tried in order against the name, then against the parameter text. A
 * pattern with three groups is the multiplier form ({@code 4 x 2,6 kW}) and renders as
 * {@code "4x 2600 W"}; a two-group pattern renders as {@code "2600 W"}.
 */
abstract class QuantityExtractor implements AttributeExtractor {
    private final String column;
    private final List<Pattern> patterns;

    QuantityExtractor(String column, List<Pattern> patterns) {
        this.column = column;
        this.patterns = patterns;
    }

    @Override
    public boolean supports(Collection<String> columns) {
        return columns.contains(column);
    }

    @Override
    public Map<String, String> extract(Input input) {
        for (String text : input.texts()) {
            for (Pattern p : patterns) {
                Matcher m = p.matcher(text);
                if (!m.find()) continue;
                if (m.groupCount() == 3) {
                    Measure measure = UnitNormalizer.normalize(m.group(2), m.group(3));
                    if (measure != null) return Map.of(column, m.group(1) + "x " + measure.render());
                } else {
                    Measure measure = UnitNormalizer.normalize(m.group(1), m.group(2));
                    if (measure != null) return Map.of(column, measure.render());
                }
            }
        }
        return Map.of();
    }
}
