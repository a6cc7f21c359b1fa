package com.gastrofeed.catalog.service.category;

import com.gastrofeed.catalog.util.FuzzyScores;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Ranks known target categories against an unmapped raw category.
 *
 * <p>Score (case-insensitive):
 * <pre>
 *   0.40 * ratio + 0.30 * tokenSortRatio + 0.20 * partialRatio + 0.10 * hierarchicalBonus
 *   hierarchicalBonus = 0.7 * ratio(last segment) + 10 * (leading segments matching above 80)
 * </pre>
 * Segments are split on {@code /}, {@code >} and {@code |}; the leading-segment count stops
 * at the first mismatch.
 */
public class CategorySuggester {
    private static final String SEGMENT_SPLIT = "[/>|]";
    private static final double SEGMENT_MATCH = 80.0;

    private final int limit;

    public CategorySuggester(int limit) {
        this.limit = limit > 0 ? limit : 5;
    }

    public List<CategorySuggestion> suggest(String rawCategory, Collection<String> candidates) {
        List<CategorySuggestion> scored = new ArrayList<>();
        if (rawCategory == null || rawCategory.isBlank() || candidates == null) return scored;
        String query = rawCategory.toLowerCase(Locale.ROOT).trim();
        for (String candidate : candidates) {
            if (candidate == null || candidate.isBlank()) continue;
            double s = score(query, candidate.toLowerCase(Locale.ROOT).trim());
            if (s > 0) scored.add(new CategorySuggestion(candidate, s));
        }
        scored.sort(Comparator.comparingDouble(CategorySuggestion::score).reversed());
        return scored.size() > limit ? new ArrayList<>(scored.subList(0, limit)) : scored;
    }

    static double score(String a, String b) {
        return 0.40 * FuzzyScores.ratio(a, b)
                + 0.30 * FuzzyScores.tokenSortRatio(a, b)
                + 0.20 * FuzzyScores.partialRatio(a, b)
                + 0.10 * hierarchicalBonus(a, b);
    }

    static double hierarchicalBonus(String a, String b) {
        List<String> sa = segments(a);
        List<String> sb = segments(b);
        if (sa.isEmpty() || sb.isEmpty()) return 0.0;
        double last = FuzzyScores.ratio(sa.get(sa.size() - 1), sb.get(sb.size() - 1));
        int leading = 0;
        int n = Math.min(sa.size(), sb.size());
        for (int i = 0; i < n; i++) {
            if (FuzzyScores.ratio(sa.get(i), sb.get(i)) > SEGMENT_MATCH) {
                leading++;
            } else {
                break;
            }
        }
        return 0.7 * last + 10.0 * leading;
    }

    private static List<String> segments(String s) {
        List<String> out = new ArrayList<>();
        Arrays.stream(s.split(SEGMENT_SPLIT)).map(String::trim).filter(x -> !x.isEmpty()).forEach(out::add);
        return out;
    }
}
