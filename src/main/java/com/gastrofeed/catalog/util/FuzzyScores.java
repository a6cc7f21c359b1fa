package com.gastrofeed.catalog.util;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.Arrays;

/**
 * 0-100 fuzzy string scores built on the longest common subsequence.
 *
 * <ul>
 *   <li>{@link #ratio} - {@code 100 * 2*LCS / (|a| + |b|)}</li>
 *   <li>{@link #tokenSortRatio} - ratio after sorting whitespace-separated tokens</li>
 *   <li>{@link #partialRatio} - best ratio of the shorter string against equally long
 *       windows of the longer one</li>
 * </ul>
 */
public final class FuzzyScores {
    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    private FuzzyScores() {}

    public static double ratio(String a, String b) {
        String s1 = a != null ? a : "";
        String s2 = b != null ? b : "";
        int total = s1.length() + s2.length();
        if (total == 0) return 100.0;
        int lcs = LCS.apply(s1, s2);
        return 100.0 * 2 * lcs / total;
    }

    public static double tokenSortRatio(String a, String b) {
        return ratio(sortTokens(a), sortTokens(b));
    }

    public static double partialRatio(String a, String b) {
        String s1 = a != null ? a : "";
        String s2 = b != null ? b : "";
        if (s1.isEmpty() || s2.isEmpty()) return 0.0;
        String shorter = s1.length() <= s2.length() ? s1 : s2;
        String longer = shorter == s1 ? s2 : s1;
        int n = shorter.length();
        double best = 0.0;
        for (int start = 0; start + n <= longer.length(); start++) {
            double r = ratio(shorter, longer.substring(start, start + n));
            if (r > best) {
                best = r;
                if (best >= 100.0) break;
            }
        }
        return best;
    }

    private static String sortTokens(String s) {
        if (s == null || s.isBlank()) return "";
        String[] tokens = s.trim().split("\\s+");
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }
}
