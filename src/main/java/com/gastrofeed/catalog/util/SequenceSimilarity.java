package com.gastrofeed.catalog.util;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Ratcliff/Obershelp similarity of two strings.
 *
 * <p>The ratio is {@code 2*M / (|a| + |b|)} where {@code M} is the number of characters in
 * matching blocks: the longest common substring is taken first (leftmost in {@code a} on
 * ties), then the same search is repeated on the unmatched pieces left and right of it.
 * Two empty strings are fully similar.
 *
 * <p>Used as the base-name grouping test, where the threshold is strict: a ratio of exactly
 * 0.98 does not group.
 */
public final class SequenceSimilarity {
    private SequenceSimilarity() {}

    public static double ratio(String a, String b) {
        String s1 = a != null ? a : "";
        String s2 = b != null ? b : "";
        int total = s1.length() + s2.length();
        if (total == 0) return 1.0;
        return 2.0 * matchingCharacters(s1, s2) / total;
    }

    /**
     * True when {@link #ratio(String, String)} is strictly greater than {@code threshold}.
     */
    public static boolean exceeds(String a, String b, double threshold) {
        return ratio(a, b) > threshold;
    }

    static int matchingCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[] {0, a.length(), 0, b.length()});
        while (!queue.isEmpty()) {
            int[] r = queue.pop();
            int alo = r[0], ahi = r[1], blo = r[2], bhi = r[3];
            int[] m = longestMatch(a, alo, ahi, b, blo, bhi);
            int i = m[0], j = m[1], k = m[2];
            if (k == 0) continue;
            matched += k;
            if (alo < i && blo < j) queue.push(new int[] {alo, i, blo, j});
            if (i + k < ahi && j + k < bhi) queue.push(new int[] {i + k, ahi, j + k, bhi});
        }
        return matched;
    }

    /**
     * Longest common substring of a[alo:ahi] and b[blo:bhi] as {i, j, size}.
     */
    private static int[] longestMatch(String a, int alo, int ahi, String b, int blo, int bhi) {
        int besti = alo, bestj = blo, bestSize = 0;
        int width = bhi - blo;
        int[] prev = new int[width + 1];
        for (int i = alo; i < ahi; i++) {
            int[] cur = new int[width + 1];
            char ca = a.charAt(i);
            for (int j = blo; j < bhi; j++) {
                if (ca == b.charAt(j)) {
                    int k = prev[j - blo] + 1;
                    cur[j - blo + 1] = k;
                    if (k > bestSize) {
                        besti = i - k + 1;
                        bestj = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            prev = cur;
        }
        return new int[] {besti, bestj, bestSize};
    }
}
