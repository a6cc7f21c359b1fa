package com.gastrofeed.catalog.util;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Natural ordering of catalog codes: embedded digit runs compare numerically, text runs
 * compare case-insensitively. {@code A2} sorts before {@code A10}.
 *
 * <p>A key alternates text and digit chunks and always starts with a (possibly empty)
 * text chunk, so chunks at the same position are always of the same kind.
 */
public final class NaturalOrder implements Comparator<String> {
    public static final NaturalOrder INSTANCE = new NaturalOrder();

    private NaturalOrder() {}

    @Override
    public int compare(String a, String b) {
        List<String> ka = key(a);
        List<String> kb = key(b);
        int n = Math.min(ka.size(), kb.size());
        for (int i = 0; i < n; i++) {
            int c;
            if (i % 2 == 1) {
                c = new BigInteger(ka.get(i)).compareTo(new BigInteger(kb.get(i)));
            } else {
                c = ka.get(i).compareTo(kb.get(i));
            }
            if (c != 0) return c;
        }
        return Integer.compare(ka.size(), kb.size());
    }

    /**
     * Splits a string into alternating text/digit chunks, text lower-cased.
     */
    static List<String> key(String s) {
        List<String> chunks = new ArrayList<>();
        String str = s != null ? s : "";
        StringBuilder current = new StringBuilder();
        boolean inDigits = false;
        for (int i = 0; i < str.length(); i++) {
            char ch = str.charAt(i);
            boolean digit = ch >= '0' && ch <= '9';
            if (digit != inDigits) {
                chunks.add(inDigits ? current.toString() : current.toString().toLowerCase());
                current.setLength(0);
                inDigits = digit;
            }
            current.append(ch);
        }
        chunks.add(inDigits ? current.toString() : current.toString().toLowerCase());
        return chunks;
    }

    /**
     * The natural-sort smallest element, empty for an empty collection.
     */
    public static Optional<String> smallest(Collection<String> values) {
        return values.stream().filter(v -> v != null).min(INSTANCE);
    }

    public static List<String> sorted(Collection<String> values) {
        List<String> out = new ArrayList<>(values);
        out.sort(INSTANCE);
        return out;
    }
}
