package com.gastrofeed.catalog.service.variant;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A catalog code token from an edited variant report, compiled to an anchored,
 * case-insensitive pattern.
 *
 * <p>Compilation:
 * <ol>
 *   <li>Strip leading slashes and a trailing file extension ({@code .jpg})</li>
 *   <li>Split on separators: space, {@code - _ / \ .}</li>
 *   <li>A run of k lower-case {@code x} means k digits ({@code ABCxxxx}); an upper-case
 *       {@code X} counts only in a segment made of {@code X}, digits and wildcards, so the
 *       {@code X} in {@code LX} or {@code BOX} stays a literal letter</li>
 *   <li>{@code *} is any run, {@code ?} any single character, everything else literal</li>
 * </ol>
 * Live codes are compared in the same separator-free, upper-cased form, so
 * {@code LX-xxxx-POL} matches {@code LX-1234-POL} but not {@code LX-12A4-POL}.
 */
public final class CatalogPattern {
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-_/\\\\.]+");
    private static final Pattern EXTENSION = Pattern.compile("\\.[A-Za-z]{2,4}$");

    private final String token;
    private final String literal;
    private final Pattern pattern;
    private final boolean wildcard;

    private CatalogPattern(String token, String literal, Pattern pattern, boolean wildcard) {
        this.token = token;
        this.literal = literal;
        this.pattern = pattern;
        this.wildcard = wildcard;
    }

    public static CatalogPattern compile(String token) {
        String t = token != null ? token.trim() : "";
        while (t.startsWith("/")) t = t.substring(1);
        t = EXTENSION.matcher(t).replaceAll("");

        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        boolean wildcard = false;
        for (String segment : SEPARATORS.split(t)) {
            if (segment.isEmpty()) continue;
            literal.append(segment.toUpperCase(Locale.ROOT));
            boolean placeholders = isPlaceholderSegment(segment);
            int i = 0;
            while (i < segment.length()) {
                char c = segment.charAt(i);
                if (c == 'x' || (placeholders && c == 'X')) {
                    int j = i;
                    while (j < segment.length() && isPlaceholder(segment.charAt(j), placeholders)) j++;
                    regex.append("\\d{").append(j - i).append('}');
                    wildcard = true;
                    i = j;
                    continue;
                }
                if (c == '*') {
                    regex.append(".*");
                    wildcard = true;
                } else if (c == '?') {
                    regex.append('.');
                    wildcard = true;
                } else {
                    regex.append(Pattern.quote(String.valueOf(c)));
                }
                i++;
            }
        }
        Pattern compiled = literal.length() == 0 ? null
                : Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return new CatalogPattern(token, literal.toString(), compiled, wildcard);
    }

    private static boolean isPlaceholder(char c, boolean upperCaseAllowed) {
        return c == 'x' || (upperCaseAllowed && c == 'X');
    }

    private static boolean isPlaceholderSegment(String segment) {
        boolean hasX = false;
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c == 'x' || c == 'X') {
                hasX = true;
            } else if (!Character.isDigit(c) && c != '*' && c != '?') {
                return false;
            }
        }
        return hasX;
    }

    /**
     * Upper-cased code with separators removed.
     */
    public static String normalizeCode(String code) {
        if (code == null) return "";
        return SEPARATORS.matcher(code.toUpperCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * True if the live code matches. A code spelled exactly like the token always matches,
     * even when the token looked like a placeholder ({@code X-100}).
     */
    public boolean matches(String code) {
        return matchesNormalized(normalizeCode(code));
    }

    boolean matchesNormalized(String normalizedCode) {
        if (pattern == null || normalizedCode.isEmpty()) return false;
        return normalizedCode.equals(literal) || pattern.matcher(normalizedCode).matches();
    }

    /** Nothing left after normalization; matches no code. */
    public boolean isEmpty() {
        return pattern == null;
    }

    public boolean isWildcard() {
        return wildcard;
    }

    public String getToken() {
        return token;
    }

    @Override
    public String toString() {
        return token + " -> " + (pattern != null ? pattern.pattern() : "<empty>");
    }
}
