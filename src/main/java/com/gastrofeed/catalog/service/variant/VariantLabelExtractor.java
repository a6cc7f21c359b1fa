package com.gastrofeed.catalog.service.variant;

import java.util.Collection;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Short label telling a family member apart when size does not: zone count, number of GN
 * containers, a numbered type prefix, or else whatever the name adds to the base name.
 */
public class VariantLabelExtractor implements AttributeExtractor {
    private static final Pattern ZONES = Pattern.compile("(\\d+)\\s*z[oó]n[ay]", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern GN_CONTAINERS = Pattern.compile("(\\d+)[xX]\\s*GN\\s*\\d+/\\d+");
    private static final Pattern TYPE_PREFIX = Pattern.compile("^(\\d+)\\s*-");

    /** Longer leftovers are usually a different description, not a variant label. */
    static final int MAX_DIFFERENCE_LENGTH = 30;

    @Override
    public boolean supports(Collection<String> columns) {
        return columns.contains(VariantExtractionSchema.VARIANT);
    }

    @Override
    public Map<String, String> extract(Input input) {
        String label = label(input.name(), input.baseName());
        return label.isEmpty() ? Map.of() : Map.of(VariantExtractionSchema.VARIANT, label);
    }

    static String label(String fullName, String baseName) {
        if (fullName.equals(baseName)) return "";
        Matcher zones = ZONES.matcher(fullName);
        if (zones.find()) return zones.group(1) + " zón";
        Matcher gn = GN_CONTAINERS.matcher(fullName);
        if (gn.find()) return gn.group(1) + "x GN";
        Matcher prefix = TYPE_PREFIX.matcher(fullName);
        if (prefix.find()) return "Typ " + prefix.group(1);

        String difference = (baseName.isEmpty() ? fullName : fullName.replace(baseName, "")).trim();
        if (difference.isEmpty() || difference.length() > MAX_DIFFERENCE_LENGTH) return "";
        return strip(difference, " -–:");
    }

    private static String strip(String s, String chars) {
        int start = 0;
        int end = s.length();
        while (start < end && chars.indexOf(s.charAt(start)) >= 0) start++;
        while (end > start && chars.indexOf(s.charAt(end - 1)) >= 0) end--;
        return s.substring(start, end);
    }
}
