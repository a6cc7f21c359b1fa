package com.gastrofeed.catalog.service.variant;

import com.gastrofeed.catalog.model.VariantGroup;
import com.gastrofeed.catalog.model.VariantMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a variant-groups report, possibly edited by hand, back into raw groups.
 *
 * <p>Recognized lines:
 * <pre>
 * Group #3 - Parent catalog: LX-xxxx
 * 1. [PARENT] LX-0001 - Stôl 400x400x850mm
 *    Base name: Stôl
 * </pre>
 * Anything else (banners, separators, counts) is ignored. Codes are kept as raw tokens;
 * they are resolved against the catalog by {@link VariantReportApplier}.
 */
public final class VariantReportParser {
    private static final Logger log = LoggerFactory.getLogger(VariantReportParser.class);

    private static final Pattern HEADER = Pattern.compile("^Group\\s*#\\s*(\\d+)\\s*-\\s*Parent catalog:\\s*(.+)\\s*$");
    private static final Pattern PRODUCT = Pattern.compile("^\\s*\\d+\\.\\s*(\\[\\s*PARENT\\s*\\])?\\s*([^\\s]+)\\s*-\\s*(.+?)\\s*$");
    private static final Pattern BASE_NAME = Pattern.compile("^\\s*Base name:\\s*(.+?)\\s*$");

    private static final Charset LEGACY = Charset.forName("windows-1250");

    private VariantReportParser() {}

    /**
     * Reads the file as UTF-8, falling back to windows-1250 for reports saved by older
     * spreadsheet tools. A missing file yields no groups.
     */
    public static List<VariantGroup> parse(Path report) throws IOException {
        if (!Files.exists(report)) {
            log.warn("Variant report not found: {}", report);
            return List.of();
        }
        return parse(decode(Files.readAllBytes(report)));
    }

    static String decode(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.info("Variant report is not UTF-8, reading as {}", LEGACY.name());
            return new String(bytes, LEGACY);
        }
    }

    public static List<VariantGroup> parse(String text) {
        List<VariantGroup> groups = new ArrayList<>();
        if (text == null || text.isEmpty()) return groups;

        VariantGroup current = null;
        for (String line : text.split("\\r?\\n")) {
            if (line.isEmpty()) continue;

            Matcher header = HEADER.matcher(line);
            if (header.matches()) {
                current = new VariantGroup(groupId(header.group(1), groups.size() + 1), header.group(2).trim());
                groups.add(current);
                continue;
            }
            if (current == null) continue;

            Matcher product = PRODUCT.matcher(line);
            if (product.matches()) {
                String name = product.group(3).trim();
                current.addMember(new VariantMember(product.group(2).trim(), name,
                        BaseNameExtractor.extractBaseName(name), product.group(1) != null));
                continue;
            }

            Matcher base = BASE_NAME.matcher(line);
            if (base.matches() && !current.getMembers().isEmpty()) {
                List<VariantMember> members = current.getMembers();
                members.get(members.size() - 1).setBaseName(base.group(1).trim());
            }
        }
        log.info("Parsed {} groups from variant report", groups.size());
        return groups;
    }

    /** Group number from the header, or its position when the number does not fit an int. */
    private static int groupId(String digits, int position) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            log.warn("Group number {} out of range, renumbered to {}", digits, position);
            return position;
        }
    }
}
