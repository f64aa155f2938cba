package org.initscan.extractor.block;

import org.initscan.extractor.diagnostics.DiagnosticsEngine;
import org.initscan.extractor.scan.Depth;
import org.initscan.extractor.scan.StructuralScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the interior of one {@code { ... }} initializer into a {@link FieldMap}.
 * <p>
 * A field starts on a line beginning with {@code .name =}. Its value may continue over
 * further lines; it ends once all parens and braces opened in the value are closed again
 * and the last consumed fragment ends with a comma. The fragments are joined with single
 * spaces and only that final comma is dropped. Several {@code .a = 1, .b = 2,} assignments on
 * one line are split onto their own lines first.
 * <p>
 * If the text ends while a field is still open, the partial value is committed instead of
 * being dropped, and a warning is reported since this can hide malformed input.
 */
public final class BlockAssignmentExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(BlockAssignmentExtractor.class);
    private static final Pattern FIELD_START = Pattern.compile("^\\.([A-Za-z_][A-Za-z0-9_]*)\\s*=(?!=)(.*)$");

    private BlockAssignmentExtractor() {
        // Private constructor to prevent instantiation
    }

    /**
     * Extracts all field assignments of an initializer body.
     *
     * @param interior The text between the outer braces.
     * @return The extracted fields.
     */
    public static FieldMap extract(String interior) {
        return extract(interior, null, "<block>", 1);
    }

    /**
     * Extracts all field assignments of an initializer body, reporting values that were
     * committed at end of input.
     *
     * @param interior The text between the outer braces.
     * @param diagnostics Receives a warning per partially committed field; may be {@code null}.
     * @param subject Name used in diagnostics, typically the entry key.
     * @param firstLineNumber The line number of the first line of {@code interior} in the scanned text.
     * @return The extracted fields.
     */
    public static FieldMap extract(String interior, DiagnosticsEngine diagnostics, String subject, int firstLineNumber) {
        Map<String, String> assignments = new LinkedHashMap<>();
        String currentField = null;
        int currentFieldLine = 0;
        List<String> buffer = new ArrayList<>();
        Depth depth = Depth.ZERO;

        String[] lines = interior.split("\n", -1);
        for (int lineIndex = 0; lineIndex < lines.length; lineIndex++) {
            int lineNumber = firstLineNumber + lineIndex;
            for (String rawLine : splitInlineAssignments(lines[lineIndex])) {
                String stripped = rawLine.strip();
                if (stripped.isEmpty()) {
                    continue;
                }
                String value;
                if (currentField == null) {
                    Matcher matcher = FIELD_START.matcher(stripped);
                    if (!matcher.matches()) {
                        continue;
                    }
                    currentField = matcher.group(1);
                    currentFieldLine = lineNumber;
                    value = matcher.group(2).strip();
                    buffer.clear();
                    depth = Depth.ZERO;
                } else {
                    value = stripped;
                }
                if (!value.isEmpty()) {
                    buffer.add(value);
                }
                depth = StructuralScanner.scan(value, depth);
                if (depth.isTopLevel() && value.endsWith(",")) {
                    assignments.put(currentField, joinFragments(buffer));
                    currentField = null;
                }
            }
        }

        if (currentField != null) {
            String partial = joinFragments(buffer);
            assignments.put(currentField, partial);
            String reason = depth.isTopLevel()
                    ? "Value of field '" + currentField + "' has no terminating comma; committed as is"
                    : "Value of field '" + currentField + "' is unbalanced at end of block; committed partial value";
            LOG.debug("{}: {}", subject, reason);
            if (diagnostics != null) {
                diagnostics.reportWarning(reason, subject, currentFieldLine);
            }
        }
        return FieldMap.of(assignments);
    }

    private static String joinFragments(List<String> fragments) {
        String joined = String.join(" ", fragments).strip();
        if (joined.endsWith(",")) {
            joined = joined.substring(0, joined.length() - 1).strip();
        }
        return joined;
    }

    /**
     * Breaks a line at every {@code , .name} that occurs outside a string literal, so each
     * assignment begins a line of its own.
     */
    static List<String> splitInlineAssignments(String line) {
        List<String> result = new ArrayList<>();
        int segmentStart = 0;
        boolean inString = false;
        boolean escape = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"' && !escape) {
                inString = !inString;
            }
            if (inString) {
                escape = c == '\\' && !escape;
                continue;
            }
            escape = false;
            if (c == ',' && startsDesignator(line, i + 1)) {
                result.add(line.substring(segmentStart, i + 1));
                segmentStart = i + 1;
            }
        }
        result.add(line.substring(segmentStart));
        return result;
    }

    private static boolean startsDesignator(String line, int from) {
        int i = from;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) i++;
        return i + 1 < line.length()
                && line.charAt(i) == '.'
                && (Character.isLetter(line.charAt(i + 1)) || line.charAt(i + 1) == '_');
    }
}
