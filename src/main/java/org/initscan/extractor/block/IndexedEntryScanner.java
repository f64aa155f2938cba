package org.initscan.extractor.block;

import org.initscan.extractor.diagnostics.DiagnosticsEngine;
import org.initscan.extractor.scan.StructuralScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds every {@code [KEY] = { ... }} entry in a text buffer and extracts its fields.
 * <p>
 * Each block is delimited by brace matching that ignores string literals. Anything after
 * the closing brace (usually {@code ;} or {@code ,}) is ignored. A malformed entry is
 * skipped and reported; it never aborts the rest of the scan. An entry counts as malformed
 * if its braces do not close before the end of the text or before the next entry header,
 * or if its body is empty.
 */
public final class IndexedEntryScanner {

    private static final Logger LOG = LoggerFactory.getLogger(IndexedEntryScanner.class);

    /** Key pattern for species tables. */
    public static final Pattern SPECIES_KEY = Pattern.compile("SPECIES_[A-Z0-9_]+");

    private IndexedEntryScanner() {
        // Private constructor to prevent instantiation
    }

    /**
     * Scans {@code text} for species entries.
     *
     * @param text The preprocessed source text.
     * @return The extracted entries.
     */
    public static IndexedEntryMap scan(String text) {
        return scan(text, SPECIES_KEY, null);
    }

    /**
     * Scans {@code text} for entries whose key matches {@code keyPattern}.
     *
     * @param text The preprocessed source text.
     * @param keyPattern Pattern a key must match completely, without the square brackets.
     * @param diagnostics Receives one error per skipped entry and warnings from field extraction; may be {@code null}.
     * @return The extracted entries, in source order. A key that occurs twice keeps its later block.
     */
    public static IndexedEntryMap scan(String text, Pattern keyPattern, DiagnosticsEngine diagnostics) {
        Pattern header = Pattern.compile("\\[\\s*(" + keyPattern.pattern() + ")\\s*\\]\\s*=");
        Matcher matcher = header.matcher(text);
        Map<String, FieldMap> result = new LinkedHashMap<>();
        LineCounter lines = new LineCounter(text);

        int position = 0;
        while (position < text.length() && matcher.find(position)) {
            String key = matcher.group(1);
            int headerLine = lines.lineAt(matcher.start());
            int open = skipWhitespace(text, matcher.end());
            if (open >= text.length() || text.charAt(open) != '{') {
                // A scalar designator such as "[KEY] = 5," is not an entry.
                position = matcher.end();
                continue;
            }

            int close = StructuralScanner.findClosing(text, open);
            int nextHeader = matcher.find(open + 1) ? matcher.start() : -1;
            if (close < 0 || (nextHeader >= 0 && nextHeader < close)) {
                skip(diagnostics, key, headerLine, "Block of entry is not closed; entry skipped");
                position = nextHeader >= 0 ? nextHeader : text.length();
                continue;
            }

            String interior = text.substring(open + 1, close);
            if (interior.isBlank()) {
                skip(diagnostics, key, headerLine, "Block of entry is empty; entry skipped");
            } else {
                result.put(key, BlockAssignmentExtractor.extract(interior, diagnostics, key, lines.lineAt(open)));
            }
            position = close + 1;
        }

        LOG.debug("Extracted {} entries matching {}", result.size(), keyPattern.pattern());
        return IndexedEntryMap.of(result);
    }

    private static void skip(DiagnosticsEngine diagnostics, String key, int line, String message) {
        LOG.debug("{} at line {}: {}", key, line, message);
        if (diagnostics != null) {
            diagnostics.reportError(message, key, line);
        }
    }

    private static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        return i;
    }

    /**
     * Maps character offsets to one-based line numbers. Offsets must be queried in
     * ascending order.
     */
    private static final class LineCounter {
        private final String text;
        private int offset = 0;
        private int line = 1;

        LineCounter(String text) {
            this.text = text;
        }

        int lineAt(int target) {
            if (target < offset) {
                offset = 0;
                line = 1;
            }
            for (; offset < target; offset++) {
                if (text.charAt(offset) == '\n') line++;
            }
            return line;
        }
    }
}
