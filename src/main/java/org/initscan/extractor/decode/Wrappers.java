package org.initscan.extractor.decode;

import org.initscan.extractor.scan.StructuralScanner;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for removing call-like wrappers such as {@code _(...)}, {@code COMPOUND_STRING(...)}
 * or {@code EVOLUTION(...)} from a raw value.
 */
final class Wrappers {

    private static final Pattern CALL_PREFIX = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)?\\s*\\(");

    private Wrappers() {
        // Private constructor to prevent instantiation
    }

    /**
     * Removes one wrapping {@code IDENT(...)} or {@code (...)} layer if the paren after the
     * name closes at the very end of the text.
     *
     * @param text Trimmed raw value.
     * @return The interior, or {@code text} unchanged if it is not wrapped.
     */
    static String stripCall(String text) {
        Matcher matcher = CALL_PREFIX.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        int open = matcher.end() - 1;
        int close = StructuralScanner.findClosing(text, open);
        if (close != text.length() - 1) {
            return text;
        }
        return text.substring(open + 1, close).strip();
    }
}
