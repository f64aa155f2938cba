package org.initscan.extractor.scan;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a comma-delimited list at nesting depth zero.
 * <p>
 * Commas inside parentheses, braces or string literals are not split points. Every piece
 * is trimmed and empty pieces are dropped. All list-shaped decoders go through here, so
 * the field counts they report depend on this being exact.
 */
public final class TopLevelSplitter {

    private TopLevelSplitter() {
        // Private constructor to prevent instantiation
    }

    /**
     * Splits {@code text} on top-level commas.
     *
     * @param text The list text, without surrounding delimiters.
     * @return The trimmed, non-empty pieces in source order.
     */
    public static List<String> split(String text) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        DelimiterTracker tracker = new DelimiterTracker(Depth.ZERO);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (tracker.feed(c) && c == ',' && tracker.depth().isTopLevel()) {
                addPart(parts, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addPart(parts, current);
        return parts;
    }

    private static void addPart(List<String> parts, CharSequence raw) {
        String part = raw.toString().trim();
        if (!part.isEmpty()) {
            parts.add(part);
        }
    }
}
