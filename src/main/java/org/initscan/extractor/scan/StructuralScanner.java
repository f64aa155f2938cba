package org.initscan.extractor.scan;

/**
 * String-literal aware depth counter for parentheses and braces.
 * <p>
 * This scanner never fails. Depths may become negative on malformed input; callers
 * detect that by checking the returned depth against the baseline they expect at a
 * block boundary.
 */
public final class StructuralScanner {

    private StructuralScanner() {
        // Private constructor to prevent instantiation
    }

    /**
     * Scans every character of {@code text} once, starting from the given depth.
     *
     * @param text The text slice to scan.
     * @param start The depth in effect before the first character.
     * @return The depth after the last character.
     */
    public static Depth scan(String text, Depth start) {
        DelimiterTracker tracker = new DelimiterTracker(start);
        for (int i = 0; i < text.length(); i++) {
            tracker.feed(text.charAt(i));
        }
        return tracker.depth();
    }

    /**
     * Scans {@code text} starting at depth zero.
     *
     * @param text The text slice to scan.
     * @return The depth after the last character.
     */
    public static Depth scan(String text) {
        return scan(text, Depth.ZERO);
    }

    /**
     * @param text The text to check.
     * @return {@code true} if every paren and brace in {@code text} is closed and no closing
     *         delimiter appears before its opening partner.
     */
    public static boolean isBalanced(String text) {
        DelimiterTracker tracker = new DelimiterTracker(Depth.ZERO);
        for (int i = 0; i < text.length(); i++) {
            tracker.feed(text.charAt(i));
        }
        return !tracker.hasUnderflowed() && tracker.depth().isTopLevel();
    }

    /**
     * Finds the delimiter that closes the one at {@code openIndex}.
     * <p>
     * Only delimiters of the same kind are counted, and delimiters inside string literals
     * are ignored.
     *
     * @param text The text to search.
     * @param openIndex The index of an opening paren or brace.
     * @return The index of the matching closing delimiter, or -1 if the text ends first.
     * @throws IllegalArgumentException if {@code openIndex} does not point at an opening delimiter.
     */
    public static int findClosing(String text, int openIndex) {
        char open = text.charAt(openIndex);
        char close;
        if (open == '(') {
            close = ')';
        } else if (open == '{') {
            close = '}';
        } else {
            throw new IllegalArgumentException("Not an opening delimiter: '" + open + "' at " + openIndex);
        }
        boolean isParen = open == '(';
        DelimiterTracker tracker = new DelimiterTracker(Depth.ZERO);
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (tracker.feed(c) && c == close && (isParen ? tracker.paren() : tracker.brace()) == 0) {
                return i;
            }
        }
        return -1;
    }
}
