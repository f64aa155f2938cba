package org.initscan.extractor.scan;

/**
 * Paren and brace nesting depth at a point in a scanned text.
 *
 * @param paren The number of currently open parentheses.
 * @param brace The number of currently open braces.
 */
public record Depth(int paren, int brace) {

    /** Depth at the start of a top-level text. */
    public static final Depth ZERO = new Depth(0, 0);

    /**
     * @return {@code true} if neither parens nor braces are open.
     */
    public boolean isTopLevel() {
        return paren == 0 && brace == 0;
    }
}
