package org.initscan.extractor.scan;

/**
 * Character-by-character paren and brace tracking that skips string literals.
 * <p>
 * Shared by every scanner in this package so that quoting and escape handling is decided
 * in one place.
 */
final class DelimiterTracker {

    private int paren;
    private int brace;
    private boolean inString;
    private boolean escape;
    private boolean underflow;

    DelimiterTracker(Depth start) {
        this.paren = start.paren();
        this.brace = start.brace();
    }

    /**
     * Feeds the next character.
     *
     * @param c The character.
     * @return {@code true} if {@code c} lies outside a string literal.
     */
    boolean feed(char c) {
        if (c == '"' && !escape) {
            inString = !inString;
        }
        if (inString) {
            // The character after a backslash never closes the string.
            escape = c == '\\' && !escape;
            return false;
        }
        escape = false;
        switch (c) {
            case '(' -> paren++;
            case ')' -> paren--;
            case '{' -> brace++;
            case '}' -> brace--;
            default -> { }
        }
        if (paren < 0 || brace < 0) {
            underflow = true;
        }
        return true;
    }

    int paren() {
        return paren;
    }

    int brace() {
        return brace;
    }

    Depth depth() {
        return new Depth(paren, brace);
    }

    /**
     * @return {@code true} if a closing delimiter appeared without an open partner at any point.
     */
    boolean hasUnderflowed() {
        return underflow;
    }
}
