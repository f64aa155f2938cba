package org.initscan.extractor.expr;

/**
 * A single token of a constant expression.
 *
 * @param type The token kind.
 * @param text The exact source text of the token.
 * @param value The numeric value for {@link TokenType#NUMBER} tokens, otherwise 0.
 * @param position The zero-based offset of the token in the expression text.
 */
public record Token(TokenType type, String text, long value, int position) {

    /**
     * @param symbol An operator symbol.
     * @return {@code true} if this token is the given operator.
     */
    public boolean isOperator(String symbol) {
        return type == TokenType.OPERATOR && text.equals(symbol);
    }
}
