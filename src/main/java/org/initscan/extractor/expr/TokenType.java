package org.initscan.extractor.expr;

/**
 * Defines the token kinds produced by the {@link ExpressionLexer}.
 */
public enum TokenType {
    /** An integer literal, decimal or 0x-prefixed hexadecimal. */
    NUMBER,
    /** An operator or punctuation symbol such as {@code <<} or {@code (}. */
    OPERATOR,
    /** A name that is resolved through the {@link SymbolTable}. */
    IDENTIFIER,
    /** Marks the end of the expression text. */
    END_OF_INPUT
}
