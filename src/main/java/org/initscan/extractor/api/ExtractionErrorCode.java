package org.initscan.extractor.api;

/**
 * Defines the closed set of error kinds the extraction engine can raise.
 * Tests match on these codes instead of on message wording.
 */
public enum ExtractionErrorCode {
    // region Expression Errors
    /** Malformed or unsupported token stream in an expression. */
    SYNTAX_ERROR,
    /** Division or modulo by zero. */
    ARITHMETIC_ERROR,
    /** An identifier outside the fixed symbol table was referenced. */
    UNRESOLVED_IDENTIFIER,
    // endregion

    // region Decoder Errors
    /** Unbalanced delimiters or a missing required segment in a value decoder. */
    PARSE_ERROR,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading a source file. */
    IO_ERROR_READING_FILE
    // endregion
}
