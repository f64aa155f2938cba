package org.initscan.extractor.expr;

import org.initscan.extractor.api.ExtractionErrorCode;
import org.initscan.extractor.api.ExtractionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a C-style constant expression into a list of tokens.
 * Whitespace produces no token; the list always ends with {@link TokenType#END_OF_INPUT}.
 */
public class ExpressionLexer {

    private static final String SOURCE = "expression";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new lexer for one expression.
     * @param source The expression text.
     */
    public ExpressionLexer(String source) {
        this.source = source;
    }

    /**
     * Tokenizes the whole expression.
     * @return The recognized tokens.
     * @throws ExtractionException with {@link ExtractionErrorCode#SYNTAX_ERROR} on an unrecognized character,
     *         a decimal literal with a leading zero or a literal that does not fit into 64 bits.
     */
    public List<Token> scanTokens() throws ExtractionException {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_INPUT, "", 0, current));
        return tokens;
    }

    private void scanToken() throws ExtractionException {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r', '\n' -> { }
            case '+', '-', '*', '/', '%', '^', '~', '?', ':', '(', ')' -> addOperator();
            case '=' -> {
                if (!match('=')) {
                    throw unexpected();
                }
                addOperator();
            }
            case '!' -> {
                match('=');
                addOperator();
            }
            case '<' -> {
                if (!match('<')) match('=');
                addOperator();
            }
            case '>' -> {
                if (!match('>')) match('=');
                addOperator();
            }
            case '&' -> {
                match('&');
                addOperator();
            }
            case '|' -> {
                match('|');
                addOperator();
            }
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw unexpected();
                }
            }
        }
    }

    private void number() throws ExtractionException {
        int radix = 10;
        if (previous() == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            radix = 16;
            while (isHexDigit(peek())) advance();
        } else {
            while (isDigit(peek())) advance();
        }
        String text = source.substring(start, current);
        String digits = radix == 16 ? text.substring(2) : text;
        if (digits.isEmpty()) {
            throw new ExtractionException(ExtractionErrorCode.SYNTAX_ERROR, SOURCE, text, "Empty hexadecimal literal");
        }
        if (radix == 10 && digits.length() > 1 && digits.charAt(0) == '0') {
            throw new ExtractionException(ExtractionErrorCode.SYNTAX_ERROR, SOURCE, text, "Octal literals are not supported");
        }
        try {
            // Unsigned magnitude, reinterpreted as a signed 64-bit value.
            long value = Long.parseUnsignedLong(digits, radix);
            tokens.add(new Token(TokenType.NUMBER, text, value, start));
        } catch (NumberFormatException e) {
            throw new ExtractionException(ExtractionErrorCode.SYNTAX_ERROR, SOURCE, text, "Integer literal out of range", e);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        tokens.add(new Token(TokenType.IDENTIFIER, source.substring(start, current), 0, start));
    }

    private void addOperator() {
        tokens.add(new Token(TokenType.OPERATOR, source.substring(start, current), 0, start));
    }

    private ExtractionException unexpected() {
        return new ExtractionException(ExtractionErrorCode.SYNTAX_ERROR, SOURCE, source.substring(start),
                "Unsupported token in expression");
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
