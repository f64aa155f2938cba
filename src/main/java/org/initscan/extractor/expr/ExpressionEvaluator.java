package org.initscan.extractor.expr;

import org.initscan.extractor.api.ExtractionErrorCode;
import org.initscan.extractor.api.ExtractionException;

import java.util.List;
import java.util.OptionalLong;

/**
 * Evaluates restricted C-style integer constant expressions.
 * <p>
 * The evaluator is a recursive-descent parser that computes values directly instead of
 * building a tree. Precedence, from loosest to tightest binding:
 * <pre>
 *   ?:  ||  &amp;&amp;  |  ^  &amp;  == !=  &lt; &gt; &lt;= &gt;=  &lt;&lt; &gt;&gt;  + -  * / %  unary + - ! ~  primary
 * </pre>
 * Arithmetic is performed on signed 64-bit values. Both branches of {@code ?:},
 * {@code ||} and {@code &&} are evaluated since operands have no side effects.
 * <p>
 * Instances are immutable and may be shared between threads; each call to
 * {@link #evaluate(String)} works on its own token cursor.
 */
public class ExpressionEvaluator {

    private static final String SOURCE = "expression";
    /** Maximum number of nested parentheses, unary operators and conditionals. */
    static final int MAX_NESTING = 256;

    private final SymbolTable symbols;

    /**
     * Creates an evaluator that only knows {@code TRUE} and {@code FALSE}.
     */
    public ExpressionEvaluator() {
        this(SymbolTable.defaults());
    }

    /**
     * Creates an evaluator with a custom symbol table.
     * @param symbols The identifiers the expressions may reference.
     */
    public ExpressionEvaluator(SymbolTable symbols) {
        this.symbols = symbols;
    }

    public SymbolTable getSymbols() {
        return symbols;
    }

    /**
     * Evaluates one expression. Blank input evaluates to 0.
     *
     * @param expression The expression text.
     * @return The integer value.
     * @throws ExtractionException with {@link ExtractionErrorCode#SYNTAX_ERROR} for malformed input,
     *         {@link ExtractionErrorCode#ARITHMETIC_ERROR} for division or modulo by zero and
     *         {@link ExtractionErrorCode#UNRESOLVED_IDENTIFIER} for unknown names.
     */
    public long evaluate(String expression) throws ExtractionException {
        String text = expression == null ? "" : expression.trim();
        if (text.isEmpty()) {
            return 0;
        }
        Cursor cursor = new Cursor(text, new ExpressionLexer(text).scanTokens());
        long value = ternary(cursor);
        if (cursor.peek().type() != TokenType.END_OF_INPUT) {
            throw cursor.error("Unexpected trailing input");
        }
        return value;
    }

    /**
     * Evaluates an expression that must fit into a Java {@code int}.
     *
     * @param expression The expression text.
     * @return The integer value.
     * @throws ExtractionException as {@link #evaluate(String)}, or {@link ExtractionErrorCode#ARITHMETIC_ERROR}
     *         if the value does not fit into 32 bits.
     */
    public int evaluateInt(String expression) throws ExtractionException {
        long value = evaluate(expression);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ExtractionException(ExtractionErrorCode.ARITHMETIC_ERROR, SOURCE, expression,
                    "Value " + value + " does not fit into 32 bits");
        }
        return (int) value;
    }

    private long ternary(Cursor cursor) throws ExtractionException {
        cursor.enter();
        try {
            long condition = logicalOr(cursor);
            if (cursor.match("?")) {
                long whenTrue = ternary(cursor);
                cursor.expect(":");
                long whenFalse = ternary(cursor);
                return condition != 0 ? whenTrue : whenFalse;
            }
            return condition;
        } finally {
            cursor.exit();
        }
    }

    private long logicalOr(Cursor cursor) throws ExtractionException {
        long value = logicalAnd(cursor);
        while (cursor.match("||")) {
            long right = logicalAnd(cursor);
            value = (value != 0 || right != 0) ? 1 : 0;
        }
        return value;
    }

    private long logicalAnd(Cursor cursor) throws ExtractionException {
        long value = bitwiseOr(cursor);
        while (cursor.match("&&")) {
            long right = bitwiseOr(cursor);
            value = (value != 0 && right != 0) ? 1 : 0;
        }
        return value;
    }

    private long bitwiseOr(Cursor cursor) throws ExtractionException {
        long value = bitwiseXor(cursor);
        while (cursor.match("|")) {
            value |= bitwiseXor(cursor);
        }
        return value;
    }

    private long bitwiseXor(Cursor cursor) throws ExtractionException {
        long value = bitwiseAnd(cursor);
        while (cursor.match("^")) {
            value ^= bitwiseAnd(cursor);
        }
        return value;
    }

    private long bitwiseAnd(Cursor cursor) throws ExtractionException {
        long value = equality(cursor);
        while (cursor.match("&")) {
            value &= equality(cursor);
        }
        return value;
    }

    private long equality(Cursor cursor) throws ExtractionException {
        long value = relational(cursor);
        while (true) {
            if (cursor.match("==")) {
                value = value == relational(cursor) ? 1 : 0;
            } else if (cursor.match("!=")) {
                value = value != relational(cursor) ? 1 : 0;
            } else {
                return value;
            }
        }
    }

    private long relational(Cursor cursor) throws ExtractionException {
        long value = shift(cursor);
        while (true) {
            if (cursor.match("<")) {
                value = value < shift(cursor) ? 1 : 0;
            } else if (cursor.match(">")) {
                value = value > shift(cursor) ? 1 : 0;
            } else if (cursor.match("<=")) {
                value = value <= shift(cursor) ? 1 : 0;
            } else if (cursor.match(">=")) {
                value = value >= shift(cursor) ? 1 : 0;
            } else {
                return value;
            }
        }
    }

    private long shift(Cursor cursor) throws ExtractionException {
        long value = additive(cursor);
        while (true) {
            if (cursor.match("<<")) {
                value = value << additive(cursor);
            } else if (cursor.match(">>")) {
                value = value >> additive(cursor);
            } else {
                return value;
            }
        }
    }

    private long additive(Cursor cursor) throws ExtractionException {
        long value = multiplicative(cursor);
        while (true) {
            if (cursor.match("+")) {
                value += multiplicative(cursor);
            } else if (cursor.match("-")) {
                value -= multiplicative(cursor);
            } else {
                return value;
            }
        }
    }

    private long multiplicative(Cursor cursor) throws ExtractionException {
        long value = unary(cursor);
        while (true) {
            if (cursor.match("*")) {
                value *= unary(cursor);
            } else if (cursor.match("/")) {
                Token operator = cursor.previous();
                long divisor = unary(cursor);
                if (divisor == 0) {
                    throw cursor.arithmetic(operator, "Division by zero in expression");
                }
                value /= divisor;
            } else if (cursor.match("%")) {
                Token operator = cursor.previous();
                long divisor = unary(cursor);
                if (divisor == 0) {
                    throw cursor.arithmetic(operator, "Modulo by zero in expression");
                }
                value %= divisor;
            } else {
                return value;
            }
        }
    }

    private long unary(Cursor cursor) throws ExtractionException {
        cursor.enter();
        try {
            if (cursor.match("+")) {
                return unary(cursor);
            }
            if (cursor.match("-")) {
                return -unary(cursor);
            }
            if (cursor.match("!")) {
                return unary(cursor) == 0 ? 1 : 0;
            }
            if (cursor.match("~")) {
                return ~unary(cursor);
            }
            return primary(cursor);
        } finally {
            cursor.exit();
        }
    }

    private long primary(Cursor cursor) throws ExtractionException {
        Token token = cursor.peek();
        if (cursor.match("(")) {
            long value = ternary(cursor);
            cursor.expect(")");
            return value;
        }
        if (token.type() == TokenType.NUMBER) {
            cursor.advance();
            return token.value();
        }
        if (token.type() == TokenType.IDENTIFIER) {
            cursor.advance();
            OptionalLong resolved = symbols.resolve(token.text());
            if (resolved.isEmpty()) {
                throw new ExtractionException(ExtractionErrorCode.UNRESOLVED_IDENTIFIER, SOURCE, token.text(),
                        "Unknown identifier in expression");
            }
            return resolved.getAsLong();
        }
        if (token.type() == TokenType.END_OF_INPUT) {
            throw cursor.error("Unexpected end of expression");
        }
        throw cursor.error("Unexpected token in expression");
    }

    /**
     * Read position over the tokens of a single evaluation.
     */
    private static final class Cursor {
        private final String text;
        private final List<Token> tokens;
        private int current = 0;
        private int nesting = 0;

        Cursor(String text, List<Token> tokens) {
            this.text = text;
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(current);
        }

        Token previous() {
            return tokens.get(current - 1);
        }

        Token advance() {
            Token token = tokens.get(current);
            if (token.type() != TokenType.END_OF_INPUT) current++;
            return token;
        }

        void enter() throws ExtractionException {
            if (++nesting > MAX_NESTING) {
                throw error("Expression nested too deeply");
            }
        }

        void exit() {
            nesting--;
        }

        boolean match(String symbol) {
            if (peek().isOperator(symbol)) {
                current++;
                return true;
            }
            return false;
        }

        void expect(String symbol) throws ExtractionException {
            if (!match(symbol)) {
                Token found = peek();
                throw error("Expected '" + symbol + "' but found '"
                        + (found.type() == TokenType.END_OF_INPUT ? "end of input" : found.text()) + "'");
            }
        }

        ExtractionException error(String message) {
            return new ExtractionException(ExtractionErrorCode.SYNTAX_ERROR, SOURCE, fragmentAt(peek()), message);
        }

        ExtractionException arithmetic(Token operator, String message) {
            return new ExtractionException(ExtractionErrorCode.ARITHMETIC_ERROR, SOURCE, fragmentAt(operator), message);
        }

        private String fragmentAt(Token token) {
            return token.type() == TokenType.END_OF_INPUT ? text : text.substring(token.position());
        }
    }
}
