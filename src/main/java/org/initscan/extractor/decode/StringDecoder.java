package org.initscan.extractor.decode;

import org.initscan.extractor.api.ExtractionErrorCode;
import org.initscan.extractor.api.ExtractionException;
import org.initscan.extractor.scan.StructuralScanner;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes string-valued fields such as {@code _("Bulbasaur")} or
 * {@code COMPOUND_STRING("A strange seed\n" "was planted")}.
 * <p>
 * One call-like wrapper is removed, every string literal in the remainder is decoded and
 * the results are concatenated, as the C compiler does for adjacent literals. A value
 * without any literal is returned trimmed, unchanged.
 */
public final class StringDecoder {

    private static final String SOURCE = "string";
    private static final Pattern LITERAL = Pattern.compile("\"((?:\\\\.|[^\"\\\\])*)\"", Pattern.DOTALL);

    private StringDecoder() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param raw The raw field value; {@code null} and blank values decode to an empty string.
     * @return The concatenated, unescaped literal contents.
     * @throws ExtractionException with {@link ExtractionErrorCode#PARSE_ERROR} if a literal is not
     *         terminated or the delimiters of the value are unbalanced.
     */
    public static String decode(String raw) throws ExtractionException {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String text = Wrappers.stripCall(raw.strip());
        text = Wrappers.stripCall(text);
        if (!StructuralScanner.isBalanced(text) || hasUnterminatedLiteral(text)) {
            throw new ExtractionException(ExtractionErrorCode.PARSE_ERROR, SOURCE, raw, "Unbalanced string value");
        }

        Matcher matcher = LITERAL.matcher(text);
        StringBuilder out = new StringBuilder();
        boolean found = false;
        while (matcher.find()) {
            found = true;
            out.append(EscapeDecoder.decode(matcher.group(1)));
        }
        return found ? out.toString() : text.strip();
    }

    private static boolean hasUnterminatedLiteral(String text) {
        boolean inString = false;
        boolean escape = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' && !escape) {
                inString = !inString;
            }
            escape = inString && c == '\\' && !escape;
        }
        return inString;
    }
}
