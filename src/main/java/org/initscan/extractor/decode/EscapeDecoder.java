package org.initscan.extractor.decode;

import org.initscan.extractor.api.ExtractionErrorCode;
import org.initscan.extractor.api.ExtractionException;

/**
 * Decodes the escape sequences of a single C string literal body.
 * <p>
 * Unknown escapes such as the {@code \p} and {@code \l} text-control codes used by game
 * text are kept verbatim, backslash included.
 */
final class EscapeDecoder {

    private EscapeDecoder() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param body The literal without its surrounding quotes.
     * @return The decoded text.
     * @throws ExtractionException if the body ends with a lone backslash or a hex escape has no digits.
     */
    static String decode(String body) throws ExtractionException {
        StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i++);
            if (c != '\\') {
                out.append(c);
                continue;
            }
            if (i >= body.length()) {
                throw new ExtractionException(ExtractionErrorCode.PARSE_ERROR, "string", body, "Dangling backslash in string literal");
            }
            char e = body.charAt(i++);
            switch (e) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'v' -> out.append('\u000B');
                case '\\', '"', '\'', '?' -> out.append(e);
                case 'x' -> {
                    int start = i;
                    while (i < body.length() && i - start < 2 && Character.digit(body.charAt(i), 16) >= 0) i++;
                    if (i == start) {
                        throw new ExtractionException(ExtractionErrorCode.PARSE_ERROR, "string", body, "Hex escape without digits");
                    }
                    out.append((char) Integer.parseInt(body.substring(start, i), 16));
                }
                default -> {
                    if (e >= '0' && e <= '7') {
                        int start = i - 1;
                        while (i < body.length() && i - start < 3 && body.charAt(i) >= '0' && body.charAt(i) <= '7') i++;
                        out.append((char) Integer.parseInt(body.substring(start, i), 8));
                    } else {
                        out.append('\\').append(e);
                    }
                }
            }
        }
        return out.toString();
    }
}
