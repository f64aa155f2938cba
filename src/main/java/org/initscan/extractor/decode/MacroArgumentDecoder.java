package org.initscan.extractor.decode;

import org.initscan.extractor.api.ExtractionErrorCode;
import org.initscan.extractor.api.ExtractionException;
import org.initscan.extractor.scan.StructuralScanner;
import org.initscan.extractor.scan.TopLevelSplitter;

import java.util.List;

/**
 * Extracts the arguments of a macro-call value such as {@code MON_TYPES(TYPE_GRASS, TYPE_POISON)}.
 * A value without any parenthesis is returned as its single argument.
 */
public final class MacroArgumentDecoder {

    private static final String SOURCE = "macro-arguments";

    private MacroArgumentDecoder() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param raw The raw field value; {@code null} and blank values decode to an empty list.
     * @return The top-level arguments between the first {@code (} and its matching {@code )}.
     * @throws ExtractionException with {@link ExtractionErrorCode#PARSE_ERROR} if the parentheses
     *         are missing a partner, text follows the call or the argument list is unbalanced.
     */
    public static List<String> decode(String raw) throws ExtractionException {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String text = raw.strip();
        int start = text.indexOf('(');
        if (start < 0) {
            if (text.indexOf(')') >= 0) {
                throw new ExtractionException(ExtractionErrorCode.PARSE_ERROR, SOURCE, raw, "Unmatched parenthesis in macro call");
            }
            return List.of(text);
        }
        int end = StructuralScanner.findClosing(text, start);
        if (end < 0) {
            throw new ExtractionException(ExtractionErrorCode.PARSE_ERROR, SOURCE, raw, "Unmatched parenthesis in macro call");
        }
        if (end != text.length() - 1) {
            throw new ExtractionException(ExtractionErrorCode.PARSE_ERROR, SOURCE, text.substring(end + 1),
                    "Unexpected text after macro call");
        }
        String inner = text.substring(start + 1, end);
        if (!StructuralScanner.isBalanced(inner)) {
            throw new ExtractionException(ExtractionErrorCode.PARSE_ERROR, SOURCE, inner, "Unbalanced macro arguments");
        }
        return TopLevelSplitter.split(inner);
    }
}
