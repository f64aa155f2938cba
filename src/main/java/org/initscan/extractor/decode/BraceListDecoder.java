package org.initscan.extractor.decode;

import org.initscan.extractor.api.ExtractionErrorCode;
import org.initscan.extractor.api.ExtractionException;
import org.initscan.extractor.scan.StructuralScanner;
import org.initscan.extractor.scan.TopLevelSplitter;

import java.util.List;

/**
 * Extracts the elements of a brace list such as {@code { ABILITY_OVERGROW, ABILITY_NONE }}.
 */
public final class BraceListDecoder {

    private static final String SOURCE = "brace-list";

    private BraceListDecoder() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param raw The raw field value; {@code null} and blank values decode to an empty list.
     * @return The top-level elements after removing one layer of wrapping braces. Braces are only
     *         removed when the first one closes at the very end, so {@code {a}, {b}} yields two groups.
     * @throws ExtractionException with {@link ExtractionErrorCode#PARSE_ERROR} if the list is unbalanced.
     */
    public static List<String> decode(String raw) throws ExtractionException {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String text = raw.strip();
        if (text.startsWith("{") && StructuralScanner.findClosing(text, 0) == text.length() - 1) {
            text = text.substring(1, text.length() - 1);
        }
        if (!StructuralScanner.isBalanced(text)) {
            throw new ExtractionException(ExtractionErrorCode.PARSE_ERROR, SOURCE, raw, "Unbalanced brace list");
        }
        return TopLevelSplitter.split(text);
    }

    /**
     * Writes elements back as a brace list that {@link #decode(String)} reads unchanged.
     * @param elements The list elements.
     * @return The brace list text.
     */
    public static String encode(List<String> elements) {
        return "{" + String.join(", ", elements) + "}";
    }
}
