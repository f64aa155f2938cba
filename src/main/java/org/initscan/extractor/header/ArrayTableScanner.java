package org.initscan.extractor.header;

import org.initscan.extractor.scan.TopLevelSplitter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code static const TYPE NAME[] = { ... };} arrays, such as level-up or teachable
 * learnsets, in preprocessed text.
 */
public final class ArrayTableScanner {

    /** Element type of level-up learnset arrays. */
    public static final String LEVEL_UP_MOVE_TYPE = "struct LevelUpMove";
    /** Element type of egg-move and teachable learnset arrays. */
    public static final String MOVE_ID_TYPE = "u16";

    private static final Set<String> IGNORED_MOVES = Set.of("MOVE_UNAVAILABLE", "MOVE_NONE");

    private ArrayTableScanner() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param text The preprocessed text.
     * @param elementType The declared element type, e.g. {@code u16}; matched literally, whitespace-insensitive.
     * @return Array name to the raw text between its braces, in source order.
     */
    public static Map<String, String> scan(String text, String elementType) {
        String typePattern = String.join("\\s+", elementType.strip().split("\\s+"));
        Pattern array = Pattern.compile(
                "static\\s+const\\s+" + typePattern + "\\s+(?<name>\\w+)\\[\\]\\s*=\\s*\\{(?<body>.*?)\\};",
                Pattern.DOTALL);
        Map<String, String> tables = new LinkedHashMap<>();
        Matcher matcher = array.matcher(text);
        while (matcher.find()) {
            tables.put(matcher.group("name"), matcher.group("body"));
        }
        return tables;
    }

    /**
     * @param body The body of a move-id array.
     * @return The move constants, without {@code MOVE_UNAVAILABLE} and {@code MOVE_NONE} terminators.
     */
    public static List<String> moveList(String body) {
        List<String> moves = new ArrayList<>();
        for (String entry : TopLevelSplitter.split(body)) {
            if (!IGNORED_MOVES.contains(entry)) {
                moves.add(entry);
            }
        }
        return moves;
    }

    /**
     * Scans all move-id arrays and decodes them with {@link #moveList(String)}.
     * @param text The preprocessed text.
     * @return Array name to its moves.
     */
    public static Map<String, List<String>> scanMoveLists(String text) {
        Map<String, List<String>> learnsets = new LinkedHashMap<>();
        scan(text, MOVE_ID_TYPE).forEach((name, body) -> learnsets.put(name, moveList(body)));
        return learnsets;
    }
}
