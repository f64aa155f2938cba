package org.initscan.extractor.header;

import org.initscan.extractor.api.ExtractionException;
import org.initscan.extractor.expr.ExpressionEvaluator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the body of a {@code struct LevelUpMove} array.
 * <p>
 * Designated {@code .move = M, .level = L} pairs are read first. Bodies without any such
 * pair are read as {@code LEVEL_UP_MOVE(L, M)} macro calls instead. Terminator and
 * placeholder moves are dropped.
 */
public final class LevelUpMoveDecoder {

    private static final Pattern DESIGNATED = Pattern.compile("\\.move\\s*=\\s*([^,]+),\\s*\\.level\\s*=\\s*([^,}]+)");
    private static final Pattern MACRO = Pattern.compile("LEVEL_UP_MOVE\\s*\\(([^,]+),\\s*([^)]+)\\)");
    private static final Set<String> IGNORED_MOVES = Set.of("MOVE_UNAVAILABLE", "LEVEL_UP_MOVE_END", "MOVE_NONE");

    private LevelUpMoveDecoder() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param body The raw array body.
     * @param evaluator Evaluates the level expressions.
     * @return The moves in source order.
     * @throws ExtractionException if a level expression cannot be evaluated.
     */
    public static List<LevelUpMove> decode(String body, ExpressionEvaluator evaluator) throws ExtractionException {
        List<LevelUpMove> entries = new ArrayList<>();
        Matcher designated = DESIGNATED.matcher(body);
        while (designated.find()) {
            String move = designated.group(1).strip();
            if (IGNORED_MOVES.contains(move) || move.startsWith("0x")) {
                continue;
            }
            entries.add(new LevelUpMove(evaluator.evaluateInt(designated.group(2)), move));
        }
        if (!entries.isEmpty()) {
            return entries;
        }

        Matcher macro = MACRO.matcher(body);
        while (macro.find()) {
            String move = macro.group(2).strip();
            if (IGNORED_MOVES.contains(move)) {
                continue;
            }
            entries.add(new LevelUpMove(evaluator.evaluateInt(macro.group(1)), move));
        }
        return entries;
    }

    /**
     * Scans all level-up learnset arrays of a text and decodes them.
     *
     * @param text The preprocessed text.
     * @param evaluator Evaluates the level expressions.
     * @return Array name to its moves.
     * @throws ExtractionException if a level expression cannot be evaluated.
     */
    public static Map<String, List<LevelUpMove>> scan(String text, ExpressionEvaluator evaluator) throws ExtractionException {
        Map<String, List<LevelUpMove>> learnsets = new LinkedHashMap<>();
        for (Map.Entry<String, String> table : ArrayTableScanner.scan(text, ArrayTableScanner.LEVEL_UP_MOVE_TYPE).entrySet()) {
            learnsets.put(table.getKey(), decode(table.getValue(), evaluator));
        }
        return learnsets;
    }
}
