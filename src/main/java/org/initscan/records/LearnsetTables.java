package org.initscan.records;

import org.initscan.extractor.header.LevelUpMove;

import java.util.List;
import java.util.Map;

/**
 * Learnset arrays by array name, as referenced from the {@code levelUpLearnset},
 * {@code eggMoveLearnset} and {@code teachableLearnset} fields.
 *
 * @param levelUp Level-up learnsets.
 * @param eggMoves Egg-move learnsets.
 * @param teachable Teachable (TM/tutor) learnsets.
 */
public record LearnsetTables(
        Map<String, List<LevelUpMove>> levelUp,
        Map<String, List<String>> eggMoves,
        Map<String, List<String>> teachable
) {
    private static final LearnsetTables EMPTY = new LearnsetTables(Map.of(), Map.of(), Map.of());

    public LearnsetTables {
        levelUp = Map.copyOf(levelUp);
        eggMoves = Map.copyOf(eggMoves);
        teachable = Map.copyOf(teachable);
    }

    public static LearnsetTables empty() {
        return EMPTY;
    }
}
