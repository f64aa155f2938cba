package org.initscan.records;

import org.initscan.extractor.header.LevelUpMove;

import java.util.List;
import java.util.Map;

/**
 * Fully decoded data of one species entry.
 * <p>
 * {@code types} and {@code eggGroups} always hold exactly two elements. {@code evYield}
 * only contains non-zero yields. {@code iconPalIndex} is {@code null} if the entry has no
 * evaluable palette index.
 */
public record SpeciesRecord(
        String speciesConstant,
        String familyMacro,
        String nationalDexConstant,
        String displayName,
        String categoryName,
        String description,
        int height,
        int weight,
        List<String> types,
        List<String> abilities,
        int catchRate,
        int expYield,
        String growthRate,
        List<String> eggGroups,
        String genderRatio,
        int eggCycles,
        int friendship,
        Map<String, Integer> baseStats,
        Map<String, Integer> evYield,
        List<LevelUpMove> levelUpMoves,
        List<String> eggMoves,
        List<String> teachableMoves,
        List<EvolutionRecord> evolutions,
        String cry,
        String graphicsFolder,
        Integer iconPalIndex
) {
}
