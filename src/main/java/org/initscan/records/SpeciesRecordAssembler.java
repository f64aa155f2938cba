package org.initscan.records;

import org.initscan.extractor.api.ExtractionException;
import org.initscan.extractor.api.Extractor;
import org.initscan.extractor.block.FieldMap;
import org.initscan.extractor.block.IndexedEntryMap;
import org.initscan.extractor.decode.EntryTuple;
import org.initscan.extractor.expr.ExpressionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds {@link SpeciesRecord}s from the raw field maps of a species table.
 * Missing fields take the defaults the game data uses for an unset field.
 */
public class SpeciesRecordAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(SpeciesRecordAssembler.class);

    private static final String SPECIES_PREFIX = "SPECIES_";

    private static final String[][] BASE_STAT_FIELDS = {
            {"baseHP", "hp"},
            {"baseAttack", "attack"},
            {"baseDefense", "defense"},
            {"baseSpeed", "speed"},
            {"baseSpAttack", "spAttack"},
            {"baseSpDefense", "spDefense"},
    };

    private static final String[][] EV_YIELD_FIELDS = {
            {"evYield_HP", "hp"},
            {"evYield_Attack", "attack"},
            {"evYield_Defense", "defense"},
            {"evYield_SpAttack", "spAttack"},
            {"evYield_SpDefense", "spDefense"},
            {"evYield_Speed", "speed"},
    };

    private final Extractor extractor;
    private final ExpressionEvaluator evaluator;

    public SpeciesRecordAssembler(Extractor extractor) {
        this.extractor = extractor;
        this.evaluator = extractor.getEvaluator();
    }

    /**
     * Assembles every entry of {@code entries}. Entries that fail to decode are logged and skipped.
     *
     * @param entries The scanned species table.
     * @param learnsets Learnset arrays referenced by the entries.
     * @return The assembled records in table order.
     */
    public List<SpeciesRecord> assembleAll(IndexedEntryMap entries, LearnsetTables learnsets) {
        List<SpeciesRecord> records = new ArrayList<>();
        for (Map.Entry<String, FieldMap> entry : entries.asMap().entrySet()) {
            try {
                records.add(assemble(entry.getKey(), entry.getValue(), learnsets));
            } catch (ExtractionException e) {
                LOG.warn("Skipping {}: {}", entry.getKey(), e.getMessage());
            }
        }
        return records;
    }

    /**
     * Assembles a single record.
     *
     * @param species The entry key, e.g. {@code SPECIES_BULBASAUR}.
     * @param info The raw fields of the entry.
     * @param learnsets Learnset arrays referenced by the entry.
     * @return The record.
     * @throws ExtractionException if a required value cannot be decoded.
     */
    public SpeciesRecord assemble(String species, FieldMap info, LearnsetTables learnsets) throws ExtractionException {
        String baseName = species.startsWith(SPECIES_PREFIX) ? species.substring(SPECIES_PREFIX.length()) : species;

        int height = number(info, "height");
        int weight = number(info, "weight");

        Map<String, Integer> baseStats = new LinkedHashMap<>();
        for (String[] field : BASE_STAT_FIELDS) {
            baseStats.put(field[1], number(info, field[0]));
        }
        Map<String, Integer> evYield = new LinkedHashMap<>();
        for (String[] field : EV_YIELD_FIELDS) {
            if (info.contains(field[0])) {
                int value = number(info, field[0]);
                if (value != 0) {
                    evYield.put(field[1], value);
                }
            }
        }

        List<String> abilities = extractor.decodeBraceList(info.getOrDefault("abilities", ""));
        if (abilities.isEmpty()) {
            abilities = List.of("ABILITY_NONE");
        }

        List<EvolutionRecord> evolutions = new ArrayList<>();
        for (EntryTuple tuple : extractor.decodeEntryList(info.getOrDefault("evolutions", ""))) {
            evolutions.add(new EvolutionRecord(species, tuple.method(), tuple.parameter(), tuple.target(), tuple.conditions()));
        }

        return new SpeciesRecord(
                species,
                "P_FAMILY_" + baseName,
                text(info, "natDexNum", "NATIONAL_DEX_" + baseName),
                extractor.decodeString(info.getOrDefault("speciesName", species)),
                extractor.decodeString(info.getOrDefault("categoryName", "")),
                extractor.decodeString(info.getOrDefault("description", "")),
                height,
                weight,
                exactlyTwo(extractor.decodeMacroArguments(info.getOrDefault("types", "")), "TYPE_NORMAL"),
                List.copyOf(abilities),
                number(info, "catchRate"),
                number(info, "expYield"),
                text(info, "growthRate", "GROWTH_MEDIUM_FAST"),
                exactlyTwo(extractor.decodeMacroArguments(info.getOrDefault("eggGroups", "")), "EGG_GROUP_NO_EGGS_DISCOVERED"),
                text(info, "genderRatio", "MON_GENDERLESS"),
                number(info, "eggCycles"),
                number(info, "friendship"),
                Collections.unmodifiableMap(baseStats),
                Collections.unmodifiableMap(evYield),
                List.copyOf(learnsets.levelUp().getOrDefault(text(info, "levelUpLearnset", ""), List.of())),
                List.copyOf(learnsets.eggMoves().getOrDefault(text(info, "eggMoveLearnset", ""), List.of())),
                List.copyOf(learnsets.teachable().getOrDefault(text(info, "teachableLearnset", ""), List.of())),
                List.copyOf(evolutions),
                text(info, "cryId", "CRY_NONE"),
                baseName.toLowerCase(Locale.ROOT),
                iconPalIndex(species, info)
        );
    }

    private int number(FieldMap info, String field) throws ExtractionException {
        return evaluator.evaluateInt(info.getOrDefault(field, "0"));
    }

    private static String text(FieldMap info, String field, String defaultValue) {
        String value = info.getOrDefault(field, "").strip();
        return value.isEmpty() ? defaultValue : value;
    }

    private Integer iconPalIndex(String species, FieldMap info) {
        String expression = info.getOrDefault("iconPalIndex", "");
        if (expression.isBlank()) {
            return null;
        }
        try {
            return evaluator.evaluateInt(expression);
        } catch (ExtractionException e) {
            LOG.debug("{}: icon palette index '{}' not evaluable: {}", species, expression, e.getMessage());
            return null;
        }
    }

    private static List<String> exactlyTwo(List<String> values, String fallback) {
        if (values.isEmpty()) {
            return List.of(fallback, fallback);
        }
        if (values.size() == 1) {
            return List.of(values.get(0), values.get(0));
        }
        return List.copyOf(values.subList(0, 2));
    }
}
