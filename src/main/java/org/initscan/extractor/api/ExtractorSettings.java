package org.initscan.extractor.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.initscan.extractor.expr.SymbolTable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Immutable settings of an {@link Extractor}.
 *
 * @param keyPattern Pattern an indexed-entry key must match.
 * @param nestedListKeywords Keywords that introduce nested condition lists in entry lists.
 * @param symbols Identifiers known to the expression evaluator.
 */
public record ExtractorSettings(Pattern keyPattern, List<String> nestedListKeywords, SymbolTable symbols) {

    /** Configuration path of the extractor block. */
    public static final String CONFIG_PATH = "initscan.extractor";

    public ExtractorSettings {
        nestedListKeywords = List.copyOf(nestedListKeywords);
    }

    /**
     * @return Settings for species tables: {@code SPECIES_*} keys, {@code CONDITIONS} lists, {@code TRUE}/{@code FALSE}.
     */
    public static ExtractorSettings defaults() {
        return new ExtractorSettings(Pattern.compile("SPECIES_[A-Z0-9_]+"), List.of("CONDITIONS"), SymbolTable.defaults());
    }

    /**
     * Reads the {@code initscan.extractor} block. Missing keys fall back to {@link #defaults()}.
     *
     * @param config The application configuration.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a present value has the wrong type.
     */
    public static ExtractorSettings fromConfig(Config config) {
        ExtractorSettings defaults = defaults();
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults;
        }
        Config extractor = config.getConfig(CONFIG_PATH);

        Pattern keyPattern = extractor.hasPath("key-pattern")
                ? Pattern.compile(extractor.getString("key-pattern"))
                : defaults.keyPattern();
        List<String> keywords = extractor.hasPath("nested-list-keywords")
                ? extractor.getStringList("nested-list-keywords")
                : defaults.nestedListKeywords();

        SymbolTable symbols = defaults.symbols();
        if (extractor.hasPath("symbols")) {
            Map<String, Long> values = new LinkedHashMap<>();
            Config symbolConfig = extractor.getConfig("symbols");
            for (Map.Entry<String, ConfigValue> entry : symbolConfig.root().entrySet()) {
                values.put(entry.getKey(), symbolConfig.getLong(entry.getKey()));
            }
            symbols = SymbolTable.of(values);
        }
        return new ExtractorSettings(keyPattern, keywords, symbols);
    }

    /**
     * @param pattern A regular expression for entry keys.
     * @return A copy of these settings with another key pattern.
     */
    public ExtractorSettings withKeyPattern(String pattern) {
        return new ExtractorSettings(Pattern.compile(pattern), nestedListKeywords, symbols);
    }
}
