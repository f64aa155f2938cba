package org.initscan.extractor.header;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects {@code #define NAME VALUE} constants from a header text.
 */
public final class DefineScanner {

    private static final Pattern DEFINE = Pattern.compile("^#define\\s+(\\w+)\\s+([^/\\n]+)");

    private DefineScanner() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param text The header text.
     * @param prefix Only names starting with this prefix are kept, e.g. {@code SPECIES_}.
     * @return Name to trimmed value, in source order. The value stops at a comment start.
     */
    public static Map<String, String> scan(String text, String prefix) {
        Map<String, String> constants = new LinkedHashMap<>();
        for (String line : text.split("\n")) {
            Matcher matcher = DEFINE.matcher(line);
            if (!matcher.find()) {
                continue;
            }
            String name = matcher.group(1);
            if (name.startsWith(prefix)) {
                constants.put(name, matcher.group(2).strip());
            }
        }
        return constants;
    }
}
