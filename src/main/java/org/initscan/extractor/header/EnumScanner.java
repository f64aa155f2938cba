package org.initscan.extractor.header;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects enumerator names such as {@code EVO_LEVEL} or {@code GROWTH_FAST} from a header text.
 * <p>
 * Scanning enters an enum at the first line that mentions the prefix and leaves it at a
 * line starting with a closing brace.
 */
public final class EnumScanner {

    private static final Pattern ENUM_ENTRY = Pattern.compile("^(\\s*)([A-Z0-9_]+)\\s*(?:=\\s*([^,]+))?,?");

    private EnumScanner() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param text The header text.
     * @param prefix The prefix shared by the wanted enumerators.
     * @return The enumerator names in declaration order.
     */
    public static List<String> scan(String text, String prefix) {
        List<String> constants = new ArrayList<>();
        boolean insideEnum = false;
        for (String rawLine : text.split("\n")) {
            String line = rawLine.stripTrailing();
            if (line.contains(prefix)) {
                insideEnum = true;
            }
            if (insideEnum) {
                Matcher matcher = ENUM_ENTRY.matcher(line);
                if (matcher.find() && matcher.group(2).startsWith(prefix)) {
                    constants.add(matcher.group(2));
                }
                if (line.startsWith("}")) {
                    insideEnum = false;
                }
            }
        }
        return constants;
    }
}
