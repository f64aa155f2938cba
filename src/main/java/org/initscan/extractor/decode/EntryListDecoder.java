package org.initscan.extractor.decode;

import org.initscan.extractor.api.ExtractionErrorCode;
import org.initscan.extractor.api.ExtractionException;
import org.initscan.extractor.scan.StructuralScanner;
import org.initscan.extractor.scan.TopLevelSplitter;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes nested entry lists such as
 * <pre>
 * EVOLUTION({EVO_LEVEL, 16, SPECIES_IVYSAUR},
 *           {EVO_ITEM, ITEM_SUN_STONE, SPECIES_BELLOSSOM, CONDITIONS({IF_GENDER, MON_FEMALE})})
 * </pre>
 * into {@link EntryTuple}s.
 * <p>
 * Each brace group at top level is one entry. Its first three parts are method, parameter
 * and target. Every further part that starts with a nested-list keyword is unwrapped: each
 * of its brace groups becomes one condition, its parts joined by single spaces. Any other
 * further part is taken verbatim as a condition.
 */
public final class EntryListDecoder {

    private static final String SOURCE = "entry-list";

    /** Keyword of nested condition lists in evolution tables. */
    public static final String CONDITIONS = "CONDITIONS";

    private static final EntryListDecoder DEFAULT = new EntryListDecoder(List.of(CONDITIONS));

    private final List<String> nestedListKeywords;

    /**
     * @param nestedListKeywords Names that introduce a nested condition list. The first one is used by {@link #encode(List)}.
     */
    public EntryListDecoder(List<String> nestedListKeywords) {
        if (nestedListKeywords.isEmpty()) {
            throw new IllegalArgumentException("At least one nested-list keyword is required");
        }
        this.nestedListKeywords = List.copyOf(nestedListKeywords);
    }

    /**
     * @return A decoder that knows the {@code CONDITIONS} keyword.
     */
    public static EntryListDecoder defaults() {
        return DEFAULT;
    }

    public List<String> getNestedListKeywords() {
        return nestedListKeywords;
    }

    /**
     * @param raw The raw field value. {@code null}, blank and {@code NAME(NULL)} decode to an empty list.
     * @return The entries in source order.
     * @throws ExtractionException with {@link ExtractionErrorCode#PARSE_ERROR} if a group is not
     *         closed, a group has fewer than three parts or a nested list is malformed.
     */
    public List<EntryTuple> decode(String raw) throws ExtractionException {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String text = Wrappers.stripCall(raw.strip());
        if (text.isEmpty() || text.equals("NULL")) {
            return List.of();
        }

        List<EntryTuple> entries = new ArrayList<>();
        for (String group : topLevelGroups(text)) {
            entries.add(decodeEntry(group));
        }
        return entries;
    }

    /**
     * Writes entries back in a form that {@link #decode(String)} reads into equal tuples.
     *
     * @param wrapper Name of the wrapping macro, e.g. {@code EVOLUTION}; {@code null} for none.
     * @param entries The entries to write.
     * @return The entry list text.
     */
    public String encode(String wrapper, List<EntryTuple> entries) {
        List<String> groups = new ArrayList<>();
        for (EntryTuple entry : entries) {
            StringBuilder group = new StringBuilder("{")
                    .append(entry.method()).append(", ")
                    .append(entry.parameter()).append(", ")
                    .append(entry.target());
            if (!entry.conditions().isEmpty()) {
                List<String> conditions = new ArrayList<>();
                for (String condition : entry.conditions()) {
                    conditions.add("{" + condition + "}");
                }
                group.append(", ").append(nestedListKeywords.get(0))
                        .append('(').append(String.join(", ", conditions)).append(')');
            }
            groups.add(group.append('}').toString());
        }
        String body = String.join(", ", groups);
        return wrapper == null ? body : wrapper + "(" + body + ")";
    }

    /**
     * Same as {@link #encode(String, List)} without a wrapper.
     * @param entries The entries to write.
     * @return The entry list text.
     */
    public String encode(List<EntryTuple> entries) {
        return encode(null, entries);
    }

    private EntryTuple decodeEntry(String group) throws ExtractionException {
        List<String> parts = TopLevelSplitter.split(group);
        if (parts.size() < 3) {
            throw new ExtractionException(ExtractionErrorCode.PARSE_ERROR, SOURCE, group,
                    "Entry needs method, parameter and target but has " + parts.size() + " part(s)");
        }
        List<String> conditions = new ArrayList<>();
        for (String extra : parts.subList(3, parts.size())) {
            if (isNestedList(extra)) {
                conditions.addAll(decodeConditions(extra));
            } else {
                conditions.add(extra);
            }
        }
        return new EntryTuple(parts.get(0), parts.get(1), parts.get(2), conditions);
    }

    private boolean isNestedList(String part) {
        for (String keyword : nestedListKeywords) {
            if (part.startsWith(keyword)) {
                return true;
            }
        }
        return false;
    }

    private List<String> decodeConditions(String part) throws ExtractionException {
        int start = part.indexOf('(');
        int end = part.lastIndexOf(')');
        if (start < 0 || end < start) {
            throw new ExtractionException(ExtractionErrorCode.PARSE_ERROR, SOURCE, part, "Nested list without argument parentheses");
        }
        List<String> conditions = new ArrayList<>();
        for (String group : topLevelGroups(part.substring(start + 1, end))) {
            List<String> conditionParts = TopLevelSplitter.split(group);
            if (!conditionParts.isEmpty()) {
                conditions.add(String.join(" ", conditionParts));
            }
        }
        return conditions;
    }

    /**
     * Returns the interiors of all brace groups at nesting depth zero, in order.
     */
    private static List<String> topLevelGroups(String text) throws ExtractionException {
        List<String> groups = new ArrayList<>();
        int depth = 0;
        boolean inString = false;
        boolean escape = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' && !escape) {
                inString = !inString;
            }
            if (inString) {
                escape = c == '\\' && !escape;
                continue;
            }
            escape = false;
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == '{' && depth == 0) {
                int close = StructuralScanner.findClosing(text, i);
                if (close < 0) {
                    throw new ExtractionException(ExtractionErrorCode.PARSE_ERROR, SOURCE, text.substring(i), "Entry group is not closed");
                }
                groups.add(text.substring(i + 1, close));
                i = close;
            } else if (c == '}' && depth == 0) {
                throw new ExtractionException(ExtractionErrorCode.PARSE_ERROR, SOURCE, text.substring(i), "Unexpected closing brace");
            }
        }
        if (depth != 0) {
            throw new ExtractionException(ExtractionErrorCode.PARSE_ERROR, SOURCE, text, "Unbalanced parentheses in entry list");
        }
        return groups;
    }
}
