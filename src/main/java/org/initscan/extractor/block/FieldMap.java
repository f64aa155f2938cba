package org.initscan.extractor.block;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from field name to the raw, unevaluated value text of one initializer.
 * A field appears at most once; when the source repeats a field the later value is kept.
 */
public final class FieldMap {

    private static final FieldMap EMPTY = new FieldMap(Map.of());

    private final Map<String, String> fields;

    private FieldMap(Map<String, String> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * @param fields Field name to raw value text.
     * @return An immutable copy of the given fields.
     */
    public static FieldMap of(Map<String, String> fields) {
        return fields.isEmpty() ? EMPTY : new FieldMap(fields);
    }

    public static FieldMap empty() {
        return EMPTY;
    }

    /**
     * @param field The field name without the leading dot.
     * @return The raw value text, or empty if the field is absent.
     */
    public Optional<String> get(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    /**
     * @param field The field name.
     * @param defaultValue Returned if the field is absent.
     * @return The raw value text or {@code defaultValue}.
     */
    public String getOrDefault(String field, String defaultValue) {
        return fields.getOrDefault(field, defaultValue);
    }

    public boolean contains(String field) {
        return fields.containsKey(field);
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * @return An unmodifiable view in source order.
     */
    public Map<String, String> asMap() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldMap other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
