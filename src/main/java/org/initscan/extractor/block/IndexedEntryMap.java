package org.initscan.extractor.block;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from entry key (e.g. {@code SPECIES_BULBASAUR}) to its {@link FieldMap}.
 * Each scanned text buffer produces its own map; maps from several buffers are combined
 * with {@link #overlay(IndexedEntryMap)}.
 */
public final class IndexedEntryMap {

    private static final IndexedEntryMap EMPTY = new IndexedEntryMap(Map.of());

    private final Map<String, FieldMap> entries;

    private IndexedEntryMap(Map<String, FieldMap> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static IndexedEntryMap of(Map<String, FieldMap> entries) {
        return entries.isEmpty() ? EMPTY : new IndexedEntryMap(entries);
    }

    public static IndexedEntryMap empty() {
        return EMPTY;
    }

    /**
     * Returns a new map containing the entries of this map replaced and extended by the
     * entries of {@code later}. An entry of {@code later} replaces the whole entry with the
     * same key; fields are not merged.
     *
     * @param later The map whose entries win.
     * @return The combined map.
     */
    public IndexedEntryMap overlay(IndexedEntryMap later) {
        if (later.isEmpty()) return this;
        if (isEmpty()) return later;
        Map<String, FieldMap> merged = new LinkedHashMap<>(entries);
        merged.putAll(later.entries);
        return new IndexedEntryMap(merged);
    }

    public Optional<FieldMap> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Map<String, FieldMap> asMap() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexedEntryMap other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
