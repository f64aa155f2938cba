package org.initscan.extractor.expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Immutable table of the identifiers a constant expression may reference.
 * <p>
 * The evaluator performs no macro expansion: any name missing from this table is an
 * error. The default table knows {@code TRUE} and {@code FALSE}.
 */
public final class SymbolTable {

    private static final SymbolTable DEFAULTS = new SymbolTable(Map.of()).withSymbol("TRUE", 1).withSymbol("FALSE", 0);

    private final Map<String, Long> symbols;

    private SymbolTable(Map<String, Long> symbols) {
        this.symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
    }

    /**
     * @return The table containing only {@code TRUE = 1} and {@code FALSE = 0}.
     */
    public static SymbolTable defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a table from explicit values, replacing the defaults entirely.
     * @param symbols The name to value mapping.
     * @return A new table.
     */
    public static SymbolTable of(Map<String, Long> symbols) {
        return new SymbolTable(symbols);
    }

    /**
     * Returns a copy of this table with one additional (or replaced) symbol.
     * @param name The identifier.
     * @param value Its integer value.
     * @return A new table.
     */
    public SymbolTable withSymbol(String name, long value) {
        Map<String, Long> copy = new LinkedHashMap<>(symbols);
        copy.put(name, value);
        return new SymbolTable(copy);
    }

    /**
     * @param name The identifier to look up.
     * @return The value, or empty if the name is unknown.
     */
    public OptionalLong resolve(String name) {
        Long value = symbols.get(name);
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    public Map<String, Long> asMap() {
        return symbols;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolTable other)) return false;
        return symbols.equals(other.symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return "SymbolTable" + symbols;
    }
}
