package org.initscan.extractor.api;

import org.initscan.extractor.block.FieldMap;
import org.initscan.extractor.block.IndexedEntryMap;
import org.initscan.extractor.decode.EntryTuple;
import org.initscan.extractor.diagnostics.DiagnosticsEngine;

import java.util.List;

/**
 * Entry point of the extraction engine: raw, already preprocessed text in, typed values out.
 * <p>
 * Implementations hold no mutable state and can be called concurrently on independent
 * text buffers. They perform no I/O.
 */
public interface IExtractor {

    /**
     * Evaluates a C-style integer constant expression.
     * @param text The expression.
     * @return The value.
     * @throws ExtractionException with {@code SYNTAX_ERROR}, {@code ARITHMETIC_ERROR} or {@code UNRESOLVED_IDENTIFIER}.
     */
    long evaluateExpression(String text) throws ExtractionException;

    /**
     * Splits a comma-delimited list on top-level commas.
     * @param text The list text.
     * @return Trimmed, non-empty pieces.
     */
    List<String> splitTopLevel(String text);

    /**
     * Extracts the {@code .field = value} assignments of one initializer body.
     * @param blockInterior The text between the braces.
     * @return Field name to raw value text.
     */
    FieldMap extractFieldMap(String blockInterior);

    /**
     * Extracts every {@code [KEY] = { ... }} entry of a text buffer using the configured key pattern.
     * @param fullText The text buffer.
     * @param diagnostics Receives skipped entries; may be {@code null}.
     * @return Key to field map.
     */
    IndexedEntryMap scanIndexedEntries(String fullText, DiagnosticsEngine diagnostics);

    /**
     * Extracts every {@code [KEY] = { ... }} entry whose key matches {@code keyPattern}.
     * @param fullText The text buffer.
     * @param keyPattern Regular expression for keys.
     * @return Key to field map.
     */
    IndexedEntryMap scanIndexedEntries(String fullText, String keyPattern);

    /**
     * @param raw A string-valued field.
     * @return The concatenated literal contents.
     * @throws ExtractionException with {@code PARSE_ERROR}.
     */
    String decodeString(String raw) throws ExtractionException;

    /**
     * @param raw A macro-call value.
     * @return The call's top-level arguments.
     * @throws ExtractionException with {@code PARSE_ERROR}.
     */
    List<String> decodeMacroArguments(String raw) throws ExtractionException;

    /**
     * @param raw A brace list value.
     * @return The list's top-level elements.
     * @throws ExtractionException with {@code PARSE_ERROR}.
     */
    List<String> decodeBraceList(String raw) throws ExtractionException;

    /**
     * @param raw An evolution-style entry list.
     * @return The decoded entries.
     * @throws ExtractionException with {@code PARSE_ERROR}.
     */
    List<EntryTuple> decodeEntryList(String raw) throws ExtractionException;
}
