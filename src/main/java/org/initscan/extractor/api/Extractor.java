package org.initscan.extractor.api;

import org.initscan.extractor.block.BlockAssignmentExtractor;
import org.initscan.extractor.block.FieldMap;
import org.initscan.extractor.block.IndexedEntryMap;
import org.initscan.extractor.block.IndexedEntryScanner;
import org.initscan.extractor.decode.BraceListDecoder;
import org.initscan.extractor.decode.EntryListDecoder;
import org.initscan.extractor.decode.EntryTuple;
import org.initscan.extractor.decode.MacroArgumentDecoder;
import org.initscan.extractor.decode.StringDecoder;
import org.initscan.extractor.diagnostics.DiagnosticsEngine;
import org.initscan.extractor.expr.ExpressionEvaluator;
import org.initscan.extractor.scan.TopLevelSplitter;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Default {@link IExtractor} that wires the scanners and decoders to one set of {@link ExtractorSettings}.
 */
public class Extractor implements IExtractor {

    private final ExtractorSettings settings;
    private final ExpressionEvaluator evaluator;
    private final EntryListDecoder entryListDecoder;

    public Extractor() {
        this(ExtractorSettings.defaults());
    }

    public Extractor(ExtractorSettings settings) {
        this.settings = settings;
        this.evaluator = new ExpressionEvaluator(settings.symbols());
        this.entryListDecoder = new EntryListDecoder(settings.nestedListKeywords());
    }

    public ExtractorSettings getSettings() {
        return settings;
    }

    public ExpressionEvaluator getEvaluator() {
        return evaluator;
    }

    public EntryListDecoder getEntryListDecoder() {
        return entryListDecoder;
    }

    @Override
    public long evaluateExpression(String text) throws ExtractionException {
        return evaluator.evaluate(text);
    }

    @Override
    public List<String> splitTopLevel(String text) {
        return TopLevelSplitter.split(text);
    }

    @Override
    public FieldMap extractFieldMap(String blockInterior) {
        return BlockAssignmentExtractor.extract(blockInterior);
    }

    @Override
    public IndexedEntryMap scanIndexedEntries(String fullText, DiagnosticsEngine diagnostics) {
        return IndexedEntryScanner.scan(fullText, settings.keyPattern(), diagnostics);
    }

    @Override
    public IndexedEntryMap scanIndexedEntries(String fullText, String keyPattern) {
        return IndexedEntryScanner.scan(fullText, Pattern.compile(keyPattern), null);
    }

    @Override
    public String decodeString(String raw) throws ExtractionException {
        return StringDecoder.decode(raw);
    }

    @Override
    public List<String> decodeMacroArguments(String raw) throws ExtractionException {
        return MacroArgumentDecoder.decode(raw);
    }

    @Override
    public List<String> decodeBraceList(String raw) throws ExtractionException {
        return BraceListDecoder.decode(raw);
    }

    @Override
    public List<EntryTuple> decodeEntryList(String raw) throws ExtractionException {
        return entryListDecoder.decode(raw);
    }
}
