package org.initscan.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.initscan.cli.CommandLineInterface;
import org.initscan.extractor.api.ExtractionException;
import org.initscan.extractor.api.Extractor;
import org.initscan.extractor.block.FieldMap;
import org.initscan.extractor.block.IndexedEntryMap;
import org.initscan.extractor.diagnostics.Diagnostic;
import org.initscan.extractor.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "extract",
    description = "Scans [KEY] = { ... } entries and prints their raw fields as JSON"
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractCommand.class);

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Preprocessed source files; later files override earlier entries")
    private List<Path> files;

    @Option(names = {"-k", "--key-pattern"}, description = "Regular expression for entry keys (default: from configuration)")
    private String keyPattern;

    @Option(names = {"-p", "--pretty"}, description = "Pretty-print the JSON output")
    private boolean pretty;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Extractor extractor = parent.createExtractor();
        if (keyPattern != null) {
            extractor = new Extractor(extractor.getSettings().withKeyPattern(keyPattern));
        }

        IndexedEntryMap merged = IndexedEntryMap.empty();
        for (Path file : files) {
            try {
                merged = merged.overlay(scanFile(extractor, file));
            } catch (ExtractionException e) {
                LOGGER.error("{}", e.getMessage());
                return 1;
            }
        }

        Map<String, Map<String, String>> output = new LinkedHashMap<>();
        for (Map.Entry<String, FieldMap> entry : merged.asMap().entrySet()) {
            output.put(entry.getKey(), entry.getValue().asMap());
        }
        GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
        if (pretty) {
            builder.setPrettyPrinting();
        }
        Gson gson = builder.create();
        spec.commandLine().getOut().println(gson.toJson(output));
        spec.commandLine().getOut().flush();
        return 0;
    }

    static IndexedEntryMap scanFile(Extractor extractor, Path file) throws ExtractionException {
        String text = SourceFiles.read(file);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        IndexedEntryMap entries = extractor.scanIndexedEntries(text, diagnostics);
        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            LOGGER.warn("{}: {}", file, diagnostic);
        }
        LOGGER.info("Extracted {} entries from {}", entries.size(), file);
        return entries;
    }
}
