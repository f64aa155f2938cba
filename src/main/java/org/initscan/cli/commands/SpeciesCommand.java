package org.initscan.cli.commands;

import com.google.gson.GsonBuilder;
import org.initscan.cli.CommandLineInterface;
import org.initscan.extractor.api.ExtractionException;
import org.initscan.extractor.api.Extractor;
import org.initscan.extractor.block.IndexedEntryMap;
import org.initscan.extractor.header.ArrayTableScanner;
import org.initscan.extractor.header.LevelUpMove;
import org.initscan.extractor.header.LevelUpMoveDecoder;
import org.initscan.records.LearnsetTables;
import org.initscan.records.SpeciesRecord;
import org.initscan.records.SpeciesRecordAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "species",
    description = "Assembles species records from species-info tables and prints them as JSON"
)
public class SpeciesCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpeciesCommand.class);

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Preprocessed species-info files; later files override earlier entries")
    private List<Path> files;

    @Option(names = "--level-up", paramLabel = "FILE", description = "Preprocessed level-up learnset files")
    private List<Path> levelUpFiles = new ArrayList<>();

    @Option(names = "--egg-moves", paramLabel = "FILE", description = "Preprocessed egg-move learnset files")
    private List<Path> eggMoveFiles = new ArrayList<>();

    @Option(names = "--teachable", paramLabel = "FILE", description = "Preprocessed teachable learnset files")
    private List<Path> teachableFiles = new ArrayList<>();

    @Option(names = {"-p", "--pretty"}, description = "Pretty-print the JSON output")
    private boolean pretty;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Extractor extractor = parent.createExtractor();
        try {
            IndexedEntryMap entries = IndexedEntryMap.empty();
            for (Path file : files) {
                entries = entries.overlay(ExtractCommand.scanFile(extractor, file));
            }
            LearnsetTables learnsets = new LearnsetTables(
                loadLevelUp(extractor),
                loadMoveLists(eggMoveFiles),
                loadMoveLists(teachableFiles));

            List<SpeciesRecord> records = new SpeciesRecordAssembler(extractor).assembleAll(entries, learnsets);
            LOGGER.info("Assembled {} of {} species", records.size(), entries.size());

            GsonBuilder builder = new GsonBuilder().disableHtmlEscaping().serializeNulls();
            if (pretty) {
                builder.setPrettyPrinting();
            }
            spec.commandLine().getOut().println(builder.create().toJson(records));
            spec.commandLine().getOut().flush();
            return 0;
        } catch (ExtractionException e) {
            LOGGER.error("{}", e.getMessage());
            return 1;
        }
    }

    private Map<String, List<LevelUpMove>> loadLevelUp(Extractor extractor) throws ExtractionException {
        Map<String, List<LevelUpMove>> tables = new HashMap<>();
        for (Path file : levelUpFiles) {
            tables.putAll(LevelUpMoveDecoder.scan(SourceFiles.read(file), extractor.getEvaluator()));
        }
        return tables;
    }

    private static Map<String, List<String>> loadMoveLists(List<Path> paths) throws ExtractionException {
        Map<String, List<String>> tables = new HashMap<>();
        for (Path file : paths) {
            tables.putAll(ArrayTableScanner.scanMoveLists(SourceFiles.read(file)));
        }
        return tables;
    }
}
