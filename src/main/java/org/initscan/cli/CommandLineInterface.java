package org.initscan.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.initscan.cli.commands.EvalCommand;
import org.initscan.cli.commands.ExtractCommand;
import org.initscan.cli.commands.SpeciesCommand;
import org.initscan.config.ConfigLoader;
import org.initscan.config.LoggingConfigurator;
import org.initscan.extractor.api.Extractor;
import org.initscan.extractor.api.ExtractorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "initscan",
    mixinStandardHelpOptions = true,
    version = "initscan 1.0",
    description = "Extracts records from preprocessed C initializer tables",
    subcommands = {
        ExtractCommand.class,
        SpeciesCommand.class,
        EvalCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = new CommandLine(new CommandLineInterface()).execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        if (configFile != null && !configFile.isFile()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
        }
        try {
            config = configFile != null ? ConfigLoader.load(configFile.getPath()) : ConfigLoader.load();
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Failed to load or parse configuration: " + e.getMessage(), e);
        }
        LoggingConfigurator.configure(config);
        LOGGER.debug("Configuration loaded");
        initialized = true;
    }

    /**
     * @return The merged configuration, loaded on first access.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * @return An extractor configured from the {@code initscan.extractor} block.
     */
    public Extractor createExtractor() {
        try {
            return new Extractor(ExtractorSettings.fromConfig(getConfig()));
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Invalid extractor configuration: " + e.getMessage(), e);
        }
    }
}
