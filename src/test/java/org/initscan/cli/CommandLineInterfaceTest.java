package org.initscan.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.initscan.junit.extensions.logging.AllowLog;
import org.initscan.junit.extensions.logging.ExpectLog;
import org.initscan.junit.extensions.logging.LogLevel;
import org.initscan.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains tests for the picocli command tree.
 * Commands are executed in-process with captured output streams.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
    }

    @Test
    @DisplayName("eval prints the value of an expression")
    void evalPrintsValue() {
        int exitCode = commandLine.execute("eval", "2 + 3 * 4");

        assertThat(exitCode).isZero();
        assertThat(out.toString().strip()).isEqualTo("14");
    }

    @Test
    @DisplayName("eval joins several arguments into one expression")
    void evalJoinsArguments() {
        int exitCode = commandLine.execute("eval", "(2", "+", "3)", "*", "4");

        assertThat(exitCode).isZero();
        assertThat(out.toString().strip()).isEqualTo("20");
    }

    @Test
    @DisplayName("eval reports the error code and exits with 1")
    void evalReportsErrors() {
        int exitCode = commandLine.execute("eval", "1 / 0");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).startsWith("ARITHMETIC_ERROR: ");
    }

    @Test
    @DisplayName("extract overlays files in argument order and prints JSON")
    void extractOverlaysFiles() throws IOException {
        // Arrange
        Path base = write("base.h", "[KEY_A] = { .x = 1, .y = 2, },\n[KEY_B] = { .z = 3, },");
        Path patch = write("patch.h", "[KEY_A] = { .x = 9, },");

        // Act
        int exitCode = commandLine.execute("extract", "--key-pattern", "KEY_[A-Z]", base.toString(), patch.toString());

        // Assert
        assertThat(exitCode).isZero();
        JsonObject json = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(json.keySet()).containsExactlyInAnyOrder("KEY_A", "KEY_B");
        assertThat(json.getAsJsonObject("KEY_A").keySet()).containsExactly("x");
        assertThat(json.getAsJsonObject("KEY_A").get("x").getAsString()).isEqualTo("9");
        assertThat(json.getAsJsonObject("KEY_B").get("z").getAsString()).isEqualTo("3");
    }

    @Test
    @DisplayName("extract logs skipped entries as warnings")
    @ExpectLog(level = LogLevel.WARN,
               loggerPattern = "org\\.initscan\\.cli\\.commands\\.ExtractCommand",
               messagePattern = ".*KEY_A.*not closed.*")
    void extractWarnsAboutSkippedEntries() throws IOException {
        Path file = write("broken.h", "[KEY_A] = { .x = 1,\n[KEY_B] = { .y = 2, },");

        int exitCode = commandLine.execute("extract", "-k", "KEY_[A-Z]", file.toString());

        assertThat(exitCode).isZero();
        assertThat(JsonParser.parseString(out.toString()).getAsJsonObject().keySet()).containsExactly("KEY_B");
    }

    @Test
    @DisplayName("extract fails with exit code 1 on an unreadable file")
    @ExpectLog(level = LogLevel.ERROR,
               loggerPattern = "org\\.initscan\\.cli\\.commands\\.ExtractCommand",
               messagePattern = "\\[IO_ERROR_READING_FILE\\].*")
    void extractFailsOnMissingFile() {
        int exitCode = commandLine.execute("extract", tempDir.resolve("missing.h").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @DisplayName("species assembles records with learnsets")
    void speciesPrintsRecords() throws IOException {
        // Arrange
        Path info = write("species_info.h", String.join("\n",
                "[SPECIES_BULBASAUR] =",
                "{",
                "    .baseHP = 45,",
                "    .types = MON_TYPES(TYPE_GRASS, TYPE_POISON),",
                "    .speciesName = _(\"Bulbasaur\"),",
                "    .levelUpLearnset = sBulbasaurLevelUpLearnset,",
                "    .teachableLearnset = sBulbasaurTeachableLearnset,",
                "},"));
        Path levelUp = write("level_up.h", String.join("\n",
                "static const struct LevelUpMove sBulbasaurLevelUpLearnset[] = {",
                "    { .move = MOVE_TACKLE, .level = 1 },",
                "    { .move = LEVEL_UP_MOVE_END, .level = 0 },",
                "};"));
        Path teachable = write("teachable.h", "static const u16 sBulbasaurTeachableLearnset[] = { MOVE_CUT, MOVE_UNAVAILABLE };");

        // Act
        int exitCode = commandLine.execute("species", info.toString(),
                "--level-up", levelUp.toString(), "--teachable", teachable.toString());

        // Assert
        assertThat(exitCode).isZero();
        JsonArray records = JsonParser.parseString(out.toString()).getAsJsonArray();
        assertThat(records.size()).isEqualTo(1);
        JsonObject bulbasaur = records.get(0).getAsJsonObject();
        assertThat(bulbasaur.get("displayName").getAsString()).isEqualTo("Bulbasaur");
        assertThat(bulbasaur.getAsJsonObject("baseStats").get("hp").getAsInt()).isEqualTo(45);
        assertThat(bulbasaur.getAsJsonArray("types").get(1).getAsString()).isEqualTo("TYPE_POISON");
        assertThat(bulbasaur.getAsJsonArray("levelUpMoves").get(0).getAsJsonObject().get("move").getAsString()).isEqualTo("MOVE_TACKLE");
        assertThat(bulbasaur.getAsJsonArray("teachableMoves").get(0).getAsString()).isEqualTo("MOVE_CUT");
        assertThat(bulbasaur.get("iconPalIndex").isJsonNull()).isTrue();
    }

    @Test
    @DisplayName("species skips entries that cannot be assembled")
    @AllowLog(level = LogLevel.WARN, loggerPattern = "org\\.initscan\\.records\\.SpeciesRecordAssembler")
    void speciesSkipsBrokenEntries() throws IOException {
        Path info = write("species_info.h", "[SPECIES_A] = { .baseHP = UNKNOWN, },\n[SPECIES_B] = { .baseHP = 10, },");

        int exitCode = commandLine.execute("species", info.toString());

        assertThat(exitCode).isZero();
        JsonArray records = JsonParser.parseString(out.toString()).getAsJsonArray();
        assertThat(records.size()).isEqualTo(1);
        assertThat(records.get(0).getAsJsonObject().get("speciesConstant").getAsString()).isEqualTo("SPECIES_B");
    }

    @Test
    @DisplayName("A custom configuration file is applied")
    void customConfigFile() throws IOException {
        // Arrange
        Path config = write("custom.conf", "initscan.extractor.symbols { TRUE = 1, FALSE = 0, GEN_LATEST = 9 }\n");

        // Act
        int exitCode = commandLine.execute("--config", config.toString(), "eval", "GEN_LATEST * 2");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString().strip()).isEqualTo("18");
    }

    @Test
    @DisplayName("A missing configuration file is a usage error")
    void missingConfigFile() {
        int exitCode = commandLine.execute("-c", tempDir.resolve("absent.conf").toString(), "eval", "1");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("was not found");
    }

    @Test
    @DisplayName("Without a subcommand the usage is printed")
    void printsUsage() {
        int exitCode = commandLine.execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Usage: initscan").contains("extract").contains("species").contains("eval");
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
