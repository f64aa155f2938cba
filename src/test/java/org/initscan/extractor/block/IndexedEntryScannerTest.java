package org.initscan.extractor.block;

import org.initscan.extractor.diagnostics.Diagnostic;
import org.initscan.extractor.diagnostics.DiagnosticsEngine;
import org.initscan.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link IndexedEntryScanner}.
 * These tests use small species tables in the layout produced by the C preprocessor.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class IndexedEntryScannerTest {

    private static final Pattern KEY = Pattern.compile("KEY_[A-Z]");

    @Test
    @DisplayName("Entries are found in source order with their fields")
    void scansSpeciesTable() {
        // Arrange
        String text = String.join("\n",
                "const struct SpeciesInfo gSpeciesInfo[] =",
                "{",
                "    [SPECIES_BULBASAUR] =",
                "    {",
                "        .baseHP = 45,",
                "        .abilities = { ABILITY_OVERGROW, ABILITY_NONE },",
                "        .speciesName = _(\"Bulb{\"),",
                "    },",
                "    [SPECIES_IVYSAUR] = { .baseHP = 60, .catchRate = 45, },",
                "};");

        // Act
        IndexedEntryMap entries = IndexedEntryScanner.scan(text);

        // Assert
        assertThat(entries.keys()).containsExactly("SPECIES_BULBASAUR", "SPECIES_IVYSAUR");
        FieldMap bulbasaur = entries.get("SPECIES_BULBASAUR").orElseThrow();
        assertThat(bulbasaur.get("abilities")).contains("{ ABILITY_OVERGROW, ABILITY_NONE }");
        assertThat(bulbasaur.get("speciesName")).contains("_(\"Bulb{\")");
        assertThat(entries.get("SPECIES_IVYSAUR").orElseThrow().get("catchRate")).contains("45");
    }

    @Test
    @DisplayName("Adjacent entries on one line are both kept")
    void scansAdjacentEntries() {
        IndexedEntryMap entries = IndexedEntryScanner.scan("[KEY_A] = { .x = 1, };[KEY_B] = { .x = 2, };", KEY, null);

        assertThat(entries.keys()).containsExactly("KEY_A", "KEY_B");
        assertThat(entries.get("KEY_B").orElseThrow().get("x")).contains("2");
    }

    @Test
    @DisplayName("Keys must match the key pattern")
    void honorsKeyPattern() {
        String text = "[KEY_A] = { .x = 1, },\n[OTHER_B] = { .y = 2, },\n[KEY_C] = { .z = 3, },";

        IndexedEntryMap entries = IndexedEntryScanner.scan(text, KEY, null);

        assertThat(entries.keys()).containsExactly("KEY_A", "KEY_C");
    }

    @Test
    @DisplayName("An unclosed entry is skipped and scanning resumes at the next header")
    void skipsUnclosedEntry() {
        // Arrange
        String text = "[KEY_A] = { .x = 1,\n[KEY_B] = { .y = 2, },";
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        IndexedEntryMap entries = IndexedEntryScanner.scan(text, KEY, diagnostics);

        // Assert
        assertThat(entries.keys()).containsExactly("KEY_B");
        assertThat(entries.get("KEY_B").orElseThrow().get("y")).contains("2");
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
            assertThat(d.subject()).isEqualTo("KEY_A");
            assertThat(d.lineNumber()).isEqualTo(1);
            assertThat(d.message()).contains("not closed");
        });
    }

    @Test
    @DisplayName("An entry that is still open at end of text is skipped")
    void skipsEntryOpenAtEndOfText() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        IndexedEntryMap entries = IndexedEntryScanner.scan("[KEY_A] = { .x = 1, },\n\n[KEY_B] = { .y = (2, ", KEY, diagnostics);

        assertThat(entries.keys()).containsExactly("KEY_A");
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::subject, Diagnostic::lineNumber)
                .containsExactly("KEY_B", 3);
    }

    @Test
    @DisplayName("Empty blocks are reported and scalar designators are ignored")
    void skipsEmptyBlocksAndScalars() {
        // Arrange
        String text = "[KEY_A] = 5,\n[KEY_B] = { },\n[KEY_C] = { .z = 3, },";
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        IndexedEntryMap entries = IndexedEntryScanner.scan(text, KEY, diagnostics);

        // Assert
        assertThat(entries.keys()).containsExactly("KEY_C");
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::subject).isEqualTo("KEY_B");
    }

    @Test
    @DisplayName("A key that occurs twice keeps its later block")
    void laterDuplicateWins() {
        IndexedEntryMap entries = IndexedEntryScanner.scan("[KEY_A] = { .x = 1, .y = 1, },\n[KEY_A] = { .x = 2, },", KEY, null);

        assertThat(entries.size()).isEqualTo(1);
        assertThat(entries.get("KEY_A").orElseThrow().asMap()).containsOnlyKeys("x").containsEntry("x", "2");
    }

    @Test
    @DisplayName("Partial field commits are reported with the entry key")
    void forwardsFieldWarnings() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        IndexedEntryMap entries = IndexedEntryScanner.scan("[KEY_A] =\n{\n  .x = 1\n}", KEY, diagnostics);

        assertThat(entries.get("KEY_A").orElseThrow().get("x")).contains("1");
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::type, Diagnostic::subject, Diagnostic::lineNumber)
                .containsExactly(Diagnostic.Type.WARNING, "KEY_A", 3);
    }
}
