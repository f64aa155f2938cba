package org.initscan.extractor.diagnostics;

import org.initscan.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class DiagnosticsEngineTest {

    @Test
    void collectsErrorsAndWarningsInOrder() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();

        // Act
        engine.reportWarning("Value committed as is", "SPECIES_A", 4);
        engine.reportError("Block of entry is not closed; entry skipped", "SPECIES_B", 9);

        // Assert
        assertThat(engine.isEmpty()).isFalse();
        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.getDiagnostics()).extracting(Diagnostic::type)
                .containsExactly(Diagnostic.Type.WARNING, Diagnostic.Type.ERROR);
        assertThat(engine.summary()).isEqualTo(
                "[WARNING] SPECIES_A:4: Value committed as is\n"
                        + "[ERROR] SPECIES_B:9: Block of entry is not closed; entry skipped");
        assertThatThrownBy(() -> engine.getDiagnostics().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void warningsAloneAreNotErrors() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        assertThat(engine.isEmpty()).isTrue();

        engine.reportWarning("w", "X", 1);

        assertThat(engine.hasErrors()).isFalse();
    }
}
