package org.initscan.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.initscan.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link ConfigLoader} precedence order.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String KEY_PATTERN = "initscan.extractor.key-pattern";

    @AfterEach
    void clearSystemProperty() {
        System.clearProperty(KEY_PATTERN);
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Defaults come from reference.conf")
    void loadsReferenceDefaults() {
        Config config = ConfigLoader.load("does-not-exist.conf");

        assertThat(config.getString(KEY_PATTERN)).isEqualTo("SPECIES_[A-Z0-9_]+");
        assertThat(config.getStringList("initscan.extractor.nested-list-keywords")).containsExactly("CONDITIONS");
        assertThat(config.getString("logging.format")).isEqualTo("PLAIN");
    }

    @Test
    @DisplayName("A classpath resource overrides the defaults")
    void loadsClasspathResource() {
        Config config = ConfigLoader.load("org/initscan/config/test-config.conf");

        assertThat(config.getString(KEY_PATTERN)).isEqualTo("TEST_[A-Z]+");
        assertThat(config.getLong("initscan.extractor.symbols.P_UPDATED_STATS")).isEqualTo(1L);
        assertThat(config.getStringList("initscan.extractor.nested-list-keywords")).containsExactly("CONDITIONS");
    }

    @Test
    @DisplayName("A file on disk overrides the defaults")
    void loadsFile(@TempDir Path tempDir) throws IOException {
        // Arrange
        Path file = tempDir.resolve("initscan.conf");
        Files.writeString(file, "initscan.extractor.key-pattern = \"FILE_[0-9]+\"\n", StandardCharsets.UTF_8);

        // Act
        Config config = ConfigLoader.load(file.toString());

        // Assert
        assertThat(config.getString(KEY_PATTERN)).isEqualTo("FILE_[0-9]+");
    }

    @Test
    @DisplayName("System properties override the configuration file")
    void systemPropertiesWin() {
        // Arrange
        System.setProperty(KEY_PATTERN, "PROP_[A-Z]+");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load("org/initscan/config/test-config.conf");

        // Assert
        assertThat(config.getString(KEY_PATTERN)).isEqualTo("PROP_[A-Z]+");
    }
}
