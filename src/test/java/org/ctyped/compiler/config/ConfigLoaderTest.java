package org.ctyped.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader} and {@link ParserOptions}, covering the layering of
 * system properties over the configuration file over the shipped defaults.
 */
@Tag("unit")
class ConfigLoaderTest {

    private static final String DEPTH_KEY = "ctyped.parser.max-nesting-depth";

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(DEPTH_KEY);
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Defaults from reference.conf match ParserOptions.defaults()")
    void load_shouldFallBackToReferenceConf() {
        // Act
        Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile());

        // Assert
        assertThat(config.getString("ctyped.parser.func-name-placeholder")).isEqualTo("__func_name__");
        assertThat(config.getInt("ctyped.compiler.verbosity")).isEqualTo(2);
        if (System.getenv("CTYPED_MAX_NESTING_DEPTH") == null) {
            assertThat(ParserOptions.fromConfig(config)).isEqualTo(ParserOptions.defaults());
        }
    }

    @Test
    @DisplayName("Configuration file overrides the defaults")
    void load_fileShouldOverrideDefaults() throws IOException {
        // Arrange
        File file = tempDir.resolve("ctyped.conf").toFile();
        Files.writeString(file.toPath(), "ctyped.compiler.verbosity = 4\nctyped.parser.func-name-placeholder = \"fn\"\n");

        // Act
        ParserOptions options = ParserOptions.fromConfig(ConfigLoader.load(file));

        // Assert
        assertThat(options.verbosity()).isEqualTo(4);
        assertThat(options.funcNamePlaceholder()).isEqualTo("fn");
    }

    @Test
    @DisplayName("System property overrides the configuration file")
    void load_systemPropertyShouldOverrideFile() throws IOException {
        // Arrange
        File file = tempDir.resolve("ctyped.conf").toFile();
        Files.writeString(file.toPath(), DEPTH_KEY + " = 64\n");
        System.setProperty(DEPTH_KEY, "32");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertThat(config.getInt(DEPTH_KEY)).isEqualTo(32);
    }

    @Test
    @DisplayName("A directory in place of the file is skipped")
    void load_shouldSkipDirectory() {
        // Act
        Config config = ConfigLoader.load(tempDir.toFile());

        // Assert
        assertThat(config.hasPath(DEPTH_KEY)).isTrue();
    }

    @Test
    @DisplayName("Invalid option values are rejected")
    void parserOptions_shouldValidate() {
        // Act & Assert
        assertThatThrownBy(() -> new ParserOptions(0, "__func_name__", 2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ParserOptions(8, " ", 2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ParserOptions.fromConfig(ConfigFactory.parseString(DEPTH_KEY + " = 5")))
                .isInstanceOf(ConfigException.Missing.class);
    }
}
