package com.latexformatter.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.latexformatter.api.error.ConfigException;
import com.latexformatter.passes.PassId;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsEmbeddedDefaults() {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();

        assertThat(config.getLineLength()).isEqualTo(80);
        assertThat(config.getIndentSize()).isEqualTo(2);
        assertThat(config.getMaxEmptyLines()).isEqualTo(2);
        assertThat(config.isWrapLongLines()).isFalse();
        assertThat(config.getOpaqueEnvironments()).contains("verbatim", "lstlisting", "minted");
        assertThat(config.getNoIndentEnvironments()).containsExactly("document");
        assertThat(config.getEnabledPasses()).doesNotContain(PassId.WRAP).contains(PassId.WHITESPACE, PassId.TABLES);
    }

    @Test
    void loadsYamlFile() throws IOException {
        Path file = tempDir.resolve("formatter.yml");
        Files.writeString(file, "line_length: 100\nindent_size: 4\nsort_packages: false\nwrap_long_lines: true\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getLineLength()).isEqualTo(100);
        assertThat(config.getIndentSize()).isEqualTo(4);
        assertThat(config.isSortPackages()).isFalse();
        assertThat(config.getEnabledPasses()).contains(PassId.WRAP).doesNotContain(PassId.PACKAGES);
    }

    @Test
    void loadsJsonFile() throws IOException {
        Path file = tempDir.resolve("formatter.json");
        Files.writeString(file, "{\"max_empty_lines\": 1, \"opaque_environments\": [\"verbatim\", \"alltt\"]}");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getMaxEmptyLines()).isEqualTo(1);
        assertThat(config.getOpaqueEnvironments()).containsExactly("verbatim", "alltt");
    }

    @Test
    void readsToolSectionOfTomlFile() throws IOException {
        Path file = tempDir.resolve("pyproject.toml");
        Files.writeString(file, "[project]\nname = \"paper\"\n\n[tool.latex-formatter]\nline_length = 120\nnormalize_quotes = false\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getLineLength()).isEqualTo(120);
        assertThat(config.isNormalizeQuotes()).isFalse();
    }

    @Test
    void explicitPassListOverridesToggles() throws IOException {
        Path file = tempDir.resolve("formatter.yml");
        Files.writeString(file, "normalize_quotes: false\npasses:\n  - whitespace\n  - quotes\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getEnabledPasses()).containsExactlyInAnyOrder(PassId.WHITESPACE, PassId.QUOTES);
    }

    @Test
    void rejectsOutOfRangeValues() throws IOException {
        Path file = tempDir.resolve("formatter.yml");
        Files.writeString(file, "line_length: 5\n");

        assertThatThrownBy(() -> ConfigurationLoader.loadConfig(file))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("line_length");
    }

    @Test
    void rejectsValuesOfTheWrongType() {
        assertThatThrownBy(() -> ConfigurationLoader.fromMap(Map.of("indent_size", "wide")))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("indent_size");
        assertThatThrownBy(() -> ConfigurationLoader.fromMap(Map.of("sort_packages", 1)))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void rejectsUnknownPassNames() {
        assertThatThrownBy(() -> ConfigurationLoader.fromMap(Map.of("passes", java.util.List.of("spelling"))))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("spelling");
    }

    @Test
    void ignoresUnknownKeys() {
        FormatterConfig config = ConfigurationLoader.fromMap(Map.of("colour_scheme", "dark", "line_length", 60));

        assertThat(config.getLineLength()).isEqualTo(60);
    }

    @Test
    void fallsBackToDefaultsWhenFileIsMissing() {
        FormatterConfig config = ConfigurationLoader.loadConfig(tempDir.resolve("missing.yml"));

        assertThat(config.getLineLength()).isEqualTo(80);
    }

    @Test
    void failsOnMalformedFile() throws IOException {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "line_length: [1, 2\n");

        assertThatThrownBy(() -> ConfigurationLoader.loadConfig(file))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("broken.yml");
    }

    @Test
    void savedConfigurationCanBeLoadedAgain() throws IOException {
        FormatterConfig config = FormatterConfig.builder()
                .lineLength(90)
                .indentSize(3)
                .wrapLongLines(true)
                .build();
        Path file = tempDir.resolve("nested/dir/.latexformatter.yml");

        ConfigurationLoader.saveConfig(config, file);
        FormatterConfig loaded = ConfigurationLoader.loadConfig(file);

        assertThat(loaded.getLineLength()).isEqualTo(90);
        assertThat(loaded.getIndentSize()).isEqualTo(3);
        assertThat(loaded.isWrapLongLines()).isTrue();
        assertThat(loaded.getTableEnvironments()).isEqualTo(config.getTableEnvironments());
    }
}
