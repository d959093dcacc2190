package com.stubforge.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(configFile, """
            templatesDirectory: "/opt/stubs"
            defaultLanguage: ruby
            """);

        ToolConfig config = ConfigLoader.load(configFile);

        assertThat(config.templatesDirectory()).isEqualTo("/opt/stubs");
        assertThat(config.templatesPath()).contains(Paths.get("/opt/stubs"));
        assertThat(config.defaultLanguage()).isEqualTo("ruby");
    }

    @Test
    void load_withoutDefaultLanguage_usesPython() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(configFile, "templatesDirectory: ./stubs\n");

        ToolConfig config = ConfigLoader.load(configFile);

        assertThat(config.defaultLanguage()).isEqualTo(ToolConfig.DEFAULT_LANGUAGE);
        assertThat(config.templatesPath()).contains(Paths.get("./stubs"));
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        ToolConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(ToolConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ToolConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ToolConfig.defaults());
    }

    @Test
    void load_directoryInsteadOfFile_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ToolConfig.defaults());
    }

    @Test
    void loadEffective_explicitFile_winsOverDefaultLocation() throws IOException {
        Path configFile = tempDir.resolve("custom.yaml");
        Files.writeString(configFile, "defaultLanguage: haskell\n");

        assertThat(ConfigLoader.loadEffective(configFile).defaultLanguage()).isEqualTo("haskell");
    }

    @Test
    void templatesPath_expandsHomeDirectory() {
        ToolConfig config = ToolConfig.defaults();

        assertThat(config.templatesPath())
            .contains(Paths.get(System.getProperty("user.home"), ".config", "stubforge", "stub_templates"));
    }

    @Test
    void templatesPath_blank_isEmpty() {
        assertThat(new ToolConfig(" ", null).templatesPath()).isEmpty();
    }

    @Test
    void defaultConfigPath_pointsIntoUserConfigDirectory() {
        assertThat(ConfigLoader.defaultConfigPath())
            .endsWithRaw(Paths.get(".config", "stubforge", ConfigLoader.CONFIG_FILE_NAME));
    }
}
