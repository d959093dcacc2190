package com.stubforge.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads {@code stubforge.yaml} into a {@link ToolConfig}.
 *
 * <p>A configuration file is optional. Anything that cannot be read as a configuration
 * yields {@link ToolConfig#defaults()}, so the CLI keeps working with the bundled languages.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ToolConfig config = ConfigLoader.loadEffective(cliConfigFile);
 * LanguageResolver resolver = new LanguageResolver(config.templatesPath().orElse(null));
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String CONFIG_FILE_NAME = "stubforge.yaml";

    /**
     * Returns {@code ~/.config/stubforge/stubforge.yaml}.
     */
    public static Path defaultConfigPath() {
        return Paths.get(System.getProperty("user.home"), ".config", "stubforge", CONFIG_FILE_NAME);
    }

    /**
     * Loads the file given on the command line, or the one at {@link #defaultConfigPath()}.
     *
     * @param explicitFile file named by the user, may be {@code null}
     * @return effective configuration
     */
    public static ToolConfig loadEffective(Path explicitFile) {
        return load(explicitFile != null ? explicitFile : defaultConfigPath());
    }

    /**
     * Loads {@code configPath}, falling back to defaults when it is absent or malformed.
     *
     * @param configPath path to {@code stubforge.yaml}
     * @return loaded configuration or defaults
     */
    public static ToolConfig load(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            log.debug("No configuration file at {}, using defaults", configPath);
            return ToolConfig.defaults();
        }

        try (Reader reader = Files.newBufferedReader(configPath)) {
            ToolConfig config = YAML_MAPPER.readValue(reader, ToolConfig.class);
            if (config == null) {
                log.debug("Configuration file {} is empty, using defaults", configPath);
                return ToolConfig.defaults();
            }
            log.debug("Loaded configuration from {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Ignoring configuration file {}: {}", configPath, e.getMessage());
            return ToolConfig.defaults();
        }
    }
}
