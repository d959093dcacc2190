package com.stubforge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * StubForge tool settings, loaded from {@code stubforge.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * templatesDirectory: "~/.config/stubforge/stub_templates"
 * defaultLanguage: python
 * }</pre>
 *
 * @param templatesDirectory user language root searched before the bundled languages;
 *                           a leading {@code ~} stands for the user's home directory
 * @param defaultLanguage language used when none is requested
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolConfig(
    @JsonProperty("templatesDirectory") String templatesDirectory,
    @JsonProperty("defaultLanguage") String defaultLanguage
) {
    public static final String DEFAULT_TEMPLATES_DIRECTORY = "~/.config/stubforge/stub_templates";
    public static final String DEFAULT_LANGUAGE = "python";

    public ToolConfig {
        if (defaultLanguage == null || defaultLanguage.isBlank()) {
            defaultLanguage = DEFAULT_LANGUAGE;
        }
    }

    /**
     * Creates the configuration used when no file is present.
     *
     * @return default configuration
     */
    public static ToolConfig defaults() {
        return new ToolConfig(DEFAULT_TEMPLATES_DIRECTORY, DEFAULT_LANGUAGE);
    }

    /**
     * Returns the user language root with {@code ~} expanded.
     *
     * @return user templates directory, or empty if none is configured
     */
    public Optional<Path> templatesPath() {
        if (templatesDirectory == null || templatesDirectory.isBlank()) {
            return Optional.empty();
        }
        if (templatesDirectory.equals("~") || templatesDirectory.startsWith("~/")) {
            return Optional.of(Paths.get(System.getProperty("user.home"), templatesDirectory.substring(1)));
        }
        return Optional.of(Paths.get(templatesDirectory));
    }
}
