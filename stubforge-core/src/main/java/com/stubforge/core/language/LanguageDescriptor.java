package com.stubforge.core.language;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Language descriptor loaded from {@code stub_config.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * name: python
 * source_file_ext: py
 * aliases: [py, python3]
 * type_tokens:
 *   int: int
 *   float: float
 * variable_name_options:
 *   casing: snake_case
 *   allow_uppercase_vars: false
 *   keywords: ["and", "as", "assert"]
 * }</pre>
 *
 * @param name language name, also the name of its configuration directory
 * @param sourceFileExt extension of generated files and middle part of template names
 * @param aliases alternative names accepted by resolution
 * @param rewritePass id of the rewrite pass applied before rendering, or null
 * @param typeTokens primitive type spellings
 * @param typeParsers names of string-to-type conversion functions
 * @param variableNameOptions identifier naming rules
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LanguageDescriptor(
    @JsonProperty("name") String name,
    @JsonProperty("source_file_ext") String sourceFileExt,
    @JsonProperty("aliases") List<String> aliases,
    @JsonProperty("rewrite_pass") String rewritePass,
    @JsonProperty("type_tokens") TypeTokens typeTokens,
    @JsonProperty("type_parsers") TypeTokens typeParsers,
    @JsonProperty("variable_name_options") VariableNameOptions variableNameOptions
) {
    public LanguageDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(sourceFileExt, "source_file_ext must not be null");
        Objects.requireNonNull(variableNameOptions, "variable_name_options must not be null");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        if (typeTokens == null) {
            typeTokens = TypeTokens.none();
        }
        if (typeParsers == null) {
            typeParsers = TypeTokens.none();
        }
    }

    public Optional<String> rewritePassId() {
        return Optional.ofNullable(rewritePass);
    }

    /**
     * Checks whether {@code requested} is one of this language's aliases, ignoring case.
     *
     * @param requested requested language name
     * @return true if an alias matches
     */
    public boolean hasAlias(String requested) {
        String lower = requested.toLowerCase(Locale.ROOT);
        return aliases.stream().anyMatch(alias -> alias.toLowerCase(Locale.ROOT).equals(lower));
    }
}
