package com.stubforge.core.language;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Naming rules for identifiers emitted in one language.
 *
 * @param casing naming convention applied to mixed-case identifiers
 * @param allowUppercaseVars whether all-uppercase identifiers are kept as written (default true)
 * @param keywords reserved words that get a {@code _} prefix
 * @param caseInsensitiveKeywords whether keyword collisions ignore case (default false)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VariableNameOptions(
    @JsonProperty("casing") Casing casing,
    @JsonProperty("allow_uppercase_vars") Boolean allowUppercaseVars,
    @JsonProperty("keywords") List<String> keywords,
    @JsonProperty("case_insensitive_keywords") Boolean caseInsensitiveKeywords
) {
    public VariableNameOptions {
        Objects.requireNonNull(casing, "casing must not be null");
        if (allowUppercaseVars == null) {
            allowUppercaseVars = true;
        }
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        if (caseInsensitiveKeywords == null) {
            caseInsensitiveKeywords = false;
        }
    }
}
