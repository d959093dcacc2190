package com.stubforge.core.language;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stubforge.core.model.VarType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-type spelling table of a language. Absent entries are types the language
 * does not need a token for.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TypeTokens(
    @JsonProperty("int") String intToken,
    @JsonProperty("float") String floatToken,
    @JsonProperty("long") String longToken,
    @JsonProperty("bool") String boolToken,
    @JsonProperty("word") String wordToken,
    @JsonProperty("string") String stringToken
) {
    public static TypeTokens none() {
        return new TypeTokens(null, null, null, null, null, null);
    }

    public Optional<String> tokenFor(VarType type) {
        String token = switch (type) {
            case INT -> intToken;
            case FLOAT -> floatToken;
            case LONG -> longToken;
            case BOOL -> boolToken;
            case WORD -> wordToken;
            case STRING -> stringToken;
        };
        return Optional.ofNullable(token);
    }

    /**
     * Returns the present entries keyed by template type name ({@code Int}, {@code Word}, ...).
     *
     * @return token map for template contexts
     */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (VarType type : VarType.values()) {
            tokenFor(type).ifPresent(token -> map.put(type.getTemplateName(), token));
        }
        return map;
    }
}
