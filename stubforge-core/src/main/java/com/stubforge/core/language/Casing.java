package com.stubforge.core.language;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Identifier naming conventions of target languages.
 *
 * <p>Word splitting treats any run of non-lowercase characters followed by a run of
 * lowercase ASCII letters as one word, so {@code craneASCIIRepresentation} splits into
 * {@code crane} and {@code asciirepresentation}.
 */
public enum Casing {
    @JsonProperty("snake_case")
    SNAKE_CASE {
        @Override
        public String convert(String identifier) {
            return String.join("_", words(identifier));
        }
    },
    @JsonProperty("kebab_case")
    KEBAB_CASE {
        @Override
        public String convert(String identifier) {
            return String.join("-", words(identifier));
        }
    },
    @JsonProperty("camel_case")
    CAMEL_CASE {
        @Override
        public String convert(String identifier) {
            if (identifier.isEmpty()) {
                return identifier;
            }
            return identifier.substring(0, 1).toLowerCase(Locale.ROOT) + identifier.substring(1);
        }
    },
    @JsonProperty("pascal_case")
    PASCAL_CASE {
        @Override
        public String convert(String identifier) {
            if (identifier.isEmpty()) {
                return identifier;
            }
            return identifier.substring(0, 1).toUpperCase(Locale.ROOT) + identifier.substring(1);
        }
    };

    /**
     * Converts a stub identifier to this convention.
     *
     * @param identifier identifier as spelled in the stub
     * @return converted identifier
     */
    public abstract String convert(String identifier);

    static List<String> words(String identifier) {
        List<String> words = new ArrayList<>();
        int length = identifier.length();
        int index = 0;
        while (index < length) {
            int start = index;
            while (index < length && !isAsciiLowercase(identifier.charAt(index))) {
                index++;
            }
            while (index < length && isAsciiLowercase(identifier.charAt(index))) {
                index++;
            }
            words.add(identifier.substring(start, index).toLowerCase(Locale.ROOT));
        }
        return words;
    }

    private static boolean isAsciiLowercase(char c) {
        return c >= 'a' && c <= 'z';
    }
}
