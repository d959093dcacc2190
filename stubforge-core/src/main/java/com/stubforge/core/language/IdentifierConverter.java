package com.stubforge.core.language;

import java.util.Locale;

/**
 * Turns stub identifiers into identifiers of the target language.
 *
 * <p>All-uppercase identifiers bypass the casing convention: they stay as written, or
 * are lowercased when the language disallows uppercase variables. Keyword escaping runs
 * after casing since casing itself can produce a keyword.
 */
public class IdentifierConverter {

    static final String KEYWORD_PREFIX = "_";

    private final VariableNameOptions options;

    public IdentifierConverter(VariableNameOptions options) {
        this.options = options;
    }

    public String convert(String identifier) {
        String converted;
        if (isUppercase(identifier)) {
            converted = options.allowUppercaseVars() ? identifier : identifier.toLowerCase(Locale.ROOT);
        } else {
            converted = options.casing().convert(identifier);
        }
        return escapeKeyword(converted);
    }

    private String escapeKeyword(String identifier) {
        boolean reserved = options.keywords().stream().anyMatch(keyword -> options.caseInsensitiveKeywords()
            ? keyword.equalsIgnoreCase(identifier)
            : keyword.equals(identifier));
        return reserved ? KEYWORD_PREFIX + identifier : identifier;
    }

    private static boolean isUppercase(String identifier) {
        return identifier.chars().allMatch(Character::isUpperCase);
    }
}
