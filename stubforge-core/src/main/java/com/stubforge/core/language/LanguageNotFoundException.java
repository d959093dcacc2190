package com.stubforge.core.language;

import java.util.List;

/**
 * Raised when no resolution stage knows the requested language.
 */
public class LanguageNotFoundException extends StubConfigException {

    private final String language;
    private final List<String> attemptedStages;

    public LanguageNotFoundException(String language, List<String> attemptedStages) {
        super("No stub configuration found for language '" + language + "' (tried: "
            + String.join(", ", attemptedStages) + ")");
        this.language = language;
        this.attemptedStages = List.copyOf(attemptedStages);
    }

    public String getLanguage() {
        return language;
    }

    public List<String> getAttemptedStages() {
        return attemptedStages;
    }
}
