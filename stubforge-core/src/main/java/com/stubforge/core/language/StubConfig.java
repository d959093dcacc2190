package com.stubforge.core.language;

import java.util.Objects;

/**
 * A resolved language: its descriptor and the templates to render it with.
 *
 * @param language language descriptor
 * @param templates template location
 */
public record StubConfig(LanguageDescriptor language, TemplateSource templates) {

    public StubConfig {
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(templates, "templates must not be null");
    }
}
