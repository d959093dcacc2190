package com.stubforge.core.language;

import freemarker.cache.TemplateLoader;

/**
 * Where the templates of one language are loaded from.
 *
 * <p>Rendering only sees the {@link TemplateLoader}; it does not know whether the
 * templates come from disk, from the packaged jar or from memory.
 */
public interface TemplateSource {

    /**
     * Creates a FreeMarker loader rooted at this language's template directory.
     *
     * @return template loader
     */
    TemplateLoader templateLoader();

    /**
     * Returns a human-readable location for log and error messages.
     *
     * @return location description
     */
    String describe();
}
