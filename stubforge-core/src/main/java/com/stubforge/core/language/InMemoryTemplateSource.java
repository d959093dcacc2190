package com.stubforge.core.language;

import freemarker.cache.StringTemplateLoader;
import freemarker.cache.TemplateLoader;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Templates held in memory, keyed by template name.
 */
public class InMemoryTemplateSource implements TemplateSource {

    private final Map<String, String> templates;

    public InMemoryTemplateSource(Map<String, String> templates) {
        this.templates = new LinkedHashMap<>(templates);
    }

    @Override
    public TemplateLoader templateLoader() {
        StringTemplateLoader loader = new StringTemplateLoader();
        templates.forEach(loader::putTemplate);
        return loader;
    }

    @Override
    public String describe() {
        return "memory:" + templates.keySet();
    }
}
