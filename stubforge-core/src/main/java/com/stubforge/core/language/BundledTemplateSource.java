package com.stubforge.core.language;

import freemarker.cache.ClassTemplateLoader;
import freemarker.cache.TemplateLoader;

/**
 * Templates packaged as classpath resources under {@code /stub_templates/<language>/}.
 */
public class BundledTemplateSource implements TemplateSource {

    static final String BUNDLE_ROOT = "/stub_templates";

    private final String language;

    public BundledTemplateSource(String language) {
        this.language = language;
    }

    @Override
    public TemplateLoader templateLoader() {
        return new ClassTemplateLoader(BundledTemplateSource.class, BUNDLE_ROOT + "/" + language);
    }

    @Override
    public String describe() {
        return "classpath:" + BUNDLE_ROOT + "/" + language;
    }
}
