package com.stubforge.core.renderer;

import com.stubforge.core.language.StubConfigException;
import com.stubforge.core.language.TemplateSource;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import freemarker.template.TemplateNotFoundException;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

/**
 * FreeMarker front for the templates of one language.
 *
 * <p>Templates are named {@code <kind>.<extension>.ftl}, e.g. {@code read_one.py.ftl}.
 * They may {@code <#import>} or {@code <#include>} each other by name. Only {@code ${...}}
 * interpolation is enabled so target-language text such as Ruby's {@code #{...}} passes
 * through untouched.
 */
public class TemplateEngine {

    static final String TEMPLATE_SUFFIX = ".ftl";

    private final Configuration configuration;
    private final String fileExtension;
    private final String location;

    public TemplateEngine(TemplateSource source, String fileExtension) {
        this.fileExtension = fileExtension;
        this.location = source.describe();
        this.configuration = new Configuration(Configuration.VERSION_2_3_32);
        configuration.setTemplateLoader(source.templateLoader());
        configuration.setDefaultEncoding("UTF-8");
        configuration.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        configuration.setLogTemplateExceptions(false);
        configuration.setWrapUncheckedExceptions(true);
        configuration.setLocalizedLookup(false);
        configuration.setInterpolationSyntax(Configuration.DOLLAR_INTERPOLATION_SYNTAX);
        configuration.setNumberFormat("computer");
    }

    public String templateName(String kind) {
        return kind + "." + fileExtension + TEMPLATE_SUFFIX;
    }

    /**
     * Renders the template of a command kind.
     *
     * @param kind command kind, e.g. {@code loop}
     * @param model template context
     * @return rendered text
     * @throws StubConfigException if the template is missing or does not parse
     * @throws TemplateRenderException if the template fails while rendering
     */
    public String render(String kind, Map<String, Object> model) {
        String name = templateName(kind);
        Template template;
        try {
            template = configuration.getTemplate(name);
        } catch (TemplateNotFoundException e) {
            throw new StubConfigException("Missing template " + name + " in " + location, e);
        } catch (IOException e) {
            throw new StubConfigException("Cannot load template " + name + " from " + location + ": " + e.getMessage(), e);
        }

        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException | IOException e) {
            throw new TemplateRenderException(name, e);
        }
        return out.toString();
    }
}
