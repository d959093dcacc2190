package com.stubforge.core.renderer;

import com.stubforge.core.language.InMemoryTemplateSource;
import com.stubforge.core.language.StubConfigException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TemplateEngine}.
 */
class TemplateEngineTest {

    private static TemplateEngine engine(Map<String, String> templates) {
        return new TemplateEngine(new InMemoryTemplateSource(templates), "rb");
    }

    @Test
    void templateName_combinesKindAndExtension() {
        assertThat(engine(Map.of()).templateName("read_one")).isEqualTo("read_one.rb.ftl");
    }

    @Test
    void render_interpolatesDollarSyntaxOnly() {
        TemplateEngine engine = engine(Map.of("write.rb.ftl", "puts \"#{${ident}}\""));

        assertThat(engine.render("write", Map.of("ident", "n"))).isEqualTo("puts \"#{n}\"");
    }

    @Test
    void render_formatsNumbersWithoutGrouping() {
        TemplateEngine engine = engine(Map.of("loop.rb.ftl", "${depth}"));

        assertThat(engine.render("loop", Map.of("depth", 12345))).isEqualTo("12345");
    }

    @Test
    void render_importsSharedTemplates() {
        TemplateEngine engine = engine(Map.of(
            "common.rb.ftl", "<#function shout s><#return s?upper_case></#function>",
            "write.rb.ftl", "<#import \"common.rb.ftl\" as c>${c.shout(text)}"));

        assertThat(engine.render("write", Map.of("text", "hi"))).isEqualTo("HI");
    }

    @Test
    void render_missingTemplate_raisesConfigError() {
        assertThatThrownBy(() -> engine(Map.of()).render("loop", Map.of()))
            .isInstanceOf(StubConfigException.class)
            .hasMessageContaining("Missing template loop.rb.ftl");
    }

    @Test
    void render_unparsableTemplate_raisesConfigError() {
        TemplateEngine engine = engine(Map.of("loop.rb.ftl", "<#if>"));

        assertThatThrownBy(() -> engine.render("loop", Map.of()))
            .isInstanceOf(StubConfigException.class)
            .hasMessageContaining("loop.rb.ftl");
    }

    @Test
    void render_undefinedVariable_raisesRenderError() {
        TemplateEngine engine = engine(Map.of("loop.rb.ftl", "${missing}"));

        assertThatThrownBy(() -> engine.render("loop", Map.of()))
            .isInstanceOf(TemplateRenderException.class)
            .hasMessageContaining("loop.rb.ftl");
    }
}
