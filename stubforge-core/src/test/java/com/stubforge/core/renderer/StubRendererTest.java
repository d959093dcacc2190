package com.stubforge.core.renderer;

import com.stubforge.core.language.Casing;
import com.stubforge.core.language.InMemoryTemplateSource;
import com.stubforge.core.language.LanguageDescriptor;
import com.stubforge.core.language.StubConfig;
import com.stubforge.core.language.TypeTokens;
import com.stubforge.core.language.VariableNameOptions;
import com.stubforge.core.model.Cmd;
import com.stubforge.core.model.ReadMainSplit;
import com.stubforge.core.model.Stub;
import com.stubforge.core.parser.StubParser;
import com.stubforge.core.rewrite.LoopCounters;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link StubRenderer} against small in-memory template sets that print
 * the context each template receives.
 */
class StubRendererTest {

    private static final Map<String, String> DEBUG_TEMPLATES = Map.of(
        "main.t.ftl", """

            <#list statement as line>
            S ${line}
            </#list>
            <#list code as line>
            ${line}
            </#list>


            """,
        "read_one.t.ftl", "one ${var.ident} ${var.type} ${var.type_token!\"-\"} sized=${var.sized?c}"
            + "<#if var.max_length??> len=${var.max_length}</#if> [${var.input_comment}] @${index_ident}\n",
        "read_many.t.ftl", "many ${vars?map(v -> v.ident)?join(\",\")} single=${single_type!\"none\"}\n",
        "loop.t.ftl", "loop ${count} ${index_ident} d${depth}\n<#list inner as line>  ${line}\n</#list>",
        "loopline.t.ftl", "loopline ${count} ${index_ident} ${vars?size}\n",
        "write.t.ftl", "<#list output_comment as c>C ${c}\n</#list><#list lines as line>W ${line}\n</#list>",
        "write_join.t.ftl", "J <#list parts as p><#if p.literal>'${p.text}'<#else>${p.ident}:${p.type}</#if><#sep>|</#list>"
            + " / <#list terms as t><#if t.literal>'${t.text}'<#else>${t.ident}</#if><#sep>|</#list>\n",
        "read_main_split.t.ftl", "R<#list read_declarations as l> ${l}</#list>\nM<#list main_content as l> ${l}</#list>\n");

    private static StubConfig config(Map<String, String> templates) {
        LanguageDescriptor language = new LanguageDescriptor("test", "t", List.of(), null,
            new TypeTokens("integer", null, null, null, null, "text"), null,
            new VariableNameOptions(Casing.SNAKE_CASE, false, List.of("end"), false));
        return new StubConfig(language, new InMemoryTemplateSource(templates));
    }

    private static String render(String stubText) {
        Stub stub = StubParser.parse(stubText);
        return new StubRenderer(config(DEBUG_TEMPLATES), LoopCounters.forCommands(stub.commands()))
            .render(stub.commands(), stub.statement());
    }

    @Test
    void render_readOne_passesConvertedVariable() {
        assertThat(render("read maxLen:int\nread myText:string(maxLen)\n\nINPUT\nmaxLen: limit\n")).isEqualTo("""
            one max_len Int integer sized=false [limit] @i
            one my_text String text sized=true len=max_len [] @i
            """);
    }

    @Test
    void render_readMany_flagsUniformType() {
        assertThat(render("read a:int b:int\nread c:int d:float\n")).isEqualTo("""
            many a,b single=Int
            many c,d single=none
            """);
    }

    @Test
    void render_keywordIdentifier_isEscaped() {
        assertThat(render("read end:float\n")).startsWith("one _end Float - ");
    }

    @Test
    void render_nestedLoops_indentInnerLinesAndAdvanceDepth() {
        assertThat(render("read nRows:int\nloop nRows loop 3 loopline nRows x:int y:int\n")).isEqualTo("""
            one n_rows Int integer sized=false [] @i
            loop n_rows i d0
              loop 3 j d1
                loopline n_rows k 2
            """);
    }

    @Test
    void render_writeJoin_mergesLiteralsAndKeepsRawTerms() {
        assertThat(render("read aB:int\nwrite join(\"x\", \"y\", aB, \"z\")\n")).endsWith(
            "J 'x y '|a_b:Int|' z' / 'x'|'y'|a_b|'z'\n");
    }

    @Test
    void render_writeWithComment_andStatement() {
        assertThat(render("write a\nb\n\nOUTPUT\nnote\n\nSTATEMENT\nTitle\n")).isEqualTo("""
            S Title
            C note
            W a
            W b
            """);
    }

    @Test
    void render_opaqueNode_usesArtifactRenderer() {
        Stub stub = StubParser.parse("write w\n\nread n:int\n");
        List<Cmd> rewritten = List.of(new Cmd.Opaque(
            new ReadMainSplit(List.of(stub.commands().get(1)), List.of(stub.commands().get(0)))));

        String code = new StubRenderer(config(DEBUG_TEMPLATES), LoopCounters.forCommands(rewritten))
            .render(rewritten, List.of());

        assertThat(code).isEqualTo("""
            R one n Int integer sized=false [] @i
            M W w
            """);
    }

    @Test
    void render_commonEntriesAreAvailableToEveryTemplate() {
        Map<String, String> templates = new HashMap<>(DEBUG_TEMPLATES);
        templates.put("write.t.ftl", "${language} ${type_tokens.Int} ${type_tokens.String} ${type_parsers?size}\n");

        Stub stub = StubParser.parse("write x\n");
        String code = new StubRenderer(config(templates), LoopCounters.forCommands(stub.commands()))
            .render(stub.commands(), stub.statement());

        assertThat(code).isEqualTo("test integer text 0\n");
    }

    @Test
    void trimBlankLines_dropsOuterBlankLinesAndTerminatesEveryLine() {
        assertThat(StubRenderer.trimBlankLines("\n  \nfirst\n\nsecond\n   \n\n")).isEqualTo("first\n\nsecond\n");
        assertThat(StubRenderer.trimBlankLines("only")).isEqualTo("only\n");
        assertThat(StubRenderer.trimBlankLines("\n\n")).isEmpty();
    }
}
