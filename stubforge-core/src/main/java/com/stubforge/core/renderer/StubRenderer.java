package com.stubforge.core.renderer;

import com.stubforge.core.language.IdentifierConverter;
import com.stubforge.core.language.LanguageDescriptor;
import com.stubforge.core.language.StubConfig;
import com.stubforge.core.language.StubConfigException;
import com.stubforge.core.model.ArtifactKind;
import com.stubforge.core.model.Cmd;
import com.stubforge.core.model.JoinTerm;
import com.stubforge.core.model.VarType;
import com.stubforge.core.model.VariableCommand;
import com.stubforge.core.renderer.impl.ForwardDeclarationsRenderer;
import com.stubforge.core.renderer.impl.ReadBatchRenderer;
import com.stubforge.core.renderer.impl.ReadMainSplitRenderer;
import com.stubforge.core.rewrite.LoopCounters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks a command tree and renders it through the templates of one language.
 *
 * <p>Each command kind maps to one template:
 * <ul>
 *   <li>{@code read_one} / {@code read_many} - a read of one or several variables</li>
 *   <li>{@code loop}, {@code loopline}, {@code write}, {@code write_join}</li>
 *   <li>{@code main} - the whole program, with the statement and top-level code lines</li>
 * </ul>
 *
 * <p>Children render first and reach their parent as a list of lines, so templates only
 * add their own indentation. {@link Cmd.Opaque} nodes are handed to the
 * {@link ArtifactRenderer} registered for their {@link ArtifactKind}.
 *
 * <p>Identifiers are converted with the language's naming rules before they reach a
 * template. Every template also sees {@code type_tokens}, {@code type_parsers} and
 * {@code language}.
 */
public class StubRenderer {

    private static final Logger log = LoggerFactory.getLogger(StubRenderer.class);

    private final LanguageDescriptor language;
    private final TemplateEngine templates;
    private final IdentifierConverter identifiers;
    private final LoopCounters loopCounters;
    private final Map<ArtifactKind, ArtifactRenderer> artifactRenderers = new EnumMap<>(ArtifactKind.class);

    public StubRenderer(StubConfig config, LoopCounters loopCounters) {
        this.language = config.language();
        this.templates = new TemplateEngine(config.templates(), language.sourceFileExt());
        this.identifiers = new IdentifierConverter(language.variableNameOptions());
        this.loopCounters = loopCounters;
        register(new ForwardDeclarationsRenderer());
        register(new ReadMainSplitRenderer());
        register(new ReadBatchRenderer());
    }

    private void register(ArtifactRenderer renderer) {
        artifactRenderers.put(renderer.kind(), renderer);
    }

    /**
     * Renders a whole program.
     *
     * @param commands top-level commands, possibly rewritten
     * @param statement statement lines shown as a leading comment
     * @return program text without leading or trailing blank lines, each line ending in a newline
     */
    public String render(List<Cmd> commands, List<String> statement) {
        Map<String, Object> context = new HashMap<>();
        context.put("statement", statement);
        context.put("code", renderLines(commands, 0));
        String program = renderTemplate("main", context);
        log.debug("Rendered {} commands for {}", commands.size(), language.name());
        return trimBlankLines(program);
    }

    public List<String> renderLines(List<Cmd> commands, int depth) {
        List<String> lines = new ArrayList<>();
        for (Cmd command : commands) {
            lines.addAll(renderCommand(command, depth).lines().toList());
        }
        return lines;
    }

    /**
     * Renders a single command.
     *
     * @param command command to render
     * @param depth number of enclosing loops, selects the loop index name
     * @return rendered text
     */
    public String renderCommand(Cmd command, int depth) {
        if (command instanceof Cmd.Read read) {
            return renderRead(read, depth);
        }
        if (command instanceof Cmd.Loop loop) {
            Map<String, Object> context = loopContext(loop.countVariable(), depth);
            context.put("inner", renderLines(List.of(loop.body()), depth + 1));
            return renderTemplate("loop", context);
        }
        if (command instanceof Cmd.LoopLine loopLine) {
            Map<String, Object> context = loopContext(loopLine.countVariable(), depth);
            context.put("vars", variableContexts(loopLine.variables()));
            return renderTemplate("loopline", context);
        }
        if (command instanceof Cmd.Write write) {
            Map<String, Object> context = depthContext(depth);
            context.put("lines", write.lines());
            context.put("output_comment", write.outputComment());
            return renderTemplate("write", context);
        }
        if (command instanceof Cmd.WriteJoin join) {
            Map<String, Object> context = depthContext(depth);
            context.put("terms", termContexts(join.terms()));
            context.put("parts", partContexts(join.terms()));
            context.put("output_comment", join.outputComment());
            return renderTemplate("write_join", context);
        }
        Cmd.Opaque opaque = (Cmd.Opaque) command;
        ArtifactRenderer renderer = artifactRenderers.get(opaque.artifact().kind());
        if (renderer == null) {
            throw new StubConfigException("No renderer for " + opaque.artifact().kind());
        }
        return renderer.render(opaque.artifact(), this);
    }

    private String renderRead(Cmd.Read read, int depth) {
        Map<String, Object> context = depthContext(depth);
        List<VariableCommand> variables = read.variables();
        if (variables.size() == 1) {
            context.put("var", variableContext(variables.get(0)));
            return renderTemplate("read_one", context);
        }

        context.put("vars", variableContexts(variables));
        VarType first = variables.get(0).type();
        if (variables.stream().allMatch(variable -> variable.type() == first)) {
            context.put("single_type", first.getTemplateName());
        }
        return renderTemplate("read_many", context);
    }

    /**
     * Renders a named template, adding the language-wide entries to its context.
     *
     * @param kind template kind
     * @param context template context
     * @return rendered text
     */
    public String renderTemplate(String kind, Map<String, Object> context) {
        Map<String, Object> model = new HashMap<>(context);
        model.put("type_tokens", language.typeTokens().asMap());
        model.put("type_parsers", language.typeParsers().asMap());
        model.put("language", language.name());
        return templates.render(kind, model);
    }

    /**
     * Builds the template view of a variable.
     *
     * @param variable variable as parsed
     * @return map with {@code ident}, {@code type}, {@code type_token}, {@code type_parser},
     *         {@code max_length}, {@code input_comment} and {@code sized}
     */
    public Map<String, Object> variableContext(VariableCommand variable) {
        Map<String, Object> context = new HashMap<>();
        context.put("ident", identifiers.convert(variable.identifier()));
        context.put("type", variable.type().getTemplateName());
        language.typeTokens().tokenFor(variable.type()).ifPresent(token -> context.put("type_token", token));
        language.typeParsers().tokenFor(variable.type()).ifPresent(parser -> context.put("type_parser", parser));
        if (variable.maxLength() != null) {
            context.put("max_length", identifiers.convert(variable.maxLength()));
        }
        context.put("input_comment", variable.inputComment());
        context.put("sized", variable.type().isSized());
        return context;
    }

    private List<Map<String, Object>> variableContexts(List<VariableCommand> variables) {
        return variables.stream().map(this::variableContext).toList();
    }

    private Map<String, Object> depthContext(int depth) {
        Map<String, Object> context = new HashMap<>();
        context.put("index_ident", identifiers.convert(loopCounters.nameAt(depth)));
        context.put("depth", depth);
        return context;
    }

    private Map<String, Object> loopContext(String countVariable, int depth) {
        Map<String, Object> context = depthContext(depth);
        context.put("count", identifiers.convert(countVariable));
        return context;
    }

    private List<Map<String, Object>> termContexts(List<JoinTerm> terms) {
        List<Map<String, Object>> contexts = new ArrayList<>();
        for (JoinTerm term : terms) {
            contexts.add(term.isLiteral() ? literalPart(term.value()) : variablePart(term));
        }
        return contexts;
    }

    /**
     * Joins terms the way they are printed: single spaces between terms, adjacent
     * literals (and the separating spaces) merged into one literal.
     */
    private List<Map<String, Object>> partContexts(List<JoinTerm> terms) {
        List<Map<String, Object>> parts = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        for (int index = 0; index < terms.size(); index++) {
            JoinTerm term = terms.get(index);
            if (index > 0) {
                pending.append(' ');
            }
            if (term.isLiteral()) {
                pending.append(term.value());
                continue;
            }
            if (pending.length() > 0) {
                parts.add(literalPart(pending.toString()));
                pending.setLength(0);
            }
            parts.add(variablePart(term));
        }
        if (pending.length() > 0) {
            parts.add(literalPart(pending.toString()));
        }
        return parts;
    }

    private static Map<String, Object> literalPart(String text) {
        Map<String, Object> part = new HashMap<>();
        part.put("literal", true);
        part.put("text", text);
        return part;
    }

    private Map<String, Object> variablePart(JoinTerm term) {
        Map<String, Object> part = new HashMap<>();
        part.put("literal", false);
        part.put("ident", identifiers.convert(term.value()));
        part.put("type", term.type().getTemplateName());
        language.typeTokens().tokenFor(term.type()).ifPresent(token -> part.put("type_token", token));
        return part;
    }

    static String trimBlankLines(String text) {
        List<String> lines = text.lines().toList();
        int start = 0;
        int end = lines.size();
        while (start < end && lines.get(start).isBlank()) {
            start++;
        }
        while (end > start && lines.get(end - 1).isBlank()) {
            end--;
        }
        StringBuilder result = new StringBuilder();
        for (String line : lines.subList(start, end)) {
            result.append(line).append('\n');
        }
        return result.toString();
    }
}
