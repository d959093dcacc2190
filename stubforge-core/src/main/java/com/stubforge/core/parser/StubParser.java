package com.stubforge.core.parser;

import com.stubforge.core.model.Cmd;
import com.stubforge.core.model.JoinTerm;
import com.stubforge.core.model.Stub;
import com.stubforge.core.model.VarType;
import com.stubforge.core.model.VariableCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for stub generator text.
 *
 * <p>The grammar is line oriented:
 * <ul>
 *   <li>{@code read a:int b:word(10)} - variables read from one line</li>
 *   <li>{@code write text} - literal output, continued on following non-blank lines</li>
 *   <li>{@code write join("x", a)} - space-joined literals and variables</li>
 *   <li>{@code loop n <command>} - repeats one nested command</li>
 *   <li>{@code loopline n a:int} - {@code n} groups of variables on one line</li>
 *   <li>{@code OUTPUT}, {@code INPUT}, {@code STATEMENT} - comment blocks ended by a blank line</li>
 * </ul>
 *
 * <p>Malformed input raises {@link StubSyntaxException}. Text that merely looks like a
 * {@code join(...)} call but is not a valid one is kept as literal output.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Stub stub = StubParser.parse("read n:int\nloop n read x:int\nwrite answer");
 * }</pre>
 */
public final class StubParser {

    private static final Logger log = LoggerFactory.getLogger(StubParser.class);

    /** Deepest accepted {@code loop} nesting. */
    public static final int MAX_LOOP_DEPTH = 256;

    private static final String JOIN_OPEN = "join(";
    private static final Pattern QUOTED_LITERAL = Pattern.compile("\"([^\"]*)\"");
    private static final Pattern TYPE_SPEC = Pattern.compile("(\\w+)(?:\\((\\w+)\\))?");

    private final TokenCursor cursor;

    StubParser(String text) {
        this.cursor = TokenCursor.over(text);
    }

    /**
     * Parses stub generator text into a command tree.
     *
     * @param text stub generator text
     * @return parsed stub
     * @throws StubSyntaxException if the text is malformed
     */
    public static Stub parse(String text) {
        Stub stub = new StubParser(text).parseStub();
        log.debug("Parsed stub with {} top-level commands and {} statement lines",
            stub.commands().size(), stub.statement().size());
        return stub;
    }

    Stub parseStub() {
        ReadPairings pairings = new ReadPairings();
        List<Cmd> commands = new ArrayList<>();
        List<String> statement = List.of();

        Optional<String> token;
        while ((token = cursor.nextSignificant()).isPresent()) {
            String keyword = token.get();
            switch (keyword) {
                case "read", "write", "loop", "loopline" -> commands.add(parseCommand(keyword, pairings, 0));
                case "OUTPUT" -> {
                    cursor.restOfLine();
                    commands = attachOutputComment(commands, cursor.textBlock());
                }
                case "INPUT" -> {
                    cursor.restOfLine();
                    commands = attachInputComments(commands, cursor.textBlock());
                }
                case "STATEMENT" -> {
                    cursor.restOfLine();
                    statement = cursor.textBlock();
                }
                case "gameloop" -> throw error("gameloop is not supported");
                default -> throw error("unknown keyword '" + keyword + "'");
            }
        }
        return new Stub(commands, statement);
    }

    private Cmd parseCommand(String keyword, ReadPairings pairings, int depth) {
        return switch (keyword) {
            case "read" -> new Cmd.Read(parseVariables(pairings));
            case "write" -> parseWrite(pairings);
            case "loop" -> parseLoop(pairings, depth);
            case "loopline" -> parseLoopLine(pairings);
            case "gameloop" -> throw error("gameloop is not supported");
            default -> throw error("'" + keyword + "' cannot be repeated by a loop");
        };
    }

    /**
     * Parses the {@code ident:type} tokens up to the end of the current line and
     * registers each variable in {@code pairings}.
     */
    List<VariableCommand> parseVariables(ReadPairings pairings) {
        int line = cursor.line();
        List<VariableCommand> variables = new ArrayList<>();
        for (String token : cursor.restOfLine().split(" ")) {
            if (token.isEmpty()) {
                continue;
            }
            VariableCommand variable = parseVariable(token, line);
            pairings.register(variable);
            variables.add(variable);
        }
        if (variables.isEmpty()) {
            throw new StubSyntaxException(line, "expected at least one variable");
        }
        return variables;
    }

    private VariableCommand parseVariable(String token, int line) {
        int colon = token.indexOf(':');
        if (colon < 0) {
            throw new StubSyntaxException(line, "variable '" + token + "' is missing a ':type' suffix");
        }
        String identifier = token.substring(0, colon);
        String typeSpec = token.substring(colon + 1);
        if (identifier.isEmpty()) {
            throw new StubSyntaxException(line, "variable '" + token + "' has no identifier");
        }

        Matcher matcher = TYPE_SPEC.matcher(typeSpec);
        if (!matcher.matches()) {
            throw new StubSyntaxException(line, "malformed type '" + typeSpec + "' for variable '" + identifier + "'");
        }
        VarType type = VarType.fromDslName(matcher.group(1))
            .orElseThrow(() -> new StubSyntaxException(line, "unknown type '" + matcher.group(1) + "'"));
        String length = matcher.group(2);

        if (type.isSized() && length == null) {
            throw new StubSyntaxException(line, "type '" + type.getDslName() + "' of '" + identifier
                + "' requires a length, e.g. " + type.getDslName() + "(256)");
        }
        if (!type.isSized() && length != null) {
            throw new StubSyntaxException(line, "type '" + type.getDslName() + "' of '" + identifier
                + "' does not take a length");
        }
        return new VariableCommand(identifier, type, length, "");
    }

    /**
     * Parses a {@code write} command whose keyword has just been consumed.
     */
    Cmd parseWrite(ReadPairings pairings) {
        int line = cursor.line();
        String first = cursor.restOfLine().trim();
        boolean blockEnded = false;
        if (first.isEmpty() && !cursor.atEnd()) {
            line = cursor.line();
            first = cursor.restOfLine().trim();
            blockEnded = first.isEmpty();
        }

        if (!first.isEmpty()) {
            Optional<List<JoinTerm>> terms = parseJoin(first, pairings, line);
            if (terms.isPresent()) {
                return new Cmd.WriteJoin(terms.get(), List.of());
            }
        }

        List<String> lines = new ArrayList<>();
        if (!first.isEmpty()) {
            lines.add(first);
        }
        if (!blockEnded) {
            lines.addAll(cursor.textBlock());
        }
        return new Cmd.Write(lines, List.of());
    }

    /**
     * Detects a {@code join(...)} call in a write line.
     *
     * @return join terms, or empty if the line is to be printed as it is
     */
    static Optional<List<JoinTerm>> parseJoin(String text, ReadPairings pairings, int line) {
        Optional<String> call = joinArguments(text);
        if (call.isEmpty()) {
            return Optional.empty();
        }

        List<String> arguments = splitArguments(call.get());
        for (String argument : arguments) {
            if (argument.isBlank()) {
                return Optional.empty();
            }
        }

        List<JoinTerm> terms = new ArrayList<>();
        for (String argument : arguments) {
            Matcher literal = QUOTED_LITERAL.matcher(argument);
            if (literal.find()) {
                terms.add(JoinTerm.literal(literal.group(1)));
                continue;
            }
            String identifier = argument.trim();
            VarType type = pairings.typeOf(identifier)
                .orElseThrow(() -> new StubSyntaxException(line,
                    "join references '" + identifier + "' which was never read"));
            terms.add(JoinTerm.variable(identifier, type));
        }
        return Optional.of(terms);
    }

    /**
     * Finds the first {@code join(} with non-empty arguments closed by a {@code )} outside quotes.
     */
    private static Optional<String> joinArguments(String text) {
        int open = text.indexOf(JOIN_OPEN);
        while (open >= 0) {
            int start = open + JOIN_OPEN.length();
            int close = unquotedIndexOf(text, ')', start);
            if (close > start) {
                return Optional.of(text.substring(start, close));
            }
            open = text.indexOf(JOIN_OPEN, open + 1);
        }
        return Optional.empty();
    }

    private static List<String> splitArguments(String arguments) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        int comma = unquotedIndexOf(arguments, ',', start);
        while (comma >= 0) {
            parts.add(arguments.substring(start, comma));
            start = comma + 1;
            comma = unquotedIndexOf(arguments, ',', start);
        }
        parts.add(arguments.substring(start));
        return parts;
    }

    private static int unquotedIndexOf(String text, char wanted, int from) {
        boolean quoted = false;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == wanted && !quoted) {
                return i;
            }
        }
        return -1;
    }

    private Cmd parseLoop(ReadPairings pairings, int depth) {
        if (depth >= MAX_LOOP_DEPTH) {
            throw error("loops are nested deeper than " + MAX_LOOP_DEPTH);
        }
        String count = cursor.nextSignificant()
            .orElseThrow(() -> error("loop is missing its count"));
        String keyword = cursor.nextSignificant()
            .orElseThrow(() -> error("loop " + count + " is missing the command to repeat"));
        return new Cmd.Loop(count, parseCommand(keyword, pairings, depth + 1));
    }

    private Cmd parseLoopLine(ReadPairings pairings) {
        String count = cursor.nextSignificant()
            .orElseThrow(() -> error("loopline is missing its count"));
        return new Cmd.LoopLine(count, parseVariables(pairings));
    }

    /**
     * Attaches {@code comment} to every write parsed so far that has no comment yet.
     */
    static List<Cmd> attachOutputComment(List<Cmd> commands, List<String> comment) {
        List<Cmd> result = new ArrayList<>(commands.size());
        for (Cmd command : commands) {
            result.add(withOutputComment(command, comment));
        }
        return result;
    }

    private static Cmd withOutputComment(Cmd command, List<String> comment) {
        if (command instanceof Cmd.Write write && write.outputComment().isEmpty()) {
            return write.withOutputComment(comment);
        }
        if (command instanceof Cmd.WriteJoin join && join.outputComment().isEmpty()) {
            return join.withOutputComment(comment);
        }
        if (command instanceof Cmd.Loop loop) {
            return new Cmd.Loop(loop.countVariable(), withOutputComment(loop.body(), comment));
        }
        return command;
    }

    /**
     * Applies {@code identifier: description} lines to the variables parsed so far.
     * Lines without a colon are ignored.
     */
    static List<Cmd> attachInputComments(List<Cmd> commands, List<String> lines) {
        List<Cmd> result = commands;
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String identifier = line.substring(0, colon).trim();
            String description = line.substring(colon + 1).trim();

            List<Cmd> annotated = new ArrayList<>(result.size());
            for (Cmd command : result) {
                annotated.add(withInputComment(command, identifier, description));
            }
            result = annotated;
        }
        return result;
    }

    private static Cmd withInputComment(Cmd command, String identifier, String description) {
        if (command instanceof Cmd.Read read) {
            return new Cmd.Read(annotate(read.variables(), identifier, description));
        }
        if (command instanceof Cmd.LoopLine loopLine) {
            return new Cmd.LoopLine(loopLine.countVariable(), annotate(loopLine.variables(), identifier, description));
        }
        if (command instanceof Cmd.Loop loop) {
            return new Cmd.Loop(loop.countVariable(), withInputComment(loop.body(), identifier, description));
        }
        return command;
    }

    private static List<VariableCommand> annotate(List<VariableCommand> variables, String identifier, String description) {
        return variables.stream()
            .map(variable -> variable.identifier().equals(identifier) ? variable.withInputComment(description) : variable)
            .toList();
    }

    private StubSyntaxException error(String message) {
        return new StubSyntaxException(cursor.line(), message);
    }
}
