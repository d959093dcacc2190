package com.stubforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A node of the command tree built from stub generator text.
 *
 * <p>The set of commands is closed. {@link Opaque} nodes never come out of the parser;
 * they are introduced by rewrite passes and carry a {@link RewriteArtifact}.
 */
public sealed interface Cmd permits Cmd.Read, Cmd.Loop, Cmd.LoopLine, Cmd.Write, Cmd.WriteJoin, Cmd.Opaque {

    /**
     * Reads one or more variables from a single input line.
     *
     * @param variables variables in input order
     */
    record Read(List<VariableCommand> variables) implements Cmd {
        public Read {
            variables = List.copyOf(variables);
            if (variables.isEmpty()) {
                throw new IllegalArgumentException("read requires at least one variable");
            }
        }
    }

    /**
     * Repeats {@code body} a number of times.
     *
     * @param countVariable number literal or identifier of a previously read integer
     * @param body repeated command
     */
    record Loop(String countVariable, Cmd body) implements Cmd {
        public Loop {
            Objects.requireNonNull(countVariable, "countVariable must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    /**
     * Reads a single line holding {@code countVariable} groups of {@code variables}.
     *
     * @param countVariable number literal or identifier of a previously read integer
     * @param variables variables of one group
     */
    record LoopLine(String countVariable, List<VariableCommand> variables) implements Cmd {
        public LoopLine {
            Objects.requireNonNull(countVariable, "countVariable must not be null");
            variables = List.copyOf(variables);
        }
    }

    /**
     * Writes literal lines.
     *
     * @param lines text to print, one entry per output line
     * @param outputComment description attached by an {@code OUTPUT} block
     */
    record Write(List<String> lines, List<String> outputComment) implements Cmd {
        public Write {
            lines = List.copyOf(lines);
            outputComment = outputComment == null ? List.of() : List.copyOf(outputComment);
        }

        public Write withOutputComment(List<String> comment) {
            return new Write(lines, comment);
        }
    }

    /**
     * Writes literal and variable terms separated by single spaces.
     *
     * @param terms joined terms
     * @param outputComment description attached by an {@code OUTPUT} block
     */
    record WriteJoin(List<JoinTerm> terms, List<String> outputComment) implements Cmd {
        public WriteJoin {
            terms = List.copyOf(terms);
            outputComment = outputComment == null ? List.of() : List.copyOf(outputComment);
        }

        public WriteJoin withOutputComment(List<String> comment) {
            return new WriteJoin(terms, comment);
        }
    }

    /**
     * Node produced by a rewrite pass.
     *
     * @param artifact pass-specific payload
     */
    record Opaque(RewriteArtifact artifact) implements Cmd {
        public Opaque {
            Objects.requireNonNull(artifact, "artifact must not be null");
        }
    }
}
