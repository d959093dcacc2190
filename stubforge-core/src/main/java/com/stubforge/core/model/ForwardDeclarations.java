package com.stubforge.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Variables hoisted to the top of the program, followed by the untouched commands.
 *
 * @param declarations unique variables and synthesized loop counters
 * @param commands original command sequence
 */
public record ForwardDeclarations(List<VariableCommand> declarations, List<Cmd> commands) implements RewriteArtifact {

    public ForwardDeclarations {
        declarations = List.copyOf(declarations);
        commands = List.copyOf(commands);
    }

    @Override
    public ArtifactKind kind() {
        return ArtifactKind.FORWARD_DECLARATIONS;
    }

    @Override
    public List<Cmd> children() {
        return new ArrayList<>(commands);
    }
}
