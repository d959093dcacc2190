package com.stubforge.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level reads separated from the rest of the program.
 *
 * @param readDeclarations top-level read commands in order
 * @param mainContent every other top-level command in order
 */
public record ReadMainSplit(List<Cmd> readDeclarations, List<Cmd> mainContent) implements RewriteArtifact {

    public ReadMainSplit {
        readDeclarations = List.copyOf(readDeclarations);
        mainContent = List.copyOf(mainContent);
    }

    @Override
    public ArtifactKind kind() {
        return ArtifactKind.READ_MAIN_SPLIT;
    }

    @Override
    public List<Cmd> children() {
        List<Cmd> children = new ArrayList<>(readDeclarations);
        children.addAll(mainContent);
        return children;
    }
}
