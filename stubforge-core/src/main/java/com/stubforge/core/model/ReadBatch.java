package com.stubforge.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A run of consecutive reads together with the commands that follow it.
 *
 * @param reads consecutive read commands
 * @param nested commands following the run, possibly containing further batches
 */
public record ReadBatch(List<Cmd> reads, List<Cmd> nested) implements RewriteArtifact {

    public ReadBatch {
        reads = List.copyOf(reads);
        nested = List.copyOf(nested);
    }

    @Override
    public ArtifactKind kind() {
        return ArtifactKind.READ_BATCH;
    }

    @Override
    public List<Cmd> children() {
        List<Cmd> children = new ArrayList<>(reads);
        children.addAll(nested);
        return children;
    }
}
