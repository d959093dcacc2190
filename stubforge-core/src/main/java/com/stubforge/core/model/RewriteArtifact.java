package com.stubforge.core.model;

import java.util.List;

/**
 * Payload of an {@link Cmd.Opaque} node.
 *
 * <p>Each payload retains the sub-trees it was built from so a renderer keyed by
 * {@link #kind()} can render them and splice the result into its own template.
 */
public sealed interface RewriteArtifact permits ForwardDeclarations, ReadMainSplit, ReadBatch {

    ArtifactKind kind();

    /**
     * Returns every command retained by this payload, in rendering order.
     *
     * @return retained commands
     */
    List<Cmd> children();
}
