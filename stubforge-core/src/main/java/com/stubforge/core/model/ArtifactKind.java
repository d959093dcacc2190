package com.stubforge.core.model;

/**
 * Tags the payload types rewrite passes can place in an {@link Cmd.Opaque} node.
 */
public enum ArtifactKind {
    FORWARD_DECLARATIONS,
    READ_MAIN_SPLIT,
    READ_BATCH
}
