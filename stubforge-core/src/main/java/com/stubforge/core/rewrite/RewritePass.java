package com.stubforge.core.rewrite;

import com.stubforge.core.model.Cmd;

import java.util.List;

/**
 * Tree transformation applied before rendering for languages that need a different
 * program shape.
 *
 * <p>A pass takes the parsed top-level commands and returns a new command list, usually
 * wrapping parts of it in {@link Cmd.Opaque} nodes. Passes are pure: the input list is
 * never modified.
 *
 * <p>Passes are discovered via Java Service Provider Interface (SPI) and selected by id
 * in a language descriptor's {@code rewrite_pass} field.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.stubforge.core.rewrite.RewritePass}
 *
 * @see RewritePasses
 */
public interface RewritePass {

    /**
     * Returns the id language descriptors use to select this pass.
     *
     * @return lowercase, dash-separated pass id
     */
    String getId();

    /**
     * Returns a human-readable name for listings.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Rewrites a command sequence.
     *
     * @param commands top-level commands of a parsed stub
     * @return rewritten top-level commands
     */
    List<Cmd> apply(List<Cmd> commands);
}
