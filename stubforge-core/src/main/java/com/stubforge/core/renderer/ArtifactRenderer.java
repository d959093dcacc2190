package com.stubforge.core.renderer;

import com.stubforge.core.model.ArtifactKind;
import com.stubforge.core.model.RewriteArtifact;

/**
 * Renders one kind of {@link RewriteArtifact}.
 *
 * <p>Implementations render the artifact's retained commands through the general
 * {@link StubRenderer} and splice the resulting lines into their own template.
 */
public interface ArtifactRenderer {

    ArtifactKind kind();

    String render(RewriteArtifact artifact, StubRenderer renderer);
}
