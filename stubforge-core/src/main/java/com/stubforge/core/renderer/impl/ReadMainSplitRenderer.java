package com.stubforge.core.renderer.impl;

import com.stubforge.core.model.ArtifactKind;
import com.stubforge.core.model.ReadMainSplit;
import com.stubforge.core.model.RewriteArtifact;
import com.stubforge.core.renderer.ArtifactRenderer;
import com.stubforge.core.renderer.StubRenderer;

import java.util.HashMap;
import java.util.Map;

/**
 * Renders the read and main groups separately into {@code read_main_split}.
 */
public class ReadMainSplitRenderer implements ArtifactRenderer {

    @Override
    public ArtifactKind kind() {
        return ArtifactKind.READ_MAIN_SPLIT;
    }

    @Override
    public String render(RewriteArtifact artifact, StubRenderer renderer) {
        ReadMainSplit split = (ReadMainSplit) artifact;
        Map<String, Object> context = new HashMap<>();
        context.put("read_declarations", renderer.renderLines(split.readDeclarations(), 0));
        context.put("main_content", renderer.renderLines(split.mainContent(), 0));
        return renderer.renderTemplate("read_main_split", context);
    }
}
