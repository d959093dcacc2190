package com.stubforge.core.renderer.impl;

import com.stubforge.core.model.ArtifactKind;
import com.stubforge.core.model.ReadBatch;
import com.stubforge.core.model.RewriteArtifact;
import com.stubforge.core.renderer.ArtifactRenderer;
import com.stubforge.core.renderer.StubRenderer;

import java.util.HashMap;
import java.util.Map;

/**
 * Renders a batch of reads and the commands nested under it into {@code read_batch}.
 */
public class ReadBatchRenderer implements ArtifactRenderer {

    @Override
    public ArtifactKind kind() {
        return ArtifactKind.READ_BATCH;
    }

    @Override
    public String render(RewriteArtifact artifact, StubRenderer renderer) {
        ReadBatch batch = (ReadBatch) artifact;
        Map<String, Object> context = new HashMap<>();
        context.put("read_lines", renderer.renderLines(batch.reads(), 0));
        context.put("nested_lines", renderer.renderLines(batch.nested(), 0));
        return renderer.renderTemplate("read_batch", context);
    }
}
