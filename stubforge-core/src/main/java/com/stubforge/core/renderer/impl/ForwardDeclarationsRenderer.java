package com.stubforge.core.renderer.impl;

import com.stubforge.core.model.ArtifactKind;
import com.stubforge.core.model.ForwardDeclarations;
import com.stubforge.core.model.RewriteArtifact;
import com.stubforge.core.model.VariableCommand;
import com.stubforge.core.renderer.ArtifactRenderer;
import com.stubforge.core.renderer.StubRenderer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders each hoisted variable with {@code forward_declaration} and wraps the
 * declarations and program body with {@code main_wrapper}.
 */
public class ForwardDeclarationsRenderer implements ArtifactRenderer {

    @Override
    public ArtifactKind kind() {
        return ArtifactKind.FORWARD_DECLARATIONS;
    }

    @Override
    public String render(RewriteArtifact artifact, StubRenderer renderer) {
        ForwardDeclarations forward = (ForwardDeclarations) artifact;

        List<String> declarations = new ArrayList<>();
        for (VariableCommand variable : forward.declarations()) {
            Map<String, Object> context = new HashMap<>();
            context.put("var", renderer.variableContext(variable));
            declarations.addAll(renderer.renderTemplate("forward_declaration", context).lines().toList());
        }

        Map<String, Object> context = new HashMap<>();
        context.put("forward_declarations", declarations);
        context.put("main_content", renderer.renderLines(forward.commands(), 0));
        return renderer.renderTemplate("main_wrapper", context);
    }
}
