package com.stubforge.core.renderer;

import com.stubforge.core.StubException;

/**
 * Raised when a template exists but fails while being evaluated.
 */
public class TemplateRenderException extends StubException {

    public TemplateRenderException(String template, Throwable cause) {
        super("Failed to render template '" + template + "': " + cause.getMessage(), cause);
    }
}
