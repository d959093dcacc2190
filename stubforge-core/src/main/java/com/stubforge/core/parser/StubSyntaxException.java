package com.stubforge.core.parser;

import com.stubforge.core.StubException;

/**
 * Raised when stub generator text is malformed or references an undeclared variable.
 */
public class StubSyntaxException extends StubException {

    private final int line;

    public StubSyntaxException(int line, String message) {
        super("line " + line + ": " + message);
        this.line = line;
    }

    /**
     * Returns the 1-based source line the error was detected on.
     *
     * @return source line number
     */
    public int getLine() {
        return line;
    }
}
