package com.stubforge.core.language;

import com.stubforge.core.StubException;

/**
 * Raised for configuration problems: malformed language descriptors, missing
 * templates or unknown rewrite passes.
 */
public class StubConfigException extends StubException {

    public StubConfigException(String message) {
        super(message);
    }

    public StubConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
