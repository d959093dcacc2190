package com.stubforge.core.model;

import java.util.List;

/**
 * Result of parsing stub generator text.
 *
 * @param commands top-level commands in source order
 * @param statement lines of the last {@code STATEMENT} block, empty if there was none
 */
public record Stub(List<Cmd> commands, List<String> statement) {

    public Stub {
        commands = List.copyOf(commands);
        statement = List.copyOf(statement);
    }
}
