package com.stubforge.core.model;

import java.util.Objects;

/**
 * One argument of a {@code write join(...)} command.
 *
 * @param value literal text, or the identifier of a previously read variable
 * @param type variable type, {@code null} for literal terms
 */
public record JoinTerm(String value, VarType type) {

    public JoinTerm {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static JoinTerm literal(String text) {
        return new JoinTerm(text, null);
    }

    public static JoinTerm variable(String identifier, VarType type) {
        return new JoinTerm(identifier, Objects.requireNonNull(type, "type must not be null"));
    }

    public boolean isLiteral() {
        return type == null;
    }
}
