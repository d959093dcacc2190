package com.stubforge.core.model;

import java.util.Objects;

/**
 * A single variable declared by a {@code read} or {@code loopline} command.
 *
 * @param identifier identifier as spelled in the stub
 * @param type declared type
 * @param maxLength length expression, present only for sized types
 * @param inputComment description attached by an {@code INPUT} block, empty by default
 */
public record VariableCommand(
    String identifier,
    VarType type,
    String maxLength,
    String inputComment
) {
    public VariableCommand {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (type.isSized() != (maxLength != null)) {
            throw new IllegalArgumentException(type.isSized()
                ? "Sized type " + type + " requires a max length"
                : "Unsized type " + type + " cannot have a max length");
        }
        if (inputComment == null) {
            inputComment = "";
        }
    }

    public static VariableCommand of(String identifier, VarType type) {
        return new VariableCommand(identifier, type, null, "");
    }

    public static VariableCommand sized(String identifier, VarType type, String maxLength) {
        return new VariableCommand(identifier, type, maxLength, "");
    }

    public VariableCommand withInputComment(String comment) {
        return new VariableCommand(identifier, type, maxLength, comment);
    }
}
