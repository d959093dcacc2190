package com.stubforge.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Primitive types a stub variable can be declared with.
 *
 * <p>{@link #WORD} and {@link #STRING} are sized: their declaration carries a maximum
 * length, either a number or the name of a previously read integer.
 */
public enum VarType {
    INT("int", "Int", false),
    FLOAT("float", "Float", false),
    LONG("long", "Long", false),
    BOOL("bool", "Bool", false),
    WORD("word", "Word", true),
    STRING("string", "String", true);

    private final String dslName;
    private final String templateName;
    private final boolean sized;

    VarType(String dslName, String templateName, boolean sized) {
        this.dslName = dslName;
        this.templateName = templateName;
        this.sized = sized;
    }

    /**
     * Looks up a type by its stub generator spelling ({@code int}, {@code word}, ...).
     *
     * @param dslName lowercase type name as written in a stub
     * @return matching type, or empty if the name is unknown
     */
    public static Optional<VarType> fromDslName(String dslName) {
        return Arrays.stream(values())
            .filter(type -> type.dslName.equals(dslName))
            .findFirst();
    }

    public String getDslName() {
        return dslName;
    }

    /**
     * Returns the name templates see in the {@code type} field ({@code Int}, {@code Word}, ...).
     *
     * @return capitalised type name
     */
    public String getTemplateName() {
        return templateName;
    }

    public boolean isSized() {
        return sized;
    }

    @Override
    public String toString() {
        return dslName.toUpperCase(Locale.ROOT);
    }
}
