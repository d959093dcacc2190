package com.stubforge.core.parser;

import com.stubforge.core.model.VarType;
import com.stubforge.core.model.VariableCommand;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Types of the variables declared so far, keyed by identifier.
 *
 * <p>Filled by {@code read} and {@code loopline} and consulted by {@code write join(...)}.
 * A later declaration of the same identifier replaces the earlier type.
 */
public final class ReadPairings {

    private final Map<String, VarType> types = new HashMap<>();

    public void register(VariableCommand variable) {
        types.put(variable.identifier(), variable.type());
    }

    public Optional<VarType> typeOf(String identifier) {
        return Optional.ofNullable(types.get(identifier));
    }

    public int size() {
        return types.size();
    }
}
