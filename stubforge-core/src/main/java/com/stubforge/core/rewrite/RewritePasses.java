package com.stubforge.core.rewrite;

import com.stubforge.core.language.StubConfigException;

import java.util.List;
import java.util.ServiceLoader;

/**
 * Looks up {@link RewritePass} implementations registered through {@link ServiceLoader}.
 */
public final class RewritePasses {

    private RewritePasses() {
    }

    public static List<RewritePass> all() {
        return ServiceLoader.load(RewritePass.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
    }

    /**
     * Finds a pass by id.
     *
     * @param id pass id from a language descriptor
     * @return the registered pass
     * @throws StubConfigException if no pass has this id
     */
    public static RewritePass byId(String id) {
        return all().stream()
            .filter(pass -> pass.getId().equals(id))
            .findFirst()
            .orElseThrow(() -> new StubConfigException("Unknown rewrite pass '" + id + "'"));
    }
}
