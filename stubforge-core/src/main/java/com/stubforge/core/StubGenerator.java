package com.stubforge.core;

import com.stubforge.core.language.LanguageResolver;
import com.stubforge.core.language.StubConfig;
import com.stubforge.core.model.Cmd;
import com.stubforge.core.model.Stub;
import com.stubforge.core.parser.StubParser;
import com.stubforge.core.renderer.StubRenderer;
import com.stubforge.core.rewrite.LoopCounters;
import com.stubforge.core.rewrite.RewritePass;
import com.stubforge.core.rewrite.RewritePasses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Stub generation pipeline: parse, optionally rewrite, render.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * StubConfig python = LanguageResolver.bundledOnly().resolve("python");
 * String code = StubGenerator.generate(python, "read m:int n:int\nwrite result");
 * }</pre>
 *
 * <p>Every failure is a {@link StubException}; nothing is recovered internally.
 */
public final class StubGenerator {

    private static final Logger log = LoggerFactory.getLogger(StubGenerator.class);

    private StubGenerator() {
    }

    /**
     * Generates a stub for a resolved language.
     *
     * @param config language configuration
     * @param dslText stub generator text
     * @return generated source code
     */
    public static String generate(StubConfig config, String dslText) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(dslText, "dslText must not be null");

        Stub stub = StubParser.parse(dslText);
        LoopCounters loopCounters = LoopCounters.forCommands(stub.commands());

        List<Cmd> commands = stub.commands();
        if (config.language().rewritePassId().isPresent()) {
            RewritePass pass = RewritePasses.byId(config.language().rewritePassId().get());
            log.debug("Applying rewrite pass '{}' for {}", pass.getId(), config.language().name());
            commands = pass.apply(commands);
        }

        return new StubRenderer(config, loopCounters).render(commands, stub.statement());
    }

    /**
     * Generates a stub for a bundled language.
     *
     * @param language language name or alias
     * @param dslText stub generator text
     * @return generated source code
     */
    public static String generate(String language, String dslText) {
        return generate(LanguageResolver.bundledOnly().resolve(language), dslText);
    }
}
