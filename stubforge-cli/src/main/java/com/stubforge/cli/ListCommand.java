package com.stubforge.cli;

import com.stubforge.core.StubException;
import com.stubforge.core.config.ConfigLoader;
import com.stubforge.core.config.ToolConfig;
import com.stubforge.core.language.LanguageDescriptor;
import com.stubforge.core.language.LanguageResolver;
import com.stubforge.core.language.StubConfig;
import com.stubforge.core.rewrite.RewritePass;
import com.stubforge.core.rewrite.RewritePasses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to list available languages or rewrite passes.
 *
 * <p>Rewrite passes are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List bundled and user languages
 * stubforge list languages
 *
 * # List rewrite passes
 * stubforge list passes
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available languages or rewrite passes",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Type to list: languages or passes")
    private String type;

    @Option(names = {"-c", "--config"}, description = "Tool configuration file (default: ~/.config/stubforge/stubforge.yaml)")
    private Path configFile;

    @Option(names = {"-t", "--templates"}, description = "Directory of language configurations searched before the bundled ones")
    private Path templatesDirectory;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "languages", "language" -> listLanguages();
            case "passes", "pass" -> listPasses();
            default -> {
                log.error("Unknown type: {}. Use: languages or passes", type);
                yield 1;
            }
        };
    }

    private int listLanguages() {
        ToolConfig toolConfig = ConfigLoader.loadEffective(configFile);
        Path userDirectory = templatesDirectory != null ? templatesDirectory : toolConfig.templatesPath().orElse(null);

        Map<String, StubConfig> languages;
        try {
            languages = new LanguageResolver(userDirectory).availableLanguages();
        } catch (StubException e) {
            log.error("Failed to list languages: {}", e.getMessage());
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Languages:");
        out.println();
        for (StubConfig config : languages.values()) {
            LanguageDescriptor language = config.language();
            out.printf("  • %s (.%s)%n", language.name(), language.sourceFileExt());
            if (!language.aliases().isEmpty()) {
                out.printf("    Aliases: %s%n", String.join(", ", language.aliases()));
            }
            language.rewritePassId().ifPresent(pass -> out.printf("    Rewrite pass: %s%n", pass));
            out.printf("    Templates: %s%n", config.templates().describe());
            out.println();
        }
        out.flush();
        return 0;
    }

    private int listPasses() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Rewrite Passes:");
        out.println();

        List<RewritePass> passes = RewritePasses.all();
        for (RewritePass pass : passes) {
            out.printf("  • %s (ID: %s)%n", pass.getDisplayName(), pass.getId());
        }
        if (passes.isEmpty()) {
            out.println("  No rewrite passes found.");
        }
        out.flush();
        return 0;
    }
}
