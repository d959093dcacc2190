package com.stubforge.cli;

import com.stubforge.core.StubException;
import com.stubforge.core.StubGenerator;
import com.stubforge.core.config.ConfigLoader;
import com.stubforge.core.config.ToolConfig;
import com.stubforge.core.language.LanguageResolver;
import com.stubforge.core.language.StubConfig;
import com.stubforge.core.parser.StubSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to generate a stub in one language.
 *
 * <p>Reads stub generator text from a file, or from standard input when no file is
 * given, and prints the generated code or writes it to a file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Default language from stubforge.yaml
 * stubforge generate -f stub.txt
 *
 * # Pascal, written to a file
 * stubforge generate pascal -f stub.txt -o Answer.pas
 *
 * # Languages from a custom directory
 * stubforge generate mylang -t ./stub_templates -f stub.txt
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate a stub from stub generator text",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1",
        description = "Language name or alias (default: defaultLanguage from the configuration)")
    private String language;

    @Option(names = {"-f", "--file"}, description = "Stub generator text file (default: standard input)")
    private Path stubFile;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    private Path outputFile;

    @Option(names = {"-c", "--config"}, description = "Tool configuration file (default: ~/.config/stubforge/stubforge.yaml)")
    private Path configFile;

    @Option(names = {"-t", "--templates"}, description = "Directory of language configurations searched before the bundled ones")
    private Path templatesDirectory;

    @Override
    public Integer call() {
        ToolConfig toolConfig = ConfigLoader.loadEffective(configFile);
        String requested = language != null ? language : toolConfig.defaultLanguage();
        Path userDirectory = templatesDirectory != null ? templatesDirectory : toolConfig.templatesPath().orElse(null);

        String dslText;
        try {
            dslText = readStub();
        } catch (IOException e) {
            log.error("Failed to read stub generator text: {}", e.getMessage());
            return 1;
        }

        try {
            StubConfig config = new LanguageResolver(userDirectory).resolve(requested);
            log.info("Generating {} stub using {}", config.language().name(), config.templates().describe());
            String code = StubGenerator.generate(config, dslText);
            writeResult(code);
            return 0;
        } catch (StubSyntaxException e) {
            log.error("Invalid stub generator text at line {}: {}", e.getLine(), e.getMessage());
            return 1;
        } catch (StubException e) {
            log.error("Stub generation failed: {}", e.getMessage());
            log.debug("Stub generation failure", e);
            return 1;
        } catch (IOException e) {
            log.error("Failed to write {}: {}", outputFile, e.getMessage());
            return 1;
        }
    }

    private String readStub() throws IOException {
        if (stubFile != null) {
            log.debug("Reading stub generator text from {}", stubFile);
            return Files.readString(stubFile, StandardCharsets.UTF_8);
        }
        log.debug("Reading stub generator text from standard input");
        InputStream in = System.in;
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    private void writeResult(String code) throws IOException {
        if (outputFile == null) {
            spec.commandLine().getOut().print(code);
            spec.commandLine().getOut().flush();
            return;
        }
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputFile, code, StandardCharsets.UTF_8);
        log.info("Wrote {}", outputFile);
    }
}
