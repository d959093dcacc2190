package com.stubforge.cli;

import com.stubforge.StubForgeCLI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GenerateCommand}.
 */
class GenerateCommandTest {

    @TempDir
    Path tempDir;

    private CommandLine commandLine;
    private StringWriter out;
    private Path emptyConfig;

    @BeforeEach
    void setUp() throws IOException {
        out = new StringWriter();
        commandLine = StubForgeCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
        emptyConfig = tempDir.resolve("stubforge.yaml");
        Files.writeString(emptyConfig, "templatesDirectory: \"\"\n");
    }

    private Path writeStub(String text) throws IOException {
        Path stub = tempDir.resolve("stub.txt");
        Files.writeString(stub, text);
        return stub;
    }

    @Test
    void generate_stubFile_printsCode() throws IOException {
        Path stub = writeStub("read m:int n:int\nwrite result\n");

        int exitCode = commandLine.execute("-q", "generate", "ruby", "-f", stub.toString(), "-c", emptyConfig.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("m, n = gets.split.map(&:to_i)\nputs \"result\"\n");
    }

    @Test
    void generate_withoutLanguage_usesConfiguredDefault() throws IOException {
        Path stub = writeStub("read n:int\n");
        Path config = tempDir.resolve("ruby.yaml");
        Files.writeString(config, "templatesDirectory: \"\"\ndefaultLanguage: ruby\n");

        int exitCode = commandLine.execute("generate", "-f", stub.toString(), "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("n = gets.to_i\n");
    }

    @Test
    void generate_outputFile_writesCodeToFile() throws IOException {
        Path stub = writeStub("read n:int\n");
        Path output = tempDir.resolve("out/solution.py");

        int exitCode = commandLine.execute("generate", "python", "-f", stub.toString(),
            "-o", output.toString(), "-c", emptyConfig.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output)).isEqualTo("n = int(input())\n");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void generate_userTemplatesDirectory_takesPrecedence() throws IOException {
        Path languageDir = Files.createDirectories(tempDir.resolve("templates/python"));
        Files.writeString(languageDir.resolve("stub_config.yaml"), """
            name: python
            source_file_ext: py
            variable_name_options:
              casing: camel_case
            """);
        Files.writeString(languageDir.resolve("main.py.ftl"), "<#list code as line>\n${line}\n</#list>\n");
        Files.writeString(languageDir.resolve("read_one.py.ftl"), "${var.ident} = custom()\n");
        Path stub = writeStub("read my_value:int\n");

        int exitCode = commandLine.execute("generate", "python", "-f", stub.toString(),
            "-t", tempDir.resolve("templates").toString(), "-c", emptyConfig.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("my_value = custom()\n");
    }

    @Test
    void generate_syntaxError_returnsOne() throws IOException {
        Path stub = writeStub("read n\n");

        int exitCode = commandLine.execute("-q", "generate", "python", "-f", stub.toString(), "-c", emptyConfig.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void generate_unknownLanguage_returnsOne() throws IOException {
        Path stub = writeStub("read n:int\n");

        int exitCode = commandLine.execute("-q", "generate", "cobol", "-f", stub.toString(), "-c", emptyConfig.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void generate_missingStubFile_returnsOne() {
        int exitCode = commandLine.execute("-q", "generate", "python", "-f", tempDir.resolve("absent.txt").toString(),
            "-c", emptyConfig.toString());

        assertThat(exitCode).isEqualTo(1);
    }
}
