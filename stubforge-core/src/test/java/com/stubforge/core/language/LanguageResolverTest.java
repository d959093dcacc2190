package com.stubforge.core.language;

import com.stubforge.core.StubGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link LanguageResolver}.
 */
class LanguageResolverTest {

    @TempDir
    Path tempDir;

    private Path writeLanguage(String directory, String descriptor) throws IOException {
        Path languageDir = Files.createDirectories(tempDir.resolve(directory));
        Files.writeString(languageDir.resolve(LanguageResolver.DESCRIPTOR_FILE), descriptor);
        return languageDir;
    }

    private Path writeShoutLanguage() throws IOException {
        Path languageDir = writeLanguage("shout", """
            name: shout
            source_file_ext: sh
            aliases: [yell]
            variable_name_options:
              casing: snake_case
            """);
        Files.writeString(languageDir.resolve("main.sh.ftl"), """
            <#list code as line>
            ${line}
            </#list>
            """);
        Files.writeString(languageDir.resolve("read_one.sh.ftl"), "read ${var.ident}\n");
        Files.writeString(languageDir.resolve("write.sh.ftl"), "<#list lines as line>\necho \"${line?upper_case}\"\n</#list>\n");
        return languageDir;
    }

    @Test
    void resolve_bundledByName_ignoresCase() {
        StubConfig config = LanguageResolver.bundledOnly().resolve("PyThOn");

        assertThat(config.language().name()).isEqualTo("python");
        assertThat(config.templates()).isInstanceOf(BundledTemplateSource.class);
    }

    @Test
    void resolve_bundledByAlias() {
        assertThat(LanguageResolver.bundledOnly().resolve("python3").language().name()).isEqualTo("python");
        assertThat(LanguageResolver.bundledOnly().resolve("hs").language().name()).isEqualTo("haskell");
    }

    @Test
    void resolve_userLanguageByName() throws IOException {
        writeShoutLanguage();

        StubConfig config = new LanguageResolver(tempDir).resolve("Shout");

        assertThat(config.language().name()).isEqualTo("shout");
        assertThat(config.templates()).isInstanceOf(DirectoryTemplateSource.class);
    }

    @Test
    void resolve_userLanguageByAlias() throws IOException {
        writeShoutLanguage();

        assertThat(new LanguageResolver(tempDir).resolve("YELL").language().name()).isEqualTo("shout");
    }

    @Test
    void resolve_userLanguageShadowsBundledOne() throws IOException {
        Path languageDir = writeLanguage("python", """
            name: python
            source_file_ext: py
            variable_name_options:
              casing: camel_case
            """);

        StubConfig config = new LanguageResolver(tempDir).resolve("python");

        assertThat(config.templates().describe()).isEqualTo(languageDir.toString());
        assertThat(config.language().variableNameOptions().casing()).isEqualTo(Casing.CAMEL_CASE);
    }

    @Test
    void resolve_missingUserDirectory_fallsBackToBundled() {
        StubConfig config = new LanguageResolver(tempDir.resolve("does-not-exist")).resolve("ruby");

        assertThat(config.language().name()).isEqualTo("ruby");
    }

    @Test
    void resolve_unknownLanguage_listsAttemptedStages() {
        assertThatThrownBy(() -> new LanguageResolver(tempDir).resolve("cobol"))
            .isInstanceOfSatisfying(LanguageNotFoundException.class, e -> {
                assertThat(e.getLanguage()).isEqualTo("cobol");
                assertThat(e.getAttemptedStages()).containsExactly(
                    LanguageResolver.STAGE_USER_NAME,
                    LanguageResolver.STAGE_USER_ALIAS,
                    LanguageResolver.STAGE_BUNDLED_NAME,
                    LanguageResolver.STAGE_BUNDLED_ALIAS);
            });
    }

    @Test
    void resolve_unknownLanguageWithoutUserDirectory_triesBundledStagesOnly() {
        assertThatThrownBy(() -> LanguageResolver.bundledOnly().resolve("cobol"))
            .isInstanceOfSatisfying(LanguageNotFoundException.class, e ->
                assertThat(e.getAttemptedStages()).containsExactly(
                    LanguageResolver.STAGE_BUNDLED_NAME,
                    LanguageResolver.STAGE_BUNDLED_ALIAS));
    }

    @Test
    void resolve_malformedUserDescriptor_isSkippedDuringAliasSearch() throws IOException {
        writeShoutLanguage();
        writeLanguage("broken", "name: [unterminated");

        assertThat(new LanguageResolver(tempDir).resolve("yell").language().name()).isEqualTo("shout");
    }

    @Test
    void resolve_malformedUserDescriptorByName_fails() throws IOException {
        writeLanguage("broken", "source_file_ext: x\n");

        assertThatThrownBy(() -> new LanguageResolver(tempDir).resolve("broken"))
            .isInstanceOf(StubConfigException.class)
            .hasMessageContaining("broken");
    }

    @Test
    void availableLanguages_listsUserLanguagesFirstThenBundled() throws IOException {
        writeShoutLanguage();

        Map<String, StubConfig> languages = new LanguageResolver(tempDir).availableLanguages();

        assertThat(languages.keySet())
            .containsExactly("shout", "python", "ruby", "c", "pascal", "haskell", "clojure");
    }

    @Test
    void bundleIndex_missingLanguageList_isEmpty() {
        assertThat(new LanguageResolver.BundleIndex(null).languages()).isEmpty();
        assertThat(new LanguageResolver.BundleIndex(List.of("python")).languages()).containsExactly("python");
    }

    @Test
    void userLanguage_rendersWithItsOwnTemplates() throws IOException {
        writeShoutLanguage();
        StubConfig config = new LanguageResolver(tempDir).resolve("shout");

        String code = StubGenerator.generate(config, "read myValue:int\nwrite hello\n");

        assertThat(code).isEqualTo("read my_value\necho \"HELLO\"\n");
    }

    @Test
    void userLanguage_missingTemplate_raisesConfigError() throws IOException {
        writeShoutLanguage();
        StubConfig config = new LanguageResolver(tempDir).resolve("shout");

        assertThatThrownBy(() -> StubGenerator.generate(config, "loop 3 write x\n"))
            .isInstanceOf(StubConfigException.class)
            .hasMessageContaining("loop.sh.ftl");
    }
}
