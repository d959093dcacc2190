package com.stubforge.core.language;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Finds the configuration of a requested language.
 *
 * <p>Resolution is case-insensitive and stops at the first hit:
 * <ol>
 *   <li>user directory, exact name</li>
 *   <li>user directory, alias</li>
 *   <li>bundled set, exact name</li>
 *   <li>bundled set, alias</li>
 * </ol>
 *
 * <p>A user directory holds one sub-directory per language, each with a
 * {@code stub_config.yaml} and its templates. The bundled set is listed in
 * {@code /stub_templates/index.yaml}.
 */
public class LanguageResolver {

    private static final Logger log = LoggerFactory.getLogger(LanguageResolver.class);

    public static final String DESCRIPTOR_FILE = "stub_config.yaml";
    static final String BUNDLE_INDEX = BundledTemplateSource.BUNDLE_ROOT + "/index.yaml";

    static final String STAGE_USER_NAME = "user directory by name";
    static final String STAGE_USER_ALIAS = "user directory by alias";
    static final String STAGE_BUNDLED_NAME = "bundled by name";
    static final String STAGE_BUNDLED_ALIAS = "bundled by alias";

    private final Path userDirectory;

    /**
     * Creates a resolver.
     *
     * @param userDirectory user configuration root, or null to use only the bundled set
     */
    public LanguageResolver(Path userDirectory) {
        this.userDirectory = userDirectory;
    }

    public static LanguageResolver bundledOnly() {
        return new LanguageResolver(null);
    }

    /**
     * Resolves a language by name or alias.
     *
     * @param requested language name, any case
     * @return resolved configuration
     * @throws LanguageNotFoundException if no stage matches
     */
    public StubConfig resolve(String requested) {
        String name = requested.toLowerCase(Locale.ROOT);
        List<String> attempted = new ArrayList<>();

        if (hasUserDirectory()) {
            attempted.add(STAGE_USER_NAME);
            Path languageDir = userDirectory.resolve(name);
            if (Files.isRegularFile(languageDir.resolve(DESCRIPTOR_FILE))) {
                return found(requested, STAGE_USER_NAME, fromDirectory(languageDir));
            }

            attempted.add(STAGE_USER_ALIAS);
            Optional<StubConfig> byAlias = userLanguages().stream()
                .filter(config -> config.language().hasAlias(name))
                .findFirst();
            if (byAlias.isPresent()) {
                return found(requested, STAGE_USER_ALIAS, byAlias.get());
            }
        }

        List<String> bundled = bundledLanguageNames();
        attempted.add(STAGE_BUNDLED_NAME);
        if (bundled.contains(name)) {
            return found(requested, STAGE_BUNDLED_NAME, fromBundle(name));
        }

        attempted.add(STAGE_BUNDLED_ALIAS);
        for (String language : bundled) {
            StubConfig config = fromBundle(language);
            if (config.language().hasAlias(name)) {
                return found(requested, STAGE_BUNDLED_ALIAS, config);
            }
        }

        throw new LanguageNotFoundException(requested, attempted);
    }

    /**
     * Lists every resolvable language, user languages first. A user language hides a
     * bundled language of the same name.
     *
     * @return configurations keyed by language name
     */
    public Map<String, StubConfig> availableLanguages() {
        Map<String, StubConfig> languages = new LinkedHashMap<>();
        if (hasUserDirectory()) {
            userLanguages().forEach(config -> languages.putIfAbsent(config.language().name(), config));
        }
        bundledLanguageNames().forEach(name -> languages.putIfAbsent(name, fromBundle(name)));
        return languages;
    }

    /**
     * Loads a language straight from its directory.
     *
     * @param languageDir directory containing {@code stub_config.yaml} and templates
     * @return configuration
     */
    public static StubConfig fromDirectory(Path languageDir) {
        LanguageDescriptor descriptor = LanguageDescriptorLoader.load(languageDir.resolve(DESCRIPTOR_FILE));
        return new StubConfig(descriptor, new DirectoryTemplateSource(languageDir));
    }

    /**
     * Loads a language from the bundled set.
     *
     * @param language bundled language name
     * @return configuration
     */
    public static StubConfig fromBundle(String language) {
        LanguageDescriptor descriptor = LanguageDescriptorLoader.loadResource(
            BundledTemplateSource.BUNDLE_ROOT + "/" + language + "/" + DESCRIPTOR_FILE);
        return new StubConfig(descriptor, new BundledTemplateSource(language));
    }

    static List<String> bundledLanguageNames() {
        return LanguageDescriptorLoader.readResource(BUNDLE_INDEX, BundleIndex.class).languages();
    }

    private boolean hasUserDirectory() {
        return userDirectory != null && Files.isDirectory(userDirectory);
    }

    private List<StubConfig> userLanguages() {
        List<StubConfig> configs = new ArrayList<>();
        try (Stream<Path> entries = Files.list(userDirectory)) {
            entries.filter(dir -> Files.isRegularFile(dir.resolve(DESCRIPTOR_FILE)))
                .sorted()
                .forEach(dir -> {
                    try {
                        configs.add(fromDirectory(dir));
                    } catch (StubConfigException e) {
                        log.warn("Skipping unreadable language configuration in {}: {}", dir, e.getMessage());
                    }
                });
        } catch (IOException e) {
            throw new StubConfigException("Cannot list user configuration directory " + userDirectory, e);
        }
        return configs;
    }

    private static StubConfig found(String requested, String stage, StubConfig config) {
        log.debug("Resolved language '{}' to {} ({}, {})",
            requested, config.language().name(), stage, config.templates().describe());
        return config;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BundleIndex(@JsonProperty("languages") List<String> languages) {
        public BundleIndex {
            languages = languages == null ? List.of() : List.copyOf(languages);
        }
    }
}
