package com.stubforge.core.language;

import freemarker.cache.FileTemplateLoader;
import freemarker.cache.TemplateLoader;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Templates stored in a language directory on disk.
 */
public class DirectoryTemplateSource implements TemplateSource {

    private final Path directory;

    public DirectoryTemplateSource(Path directory) {
        this.directory = directory;
    }

    @Override
    public TemplateLoader templateLoader() {
        try {
            return new FileTemplateLoader(directory.toFile());
        } catch (IOException e) {
            throw new StubConfigException("Cannot read template directory " + directory, e);
        }
    }

    @Override
    public String describe() {
        return directory.toString();
    }

    public Path getDirectory() {
        return directory;
    }
}
