package com.stubforge.core.language;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code stub_config.yaml} language descriptors with Jackson.
 *
 * <p>Unlike the tool configuration, a broken descriptor is never replaced by defaults:
 * every failure becomes a {@link StubConfigException} naming the file.
 */
public final class LanguageDescriptorLoader {

    private static final Logger log = LoggerFactory.getLogger(LanguageDescriptorLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private LanguageDescriptorLoader() {
    }

    /**
     * Loads a descriptor from disk.
     *
     * @param descriptorPath path to {@code stub_config.yaml}
     * @return parsed descriptor
     * @throws StubConfigException if the file is unreadable or malformed
     */
    public static LanguageDescriptor load(Path descriptorPath) {
        if (!Files.isRegularFile(descriptorPath) || !Files.isReadable(descriptorPath)) {
            throw new StubConfigException("Language descriptor is not readable: " + descriptorPath);
        }
        try {
            log.debug("Loading language descriptor from: {}", descriptorPath);
            return YAML_MAPPER.readValue(descriptorPath.toFile(), LanguageDescriptor.class);
        } catch (IOException e) {
            throw new StubConfigException("Malformed language descriptor " + descriptorPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads a descriptor from a classpath resource.
     *
     * @param resource absolute resource name
     * @return parsed descriptor
     * @throws StubConfigException if the resource is missing or malformed
     */
    public static LanguageDescriptor loadResource(String resource) {
        return readResource(resource, LanguageDescriptor.class);
    }

    static <T> T readResource(String resource, Class<T> type) {
        try (InputStream in = LanguageDescriptorLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new StubConfigException("Missing bundled resource: " + resource);
            }
            log.debug("Loading bundled resource: {}", resource);
            return YAML_MAPPER.readValue(in, type);
        } catch (IOException e) {
            throw new StubConfigException("Malformed bundled resource " + resource + ": " + e.getMessage(), e);
        }
    }
}
