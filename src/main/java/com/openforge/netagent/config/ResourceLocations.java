package com.openforge.netagent.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens pattern and mapping files named either {@code classpath:...} or by filesystem path.
 */
public final class ResourceLocations {

    public static final String CLASSPATH_PREFIX = "classpath:";

    private ResourceLocations() {}

    public static InputStream open(String location) {
        if (location == null || location.isBlank()) {
            throw new ConfigurationException("Resource location must not be blank");
        }
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String name = location.substring(CLASSPATH_PREFIX.length());
            if (name.startsWith("/")) name = name.substring(1);
            InputStream in = ResourceLocations.class.getClassLoader().getResourceAsStream(name);
            if (in == null) {
                throw new ConfigurationException("Classpath resource not found: " + location);
            }
            return in;
        }
        Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("File not found: " + path.toAbsolutePath());
        }
        try {
            return Files.newInputStream(path);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + path.toAbsolutePath(), e);
        }
    }
}
