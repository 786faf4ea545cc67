package com.openforge.netagent.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Variables for configuration outside Spring: a {@code .env} file supplies
 * defaults and the process environment overrides them.
 *
 * The {@code .env} file uses {@code KEY=value} lines; surrounding quotes on
 * values are stripped.
 */
public final class EnvironmentSource {

    public static final Path DEFAULT_DOTENV = Path.of(".env");

    private final Map<String, String> variables;

    public EnvironmentSource(Map<String, String> dotenv, Map<String, String> environment) {
        Map<String, String> merged = new HashMap<>(dotenv);
        merged.putAll(environment);
        this.variables = Map.copyOf(merged);
    }

    /** Process environment layered over {@code ./.env}, if present. */
    public static EnvironmentSource system() {
        return new EnvironmentSource(readDotenv(DEFAULT_DOTENV), System.getenv());
    }

    public static EnvironmentSource of(Map<String, String> variables) {
        return new EnvironmentSource(Map.of(), variables);
    }

    public Optional<String> get(String name) {
        String value = variables.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.strip());
    }

    public String require(String name) {
        return get(name).orElseThrow(() ->
                new ConfigurationException("Required environment variable %s is not set".formatted(name)));
    }

    public static Map<String, String> readDotenv(Path file) {
        if (!Files.isRegularFile(file)) return Map.of();

        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + file.toAbsolutePath(), e);
        }

        Map<String, String> values = new HashMap<>();
        for (String key : properties.stringPropertyNames()) {
            String name = key.strip();
            values.put(name, unquote(properties.getProperty(key).strip()));
        }
        return values;
    }

    private static String unquote(String value) {
        if (value.length() >= 2
                && (value.startsWith("\"") && value.endsWith("\"") || value.startsWith("'") && value.endsWith("'"))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
