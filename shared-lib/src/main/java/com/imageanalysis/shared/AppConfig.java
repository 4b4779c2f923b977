package com.imageanalysis.shared;

import io.github.cdimascio.dotenv.Dotenv;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Configuration handler that reads from Environment Variables first and a
 * .env file second.
 * Required keys fail fast, optional keys fall back to the supplied default.
 */
public class AppConfig {

    private final Dotenv dotenv;
    private final Map<String, String> overrides;
    private final boolean useEnvironment;

    public AppConfig() {
        // Load .env file if present, otherwise ignore
        this(Dotenv.configure().ignoreIfMissing().load(), Map.of(), true);
    }

    /**
     * Config backed only by the given values (tests and embedded use).
     */
    public AppConfig(Map<String, String> values) {
        this(null, values, false);
    }

    private AppConfig(Dotenv dotenv, Map<String, String> overrides, boolean useEnvironment) {
        this.dotenv = dotenv;
        this.overrides = Map.copyOf(overrides);
        this.useEnvironment = useEnvironment;
    }

    /**
     * Get a string value.
     * Throws RuntimeException if not found.
     */
    public String getString(String key) {
        String value = get(key);
        if (value == null) {
            throw new RuntimeException("Missing required environment variable: " + key);
        }
        return value;
    }

    public String getOptional(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Get an int value, or default if missing.
     * Throws RuntimeException if present but not a valid integer.
     */
    public int getIntOptional(String key, int defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new RuntimeException("Invalid integer for environment variable: " + key + ", value: " + value);
        }
    }

    public Duration getSecondsOptional(String key, long defaultSeconds) {
        return Duration.ofSeconds(getIntOptional(key, (int) defaultSeconds));
    }

    public Duration getMillisOptional(String key, long defaultMillis) {
        return Duration.ofMillis(getIntOptional(key, (int) defaultMillis));
    }

    /**
     * Comma separated list, blanks dropped.
     */
    public List<String> getListOptional(String key, String defaultValue) {
        return Arrays.stream(getOptional(key, defaultValue).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * Explicit values first, then System Env, then .env file
     */
    private String get(String key) {
        String value = overrides.get(key);
        if (value != null) {
            return value;
        }
        if (!useEnvironment) {
            return null;
        }
        value = System.getenv(key);
        if (value != null && !value.isEmpty()) {
            return value;
        }
        return dotenv.get(key);
    }
}
