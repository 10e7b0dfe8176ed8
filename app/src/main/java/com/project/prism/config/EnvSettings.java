package com.project.prism.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed view over environment-style settings.
 * <p>
 * Components read their options through this class instead of calling
 * {@link System#getenv(String)} directly, so tests can hand in a plain map.
 * Malformed numbers fall back to the supplied default.
 */
public final class EnvSettings {

    private final Map<String, String> values;

    private EnvSettings(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    public static EnvSettings fromEnv() {
        return new EnvSettings(System.getenv());
    }

    public static EnvSettings of(Map<String, String> values) {
        return new EnvSettings(Objects.requireNonNull(values, "values must not be null"));
    }

    public Optional<String> get(String name) {
        String value = values.get(name);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    public String get(String name, String defaultValue) {
        return get(name).orElse(defaultValue);
    }

    public String require(String name) {
        return get(name).orElseThrow(() -> new ConfigurationException(name + " must be set"));
    }

    public int getInt(String name, int defaultValue) {
        Optional<String> value = get(name);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.get());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLong(String name, long defaultValue) {
        Optional<String> value = get(name);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.get());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * {@code true} only for a case-insensitive "true"; anything else yields the default when unset.
     */
    public boolean getBoolean(String name, boolean defaultValue) {
        return get(name).map("true"::equalsIgnoreCase).orElse(defaultValue);
    }
}
