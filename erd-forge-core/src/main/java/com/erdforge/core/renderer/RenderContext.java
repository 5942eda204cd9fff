package com.erdforge.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Context provided to renderers.
 *
 * @param outputDirectory target directory, used by file-based renderers
 * @param settings renderer-specific settings, keyed {@code <renderer>.<name>}
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public String getSetting(String key) {
        return settings.get(key);
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    /**
     * Reads a boolean setting.
     *
     * @param key setting key
     * @param defaultValue value when the setting is absent
     * @return true if the setting is "true" (ignoring case)
     */
    public boolean isEnabled(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }
}
