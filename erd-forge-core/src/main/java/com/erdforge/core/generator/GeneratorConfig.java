package com.erdforge.core.generator;

import com.erdforge.core.layout.LayoutSettings;

import java.util.Map;

/**
 * Configuration for document generation.
 *
 * @param title document title, used as a heading where the format has one
 * @param layout layout settings for generators that emit geometry
 * @param customSettings generator-specific custom settings
 */
public record GeneratorConfig(
    String title,
    LayoutSettings layout,
    Map<String, Object> customSettings
) {
    private static final String DEFAULT_TITLE = "Entity-Relationship Diagram";

    /**
     * Compact constructor filling in defaults.
     */
    public GeneratorConfig {
        if (title == null || title.isBlank()) {
            title = DEFAULT_TITLE;
        }
        if (layout == null) {
            layout = LayoutSettings.defaults();
        }
        customSettings = customSettings == null ? Map.of() : Map.copyOf(customSettings);
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(null, null, Map.of());
    }

    /**
     * Gets a custom setting value.
     *
     * @param key setting key
     * @param <T> expected type
     * @return setting value or null
     */
    @SuppressWarnings("unchecked")
    public <T> T getSetting(String key) {
        return (T) customSettings.get(key);
    }

    /**
     * Gets a custom setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @param <T> expected type
     * @return setting value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }
}
