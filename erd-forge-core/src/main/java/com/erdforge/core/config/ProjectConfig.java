package com.erdforge.core.config;

import com.erdforge.core.layout.LayoutSettings;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration for ERD Forge.
 *
 * <p>Loaded from {@code erdforge.yaml}. Every section is optional; missing sections fall
 * back to the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Retail"
 *
 * layout:
 *   horizontalSpacing: 240
 *   attributeSpacing: 60
 *
 * reverse:
 *   strict: false
 *
 * generators:
 *   enabled:
 *     - dsl
 *     - mermaid
 *   settings:
 *     mermaid:
 *       direction: LR
 *     json:
 *       indent: false
 *
 * output:
 *   directory: "./docs/erd"
 * }</pre>
 *
 * @param project project metadata
 * @param layout layout spacing and sizes
 * @param reverse graph-to-diagram settings
 * @param generators generator selection
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("layout") LayoutSettings layout,
    @JsonProperty("reverse") ReverseSettings reverse,
    @JsonProperty("generators") GeneratorSettings generators,
    @JsonProperty("output") OutputConfig output
) {
    private static final String DEFAULT_PROJECT_NAME = "erd";
    private static final String DEFAULT_OUTPUT_DIRECTORY = "./docs/erd";
    private static final List<String> DEFAULT_GENERATORS = List.of("dsl", "json", "mermaid");

    /**
     * Compact constructor filling in missing sections.
     */
    public ProjectConfig {
        if (project == null) {
            project = new ProjectInfo(DEFAULT_PROJECT_NAME);
        }
        if (layout == null) {
            layout = LayoutSettings.defaults();
        }
        if (reverse == null) {
            reverse = new ReverseSettings(false);
        }
        if (generators == null) {
            generators = new GeneratorSettings(DEFAULT_GENERATORS, null);
        }
        if (output == null) {
            output = new OutputConfig(DEFAULT_OUTPUT_DIRECTORY);
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name, used as the title of generated documents
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name
    ) {}

    /**
     * Settings for reading a diagram back from an edited graph.
     *
     * @param strict fail instead of applying structural defaults
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReverseSettings(
        @JsonProperty("strict") boolean strict
    ) {}

    /**
     * Generator selection and per-generator settings.
     *
     * @param enabled generator ids to run when none are requested explicitly
     * @param settings settings keyed by generator id, handed to that generator only
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSettings(
        @JsonProperty("enabled") List<String> enabled,
        @JsonProperty("settings") Map<String, Map<String, Object>> settings
    ) {
        public GeneratorSettings {
            enabled = enabled == null || enabled.isEmpty() ? DEFAULT_GENERATORS : List.copyOf(enabled);
            Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
            if (settings != null) {
                // A key with no value in YAML binds to null
                settings.forEach((id, values) -> {
                    if (values != null) {
                        Map<String, Object> present = new LinkedHashMap<>();
                        values.forEach((key, value) -> {
                            if (value != null) {
                                present.put(key, value);
                            }
                        });
                        copy.put(id, Collections.unmodifiableMap(present));
                    }
                });
            }
            settings = Collections.unmodifiableMap(copy);
        }

        /**
         * Returns the settings of one generator.
         *
         * @param generatorId generator id
         * @return settings, empty if none are configured
         */
        public Map<String, Object> settingsFor(String generatorId) {
            Map<String, Object> generatorSettings = settings.get(generatorId);
            return generatorSettings == null ? Map.of() : generatorSettings;
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory
    ) {
        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_OUTPUT_DIRECTORY;
            }
        }
    }
}
