package com.erdforge.core.config;

import com.erdforge.core.layout.LayoutSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_withValidYaml_parsesAllSections() throws IOException {
        Path configFile = tempDir.resolve("erdforge.yaml");
        Files.writeString(configFile, """
            project:
              name: "Retail"

            layout:
              horizontalSpacing: 240
              attributeSpacing: 60

            reverse:
              strict: true

            generators:
              enabled:
                - mermaid
              settings:
                mermaid:
                  direction: LR

            output:
              directory: "./out"
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("Retail");
        assertThat(config.layout().horizontalSpacing()).isEqualTo(240);
        assertThat(config.layout().attributeSpacing()).isEqualTo(60);
        assertThat(config.layout().entityWidth()).isEqualTo(140);
        assertThat(config.reverse().strict()).isTrue();
        assertThat(config.generators().enabled()).containsExactly("mermaid");
        assertThat(config.generators().enabled()).doesNotContain("dsl");
        assertThat(config.generators().settingsFor("mermaid")).containsEntry("direction", "LR");
        assertThat(config.generators().settingsFor("json")).isEmpty();
        assertThat(config.output().directory()).isEqualTo("./out");
    }

    @Test
    void load_withMissingFile_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(ProjectConfig.defaults());
        assertThat(config.project().name()).isEqualTo("erd");
        assertThat(config.layout()).isEqualTo(LayoutSettings.defaults());
        assertThat(config.reverse().strict()).isFalse();
        assertThat(config.generators().enabled()).containsExactly("dsl", "json", "mermaid");
        assertThat(config.output().directory()).isEqualTo("./docs/erd");
    }

    @Test
    void load_withPartialYaml_fillsMissingSections() throws IOException {
        Path configFile = tempDir.resolve("erdforge.yaml");
        Files.writeString(configFile, """
            project:
              name: "Library"
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("Library");
        assertThat(config.layout()).isEqualTo(LayoutSettings.defaults());
        assertThat(config.generators().enabled()).contains("json");
    }

    @Test
    void load_withZeroCoordinates_keepsThem() throws IOException {
        Path configFile = tempDir.resolve("erdforge.yaml");
        Files.writeString(configFile, """
            layout:
              entityRowY: 0
              firstEntityX: 0
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.layout().entityRowY()).isZero();
        assertThat(config.layout().firstEntityX()).isZero();
        assertThat(config.layout().horizontalSpacing()).isEqualTo(200);
    }

    @Test
    void load_withNonPositiveSize_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("erdforge.yaml");
        Files.writeString(configFile, """
            layout:
              entityWidth: -10
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_withEmptyGeneratorSettings_treatsThemAsAbsent() throws IOException {
        Path configFile = tempDir.resolve("erdforge.yaml");
        Files.writeString(configFile, """
            generators:
              settings:
                json:
                mermaid:
                  direction: TB
                  theme:
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.generators().enabled()).containsExactly("dsl", "json", "mermaid");
        assertThat(config.generators().settingsFor("json")).isEmpty();
        assertThat(config.generators().settingsFor("mermaid")).containsOnlyKeys("direction");
    }

    @Test
    void load_withUnknownKeys_ignoresThem() throws IOException {
        Path configFile = tempDir.resolve("erdforge.yaml");
        Files.writeString(configFile, """
            theme: dark
            layout:
              zoom: 3
              entityWidth: 180
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.layout().entityWidth()).isEqualTo(180);
    }

    @Test
    void load_withInvalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("erdforge.yaml");
        Files.writeString(configFile, "layout: [unclosed");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_withEmptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("erdforge.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_withDirectory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ProjectConfig.defaults());
    }
}
