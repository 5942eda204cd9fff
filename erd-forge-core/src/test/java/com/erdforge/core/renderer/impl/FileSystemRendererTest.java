package com.erdforge.core.renderer.impl;

import com.erdforge.core.renderer.GeneratedFile;
import com.erdforge.core.renderer.GeneratedOutput;
import com.erdforge.core.renderer.RenderContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private final FileSystemRenderer renderer = new FileSystemRenderer();

    @Test
    void render_writesFilesAsUtf8() throws IOException {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("dsl.erd", "Relation A (1) — (M) B: has\n", "text/plain"),
            new GeneratedFile("mermaid-er.md", "# Title\n", "text/markdown")));

        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        assertThat(Files.readString(tempDir.resolve("dsl.erd"))).isEqualTo("Relation A (1) — (M) B: has\n");
        assertThat(tempDir.resolve("mermaid-er.md")).hasContent("# Title\n");
    }

    @Test
    void render_createsMissingDirectories() {
        Path outputDir = tempDir.resolve("docs/erd");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("nested/a.json", "{}", null)));

        renderer.render(output, new RenderContext(outputDir.toString(), Map.of()));

        assertThat(outputDir.resolve("nested/a.json")).exists().hasContent("{}");
    }

    @Test
    void render_overwritesExistingFiles() throws IOException {
        Files.writeString(tempDir.resolve("dsl.erd"), "old content that is longer");

        renderer.render(new GeneratedOutput(List.of(new GeneratedFile("dsl.erd", "new", null))),
            new RenderContext(tempDir.toString(), Map.of()));

        assertThat(tempDir.resolve("dsl.erd")).hasContent("new");
    }

    @Test
    void render_rejectsPathsOutsideOutputDirectory() {
        Path outputDir = tempDir.resolve("out");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("../escape.txt", "x", null)));

        assertThatThrownBy(() -> renderer.render(output, new RenderContext(outputDir.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("escapes output directory");
        assertThat(tempDir.resolve("escape.txt")).doesNotExist();
    }

    @Test
    void render_whenOutputDirectoryIsAFile_throws() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "");

        assertThatThrownBy(() -> renderer.render(
            new GeneratedOutput(List.of(new GeneratedFile("a.erd", "x", null))),
            new RenderContext(blocker.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class);
    }
}
