package com.erdforge.core.renderer.impl;

import com.erdforge.core.renderer.GeneratedFile;
import com.erdforge.core.renderer.GeneratedOutput;
import com.erdforge.core.renderer.OutputRenderer;
import com.erdforge.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes generated files below the output directory as UTF-8, overwriting existing files
 * and creating missing directories.
 *
 * <p>A relative path that would resolve outside the output directory is rejected.
 *
 * <pre>{@code
 * new FileSystemRenderer().render(
 *     new GeneratedOutput(List.of(new GeneratedFile("dsl.erd", text, "text/plain"))),
 *     new RenderContext("./docs/erd", Map.of()));
 * // Creates: ./docs/erd/dsl.erd
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory()).toAbsolutePath().normalize();
        log.info("Rendering {} files to filesystem at: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }

        log.info("Successfully rendered {} files to filesystem", output.files().size());
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir)) {
            throw new IllegalStateException("File path escapes output directory: " + file.relativePath());
        }

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            log.debug("Wrote file: {} ({} chars)", targetPath, file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
