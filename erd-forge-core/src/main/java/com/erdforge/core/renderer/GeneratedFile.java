package com.erdforge.core.renderer;

import com.erdforge.core.generator.GeneratedDiagram;

import java.util.Map;
import java.util.Objects;

/**
 * A generated file to be rendered.
 *
 * @param relativePath path relative to the output directory (e.g. "mermaid-er.md")
 * @param content file content
 * @param contentType MIME type, may be null
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    private static final Map<String, String> CONTENT_TYPES = Map.of(
        "md", "text/markdown",
        "json", "application/json",
        "erd", "text/plain"
    );

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Wraps a generated document, deriving the content type from its extension.
     *
     * @param diagram generated document
     * @return file named {@code name.extension}
     */
    public static GeneratedFile of(GeneratedDiagram diagram) {
        return new GeneratedFile(diagram.fileName(), diagram.content(),
            CONTENT_TYPES.get(diagram.fileExtension()));
    }
}
