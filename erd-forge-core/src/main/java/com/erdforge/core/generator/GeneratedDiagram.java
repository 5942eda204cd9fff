package com.erdforge.core.generator;

import java.util.Objects;

/**
 * A document produced by a {@link DiagramGenerator}.
 *
 * @param name document name, used as the file stem
 * @param content document text
 * @param fileExtension file extension without leading dot
 */
public record GeneratedDiagram(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedDiagram {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * Returns the file name for this document.
     *
     * @return {@code name.extension}
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
