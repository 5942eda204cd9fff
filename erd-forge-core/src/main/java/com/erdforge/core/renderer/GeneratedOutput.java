package com.erdforge.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Files produced by one generate run.
 *
 * @param files generated files, in generation order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
