package com.erdforge.core.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Access to the DSL documents bundled with the library.
 */
public final class SampleDocuments {

    private static final String SAMPLE_RESOURCE = "/samples/sample.erd";

    private SampleDocuments() {
        // Utility class
    }

    /**
     * Returns the retail sample: five entities (one weak) and three relationships
     * (one identifying).
     *
     * @return sample DSL text
     * @throws IllegalStateException if the resource is missing from the classpath
     */
    public static String sample() {
        try (InputStream in = SampleDocuments.class.getResourceAsStream(SAMPLE_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Sample document not found on classpath: " + SAMPLE_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read sample document " + SAMPLE_RESOURCE, e);
        }
    }
}
