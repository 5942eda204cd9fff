package com.erdforge.core.generator;

import com.erdforge.core.model.ErDiagram;

import java.util.Set;

/**
 * Produces a textual document from a parsed diagram.
 *
 * <p>Each generator supports one or more {@link OutputType}s. Generators are discovered via
 * {@link java.util.ServiceLoader}; register implementations in
 * {@code META-INF/services/com.erdforge.core.generator.DiagramGenerator}.
 *
 * <pre>{@code
 * for (DiagramGenerator generator : ServiceLoader.load(DiagramGenerator.class)) {
 *     for (OutputType type : generator.getSupportedOutputTypes()) {
 *         GeneratedDiagram doc = generator.generate(diagram, type, GeneratorConfig.defaults());
 *     }
 * }
 * }</pre>
 *
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns the unique, lowercase identifier used in configuration and on the command line
     * (e.g. "dsl", "mermaid").
     *
     * @return generator identifier
     */
    String getId();

    /**
     * Returns a human-readable name for CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the file extension of generated documents, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Returns the output types this generator can produce.
     *
     * @return supported output types
     */
    Set<OutputType> getSupportedOutputTypes();

    /**
     * Generates a document.
     *
     * <p>An empty diagram still yields a valid document.
     *
     * @param diagram the diagram to render
     * @param type the output type to generate
     * @param config configuration settings for generation
     * @return generated document
     * @throws IllegalArgumentException if the output type is not supported
     */
    GeneratedDiagram generate(ErDiagram diagram, OutputType type, GeneratorConfig config);
}
