package com.erdforge.core.renderer;

/**
 * Writes generated documents to a destination.
 *
 * <p>Renderers are discovered via {@link java.util.ServiceLoader}; register implementations
 * in {@code META-INF/services/com.erdforge.core.renderer.OutputRenderer}.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns the unique, lowercase identifier of this renderer (e.g. "filesystem").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Renders every file of the output.
     *
     * @param output generated files
     * @param context output directory and renderer settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
