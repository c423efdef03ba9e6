package com.pathwaygraph.core.renderer;

/**
 * Destination for generated diagram and document text.
 *
 * <p>Implementations are registered in
 * {@code META-INF/services/com.pathwaygraph.core.renderer.OutputRenderer} and selected by
 * {@link #getId()}.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer, e.g. "filesystem" or "console".
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Writes every file of the output to this renderer's destination.
     *
     * @param output generated files
     * @param context destination settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
