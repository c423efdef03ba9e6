package com.pathwaygraph.core.generator;

import com.pathwaygraph.core.graph.PathwayGraph;

/**
 * Interface for generators that turn a synthesized pathway graph into diagram source text.
 *
 * <p>Generators never synthesize edges themselves: they consume the edge list of the
 * {@link PathwayGraph}, so every diagram language shows the same branch-aware structure.
 * For an empty node list a generator emits a well-formed placeholder diagram.
 *
 * <p><b>Registration:</b> implementations are discovered through
 * {@code META-INF/services/com.pathwaygraph.core.generator.DiagramGenerator}.
 *
 * @see PathwayGraph
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used in configuration ({@code diagrams.formats}); lowercase, e.g. "mermaid", "dot".
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated diagrams, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Returns the diagram language this generator produces.
     *
     * @return diagram type
     */
    DiagramType getDiagramType();

    /**
     * Generates diagram source for the graph.
     *
     * @param graph nodes and synthesized edges
     * @param config generation settings
     * @return generated diagram
     */
    GeneratedDiagram generate(PathwayGraph graph, GeneratorConfig config);
}
