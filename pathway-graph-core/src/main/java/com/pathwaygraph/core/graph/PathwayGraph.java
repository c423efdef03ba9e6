package com.pathwaygraph.core.graph;

import com.pathwaygraph.core.model.Edge;
import com.pathwaygraph.core.model.NodeList;

import java.util.List;
import java.util.Objects;

/**
 * A node list together with the edges synthesized from it.
 *
 * <p>This is the input of every diagram generator.
 *
 * @param nodes ordered pathway nodes
 * @param edges synthesized edges in emission order
 */
public record PathwayGraph(
    NodeList nodes,
    List<Edge> edges
) {
    public PathwayGraph {
        Objects.requireNonNull(nodes, "nodes must not be null");
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /**
     * Synthesizes the edges of the node list.
     *
     * @param nodes ordered pathway nodes
     * @return graph with synthesized edges
     */
    public static PathwayGraph of(NodeList nodes) {
        return new PathwayGraph(nodes, EdgeSynthesizer.synthesize(nodes));
    }
}
