package com.pathwaygraph.core.model;

/**
 * A directed edge between two nodes of a {@link NodeList}, addressed by position.
 *
 * <p>Edges are always derived by the edge synthesizer and never authored directly.
 *
 * @param source position of the source node
 * @param destination position of the destination node
 * @param label edge label, empty when the edge is unlabeled
 */
public record Edge(
    int source,
    int destination,
    String label
) {
    /**
     * Compact constructor normalizing a missing label to the empty string.
     */
    public Edge {
        if (label == null) {
            label = "";
        }
    }

    /**
     * Creates an unlabeled edge.
     *
     * @param source source position
     * @param destination destination position
     * @return new edge
     */
    public static Edge of(int source, int destination) {
        return new Edge(source, destination, "");
    }

    /**
     * Returns whether this edge has a non-empty label.
     *
     * @return true if labeled
     */
    public boolean hasLabel() {
        return !label.isBlank();
    }
}
