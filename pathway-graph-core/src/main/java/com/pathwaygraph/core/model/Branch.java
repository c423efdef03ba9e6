package com.pathwaygraph.core.model;

/**
 * A labeled outgoing choice of a Decision node.
 *
 * @param label branch label shown on the edge (e.g. "Yes")
 * @param target identifier of the target node, or null when the authored target could not be resolved
 */
public record Branch(
    String label,
    String target
) {
    /**
     * Compact constructor normalizing a missing label to the empty string.
     */
    public Branch {
        if (label == null) {
            label = "";
        }
    }

    /**
     * Creates a branch pointing at the node with the given identifier.
     *
     * @param label branch label
     * @param target target node identifier
     * @return new branch
     */
    public static Branch to(String label, String target) {
        return new Branch(label, target);
    }
}
