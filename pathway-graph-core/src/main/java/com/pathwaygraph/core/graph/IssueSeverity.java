package com.pathwaygraph.core.graph;

/**
 * Severity of a structural issue found in a node list.
 */
public enum IssueSeverity {
    /**
     * Warning - the graph renders, but probably not as the author intended.
     */
    WARNING,

    /**
     * Error - edges are dropped or resolved arbitrarily.
     */
    ERROR
}
