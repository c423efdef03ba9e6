package com.pathwaygraph.core.generator;

/**
 * Diagram languages a pathway graph can be rendered to.
 */
public enum DiagramType {
    /** Node/edge flowchart with shapes, style classes and a notes legend (Mermaid) */
    FLOWCHART,

    /** Ranked digraph with source/sink/same-rank constraints (Graphviz DOT) */
    RANKED_DIGRAPH
}
