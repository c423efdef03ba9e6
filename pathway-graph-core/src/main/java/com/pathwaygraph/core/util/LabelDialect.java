package com.pathwaygraph.core.util;

/**
 * Diagram languages whose quoted-label syntax {@link LabelSanitizer} targets.
 */
public enum LabelDialect {
    /** Mermaid flowchart: HTML entities, truncation with an ellipsis */
    FLOWCHART,

    /** Graphviz DOT: backslash escapes, word wrapping with the {@code \n} line break */
    DIGRAPH
}
