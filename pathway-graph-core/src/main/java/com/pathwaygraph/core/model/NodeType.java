package com.pathwaygraph.core.model;

import java.util.Locale;

/**
 * Types of steps in a clinical decision pathway.
 */
public enum NodeType {
    /** Entry point of the pathway; the first one in a node list is the root */
    START("Start"),

    /** Branching point whose outgoing edges come from its branch list */
    DECISION("Decision"),

    /** Ordinary action or workup step */
    PROCESS("Process"),

    /** Terminal step (disposition); never has outgoing edges */
    END("End"),

    /** Re-assessment step that usually loops back into the pathway */
    REEVALUATION("Reevaluation");

    private final String displayName;

    NodeType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the name used in node-list JSON and summaries.
     *
     * @return display name, e.g. "Decision"
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a node type from its JSON value.
     *
     * <p>Matching is case-insensitive and ignores non-letter characters, so
     * {@code "re-evaluation"} resolves to {@link #REEVALUATION}. Unknown or missing
     * values resolve to {@link #PROCESS}.
     *
     * @param value type name (may be null)
     * @return matching type, or PROCESS
     */
    public static NodeType fromValue(String value) {
        if (value == null) {
            return PROCESS;
        }
        String normalized = value.replaceAll("[^A-Za-z]", "").toUpperCase(Locale.ROOT);
        for (NodeType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return PROCESS;
    }
}
