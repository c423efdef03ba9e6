package com.pathwaygraph.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One step in a clinical decision pathway.
 *
 * <p>Nodes are identified by a stable {@code id}; their position inside a {@link NodeList}
 * only determines rendering order. Explicit targets and branch targets reference node
 * identifiers, so reordering a list does not silently rewire it.
 *
 * @param id stable node identifier
 * @param type node type
 * @param label display label
 * @param notes optional actionable clinical details
 * @param evidence optional supporting evidence (e.g. a PMID)
 * @param branches outgoing branches; only meaningful for Decision nodes
 * @param target optional identifier of an explicit next node
 * @param role optional swimlane assignment (e.g. "Critical Care")
 */
public record PathwayNode(
    String id,
    NodeType type,
    String label,
    String notes,
    String evidence,
    List<Branch> branches,
    String target,
    String role
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public PathwayNode {
        Objects.requireNonNull(id, "id must not be null");
        if (type == null) {
            type = NodeType.PROCESS;
        }
        if (label == null) {
            label = "";
        }
        branches = branches == null ? List.of() : List.copyOf(branches);
    }

    /**
     * Creates a Start node.
     *
     * @param id node identifier
     * @param label node label
     * @return new node
     */
    public static PathwayNode start(String id, String label) {
        return new PathwayNode(id, NodeType.START, label, null, null, null, null, null);
    }

    /**
     * Creates a Process node.
     *
     * @param id node identifier
     * @param label node label
     * @return new node
     */
    public static PathwayNode process(String id, String label) {
        return new PathwayNode(id, NodeType.PROCESS, label, null, null, null, null, null);
    }

    /**
     * Creates a Decision node with the given branches.
     *
     * @param id node identifier
     * @param label node label
     * @param branches outgoing branches in display order
     * @return new node
     */
    public static PathwayNode decision(String id, String label, Branch... branches) {
        return new PathwayNode(id, NodeType.DECISION, label, null, null, Arrays.asList(branches), null, null);
    }

    /**
     * Creates a Reevaluation node.
     *
     * @param id node identifier
     * @param label node label
     * @return new node
     */
    public static PathwayNode reevaluation(String id, String label) {
        return new PathwayNode(id, NodeType.REEVALUATION, label, null, null, null, null, null);
    }

    /**
     * Creates an End node.
     *
     * @param id node identifier
     * @param label node label
     * @return new node
     */
    public static PathwayNode end(String id, String label) {
        return new PathwayNode(id, NodeType.END, label, null, null, null, null, null);
    }

    public PathwayNode withNotes(String newNotes) {
        return new PathwayNode(id, type, label, newNotes, evidence, branches, target, role);
    }

    public PathwayNode withTarget(String newTarget) {
        return new PathwayNode(id, type, label, notes, evidence, branches, newTarget, role);
    }

    /**
     * Returns whether the node carries non-blank notes.
     *
     * @return true if notes are present
     */
    public boolean hasNotes() {
        return notes != null && !notes.isBlank();
    }

    /**
     * Returns whether this is a Decision whose branches drive its outgoing edges.
     *
     * @return true for a Decision with at least one branch
     */
    public boolean isBranching() {
        return type == NodeType.DECISION && !branches.isEmpty();
    }
}
