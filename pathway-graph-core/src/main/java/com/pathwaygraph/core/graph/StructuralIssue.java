package com.pathwaygraph.core.graph;

import java.util.Objects;

/**
 * A structural problem detected in a node list.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * StructuralIssue issue = StructuralIssue.error(
 *     StructuralIssue.Kind.INVALID_TARGET, 3,
 *     "Branch 'No' of node N3 targets unknown node 'N42'"
 * );
 * }</pre>
 *
 * @param kind kind of issue
 * @param position position of the offending node, or -1 for list-level issues
 * @param message human-readable description
 * @param severity severity level
 */
public record StructuralIssue(
    Kind kind,
    int position,
    String message,
    IssueSeverity severity
) {
    /**
     * Kinds of structural issues.
     */
    public enum Kind {
        /** The list has no nodes */
        EMPTY_PATHWAY,
        /** No Start node; there is no root for the rank=source constraint */
        MISSING_START,
        /** A branch or explicit target does not resolve to a node */
        INVALID_TARGET,
        /** A target that the synthesizer ignores (End target, Decision target beside branches) */
        IGNORED_TARGET,
        /** Branches reconverge past the end of the list and the last branch does not end */
        DANGLING_BRANCH,
        /** Branch spans of two decisions cross without one nesting inside the other */
        OVERLAPPING_BRANCH_REGIONS
    }

    public StructuralIssue {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
    }

    public static StructuralIssue warning(Kind kind, int position, String message) {
        return new StructuralIssue(kind, position, message, IssueSeverity.WARNING);
    }

    public static StructuralIssue error(Kind kind, int position, String message) {
        return new StructuralIssue(kind, position, message, IssueSeverity.ERROR);
    }
}
