package com.pathwaygraph.core.convert;

import java.util.List;
import java.util.Objects;

import com.pathwaygraph.core.model.ClinicalPathway;

/**
 * Result of rebuilding a structured pathway from a node list.
 *
 * <p>The reverse mapping is lossy: orders, evidence-based additions and critical care
 * actions are not recovered. Each loss or heuristic fallback is reported as a warning.
 *
 * @param pathway best-effort pathway
 * @param warnings human-readable notes on what was dropped or guessed
 * @param confidence overall confidence in the result
 */
public record PathwayReconstruction(
    ClinicalPathway pathway,
    List<String> warnings,
    ReconstructionConfidence confidence
) {
    public PathwayReconstruction {
        Objects.requireNonNull(pathway, "pathway must not be null");
        Objects.requireNonNull(confidence, "confidence must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
