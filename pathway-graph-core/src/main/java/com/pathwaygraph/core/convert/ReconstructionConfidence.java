package com.pathwaygraph.core.convert;

/**
 * How much of a structured pathway could be recovered from a node list.
 */
public enum ReconstructionConfidence {
    /** Start and End nodes found, nothing had to be guessed. */
    HIGH,
    /** Pathway recovered, but some content was dropped or classified by fallback. */
    MEDIUM,
    /** Start or End nodes are missing; most fields are defaults. */
    LOW
}
