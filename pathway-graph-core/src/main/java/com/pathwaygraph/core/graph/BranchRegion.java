package com.pathwaygraph.core.graph;

/**
 * Contiguous span of nodes reached along one branch of a Decision before control reconverges.
 *
 * <p>Regions are recomputed on every synthesis call and never persisted.
 *
 * @param decision position of the owning Decision node
 * @param start first position of the region (the branch target)
 * @param end last position of the region, inclusive
 * @param reconvergence position where the branches rejoin; may equal the node count when
 *                      the branches run off the end of the list
 */
public record BranchRegion(
    int decision,
    int start,
    int end,
    int reconvergence
) {
    public BranchRegion {
        if (start > end) {
            throw new IllegalArgumentException("start must not exceed end: " + start + " > " + end);
        }
    }

    /**
     * Returns whether the position lies inside this region.
     *
     * @param position node position
     * @return true if {@code start <= position <= end}
     */
    public boolean contains(int position) {
        return position >= start && position <= end;
    }
}
