package com.pathwaygraph.core.graph;

import com.pathwaygraph.core.model.Branch;
import com.pathwaygraph.core.model.Edge;
import com.pathwaygraph.core.model.NodeList;
import com.pathwaygraph.core.model.NodeType;
import com.pathwaygraph.core.model.PathwayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Derives the branch-aware edge set of a flat, ordered node list.
 *
 * <p>Pathways are authored as a linear list in which only Decision branches and explicit
 * targets are stated; every other edge is implicit. Naively linking each node to the next
 * one would connect the last step of one branch to the first step of its sibling. The
 * synthesizer prevents this by computing <em>branch regions</em>: for a Decision with two
 * or more forward targets {@code t1 < t2 < ... < tk}, the region of {@code ti} spans
 * {@code [ti, t(i+1) - 1]} and the region of {@code tk} spans {@code [tk, tk]}; all of them
 * reconverge at {@code tk + 1}.
 *
 * <h2>Emission rules (per node, ascending position)</h2>
 * <ol>
 *   <li>Decision with branches: one edge per branch with a resolvable target, labeled with
 *       the branch label, in branch order. Its own {@code target} is ignored.</li>
 *   <li>End: no outgoing edge.</li>
 *   <li>Explicit {@code target}: one unlabeled edge to it. An unresolvable target produces
 *       no edge.</li>
 *   <li>Last node of a region: edge to the reconvergence point, if it exists.</li>
 *   <li>Other region nodes and all remaining nodes: edge to the next position, if any.</li>
 * </ol>
 *
 * <p>Backward branch targets (e.g. escalation back to critical care) produce edges but never
 * take part in region computation. When regions of different decisions overlap, the
 * innermost decision (the one with the highest position) claims the node.
 *
 * <p>All methods are pure and thread-safe; unresolvable targets are dropped silently.
 */
public final class EdgeSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(EdgeSynthesizer.class);

    private EdgeSynthesizer() {
        // Utility class
    }

    /**
     * Synthesizes the complete edge list of a node list.
     *
     * @param nodes ordered pathway nodes
     * @return edges in emission order; empty for an empty list
     */
    public static List<Edge> synthesize(NodeList nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        int n = nodes.size();
        if (n == 0) {
            return List.of();
        }

        BranchRegion[] regionOf = assignRegions(nodes);
        List<Edge> edges = new ArrayList<>();

        for (int i = 0; i < n; i++) {
            PathwayNode node = nodes.get(i);

            if (node.isBranching()) {
                appendBranchEdges(edges, nodes, i);
            } else if (node.type() == NodeType.END) {
                continue;
            } else if (node.target() != null) {
                int target = nodes.positionOf(node.target());
                if (target >= 0) {
                    edges.add(Edge.of(i, target));
                } else {
                    log.debug("Dropping edge from {}: unknown target '{}'", node.id(), node.target());
                }
            } else if (regionOf[i] != null) {
                BranchRegion region = regionOf[i];
                if (i == region.end()) {
                    if (region.reconvergence() < n) {
                        edges.add(Edge.of(i, region.reconvergence()));
                    }
                } else {
                    edges.add(Edge.of(i, i + 1));
                }
            } else if (i + 1 < n) {
                edges.add(Edge.of(i, i + 1));
            }
        }

        log.debug("Synthesized {} edges for {} nodes", edges.size(), n);
        return List.copyOf(edges);
    }

    /**
     * Computes the branch regions of every Decision with at least two distinct forward targets.
     *
     * <p>Regions are returned ordered by decision position, then by start. Regions of different
     * decisions may overlap; {@link #synthesize(NodeList)} resolves overlaps in favor of the
     * innermost decision.
     *
     * @param nodes ordered pathway nodes
     * @return branch regions
     */
    public static List<BranchRegion> computeRegions(NodeList nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        List<BranchRegion> regions = new ArrayList<>();

        for (int d = 0; d < nodes.size(); d++) {
            PathwayNode node = nodes.get(d);
            if (!node.isBranching()) {
                continue;
            }

            TreeSet<Integer> forward = new TreeSet<>();
            for (Branch branch : node.branches()) {
                int target = nodes.positionOf(branch.target());
                if (target > d) {
                    forward.add(target);
                }
            }
            if (forward.size() < 2) {
                continue;
            }

            List<Integer> targets = new ArrayList<>(forward);
            int reconvergence = targets.get(targets.size() - 1) + 1;
            for (int k = 0; k < targets.size(); k++) {
                int end = k + 1 < targets.size() ? targets.get(k + 1) - 1 : reconvergence - 1;
                regions.add(new BranchRegion(d, targets.get(k), end, reconvergence));
            }
        }
        return regions;
    }

    /**
     * Maps each position to the region that claims it, innermost decision first.
     */
    private static BranchRegion[] assignRegions(NodeList nodes) {
        BranchRegion[] regionOf = new BranchRegion[nodes.size()];
        List<BranchRegion> regions = new ArrayList<>(computeRegions(nodes));
        regions.sort(Comparator.comparingInt(BranchRegion::decision).reversed());

        for (BranchRegion region : regions) {
            for (int p = region.start(); p <= region.end(); p++) {
                if (regionOf[p] == null) {
                    regionOf[p] = region;
                }
            }
        }
        return regionOf;
    }

    private static void appendBranchEdges(List<Edge> edges, NodeList nodes, int decision) {
        for (Branch branch : nodes.get(decision).branches()) {
            int target = nodes.positionOf(branch.target());
            if (target >= 0) {
                edges.add(new Edge(decision, target, branch.label()));
            } else {
                log.debug("Dropping branch '{}' of {}: unknown target '{}'",
                    branch.label(), nodes.get(decision).id(), branch.target());
            }
        }
    }
}
