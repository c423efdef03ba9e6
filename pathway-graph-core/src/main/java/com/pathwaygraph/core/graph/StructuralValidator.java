package com.pathwaygraph.core.graph;

import com.pathwaygraph.core.model.Branch;
import com.pathwaygraph.core.model.NodeList;
import com.pathwaygraph.core.model.NodeType;
import com.pathwaygraph.core.model.PathwayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reports structural problems that the edge synthesizer tolerates silently.
 *
 * <p>Synthesis never fails; it drops unresolvable targets and lets the innermost decision
 * win overlapping regions. This validator makes those decisions visible so authors can fix
 * the pathway instead of discovering missing edges in the rendered diagram.
 */
public final class StructuralValidator {

    private static final Logger log = LoggerFactory.getLogger(StructuralValidator.class);

    private StructuralValidator() {
        // Utility class
    }

    /**
     * Validates the node list.
     *
     * @param nodes ordered pathway nodes
     * @return issues in node order; empty if the list is structurally sound
     */
    public static List<StructuralIssue> validate(NodeList nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        List<StructuralIssue> issues = new ArrayList<>();

        if (nodes.isEmpty()) {
            issues.add(StructuralIssue.warning(StructuralIssue.Kind.EMPTY_PATHWAY, -1, "Pathway has no nodes"));
            return issues;
        }
        if (nodes.firstPositionOf(NodeType.START) < 0) {
            issues.add(StructuralIssue.warning(StructuralIssue.Kind.MISSING_START, -1,
                "Pathway has no Start node"));
        }

        for (int i = 0; i < nodes.size(); i++) {
            checkTargets(nodes, i, issues);
        }

        List<BranchRegion> regions = EdgeSynthesizer.computeRegions(nodes);
        checkDanglingBranches(nodes, regions, issues);
        checkOverlaps(nodes, regions, issues);

        log.debug("Validated {} nodes: {} issues", nodes.size(), issues.size());
        return issues;
    }

    /**
     * Returns whether any issue is an error.
     *
     * @param issues validation result
     * @return true if at least one issue has ERROR severity
     */
    public static boolean hasErrors(List<StructuralIssue> issues) {
        return issues.stream().anyMatch(issue -> issue.severity() == IssueSeverity.ERROR);
    }

    private static void checkTargets(NodeList nodes, int i, List<StructuralIssue> issues) {
        PathwayNode node = nodes.get(i);

        if (node.isBranching()) {
            for (Branch branch : node.branches()) {
                if (nodes.positionOf(branch.target()) < 0) {
                    issues.add(StructuralIssue.error(StructuralIssue.Kind.INVALID_TARGET, i,
                        "Branch '" + branch.label() + "' of node " + node.id()
                            + " targets unknown node " + describe(branch.target())));
                }
            }
            if (node.target() != null) {
                issues.add(StructuralIssue.warning(StructuralIssue.Kind.IGNORED_TARGET, i,
                    "Decision " + node.id() + " has branches; its target '" + node.target() + "' is ignored"));
            }
            return;
        }

        if (node.target() == null) {
            return;
        }
        if (node.type() == NodeType.END) {
            issues.add(StructuralIssue.warning(StructuralIssue.Kind.IGNORED_TARGET, i,
                "End node " + node.id() + " has a target; End nodes have no outgoing edges"));
        } else if (nodes.positionOf(node.target()) < 0) {
            issues.add(StructuralIssue.error(StructuralIssue.Kind.INVALID_TARGET, i,
                "Node " + node.id() + " targets unknown node " + describe(node.target())));
        }
    }

    private static String describe(String target) {
        return target == null ? "(unresolved)" : "'" + target + "'";
    }

    private static void checkDanglingBranches(NodeList nodes, List<BranchRegion> regions,
                                              List<StructuralIssue> issues) {
        for (BranchRegion region : regions) {
            if (region.reconvergence() < nodes.size()) {
                continue;
            }
            PathwayNode last = nodes.get(region.end());
            if (last.type() != NodeType.END && last.target() == null && !last.isBranching()) {
                issues.add(StructuralIssue.warning(StructuralIssue.Kind.DANGLING_BRANCH, region.end(),
                    "Branch of decision " + nodes.get(region.decision()).id()
                        + " ends at " + last.id() + " without reaching an End node"));
            }
        }
    }

    /**
     * Flags decisions whose overall branch spans cross. Nested spans are fine: the inner
     * decision claims its nodes.
     */
    private static void checkOverlaps(NodeList nodes, List<BranchRegion> regions, List<StructuralIssue> issues) {
        Map<Integer, int[]> spans = new LinkedHashMap<>();
        for (BranchRegion region : regions) {
            spans.merge(region.decision(), new int[] {region.start(), region.end()},
                (a, b) -> new int[] {Math.min(a[0], b[0]), Math.max(a[1], b[1])});
        }

        List<Map.Entry<Integer, int[]>> entries = new ArrayList<>(spans.entrySet());
        for (int a = 0; a < entries.size(); a++) {
            for (int b = a + 1; b < entries.size(); b++) {
                int[] first = entries.get(a).getValue();
                int[] second = entries.get(b).getValue();
                boolean overlap = first[0] <= second[1] && second[0] <= first[1];
                boolean nested = (first[0] <= second[0] && second[1] <= first[1])
                    || (second[0] <= first[0] && first[1] <= second[1]);
                if (overlap && !nested) {
                    int decision = entries.get(b).getKey();
                    issues.add(StructuralIssue.error(StructuralIssue.Kind.OVERLAPPING_BRANCH_REGIONS, decision,
                        "Branch span of decision " + nodes.get(decision).id() + " [" + second[0] + ".." + second[1]
                            + "] crosses the span of decision " + nodes.get(entries.get(a).getKey()).id()
                            + " [" + first[0] + ".." + first[1] + "]"));
                }
            }
        }
    }
}
