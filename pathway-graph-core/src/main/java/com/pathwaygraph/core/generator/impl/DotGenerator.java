package com.pathwaygraph.core.generator.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pathwaygraph.core.generator.DiagramGenerator;
import com.pathwaygraph.core.generator.DiagramType;
import com.pathwaygraph.core.generator.GeneratedDiagram;
import com.pathwaygraph.core.generator.GeneratorConfig;
import com.pathwaygraph.core.generator.Orientation;
import com.pathwaygraph.core.graph.PathwayGraph;
import com.pathwaygraph.core.model.Branch;
import com.pathwaygraph.core.model.Edge;
import com.pathwaygraph.core.model.NodeList;
import com.pathwaygraph.core.model.NodeType;
import com.pathwaygraph.core.model.PathwayNode;
import com.pathwaygraph.core.util.LabelDialect;
import com.pathwaygraph.core.util.LabelSanitizer;

/**
 * Generates Graphviz DOT source from a synthesized pathway graph.
 *
 * <p>The layout is a ranked decision tree:
 * <ul>
 *   <li>the first Start node is pinned to {@code rank=source}</li>
 *   <li>all End nodes are pinned to {@code rank=sink}</li>
 *   <li>the targets of each Decision with two or more branches share a {@code rank=same}
 *       group so that alternatives sit level with each other</li>
 * </ul>
 *
 * <p>Decisions are pink diamonds, Start and End green ovals, everything else yellow boxes.
 * Labels are word-wrapped rather than truncated. A node with notes shows its own 1-based
 * position as {@code (Note k)} on an extra line; unlike the flowchart there is no legend.
 */
public class DotGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(DotGenerator.class);

    private static final String GENERATOR_ID = "dot";
    private static final String GENERATOR_DISPLAY_NAME = "Graphviz DOT Generator";
    private static final String FILE_EXTENSION = "dot";

    /** Line width of wrapped node and edge labels. */
    public static final int LABEL_WIDTH = 40;

    private static final String INDENT = "  ";
    private static final String EMPTY_GRAPH = "digraph G {\n  // No nodes\n}";

    private static final String DECISION_FILL = "#F8CECC";
    private static final String TERMINAL_FILL = "#D5E8D4";
    private static final String PROCESS_FILL = "#FFF2CC";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public DiagramType getDiagramType() {
        return DiagramType.RANKED_DIGRAPH;
    }

    @Override
    public GeneratedDiagram generate(PathwayGraph graph, GeneratorConfig config) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(config, "config must not be null");

        log.debug("Generating DOT digraph for {} nodes", graph.nodes().size());
        int labelWidth = config.getSettingOrDefault("labelLength", LABEL_WIDTH);
        String content = render(graph.nodes(), graph.edges(), config.orientation(), labelWidth);

        GeneratedDiagram diagram = new GeneratedDiagram(config.diagramName(), content, getFileExtension());
        log.info("Generated DOT digraph: {}", diagram.fileName());
        return diagram;
    }

    /**
     * Renders a ranked digraph with the default label width.
     *
     * @param nodes ordered pathway nodes
     * @param edges edges synthesized from {@code nodes}
     * @param orientation layout direction
     * @return DOT source
     */
    public String render(NodeList nodes, List<Edge> edges, Orientation orientation) {
        return render(nodes, edges, orientation, LABEL_WIDTH);
    }

    /**
     * Renders a ranked digraph.
     *
     * @param nodes ordered pathway nodes
     * @param edges edges synthesized from {@code nodes}; edges outside the list are skipped
     * @param orientation layout direction
     * @param labelWidth line width of wrapped labels
     * @return DOT source
     */
    public String render(NodeList nodes, List<Edge> edges, Orientation orientation, int labelWidth) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(edges, "edges must not be null");
        Objects.requireNonNull(orientation, "orientation must not be null");

        if (nodes.isEmpty()) {
            return EMPTY_GRAPH;
        }

        List<String> lines = new ArrayList<>();
        appendGraphHeader(lines, orientation);
        appendNodeDeclarations(lines, nodes, labelWidth);
        lines.add("");
        appendRankConstraints(lines, nodes);
        lines.add("");
        appendEdges(lines, edges, nodes.size(), labelWidth);
        lines.add("}");

        return String.join("\n", lines);
    }

    private void appendGraphHeader(List<String> lines, Orientation orientation) {
        lines.add("digraph G {");
        lines.add(INDENT + "rankdir=" + orientation.dotRankdir() + ";");
        lines.add(INDENT + "splines=ortho;");
        lines.add(INDENT + "nodesep=0.8;");
        lines.add(INDENT + "ranksep=1.0;");
        lines.add(INDENT + "node [fontname=Helvetica, fontsize=11];");
        lines.add(INDENT + "edge [fontname=Helvetica, fontsize=10];");
    }

    private void appendNodeDeclarations(List<String> lines, NodeList nodes, int labelWidth) {
        for (int i = 0; i < nodes.size(); i++) {
            PathwayNode node = nodes.get(i);
            String rawLabel = node.label().isBlank() ? "Step " + i : node.label();
            String label = LabelSanitizer.sanitize(rawLabel, labelWidth, LabelDialect.DIGRAPH);
            if (node.hasNotes()) {
                label += LabelSanitizer.DOT_LINE_BREAK + "(Note " + (i + 1) + ")";
            }
            lines.add(INDENT + nodeId(i) + " [label=\"" + label + "\", shape=" + shape(node.type())
                + ", style=filled, fillcolor=\"" + fill(node.type()) + "\"];");
        }
    }

    private String shape(NodeType type) {
        return switch (type) {
            case DECISION -> "diamond";
            case START, END -> "oval";
            case PROCESS, REEVALUATION -> "box";
        };
    }

    private String fill(NodeType type) {
        return switch (type) {
            case DECISION -> DECISION_FILL;
            case START, END -> TERMINAL_FILL;
            case PROCESS, REEVALUATION -> PROCESS_FILL;
        };
    }

    /**
     * Appends source, sink and same-rank groups.
     */
    private void appendRankConstraints(List<String> lines, NodeList nodes) {
        int root = nodes.firstPositionOf(NodeType.START);
        if (root >= 0) {
            lines.add(INDENT + "{ rank=source; " + nodeId(root) + "; }");
        }

        List<String> sinks = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).type() == NodeType.END) {
                sinks.add(nodeId(i));
            }
        }
        if (!sinks.isEmpty()) {
            lines.add(INDENT + "{ rank=sink; " + String.join("; ", sinks) + "; }");
        }

        for (PathwayNode node : nodes) {
            if (node.type() != NodeType.DECISION || node.branches().size() < 2) {
                continue;
            }
            List<String> targets = new ArrayList<>();
            for (Branch branch : node.branches()) {
                int target = nodes.positionOf(branch.target());
                if (target >= 0) {
                    targets.add(nodeId(target));
                }
            }
            if (targets.size() >= 2) {
                lines.add(INDENT + "{ rank=same; " + String.join("; ", targets) + "; }");
            }
        }
    }

    private void appendEdges(List<String> lines, List<Edge> edges, int nodeCount, int labelWidth) {
        for (Edge edge : edges) {
            if (edge.source() < 0 || edge.source() >= nodeCount
                || edge.destination() < 0 || edge.destination() >= nodeCount) {
                log.debug("Skipping edge outside node list: {}", edge);
                continue;
            }
            String src = nodeId(edge.source());
            String dst = nodeId(edge.destination());
            if (edge.hasLabel()) {
                String label = LabelSanitizer.sanitize(edge.label(), labelWidth, LabelDialect.DIGRAPH);
                lines.add(INDENT + src + " -> " + dst + " [label=\"" + label + "\"];");
            } else {
                lines.add(INDENT + src + " -> " + dst + ";");
            }
        }
    }

    private static String nodeId(int position) {
        return "N" + position;
    }
}
