package com.pathwaygraph.core.generator.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pathwaygraph.core.generator.DiagramGenerator;
import com.pathwaygraph.core.generator.DiagramType;
import com.pathwaygraph.core.generator.GeneratedDiagram;
import com.pathwaygraph.core.generator.GeneratorConfig;
import com.pathwaygraph.core.generator.Orientation;
import com.pathwaygraph.core.graph.PathwayGraph;
import com.pathwaygraph.core.model.Edge;
import com.pathwaygraph.core.model.NodeList;
import com.pathwaygraph.core.model.NodeType;
import com.pathwaygraph.core.model.PathwayNode;
import com.pathwaygraph.core.util.LabelDialect;
import com.pathwaygraph.core.util.LabelSanitizer;

/**
 * Generates Mermaid flowchart source from a synthesized pathway graph.
 *
 * <h2>Output Structure</h2>
 * <ol>
 *   <li>{@code graph TD} (or {@code graph LR}) header</li>
 *   <li>{@code classDef} block, when styling is enabled</li>
 *   <li>One declaration per node, {@code N0}, {@code N1}, ... in list order, shaped by type:
 *       stadium for Start/End, rhombus for Decision, parallelogram for Reevaluation and
 *       rectangle otherwise</li>
 *   <li>Edges, with quoted labels for Decision branches</li>
 *   <li>A "Notes Legend" subgraph listing node notes, numbered from 1 in node order; each
 *       annotated node carries a {@code [Note k]} reference in its label</li>
 *   <li>{@code class} assignments grouping node ids by style class, when styling is enabled</li>
 * </ol>
 *
 * <p>Labels go through {@link LabelSanitizer} with the FLOWCHART dialect: 60 characters for
 * nodes, 35 for edges and 80 for notes. An empty node list yields a single placeholder node.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * PathwayGraph graph = PathwayGraph.of(nodes);
 * String source = new MermaidGenerator().render(graph.nodes(), graph.edges(), true);
 * }</pre>
 *
 * @see <a href="https://mermaid.js.org/syntax/flowchart.html">Mermaid Flowchart Syntax</a>
 */
public class MermaidGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Flowchart Generator";
    private static final String FILE_EXTENSION = "mmd";

    // Label budgets
    public static final int NODE_LABEL_LENGTH = 60;
    public static final int EDGE_LABEL_LENGTH = 35;
    public static final int NOTE_LABEL_LENGTH = 80;

    private static final String INDENT = "    ";
    private static final String GRAPH_PREFIX = "graph ";
    private static final String NO_NODES_NODE = INDENT + "NoNodes[No pathway nodes defined]";
    private static final String NOTES_SUBGRAPH = INDENT + "subgraph notesLegend [Notes Legend]";

    /**
     * Style classes applied to node declarations.
     */
    private enum StyleClass {
        START_END("startEnd", "fill:#d4edda,stroke:#28a745,stroke-width:2px,color:#155724,font-weight:bold"),
        DECISION("decision", "fill:#f8d7da,stroke:#dc3545,stroke-width:2px,color:#721c24,font-weight:bold"),
        PROCESS("process", "fill:#fff3cd,stroke:#ffc107,stroke-width:1px,color:#856404"),
        REEVAL("reeval", "fill:#ffe0b2,stroke:#e65100,stroke-width:2px,color:#bf360c"),
        NOTE_BOX("noteBox", "fill:#bbdefb,stroke:#1565c0,stroke-width:1px,color:#0d47a1,font-size:11px");

        private final String className;
        private final String definition;

        StyleClass(String className, String definition) {
            this.className = className;
            this.definition = definition;
        }

        String className() {
            return className;
        }

        static StyleClass forType(NodeType type) {
            return switch (type) {
                case START, END -> START_END;
                case DECISION -> DECISION;
                case REEVALUATION -> REEVAL;
                case PROCESS -> PROCESS;
            };
        }
    }

    /**
     * A numbered entry of the notes legend.
     */
    private record Note(int number, int position, String text) {
        String nodeId() {
            return "NOTE" + number;
        }
    }

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
        return DiagramType.FLOWCHART;
    }

    @Override
    public GeneratedDiagram generate(PathwayGraph graph, GeneratorConfig config) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(config, "config must not be null");

        log.debug("Generating Mermaid flowchart for {} nodes", graph.nodes().size());
        int labelLength = config.getSettingOrDefault("labelLength", NODE_LABEL_LENGTH);
        String content = render(graph.nodes(), graph.edges(), config.includeStyling(),
            config.orientation(), labelLength);

        GeneratedDiagram diagram = new GeneratedDiagram(config.diagramName(), content, getFileExtension());
        log.info("Generated Mermaid flowchart: {}", diagram.fileName());
        return diagram;
    }

    /**
     * Renders a top-down flowchart with default label lengths.
     *
     * @param nodes ordered pathway nodes
     * @param edges edges synthesized from {@code nodes}
     * @param includeStyling whether to emit style classes
     * @return Mermaid source
     */
    public String render(NodeList nodes, List<Edge> edges, boolean includeStyling) {
        return render(nodes, edges, includeStyling, Orientation.VERTICAL, NODE_LABEL_LENGTH);
    }

    /**
     * Renders a flowchart.
     *
     * @param nodes ordered pathway nodes
     * @param edges edges synthesized from {@code nodes}; edges outside the list are skipped
     * @param includeStyling whether to emit style classes
     * @param orientation layout direction
     * @param labelLength maximum node label length
     * @return Mermaid source
     */
    public String render(NodeList nodes, List<Edge> edges, boolean includeStyling,
                         Orientation orientation, int labelLength) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(edges, "edges must not be null");

        List<String> lines = new ArrayList<>();
        lines.add(GRAPH_PREFIX + orientation.mermaidDirection());

        if (nodes.isEmpty()) {
            lines.add(NO_NODES_NODE);
            return String.join("\n", lines);
        }

        List<Note> notes = collectNotes(nodes);

        if (includeStyling) {
            appendClassDefinitions(lines);
        }
        appendNodeDeclarations(lines, nodes, notes, labelLength);
        lines.add("");
        appendEdges(lines, edges, nodes.size());
        if (!notes.isEmpty()) {
            appendNotesLegend(lines, notes);
        }
        if (includeStyling) {
            appendClassAssignments(lines, groupStyleClasses(nodes, notes));
        }

        return String.join("\n", lines);
    }

    /**
     * Numbers the nodes carrying notes, starting at 1 in node order.
     */
    private List<Note> collectNotes(NodeList nodes) {
        List<Note> notes = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            PathwayNode node = nodes.get(i);
            if (node.hasNotes()) {
                notes.add(new Note(notes.size() + 1, i, node.notes().strip()));
            }
        }
        return notes;
    }

    private void appendClassDefinitions(List<String> lines) {
        lines.add("");
        lines.add(INDENT + "%% Styling");
        for (StyleClass styleClass : StyleClass.values()) {
            lines.add(INDENT + "classDef " + styleClass.className + " " + styleClass.definition);
        }
        lines.add("");
    }

    /**
     * Appends one shaped declaration per node.
     */
    private void appendNodeDeclarations(List<String> lines, NodeList nodes, List<Note> notes, int labelLength) {
        Map<Integer, Integer> noteNumbers = notes.stream()
            .collect(Collectors.toMap(Note::position, Note::number));

        for (int i = 0; i < nodes.size(); i++) {
            PathwayNode node = nodes.get(i);
            String label = LabelSanitizer.sanitize(labelOrPlaceholder(node, i), labelLength, LabelDialect.FLOWCHART);
            Integer noteNumber = noteNumbers.get(i);
            if (noteNumber != null) {
                label = label + " &#91;Note " + noteNumber + "&#93;";
            }
            lines.add(INDENT + nodeId(i) + shape(node.type(), label));
        }
    }

    private String shape(NodeType type, String label) {
        return switch (type) {
            case START, END -> "([\"" + label + "\"])";
            case DECISION -> "{\"" + label + "\"}";
            case REEVALUATION -> "[/\"" + label + "\"/]";
            case PROCESS -> "[\"" + label + "\"]";
        };
    }

    private void appendEdges(List<String> lines, List<Edge> edges, int nodeCount) {
        for (Edge edge : edges) {
            if (!inRange(edge, nodeCount)) {
                log.debug("Skipping edge outside node list: {}", edge);
                continue;
            }
            String src = nodeId(edge.source());
            String dst = nodeId(edge.destination());
            if (edge.hasLabel()) {
                String label = LabelSanitizer.sanitize(edge.label(), EDGE_LABEL_LENGTH, LabelDialect.FLOWCHART);
                lines.add(INDENT + src + " -->|\"" + label + "\"| " + dst);
            } else {
                lines.add(INDENT + src + " --> " + dst);
            }
        }
    }

    private void appendNotesLegend(List<String> lines, List<Note> notes) {
        lines.add("");
        lines.add(NOTES_SUBGRAPH);
        lines.add(INDENT + "direction TB");
        for (Note note : notes) {
            String text = LabelSanitizer.sanitize(note.text(), NOTE_LABEL_LENGTH, LabelDialect.FLOWCHART);
            lines.add(INDENT + note.nodeId() + "[\"" + note.number() + ". " + text + "\"]");
        }
        lines.add(INDENT + "end");
    }

    /**
     * Groups node and note ids by style class.
     *
     * @param nodes ordered pathway nodes
     * @param notes legend entries
     * @return immutable map from style class to ids, in declaration order
     */
    private Map<StyleClass, List<String>> groupStyleClasses(NodeList nodes, List<Note> notes) {
        Stream<Map.Entry<StyleClass, String>> nodeEntries = IntStream.range(0, nodes.size())
            .mapToObj(i -> Map.entry(StyleClass.forType(nodes.get(i).type()), nodeId(i)));
        Stream<Map.Entry<StyleClass, String>> noteEntries = notes.stream()
            .map(note -> Map.entry(StyleClass.NOTE_BOX, note.nodeId()));

        Map<StyleClass, List<String>> grouped = Stream.concat(nodeEntries, noteEntries)
            .collect(Collectors.groupingBy(
                Map.Entry::getKey,
                () -> new EnumMap<>(StyleClass.class),
                Collectors.mapping(Map.Entry::getValue, Collectors.toUnmodifiableList())));
        return Collections.unmodifiableMap(grouped);
    }

    private void appendClassAssignments(List<String> lines, Map<StyleClass, List<String>> grouped) {
        lines.add("");
        grouped.forEach((styleClass, ids) ->
            lines.add(INDENT + "class " + String.join(",", ids) + " " + styleClass.className()));
    }

    private static String labelOrPlaceholder(PathwayNode node, int position) {
        return node.label().isBlank() ? "Step " + position : node.label();
    }

    private static boolean inRange(Edge edge, int nodeCount) {
        return edge.source() >= 0 && edge.source() < nodeCount
            && edge.destination() >= 0 && edge.destination() < nodeCount;
    }

    private static String nodeId(int position) {
        return "N" + position;
    }
}
