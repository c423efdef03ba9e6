package com.pathwaygraph.core.generator.impl;

import com.pathwaygraph.core.PathwayFixtures;
import com.pathwaygraph.core.generator.DiagramType;
import com.pathwaygraph.core.generator.GeneratedDiagram;
import com.pathwaygraph.core.generator.GeneratorConfig;
import com.pathwaygraph.core.generator.Orientation;
import com.pathwaygraph.core.graph.PathwayGraph;
import com.pathwaygraph.core.model.Branch;
import com.pathwaygraph.core.model.NodeList;
import com.pathwaygraph.core.model.PathwayNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link DotGenerator}.
 */
class DotGeneratorTest {

    private DotGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new DotGenerator();
    }

    @Test
    void getId_returnsDot() {
        assertThat(generator.getId()).isEqualTo("dot");
        assertThat(generator.getFileExtension()).isEqualTo("dot");
        assertThat(generator.getDiagramType()).isEqualTo(DiagramType.RANKED_DIGRAPH);
    }

    @Test
    void render_withEmptyList_emitsEmptyGraph() {
        assertThat(generator.render(NodeList.empty(), List.of(), Orientation.VERTICAL))
            .isEqualTo("digraph G {\n  // No nodes\n}");
    }

    @Test
    void render_withDecision_emitsRankedDigraph() {
        PathwayGraph graph = PathwayGraph.of(PathwayFixtures.stableDecision());

        String source = generator.render(graph.nodes(), graph.edges(), Orientation.VERTICAL);

        assertThat(source).startsWith("digraph G {\n  rankdir=TB;\n  splines=ortho;\n");
        assertThat(source).contains(
            "  N0 [label=\"Patient presents\", shape=oval, style=filled, fillcolor=\"#D5E8D4\"];",
            "  N1 [label=\"Stable?\", shape=diamond, style=filled, fillcolor=\"#F8CECC\"];",
            "  N2 [label=\"Routine care\", shape=box, style=filled, fillcolor=\"#FFF2CC\"];",
            "  { rank=source; N0; }",
            "  { rank=sink; N4; }",
            "  { rank=same; N2; N3; }",
            "  N0 -> N1;",
            "  N1 -> N2 [label=\"Yes\"];",
            "  N1 -> N3 [label=\"No\"];",
            "  N3 -> N4;");
        assertThat(source).endsWith("\n}");
    }

    @Test
    void render_withHorizontalOrientation_usesLeftRightRankdir() {
        PathwayGraph graph = PathwayGraph.of(PathwayFixtures.stableDecision());

        assertThat(generator.render(graph.nodes(), graph.edges(), Orientation.HORIZONTAL)).contains("  rankdir=LR;");
    }

    @Test
    void render_withNotes_appendsOneBasedPositionReference() {
        NodeList nodes = NodeList.of(
            PathwayNode.start("s", "Start"),
            PathwayNode.process("p", "Give aspirin").withNotes("325 mg"));

        assertThat(generator.render(nodes, List.of(), Orientation.VERTICAL))
            .contains("  N1 [label=\"Give aspirin\\n(Note 2)\", shape=box");
    }

    @Test
    void render_withLongLabel_wrapsInsteadOfTruncating() {
        String label = "Obtain serial troponins at zero and three hours with repeat ECG";
        NodeList nodes = NodeList.of(PathwayNode.process("p", label));

        String source = generator.render(nodes, List.of(), Orientation.VERTICAL);

        assertThat(source).contains("label=\"Obtain serial troponins at zero and\\nthree hours with repeat ECG\"");
        assertThat(source).doesNotContain("...");
    }

    @Test
    void render_withSingleResolvableBranchTarget_emitsNoSameRankGroup() {
        NodeList nodes = NodeList.of(
            PathwayNode.decision("d", "Check", Branch.to("Yes", "p"), Branch.to("No", "missing")),
            PathwayNode.process("p", "Proceed"));
        PathwayGraph graph = PathwayGraph.of(nodes);

        assertThat(generator.render(graph.nodes(), graph.edges(), Orientation.VERTICAL)).doesNotContain("rank=same");
    }

    @Test
    void generate_usesConfiguredNameAndOrientation() {
        GeneratorConfig config = new GeneratorConfig(true, Orientation.HORIZONTAL, Map.of("name", "acs"));

        GeneratedDiagram diagram = generator.generate(PathwayGraph.of(PathwayFixtures.stableDecision()), config);

        assertThat(diagram.fileName()).isEqualTo("acs.dot");
        assertThat(diagram.content()).contains("rankdir=LR;");
    }

    @Test
    void render_isIdempotent() {
        PathwayGraph graph = PathwayGraph.of(PathwayFixtures.stableDecision());

        assertThat(generator.render(graph.nodes(), graph.edges(), Orientation.VERTICAL))
            .isEqualTo(generator.render(graph.nodes(), graph.edges(), Orientation.VERTICAL));
    }

    @Test
    void render_withWhitespaceOnlyBranchLabel_emitsUnlabeledEdge() {
        PathwayGraph graph = PathwayGraph.of(NodeList.of(
            PathwayNode.start("s", "Start"),
            PathwayNode.decision("d", "Stable?", Branch.to("\t ", "p"), Branch.to("No", "e")),
            PathwayNode.process("p", "Observe"),
            PathwayNode.end("e", "Done")));

        String source = generator.render(graph.nodes(), graph.edges(), Orientation.VERTICAL);

        assertThat(source).contains("  N1 -> N2;");
        assertThat(source).contains("  N1 -> N3 [label=\"No\"];");
        assertThat(source).doesNotContain("[label=\"\"]");
    }
}
