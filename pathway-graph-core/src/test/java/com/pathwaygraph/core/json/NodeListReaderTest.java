package com.pathwaygraph.core.json;

import com.pathwaygraph.core.graph.EdgeSynthesizer;
import com.pathwaygraph.core.model.Branch;
import com.pathwaygraph.core.model.Edge;
import com.pathwaygraph.core.model.NodeList;
import com.pathwaygraph.core.model.NodeType;
import com.pathwaygraph.core.model.PathwayNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link NodeListReader}.
 */
class NodeListReaderTest {

    private final NodeListReader reader = new NodeListReader();

    @Test
    void read_withPositionalTargets_resolvesToIds() {
        NodeList nodes = reader.read("""
            [
              {"type": "Start", "label": "Patient presents with syncope"},
              {"type": "Decision", "label": "Stable?",
               "branches": [{"label": "Yes", "target": 2}, {"label": "No", "target": 3}]},
              {"type": "Process", "label": "ECG", "target": 3},
              {"type": "End", "label": "Discharge"}
            ]
            """);

        assertThat(nodes.nodes()).extracting(PathwayNode::id).containsExactly("N0", "N1", "N2", "N3");
        assertThat(nodes.get(1).branches()).containsExactly(Branch.to("Yes", "N2"), Branch.to("No", "N3"));
        assertThat(nodes.get(2).target()).isEqualTo("N3");
    }

    @Test
    void read_withIdTargets_keepsIds() {
        NodeList nodes = reader.read("""
            [
              {"id": "start", "type": "Start", "label": "Patient presents with fever"},
              {"id": "check", "type": "Decision", "label": "Septic?",
               "branches": [{"label": "Yes", "target": "icu"}]},
              {"id": "icu", "type": "End", "label": "ICU"}
            ]
            """);

        assertThat(nodes.get(1).branches()).containsExactly(Branch.to("Yes", "icu"));
        assertThat(nodes.positionOf("icu")).isEqualTo(2);
    }

    @Test
    void read_withMissingFields_appliesDefaults() {
        NodeList nodes = reader.read("""
            [{"detail": "Serial troponins"}, {"type": "re-evaluation", "label": "Repeat ECG"}]
            """);

        assertThat(nodes.get(0).type()).isEqualTo(NodeType.PROCESS);
        assertThat(nodes.get(0).label()).isEqualTo("Step 0");
        assertThat(nodes.get(0).notes()).isEqualTo("Serial troponins");
        assertThat(nodes.get(1).type()).isEqualTo(NodeType.REEVALUATION);
    }

    @Test
    void read_withDuplicateIds_assignsUniqueIds() {
        NodeList nodes = reader.read("""
            [{"id": "N1", "label": "A"}, {"id": "N1", "label": "B"}, {"label": "C"}]
            """);

        assertThat(nodes.nodes()).extracting(PathwayNode::id).containsExactly("N1", "N1_1", "N2");
    }

    @Test
    void read_withOutOfRangeTargets_leavesThemUnresolved() {
        NodeList nodes = reader.read("""
            [
              {"type": "Decision", "label": "Q", "branches": [{"label": "Yes", "target": 9}]},
              {"type": "Process", "label": "P", "target": 7}
            ]
            """);

        assertThat(nodes.get(0).branches()).containsExactly(new Branch("Yes", null));
        assertThat(nodes.get(1).target()).isEqualTo("#7");
        assertThat(nodes.positionOf(nodes.get(1).target())).isEqualTo(-1);
    }

    @Test
    void read_withTargetsBeyondIntRange_doesNotWrapAround() {
        NodeList nodes = reader.read("""
            [
              {"type": "Start", "label": "Patient presents with chest pain"},
              {"type": "Decision", "label": "Stable?", "branches": [{"label": "Yes", "target": 4294967298}]},
              {"type": "Process", "label": "Monitor", "target": 4294967296},
              {"type": "End", "label": "Discharge"}
            ]
            """);

        assertThat(nodes.get(1).branches()).containsExactly(new Branch("Yes", null));
        assertThat(nodes.get(2).target()).isEqualTo("#4294967296");

        List<Edge> edges = EdgeSynthesizer.synthesize(nodes);
        assertThat(edges).containsExactly(Edge.of(0, 1));
    }

    @Test
    void read_withOutOfRangeTargetCollidingWithId_prefixesMarker() {
        NodeList nodes = reader.read("""
            [{"id": "#5", "label": "A", "target": 5}]
            """);

        assertThat(nodes.get(0).target()).isEqualTo("##5");
        assertThat(nodes.positionOf("##5")).isEqualTo(-1);
    }

    @Test
    void read_withWrongFieldTypes_treatsThemAsAbsent() {
        NodeList nodes = reader.read("""
            [{"type": "End", "label": 42, "evidence": ["x"], "branches": "none"}]
            """);

        assertThat(nodes.get(0).label()).isEqualTo("Step 0");
        assertThat(nodes.get(0).evidence()).isNull();
        assertThat(nodes.get(0).branches()).isEmpty();
    }

    @Test
    void read_withEmptyArray_returnsEmptyList() {
        assertThat(reader.read("[]").isEmpty()).isTrue();
    }

    @Test
    void read_withMalformedJson_throwsImportException() {
        assertThatThrownBy(() -> reader.read("[{\"type\": "))
            .isInstanceOf(PathwayImportException.class)
            .hasMessageStartingWith("Malformed node list JSON");
    }

    @Test
    void read_withObjectRoot_throwsImportException() {
        assertThatThrownBy(() -> reader.read("{\"type\": \"Start\"}"))
            .isInstanceOf(PathwayImportException.class)
            .hasMessage("Node list JSON must be an array");
    }

    @Test
    void read_withNonObjectEntry_throwsImportException() {
        assertThatThrownBy(() -> reader.read("[{\"label\": \"A\"}, 3]"))
            .isInstanceOf(PathwayImportException.class)
            .hasMessageContaining("entry 1");
    }

    @Test
    void read_fromFile_readsContent(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("nodes.json");
        Files.writeString(file, "[{\"type\": \"Start\", \"label\": \"Begin\"}]");

        assertThat(reader.read(file).get(0).label()).isEqualTo("Begin");
    }

    @Test
    void read_fromMissingFile_throwsImportException(@TempDir Path tempDir) {
        assertThatThrownBy(() -> reader.read(tempDir.resolve("missing.json")))
            .isInstanceOf(PathwayImportException.class)
            .hasMessageStartingWith("Cannot read node list file");
    }
}
