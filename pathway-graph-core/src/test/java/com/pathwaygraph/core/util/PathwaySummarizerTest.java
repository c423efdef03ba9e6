package com.pathwaygraph.core.util;

import com.pathwaygraph.core.PathwayFixtures;
import com.pathwaygraph.core.model.NodeList;
import com.pathwaygraph.core.model.PathwayNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PathwaySummarizer}.
 */
class PathwaySummarizerTest {

    @Test
    void summarize_withEmptyList_returnsNoPathway() {
        assertThat(PathwaySummarizer.summarize(NodeList.empty())).isEqualTo("No existing pathway.");
    }

    @Test
    void summarize_withPathway_countsTypesInFirstSeenOrder() {
        String summary = PathwaySummarizer.summarize(PathwayFixtures.stableDecision());

        assertThat(summary).isEqualTo("Pathway with 5 nodes (1 Start, 1 Decision, 2 Process, 1 End). "
            + "Starts with: 'Patient presents'. End points: Discharge.");
    }

    @Test
    void summarize_withoutEndNodes_omitsEndPoints() {
        NodeList nodes = NodeList.of(PathwayNode.start("s", "Begin"), PathwayNode.process("p", "Work"));

        assertThat(PathwaySummarizer.summarize(nodes))
            .isEqualTo("Pathway with 2 nodes (1 Start, 1 Process). Starts with: 'Begin'.");
    }

    @Test
    void summarize_withManyLongEndLabels_keepsThreeShortenedLabels() {
        String longLabel = "Discharge home with outpatient cardiology follow-up";
        NodeList nodes = NodeList.of(
            PathwayNode.start("s", "Begin"),
            PathwayNode.end("e1", longLabel),
            PathwayNode.end("e2", "Observation"),
            PathwayNode.end("e3", "Admit"),
            PathwayNode.end("e4", "Transfer"));

        String summary = PathwaySummarizer.summarize(nodes);

        assertThat(summary).endsWith("End points: " + longLabel.substring(0, 30) + ", Observation, Admit.");
        assertThat(summary).doesNotContain("Transfer");
    }
}
