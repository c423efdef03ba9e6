package com.pathwaygraph.core.document;

import com.pathwaygraph.core.PathwayFixtures;
import com.pathwaygraph.core.model.ClinicalPathway;
import com.pathwaygraph.core.model.NodeList;
import com.pathwaygraph.core.model.PathwayNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PathwayMarkdownWriter}.
 */
class PathwayMarkdownWriterTest {

    private final PathwayMarkdownWriter writer = new PathwayMarkdownWriter();

    @Test
    void write_fullPathway_containsAllSections() {
        String markdown = writer.write(PathwayFixtures.chestPain());

        assertThat(markdown)
            .startsWith("# Chest Pain (ACS)\n")
            .contains("**Clinical Setting:** ED")
            .contains("**Chief Complaint:** chest pain")
            .contains("## Pathway Flowchart\n\n```mermaid\ngraph TD")
            .contains("### Step 1: Patient Entry")
            .contains("### Step 2: Initial Criticality Check")
            .contains("### Step 3: PIT Orders")
            .contains("### Step 4: Secondary Criticality Check")
            .contains("### Step 5: Evidence-Based Additions")
            .contains("### Step 6: Disposition")
            .contains("## Special Population Considerations")
            .contains("## References");
    }

    @Test
    void write_fullPathway_listsOrderAndEvidenceDetails() {
        String markdown = writer.write(PathwayFixtures.chestPain());

        assertThat(markdown)
            .contains("- **Labs:** Troponin, CBC\n  - *Note: Repeat troponin at 3h*")
            .contains("  - Evidence: PMID 12345678")
            .contains("#### Discharge\n- HEART <= 3\n- Negative troponins\n- Follow-up: PCP in 72h");
    }

    @Test
    void write_minimalPathway_numbersStepsConsecutively() {
        ClinicalPathway pathway = ClinicalPathway.builder("Fever", "fever", "Clinic")
            .secondaryCriticality("Hypotension")
            .build();

        String markdown = writer.write(pathway);

        assertThat(markdown)
            .contains("### Step 1: Patient Entry")
            .contains("### Step 2: Secondary Criticality Check")
            .doesNotContain("Initial Criticality Check")
            .doesNotContain("## References");
    }

    @Test
    void write_nodeList_embedsAuthoredNodesInFlowchart() {
        NodeList nodes = NodeList.of(
            PathwayNode.start("s", "Patient presents to ED with syncope"),
            PathwayNode.process("ecg", "Obtain ECG"),
            PathwayNode.end("e", "Discharge home"));

        String markdown = writer.write(nodes, "Syncope", "ED");

        assertThat(markdown)
            .startsWith("# Syncope\n")
            .contains("**Chief Complaint:** syncope")
            .contains("Obtain ECG")
            .contains("#### Discharge");
    }
}
