package com.pathwaygraph.core.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pathwaygraph.core.convert.PathwayNodeConverter;
import com.pathwaygraph.core.convert.PathwayReconstruction;
import com.pathwaygraph.core.generator.impl.MermaidGenerator;
import com.pathwaygraph.core.graph.PathwayGraph;
import com.pathwaygraph.core.model.ClinicalPathway;
import com.pathwaygraph.core.model.DispositionCriteria;
import com.pathwaygraph.core.model.EvidenceBasedAddition;
import com.pathwaygraph.core.model.NodeList;
import com.pathwaygraph.core.model.Order;

/**
 * Renders a clinical pathway as a Markdown document with an embedded Mermaid flowchart.
 *
 * <p>Sections: title, setting and complaint, flowchart, numbered pathway steps, special
 * populations and references. Steps are numbered consecutively over the sections present.
 */
public class PathwayMarkdownWriter {

    private static final Logger log = LoggerFactory.getLogger(PathwayMarkdownWriter.class);

    private final MermaidGenerator mermaid = new MermaidGenerator();

    /**
     * Writes a document whose flowchart is derived from the pathway itself.
     *
     * @param pathway structured pathway
     * @return Markdown text
     */
    public String write(ClinicalPathway pathway) {
        Objects.requireNonNull(pathway, "pathway must not be null");
        return write(pathway, PathwayNodeConverter.pathwayToNodes(pathway));
    }

    /**
     * Writes a document for an authored node list.
     *
     * <p>The detail sections come from the reconstructed pathway; the flowchart shows the
     * node list as authored, so nothing the reconstruction drops is lost from the diagram.
     *
     * @param nodes authored node list
     * @param conditionName condition name
     * @param setting clinical setting
     * @return Markdown text
     */
    public String write(NodeList nodes, String conditionName, String setting) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        PathwayReconstruction reconstruction = PathwayNodeConverter.nodesToPathway(nodes, conditionName, setting);
        reconstruction.warnings().forEach(warning -> log.debug("Reconstruction: {}", warning));
        return write(reconstruction.pathway(), nodes);
    }

    private String write(ClinicalPathway pathway, NodeList diagramNodes) {
        PathwayGraph graph = PathwayGraph.of(diagramNodes);
        List<String> md = new ArrayList<>();

        md.add("# " + pathway.conditionName());
        md.add("");
        md.add("**Clinical Setting:** " + pathway.clinicalSetting());
        md.add("**Chief Complaint:** " + pathway.chiefComplaint());
        md.add("");

        md.add("## Pathway Flowchart");
        md.add("");
        md.add("```mermaid");
        md.add(mermaid.render(graph.nodes(), graph.edges(), true));
        md.add("```");
        md.add("");

        md.add("## Pathway Details");
        md.add("");
        int step = 1;
        md.add("### Step " + step++ + ": Patient Entry");
        md.add("- Chief Complaint: " + pathway.chiefComplaint());
        md.add("");

        if (!pathway.initialCriticalityCriteria().isEmpty()) {
            md.add("### Step " + step++ + ": Initial Criticality Check");
            bullets(md, pathway.initialCriticalityCriteria());
            md.add("");
            md.add("**If Critical:** → ERU / Critical Care");
            bullets(md, pathway.criticalCareActions());
            md.add("");
        }

        if (!pathway.pitOrders().isEmpty()) {
            md.add("### Step " + step++ + ": PIT Orders");
            for (Order order : pathway.pitOrders()) {
                md.add("- **" + order.category() + ":** " + String.join(", ", order.items()));
                if (isPresent(order.conditional())) {
                    md.add("  - *Conditional: " + order.conditional() + "*");
                }
                if (isPresent(order.notes())) {
                    md.add("  - *Note: " + order.notes() + "*");
                }
            }
            md.add("");
        }

        if (pathway.hasSecondaryCriticality()) {
            md.add("### Step " + step++ + ": Secondary Criticality Check");
            bullets(md, pathway.secondaryCriticalityCriteria());
            md.add("");
        }

        if (!pathway.evidenceBasedAdditions().isEmpty()) {
            md.add("### Step " + step++ + ": Evidence-Based Additions");
            for (EvidenceBasedAddition addition : pathway.evidenceBasedAdditions()) {
                md.add("- **" + addition.category() + ":** " + addition.name());
                if (isPresent(addition.description())) {
                    md.add("  - " + addition.description());
                }
                if (isPresent(addition.criteria())) {
                    md.add("  - Criteria: " + addition.criteria());
                }
                if (isPresent(addition.pmid())) {
                    md.add("  - Evidence: PMID " + addition.pmid());
                }
            }
            md.add("");
        }

        if (!pathway.dispositionCriteria().isEmpty()) {
            md.add("### Step " + step + ": Disposition");
            md.add("");
            for (DispositionCriteria disposition : pathway.dispositionCriteria()) {
                md.add("#### " + disposition.dispositionType().value());
                bullets(md, disposition.criteria());
                if (isPresent(disposition.followUp())) {
                    md.add("- Follow-up: " + disposition.followUp());
                }
                if (isPresent(disposition.additionalNotes())) {
                    md.add("- *" + disposition.additionalNotes() + "*");
                }
                md.add("");
            }
        }

        if (!pathway.specialPopulations().isEmpty()) {
            md.add("## Special Population Considerations");
            bullets(md, pathway.specialPopulations());
            md.add("");
        }

        if (!pathway.references().isEmpty()) {
            md.add("## References");
            bullets(md, pathway.references());
        }

        log.info("Generated Markdown document for: {}", pathway.conditionName());
        return String.join("\n", md);
    }

    private static void bullets(List<String> md, List<String> items) {
        for (String item : items) {
            md.add("- " + item);
        }
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
