package com.pathwaygraph.core.convert;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pathwaygraph.core.model.Branch;
import com.pathwaygraph.core.model.ClinicalPathway;
import com.pathwaygraph.core.model.DispositionCriteria;
import com.pathwaygraph.core.model.DispositionType;
import com.pathwaygraph.core.model.EvidenceBasedAddition;
import com.pathwaygraph.core.model.NodeList;
import com.pathwaygraph.core.model.NodeType;
import com.pathwaygraph.core.model.Order;
import com.pathwaygraph.core.model.PathwayNode;

/**
 * Converts between structured {@link ClinicalPathway} records and flat {@link NodeList}s.
 *
 * <h2>Forward mapping</h2>
 * <p>{@link #pathwayToNodes(ClinicalPathway)} lays the pathway out in a fixed order:
 * <ol>
 *   <li>Start: patient presentation</li>
 *   <li>Initial criticality Decision and the critical care Process node, when criteria exist</li>
 *   <li>One PIT orders Process node, when orders exist</li>
 *   <li>Secondary criticality Decision, escalating back to critical care</li>
 *   <li>Up to three evidence-based addition Process nodes</li>
 *   <li>Disposition Decision with one End per disposition, or a single default End</li>
 * </ol>
 * Node identifiers are {@code N0}, {@code N1}, ... in that order.
 *
 * <h2>Reverse mapping</h2>
 * <p>{@link #nodesToPathway(NodeList, String, String)} recovers the chief complaint,
 * criticality criteria and dispositions. It never fails; what it cannot recover is listed in
 * the returned {@link PathwayReconstruction}.
 */
public final class PathwayNodeConverter {

    private static final Logger log = LoggerFactory.getLogger(PathwayNodeConverter.class);

    /** Evidence value of nodes without a supporting citation. */
    public static final String NO_EVIDENCE = "N/A";

    public static final String DEFAULT_CONDITION_NAME = "Imported Pathway";
    public static final String DEFAULT_SETTING = "ED";
    public static final String DEFAULT_CHIEF_COMPLAINT = "Clinical presentation";
    public static final String DEFAULT_END_LABEL = "Disposition per clinical judgment";
    public static final String CRITICAL_CARE_ROLE = "Critical Care";

    static final String RED_FLAGS_PREFIX = "Red flags:";
    static final String REEVALUATE_PREFIX = "Re-evaluate after initial workup:";

    private static final int MAX_LABELED_INITIAL_CRITERIA = 3;
    private static final int MAX_LABELED_SECONDARY_CRITERIA = 2;
    private static final int MAX_LABELED_CARE_ACTIONS = 3;
    private static final int MAX_CONSIDERED_ORDERS = 6;
    private static final int MAX_LABELED_ORDERS = 4;
    private static final int MAX_EVIDENCE_ADDITIONS = 3;
    private static final int MAX_RECOVERED_CRITERIA = 5;

    private static final Pattern WITH_WORD = Pattern.compile("\\bwith\\b", Pattern.CASE_INSENSITIVE);

    private PathwayNodeConverter() {
    }

    /**
     * Flattens a structured pathway into an ordered node list.
     *
     * @param pathway structured pathway
     * @return node list with identifiers {@code N0..N(n-1)}
     */
    public static NodeList pathwayToNodes(ClinicalPathway pathway) {
        Objects.requireNonNull(pathway, "pathway must not be null");

        List<PathwayNode> nodes = new ArrayList<>();
        nodes.add(new PathwayNode(nextId(nodes), NodeType.START,
            "Patient presents to " + pathway.clinicalSetting() + " with " + pathway.chiefComplaint(),
            "", NO_EVIDENCE, null, null, null));

        String criticalCareId = null;
        List<String> initial = pathway.initialCriticalityCriteria();
        if (!initial.isEmpty()) {
            String decisionId = nextId(nodes);
            criticalCareId = idAt(nodes.size() + 1);
            String stableId = idAt(nodes.size() + 2);

            String criteria = String.join(" OR ", head(initial, MAX_LABELED_INITIAL_CRITERIA));
            if (initial.size() > MAX_LABELED_INITIAL_CRITERIA) {
                criteria += " OR other critical findings";
            }
            nodes.add(new PathwayNode(decisionId, NodeType.DECISION, "Initial Criticality: " + criteria + "?",
                RED_FLAGS_PREFIX + " " + String.join(", ", initial), NO_EVIDENCE,
                List.of(Branch.to("YES - Critical", criticalCareId), Branch.to("NO - Stable", stableId)),
                null, null));

            List<String> actions = pathway.criticalCareActions();
            nodes.add(new PathwayNode(criticalCareId, NodeType.PROCESS,
                "ERU/Critical Care: " + String.join("; ", head(actions, MAX_LABELED_CARE_ACTIONS)),
                "Activate resuscitation team. " + String.join("; ", actions), NO_EVIDENCE,
                null, null, CRITICAL_CARE_ROLE));
        }

        if (!pathway.pitOrders().isEmpty()) {
            nodes.add(ordersNode(nextId(nodes), pathway.pitOrders()));
        }

        if (pathway.hasSecondaryCriticality()) {
            nodes.add(secondaryCriticalityNode(nextId(nodes), idAt(nodes.size() + 1),
                criticalCareId, pathway.secondaryCriticalityCriteria()));
        }

        for (EvidenceBasedAddition addition : head(pathway.evidenceBasedAdditions(), MAX_EVIDENCE_ADDITIONS)) {
            String evidence = addition.pmid() != null && !addition.pmid().isBlank() ? addition.pmid() : NO_EVIDENCE;
            nodes.add(new PathwayNode(nextId(nodes), NodeType.PROCESS, addition.toLabel(),
                addition.description(), evidence, null, null, null));
        }

        List<DispositionCriteria> dispositions = pathway.dispositionCriteria();
        if (dispositions.isEmpty()) {
            nodes.add(new PathwayNode(nextId(nodes), NodeType.END, DEFAULT_END_LABEL,
                "", NO_EVIDENCE, null, null, null));
        } else {
            int firstEnd = nodes.size() + 1;
            List<Branch> branches = new ArrayList<>();
            for (int i = 0; i < dispositions.size(); i++) {
                branches.add(Branch.to(dispositions.get(i).dispositionType().value(), idAt(firstEnd + i)));
            }
            nodes.add(new PathwayNode(nextId(nodes), NodeType.DECISION, "Disposition Assessment",
                "Determine appropriate disposition based on clinical status and criteria", NO_EVIDENCE,
                branches, null, null));
            for (DispositionCriteria disposition : dispositions) {
                nodes.add(dispositionEnd(nextId(nodes), disposition));
            }
        }

        log.debug("Converted pathway '{}' to {} nodes", pathway.conditionName(), nodes.size());
        return NodeList.of(nodes);
    }

    private static PathwayNode ordersNode(String id, List<Order> orders) {
        List<String> labels = new ArrayList<>();
        List<String> notes = new ArrayList<>();
        for (Order order : head(orders, MAX_CONSIDERED_ORDERS)) {
            labels.add(order.toLabel());
            if (order.notes() != null && !order.notes().isBlank()) {
                notes.add(order.category() + ": " + order.notes());
            }
        }
        String label = "PIT Orders: " + String.join("; ", head(labels, MAX_LABELED_ORDERS));
        String noteText = notes.isEmpty() ? "Standard workup orders" : String.join("; ", notes);
        return new PathwayNode(id, NodeType.PROCESS, label, noteText, NO_EVIDENCE, null, null, null);
    }

    /**
     * Builds the secondary criticality Decision. Without a critical care node there is nowhere
     * to escalate to, so only the continue branch is kept.
     */
    private static PathwayNode secondaryCriticalityNode(String id, String continueId, String criticalCareId,
                                                        List<String> criteria) {
        List<Branch> branches = new ArrayList<>();
        if (criticalCareId != null) {
            branches.add(Branch.to("YES - Escalate", criticalCareId));
        } else {
            log.debug("No critical care node; omitting escalate branch of secondary criticality");
        }
        branches.add(Branch.to("NO - Continue", continueId));

        String label = "Secondary Criticality: "
            + String.join(" OR ", head(criteria, MAX_LABELED_SECONDARY_CRITERIA)) + "?";
        return new PathwayNode(id, NodeType.DECISION, label,
            REEVALUATE_PREFIX + " " + String.join(", ", criteria), NO_EVIDENCE, branches, null, null);
    }

    private static PathwayNode dispositionEnd(String id, DispositionCriteria disposition) {
        String label = disposition.toLabel();
        if (disposition.followUp() != null && !disposition.followUp().isBlank()) {
            label += " Follow-up: " + disposition.followUp();
        }
        String notes = disposition.additionalNotes() != null && !disposition.additionalNotes().isBlank()
            ? disposition.additionalNotes()
            : String.join("; ", disposition.criteria());
        return new PathwayNode(id, NodeType.END, label, notes, NO_EVIDENCE, null, null, null);
    }

    /**
     * Rebuilds a structured pathway from a node list.
     *
     * @param nodes node list
     * @param conditionName condition name, or null for {@value #DEFAULT_CONDITION_NAME}
     * @param setting clinical setting, or null for {@value #DEFAULT_SETTING}
     * @return reconstructed pathway with warnings and confidence
     */
    public static PathwayReconstruction nodesToPathway(NodeList nodes, String conditionName, String setting) {
        Objects.requireNonNull(nodes, "nodes must not be null");

        List<String> warnings = new ArrayList<>();
        String chiefComplaint = recoverChiefComplaint(nodes, warnings);

        List<String> initial = new ArrayList<>();
        List<String> secondary = new ArrayList<>();
        List<DispositionCriteria> dispositions = new ArrayList<>();
        int unmappedProcesses = 0;

        for (int i = 0; i < nodes.size(); i++) {
            PathwayNode node = nodes.get(i);
            switch (node.type()) {
                case DECISION -> collectCriteria(node, initial, secondary);
                case END -> dispositions.add(classifyEnd(node, i, warnings));
                case PROCESS, REEVALUATION -> unmappedProcesses++;
                case START -> { }
            }
        }

        if (unmappedProcesses > 0) {
            warnings.add(unmappedProcesses + " process node(s) not mapped back; orders, evidence-based "
                + "additions and critical care actions are not reconstructed");
        }
        if (dispositions.isEmpty()) {
            warnings.add("No End nodes; disposition criteria are empty");
        }

        ClinicalPathway pathway = new ClinicalPathway(
            conditionName != null ? conditionName : DEFAULT_CONDITION_NAME,
            chiefComplaint,
            setting != null ? setting : DEFAULT_SETTING,
            initial, null, null,
            secondary.isEmpty() ? null : secondary,
            null, dispositions, null, null, null, null);

        ReconstructionConfidence confidence;
        if (nodes.firstPositionOf(NodeType.START) < 0 || dispositions.isEmpty()) {
            confidence = ReconstructionConfidence.LOW;
        } else if (!warnings.isEmpty()) {
            confidence = ReconstructionConfidence.MEDIUM;
        } else {
            confidence = ReconstructionConfidence.HIGH;
        }

        log.debug("Reconstructed pathway from {} nodes with confidence {} ({} warnings)",
            nodes.size(), confidence, warnings.size());
        return new PathwayReconstruction(pathway, warnings, confidence);
    }

    /**
     * Takes the text after the last word "with" in the first Start label.
     */
    static String recoverChiefComplaint(NodeList nodes, List<String> warnings) {
        int start = nodes.firstPositionOf(NodeType.START);
        if (start < 0) {
            warnings.add("No Start node; chief complaint defaulted to '" + DEFAULT_CHIEF_COMPLAINT + "'");
            return DEFAULT_CHIEF_COMPLAINT;
        }
        String label = nodes.get(start).label();
        Matcher matcher = WITH_WORD.matcher(label);
        int afterLast = -1;
        while (matcher.find()) {
            afterLast = matcher.end();
        }
        String complaint = afterLast >= 0 ? label.substring(afterLast).strip() : "";
        if (complaint.isEmpty()) {
            warnings.add("Start label has no complaint after 'with'; chief complaint defaulted to '"
                + DEFAULT_CHIEF_COMPLAINT + "'");
            return DEFAULT_CHIEF_COMPLAINT;
        }
        return complaint;
    }

    private static void collectCriteria(PathwayNode node, List<String> initial, List<String> secondary) {
        String label = node.label().toLowerCase(Locale.ROOT);
        if (!label.contains("critical") || !node.hasNotes()) {
            return;
        }
        String notes = node.notes().replace(RED_FLAGS_PREFIX, "").replace(REEVALUATE_PREFIX, "");
        List<String> criteria = new ArrayList<>();
        for (String part : notes.split(",")) {
            String criterion = part.strip();
            if (!criterion.isEmpty()) {
                criteria.add(criterion);
            }
        }
        List<String> kept = head(criteria, MAX_RECOVERED_CRITERIA);
        if (label.contains("initial") || !label.contains("secondary")) {
            initial.addAll(kept);
        } else {
            secondary.addAll(kept);
        }
    }

    /**
     * Classifies an End node by keyword, checked in order ICU, inpatient/admit,
     * observation/obs, transfer; anything else is a discharge.
     */
    static DispositionCriteria classifyEnd(PathwayNode node, int position, List<String> warnings) {
        String label = node.label();
        String lower = label.toLowerCase(Locale.ROOT);
        DispositionType type;
        if (lower.contains("icu")) {
            type = DispositionType.ICU;
        } else if (lower.contains("inpatient") || lower.contains("admit")) {
            type = DispositionType.INPATIENT;
        } else if (lower.contains("obs")) {
            type = DispositionType.OBSERVATION;
        } else if (lower.contains("transfer")) {
            type = DispositionType.TRANSFER;
        } else {
            type = DispositionType.DISCHARGE;
            if (!lower.contains("discharge")) {
                log.debug("End node {} has no disposition keyword, classified as Discharge", node.id());
                warnings.add("End node at position " + position + " ('" + label
                    + "') has no disposition keyword; classified as Discharge");
            }
        }
        return new DispositionCriteria(type, List.of(label), node.notes(), null);
    }

    private static <T> List<T> head(List<T> list, int max) {
        return list.subList(0, Math.min(max, list.size()));
    }

    private static String nextId(List<PathwayNode> nodes) {
        return idAt(nodes.size());
    }

    private static String idAt(int position) {
        return "N" + position;
    }
}
