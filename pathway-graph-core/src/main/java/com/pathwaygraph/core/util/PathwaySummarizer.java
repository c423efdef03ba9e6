package com.pathwaygraph.core.util;

import com.pathwaygraph.core.model.NodeList;
import com.pathwaygraph.core.model.NodeType;
import com.pathwaygraph.core.model.PathwayNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds a one-paragraph plain-text summary of a node list.
 *
 * <p>Example: {@code Pathway with 5 nodes (1 Start, 1 Decision, 2 Process, 1 End).
 * Starts with: 'Patient presents'. End points: Discharge.}
 */
public final class PathwaySummarizer {

    /** Summary of an empty node list. */
    public static final String EMPTY_SUMMARY = "No existing pathway.";

    private static final int FIRST_LABEL_LENGTH = 50;
    private static final int END_LABEL_LENGTH = 30;
    private static final int MAX_END_LABELS = 3;

    private PathwaySummarizer() {
        // Utility class
    }

    /**
     * Summarizes the node list.
     *
     * @param nodes node list
     * @return summary text
     */
    public static String summarize(NodeList nodes) {
        if (nodes.isEmpty()) {
            return EMPTY_SUMMARY;
        }

        Map<NodeType, Long> counts = nodes.nodes().stream()
            .collect(Collectors.groupingBy(PathwayNode::type, LinkedHashMap::new, Collectors.counting()));
        String typeSummary = counts.entrySet().stream()
            .map(e -> e.getValue() + " " + e.getKey().displayName())
            .collect(Collectors.joining(", "));

        String endLabels = nodes.nodes().stream()
            .filter(node -> node.type() == NodeType.END)
            .limit(MAX_END_LABELS)
            .map(node -> head(node.label(), END_LABEL_LENGTH))
            .collect(Collectors.joining(", "));

        StringBuilder sb = new StringBuilder();
        sb.append("Pathway with ").append(nodes.size()).append(" nodes (").append(typeSummary).append("). ");
        sb.append("Starts with: '").append(head(nodes.get(0).label(), FIRST_LABEL_LENGTH)).append("'. ");
        if (!endLabels.isEmpty()) {
            sb.append("End points: ").append(endLabels).append('.');
        }
        return sb.toString().strip();
    }

    private static String head(String text, int length) {
        return text.length() <= length ? text : text.substring(0, length);
    }
}
