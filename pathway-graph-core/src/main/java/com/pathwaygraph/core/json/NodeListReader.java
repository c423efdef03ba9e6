package com.pathwaygraph.core.json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pathwaygraph.core.model.Branch;
import com.pathwaygraph.core.model.NodeList;
import com.pathwaygraph.core.model.NodeType;
import com.pathwaygraph.core.model.PathwayNode;

/**
 * Reads node-list JSON leniently into a {@link NodeList}.
 *
 * <p>The input is an array of node objects:
 * <pre>{@code
 * [
 *   {"type": "Start", "label": "Patient presents to ED with chest pain"},
 *   {"type": "Decision", "label": "Stable?",
 *    "branches": [{"label": "Yes", "target": 2}, {"label": "No", "target": "icu"}]},
 *   ...
 * ]
 * }</pre>
 *
 * <p>Leniency rules:
 * <ul>
 *   <li>missing {@code type} reads as Process, missing {@code label} as {@code Step i}</li>
 *   <li>{@code detail} is accepted in place of {@code notes}</li>
 *   <li>missing or duplicate {@code id} becomes {@code N{i}}, suffixed until unique</li>
 *   <li>targets may be positions (integers) or node identifiers (strings)</li>
 *   <li>optional fields of the wrong JSON type are treated as absent</li>
 * </ul>
 *
 * <p>An integer branch target outside the list becomes an unresolved branch. An integer
 * explicit target outside the list is kept as {@code #<value>}, which matches no node, so the
 * node still renders without an outgoing edge.
 */
public class NodeListReader {

    private static final Logger log = LoggerFactory.getLogger(NodeListReader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Reads a node list from a JSON string.
     *
     * @param json JSON array of nodes
     * @return node list
     * @throws PathwayImportException if the JSON is malformed or not an array of objects
     */
    public NodeList read(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return read(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new PathwayImportException("Malformed node list JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads a node list from a JSON file.
     *
     * @param file path to a JSON array of nodes
     * @return node list
     * @throws PathwayImportException if the file cannot be read or parsed
     */
    public NodeList read(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        try {
            log.debug("Reading node list from: {}", file);
            return read(Files.readString(file));
        } catch (IOException e) {
            throw new PathwayImportException("Cannot read node list file: " + file, e);
        }
    }

    /**
     * Reads a node list from a parsed JSON tree.
     *
     * @param root JSON array of nodes
     * @return node list
     * @throws PathwayImportException if the tree is not an array of objects
     */
    public NodeList read(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new PathwayImportException("Node list JSON must be an array");
        }
        for (int i = 0; i < root.size(); i++) {
            if (!root.get(i).isObject()) {
                throw new PathwayImportException("Node list entry " + i + " is not an object");
            }
        }

        List<String> ids = assignIds(root);
        Set<String> idSet = new HashSet<>(ids);
        List<PathwayNode> nodes = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            nodes.add(readNode(root.get(i), i, ids, idSet));
        }

        log.debug("Read {} nodes", nodes.size());
        return NodeList.of(nodes);
    }

    private List<String> assignIds(JsonNode root) {
        List<String> ids = new ArrayList<>(root.size());
        Set<String> used = new HashSet<>();
        for (int i = 0; i < root.size(); i++) {
            String id = scalarText(root.get(i).get("id"));
            if (id == null || id.isBlank() || used.contains(id)) {
                id = uniqueId("N" + i, used);
            }
            used.add(id);
            ids.add(id);
        }
        return ids;
    }

    private static String uniqueId(String base, Set<String> used) {
        String candidate = base;
        int suffix = 1;
        while (used.contains(candidate)) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    private PathwayNode readNode(JsonNode json, int position, List<String> ids, Set<String> idSet) {
        NodeType type = NodeType.fromValue(text(json.get("type")));

        String label = text(json.get("label"));
        if (label == null) {
            label = "Step " + position;
        }

        String notes = text(json.get("notes"));
        if (notes == null) {
            notes = text(json.get("detail"));
        }

        List<Branch> branches = new ArrayList<>();
        JsonNode branchArray = json.get("branches");
        if (branchArray != null && branchArray.isArray()) {
            for (JsonNode branch : branchArray) {
                if (!branch.isObject()) {
                    log.debug("Ignoring non-object branch of node {}", ids.get(position));
                    continue;
                }
                branches.add(new Branch(text(branch.get("label")), resolveBranchTarget(branch.get("target"), ids)));
            }
        }

        return new PathwayNode(ids.get(position), type, label, notes, text(json.get("evidence")),
            branches, resolveExplicitTarget(json.get("target"), ids, idSet), text(json.get("role")));
    }

    private String resolveBranchTarget(JsonNode target, List<String> ids) {
        if (target == null) {
            return null;
        }
        if (target.isIntegralNumber()) {
            int position = position(target, ids.size());
            return position >= 0 ? ids.get(position) : null;
        }
        return target.isTextual() ? target.asText() : null;
    }

    private String resolveExplicitTarget(JsonNode target, List<String> ids, Set<String> idSet) {
        if (target == null) {
            return null;
        }
        if (target.isIntegralNumber()) {
            int position = position(target, ids.size());
            if (position >= 0) {
                return ids.get(position);
            }
            String marker = "#" + target.asText();
            while (idSet.contains(marker)) {
                marker = "#" + marker;
            }
            return marker;
        }
        return target.isTextual() ? target.asText() : null;
    }

    /**
     * Returns the integer target as a position in {@code [0, size)}, or -1 when it lies
     * outside the list, including values that do not fit in an int.
     */
    private static int position(JsonNode target, int size) {
        if (!target.canConvertToInt()) {
            return -1;
        }
        int position = target.intValue();
        return position >= 0 && position < size ? position : -1;
    }

    private static String text(JsonNode value) {
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static String scalarText(JsonNode value) {
        if (value == null) {
            return null;
        }
        return value.isTextual() || value.isIntegralNumber() ? value.asText() : null;
    }
}
