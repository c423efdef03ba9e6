package com.pathwaygraph.core.json;

import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pathwaygraph.core.model.Branch;
import com.pathwaygraph.core.model.NodeList;
import com.pathwaygraph.core.model.PathwayNode;

/**
 * Writes a {@link NodeList} as node-list JSON.
 *
 * <p>Resolvable targets are written as integer positions so that the output can be read by
 * tools that only understand positional targets. Unresolvable targets are written as the
 * original identifier text.
 */
public class NodeListWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Serializes a node list.
     *
     * @param nodes node list
     * @return pretty-printed JSON array
     */
    public String write(NodeList nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        try {
            return MAPPER.writeValueAsString(toTree(nodes));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize node list", e);
        }
    }

    /**
     * Builds the JSON tree of a node list.
     *
     * @param nodes node list
     * @return JSON array
     */
    public ArrayNode toTree(NodeList nodes) {
        ArrayNode array = MAPPER.createArrayNode();
        for (PathwayNode node : nodes) {
            ObjectNode json = array.addObject();
            json.put("id", node.id());
            json.put("type", node.type().displayName());
            json.put("label", node.label());
            if (node.evidence() != null) {
                json.put("evidence", node.evidence());
            }
            if (node.notes() != null) {
                json.put("notes", node.notes());
            }
            if (!node.branches().isEmpty()) {
                ArrayNode branches = json.putArray("branches");
                for (Branch branch : node.branches()) {
                    ObjectNode branchJson = branches.addObject();
                    branchJson.put("label", branch.label());
                    putTarget(branchJson, branch.target(), nodes);
                }
            }
            if (node.target() != null) {
                putTarget(json, node.target(), nodes);
            }
            if (node.role() != null) {
                json.put("role", node.role());
            }
        }
        return array;
    }

    private static void putTarget(ObjectNode json, String target, NodeList nodes) {
        int position = nodes.positionOf(target);
        if (position >= 0) {
            json.put("target", position);
        } else if (target != null) {
            json.put("target", target);
        } else {
            json.putNull("target");
        }
    }
}
