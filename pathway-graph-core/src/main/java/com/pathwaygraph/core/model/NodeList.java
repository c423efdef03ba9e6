package com.pathwaygraph.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable ordered list of pathway nodes with an identifier-to-position index.
 *
 * <p>Positions are 0-based and used for rendering order and edge addressing.
 * Identifiers must be unique within the list.
 */
public final class NodeList implements Iterable<PathwayNode> {

    private static final NodeList EMPTY = new NodeList(List.of());

    private final List<PathwayNode> nodes;
    private final Map<String, Integer> positions;

    private NodeList(List<PathwayNode> nodes) {
        this.nodes = List.copyOf(nodes);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < this.nodes.size(); i++) {
            String id = this.nodes.get(i).id();
            if (index.putIfAbsent(id, i) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + id);
            }
        }
        this.positions = Collections.unmodifiableMap(index);
    }

    /**
     * Creates a node list from the given nodes.
     *
     * @param nodes nodes in pathway order
     * @return node list
     * @throws IllegalArgumentException if two nodes share an identifier
     */
    public static NodeList of(List<PathwayNode> nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        return nodes.isEmpty() ? EMPTY : new NodeList(nodes);
    }

    /**
     * Creates a node list from the given nodes.
     *
     * @param nodes nodes in pathway order
     * @return node list
     */
    public static NodeList of(PathwayNode... nodes) {
        return of(Arrays.asList(nodes));
    }

    /**
     * Returns the empty node list.
     *
     * @return empty list
     */
    public static NodeList empty() {
        return EMPTY;
    }

    public List<PathwayNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public PathwayNode get(int position) {
        return nodes.get(position);
    }

    /**
     * Resolves a node identifier to its position.
     *
     * @param id node identifier (may be null)
     * @return position, or -1 if the identifier is null or unknown
     */
    public int positionOf(String id) {
        if (id == null) {
            return -1;
        }
        Integer position = positions.get(id);
        return position != null ? position : -1;
    }

    /**
     * Returns the position of the first node of the given type.
     *
     * @param type node type
     * @return position, or -1 if no node has that type
     */
    public int firstPositionOf(NodeType type) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).type() == type) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns a node list keeping only nodes of the given types, in order.
     *
     * <p>Targets pointing at removed nodes become unresolvable and render no edge.
     *
     * @param types node types to keep
     * @return filtered node list
     */
    public NodeList filterByTypes(Set<NodeType> types) {
        return of(nodes.stream().filter(node -> types.contains(node.type())).toList());
    }

    @Override
    public Iterator<PathwayNode> iterator() {
        return nodes.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof NodeList other && nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return "NodeList" + nodes;
    }
}
