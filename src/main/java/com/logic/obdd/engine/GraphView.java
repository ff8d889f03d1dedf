package com.logic.obdd.engine;

import com.logic.obdd.api.Edge;
import com.logic.obdd.api.EdgeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of the diagram.
 *
 * Taken by the graph after every mutation and handed to the render surface,
 * which may keep it and paint from another thread while the editor carries
 * on. Two views are equal when they hold the same nodes (ids, kinds, labels,
 * positions, edges) in the same order and the same root.
 */
public final class GraphView {
    private final List<NodeSnapshot> nodes;
    private final Map<String, NodeSnapshot> byId;
    private final List<Edge> edges;
    private final String rootId;

    public GraphView(List<NodeSnapshot> nodes, String rootId) {
        this.nodes = List.copyOf(nodes);
        this.rootId = rootId;
        Map<String, NodeSnapshot> index = new LinkedHashMap<>(nodes.size() * 2);
        List<Edge> edgeList = new ArrayList<>();
        for (NodeSnapshot node : this.nodes) {
            index.put(node.id(), node);
            for (EdgeKind kind : EdgeKind.values()) {
                String target = node.target(kind);
                if (target != null)
                    edgeList.add(new Edge(node.id(), kind, target));
            }
        }
        this.byId = Collections.unmodifiableMap(index);
        this.edges = Collections.unmodifiableList(edgeList);
    }

    /** Nodes in creation order. */
    public List<NodeSnapshot> nodes() {
        return nodes;
    }

    /** Edges grouped by source in node order, ZERO before ONE. */
    public List<Edge> edges() {
        return edges;
    }

    /** @return the node, or null if the id is unknown. */
    public NodeSnapshot node(String id) {
        return byId.get(id);
    }

    /** @return the root id, or null if no root is set. */
    public String rootId() {
        return rootId;
    }

    public int nodeCount() {
        return nodes.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GraphView other))
            return false;
        return nodes.equals(other.nodes) && Objects.equals(rootId, other.rootId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, rootId);
    }

    @Override
    public String toString() {
        return "GraphView[nodes=" + nodes.size() + ", edges=" + edges.size() + ", root=" + rootId + "]";
    }
}
