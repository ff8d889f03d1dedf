package com.logic.obdd.engine;

import com.logic.obdd.api.EdgeKind;
import com.logic.obdd.api.NodeKind;
import com.logic.obdd.api.NodeView;
import com.logic.obdd.api.Position;

import java.util.EnumMap;
import java.util.Map;

/**
 * Mutable node record stored in the graph's arena.
 *
 * Only the owning graph holds references to instances of this class; everyone
 * else sees it through {@link NodeView}. That keeps the structural rules in one
 * place:
 *
 * - At most one outgoing edge per {@link EdgeKind}. {@link #link} replaces an
 * existing edge of the same kind instead of adding a second one.
 * - Terminal nodes never gain outgoing edges.
 */
final class ObddNode implements NodeView {
    private final String id;
    private final NodeKind kind;
    private final String label;
    private Position position;

    // EnumMap keeps ZERO before ONE when iterating
    private final Map<EdgeKind, String> outgoing = new EnumMap<>(EdgeKind.class);

    ObddNode(String id, NodeKind kind, String label, Position position) {
        this.id = id;
        this.kind = kind;
        this.label = label;
        this.position = position;
    }

    static ObddNode decision(String id, String label, Position position) {
        return new ObddNode(id, NodeKind.DECISION, label, position);
    }

    static ObddNode terminal(String id, boolean value, Position position) {
        return new ObddNode(id, NodeKind.TERMINAL, value ? "1" : "0", position);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public Position position() {
        return position;
    }

    void moveTo(Position position) {
        this.position = position;
    }

    @Override
    public String target(EdgeKind edgeKind) {
        return outgoing.get(edgeKind);
    }

    /**
     * Sets the {@code edgeKind} edge to point at {@code targetId}.
     *
     * @return true if the edge was added or re-pointed, false if it already
     *         pointed at {@code targetId}.
     * @throws IllegalStateException if this is a terminal node.
     */
    boolean link(EdgeKind edgeKind, String targetId) {
        if (kind == NodeKind.TERMINAL)
            throw new IllegalStateException("Terminal node " + id + " cannot have outgoing edges");
        return !targetId.equals(outgoing.put(edgeKind, targetId));
    }

    /** Removes the {@code edgeKind} edge, if any. */
    boolean unlink(EdgeKind edgeKind) {
        return outgoing.remove(edgeKind) != null;
    }

    /**
     * Drops every outgoing edge.
     *
     * @return the number of edges removed (0, 1 or 2).
     */
    int unlinkAll() {
        int removed = outgoing.size();
        outgoing.clear();
        return removed;
    }

    /** Read-only view of the outgoing edges, ZERO first. */
    Map<EdgeKind, String> outgoing() {
        return java.util.Collections.unmodifiableMap(outgoing);
    }

    @Override
    public String toString() {
        return "ObddNode[" + id + " '" + label + "' " + kind + " " + position + " " + outgoing + "]";
    }
}
