package com.logic.obdd.api;

/**
 * Read-only view of a diagram node.
 *
 * The graph hands these out instead of its mutable nodes, so every mutation
 * has to go through the graph's own operations.
 */
public interface NodeView {

    /** Unique, immutable identifier. */
    String id();

    NodeKind kind();

    /** Variable name for decision nodes, "0" or "1" for terminals. */
    String label();

    Position position();

    /**
     * Target of the outgoing edge of the given kind.
     *
     * @return the target id, or null if there is no such edge.
     */
    String target(EdgeKind kind);

    default boolean isTerminal() {
        return kind() == NodeKind.TERMINAL;
    }
}
