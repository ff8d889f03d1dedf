package com.logic.obdd.api;

/**
 * The two node shapes an OBDD is built from.
 *
 * Decision nodes carry a variable label and up to one outgoing edge per
 * {@link EdgeKind}. Terminal nodes are the constant sinks "0" and "1" and never
 * have outgoing edges.
 */
public enum NodeKind {
    DECISION("decision"),
    TERMINAL("terminal");

    private final String wireName;

    NodeKind(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in exported documents. */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a document name back to a kind.
     *
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static NodeKind fromWire(String name) {
        for (NodeKind kind : values()) {
            if (kind.wireName.equals(name))
                return kind;
        }
        throw new IllegalArgumentException("Unknown node kind: " + name);
    }
}
