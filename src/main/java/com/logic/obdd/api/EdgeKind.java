package com.logic.obdd.api;

/**
 * Branch of a decision node: the 0-edge (variable false) or the 1-edge
 * (variable true).
 *
 * Rendering convention: 1-edges are solid, 0-edges are dashed, both arrowed.
 */
public enum EdgeKind {
    ZERO("zero", '0'),
    ONE("one", '1');

    private final String wireName;
    private final char symbol;

    EdgeKind(String wireName, char symbol) {
        this.wireName = wireName;
        this.symbol = symbol;
    }

    public String wireName() {
        return wireName;
    }

    /** The digit shown in status messages, e.g. {@code p --1--> q}. */
    public char symbol() {
        return symbol;
    }

    /** The branch taken when the variable has the given value. */
    public static EdgeKind forValue(boolean value) {
        return value ? ONE : ZERO;
    }

    /**
     * @throws IllegalArgumentException if the name is not "zero" or "one".
     */
    public static EdgeKind fromWire(String name) {
        for (EdgeKind kind : values()) {
            if (kind.wireName.equals(name))
                return kind;
        }
        throw new IllegalArgumentException("Unknown edge kind: " + name);
    }
}
