package com.logic.obdd.engine;

import com.logic.obdd.api.NodeKind;
import com.logic.obdd.api.NodeView;
import com.logic.obdd.api.Position;

/**
 * Node outlines shared by hit testing and drawing.
 */
public final class NodeGeometry {
    public static final double DECISION_RADIUS = 25;
    public static final double TERMINAL_SIZE = 40;
    public static final double ROOT_INDICATOR_LENGTH = 40;
    public static final double ROOT_INDICATOR_GAP = 5;

    private NodeGeometry() {
        // Utility class
    }

    /** Distance from a node's centre to its outline along the axes. */
    public static double extent(NodeKind kind) {
        return kind == NodeKind.TERMINAL ? TERMINAL_SIZE / 2 : DECISION_RADIUS;
    }

    /** Circle test for decision nodes, square test for terminals. */
    public static boolean contains(NodeView node, Position point) {
        Position c = node.position();
        double dx = point.x() - c.x();
        double dy = point.y() - c.y();
        if (node.isTerminal()) {
            double half = TERMINAL_SIZE / 2;
            return Math.abs(dx) <= half && Math.abs(dy) <= half;
        }
        return dx * dx + dy * dy <= DECISION_RADIUS * DECISION_RADIUS;
    }
}
