package com.logic.obdd.engine;

import com.logic.obdd.api.Edge;
import com.logic.obdd.api.Position;
import com.logic.obdd.api.RenderSurface;

/**
 * Turns a {@link RenderCommand.Redraw} into surface primitives.
 *
 * Frame order is edges, then nodes in creation order, then the root arrow, so
 * that nodes cover the edge ends and the arrow sits on top. A selection
 * rectangle in progress is drawn last. Every selected node is highlighted.
 *
 * Edges run between node outlines rather than centres: the segment is
 * shortened at each end by the node's extent (decision radius, or half the
 * terminal side). Edges whose endpoints are less than a pixel apart, including
 * self loops, have no direction and are not drawn.
 */
public final class DiagramPainter {
    private static final double MIN_EDGE_LENGTH = 1.0;

    private DiagramPainter() {
        // Utility class
    }

    public static void paint(GraphView view, String selectedNodeId, RenderSurface surface) {
        paint(new RenderCommand.Redraw(view, selectedNodeId), surface);
    }

    public static void paint(RenderCommand.Redraw redraw, RenderSurface surface) {
        GraphView view = redraw.view();
        surface.beginFrame();

        for (Edge edge : view.edges()) {
            NodeSnapshot from = view.node(edge.source());
            NodeSnapshot to = view.node(edge.target());
            if (from == null || to == null)
                continue;
            drawEdge(from, to, edge, surface);
        }

        for (NodeSnapshot node : view.nodes()) {
            boolean selected = redraw.isSelected(node.id());
            if (node.isTerminal())
                surface.drawTerminalNode(node.position(), node.label(), selected);
            else
                surface.drawDecisionNode(node.position(), node.label(), selected);
        }

        NodeSnapshot root = view.rootId() == null ? null : view.node(view.rootId());
        if (root != null) {
            Position c = root.position();
            double top = NodeGeometry.extent(root.kind());
            surface.drawRootIndicator(
                    new Position(c.x(), c.y() - top - NodeGeometry.ROOT_INDICATOR_LENGTH),
                    new Position(c.x(), c.y() - top - NodeGeometry.ROOT_INDICATOR_GAP));
        }

        EditorSession.Box box = redraw.box();
        if (box != null)
            surface.drawSelectionBox(box.anchor(), box.corner());

        surface.endFrame();
    }

    private static void drawEdge(NodeSnapshot from, NodeSnapshot to, Edge edge, RenderSurface surface) {
        double dx = to.position().x() - from.position().x();
        double dy = to.position().y() - from.position().y();
        double distance = Math.sqrt(dx * dx + dy * dy);
        if (distance < MIN_EDGE_LENGTH)
            return;
        dx /= distance;
        dy /= distance;

        double startOffset = NodeGeometry.extent(from.kind());
        double endOffset = NodeGeometry.extent(to.kind());
        Position start = from.position().translate(dx * startOffset, dy * startOffset);
        Position end = to.position().translate(-dx * endOffset, -dy * endOffset);
        surface.drawEdge(start, end, edge.kind());
    }
}
