package com.logic.obdd.util;

import com.logic.obdd.api.Edge;
import com.logic.obdd.api.EdgeKind;
import com.logic.obdd.engine.GraphView;
import com.logic.obdd.engine.NodeSnapshot;

/**
 * Diagnostic renderings of a diagram snapshot.
 *
 * <p>
 * {@link #toMermaid} produces a Mermaid flowchart suitable for embedding in
 * Markdown: decision nodes as circles, terminals as boxes, 1-edges solid,
 * 0-edges dashed, the root highlighted. {@link #dumpDiagram} is a plain text
 * listing for logs.
 *
 * <p>
 * <b>Usage:</b> debugging and export only; both methods walk the whole
 * diagram and allocate strings.
 */
public final class DiagramExplain {

    private DiagramExplain() {
        // Utility class
    }

    public static String toMermaid(GraphView view) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph TD;\n");

        // 1. Nodes in creation order
        for (NodeSnapshot node : view.nodes()) {
            String safeId = sanitize(node.id());
            String label = escape(node.label());
            if (node.isTerminal())
                sb.append("  ").append(safeId).append("[\"").append(label).append("\"];\n");
            else
                sb.append("  ").append(safeId).append("((\"").append(label).append("\"));\n");
        }

        // 2. Edges afterwards, ZERO dashed
        for (Edge edge : view.edges()) {
            sb.append("  ").append(sanitize(edge.source()));
            if (edge.kind() == EdgeKind.ZERO)
                sb.append(" -. 0 .-> ");
            else
                sb.append(" -- 1 --> ");
            sb.append(sanitize(edge.target())).append(";\n");
        }

        if (view.rootId() != null && view.node(view.rootId()) != null) {
            sb.append("  classDef root stroke:#d00,stroke-width:3px;\n");
            sb.append("  class ").append(sanitize(view.rootId())).append(" root;\n");
        }
        return sb.toString();
    }

    /** One line per node: id, label, kind, position, outgoing edges, root marker. */
    public static String dumpDiagram(GraphView view) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Diagram (").append(view.nodeCount()).append(" nodes, ")
                .append(view.edges().size()).append(" edges):\n");
        for (NodeSnapshot node : view.nodes()) {
            sb.append("  [").append(node.id()).append("] '").append(node.label()).append("' ")
                    .append(node.kind().wireName()).append(' ').append(node.position());
            if (node.id().equals(view.rootId()))
                sb.append(" (ROOT)");
            for (EdgeKind kind : EdgeKind.values()) {
                String target = node.target(kind);
                if (target == null)
                    continue;
                NodeSnapshot t = view.node(target);
                sb.append(" --").append(kind.symbol()).append("--> ").append(t != null ? t.label() : target);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String sanitize(String id) {
        return id.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private static String escape(String label) {
        return label.replace("\"", "#quot;");
    }
}
