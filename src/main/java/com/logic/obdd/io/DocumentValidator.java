package com.logic.obdd.io;

import com.logic.obdd.api.EdgeKind;
import com.logic.obdd.api.GraphException;
import com.logic.obdd.api.NodeKind;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks run on a document before it may replace the live graph.
 *
 * Rejects, with a {@link GraphException} of kind MALFORMED_DOCUMENT:
 * - a missing document or node list,
 * - nodes missing id, kind, label, x or y,
 * - duplicate node ids,
 * - unknown node or edge kinds,
 * - terminals labelled anything but "0" / "1", or not exactly one of each,
 * - edges with missing fields, unknown endpoints, or leaving a terminal,
 * - more than one edge of a kind from the same source,
 * - a root that names no node.
 *
 * A missing edge list reads as "no edges". Cycles and duplicate decision
 * labels are allowed, as in the editor.
 */
public final class DocumentValidator {

    private DocumentValidator() {
        // Utility class
    }

    public static void validate(ObddDocument doc) {
        if (doc == null)
            throw GraphException.malformed("document is empty");
        if (doc.getNodes() == null)
            throw GraphException.malformed("document has no 'nodes' list");

        Map<String, NodeKind> kinds = new HashMap<>(doc.getNodes().size() * 2);
        Set<String> terminalLabels = new HashSet<>();
        int index = 0;
        for (ObddDocument.NodeDef node : doc.getNodes()) {
            String where = "node #" + index++;
            if (node == null)
                throw GraphException.malformed(where + " is null");
            requireField(node.getId(), "id", where);
            where = "node '" + node.getId() + "'";
            requireField(node.getKind(), "kind", where);
            requireField(node.getLabel(), "label", where);
            if (node.getX() == null)
                throw GraphException.malformed(where + " is missing 'x'");
            if (node.getY() == null)
                throw GraphException.malformed(where + " is missing 'y'");

            NodeKind kind = parseNodeKind(node.getKind(), where);
            if (kinds.put(node.getId(), kind) != null)
                throw GraphException.malformed("duplicate node id " + node.getId());

            if (kind == NodeKind.TERMINAL) {
                String label = node.getLabel();
                if (!label.equals("0") && !label.equals("1"))
                    throw GraphException.malformed(where + ": terminal label must be \"0\" or \"1\", got \"" + label + "\"");
                if (!terminalLabels.add(label))
                    throw GraphException.malformed("more than one terminal labelled \"" + label + "\"");
            }
        }
        if (terminalLabels.size() != 2)
            throw GraphException.malformed("document needs terminal nodes labelled \"0\" and \"1\"");

        if (doc.getEdges() != null) {
            Map<String, Set<EdgeKind>> seen = new HashMap<>();
            index = 0;
            for (ObddDocument.EdgeDef edge : doc.getEdges()) {
                String where = "edge #" + index++;
                if (edge == null)
                    throw GraphException.malformed(where + " is null");
                requireField(edge.getSource(), "source", where);
                requireField(edge.getKind(), "kind", where);
                requireField(edge.getTarget(), "target", where);

                EdgeKind kind = parseEdgeKind(edge.getKind(), where);
                NodeKind sourceKind = kinds.get(edge.getSource());
                if (sourceKind == null)
                    throw GraphException.malformed(where + ": source " + edge.getSource() + " does not exist");
                if (!kinds.containsKey(edge.getTarget()))
                    throw GraphException.malformed(where + ": target " + edge.getTarget() + " does not exist");
                if (sourceKind == NodeKind.TERMINAL)
                    throw GraphException.malformed(where + ": terminal " + edge.getSource() + " cannot have outgoing edges");
                if (!seen.computeIfAbsent(edge.getSource(), k -> EnumSet.noneOf(EdgeKind.class)).add(kind))
                    throw GraphException.malformed("node " + edge.getSource() + " has more than one "
                            + kind.wireName() + " edge");
            }
        }

        if (doc.getRoot() != null && !kinds.containsKey(doc.getRoot()))
            throw GraphException.malformed("root " + doc.getRoot() + " does not exist");
    }

    private static void requireField(String value, String field, String where) {
        if (value == null || value.isEmpty())
            throw GraphException.malformed(where + " is missing '" + field + "'");
    }

    private static NodeKind parseNodeKind(String name, String where) {
        try {
            return NodeKind.fromWire(name);
        } catch (IllegalArgumentException e) {
            throw GraphException.malformed(where + ": unknown node kind '" + name + "'");
        }
    }

    private static EdgeKind parseEdgeKind(String name, String where) {
        try {
            return EdgeKind.fromWire(name);
        } catch (IllegalArgumentException e) {
            throw GraphException.malformed(where + ": unknown edge kind '" + name + "'");
        }
    }
}
