package com.logic.obdd.engine;

import com.logic.obdd.api.Edge;
import com.logic.obdd.api.EdgeKind;
import com.logic.obdd.api.ErrorKind;
import com.logic.obdd.api.GraphException;
import com.logic.obdd.api.NodeKind;
import com.logic.obdd.api.NodeView;
import com.logic.obdd.api.Position;
import com.logic.obdd.io.DocumentValidator;
import com.logic.obdd.io.ObddDocument;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;

/**
 * The diagram: an arena of nodes indexed by id plus an optional root.
 *
 * This is the single owner of every {@link ObddNode}. Outside code refers to
 * nodes by id and reads them through {@link NodeView}; all mutation goes
 * through the operations below, which is where the structural rules live:
 *
 * 1. Edges: at most one 0-edge and one 1-edge per node. Connecting a kind that
 * already exists re-points it; the old edge is gone.
 * 2. Terminals: exactly one "0" and one "1" terminal exist at all times. They
 * never have outgoing edges and cannot be removed on their own; only
 * {@link #reset()} or a successful {@link #fromDocument} replaces them.
 * 3. Root: at most one. Setting a new root replaces the previous one. The root
 * is a lookup by id, not ownership.
 * 4. Labels: generated labels come from the {@link LabelAllocator} and never
 * collide with a live node's label.
 *
 * Permissive on purpose where the editor is: cycles, unreachable nodes and
 * user-chosen duplicate labels are accepted.
 *
 * Thread Safety:
 * Not thread-safe. The editor's event thread is the only writer; other threads
 * read {@link #snapshot()} results.
 */
public final class ObddGraph {
    private static final Logger log = LogManager.getLogger(ObddGraph.class);

    public static final String FALSE_LABEL = "0";
    public static final String TRUE_LABEL = "1";

    private final CanvasLayout layout;
    private final LabelAllocator labels = new LabelAllocator();

    private Map<String, ObddNode> nodes = new LinkedHashMap<>();
    private String rootId;
    private long nextId;

    public ObddGraph(CanvasLayout layout) {
        this.layout = layout;
        createTerminals();
    }

    public ObddGraph() {
        this(CanvasLayout.DEFAULT);
    }

    public CanvasLayout layout() {
        return layout;
    }

    // ── Mutations ────────────────────────────────────────────────

    /** Adds a decision node with the next label at the default spot. */
    public NodeView addDecisionNode() {
        return addDecisionNode(layout.newNode());
    }

    /** Adds a decision node with the next allocated label. */
    public NodeView addDecisionNode(Position position) {
        return insert(ObddNode.decision(newId(), labels.next(this::hasLabel), position));
    }

    /**
     * Adds a decision node with a user-chosen label. A null or blank label falls
     * back to the allocator. A custom label still consumes one allocator slot so
     * the skipped suggestion is not offered again.
     */
    public NodeView addDecisionNode(String label, Position position) {
        if (label == null || label.isBlank())
            return addDecisionNode(position);
        String trimmed = label.trim();
        labels.skip();
        return insert(ObddNode.decision(newId(), trimmed, position));
    }

    /** @throws GraphException NOT_FOUND if the id is unknown. */
    public void moveNode(String id, Position position) {
        require(id).moveTo(position);
    }

    /**
     * Points the {@code kind} edge of {@code sourceId} at {@code targetId},
     * replacing any existing edge of that kind.
     *
     * @return true if the graph changed, false if the edge already pointed there.
     * @throws GraphException NOT_FOUND if either id is unknown, INVALID_SOURCE if
     *                        the source is a terminal. The graph is unchanged in
     *                        both cases.
     */
    public boolean connect(String sourceId, EdgeKind kind, String targetId) {
        ObddNode source = require(sourceId);
        require(targetId);
        if (source.isTerminal()) {
            throw new GraphException(ErrorKind.INVALID_SOURCE,
                    "cannot connect from terminal node " + source.label());
        }
        return source.link(kind, targetId);
    }

    /**
     * Removes both outgoing edges of a node. Not an error if there are none.
     *
     * @return the number of edges removed.
     * @throws GraphException NOT_FOUND if the id is unknown.
     */
    public int disconnectAll(String sourceId) {
        return require(sourceId).unlinkAll();
    }

    /** @throws GraphException NOT_FOUND if the id is unknown. */
    public void setRoot(String id) {
        require(id);
        this.rootId = id;
    }

    /**
     * Removes a decision node together with its outgoing edges and every edge
     * pointing at it. Clears the root if the node was the root.
     *
     * @throws GraphException NOT_FOUND if the id is unknown, INVALID_SOURCE for
     *                        terminals.
     */
    public NodeView removeDecisionNode(String id) {
        ObddNode node = require(id);
        if (node.isTerminal()) {
            throw new GraphException(ErrorKind.INVALID_SOURCE,
                    "cannot delete terminal node " + node.label());
        }
        nodes.remove(id);
        for (ObddNode other : nodes.values()) {
            for (EdgeKind kind : EdgeKind.values()) {
                if (id.equals(other.target(kind)))
                    other.unlink(kind);
            }
        }
        if (id.equals(rootId))
            rootId = null;
        return node;
    }

    /**
     * Back to the start-up state: two fresh terminals, no decision nodes, no
     * edges, no root. The label sequence restarts at "p".
     */
    public void reset() {
        nodes = new LinkedHashMap<>();
        rootId = null;
        nextId = 0;
        labels.reset();
        createTerminals();
        log.info("Graph cleared");
    }

    // ── Queries ──────────────────────────────────────────────────

    /** @return the node, or null if the id is unknown. */
    public NodeView node(String id) {
        return nodes.get(id);
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    /** All nodes in creation order. */
    public Collection<NodeView> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    /** Edges rebuilt from the nodes' outgoing maps, ZERO before ONE per source. */
    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>();
        for (ObddNode node : nodes.values()) {
            for (Map.Entry<EdgeKind, String> e : node.outgoing().entrySet())
                edges.add(new Edge(node.id(), e.getKey(), e.getValue()));
        }
        return edges;
    }

    /** @return the root id, or null. */
    public String rootId() {
        return rootId;
    }

    /** The "1" terminal for {@code true}, the "0" terminal for {@code false}. */
    public NodeView terminal(boolean value) {
        String label = value ? TRUE_LABEL : FALSE_LABEL;
        for (ObddNode node : nodes.values()) {
            if (node.isTerminal() && node.label().equals(label))
                return node;
        }
        throw new IllegalStateException("Terminal " + label + " missing");
    }

    /** First node with the given label, or null. */
    public NodeView findByLabel(String label) {
        for (ObddNode node : nodes.values()) {
            if (node.label().equals(label))
                return node;
        }
        return null;
    }

    /**
     * Topmost node under a canvas point. Nodes created later are drawn later,
     * so the search runs newest first.
     *
     * @return the node, or null if the point hits empty canvas.
     */
    public NodeView nodeAt(Position point) {
        List<ObddNode> ordered = new ArrayList<>(nodes.values());
        ListIterator<ObddNode> it = ordered.listIterator(ordered.size());
        while (it.hasPrevious()) {
            ObddNode node = it.previous();
            if (NodeGeometry.contains(node, point))
                return node;
        }
        return null;
    }

    /** The label {@link #addDecisionNode()} would produce next. */
    public String peekNextLabel() {
        return labels.peek(this::hasLabel);
    }

    public GraphView snapshot() {
        List<NodeSnapshot> copies = new ArrayList<>(nodes.size());
        for (ObddNode node : nodes.values())
            copies.add(NodeSnapshot.of(node));
        return new GraphView(copies, rootId);
    }

    // ── Documents ────────────────────────────────────────────────

    /** Structural export: nodes in creation order, edges per source, root. */
    public ObddDocument toDocument() {
        ObddDocument doc = new ObddDocument();
        List<ObddDocument.NodeDef> nodeDefs = new ArrayList<>(nodes.size());
        for (ObddNode node : nodes.values()) {
            ObddDocument.NodeDef def = new ObddDocument.NodeDef();
            def.setId(node.id());
            def.setKind(node.kind().wireName());
            def.setLabel(node.label());
            def.setX(node.position().x());
            def.setY(node.position().y());
            nodeDefs.add(def);
        }
        List<ObddDocument.EdgeDef> edgeDefs = new ArrayList<>();
        for (Edge edge : edges()) {
            ObddDocument.EdgeDef def = new ObddDocument.EdgeDef();
            def.setSource(edge.source());
            def.setKind(edge.kind().wireName());
            def.setTarget(edge.target());
            edgeDefs.add(def);
        }
        doc.setNodes(nodeDefs);
        doc.setEdges(edgeDefs);
        doc.setRoot(rootId);
        return doc;
    }

    /**
     * Replaces the whole graph with the document's content.
     *
     * The document is validated in full before anything is touched, so on
     * failure the current graph is exactly as it was. On success the label
     * sequence restarts, skipping labels the imported nodes already use.
     *
     * @throws GraphException MALFORMED_DOCUMENT describing the first violation.
     */
    public void fromDocument(ObddDocument doc) {
        DocumentValidator.validate(doc);

        Map<String, ObddNode> staged = new LinkedHashMap<>(doc.getNodes().size() * 2);
        for (ObddDocument.NodeDef def : doc.getNodes()) {
            NodeKind kind = NodeKind.fromWire(def.getKind());
            staged.put(def.getId(), new ObddNode(def.getId(), kind, def.getLabel(),
                    new Position(def.getX(), def.getY())));
        }
        if (doc.getEdges() != null) {
            for (ObddDocument.EdgeDef def : doc.getEdges())
                staged.get(def.getSource()).link(EdgeKind.fromWire(def.getKind()), def.getTarget());
        }

        this.nodes = staged;
        this.rootId = doc.getRoot();
        this.nextId = 0;
        this.labels.reset();
        log.debug("Graph replaced from document: {} nodes, root={}", staged.size(), rootId);
    }

    // ── Internals ────────────────────────────────────────────────

    private void createTerminals() {
        insert(ObddNode.terminal(newId(), false, layout.falseTerminal()));
        insert(ObddNode.terminal(newId(), true, layout.trueTerminal()));
    }

    private NodeView insert(ObddNode node) {
        nodes.put(node.id(), node);
        return node;
    }

    private String newId() {
        String id;
        do {
            id = "n" + nextId++;
        } while (nodes.containsKey(id));
        return id;
    }

    private boolean hasLabel(String label) {
        for (ObddNode node : nodes.values()) {
            if (node.label().equals(label))
                return true;
        }
        return false;
    }

    private ObddNode require(String id) {
        ObddNode node = id == null ? null : nodes.get(id);
        if (node == null)
            throw GraphException.notFound(id);
        return node;
    }
}
