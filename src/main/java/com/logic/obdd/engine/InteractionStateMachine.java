package com.logic.obdd.engine;

import com.logic.obdd.api.CursorStyle;
import com.logic.obdd.api.EdgeKind;
import com.logic.obdd.api.EditorCommand;
import com.logic.obdd.api.ErrorKind;
import com.logic.obdd.api.FileAction;
import com.logic.obdd.api.GraphException;
import com.logic.obdd.api.InputEvent;
import com.logic.obdd.api.NodeView;
import com.logic.obdd.api.Position;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Interprets user input against the current session and the graph.
 *
 * The machine is a function {@code (EditorSession, InputEvent) -> Transition}:
 * it keeps no interaction state of its own, mutates the graph through its
 * public operations, and describes the required feedback as
 * {@link RenderCommand}s. No GUI toolkit is involved, so every gesture can be
 * replayed from a test.
 *
 * Modes:
 * - Idle: clicks select, presses on a node start a drag, commands act on the
 * selection.
 * - EdgePending(kind): entered from Idle by connect-0 / connect-1 with a
 * decision node selected. The next press on a node connects the selection to
 * it with an edge of that kind and moves the selection to the target. ESC
 * drops the pending edge but keeps the selection. Pressing empty canvas
 * clears both. Any other command abandons the gesture first.
 *
 * Drag sub-state: a press on a node in Idle selects it and records where it
 * was grabbed; moves re-position it (redraw only), release ends the drag with
 * a status line. Pressing a member of a multi-node selection keeps the
 * selection and drags all of its nodes together.
 *
 * Additive presses (shift) toggle a node in the selection without dragging.
 *
 * Box sub-state: a press on empty canvas in Idle starts a selection rectangle,
 * replacing the selection unless the press is additive. Release selects every
 * node whose centre lies inside the rectangle.
 *
 * Failure Handling:
 * Guard failures (nothing selected, terminal source) and graph errors never
 * escape. They become a status message, the transition carries the
 * {@link ErrorKind}, and the mode falls back to Idle.
 */
public final class InteractionStateMachine {
    private static final Logger log = LogManager.getLogger(InteractionStateMachine.class);

    public static final String MODE_READY = "Ready";
    public static final String MODE_BOX = "Box selecting";

    private final ObddGraph graph;
    private final KeyBindings keys;

    public InteractionStateMachine(ObddGraph graph, KeyBindings keys) {
        this.graph = graph;
        this.keys = keys;
    }

    public InteractionStateMachine(ObddGraph graph) {
        this(graph, KeyBindings.defaults());
    }

    public ObddGraph graph() {
        return graph;
    }

    /**
     * Runs one event to completion.
     *
     * @throws IllegalArgumentException for file events, which carry I/O and are
     *                                  handled by the editor.
     */
    public Transition apply(EditorSession session, InputEvent event) {
        Output out = new Output();
        EditorSession next;
        try {
            next = dispatch(session, event, out);
        } catch (GraphException e) {
            out = new Output();
            next = recover(session, e, out);
        }
        return out.toTransition(next);
    }

    /** The commands that paint the current state from scratch. */
    public Transition refresh(EditorSession session) {
        Output out = new Output();
        redraw(session, out);
        out.add(new RenderCommand.SetCursor(session.isEdgePending() ? CursorStyle.CROSSHAIR : CursorStyle.NORMAL));
        out.add(new RenderCommand.ShowMode(modeLine(session)));
        out.status(MODE_READY);
        return out.toTransition(session);
    }

    private EditorSession dispatch(EditorSession s, InputEvent event, Output out) {
        if (event instanceof InputEvent.Click click)
            return onPress(s, click.at(), click.additive(), false, out);
        if (event instanceof InputEvent.DragStart start)
            return onPress(s, start.at(), start.additive(), true, out);
        if (event instanceof InputEvent.DragMove move)
            return onDragMove(s, move.at(), out);
        if (event instanceof InputEvent.DragEnd end)
            return onDragEnd(s, end.at(), out);
        if (event instanceof InputEvent.KeyPress key) {
            EditorCommand command = keys.lookup(key.key());
            if (command == null) {
                log.trace("Unbound key {}", (int) key.key());
                return s;
            }
            return onCommand(s, command, null, out);
        }
        if (event instanceof InputEvent.Command command)
            return onCommand(s, command.command(), command.label(), out);
        throw new IllegalArgumentException("Event not handled by the state machine: " + event);
    }

    // ── Pointer ──────────────────────────────────────────────────

    private EditorSession onPress(EditorSession s, Position at, boolean additive, boolean startsDrag, Output out) {
        NodeView hit = graph.nodeAt(at);
        if (s.isEdgePending())
            return hit == null ? clearSelection(s, out) : completeEdge(s, hit, out);
        if (hit == null) {
            if (startsDrag)
                return startBox(s, at, additive, out);
            if (additive) {
                out.status(MODE_READY);
                return s;
            }
            return clearSelection(s, out);
        }
        if (additive)
            return toggle(s, hit, out);

        EditorSession next = s.isSelected(hit.id()) && s.selectionSize() > 1 ? s.focus(hit.id()) : s.select(hit.id());
        next = next.dragging(null);
        if (startsDrag)
            next = next.dragging(new EditorSession.Drag(hit.id(), at.minus(hit.position()), false));
        redraw(next, out);
        out.status("node " + hit.label() + " selected");
        return next;
    }

    private EditorSession toggle(EditorSession s, NodeView hit, Output out) {
        Set<String> ids = new LinkedHashSet<>(s.selectedIds());
        EditorSession next;
        if (ids.remove(hit.id())) {
            String primary = hit.id().equals(s.selectedNodeId()) ? first(ids) : s.selectedNodeId();
            next = s.select(primary, ids).dragging(null);
            out.status("node " + hit.label() + " deselected");
        } else {
            ids.add(hit.id());
            next = s.select(hit.id(), ids).dragging(null);
            out.status("node " + hit.label() + " selected");
        }
        redraw(next, out);
        return next;
    }

    private EditorSession startBox(EditorSession s, Position at, boolean additive, Output out) {
        EditorSession base = additive ? s : s.select(null);
        EditorSession next = base.dragging(null).boxing(new EditorSession.Box(at, at, additive));
        redraw(next, out);
        out.add(new RenderCommand.ShowMode(MODE_BOX));
        out.status("box select: drag to choose nodes");
        return next;
    }

    private EditorSession finishBox(EditorSession s, EditorSession.Box box, Output out) {
        Set<String> inside = new LinkedHashSet<>();
        for (NodeView node : graph.nodes()) {
            if (box.contains(node.position()))
                inside.add(node.id());
        }
        Set<String> ids = new LinkedHashSet<>();
        if (box.additive())
            ids.addAll(s.selectedIds());
        ids.addAll(inside);
        String primary = s.hasSelection() && ids.contains(s.selectedNodeId()) ? s.selectedNodeId() : first(ids);

        EditorSession next = s.boxing(null).select(primary, ids);
        redraw(next, out);
        out.add(new RenderCommand.ShowMode(MODE_READY));
        out.status(inside.isEmpty() ? MODE_READY : "selected " + inside.size() + " node(s)");
        return next;
    }

    private EditorSession clearSelection(EditorSession s, Output out) {
        EditorSession next = EditorSession.INITIAL;
        redraw(next, out);
        if (s.isEdgePending())
            backToReady(out);
        out.status(s.hasSelection() ? "selection cleared" : MODE_READY);
        return next;
    }

    private EditorSession completeEdge(EditorSession s, NodeView target, Output out) {
        EdgeKind kind = s.pendingEdgeKind();
        NodeView source = requireSelected(s);
        boolean changed = graph.connect(source.id(), kind, target.id());

        EditorSession next = new EditorSession(target.id(), null, null);
        redraw(next, out);
        backToReady(out);
        String edge = source.label() + " --" + kind.symbol() + "--> " + target.label();
        out.status(changed ? "connected " + edge : edge + " already connected");
        return next;
    }

    private EditorSession onDragMove(EditorSession s, Position at, Output out) {
        if (s.isBoxSelecting()) {
            EditorSession next = s.boxing(s.box().to(at));
            redraw(next, out);
            return next;
        }
        EditorSession.Drag drag = s.drag();
        if (drag == null)
            return s;
        Position target = at.minus(drag.grab());
        if (isGroupDrag(s, drag)) {
            Position delta = target.minus(require(drag.nodeId()).position());
            for (String id : s.selectedIds())
                graph.moveNode(id, require(id).position().translate(delta.x(), delta.y()));
        } else {
            graph.moveNode(drag.nodeId(), target);
        }
        EditorSession next = s.dragging(drag.markMoved());
        redraw(next, out);
        return next;
    }

    private EditorSession onDragEnd(EditorSession s, Position at, Output out) {
        if (s.isBoxSelecting())
            return finishBox(s, s.box().to(at), out);
        EditorSession.Drag drag = s.drag();
        if (drag == null)
            return s;
        EditorSession next = s.dragging(null);
        if (drag.moved() && isGroupDrag(s, drag)) {
            out.status("moved " + s.selectionSize() + " nodes");
        } else if (drag.moved()) {
            NodeView node = graph.node(drag.nodeId());
            if (node != null)
                out.status("node " + node.label() + " moved to " + node.position());
        }
        return next;
    }

    // ── Commands ─────────────────────────────────────────────────

    private EditorSession onCommand(EditorSession s, EditorCommand command, String label, Output out) {
        if (command == EditorCommand.CANCEL)
            return cancel(s, out);

        EditorSession idle = abandonEdge(s, out);
        switch (command) {
            case ADD_NODE:
                return addNode(idle, label, out);
            case SET_ROOT:
                return setRoot(idle, out);
            case CONNECT_ZERO:
            case CONNECT_ONE:
                return startEdge(idle, command.edgeKind(), out);
            case DELETE_EDGES:
                return deleteEdges(idle, out);
            case DELETE_NODE:
                return deleteNode(idle, out);
            case CLEAR_ALL:
                return clearAll(out);
            case EXPORT:
                out.add(new RenderCommand.RequestFile(FileAction.EXPORT));
                return idle;
            case IMPORT:
                out.add(new RenderCommand.RequestFile(FileAction.IMPORT));
                return idle;
            default:
                throw new IllegalStateException("Unhandled command " + command);
        }
    }

    private EditorSession cancel(EditorSession s, Output out) {
        if (!s.isEdgePending()) {
            out.status(MODE_READY);
            return s;
        }
        EditorSession next = s.idle();
        redraw(next, out);
        backToReady(out);
        out.status("edge connection cancelled");
        return next;
    }

    private EditorSession addNode(EditorSession s, String label, Output out) {
        NodeView anchor = s.hasSelection() ? graph.node(s.selectedNodeId()) : null;
        Position at = anchor != null ? graph.layout().above(anchor.position()) : graph.layout().newNode();
        NodeView node = graph.addDecisionNode(label, at);

        EditorSession next = s.select(node.id());
        redraw(next, out);
        out.status("node " + node.label() + " added");
        return next;
    }

    private EditorSession setRoot(EditorSession s, Output out) {
        NodeView node = selectedOrReject(s, "cannot set root", out);
        if (node == null)
            return s;
        graph.setRoot(node.id());
        redraw(s, out);
        out.status("node " + node.label() + " is now the root");
        return s;
    }

    private EditorSession startEdge(EditorSession s, EdgeKind kind, Output out) {
        NodeView source = selectedOrReject(s, "cannot connect " + kind.symbol() + "-edge", out);
        if (source == null)
            return s;
        if (source.isTerminal()) {
            out.reject(ErrorKind.INVALID_SOURCE, "cannot connect from terminal node " + source.label());
            return s;
        }
        EditorSession next = s.pending(kind);
        redraw(next, out);
        out.add(new RenderCommand.SetCursor(CursorStyle.CROSSHAIR));
        out.add(new RenderCommand.ShowMode(modeLine(next)));
        out.status("click the target of the " + kind.symbol() + "-edge from " + source.label() + " (ESC to cancel)");
        return next;
    }

    private EditorSession deleteEdges(EditorSession s, Output out) {
        NodeView node = selectedOrReject(s, "cannot delete edges", out);
        if (node == null)
            return s;
        int removed = graph.disconnectAll(node.id());
        redraw(s, out);
        out.status(removed > 0
                ? "deleted outgoing edges of " + node.label()
                : "node " + node.label() + " has no outgoing edges");
        return s;
    }

    private EditorSession deleteNode(EditorSession s, Output out) {
        NodeView node = selectedOrReject(s, "cannot delete node", out);
        if (node == null)
            return s;
        if (node.isTerminal()) {
            out.reject(ErrorKind.INVALID_SOURCE, "cannot delete terminal node " + node.label());
            return s;
        }
        graph.removeDecisionNode(node.id());
        EditorSession next = EditorSession.INITIAL;
        redraw(next, out);
        out.status("node " + node.label() + " deleted");
        return next;
    }

    private EditorSession clearAll(Output out) {
        graph.reset();
        EditorSession next = EditorSession.INITIAL;
        redraw(next, out);
        backToReady(out);
        out.status("cleared all decision nodes");
        return next;
    }

    // ── Helpers ──────────────────────────────────────────────────

    /** Leaves EdgePending without a connection, if the session is in it. */
    private EditorSession abandonEdge(EditorSession s, Output out) {
        if (!s.isEdgePending())
            return s;
        backToReady(out);
        return s.idle();
    }

    private NodeView selectedOrReject(EditorSession s, String action, Output out) {
        if (!s.hasSelection()) {
            out.reject(ErrorKind.NO_SELECTION, "no node selected: " + action);
            return null;
        }
        return requireSelected(s);
    }

    private static boolean isGroupDrag(EditorSession s, EditorSession.Drag drag) {
        return s.selectionSize() > 1 && s.isSelected(drag.nodeId());
    }

    private NodeView require(String id) {
        NodeView node = graph.node(id);
        if (node == null)
            throw GraphException.notFound(id);
        return node;
    }

    private static String first(Set<String> ids) {
        return ids.isEmpty() ? null : ids.iterator().next();
    }

    private NodeView requireSelected(EditorSession s) {
        NodeView node = graph.node(s.selectedNodeId());
        if (node == null)
            throw GraphException.notFound(s.selectedNodeId());
        return node;
    }

    /**
     * Falls back to Idle after an unexpected graph error, dropping a selection
     * that no longer resolves.
     */
    private EditorSession recover(EditorSession s, GraphException e, Output out) {
        log.warn("Recovered from graph error ({}): {}", e.kind(), e.getMessage());
        Set<String> live = new LinkedHashSet<>();
        for (String id : s.selectedIds()) {
            if (graph.contains(id))
                live.add(id);
        }
        String primary = live.contains(s.selectedNodeId()) ? s.selectedNodeId() : first(live);
        EditorSession next = new EditorSession(primary, live, null, null, null);
        redraw(next, out);
        backToReady(out);
        out.reject(e.kind(), e.getMessage());
        return next;
    }

    private void redraw(EditorSession s, Output out) {
        out.add(new RenderCommand.Redraw(graph.snapshot(), s.selectedNodeId(), s.selectedIds(), s.box()));
    }

    private static void backToReady(Output out) {
        out.add(new RenderCommand.SetCursor(CursorStyle.NORMAL));
        out.add(new RenderCommand.ShowMode(MODE_READY));
    }

    private String modeLine(EditorSession s) {
        if (s.isBoxSelecting())
            return MODE_BOX;
        if (!s.isEdgePending())
            return MODE_READY;
        NodeView source = graph.node(s.selectedNodeId());
        String from = source != null ? source.label() : s.selectedNodeId();
        return "Connecting " + s.pendingEdgeKind().symbol() + "-edge from '" + from + "'";
    }

    /** Commands collected while handling one event. */
    private static final class Output {
        private final List<RenderCommand> commands = new ArrayList<>();
        private ErrorKind error;

        void add(RenderCommand command) {
            commands.add(command);
        }

        void status(String message) {
            commands.add(new RenderCommand.ShowStatus(message));
        }

        void reject(ErrorKind kind, String message) {
            this.error = kind;
            status(message);
        }

        Transition toTransition(EditorSession session) {
            return new Transition(session, commands, error);
        }
    }
}
