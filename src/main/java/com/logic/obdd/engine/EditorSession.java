package com.logic.obdd.engine;

import com.logic.obdd.api.EdgeKind;
import com.logic.obdd.api.Position;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Interaction state that is not part of the diagram itself.
 *
 * Immutable; the state machine takes one session and returns the next. The
 * mode is derived from {@code pendingEdgeKind}: null means Idle, otherwise the
 * editor waits for the target of an edge of that kind.
 *
 * Selection:
 * {@code selectedIds} is every highlighted node, in the order they were
 * selected. {@code selectedNodeId} is the primary one that commands act on; it
 * is always a member of {@code selectedIds} when set.
 *
 * @param selectedNodeId  the primary selection, or null.
 * @param selectedIds     all selected nodes, never null.
 * @param pendingEdgeKind the edge kind waiting for a target, or null.
 * @param drag            the node being dragged, or null.
 * @param box             the selection rectangle being drawn, or null.
 */
public record EditorSession(String selectedNodeId, Set<String> selectedIds, EdgeKind pendingEdgeKind, Drag drag,
        Box box) {

    public static final EditorSession INITIAL = new EditorSession(null, null, null);

    public EditorSession {
        Set<String> ids = new LinkedHashSet<>();
        if (selectedIds != null)
            ids.addAll(selectedIds);
        if (selectedNodeId != null)
            ids.add(selectedNodeId);
        selectedIds = Collections.unmodifiableSet(ids);
    }

    /** A session with at most one selected node and no box. */
    public EditorSession(String selectedNodeId, EdgeKind pendingEdgeKind, Drag drag) {
        this(selectedNodeId, null, pendingEdgeKind, drag, null);
    }

    /** The two interaction modes. */
    public enum Mode {
        IDLE,
        EDGE_PENDING
    }

    /**
     * Drag sub-state.
     *
     * @param nodeId node being moved. When it is part of a multi-node
     *               selection the whole selection follows it.
     * @param grab   pointer position minus node centre at drag start, so the
     *               node does not jump under the pointer.
     * @param moved  whether any move happened since the drag started.
     */
    public record Drag(String nodeId, Position grab, boolean moved) {
        public Drag markMoved() {
            return moved ? this : new Drag(nodeId, grab, true);
        }
    }

    /**
     * Rubber-band selection sub-state, started by a press on empty canvas.
     *
     * @param anchor   where the press happened.
     * @param corner   the current pointer position.
     * @param additive whether the nodes inside are added to the selection
     *                 held when the box started instead of replacing it.
     */
    public record Box(Position anchor, Position corner, boolean additive) {
        public Box to(Position corner) {
            return new Box(anchor, corner, additive);
        }

        /** Whether a point lies inside the rectangle, borders included. */
        public boolean contains(Position p) {
            return p.x() >= Math.min(anchor.x(), corner.x()) && p.x() <= Math.max(anchor.x(), corner.x())
                    && p.y() >= Math.min(anchor.y(), corner.y()) && p.y() <= Math.max(anchor.y(), corner.y());
        }
    }

    public Mode mode() {
        return pendingEdgeKind == null ? Mode.IDLE : Mode.EDGE_PENDING;
    }

    public boolean isEdgePending() {
        return pendingEdgeKind != null;
    }

    public boolean hasSelection() {
        return selectedNodeId != null;
    }

    public boolean isSelected(String nodeId) {
        return selectedIds.contains(nodeId);
    }

    public int selectionSize() {
        return selectedIds.size();
    }

    public boolean isDragging() {
        return drag != null;
    }

    public boolean isBoxSelecting() {
        return box != null;
    }

    /** Selects exactly one node, or nothing for null. */
    public EditorSession select(String nodeId) {
        return new EditorSession(nodeId, null, pendingEdgeKind, drag, box);
    }

    /** Replaces the selection; {@code primary} must be null or one of {@code ids}. */
    public EditorSession select(String primary, Set<String> ids) {
        return new EditorSession(primary, ids, pendingEdgeKind, drag, box);
    }

    /** Makes an already selected node the primary one. */
    public EditorSession focus(String nodeId) {
        return new EditorSession(nodeId, selectedIds, pendingEdgeKind, drag, box);
    }

    public EditorSession pending(EdgeKind kind) {
        return new EditorSession(selectedNodeId, selectedIds, kind, drag, box);
    }

    /** Leaves the edge-pending mode, keeping the selection. */
    public EditorSession idle() {
        return new EditorSession(selectedNodeId, selectedIds, null, drag, box);
    }

    public EditorSession dragging(Drag drag) {
        return new EditorSession(selectedNodeId, selectedIds, pendingEdgeKind, drag, box);
    }

    public EditorSession boxing(Box box) {
        return new EditorSession(selectedNodeId, selectedIds, pendingEdgeKind, drag, box);
    }
}
