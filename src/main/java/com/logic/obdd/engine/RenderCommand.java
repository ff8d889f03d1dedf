package com.logic.obdd.engine;

import com.logic.obdd.api.CursorStyle;
import com.logic.obdd.api.FileAction;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Instructions a transition emits for the render surface.
 *
 * Kept as plain values so that tests can assert on them without a display.
 */
public sealed interface RenderCommand {

    /**
     * Repaint the whole diagram.
     *
     * @param selectedNodeId primary selection, may be null.
     * @param selectedIds    every highlighted node; includes the primary one.
     * @param box            selection rectangle in progress, or null.
     */
    record Redraw(GraphView view, String selectedNodeId, Set<String> selectedIds, EditorSession.Box box)
            implements RenderCommand {
        public Redraw {
            Set<String> ids = new LinkedHashSet<>();
            if (selectedIds != null)
                ids.addAll(selectedIds);
            if (selectedNodeId != null)
                ids.add(selectedNodeId);
            selectedIds = Collections.unmodifiableSet(ids);
        }

        public Redraw(GraphView view, String selectedNodeId) {
            this(view, selectedNodeId, null, null);
        }

        public boolean isSelected(String nodeId) {
            return selectedIds.contains(nodeId);
        }
    }

    record SetCursor(CursorStyle style) implements RenderCommand {
    }

    record ShowStatus(String message) implements RenderCommand {
    }

    record ShowMode(String mode) implements RenderCommand {
    }

    /** Ask the user for a file to export to or import from. */
    record RequestFile(FileAction action) implements RenderCommand {
    }
}
