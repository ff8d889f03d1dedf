package com.logic.obdd.api;

import java.nio.file.Path;

/**
 * User input delivered by the render adapter to the editor.
 *
 * Pointer events carry canvas coordinates only; hit testing against nodes is
 * done by the editor, so adapters need no knowledge of the diagram.
 */
public sealed interface InputEvent {

    /**
     * A press and release without movement.
     *
     * @param additive shift held: toggles the node in the selection instead of
     *                 replacing it.
     */
    record Click(Position at, boolean additive) implements InputEvent {
        public Click(Position at) {
            this(at, false);
        }
    }

    /**
     * Pointer pressed; may become a drag. On empty canvas it starts a
     * selection box.
     *
     * @param additive shift held: toggles a pressed node, or adds the boxed
     *                 nodes to the current selection.
     */
    record DragStart(Position at, boolean additive) implements InputEvent {
        public DragStart(Position at) {
            this(at, false);
        }
    }

    record DragMove(Position at) implements InputEvent {
    }

    record DragEnd(Position at) implements InputEvent {
    }

    /**
     * A raw key, translated through the key bindings. Use
     * {@link KeyPress#ESCAPE} and {@link KeyPress#DELETE} for the non-printing
     * keys.
     */
    record KeyPress(char key) implements InputEvent {
        public static final char ESCAPE = '\u001b';
        public static final char DELETE = '\u007f';
    }

    /**
     * A command from a button or menu.
     *
     * @param label optional variable name for {@link EditorCommand#ADD_NODE};
     *              null or blank means "allocate the next one".
     */
    record Command(EditorCommand command, String label) implements InputEvent {
        public Command(EditorCommand command) {
            this(command, null);
        }
    }

    /** The user chose a file to export to. */
    record ExportTo(Path path) implements InputEvent {
    }

    /** The user chose a file to import from. */
    record ImportFrom(Path path) implements InputEvent {
    }
}
