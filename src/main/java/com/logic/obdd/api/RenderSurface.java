package com.logic.obdd.api;

/**
 * Drawing and feedback surface the editor core renders onto.
 *
 * The core never talks to a GUI toolkit directly. After every state-changing
 * event it repaints the whole diagram as one frame of primitive calls:
 *
 * <pre>
 * beginFrame()
 *   drawEdge(...)            once per edge, edges first so nodes cover them
 *   drawDecisionNode(...)    circles with the variable label
 *   drawTerminalNode(...)    squares labelled "0" / "1"
 *   drawRootIndicator(...)   arrow pointing at the root, if one is set
 *   drawSelectionBox(...)    rubber band while box-selecting
 * endFrame()
 * </pre>
 *
 * Threading:
 * Calls arrive on the editor's event thread. Implementations backed by a GUI
 * toolkit must hand the frame over to their own UI thread; the arguments are
 * immutable values and may be retained.
 */
public interface RenderSurface {

    /** Starts a new frame; everything drawn before is discarded on {@link #endFrame()}. */
    void beginFrame();

    /** A circle of the decision radius centred on {@code center}. */
    void drawDecisionNode(Position center, String label, boolean selected);

    /** A square of the terminal size centred on {@code center}. */
    void drawTerminalNode(Position center, String label, boolean selected);

    /**
     * An arrowed line from {@code from} to {@code to}, already clipped to the
     * node outlines. Solid for {@link EdgeKind#ONE}, dashed for
     * {@link EdgeKind#ZERO}.
     */
    void drawEdge(Position from, Position to, EdgeKind kind);

    /** An arrow from {@code tail} to {@code tip} marking the root node. */
    void drawRootIndicator(Position tail, Position tip);

    /** The rectangle spanned by two opposite corners, drawn over everything else. */
    void drawSelectionBox(Position corner, Position opposite);

    /** Publishes the frame started by {@link #beginFrame()}. */
    void endFrame();

    void setCursor(CursorStyle style);

    /** Short human-readable feedback, e.g. "connected p --1--> q". */
    void showStatus(String message);

    /** Current interaction mode, e.g. "Ready" or "Connecting 1-edge from 'p'". */
    void showMode(String mode);

    /**
     * Asks the user for a file. The answer, if any, comes back later as an
     * {@link InputEvent.ExportTo} or {@link InputEvent.ImportFrom} event.
     */
    void requestFile(FileAction action);
}
