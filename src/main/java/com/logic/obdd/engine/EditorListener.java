package com.logic.obdd.engine;

import com.logic.obdd.api.ErrorKind;
import com.logic.obdd.api.InputEvent;

/**
 * Observability hook for the editor's event processing.
 *
 * Callbacks run on the editor's event thread, after the transition has been
 * applied and its render commands dispatched. Keep them cheap.
 */
public interface EditorListener {

    /**
     * Called once per processed event.
     *
     * @param sequence   running count of events handled by this editor.
     * @param event      the input.
     * @param transition what the event did.
     */
    void onTransition(long sequence, InputEvent event, Transition transition);

    /**
     * Called in addition to {@link #onTransition} when the event was refused
     * (no selection, terminal source, bad import file, ...).
     */
    void onRejected(long sequence, InputEvent event, ErrorKind kind, String message);
}
