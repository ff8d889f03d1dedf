package com.logic.obdd.util;

import com.logic.obdd.api.ErrorKind;
import com.logic.obdd.api.InputEvent;
import com.logic.obdd.engine.EditorListener;
import com.logic.obdd.engine.Transition;

import java.util.Arrays;

/**
 * Fans editor callbacks out to several {@link EditorListener}s.
 *
 * Listeners are held in an array that is replaced on every add, so iteration
 * on the event thread never sees a half-updated list.
 */
public class CompositeEditorListener implements EditorListener {
    private volatile EditorListener[] listeners = new EditorListener[0];

    public void add(EditorListener listener) {
        if (listener == null)
            throw new IllegalArgumentException("listener must not be null");
        EditorListener[] old = listeners;
        EditorListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onTransition(long sequence, InputEvent event, Transition transition) {
        for (EditorListener l : listeners)
            l.onTransition(sequence, event, transition);
    }

    @Override
    public void onRejected(long sequence, InputEvent event, ErrorKind kind, String message) {
        for (EditorListener l : listeners)
            l.onRejected(sequence, event, kind, message);
    }
}
