package com.logic.obdd.wiring;

import com.logic.obdd.api.InputEvent;

/**
 * Mutable ring buffer slot carrying one {@link InputEvent} to the editor.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Slots are pre-allocated when the ring buffer is built and reused for the
 * lifetime of the loop. The producer fills a slot with {@link #set}; the
 * consumer reads it and calls {@link #clear()} so the slot does not keep the
 * input (and through it, file paths) reachable.
 */
public final class EditorEvent {
    private InputEvent input;
    private long publishedNanos;

    public void set(InputEvent input, long publishedNanos) {
        this.input = input;
        this.publishedNanos = publishedNanos;
    }

    public InputEvent input() {
        return input;
    }

    public long publishedNanos() {
        return publishedNanos;
    }

    public void clear() {
        input = null;
        publishedNanos = 0;
    }
}
