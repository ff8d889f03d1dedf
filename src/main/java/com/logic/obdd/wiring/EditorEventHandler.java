package com.logic.obdd.wiring;

import com.lmax.disruptor.EventHandler;
import com.logic.obdd.ObddEditor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Disruptor EventHandler that feeds ring buffer slots into the editor.
 *
 * Runs on the loop's single consumer thread, which is therefore the only
 * thread that ever touches the graph or the session.
 *
 * Failure Handling:
 * An exception escaping the editor is logged and the event is dropped. It is
 * never rethrown, so the consumer thread stays alive and the next event is
 * processed normally.
 *
 * Lifecycle:
 * {@link #onStart()} runs on the consumer thread once it is live; the loop
 * waits for it before accepting events, so a shutdown right after start still
 * sees the consumer and drains its backlog.
 */
public final class EditorEventHandler implements EventHandler<EditorEvent> {
    private static final Logger log = LogManager.getLogger(EditorEventHandler.class);

    private final ObddEditor editor;
    private volatile long handled;
    private volatile long failed;
    private final CountDownLatch started = new CountDownLatch(1);

    public EditorEventHandler(ObddEditor editor) {
        this.editor = editor;
    }

    @Override
    public void onEvent(EditorEvent event, long sequence, boolean endOfBatch) {
        try {
            if (event.input() == null) {
                log.error("Empty editor event at sequence {}", sequence);
                return;
            }
            editor.handle(event.input());
            handled++;
            if (log.isTraceEnabled()) {
                log.trace("Handled {} at sequence {} in {} us", event.input(), sequence,
                        (System.nanoTime() - event.publishedNanos()) / 1000);
            }
        } catch (Exception e) {
            failed++;
            log.error("Error processing {} at sequence {}: {}", event.input(), sequence, e.getMessage(), e);
        } finally {
            event.clear();
        }
    }

    @Override
    public void onStart() {
        log.debug("Editor consumer thread {} running", Thread.currentThread().getName());
        started.countDown();
    }

    /** @return true if the consumer thread came up within the timeout. */
    boolean awaitStarted(long timeout, TimeUnit unit) throws InterruptedException {
        return started.await(timeout, unit);
    }

    public long handledCount() {
        return handled;
    }

    public long failedCount() {
        return failed;
    }
}
