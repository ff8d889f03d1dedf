package com.logic.obdd.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.logic.obdd.ObddEditor;
import com.logic.obdd.api.InputEvent;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.TimeUnit;

/**
 * Serializes user input onto a single editor thread.
 *
 * The GUI thread publishes {@link InputEvent}s; one Disruptor consumer
 * thread takes them off the ring buffer in order and runs them through the
 * {@link ObddEditor}. The editor needs no locking because nothing else calls
 * it.
 *
 * Producer Model:
 * {@link ProducerType#SINGLE}. Only one thread (the Swing event dispatch
 * thread in the application, the test thread in tests) may call
 * {@link #publish}.
 *
 * Wait Strategy:
 * {@link BlockingWaitStrategy}. Input arrives at human speed; the consumer
 * parks instead of spinning.
 */
public final class EditorEventLoop implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(EditorEventLoop.class);
    private static final long START_TIMEOUT_SECONDS = 5;

    private final Disruptor<EditorEvent> disruptor;
    private final EditorEventHandler handler;
    private volatile RingBuffer<EditorEvent> ringBuffer;

    /**
     * @param bufferSize ring buffer size, a power of two.
     * @throws IllegalArgumentException if the size is not a power of two.
     */
    public EditorEventLoop(ObddEditor editor, int bufferSize) {
        this.disruptor = new Disruptor<>(
                EditorEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        this.handler = new EditorEventHandler(editor);
        disruptor.handleEventsWith(handler);
    }

    /**
     * Starts the consumer thread and returns once it is processing.
     *
     * @throws IllegalStateException if already started.
     */
    public synchronized EditorEventLoop start() {
        if (ringBuffer != null)
            throw new IllegalStateException("Event loop already started");
        RingBuffer<EditorEvent> rb = disruptor.start();
        try {
            if (!handler.awaitStarted(START_TIMEOUT_SECONDS, TimeUnit.SECONDS))
                log.warn("Editor consumer thread not running after {} s", START_TIMEOUT_SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the editor consumer thread");
        }
        ringBuffer = rb;
        log.info("Editor event loop started (buffer size {})", rb.getBufferSize());
        return this;
    }

    /**
     * Queues an event for the editor thread. Blocks only if the ring buffer is
     * full.
     *
     * @throws IllegalStateException if the loop has not been started.
     */
    public void publish(InputEvent input) {
        RingBuffer<EditorEvent> rb = ringBuffer;
        if (rb == null)
            throw new IllegalStateException("Event loop not started");
        long sequence = rb.next();
        try {
            rb.get(sequence).set(input, System.nanoTime());
        } finally {
            rb.publish(sequence);
        }
    }

    public long handledCount() {
        return handler.handledCount();
    }

    public long failedCount() {
        return handler.failedCount();
    }

    /** Drains every published event, then stops the consumer thread. */
    @Override
    public synchronized void close() {
        if (ringBuffer == null)
            return;
        disruptor.shutdown();
        log.info("Editor event loop stopped after {} events ({} failed)", handledCount(), failedCount());
        ringBuffer = null;
    }
}
