package com.amblue.agent.stream;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded, ordered channel between one running loop (producer) and one reader.
 *
 * - {@link #emit} waits while the queue is full, so a slow reader slows the loop down
 * - {@link #complete} marks the end; the reader's {@link #hasNext} then returns false
 * - {@link #cancel} is the reader walking away: pending events are dropped, further
 *   emits are refused, and the loop sees {@link #isCancelled()} before its next model call
 */
public class AgentEventStream implements Iterator<AgentEvent> {

    private static final long OFFER_POLL_MS = 100;

    private static final AgentEvent END = new AgentEvent(null, null, null, null);

    private final BlockingQueue<AgentEvent> queue;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean completed = new AtomicBoolean();

    private AgentEvent next;
    private boolean finished;

    public AgentEventStream(int capacity) {
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    /**
     * @return false when the event was not delivered because the stream is cancelled or complete
     */
    public boolean emit(AgentEvent event) {
        if (cancelled.get() || completed.get()) {
            return false;
        }
        try {
            while (!queue.offer(event, OFFER_POLL_MS, TimeUnit.MILLISECONDS)) {
                if (cancelled.get()) return false;
            }
            return !cancelled.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return false;
        }
    }

    /** Producer is done. Safe to call more than once. */
    public void complete() {
        if (!completed.compareAndSet(false, true)) return;
        try {
            while (!queue.offer(END, OFFER_POLL_MS, TimeUnit.MILLISECONDS)) {
                if (cancelled.get()) return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
        }
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) return;
        // a producer may slip one event in between clear and offer
        do {
            queue.clear();
        } while (!queue.offer(END));
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public boolean hasNext() {
        if (next != null) return true;
        if (finished) return false;
        if (cancelled.get()) {
            finished = true;
            return false;
        }

        AgentEvent item;
        try {
            item = queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            finished = true;
            return false;
        }

        if (item == END || cancelled.get()) {
            finished = true;
            return false;
        }
        next = item;
        return true;
    }

    @Override
    public AgentEvent next() {
        if (!hasNext()) throw new NoSuchElementException();
        AgentEvent event = next;
        next = null;
        return event;
    }
}
