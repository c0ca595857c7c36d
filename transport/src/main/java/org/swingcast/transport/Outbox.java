package org.swingcast.transport;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * FIFO of serialized messages waiting for a live connection. A drained payload is gone:
 * there is no second delivery attempt.
 */
public final class Outbox {

    private final Deque<byte[]> queue = new ArrayDeque<>();

    public synchronized void enqueue(byte[] payload) {
        queue.addLast(Objects.requireNonNull(payload, "payload"));
    }

    /**
     * Hands every queued payload to {@code sink} in enqueue order and leaves the outbox empty.
     *
     * @return number of payloads handed over
     */
    public synchronized int drainTo(Consumer<byte[]> sink) {
        int n = 0;
        byte[] next;
        while ((next = queue.pollFirst()) != null) {
            sink.accept(next);
            n++;
        }
        return n;
    }

    public synchronized int size() {
        return queue.size();
    }

    public synchronized boolean isEmpty() {
        return queue.isEmpty();
    }

    public synchronized void clear() {
        queue.clear();
    }
}
