package org.swingcast.session;

import org.swingcast.session.media.IceCandidate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Remote candidates that arrived before a remote description was applied. Owned by the
 * negotiation executor, so not thread-safe.
 */
public final class PendingCandidateBuffer {

    private final Deque<IceCandidate> queue = new ArrayDeque<>();

    public void add(IceCandidate candidate) {
        queue.addLast(Objects.requireNonNull(candidate, "candidate"));
    }

    /** Removes and returns every buffered candidate in arrival order. */
    public List<IceCandidate> drain() {
        List<IceCandidate> out = new ArrayList<>(queue);
        queue.clear();
        return out;
    }

    public void clear() {
        queue.clear();
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
