package com.roomsnap.collab.network;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Unbounded FIFO of envelopes waiting for a connection.
 * Drained strictly in enqueue order; never reordered.
 */
public class OutboundQueue {
    private final Deque<CollaborationMessage> pending = new ArrayDeque<>();
    
    public synchronized void enqueue(CollaborationMessage message) {
        pending.addLast(message);
    }
    
    /**
     * Hands queued envelopes to a sender, oldest first. The head is removed
     * only once the sender accepts it; the first refusal stops the drain and
     * leaves that envelope at the head.
     * @param sender Returns true if the envelope was written.
     * @return The number of envelopes delivered.
     */
    public synchronized int drain(Predicate<CollaborationMessage> sender) {
        int delivered = 0;
        while (!pending.isEmpty()) {
            if (!sender.test(pending.peekFirst())) {
                break;
            }
            pending.removeFirst();
            delivered++;
        }
        return delivered;
    }
    
    public synchronized List<CollaborationMessage> snapshot() {
        return new ArrayList<>(pending);
    }
    
    public synchronized int size() {
        return pending.size();
    }
    
    public synchronized boolean isEmpty() {
        return pending.isEmpty();
    }
    
    public synchronized void clear() {
        pending.clear();
    }
}
