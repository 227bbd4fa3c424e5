package se.escrow_be.service;

import org.springframework.web.socket.TextMessage;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pending frames of one session. At most one drainer holds the outbox at a time, so frames leave
 * in the order they were queued whatever thread runs the drain.
 */
final class SessionOutbox {

    private final Queue<TextMessage> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();

    void offer(TextMessage message) {
        pending.add(message);
    }

    TextMessage poll() {
        return pending.poll();
    }

    boolean hasPending() {
        return !pending.isEmpty();
    }

    void clear() {
        pending.clear();
    }

    /**
     * @return whether the caller became the drainer
     */
    boolean claim() {
        return draining.compareAndSet(false, true);
    }

    void release() {
        draining.set(false);
    }
}
