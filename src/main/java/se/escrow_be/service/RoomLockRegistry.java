package se.escrow_be.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per room phrase. Every writer of a room runs inside {@link #withRoomLock}, so
 * the second of two racing intents sees the state the first one committed.
 * <p>
 * An entry lives only while some thread holds or waits for it; the last one out removes it.
 * Holder counts change only inside the map's atomic sections, so a waiter can never end up on
 * a lock that has already been evicted.
 */
@Component
public class RoomLockRegistry {

    private final Map<String, RoomLock> locks = new ConcurrentHashMap<>();

    public <T> T withRoomLock(String roomPhrase, Supplier<T> action) {
        RoomLock roomLock = locks.compute(roomPhrase, (phrase, existing) -> {
            RoomLock target = existing != null ? existing : new RoomLock();
            target.users++;
            return target;
        });
        roomLock.lock.lock();
        try {
            return action.get();
        } finally {
            roomLock.lock.unlock();
            locks.computeIfPresent(roomPhrase, (phrase, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    /**
     * Rooms with a current holder or waiter.
     */
    public int activeLockCount() {
        return locks.size();
    }

    private static final class RoomLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        // Guarded by the map's per-key atomicity
        private int users;
    }
}
