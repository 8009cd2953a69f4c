package net.kinvault.e2ee.state;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per session id. Operations on the same session are serialized; different sessions proceed in
 * parallel.
 */
public class SessionLocks {
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Acquires the lock of {@code sessionId}. The caller must unlock the returned lock.
     */
    public ReentrantLock lock(String sessionId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock());
            lock.lock();
            // released while we waited
            if (locks.get(sessionId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    /**
     * Forgets the lock of a deleted session. Must be called by the holder of {@code lock}; threads waiting on
     * it retry with a fresh lock. Nested holds keep the entry.
     */
    public void release(String sessionId, ReentrantLock lock) {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalMonitorStateException("Lock of " + sessionId + " not held");
        }
        if (lock.getHoldCount() == 1) {
            locks.remove(sessionId, lock);
        }
    }

    public int size() {
        return locks.size();
    }
}
