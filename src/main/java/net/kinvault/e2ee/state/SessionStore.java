package net.kinvault.e2ee.state;

import net.kinvault.e2ee.StorageFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Persists sessions through {@link KeyMaterialStore} and keeps recently used ones decoded in memory.
 * <p>
 * Callers must hold the session's lock from {@link SessionLocks} around load / save / delete.
 */
public class SessionStore {
    private final static Logger logger = LoggerFactory.getLogger(SessionStore.class);

    private final KeyMaterialStore keyMaterialStore;
    private final SessionCodec codec;
    private final SessionLocks sessionLocks;
    private final ExpiringCache<String, SessionState> cache;

    public SessionStore(KeyMaterialStore keyMaterialStore, SessionCodec codec, SessionLocks sessionLocks,
                        int cacheCapacity, Duration cacheTtl, Clock clock) {
        this.keyMaterialStore = keyMaterialStore;
        this.codec = codec;
        this.sessionLocks = sessionLocks;
        this.cache = new ExpiringCache<>(cacheCapacity, cacheTtl, clock);
    }

    public SessionCodec getCodec() {
        return codec;
    }

    /**
     * Persists {@code state} and makes it the cached instance. A different previously cached instance for
     * the same session is destroyed.
     */
    public void save(SessionState state) throws StorageFailureException {
        byte[] blob = codec.encode(state);
        try {
            keyMaterialStore.storeSessionBlob(state.getSessionId(), blob);
        } finally {
            Arrays.fill(blob, (byte) 0);
        }
        SessionState previous = cache.remove(state.getSessionId());
        if (previous != null && previous != state) {
            previous.destroy();
        }
        cache.put(state.getSessionId(), state);
    }

    /**
     * @return the stored session, or null if none exists
     */
    public SessionState load(String sessionId) throws StorageFailureException {
        SessionState cached = cache.get(sessionId);
        if (cached != null) {
            return cached;
        }
        byte[] blob = keyMaterialStore.loadSessionBlob(sessionId);
        if (blob == null) {
            return null;
        }
        try {
            SessionState state = codec.decode(blob);
            cache.put(sessionId, state);
            return state;
        } finally {
            Arrays.fill(blob, (byte) 0);
        }
    }

    public boolean contains(String sessionId) throws StorageFailureException {
        return cache.get(sessionId) != null || keyMaterialStore.loadSessionBlob(sessionId) != null;
    }

    public void delete(String sessionId) throws StorageFailureException {
        SessionState cached = cache.remove(sessionId);
        if (cached != null) {
            cached.destroy();
        }
        keyMaterialStore.removeSessionBlob(sessionId);
        logger.debug("Deleted session {}", sessionId);
    }

    public List<String> loadSessionIds() throws StorageFailureException {
        return keyMaterialStore.loadSessionIds();
    }

    public List<SessionState> loadAll() throws StorageFailureException {
        List<SessionState> sessions = new ArrayList<>();
        for (String sessionId : loadSessionIds()) {
            SessionState state = load(sessionId);
            if (state != null) {
                sessions.add(state);
            }
        }
        return sessions;
    }

    /**
     * Destroys all decoded sessions; subsequent loads read from storage again. Takes each session's lock in turn,
     * so it must not be called while holding a different session's lock.
     */
    public void invalidateCache() {
        int dropped = 0;
        for (String sessionId : cache.keys()) {
            ReentrantLock lock = sessionLocks.lock(sessionId);
            try {
                SessionState cached = cache.remove(sessionId);
                if (cached != null) {
                    cached.destroy();
                    dropped++;
                }
            } finally {
                lock.unlock();
            }
        }
        logger.debug("Session cache invalidated, {} sessions destroyed", dropped);
    }

    public int tick() {
        return cache.tick();
    }

    public int getCachedCount() {
        return cache.size();
    }
}
