package net.kinvault.e2ee.state;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Bounded map whose entries expire a fixed time after insertion.
 * <p>
 * Iteration order is insertion order, so the first entry is always the oldest. Overflow evicts oldest
 * first on insertion; expiry is applied lazily on lookup and in bulk by {@link #tick()}. Every entry
 * leaving the cache other than through {@link #remove(Object)} is handed to the eviction listener.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class ExpiringCache<K, V> {
    private final int capacity;
    private final Duration ttl;
    private final Clock clock;
    private final BiConsumer<K, V> evictionListener;
    private final LinkedHashMap<K, Entry<V>> entries = new LinkedHashMap<>();

    public ExpiringCache(int capacity, Duration ttl, Clock clock) {
        this(capacity, ttl, clock, (key, value) -> {});
    }

    public ExpiringCache(int capacity, Duration ttl, Clock clock, BiConsumer<K, V> evictionListener) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.ttl = ttl;
        this.clock = clock;
        this.evictionListener = evictionListener;
    }

    public synchronized void put(K key, V value) {
        putAt(key, value, clock.millis());
    }

    /**
     * Inserts with an explicit insertion time, used when restoring persisted entries in age order.
     */
    public synchronized void putAt(K key, V value, long timestamp) {
        Entry<V> previous = entries.remove(key);
        if (previous != null && previous.value != value) {
            evictionListener.accept(key, previous.value);
        }
        entries.put(key, new Entry<>(value, timestamp));
        while (entries.size() > capacity) {
            Iterator<Map.Entry<K, Entry<V>>> oldest = entries.entrySet().iterator();
            Map.Entry<K, Entry<V>> evicted = oldest.next();
            oldest.remove();
            evictionListener.accept(evicted.getKey(), evicted.getValue().value);
        }
    }

    /**
     * @return the live value, or null if absent or expired
     */
    public synchronized V get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry, clock.millis())) {
            entries.remove(key);
            evictionListener.accept(key, entry.value);
            return null;
        }
        return entry.value;
    }

    public synchronized V remove(K key) {
        Entry<V> entry = entries.remove(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry, clock.millis())) {
            evictionListener.accept(key, entry.value);
            return null;
        }
        return entry.value;
    }

    public synchronized boolean containsKey(K key) {
        return get(key) != null;
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Drops every expired entry.
     *
     * @return number of entries dropped
     */
    public synchronized int purgeExpired() {
        long now = clock.millis();
        int purged = 0;
        Iterator<Map.Entry<K, Entry<V>>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<K, Entry<V>> entry = iterator.next();
            if (isExpired(entry.getValue(), now)) {
                iterator.remove();
                evictionListener.accept(entry.getKey(), entry.getValue().value);
                purged++;
            }
        }
        return purged;
    }

    /**
     * Periodic cleanup entry point.
     */
    public int tick() {
        return purgeExpired();
    }

    public synchronized void clear() {
        for (Map.Entry<K, Entry<V>> entry : entries.entrySet()) {
            evictionListener.accept(entry.getKey(), entry.getValue().value);
        }
        entries.clear();
    }

    public synchronized List<K> keys() {
        return new ArrayList<>(entries.keySet());
    }

    /**
     * Visits live entries oldest first with their insertion timestamps.
     */
    public synchronized void forEach(EntryVisitor<K, V> visitor) {
        for (Map.Entry<K, Entry<V>> entry : entries.entrySet()) {
            visitor.visit(entry.getKey(), entry.getValue().value, entry.getValue().timestamp);
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public Duration getTtl() {
        return ttl;
    }

    private boolean isExpired(Entry<V> entry, long now) {
        return now - entry.timestamp > ttl.toMillis();
    }

    public interface EntryVisitor<K, V> {
        void visit(K key, V value, long timestamp);
    }

    private static final class Entry<V> {
        private final V value;
        private final long timestamp;

        private Entry(V value, long timestamp) {
            this.value = value;
            this.timestamp = timestamp;
        }
    }
}
