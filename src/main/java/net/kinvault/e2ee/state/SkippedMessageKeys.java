package net.kinvault.e2ee.state;

import net.kinvault.e2ee.crypto.SecretBytes;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;

/**
 * Message keys derived ahead of time for messages that have not arrived yet, keyed by
 * (sender ratchet key, index). Bounded in size and lifetime; evicted keys are wiped.
 */
public final class SkippedMessageKeys {
    private final ExpiringCache<KeyId, SecretBytes> cache;
    private final Clock clock;

    public SkippedMessageKeys(int capacity, Duration lifetime, Clock clock) {
        this.clock = clock;
        this.cache = new ExpiringCache<>(capacity, lifetime, clock, (id, key) -> key.destroy());
    }

    public void store(byte[] ratchetKey, int index, SecretBytes messageKey) {
        cache.put(new KeyId(ratchetKey, index), messageKey);
    }

    void restore(byte[] ratchetKey, int index, SecretBytes messageKey, long timestamp) {
        cache.putAt(new KeyId(ratchetKey, index), messageKey, timestamp);
    }

    /**
     * Removes and returns the key for (ratchetKey, index); the caller owns and must destroy it.
     */
    public SecretBytes take(byte[] ratchetKey, int index) {
        return cache.remove(new KeyId(ratchetKey, index));
    }

    public boolean contains(byte[] ratchetKey, int index) {
        return cache.containsKey(new KeyId(ratchetKey, index));
    }

    public int size() {
        return cache.size();
    }

    public int purgeExpired() {
        return cache.purgeExpired();
    }

    public int getCapacity() {
        return cache.getCapacity();
    }

    public Duration getLifetime() {
        return cache.getTtl();
    }

    public SkippedMessageKeys copy() {
        SkippedMessageKeys copy = new SkippedMessageKeys(cache.getCapacity(), cache.getTtl(), clock);
        cache.forEach((id, key, timestamp) -> copy.cache.putAt(id, key.duplicate(), timestamp));
        return copy;
    }

    void forEach(Visitor visitor) {
        cache.forEach((id, key, timestamp) -> visitor.visit(id.ratchetKey.clone(), id.index, key, timestamp));
    }

    public void destroy() {
        cache.clear();
    }

    interface Visitor {
        void visit(byte[] ratchetKey, int index, SecretBytes messageKey, long timestamp);
    }

    private static final class KeyId {
        private final byte[] ratchetKey;
        private final int index;

        private KeyId(byte[] ratchetKey, int index) {
            this.ratchetKey = ratchetKey.clone();
            this.index = index;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) return true;
            if (!(other instanceof KeyId)) return false;
            KeyId that = (KeyId) other;
            return index == that.index && Arrays.equals(ratchetKey, that.ratchetKey);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(ratchetKey) + index;
        }

        @Override
        public String toString() {
            return Base64.getEncoder().encodeToString(ratchetKey) + "-" + index;
        }
    }
}
