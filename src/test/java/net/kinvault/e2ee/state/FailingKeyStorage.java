package net.kinvault.e2ee.state;

import net.kinvault.e2ee.StorageFailureException;
import net.kinvault.e2ee.state.impl.InMemorySecureKeyStorage;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory storage that refuses writes to chosen keys.
 */
public class FailingKeyStorage implements SecureKeyStorage {

    private final InMemorySecureKeyStorage delegate = new InMemorySecureKeyStorage();
    private final Set<String> failingKeys = new HashSet<>();

    public synchronized void failWritesTo(String key) {
        failingKeys.add(key);
    }

    public synchronized void clearFailures() {
        failingKeys.clear();
    }

    @Override
    public void set(String key, byte[] value) throws StorageFailureException {
        synchronized (this) {
            if (failingKeys.contains(key)) {
                throw new StorageFailureException("Write to " + key + " refused");
            }
        }
        delegate.set(key, value);
    }

    @Override
    public byte[] get(String key) {
        return delegate.get(key);
    }

    @Override
    public void delete(String key) {
        delegate.delete(key);
    }

    @Override
    public List<String> keys(String prefix) {
        return delegate.keys(prefix);
    }
}
