package net.kinvault.e2ee.state.impl;

import net.kinvault.e2ee.state.SecureKeyStorage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class InMemorySecureKeyStorage implements SecureKeyStorage {

    private final Map<String, byte[]> values = new HashMap<>();

    public InMemorySecureKeyStorage() {}

    @Override
    public synchronized void set(String key, byte[] value) {
        byte[] previous = values.put(key, value.clone());
        if (previous != null) {
            Arrays.fill(previous, (byte) 0);
        }
    }

    @Override
    public synchronized byte[] get(String key) {
        byte[] value = values.get(key);
        return value == null ? null : value.clone();
    }

    @Override
    public synchronized void delete(String key) {
        byte[] previous = values.remove(key);
        if (previous != null) {
            Arrays.fill(previous, (byte) 0);
        }
    }

    @Override
    public synchronized List<String> keys(String prefix) {
        List<String> keys = new ArrayList<>();
        for (String key : values.keySet()) {
            if (key.startsWith(prefix)) {
                keys.add(key);
            }
        }
        return keys;
    }

    public synchronized int size() {
        return values.size();
    }
}
