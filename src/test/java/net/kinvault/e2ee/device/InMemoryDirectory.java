package net.kinvault.e2ee.device;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class InMemoryDirectory implements Directory {
    private final Map<String, Map<String, DeviceRecord>> devices = new HashMap<>();
    private final List<String> consumed = new ArrayList<>();
    private volatile boolean failFetch;
    private volatile boolean failPublish;
    private int publishCount;

    @Override
    public synchronized void publishDeviceBundle(String userId, DeviceRecord record) throws IOException {
        if (failPublish) {
            throw new IOException("directory offline");
        }
        put(userId, record);
        publishCount++;
    }

    @Override
    public synchronized List<DeviceRecord> fetchDeviceBundles(String userId) throws IOException {
        if (failFetch) {
            throw new IOException("directory offline");
        }
        Map<String, DeviceRecord> records = devices.get(userId);
        return records == null ? new ArrayList<>() : new ArrayList<>(records.values());
    }

    @Override
    public synchronized void consumeOneTimePreKey(String userId, String deviceId, int keyId) {
        DeviceRecord record = devices.get(userId).get(deviceId);
        devices.get(userId).put(deviceId, record.withoutOneTimePreKey(keyId));
        consumed.add(userId + ":" + deviceId + ":" + keyId);
    }

    /**
     * Registers a record directly, bypassing failure injection.
     */
    public synchronized void put(String userId, DeviceRecord record) {
        devices.computeIfAbsent(userId, id -> new LinkedHashMap<>()).put(record.getDeviceId(), record);
    }

    public synchronized DeviceRecord get(String userId, String deviceId) {
        Map<String, DeviceRecord> records = devices.get(userId);
        return records == null ? null : records.get(deviceId);
    }

    public synchronized List<String> getConsumed() {
        return new ArrayList<>(consumed);
    }

    public synchronized int getPublishCount() {
        return publishCount;
    }

    public void setFailFetch(boolean failFetch) {
        this.failFetch = failFetch;
    }

    public void setFailPublish(boolean failPublish) {
        this.failPublish = failPublish;
    }
}
