package net.kinvault.e2ee.device;

import java.io.IOException;
import java.util.List;

/**
 * Remote registry of device bundles.
 */
public interface Directory {
    void publishDeviceBundle(String userId, DeviceRecord record) throws IOException;

    /**
     * @return every registered device of {@code userId}; empty if the user is unknown
     */
    List<DeviceRecord> fetchDeviceBundles(String userId) throws IOException;

    /**
     * Marks a one-time pre-key as used so it is not handed out again.
     */
    void consumeOneTimePreKey(String userId, String deviceId, int keyId) throws IOException;
}
