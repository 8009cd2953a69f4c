package net.kinvault.e2ee.device;

import net.kinvault.e2ee.crypto.IdentityKey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Public bundle a device publishes to the directory so that peers can start sessions with it offline.
 */
public final class DeviceRecord {
    private final String deviceId;
    private final String deviceName;
    private final IdentityKey identityKey;
    private final SignedPreKey signedPreKey;
    private final List<PreKey> oneTimePreKeys;
    private final int registrationId;
    private final Instant registeredAt;
    private final Instant lastSeenAt;

    public DeviceRecord(String deviceId, String deviceName, IdentityKey identityKey, SignedPreKey signedPreKey,
                        List<PreKey> oneTimePreKeys, int registrationId, Instant registeredAt, Instant lastSeenAt) {
        this.deviceId = deviceId;
        this.deviceName = deviceName;
        this.identityKey = identityKey;
        this.signedPreKey = signedPreKey;
        this.oneTimePreKeys = Collections.unmodifiableList(new ArrayList<>(oneTimePreKeys));
        this.registrationId = registrationId;
        this.registeredAt = registeredAt;
        this.lastSeenAt = lastSeenAt;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public IdentityKey getIdentityKey() {
        return identityKey;
    }

    /**
     * @return the signed pre-key, or null if the device has not published one
     */
    public SignedPreKey getSignedPreKey() {
        return signedPreKey;
    }

    public List<PreKey> getOneTimePreKeys() {
        return oneTimePreKeys;
    }

    public int getRegistrationId() {
        return registrationId;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    /**
     * Copy of this record with the given one-time pre-key removed.
     */
    public DeviceRecord withoutOneTimePreKey(int keyId) {
        List<PreKey> remaining = new ArrayList<>();
        for (PreKey preKey : oneTimePreKeys) {
            if (preKey.getId() != keyId) {
                remaining.add(preKey);
            }
        }
        return new DeviceRecord(deviceId, deviceName, identityKey, signedPreKey, remaining, registrationId,
            registeredAt, lastSeenAt);
    }

    @Override
    public String toString() {
        return "DeviceRecord{" + deviceId + ", " + deviceName + ", oneTimePreKeys=" + oneTimePreKeys.size() + "}";
    }
}
