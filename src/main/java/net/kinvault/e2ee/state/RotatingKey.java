package net.kinvault.e2ee.state;

import net.kinvault.e2ee.crypto.IdentityKeyPair;

import java.time.Instant;

/**
 * One generation of the device identity key. Exactly one generation is active at a time; inactive
 * generations are retained for decrypting older data until pruned.
 */
public final class RotatingKey {
    private final String id;
    private final IdentityKeyPair keyPair;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final int version;
    private final boolean active;

    public RotatingKey(String id, IdentityKeyPair keyPair, Instant createdAt, Instant expiresAt, int version,
                       boolean active) {
        this.id = id;
        this.keyPair = keyPair;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.version = version;
        this.active = active;
    }

    public static String idForVersion(int version) {
        return "key-v" + version;
    }

    public String getId() {
        return id;
    }

    public IdentityKeyPair getKeyPair() {
        return keyPair;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public int getVersion() {
        return version;
    }

    public boolean isActive() {
        return active;
    }

    public RotatingKey withActive(boolean active) {
        return new RotatingKey(id, keyPair, createdAt, expiresAt, version, active);
    }

    @Override
    public String toString() {
        return "RotatingKey{" + id + ", active=" + active + ", expiresAt=" + expiresAt + "}";
    }
}
