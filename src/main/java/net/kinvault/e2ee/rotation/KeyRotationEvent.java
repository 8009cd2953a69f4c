package net.kinvault.e2ee.rotation;

import java.time.Instant;

public final class KeyRotationEvent {
    public enum Type {
        STARTED,
        COMPLETED,
        FAILED,
        WARNING
    }

    private final Type type;
    private final String keyId;
    private final int version;
    private final Instant timestamp;
    private final String message;

    public KeyRotationEvent(Type type, String keyId, int version, Instant timestamp, String message) {
        this.type = type;
        this.keyId = keyId;
        this.version = version;
        this.timestamp = timestamp;
        this.message = message;
    }

    public Type getType() {
        return type;
    }

    /**
     * @return the key the event refers to: the new key for {@link Type#COMPLETED}, the active key otherwise
     */
    public String getKeyId() {
        return keyId;
    }

    public int getVersion() {
        return version;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "KeyRotationEvent{" + type + ", " + keyId + ", " + message + "}";
    }
}
