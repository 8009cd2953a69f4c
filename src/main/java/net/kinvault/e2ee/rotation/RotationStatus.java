package net.kinvault.e2ee.rotation;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of the rotation schedule. Key fields are null in state {@link RotationState#NO_KEY}.
 */
public final class RotationStatus {
    private final RotationState state;
    private final String activeKeyId;
    private final int activeVersion;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final Duration timeUntilRotation;
    private final int retainedKeyCount;
    private final boolean rotationPending;

    public RotationStatus(RotationState state, String activeKeyId, int activeVersion, Instant createdAt,
                          Instant expiresAt, Duration timeUntilRotation, int retainedKeyCount, boolean rotationPending) {
        this.state = state;
        this.activeKeyId = activeKeyId;
        this.activeVersion = activeVersion;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.timeUntilRotation = timeUntilRotation;
        this.retainedKeyCount = retainedKeyCount;
        this.rotationPending = rotationPending;
    }

    public RotationState getState() {
        return state;
    }

    public String getActiveKeyId() {
        return activeKeyId;
    }

    public int getActiveVersion() {
        return activeVersion;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Duration getTimeUntilRotation() {
        return timeUntilRotation;
    }

    public int getRetainedKeyCount() {
        return retainedKeyCount;
    }

    /**
     * @return true if the last rotation attempt failed and will be retried on the next tick
     */
    public boolean isRotationPending() {
        return rotationPending;
    }
}
