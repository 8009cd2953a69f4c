package net.kinvault.e2ee.session;

import java.util.Objects;

/**
 * A remote device: the peer's user id and one of its device ids.
 */
public final class SessionAddress {
    private final String userId;
    private final String deviceId;

    public SessionAddress(String userId, String deviceId) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
    }

    /**
     * Parses a session id produced by {@link #toSessionId()}. The device id is everything after the last ':'.
     */
    public static SessionAddress fromSessionId(String sessionId) {
        int separator = sessionId.lastIndexOf(':');
        if (separator <= 0 || separator == sessionId.length() - 1) {
            throw new IllegalArgumentException("Not a session id: " + sessionId);
        }
        return new SessionAddress(sessionId.substring(0, separator), sessionId.substring(separator + 1));
    }

    public String getUserId() {
        return userId;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String toSessionId() {
        return userId + ":" + deviceId;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof SessionAddress)) return false;
        SessionAddress that = (SessionAddress) other;
        return userId.equals(that.userId) && deviceId.equals(that.deviceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, deviceId);
    }

    @Override
    public String toString() {
        return toSessionId();
    }
}
