package net.kinvault.e2ee.state;

import java.time.Instant;

/**
 * Secret-free snapshot of a session's counters and timestamps.
 */
public final class SessionInfo {
    private final String sessionId;
    private final String remoteIdentityFingerprint;
    private final int messagesSent;
    private final int messagesReceived;
    private final int previousCounter;
    private final int skippedKeyCount;
    private final Instant createdAt;
    private final Instant lastActivity;
    private final boolean handshakePending;

    public SessionInfo(String sessionId, String remoteIdentityFingerprint, int messagesSent, int messagesReceived,
                       int previousCounter, int skippedKeyCount, Instant createdAt, Instant lastActivity,
                       boolean handshakePending) {
        this.sessionId = sessionId;
        this.remoteIdentityFingerprint = remoteIdentityFingerprint;
        this.messagesSent = messagesSent;
        this.messagesReceived = messagesReceived;
        this.previousCounter = previousCounter;
        this.skippedKeyCount = skippedKeyCount;
        this.createdAt = createdAt;
        this.lastActivity = lastActivity;
        this.handshakePending = handshakePending;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getRemoteIdentityFingerprint() {
        return remoteIdentityFingerprint;
    }

    public int getMessagesSent() {
        return messagesSent;
    }

    public int getMessagesReceived() {
        return messagesReceived;
    }

    public int getPreviousCounter() {
        return previousCounter;
    }

    public int getSkippedKeyCount() {
        return skippedKeyCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public boolean isHandshakePending() {
        return handshakePending;
    }

    @Override
    public String toString() {
        return "SessionInfo{" + sessionId + ", sent=" + messagesSent + ", received=" + messagesReceived
            + ", skipped=" + skippedKeyCount + "}";
    }
}
