package net.kinvault.e2ee.state;

import net.kinvault.e2ee.crypto.DhKeyPair;
import net.kinvault.e2ee.crypto.IdentityKey;
import net.kinvault.e2ee.crypto.SecretBytes;
import net.kinvault.e2ee.message.InitialHandshake;

import javax.security.auth.Destroyable;
import java.time.Instant;

/**
 * Double Ratchet state for one remote device.
 * <p>
 * Instances are mutable and not thread-safe. Callers mutate a {@link #copy()} under the session lock and
 * replace the stored instance only once the whole operation has succeeded.
 */
public final class SessionState implements Destroyable {
    private final String sessionId;
    private final IdentityKey remoteIdentityKey;
    private final byte[] associatedData;
    private final byte[] baseKey;
    private final Instant createdAt;

    private SecretBytes rootKey;
    private ChainKey sendingChain;
    private ChainKey receivingChain;
    private DhKeyPair sendingRatchetKey;
    private byte[] receivingRatchetKey;
    private int previousCounter;
    private int messagesSent;
    private int messagesReceived;
    private SkippedMessageKeys skippedMessageKeys;
    private InitialHandshake pendingHandshake;
    private Instant lastActivity;
    private int localIdentityVersion;

    public SessionState(String sessionId, IdentityKey remoteIdentityKey, byte[] associatedData, byte[] baseKey,
                        Instant createdAt, SkippedMessageKeys skippedMessageKeys) {
        this.sessionId = sessionId;
        this.remoteIdentityKey = remoteIdentityKey;
        this.associatedData = associatedData.clone();
        this.baseKey = baseKey.clone();
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
        this.skippedMessageKeys = skippedMessageKeys;
    }

    public String getSessionId() {
        return sessionId;
    }

    public IdentityKey getRemoteIdentityKey() {
        return remoteIdentityKey;
    }

    /**
     * Initiator identity followed by responder identity; bound into every MAC and AEAD tag.
     */
    public byte[] getAssociatedData() {
        return associatedData.clone();
    }

    /**
     * The initiator's handshake ephemeral key, identifying which handshake created this session.
     */
    public byte[] getBaseKey() {
        return baseKey.clone();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public SecretBytes getRootKey() {
        return rootKey;
    }

    public void setRootKey(SecretBytes rootKey) {
        this.rootKey = rootKey;
    }

    public ChainKey getSendingChain() {
        return sendingChain;
    }

    public void setSendingChain(ChainKey sendingChain) {
        this.sendingChain = sendingChain;
    }

    public ChainKey getReceivingChain() {
        return receivingChain;
    }

    public void setReceivingChain(ChainKey receivingChain) {
        this.receivingChain = receivingChain;
    }

    public DhKeyPair getSendingRatchetKey() {
        return sendingRatchetKey;
    }

    public void setSendingRatchetKey(DhKeyPair sendingRatchetKey) {
        this.sendingRatchetKey = sendingRatchetKey;
    }

    public byte[] getReceivingRatchetKey() {
        return receivingRatchetKey == null ? null : receivingRatchetKey.clone();
    }

    public void setReceivingRatchetKey(byte[] receivingRatchetKey) {
        this.receivingRatchetKey = receivingRatchetKey == null ? null : receivingRatchetKey.clone();
    }

    public int getPreviousCounter() {
        return previousCounter;
    }

    public void setPreviousCounter(int previousCounter) {
        this.previousCounter = previousCounter;
    }

    public int getMessagesSent() {
        return messagesSent;
    }

    public void setMessagesSent(int messagesSent) {
        this.messagesSent = messagesSent;
    }

    public int getMessagesReceived() {
        return messagesReceived;
    }

    public void setMessagesReceived(int messagesReceived) {
        this.messagesReceived = messagesReceived;
    }

    public SkippedMessageKeys getSkippedMessageKeys() {
        return skippedMessageKeys;
    }

    public InitialHandshake getPendingHandshake() {
        return pendingHandshake;
    }

    public void setPendingHandshake(InitialHandshake pendingHandshake) {
        this.pendingHandshake = pendingHandshake;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public void setLastActivity(Instant lastActivity) {
        this.lastActivity = lastActivity;
    }

    public int getLocalIdentityVersion() {
        return localIdentityVersion;
    }

    public void setLocalIdentityVersion(int localIdentityVersion) {
        this.localIdentityVersion = localIdentityVersion;
    }

    public SessionInfo toInfo() {
        return new SessionInfo(sessionId, remoteIdentityKey.fingerprint(), messagesSent, messagesReceived,
            previousCounter, skippedMessageKeys.size(), createdAt, lastActivity, pendingHandshake != null);
    }

    /**
     * Deep copy: every secret is duplicated, so destroying either instance leaves the other usable.
     */
    public SessionState copy() {
        SessionState copy = new SessionState(sessionId, remoteIdentityKey, associatedData, baseKey, createdAt,
            skippedMessageKeys.copy());
        copy.rootKey = rootKey == null ? null : rootKey.duplicate();
        copy.sendingChain = sendingChain == null ? null : sendingChain.copy();
        copy.receivingChain = receivingChain == null ? null : receivingChain.copy();
        copy.sendingRatchetKey = sendingRatchetKey == null ? null : sendingRatchetKey.copy();
        copy.receivingRatchetKey = receivingRatchetKey == null ? null : receivingRatchetKey.clone();
        copy.previousCounter = previousCounter;
        copy.messagesSent = messagesSent;
        copy.messagesReceived = messagesReceived;
        copy.pendingHandshake = pendingHandshake;
        copy.lastActivity = lastActivity;
        copy.localIdentityVersion = localIdentityVersion;
        return copy;
    }

    @Override
    public void destroy() {
        if (rootKey != null) rootKey.destroy();
        if (sendingChain != null) sendingChain.destroy();
        if (receivingChain != null) receivingChain.destroy();
        if (sendingRatchetKey != null) sendingRatchetKey.destroy();
        skippedMessageKeys.destroy();
    }

    @Override
    public boolean isDestroyed() {
        return rootKey != null && rootKey.isDestroyed();
    }
}
