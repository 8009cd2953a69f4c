package net.kinvault.e2ee.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.kinvault.e2ee.PeerBundleInvalidException;
import net.kinvault.e2ee.StorageFailureException;
import net.kinvault.e2ee.crypto.IdentityKey;
import net.kinvault.e2ee.crypto.SecretBytes;
import net.kinvault.e2ee.message.InitialHandshake;

import java.io.IOException;
import java.security.InvalidKeyException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of {@link SessionState}, including skipped message keys with their insertion timestamps.
 */
public class SessionCodec {
    static final int FORMAT_VERSION = 1;

    private final ObjectMapper jsonProcessor = KeyMaterialStore.createStorageObjectMapper();
    private final int maxStoredMessageKeys;
    private final Duration messageKeyLifetime;
    private final Clock clock;

    public SessionCodec(int maxStoredMessageKeys, Duration messageKeyLifetime, Clock clock) {
        this.maxStoredMessageKeys = maxStoredMessageKeys;
        this.messageKeyLifetime = messageKeyLifetime;
        this.clock = clock;
    }

    public SkippedMessageKeys newSkippedMessageKeys() {
        return new SkippedMessageKeys(maxStoredMessageKeys, messageKeyLifetime, clock);
    }

    public byte[] encode(SessionState state) throws StorageFailureException {
        SessionEntry entry = new SessionEntry();
        entry.version = FORMAT_VERSION;
        entry.sessionId = state.getSessionId();
        entry.remoteIdentityKey = state.getRemoteIdentityKey().serialize();
        entry.associatedData = state.getAssociatedData();
        entry.baseKey = state.getBaseKey();
        entry.createdAt = state.getCreatedAt().toEpochMilli();
        entry.lastActivity = state.getLastActivity().toEpochMilli();
        entry.rootKey = state.getRootKey().copy();
        entry.sendingChainKey = state.getSendingChain().getKey();
        entry.sendingChainIndex = state.getSendingChain().getIndex();
        if (state.getReceivingChain() != null) {
            entry.receivingChainKey = state.getReceivingChain().getKey();
            entry.receivingChainIndex = state.getReceivingChain().getIndex();
        }
        entry.sendingRatchetKey = KeyMaterialStore.KeyPairEntry.of(state.getSendingRatchetKey());
        entry.receivingRatchetKey = state.getReceivingRatchetKey();
        entry.previousCounter = state.getPreviousCounter();
        entry.messagesSent = state.getMessagesSent();
        entry.messagesReceived = state.getMessagesReceived();
        entry.localIdentityVersion = state.getLocalIdentityVersion();
        if (state.getPendingHandshake() != null) {
            entry.pendingHandshake = state.getPendingHandshake().serialize();
        }
        entry.skippedMessageKeys = new ArrayList<>();
        state.getSkippedMessageKeys().forEach((ratchetKey, index, messageKey, timestamp) -> {
            SkippedKeyEntry skipped = new SkippedKeyEntry();
            skipped.ratchetKey = ratchetKey;
            skipped.index = index;
            skipped.messageKey = messageKey.copy();
            skipped.timestamp = timestamp;
            entry.skippedMessageKeys.add(skipped);
        });
        try {
            return jsonProcessor.writeValueAsBytes(entry);
        } catch (JsonProcessingException e) {
            throw new StorageFailureException("Failed to encode session " + state.getSessionId(), e);
        }
    }

    public SessionState decode(byte[] blob) throws StorageFailureException {
        SessionEntry entry;
        try {
            entry = jsonProcessor.readValue(blob, SessionEntry.class);
        } catch (IOException e) {
            throw new StorageFailureException("Corrupt session blob", e);
        }
        if (entry.version != FORMAT_VERSION || entry.sessionId == null || entry.rootKey == null
            || entry.sendingChainKey == null || entry.sendingRatchetKey == null) {
            throw new StorageFailureException("Unsupported session blob");
        }
        try {
            SkippedMessageKeys skipped = newSkippedMessageKeys();
            if (entry.skippedMessageKeys != null) {
                for (SkippedKeyEntry key : entry.skippedMessageKeys) {
                    skipped.restore(key.ratchetKey, key.index, SecretBytes.wrap(key.messageKey), key.timestamp);
                }
            }
            SessionState state = new SessionState(entry.sessionId, IdentityKey.deserialize(entry.remoteIdentityKey),
                entry.associatedData, entry.baseKey, Instant.ofEpochMilli(entry.createdAt), skipped);
            state.setRootKey(SecretBytes.wrap(entry.rootKey));
            state.setSendingChain(new ChainKey(SecretBytes.wrap(entry.sendingChainKey), entry.sendingChainIndex));
            if (entry.receivingChainKey != null) {
                state.setReceivingChain(new ChainKey(SecretBytes.wrap(entry.receivingChainKey), entry.receivingChainIndex));
            }
            state.setSendingRatchetKey(entry.sendingRatchetKey.toKeyPair());
            state.setReceivingRatchetKey(entry.receivingRatchetKey);
            state.setPreviousCounter(entry.previousCounter);
            state.setMessagesSent(entry.messagesSent);
            state.setMessagesReceived(entry.messagesReceived);
            state.setLocalIdentityVersion(entry.localIdentityVersion);
            state.setLastActivity(Instant.ofEpochMilli(entry.lastActivity));
            if (entry.pendingHandshake != null) {
                state.setPendingHandshake(InitialHandshake.deserialize(entry.pendingHandshake));
            }
            return state;
        } catch (InvalidKeyException | PeerBundleInvalidException | IllegalArgumentException e) {
            throw new StorageFailureException("Corrupt session " + entry.sessionId, e);
        }
    }

    public static class SessionEntry {
        public int version;
        public String sessionId;
        public byte[] remoteIdentityKey;
        public byte[] associatedData;
        public byte[] baseKey;
        public long createdAt;
        public long lastActivity;
        public byte[] rootKey;
        public byte[] sendingChainKey;
        public int sendingChainIndex;
        public byte[] receivingChainKey;
        public int receivingChainIndex;
        public KeyMaterialStore.KeyPairEntry sendingRatchetKey;
        public byte[] receivingRatchetKey;
        public int previousCounter;
        public int messagesSent;
        public int messagesReceived;
        public int localIdentityVersion;
        public byte[] pendingHandshake;
        public List<SkippedKeyEntry> skippedMessageKeys;
    }

    public static class SkippedKeyEntry {
        public byte[] ratchetKey;
        public int index;
        public byte[] messageKey;
        public long timestamp;
    }
}
