package net.kinvault.e2ee.ratchet;

import net.kinvault.e2ee.AuthenticationFailedException;
import net.kinvault.e2ee.EngineConfig;
import net.kinvault.e2ee.KeyGenerationException;
import net.kinvault.e2ee.NoSessionException;
import net.kinvault.e2ee.StorageFailureException;
import net.kinvault.e2ee.TooManySkippedMessagesException;
import net.kinvault.e2ee.audit.AuditEventType;
import net.kinvault.e2ee.audit.AuditLogger;
import net.kinvault.e2ee.crypto.Crypto;
import net.kinvault.e2ee.crypto.DhKeyPair;
import net.kinvault.e2ee.crypto.MessageKeys;
import net.kinvault.e2ee.crypto.SecretBytes;
import net.kinvault.e2ee.message.EncryptedEnvelope;
import net.kinvault.e2ee.message.RatchetHeader;
import net.kinvault.e2ee.message.RatchetMessage;
import net.kinvault.e2ee.state.ChainKey;
import net.kinvault.e2ee.state.SessionInfo;
import net.kinvault.e2ee.state.SessionLocks;
import net.kinvault.e2ee.state.SessionState;
import net.kinvault.e2ee.state.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.InvalidKeyException;
import java.time.Clock;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Double Ratchet encryption and decryption over stored sessions.
 * <p>
 * Every operation runs on a copy of the stored session while holding the session lock. The copy replaces the
 * stored session only after the operation has fully succeeded, so a failed decrypt leaves no trace.
 */
public class RatchetEngine {
    private final static Logger logger = LoggerFactory.getLogger(RatchetEngine.class);

    private final SessionStore sessionStore;
    private final SessionLocks sessionLocks;
    private final int maxSkip;
    private final Clock clock;
    private final AuditLogger auditLogger;

    public RatchetEngine(SessionStore sessionStore, SessionLocks sessionLocks, EngineConfig config, Clock clock,
                         AuditLogger auditLogger) {
        this.sessionStore = sessionStore;
        this.sessionLocks = sessionLocks;
        this.maxSkip = config.getMaxSkip();
        this.clock = clock;
        this.auditLogger = auditLogger;
    }

    public RatchetMessage encrypt(String sessionId, byte[] plaintext) throws NoSessionException, StorageFailureException {
        return encryptEnvelope(sessionId, plaintext).getMessage();
    }

    /**
     * Encrypts and attaches the pending handshake, if the peer has not replied yet.
     */
    public EncryptedEnvelope encryptEnvelope(String sessionId, byte[] plaintext)
        throws NoSessionException, StorageFailureException {
        ReentrantLock lock = sessionLocks.lock(sessionId);
        try {
            SessionState working = requireSession(sessionId).copy();
            boolean committed = false;
            try {
                RatchetMessage message = ratchetEncrypt(working, plaintext);
                working.setLastActivity(clock.instant());
                sessionStore.save(working);
                committed = true;
                return new EncryptedEnvelope(message, working.getPendingHandshake());
            } finally {
                if (!committed) {
                    working.destroy();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws AuthenticationFailedException    if the message was altered, replayed or not meant for this session
     * @throws TooManySkippedMessagesException if accepting the message would skip more than the configured bound
     */
    public byte[] decrypt(String sessionId, RatchetMessage message)
        throws NoSessionException, AuthenticationFailedException, TooManySkippedMessagesException,
        KeyGenerationException, StorageFailureException {
        ReentrantLock lock = sessionLocks.lock(sessionId);
        try {
            return decryptAndCommit(requireSession(sessionId).copy(), message);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Decrypts the first message of a freshly accepted session and stores that session only if it decrypts,
     * replacing any existing session for the same id.
     */
    public byte[] decryptWithNewSession(SessionState session, RatchetMessage message)
        throws AuthenticationFailedException, TooManySkippedMessagesException, KeyGenerationException,
        StorageFailureException {
        ReentrantLock lock = sessionLocks.lock(session.getSessionId());
        try {
            return decryptAndCommit(session, message);
        } finally {
            lock.unlock();
        }
    }

    private byte[] decryptAndCommit(SessionState working, RatchetMessage message)
        throws AuthenticationFailedException, TooManySkippedMessagesException, KeyGenerationException,
        StorageFailureException {
        boolean committed = false;
        try {
            byte[] plaintext = ratchetDecrypt(working, message);
            working.setPendingHandshake(null);
            working.setLastActivity(clock.instant());
            sessionStore.save(working);
            committed = true;
            return plaintext;
        } catch (AuthenticationFailedException e) {
            logger.warn("Rejected message for {}: {}", working.getSessionId(), e.getMessage());
            auditLogger.securityWarning("Message failed authentication", working.getSessionId(), e.getMessage());
            throw e;
        } catch (TooManySkippedMessagesException e) {
            logger.warn("Rejected message for {}: {}", working.getSessionId(), e.getMessage());
            throw e;
        } finally {
            if (!committed) {
                working.destroy();
            }
        }
    }

    RatchetMessage ratchetEncrypt(SessionState state, byte[] plaintext) {
        ChainKey.Step step = state.getSendingChain().advance();
        state.setSendingChain(step.getNext());
        RatchetHeader header = new RatchetHeader(state.getSendingRatchetKey().getPublicKey(),
            state.getPreviousCounter(), state.getMessagesSent());
        byte[] headerBytes = header.serialize();
        byte[] associatedData = state.getAssociatedData();
        try (SecretBytes messageKey = step.getMessageKey();
             MessageKeys keys = Crypto.deriveMessageKeys(messageKey.bytes())) {
            byte[] ciphertext = Crypto.encrypt(keys, plaintext, Crypto.concat(associatedData, headerBytes));
            byte[] mac = Crypto.hmacSha256(keys.getMacKey().bytes(), associatedData, headerBytes, ciphertext);
            state.setMessagesSent(state.getMessagesSent() + 1);
            return new RatchetMessage(header, ciphertext, mac);
        }
    }

    byte[] ratchetDecrypt(SessionState state, RatchetMessage message)
        throws AuthenticationFailedException, TooManySkippedMessagesException, KeyGenerationException {
        RatchetHeader header = message.getHeader();
        SecretBytes messageKey = trySkippedMessageKeys(state, header);
        if (messageKey == null) {
            if (!Arrays.equals(header.getDh(), state.getReceivingRatchetKey())) {
                skipMessageKeys(state, header.getPn());
                dhRatchet(state, header);
            }
            if (header.getN() < state.getMessagesReceived()) {
                throw new AuthenticationFailedException("Duplicate message " + header.getN());
            }
            skipMessageKeys(state, header.getN());
            ChainKey.Step step = state.getReceivingChain().advance();
            state.setReceivingChain(step.getNext());
            state.setMessagesReceived(header.getN() + 1);
            messageKey = step.getMessageKey();
        }

        byte[] headerBytes = header.serialize();
        byte[] associatedData = state.getAssociatedData();
        try (SecretBytes key = messageKey; MessageKeys keys = Crypto.deriveMessageKeys(key.bytes())) {
            if (!Crypto.verifyMac(keys.getMacKey().bytes(), message.getMac(), associatedData, headerBytes,
                message.getCiphertext())) {
                throw new AuthenticationFailedException("Bad MAC");
            }
            return Crypto.decrypt(keys, message.getCiphertext(), Crypto.concat(associatedData, headerBytes));
        }
    }

    private SecretBytes trySkippedMessageKeys(SessionState state, RatchetHeader header) {
        return state.getSkippedMessageKeys().take(header.getDh(), header.getN());
    }

    private void skipMessageKeys(SessionState state, int until) throws TooManySkippedMessagesException {
        if ((long) state.getMessagesReceived() + maxSkip < until) {
            throw new TooManySkippedMessagesException("Too many messages to skip: " + state.getMessagesReceived()
                + " -> " + until);
        }
        if (state.getReceivingChain() != null) {
            byte[] ratchetKey = state.getReceivingRatchetKey();
            while (state.getMessagesReceived() < until) {
                ChainKey.Step step = state.getReceivingChain().advance();
                state.getSkippedMessageKeys().store(ratchetKey, state.getMessagesReceived(), step.getMessageKey());
                state.setReceivingChain(step.getNext());
                state.setMessagesReceived(state.getMessagesReceived() + 1);
            }
        }
    }

    private void dhRatchet(SessionState state, RatchetHeader header)
        throws AuthenticationFailedException, KeyGenerationException {
        state.setPreviousCounter(state.getMessagesSent());
        state.setMessagesSent(0);
        state.setMessagesReceived(0);
        state.setReceivingRatchetKey(header.getDh());

        DhKeyPair newRatchetKey = Crypto.generateDh();
        byte[] receivingInput = null, receiving = null, sendingInput = null, sending = null;
        try {
            receivingInput = Crypto.dh(state.getSendingRatchetKey(), header.getDh());
            receiving = Crypto.kdfRk(state.getRootKey().bytes(), receivingInput);
            replaceReceivingChain(state, new ChainKey(
                SecretBytes.copyOfRange(receiving, Crypto.KEY_SIZE_BYTES, receiving.length), 0));

            sendingInput = Crypto.dh(newRatchetKey, header.getDh());
            sending = Crypto.kdfRk(Arrays.copyOfRange(receiving, 0, Crypto.KEY_SIZE_BYTES), sendingInput);
            state.getRootKey().destroy();
            state.setRootKey(SecretBytes.copyOfRange(sending, 0, Crypto.KEY_SIZE_BYTES));
            state.getSendingChain().destroy();
            state.setSendingChain(new ChainKey(SecretBytes.copyOfRange(sending, Crypto.KEY_SIZE_BYTES, sending.length), 0));
            state.getSendingRatchetKey().destroy();
            state.setSendingRatchetKey(newRatchetKey);
        } catch (InvalidKeyException e) {
            newRatchetKey.destroy();
            throw new AuthenticationFailedException("Bad ratchet key in header", e);
        } finally {
            Crypto.wipe(receivingInput, receiving, sendingInput, sending);
        }
    }

    private static void replaceReceivingChain(SessionState state, ChainKey chainKey) {
        if (state.getReceivingChain() != null) {
            state.getReceivingChain().destroy();
        }
        state.setReceivingChain(chainKey);
    }

    public boolean hasSession(String sessionId) throws StorageFailureException {
        ReentrantLock lock = sessionLocks.lock(sessionId);
        try {
            return sessionStore.load(sessionId) != null;
        } finally {
            lock.unlock();
        }
    }

    public void deleteSession(String sessionId) throws StorageFailureException {
        ReentrantLock lock = sessionLocks.lock(sessionId);
        try {
            sessionStore.delete(sessionId);
            sessionLocks.release(sessionId, lock);
        } finally {
            lock.unlock();
        }
    }

    public SessionInfo getSessionInfo(String sessionId) throws NoSessionException, StorageFailureException {
        ReentrantLock lock = sessionLocks.lock(sessionId);
        try {
            return requireSession(sessionId).toInfo();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Serialized session for backup. The blob contains live key material.
     */
    public byte[] exportSession(String sessionId) throws NoSessionException, StorageFailureException {
        ReentrantLock lock = sessionLocks.lock(sessionId);
        try {
            byte[] blob = sessionStore.getCodec().encode(requireSession(sessionId));
            auditLogger.log(AuditEventType.ENCRYPTION_KEY_USAGE, "Session exported",
                Collections.singletonMap("sessionId", sessionId));
            return blob;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a session from {@link #exportSession(String)}, replacing any existing session with the same id.
     */
    public SessionInfo importSession(byte[] blob) throws StorageFailureException {
        SessionState imported = sessionStore.getCodec().decode(blob);
        ReentrantLock lock = sessionLocks.lock(imported.getSessionId());
        try {
            sessionStore.save(imported);
        } catch (StorageFailureException e) {
            imported.destroy();
            throw e;
        } finally {
            lock.unlock();
        }
        auditLogger.log(AuditEventType.DATA_MODIFICATION, "Session imported",
            Collections.singletonMap("sessionId", imported.getSessionId()));
        return imported.toInfo();
    }

    /**
     * Purges expired skipped message keys from every stored session and evicts idle cached sessions.
     *
     * @return number of skipped message keys purged
     */
    public int tick() throws StorageFailureException {
        int purged = 0;
        for (String sessionId : sessionStore.loadSessionIds()) {
            ReentrantLock lock = sessionLocks.lock(sessionId);
            try {
                SessionState state = sessionStore.load(sessionId);
                if (state == null) {
                    continue;
                }
                int expired = state.getSkippedMessageKeys().purgeExpired();
                if (expired > 0) {
                    sessionStore.save(state);
                    purged += expired;
                }
            } catch (StorageFailureException e) {
                logger.warn("Maintenance skipped session {}: {}", sessionId, e.getMessage());
            } finally {
                lock.unlock();
            }
        }
        int evicted = sessionStore.tick();
        logger.debug("Maintenance purged {} skipped keys, evicted {} cached sessions", purged, evicted);
        return purged;
    }

    private SessionState requireSession(String sessionId) throws NoSessionException, StorageFailureException {
        SessionState state = sessionStore.load(sessionId);
        if (state == null) {
            throw new NoSessionException(sessionId, "No session for " + sessionId);
        }
        return state;
    }
}
