package net.kinvault.e2ee.device;

import net.kinvault.e2ee.DirectoryUnavailableException;
import net.kinvault.e2ee.E2eeException;
import net.kinvault.e2ee.EngineConfig;
import net.kinvault.e2ee.NoSessionException;
import net.kinvault.e2ee.StorageFailureException;
import net.kinvault.e2ee.audit.AuditEventType;
import net.kinvault.e2ee.audit.AuditLogger;
import net.kinvault.e2ee.message.EncryptedEnvelope;
import net.kinvault.e2ee.message.InitialHandshake;
import net.kinvault.e2ee.ratchet.RatchetEngine;
import net.kinvault.e2ee.session.SessionAddress;
import net.kinvault.e2ee.session.SessionEstablisher;
import net.kinvault.e2ee.state.SessionLocks;
import net.kinvault.e2ee.state.SessionState;
import net.kinvault.e2ee.state.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps one session per remote device and fans messages out to every device of a user.
 */
public class DeviceDirectory {
    private final static Logger logger = LoggerFactory.getLogger(DeviceDirectory.class);

    private final String localDeviceId;
    private final Directory directory;
    private final SessionEstablisher establisher;
    private final RatchetEngine ratchetEngine;
    private final SessionStore sessionStore;
    private final SessionLocks sessionLocks;
    private final Duration sessionLifetime;
    private final Clock clock;
    private final AuditLogger auditLogger;

    public DeviceDirectory(String localDeviceId, Directory directory, SessionEstablisher establisher,
                           RatchetEngine ratchetEngine, SessionStore sessionStore, SessionLocks sessionLocks,
                           EngineConfig config, Clock clock, AuditLogger auditLogger) {
        this.localDeviceId = localDeviceId;
        this.directory = directory;
        this.establisher = establisher;
        this.ratchetEngine = ratchetEngine;
        this.sessionStore = sessionStore;
        this.sessionLocks = sessionLocks;
        this.sessionLifetime = config.getSessionLifetime();
        this.clock = clock;
        this.auditLogger = auditLogger;
    }

    /**
     * Encrypts {@code plaintext} for every device of {@code peerUserId} except this device.
     * <p>
     * Devices that cannot be reached are logged and left out of the result. If the directory itself cannot be
     * reached the result is empty.
     *
     * @return envelopes keyed by device id
     */
    public Map<String, EncryptedEnvelope> encryptForAllDevices(byte[] plaintext, String peerUserId) {
        List<DeviceRecord> bundles;
        try {
            bundles = directory.fetchDeviceBundles(peerUserId);
        } catch (IOException e) {
            logger.warn("Failed to fetch devices of {}: {}", peerUserId, e.getMessage());
            return Collections.emptyMap();
        }

        Map<String, EncryptedEnvelope> envelopes = new LinkedHashMap<>();
        for (DeviceRecord bundle : bundles) {
            if (bundle.getDeviceId().equals(localDeviceId)) {
                continue;
            }
            SessionAddress address = new SessionAddress(peerUserId, bundle.getDeviceId());
            try {
                ensureSession(address, bundle);
                envelopes.put(bundle.getDeviceId(), ratchetEngine.encryptEnvelope(address.toSessionId(), plaintext));
            } catch (E2eeException e) {
                logger.warn("Skipping device {}: {} ({})", address, e.getMessage(), e.getKind());
            } catch (RuntimeException e) {
                logger.warn("Skipping device {}: unexpected failure", address, e);
            }
        }
        logger.debug("Encrypted for {} of {} devices of {}", envelopes.size(), bundles.size(), peerUserId);
        return envelopes;
    }

    /**
     * Fans out like {@link #encryptForAllDevices(byte[], String)} and hands each envelope to {@code sink}.
     *
     * @return number of envelopes delivered
     */
    public int sendToAllDevices(byte[] plaintext, String peerUserId, MessageSink sink) {
        int delivered = 0;
        for (Map.Entry<String, EncryptedEnvelope> entry : encryptForAllDevices(plaintext, peerUserId).entrySet()) {
            try {
                sink.deliver(peerUserId, entry.getKey(), entry.getValue());
                delivered++;
            } catch (IOException e) {
                logger.warn("Delivery to {}:{} failed: {}", peerUserId, entry.getKey(), e.getMessage());
            }
        }
        return delivered;
    }

    /**
     * Encrypts for a single device, establishing a session from its published bundle if none exists.
     */
    public EncryptedEnvelope encryptForDevice(String peerUserId, String deviceId, byte[] plaintext)
        throws E2eeException {
        SessionAddress address = new SessionAddress(peerUserId, deviceId);
        if (!ratchetEngine.hasSession(address.toSessionId())) {
            ensureSession(address, fetchBundle(address));
        }
        return ratchetEngine.encryptEnvelope(address.toSessionId(), plaintext);
    }

    /**
     * Establishes a session with one device from its published bundle, replacing an idle session or one whose
     * identity key has changed.
     */
    public void establishSession(String peerUserId, String deviceId) throws E2eeException {
        SessionAddress address = new SessionAddress(peerUserId, deviceId);
        ensureSession(address, fetchBundle(address));
    }

    /**
     * Decrypts an envelope from a remote device. An attached handshake is accepted when there is no session
     * for the sender yet or the handshake starts a different session than the stored one.
     */
    public byte[] decryptFromDevice(String senderUserId, String senderDeviceId, EncryptedEnvelope envelope)
        throws E2eeException {
        SessionAddress address = new SessionAddress(senderUserId, senderDeviceId);
        String sessionId = address.toSessionId();
        InitialHandshake handshake = envelope.getHandshake();
        if (handshake == null) {
            return ratchetEngine.decrypt(sessionId, envelope.getMessage());
        }

        ReentrantLock lock = sessionLocks.lock(sessionId);
        try {
            SessionState existing = sessionStore.load(sessionId);
            if (existing != null && Arrays.equals(existing.getBaseKey(), handshake.getEphemeralKey())) {
                return ratchetEngine.decrypt(sessionId, envelope.getMessage());
            }
            SessionState accepted = establisher.accept(address, handshake);
            byte[] plaintext = ratchetEngine.decryptWithNewSession(accepted, envelope.getMessage());
            establisher.consumeLocalPreKey(handshake);
            auditLogger.log(AuditEventType.DEVICE_MANAGEMENT, "Session accepted", sessionMetadata(sessionId, "accept"));
            return plaintext;
        } finally {
            lock.unlock();
        }
    }

    public void removeDevice(String peerUserId, String deviceId) throws StorageFailureException {
        String sessionId = new SessionAddress(peerUserId, deviceId).toSessionId();
        ratchetEngine.deleteSession(sessionId);
        auditLogger.log(AuditEventType.DEVICE_MANAGEMENT, "Device session removed", sessionMetadata(sessionId, "remove"));
        logger.info("Removed session {}", sessionId);
    }

    /**
     * Deletes every session with devices of {@code peerUserId}.
     *
     * @return number of sessions deleted
     */
    public int resetEncryption(String peerUserId) throws StorageFailureException {
        int removed = 0;
        for (String sessionId : sessionStore.loadSessionIds()) {
            if (SessionAddress.fromSessionId(sessionId).getUserId().equals(peerUserId)) {
                ratchetEngine.deleteSession(sessionId);
                removed++;
            }
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("peerUserId", peerUserId);
        metadata.put("sessions", removed);
        auditLogger.log(AuditEventType.DATA_MODIFICATION, "Encryption reset", metadata);
        logger.info("Reset {} sessions with {}", removed, peerUserId);
        return removed;
    }

    /**
     * @return number of stored sessions used within the session lifetime
     */
    public int getActiveSessionCount() throws StorageFailureException {
        int active = 0;
        for (String sessionId : sessionStore.loadSessionIds()) {
            ReentrantLock lock = sessionLocks.lock(sessionId);
            try {
                SessionState state = sessionStore.load(sessionId);
                if (state != null && !isIdle(state)) {
                    active++;
                }
            } finally {
                lock.unlock();
            }
        }
        return active;
    }

    private void ensureSession(SessionAddress address, DeviceRecord bundle) throws E2eeException {
        String sessionId = address.toSessionId();
        ReentrantLock lock = sessionLocks.lock(sessionId);
        try {
            SessionState existing = sessionStore.load(sessionId);
            if (existing != null) {
                if (!existing.getRemoteIdentityKey().equals(bundle.getIdentityKey())) {
                    logger.warn("Identity key of {} changed, re-establishing", address);
                    auditLogger.securityWarning("Remote identity key changed", sessionId, "identity-changed");
                } else if (isIdle(existing)) {
                    logger.info("Session {} idle since {}, re-establishing", sessionId, existing.getLastActivity());
                } else {
                    return;
                }
            }
            SessionState established = establisher.initiate(address, bundle);
            try {
                sessionStore.save(established);
            } catch (StorageFailureException e) {
                established.destroy();
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean isIdle(SessionState state) {
        Instant idleSince = state.getLastActivity();
        return Duration.between(idleSince, clock.instant()).compareTo(sessionLifetime) > 0;
    }

    private DeviceRecord fetchBundle(SessionAddress address) throws DirectoryUnavailableException, NoSessionException {
        List<DeviceRecord> bundles;
        try {
            bundles = directory.fetchDeviceBundles(address.getUserId());
        } catch (IOException e) {
            throw new DirectoryUnavailableException("Failed to fetch devices of " + address.getUserId(), e);
        }
        for (DeviceRecord bundle : bundles) {
            if (bundle.getDeviceId().equals(address.getDeviceId())) {
                return bundle;
            }
        }
        throw new NoSessionException(address.toSessionId(), "Device " + address + " is not registered");
    }

    private static Map<String, Object> sessionMetadata(String sessionId, String operation) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sessionId", sessionId);
        metadata.put("operation", operation);
        return metadata;
    }
}
