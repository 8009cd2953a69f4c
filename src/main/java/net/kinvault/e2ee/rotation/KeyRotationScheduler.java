package net.kinvault.e2ee.rotation;

import net.kinvault.e2ee.AuthenticationFailedException;
import net.kinvault.e2ee.E2eeException;
import net.kinvault.e2ee.EngineConfig;
import net.kinvault.e2ee.KeyGenerationException;
import net.kinvault.e2ee.RotationFailureException;
import net.kinvault.e2ee.StorageFailureException;
import net.kinvault.e2ee.audit.AuditEventType;
import net.kinvault.e2ee.audit.AuditLogger;
import net.kinvault.e2ee.crypto.IdentityKey;
import net.kinvault.e2ee.crypto.IdentityKeyPair;
import net.kinvault.e2ee.crypto.SealedBox;
import net.kinvault.e2ee.device.DeviceRecord;
import net.kinvault.e2ee.device.Directory;
import net.kinvault.e2ee.identity.IdentityManager;
import net.kinvault.e2ee.identity.PreKeyManager;
import net.kinvault.e2ee.state.KeyMaterialStore;
import net.kinvault.e2ee.state.RotatingKey;
import net.kinvault.e2ee.state.SignedPreKeyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Rotates the device identity key on a fixed interval while keeping recent generations for decryption.
 * <p>
 * A rotation only takes effect once the new bundle is published. If publishing fails the previous key stays
 * active and the rotation is retried on the next {@link #tick()}.
 */
public class KeyRotationScheduler {
    private final static Logger logger = LoggerFactory.getLogger(KeyRotationScheduler.class);

    private final KeyMaterialStore keyMaterialStore;
    private final IdentityManager identityManager;
    private final PreKeyManager preKeyManager;
    private final Directory directory;
    private final String userId;
    private final String deviceId;
    private final String deviceName;
    private final Duration rotationInterval;
    private final Duration preRotationWarning;
    private final int maxActiveKeys;
    private final Clock clock;
    private final AuditLogger auditLogger;
    private final List<KeyRotationListener> listeners = new CopyOnWriteArrayList<>();

    private volatile RotationState state = RotationState.NO_KEY;
    private volatile boolean rotationPending;
    private String warnedKeyId;

    public KeyRotationScheduler(KeyMaterialStore keyMaterialStore, IdentityManager identityManager,
                                PreKeyManager preKeyManager, Directory directory, String userId, String deviceId,
                                String deviceName, EngineConfig config, Clock clock, AuditLogger auditLogger) {
        this.keyMaterialStore = keyMaterialStore;
        this.identityManager = identityManager;
        this.preKeyManager = preKeyManager;
        this.directory = directory;
        this.userId = userId;
        this.deviceId = deviceId;
        this.deviceName = deviceName;
        this.rotationInterval = config.getRotationInterval();
        this.preRotationWarning = config.getPreRotationWarning();
        this.maxActiveKeys = config.getMaxActiveKeys();
        this.clock = clock;
        this.auditLogger = auditLogger;
    }

    public void addListener(KeyRotationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(KeyRotationListener listener) {
        listeners.remove(listener);
    }

    /**
     * Adopts the current identity (generating one if needed) as version 1, unless rotation state already exists.
     *
     * @return the active key's id
     */
    public synchronized String initialize() throws KeyGenerationException, StorageFailureException {
        RotatingKey active = loadActiveKey();
        if (active == null) {
            IdentityKeyPair identity = identityManager.getIdentity();
            if (identity == null) {
                identity = identityManager.generateIdentity();
            }
            Instant now = clock.instant();
            active = new RotatingKey(RotatingKey.idForVersion(1), identity, now, now.plus(rotationInterval), 1, true);
            keyMaterialStore.storeRotatingKey(active);
            keyMaterialStore.storeActiveRotatingKeyId(active.getId());
            logger.info("Rotation initialized with {}", active.getId());
        } else {
            active.getKeyPair().destroy();
        }
        state = stateFor(active, clock.instant());
        return active.getId();
    }

    /**
     * Generates and publishes a new identity generation, then makes it active and prunes old generations.
     *
     * @return id of the new active key
     * @throws RotationFailureException if the new key could not be generated, published or stored; the
     *                                  previous key then remains active and is advertised again
     */
    public synchronized String rotate() throws RotationFailureException {
        RotatingKey current;
        try {
            initialize();
            current = loadActiveKey();
        } catch (E2eeException e) {
            throw new RotationFailureException("Rotation state unavailable", e);
        }
        RotationState previousState = state;
        state = RotationState.ROTATING;
        emit(KeyRotationEvent.Type.STARTED, current.getId(), current.getVersion(), "Rotation started");

        IdentityKeyPair next = null;
        SignedPreKeyRecord signedPreKey;
        SignedPreKeyRecord previousSignedPreKey;
        try {
            previousSignedPreKey = preKeyManager.getCurrentSignedPreKey();
            next = IdentityKeyPair.generate();
            signedPreKey = preKeyManager.createSignedPreKey(next);
            DeviceRecord record = preKeyManager.buildDeviceRecord(deviceId, deviceName, next, signedPreKey);
            preKeyManager.publish(directory, userId, record);
        } catch (E2eeException e) {
            if (next != null) {
                next.destroy();
            }
            rotationPending = true;
            state = previousState;
            logger.warn("Rotation from {} failed, keeping it active: {}", current.getId(), e.getMessage());
            emit(KeyRotationEvent.Type.FAILED, current.getId(), current.getVersion(), e.getMessage());
            auditLogger.log(AuditEventType.ENCRYPTION_KEY_USAGE, "Key rotation failed",
                rotationMetadata(current.getId(), "rotate-failed"));
            throw new RotationFailureException("Failed to publish rotated key: " + e.getMessage(), e);
        }

        int version = current.getVersion() + 1;
        Instant now = clock.instant();
        RotatingKey rotated = new RotatingKey(RotatingKey.idForVersion(version), next, now,
            now.plus(rotationInterval), version, true);
        try {
            keyMaterialStore.storeRotatingKey(rotated);
            preKeyManager.commitSignedPreKey(signedPreKey);
            identityManager.restoreIdentity(next);
            keyMaterialStore.storeActiveRotatingKeyId(rotated.getId());
            keyMaterialStore.storeRotatingKey(current.withActive(false));
        } catch (StorageFailureException e) {
            rollBack(current, rotated, signedPreKey, previousSignedPreKey, e);
            rotationPending = true;
            state = previousState;
            logger.warn("Storing rotated key {} failed, keeping {} active: {}", rotated.getId(), current.getId(),
                e.getMessage());
            emit(KeyRotationEvent.Type.FAILED, current.getId(), current.getVersion(), e.getMessage());
            auditLogger.log(AuditEventType.ENCRYPTION_KEY_USAGE, "Key rotation failed",
                rotationMetadata(current.getId(), "rotate-failed"));
            throw new RotationFailureException("Failed to store rotated key", e);
        } finally {
            current.getKeyPair().destroy();
        }

        try {
            prune();
        } catch (StorageFailureException e) {
            logger.warn("Pruning after rotation to {} failed: {}", rotated.getId(), e.getMessage());
        }

        rotationPending = false;
        state = RotationState.ACTIVE;
        logger.info("Rotated identity key to {}", rotated.getId());
        emit(KeyRotationEvent.Type.COMPLETED, rotated.getId(), version, "Rotation completed");
        auditLogger.log(AuditEventType.ENCRYPTION_KEY_USAGE, "Identity key rotated",
            rotationMetadata(rotated.getId(), "rotate"));
        return rotated.getId();
    }

    /**
     * Puts {@code current} back as the active key and re-advertises its bundle after a failed commit of
     * {@code rotated}. Every step is attempted; failures are attached to {@code cause}.
     */
    private void rollBack(RotatingKey current, RotatingKey rotated, SignedPreKeyRecord signedPreKey,
                          SignedPreKeyRecord previousSignedPreKey, StorageFailureException cause) {
        try {
            keyMaterialStore.storeRotatingKey(current);
            keyMaterialStore.storeActiveRotatingKeyId(current.getId());
        } catch (StorageFailureException e) {
            cause.addSuppressed(e);
        }
        try {
            keyMaterialStore.removeRotatingKey(rotated.getId());
        } catch (StorageFailureException e) {
            cause.addSuppressed(e);
        }
        try {
            identityManager.restoreIdentity(current.getKeyPair().copy());
            rotated.getKeyPair().destroy();
        } catch (StorageFailureException e) {
            cause.addSuppressed(e);
        }
        try {
            SignedPreKeyRecord advertised = previousSignedPreKey;
            if (advertised == null) {
                advertised = preKeyManager.createSignedPreKey(current.getKeyPair());
                preKeyManager.commitSignedPreKey(advertised);
            } else {
                keyMaterialStore.storeCurrentSignedPreKeyId(advertised.getId());
            }
            keyMaterialStore.removeSignedPreKey(signedPreKey.getId());
            DeviceRecord record = preKeyManager.buildDeviceRecord(deviceId, deviceName, current.getKeyPair(),
                advertised);
            preKeyManager.publish(directory, userId, record);
        } catch (E2eeException e) {
            logger.warn("Failed to re-advertise {}: {}", current.getId(), e.getMessage());
            cause.addSuppressed(e);
        }
    }

    /**
     * Removes inactive generations that are neither among the newest {@code maxActiveKeys} nor younger than
     * twice the rotation interval.
     *
     * @return number of generations removed
     */
    int prune() throws StorageFailureException {
        Instant now = clock.instant();
        Duration retention = rotationInterval.multipliedBy(2);
        int kept = 0;
        int removed = 0;
        for (RotatingKey key : keyMaterialStore.loadRotatingKeys()) {
            boolean young = Duration.between(key.getCreatedAt(), now).compareTo(retention) < 0;
            if (key.isActive() || kept < maxActiveKeys || young) {
                kept++;
            } else {
                keyMaterialStore.removeRotatingKey(key.getId());
                logger.info("Pruned rotated key {}", key.getId());
                removed++;
            }
            key.getKeyPair().destroy();
        }
        return removed;
    }

    /**
     * Opens a sealed box with any retained generation, newest first.
     *
     * @return the plaintext, or null if no retained key opens it
     */
    public byte[] decryptWithAnyKey(byte[] sealed) throws StorageFailureException {
        List<RotatingKey> keys = keyMaterialStore.loadRotatingKeys();
        try {
            for (RotatingKey key : keys) {
                try {
                    return SealedBox.open(key.getKeyPair(), sealed);
                } catch (AuthenticationFailedException e) {
                    logger.trace("Key {} did not open sealed data", key.getId());
                }
            }
        } finally {
            for (RotatingKey key : keys) {
                key.getKeyPair().destroy();
            }
        }
        logger.debug("No retained key opens sealed data ({} tried)", keys.size());
        return null;
    }

    public byte[] encryptToIdentity(IdentityKey recipient, byte[] plaintext) throws KeyGenerationException {
        return SealedBox.seal(recipient, plaintext);
    }

    /**
     * Periodic check: warns inside the pre-rotation window, rotates when the active key has expired and
     * retries a previously failed rotation.
     */
    public synchronized RotationState tick() throws StorageFailureException {
        RotatingKey active = loadActiveKey();
        if (active == null) {
            state = RotationState.NO_KEY;
            return state;
        }
        active.getKeyPair().destroy();
        Instant now = clock.instant();
        if (rotationPending || !now.isBefore(active.getExpiresAt())) {
            try {
                rotate();
            } catch (RotationFailureException e) {
                logger.warn("Scheduled rotation failed, will retry: {}", e.getMessage());
            }
            return state;
        }
        state = stateFor(active, now);
        if (state == RotationState.WARNING && !active.getId().equals(warnedKeyId)) {
            warnedKeyId = active.getId();
            emit(KeyRotationEvent.Type.WARNING, active.getId(), active.getVersion(),
                "Key expires at " + active.getExpiresAt());
        }
        return state;
    }

    public RotationState getState() {
        return state;
    }

    public boolean isRotationPending() {
        return rotationPending;
    }

    public RotationStatus getRotationStatus() throws StorageFailureException {
        List<RotatingKey> keys = keyMaterialStore.loadRotatingKeys();
        RotatingKey active = null;
        for (RotatingKey key : keys) {
            if (key.isActive() && active == null) {
                active = key;
            }
            key.getKeyPair().destroy();
        }
        if (active == null) {
            return new RotationStatus(RotationState.NO_KEY, null, 0, null, null, null, keys.size(), rotationPending);
        }
        Duration untilRotation = Duration.between(clock.instant(), active.getExpiresAt());
        return new RotationStatus(state, active.getId(), active.getVersion(), active.getCreatedAt(),
            active.getExpiresAt(), untilRotation.isNegative() ? Duration.ZERO : untilRotation, keys.size(),
            rotationPending);
    }

    /**
     * @return ids of all retained generations, newest first
     */
    public List<String> getRetainedKeyIds() throws StorageFailureException {
        List<String> ids = new ArrayList<>();
        for (RotatingKey key : keyMaterialStore.loadRotatingKeys()) {
            ids.add(key.getId());
            key.getKeyPair().destroy();
        }
        return ids;
    }

    private RotatingKey loadActiveKey() throws StorageFailureException {
        String activeId = keyMaterialStore.loadActiveRotatingKeyId();
        return activeId == null ? null : keyMaterialStore.loadRotatingKey(activeId);
    }

    private RotationState stateFor(RotatingKey active, Instant now) {
        if (!now.isBefore(active.getExpiresAt().minus(preRotationWarning))) {
            return RotationState.WARNING;
        }
        return RotationState.ACTIVE;
    }

    private void emit(KeyRotationEvent.Type type, String keyId, int version, String message) {
        KeyRotationEvent event = new KeyRotationEvent(type, keyId, version, clock.instant(), message);
        for (KeyRotationListener listener : listeners) {
            try {
                listener.onRotationEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Rotation listener failed on {}: {}", type, e.getMessage());
            }
        }
    }

    private static Map<String, Object> rotationMetadata(String keyId, String operation) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("keyId", keyId);
        metadata.put("operation", operation);
        return metadata;
    }
}
