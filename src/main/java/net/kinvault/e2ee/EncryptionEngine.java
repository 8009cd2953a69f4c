package net.kinvault.e2ee;

import net.kinvault.e2ee.audit.AuditLogger;
import net.kinvault.e2ee.audit.AuditSink;
import net.kinvault.e2ee.crypto.IdentityKey;
import net.kinvault.e2ee.crypto.IdentityKeyPair;
import net.kinvault.e2ee.device.DeviceDirectory;
import net.kinvault.e2ee.device.DeviceRecord;
import net.kinvault.e2ee.device.Directory;
import net.kinvault.e2ee.device.MessageSink;
import net.kinvault.e2ee.identity.IdentityManager;
import net.kinvault.e2ee.identity.PreKeyManager;
import net.kinvault.e2ee.message.EncryptedEnvelope;
import net.kinvault.e2ee.ratchet.RatchetEngine;
import net.kinvault.e2ee.rotation.KeyRotationListener;
import net.kinvault.e2ee.rotation.KeyRotationScheduler;
import net.kinvault.e2ee.rotation.RotationStatus;
import net.kinvault.e2ee.session.SessionAddress;
import net.kinvault.e2ee.session.SessionEstablisher;
import net.kinvault.e2ee.state.KeyMaterialStore;
import net.kinvault.e2ee.state.SecureKeyStorage;
import net.kinvault.e2ee.state.SessionCodec;
import net.kinvault.e2ee.state.SessionInfo;
import net.kinvault.e2ee.state.SessionLocks;
import net.kinvault.e2ee.state.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for one local device: wires the components together and reports every outcome as a
 * {@link Result} instead of throwing.
 */
public class EncryptionEngine implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(EncryptionEngine.class);

    private final String userId;
    private final String deviceId;
    private final String deviceName;
    private final EngineConfig config;
    private final Directory directory;
    private final IdentityManager identityManager;
    private final PreKeyManager preKeyManager;
    private final RatchetEngine ratchetEngine;
    private final DeviceDirectory deviceDirectory;
    private final KeyRotationScheduler rotationScheduler;
    private final ExecutorService workers;
    private final ScheduledExecutorService maintenance;

    private ScheduledFuture<?> maintenanceTask;

    private EncryptionEngine(Builder builder) {
        this.userId = Objects.requireNonNull(builder.userId, "userId");
        this.deviceId = Objects.requireNonNull(builder.deviceId, "deviceId");
        this.deviceName = builder.deviceName == null ? builder.deviceId : builder.deviceName;
        this.config = builder.config;
        this.directory = Objects.requireNonNull(builder.directory, "directory");
        Clock clock = builder.clock;

        AuditLogger auditLogger = new AuditLogger(builder.auditSink, builder.auditExecutor);
        KeyMaterialStore keyMaterialStore = new KeyMaterialStore(Objects.requireNonNull(builder.storage, "storage"));
        SessionCodec codec = new SessionCodec(config.getMaxStoredMessageKeys(), config.getMessageKeyLifetime(), clock);
        SessionLocks sessionLocks = new SessionLocks();
        SessionStore sessionStore = new SessionStore(keyMaterialStore, codec, sessionLocks,
            config.getSessionCacheCapacity(), config.getSessionCacheTtl(), clock);

        this.identityManager = new IdentityManager(keyMaterialStore, sessionStore, auditLogger);
        this.preKeyManager = new PreKeyManager(keyMaterialStore, identityManager, config, clock, auditLogger);
        SessionEstablisher establisher = new SessionEstablisher(identityManager, keyMaterialStore, codec, directory,
            clock, auditLogger);
        this.ratchetEngine = new RatchetEngine(sessionStore, sessionLocks, config, clock, auditLogger);
        this.deviceDirectory = new DeviceDirectory(deviceId, directory, establisher, ratchetEngine, sessionStore,
            sessionLocks, config, clock, auditLogger);
        this.rotationScheduler = new KeyRotationScheduler(keyMaterialStore, identityManager, preKeyManager, directory,
            userId, deviceId, deviceName, config, clock, auditLogger);
        this.workers = Executors.newCachedThreadPool();
        this.maintenance = Executors.newSingleThreadScheduledExecutor();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getUserId() {
        return userId;
    }

    public String getDeviceId() {
        return deviceId;
    }

    /**
     * Creates identity and pre-keys as needed, publishes this device's bundle and starts rotation tracking.
     */
    public Result<DeviceRecord> registerDevice() {
        try {
            DeviceRecord record = preKeyManager.registerDevice(directory, userId, deviceId, deviceName);
            rotationScheduler.initialize();
            return Result.success(record);
        } catch (E2eeException e) {
            return failure("registerDevice", e);
        }
    }

    public Result<IdentityKey> getIdentityKey() {
        try {
            return Result.success(identityManager.requireIdentity().getPublicKey());
        } catch (E2eeException e) {
            return failure("getIdentityKey", e);
        }
    }

    /**
     * Replaces the local identity, e.g. from a key backup.
     */
    public Result<Void> restoreIdentity(IdentityKeyPair identity) {
        try {
            identityManager.restoreIdentity(identity);
            return Result.success(null);
        } catch (E2eeException e) {
            return failure("restoreIdentity", e);
        }
    }

    public Result<Map<String, EncryptedEnvelope>> encryptForAllDevices(String peerUserId, byte[] plaintext) {
        return Result.success(deviceDirectory.encryptForAllDevices(plaintext, peerUserId));
    }

    public Result<Integer> sendToAllDevices(String peerUserId, byte[] plaintext, MessageSink sink) {
        return Result.success(deviceDirectory.sendToAllDevices(plaintext, peerUserId, sink));
    }

    public Result<EncryptedEnvelope> encryptForDevice(String peerUserId, String peerDeviceId, byte[] plaintext) {
        try {
            return Result.success(deviceDirectory.encryptForDevice(peerUserId, peerDeviceId, plaintext));
        } catch (E2eeException e) {
            return failure("encryptForDevice", e);
        }
    }

    public Result<byte[]> decrypt(String senderUserId, String senderDeviceId, EncryptedEnvelope envelope) {
        try {
            return Result.success(deviceDirectory.decryptFromDevice(senderUserId, senderDeviceId, envelope));
        } catch (E2eeException e) {
            return failure("decrypt", e);
        }
    }

    public Result<byte[]> decrypt(String senderUserId, String senderDeviceId, byte[] serializedEnvelope) {
        try {
            return decrypt(senderUserId, senderDeviceId, EncryptedEnvelope.deserialize(serializedEnvelope));
        } catch (E2eeException e) {
            return failure("decrypt", e);
        }
    }

    /**
     * Establishes a session with one peer device on a worker thread. Cancelling the future with interruption
     * before the session is stored leaves no partial state.
     */
    public Future<Result<Void>> establishAsync(String peerUserId, String peerDeviceId) {
        return workers.submit(() -> {
            try {
                deviceDirectory.establishSession(peerUserId, peerDeviceId);
                return Result.<Void>success(null);
            } catch (E2eeException e) {
                return failure("establish", e);
            } catch (CancellationException e) {
                logger.debug("Establishment with {}:{} cancelled", peerUserId, peerDeviceId);
                throw e;
            }
        });
    }

    public Result<SessionInfo> getSessionInfo(String peerUserId, String peerDeviceId) {
        try {
            return Result.success(ratchetEngine.getSessionInfo(sessionId(peerUserId, peerDeviceId)));
        } catch (E2eeException e) {
            return failure("getSessionInfo", e);
        }
    }

    public Result<byte[]> exportSession(String peerUserId, String peerDeviceId) {
        try {
            return Result.success(ratchetEngine.exportSession(sessionId(peerUserId, peerDeviceId)));
        } catch (E2eeException e) {
            return failure("exportSession", e);
        }
    }

    public Result<SessionInfo> importSession(byte[] blob) {
        try {
            return Result.success(ratchetEngine.importSession(blob));
        } catch (E2eeException e) {
            return failure("importSession", e);
        }
    }

    public Result<Void> removeDevice(String peerUserId, String peerDeviceId) {
        try {
            deviceDirectory.removeDevice(peerUserId, peerDeviceId);
            return Result.success(null);
        } catch (E2eeException e) {
            return failure("removeDevice", e);
        }
    }

    public Result<Integer> resetEncryption(String peerUserId) {
        try {
            return Result.success(deviceDirectory.resetEncryption(peerUserId));
        } catch (E2eeException e) {
            return failure("resetEncryption", e);
        }
    }

    public Result<Integer> getActiveSessionCount() {
        try {
            return Result.success(deviceDirectory.getActiveSessionCount());
        } catch (E2eeException e) {
            return failure("getActiveSessionCount", e);
        }
    }

    public Result<String> rotateKeys() {
        try {
            return Result.success(rotationScheduler.rotate());
        } catch (E2eeException e) {
            return failure("rotateKeys", e);
        }
    }

    public Result<RotationStatus> getRotationStatus() {
        try {
            return Result.success(rotationScheduler.getRotationStatus());
        } catch (E2eeException e) {
            return failure("getRotationStatus", e);
        }
    }

    public Result<byte[]> encryptToIdentity(IdentityKey recipient, byte[] plaintext) {
        try {
            return Result.success(rotationScheduler.encryptToIdentity(recipient, plaintext));
        } catch (E2eeException e) {
            return failure("encryptToIdentity", e);
        }
    }

    /**
     * @return the plaintext, or a successful result holding null if no retained key opens {@code sealed}
     */
    public Result<byte[]> decryptWithAnyKey(byte[] sealed) {
        try {
            return Result.success(rotationScheduler.decryptWithAnyKey(sealed));
        } catch (E2eeException e) {
            return failure("decryptWithAnyKey", e);
        }
    }

    public void addRotationListener(KeyRotationListener listener) {
        rotationScheduler.addListener(listener);
    }

    public void removeRotationListener(KeyRotationListener listener) {
        rotationScheduler.removeListener(listener);
    }

    /**
     * One maintenance pass: purges expired skipped keys, evicts idle cached sessions, drives key rotation and
     * tops up one-time pre-keys.
     */
    public Result<Void> tick() {
        try {
            int purged = ratchetEngine.tick();
            rotationScheduler.tick();
            if (identityManager.getIdentity() != null && preKeyManager.replenishIfNeeded() > 0) {
                preKeyManager.publish(directory, userId, preKeyManager.buildDeviceRecord(deviceId, deviceName));
            }
            logger.debug("Maintenance done, {} skipped keys purged", purged);
            return Result.success(null);
        } catch (E2eeException e) {
            return failure("tick", e);
        }
    }

    /**
     * Runs {@link #tick()} every maintenance interval until {@link #close()}.
     */
    public synchronized void start() {
        if (maintenanceTask != null) {
            return;
        }
        long period = config.getMaintenanceInterval().toMillis();
        maintenanceTask = maintenance.scheduleAtFixedRate(this::runMaintenance, period, period, TimeUnit.MILLISECONDS);
        logger.info("Maintenance scheduled every {}", config.getMaintenanceInterval());
    }

    private void runMaintenance() {
        Result<Void> result = tick();
        if (!result.isSuccess()) {
            logger.warn("Maintenance failed: {}", result);
        }
    }

    @Override
    public synchronized void close() {
        if (maintenanceTask != null) {
            maintenanceTask.cancel(false);
            maintenanceTask = null;
        }
        maintenance.shutdown();
        workers.shutdown();
    }

    private static String sessionId(String peerUserId, String peerDeviceId) {
        return new SessionAddress(peerUserId, peerDeviceId).toSessionId();
    }

    private static <T> Result<T> failure(String operation, E2eeException e) {
        if (e.getKind().isIntegrityFailure()) {
            logger.warn("{} failed: {} ({})", operation, e.getMessage(), e.getKind());
        } else {
            logger.debug("{} failed: {} ({})", operation, e.getMessage(), e.getKind());
        }
        return Result.failure(e);
    }

    public static class Builder {
        private String userId;
        private String deviceId;
        private String deviceName;
        private SecureKeyStorage storage;
        private Directory directory;
        private EngineConfig config = EngineConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private AuditSink auditSink = AuditSink.NONE;
        private Executor auditExecutor = Runnable::run;

        private Builder() {}

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder deviceName(String deviceName) {
            this.deviceName = deviceName;
            return this;
        }

        public Builder storage(SecureKeyStorage storage) {
            this.storage = storage;
            return this;
        }

        public Builder directory(Directory directory) {
            this.directory = directory;
            return this;
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder auditSink(AuditSink auditSink) {
            this.auditSink = auditSink;
            return this;
        }

        public Builder auditExecutor(Executor auditExecutor) {
            this.auditExecutor = auditExecutor;
            return this;
        }

        public EncryptionEngine build() {
            return new EncryptionEngine(this);
        }
    }
}
