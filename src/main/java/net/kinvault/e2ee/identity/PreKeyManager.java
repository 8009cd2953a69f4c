package net.kinvault.e2ee.identity;

import net.kinvault.e2ee.DirectoryUnavailableException;
import net.kinvault.e2ee.EngineConfig;
import net.kinvault.e2ee.KeyExhaustedException;
import net.kinvault.e2ee.KeyGenerationException;
import net.kinvault.e2ee.StorageFailureException;
import net.kinvault.e2ee.audit.AuditEventType;
import net.kinvault.e2ee.audit.AuditLogger;
import net.kinvault.e2ee.crypto.Crypto;
import net.kinvault.e2ee.crypto.DhKeyPair;
import net.kinvault.e2ee.crypto.IdentityKeyPair;
import net.kinvault.e2ee.device.DeviceRecord;
import net.kinvault.e2ee.device.Directory;
import net.kinvault.e2ee.device.PreKey;
import net.kinvault.e2ee.device.SignedPreKey;
import net.kinvault.e2ee.state.KeyMaterialStore;
import net.kinvault.e2ee.state.PreKeyRecord;
import net.kinvault.e2ee.state.SignedPreKeyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates signed and one-time pre-keys and assembles the device bundle published to the directory.
 */
public class PreKeyManager {
    private final static Logger logger = LoggerFactory.getLogger(PreKeyManager.class);

    private final KeyMaterialStore keyMaterialStore;
    private final IdentityManager identityManager;
    private final EngineConfig config;
    private final Clock clock;
    private final AuditLogger auditLogger;

    public PreKeyManager(KeyMaterialStore keyMaterialStore, IdentityManager identityManager, EngineConfig config,
                         Clock clock, AuditLogger auditLogger) {
        this.keyMaterialStore = keyMaterialStore;
        this.identityManager = identityManager;
        this.config = config;
        this.clock = clock;
        this.auditLogger = auditLogger;
    }

    /**
     * Signs a new pre-key with {@code identity} without storing it. See {@link #commitSignedPreKey}.
     */
    public SignedPreKeyRecord createSignedPreKey(IdentityKeyPair identity)
        throws KeyGenerationException, StorageFailureException {
        List<Integer> ids = keyMaterialStore.loadSignedPreKeyIds();
        int id = ids.isEmpty() ? 1 : ids.get(ids.size() - 1) + 1;
        DhKeyPair keyPair = Crypto.generateDh();
        byte[] signature = identity.sign(keyPair.getPublicKey());
        return new SignedPreKeyRecord(id, keyPair, signature, clock.instant());
    }

    /**
     * Stores {@code record} and makes it the signed pre-key advertised in new bundles. Older signed
     * pre-keys stay stored so that in-flight handshakes against them can still be accepted.
     */
    public void commitSignedPreKey(SignedPreKeyRecord record) throws StorageFailureException {
        keyMaterialStore.storeSignedPreKey(record);
        keyMaterialStore.storeCurrentSignedPreKeyId(record.getId());
    }

    public SignedPreKeyRecord generateSignedPreKey()
        throws KeyGenerationException, KeyExhaustedException, StorageFailureException {
        SignedPreKeyRecord record = createSignedPreKey(identityManager.requireIdentity());
        commitSignedPreKey(record);
        logger.debug("Generated signed pre-key {}", record.getId());
        return record;
    }

    /**
     * @return the currently advertised signed pre-key, or null if none was generated
     */
    public SignedPreKeyRecord getCurrentSignedPreKey() throws StorageFailureException {
        Integer id = keyMaterialStore.loadCurrentSignedPreKeyId();
        return id == null ? null : keyMaterialStore.loadSignedPreKey(id);
    }

    public List<PreKeyRecord> generateOneTimePreKeys(int count) throws KeyGenerationException, StorageFailureException {
        List<Integer> ids = keyMaterialStore.loadPreKeyIds();
        int nextId = ids.isEmpty() ? 1 : ids.get(ids.size() - 1) + 1;
        List<PreKeyRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            PreKeyRecord record = new PreKeyRecord(nextId + i, Crypto.generateDh());
            keyMaterialStore.storePreKey(record);
            records.add(record);
        }
        logger.debug("Generated {} one-time pre-keys starting at {}", count, nextId);
        return records;
    }

    public int getOneTimePreKeyCount() throws StorageFailureException {
        return keyMaterialStore.loadPreKeyIds().size();
    }

    /**
     * Generates one-time pre-keys up to the configured batch size when fewer than the configured minimum remain.
     *
     * @return number of keys generated
     */
    public int replenishIfNeeded() throws KeyGenerationException, StorageFailureException {
        int remaining = getOneTimePreKeyCount();
        if (remaining >= config.getMinOneTimePreKeys()) {
            return 0;
        }
        int count = Math.max(0, config.getOneTimePreKeyBatchSize() - remaining);
        generateOneTimePreKeys(count);
        logger.info("Replenished one-time pre-keys: {} remaining, {} generated", remaining, count);
        return count;
    }

    public DeviceRecord buildDeviceRecord(String deviceId, String deviceName)
        throws KeyGenerationException, KeyExhaustedException, StorageFailureException {
        IdentityKeyPair identity = identityManager.requireIdentity();
        SignedPreKeyRecord signedPreKey = getCurrentSignedPreKey();
        if (signedPreKey == null) {
            signedPreKey = generateSignedPreKey();
        }
        return buildDeviceRecord(deviceId, deviceName, identity, signedPreKey);
    }

    /**
     * Bundle for {@code identity} and {@code signedPreKey}, advertising every stored one-time pre-key.
     */
    public DeviceRecord buildDeviceRecord(String deviceId, String deviceName, IdentityKeyPair identity,
                                          SignedPreKeyRecord signedPreKey)
        throws KeyExhaustedException, StorageFailureException {
        List<PreKey> preKeys = new ArrayList<>();
        for (int id : keyMaterialStore.loadPreKeyIds()) {
            PreKeyRecord record = keyMaterialStore.loadPreKey(id);
            if (record != null) {
                preKeys.add(new PreKey(id, record.getKeyPair().getPublicKey()));
            }
        }
        Instant now = clock.instant();
        SignedPreKey published = new SignedPreKey(signedPreKey.getId(), signedPreKey.getKeyPair().getPublicKey(),
            signedPreKey.getSignature(), signedPreKey.getTimestamp());
        return new DeviceRecord(deviceId, deviceName, identity.getPublicKey(), published, preKeys,
            identityManager.getRegistrationId(), now, now);
    }

    /**
     * Ensures an identity, signed pre-key and a batch of one-time pre-keys exist, then publishes the bundle.
     */
    public DeviceRecord registerDevice(Directory directory, String userId, String deviceId, String deviceName)
        throws KeyGenerationException, KeyExhaustedException, StorageFailureException, DirectoryUnavailableException {
        if (identityManager.getIdentity() == null) {
            identityManager.generateIdentity();
        }
        if (getCurrentSignedPreKey() == null) {
            generateSignedPreKey();
        }
        replenishIfNeeded();
        DeviceRecord record = buildDeviceRecord(deviceId, deviceName);
        publish(directory, userId, record);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("deviceId", deviceId);
        metadata.put("operation", "register");
        auditLogger.log(AuditEventType.DEVICE_MANAGEMENT, "Device registered", metadata);
        logger.info("Registered device {} for {}", deviceId, userId);
        return record;
    }

    public void publish(Directory directory, String userId, DeviceRecord record) throws DirectoryUnavailableException {
        try {
            directory.publishDeviceBundle(userId, record);
        } catch (IOException e) {
            throw new DirectoryUnavailableException("Failed to publish bundle for device " + record.getDeviceId(), e);
        }
    }
}
