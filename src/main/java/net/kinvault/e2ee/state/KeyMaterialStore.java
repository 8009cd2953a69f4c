package net.kinvault.e2ee.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.kinvault.e2ee.StorageFailureException;
import net.kinvault.e2ee.crypto.DhKeyPair;
import net.kinvault.e2ee.crypto.IdentityKeyPair;
import net.kinvault.e2ee.crypto.SecretBytes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Typed view over {@link SecureKeyStorage}. The only component that writes key material or session blobs
 * to storage.
 * <p>
 * Layout: {@code identity}, {@code registration-id}, {@code signed-prekey/<id>}, {@code signed-prekey-current},
 * {@code prekey/<id>}, {@code rotating-key/<id>}, {@code rotating-key-active}, {@code session/<sessionId>}.
 */
public class KeyMaterialStore {
    private final static Logger logger = LoggerFactory.getLogger(KeyMaterialStore.class);

    static final String IDENTITY = "identity";
    static final String REGISTRATION_ID = "registration-id";
    static final String SIGNED_PREKEY_PREFIX = "signed-prekey/";
    static final String SIGNED_PREKEY_CURRENT = "signed-prekey-current";
    static final String PREKEY_PREFIX = "prekey/";
    static final String ROTATING_KEY_PREFIX = "rotating-key/";
    static final String ROTATING_KEY_ACTIVE = "rotating-key-active";
    static final String SESSION_PREFIX = "session/";

    private final SecureKeyStorage storage;
    private final ObjectMapper jsonProcessor;

    public KeyMaterialStore(SecureKeyStorage storage) {
        this.storage = storage;
        this.jsonProcessor = createStorageObjectMapper();
    }

    static ObjectMapper createStorageObjectMapper() {
        return new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    // Identity

    public IdentityKeyPair loadIdentity() throws StorageFailureException {
        IdentityEntry entry = read(IDENTITY, IdentityEntry.class);
        return entry == null ? null : entry.toKeyPair();
    }

    public void storeIdentity(IdentityKeyPair identity) throws StorageFailureException {
        write(IDENTITY, IdentityEntry.of(identity));
    }

    public Integer loadRegistrationId() throws StorageFailureException {
        byte[] value = storage.get(REGISTRATION_ID);
        return value == null || value.length != 4 ? null : ByteBuffer.wrap(value).getInt();
    }

    public void storeRegistrationId(int registrationId) throws StorageFailureException {
        storage.set(REGISTRATION_ID, ByteBuffer.allocate(4).putInt(registrationId).array());
    }

    // Signed pre-keys

    public SignedPreKeyRecord loadSignedPreKey(int id) throws StorageFailureException {
        SignedPreKeyEntry entry = read(SIGNED_PREKEY_PREFIX + id, SignedPreKeyEntry.class);
        return entry == null ? null : entry.toRecord();
    }

    public void storeSignedPreKey(SignedPreKeyRecord record) throws StorageFailureException {
        write(SIGNED_PREKEY_PREFIX + record.getId(), SignedPreKeyEntry.of(record));
    }

    public void removeSignedPreKey(int id) throws StorageFailureException {
        storage.delete(SIGNED_PREKEY_PREFIX + id);
    }

    public List<Integer> loadSignedPreKeyIds() throws StorageFailureException {
        return idsUnder(SIGNED_PREKEY_PREFIX);
    }

    public Integer loadCurrentSignedPreKeyId() throws StorageFailureException {
        byte[] value = storage.get(SIGNED_PREKEY_CURRENT);
        return value == null || value.length != 4 ? null : ByteBuffer.wrap(value).getInt();
    }

    public void storeCurrentSignedPreKeyId(int id) throws StorageFailureException {
        storage.set(SIGNED_PREKEY_CURRENT, ByteBuffer.allocate(4).putInt(id).array());
    }

    // One-time pre-keys

    public PreKeyRecord loadPreKey(int id) throws StorageFailureException {
        PreKeyEntry entry = read(PREKEY_PREFIX + id, PreKeyEntry.class);
        return entry == null ? null : entry.toRecord();
    }

    public void storePreKey(PreKeyRecord record) throws StorageFailureException {
        write(PREKEY_PREFIX + record.getId(), PreKeyEntry.of(record));
    }

    public void removePreKey(int id) throws StorageFailureException {
        storage.delete(PREKEY_PREFIX + id);
    }

    public List<Integer> loadPreKeyIds() throws StorageFailureException {
        return idsUnder(PREKEY_PREFIX);
    }

    // Rotating identity keys

    public RotatingKey loadRotatingKey(String id) throws StorageFailureException {
        RotatingKeyEntry entry = read(ROTATING_KEY_PREFIX + id, RotatingKeyEntry.class);
        return entry == null ? null : entry.toKey();
    }

    public void storeRotatingKey(RotatingKey key) throws StorageFailureException {
        write(ROTATING_KEY_PREFIX + key.getId(), RotatingKeyEntry.of(key));
    }

    public void removeRotatingKey(String id) throws StorageFailureException {
        storage.delete(ROTATING_KEY_PREFIX + id);
    }

    /**
     * @return all retained generations, newest first
     */
    public List<RotatingKey> loadRotatingKeys() throws StorageFailureException {
        List<RotatingKey> keys = new ArrayList<>();
        for (String key : storage.keys(ROTATING_KEY_PREFIX)) {
            RotatingKey rotatingKey = loadRotatingKey(key.substring(ROTATING_KEY_PREFIX.length()));
            if (rotatingKey != null) {
                keys.add(rotatingKey);
            }
        }
        keys.sort(Comparator.comparingInt(RotatingKey::getVersion).reversed());
        return keys;
    }

    public String loadActiveRotatingKeyId() throws StorageFailureException {
        byte[] value = storage.get(ROTATING_KEY_ACTIVE);
        return value == null ? null : new String(value, UTF_8);
    }

    public void storeActiveRotatingKeyId(String id) throws StorageFailureException {
        storage.set(ROTATING_KEY_ACTIVE, id.getBytes(UTF_8));
    }

    // Sessions

    public byte[] loadSessionBlob(String sessionId) throws StorageFailureException {
        return storage.get(SESSION_PREFIX + sessionId);
    }

    public void storeSessionBlob(String sessionId, byte[] blob) throws StorageFailureException {
        storage.set(SESSION_PREFIX + sessionId, blob);
    }

    public void removeSessionBlob(String sessionId) throws StorageFailureException {
        storage.delete(SESSION_PREFIX + sessionId);
    }

    public List<String> loadSessionIds() throws StorageFailureException {
        List<String> ids = new ArrayList<>();
        for (String key : storage.keys(SESSION_PREFIX)) {
            ids.add(key.substring(SESSION_PREFIX.length()));
        }
        return ids;
    }

    private List<Integer> idsUnder(String prefix) throws StorageFailureException {
        List<Integer> ids = new ArrayList<>();
        for (String key : storage.keys(prefix)) {
            try {
                ids.add(Integer.parseInt(key.substring(prefix.length())));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring malformed key entry {}", key);
            }
        }
        ids.sort(null);
        return ids;
    }

    private <T> T read(String key, Class<T> type) throws StorageFailureException {
        byte[] value = storage.get(key);
        if (value == null) {
            return null;
        }
        try {
            return jsonProcessor.readValue(value, type);
        } catch (IOException e) {
            throw new StorageFailureException("Corrupt entry " + key, e);
        } finally {
            Arrays.fill(value, (byte) 0);
        }
    }

    private void write(String key, Object entry) throws StorageFailureException {
        byte[] value;
        try {
            value = jsonProcessor.writeValueAsBytes(entry);
        } catch (JsonProcessingException e) {
            throw new StorageFailureException("Failed to encode entry " + key, e);
        }
        try {
            storage.set(key, value);
        } finally {
            Arrays.fill(value, (byte) 0);
        }
    }

    public static class KeyPairEntry {
        public byte[] publicKey;
        public byte[] privateKey;

        static KeyPairEntry of(DhKeyPair keyPair) {
            KeyPairEntry entry = new KeyPairEntry();
            entry.publicKey = keyPair.getPublicKey();
            entry.privateKey = keyPair.getPrivateKey().copy();
            return entry;
        }

        DhKeyPair toKeyPair() {
            return new DhKeyPair(publicKey, SecretBytes.wrap(privateKey));
        }
    }

    public static class IdentityEntry {
        public KeyPairEntry agreement;
        public byte[] signingPublicKey;
        public byte[] signingPrivateKey;

        static IdentityEntry of(IdentityKeyPair identity) {
            IdentityEntry entry = new IdentityEntry();
            entry.agreement = KeyPairEntry.of(identity.getAgreementKeyPair());
            entry.signingPublicKey = identity.getSigningPublicKey();
            entry.signingPrivateKey = identity.getSigningPrivateKey().copy();
            return entry;
        }

        IdentityKeyPair toKeyPair() {
            return new IdentityKeyPair(agreement.toKeyPair(), signingPublicKey, SecretBytes.wrap(signingPrivateKey));
        }
    }

    public static class PreKeyEntry {
        public int id;
        public KeyPairEntry keyPair;

        static PreKeyEntry of(PreKeyRecord record) {
            PreKeyEntry entry = new PreKeyEntry();
            entry.id = record.getId();
            entry.keyPair = KeyPairEntry.of(record.getKeyPair());
            return entry;
        }

        PreKeyRecord toRecord() {
            return new PreKeyRecord(id, keyPair.toKeyPair());
        }
    }

    public static class SignedPreKeyEntry {
        public int id;
        public KeyPairEntry keyPair;
        public byte[] signature;
        public long timestamp;

        static SignedPreKeyEntry of(SignedPreKeyRecord record) {
            SignedPreKeyEntry entry = new SignedPreKeyEntry();
            entry.id = record.getId();
            entry.keyPair = KeyPairEntry.of(record.getKeyPair());
            entry.signature = record.getSignature();
            entry.timestamp = record.getTimestamp().toEpochMilli();
            return entry;
        }

        SignedPreKeyRecord toRecord() {
            return new SignedPreKeyRecord(id, keyPair.toKeyPair(), signature, Instant.ofEpochMilli(timestamp));
        }
    }

    public static class RotatingKeyEntry {
        public String id;
        public IdentityEntry keyPair;
        public long createdAt;
        public long expiresAt;
        public int version;
        public boolean active;

        static RotatingKeyEntry of(RotatingKey key) {
            RotatingKeyEntry entry = new RotatingKeyEntry();
            entry.id = key.getId();
            entry.keyPair = IdentityEntry.of(key.getKeyPair());
            entry.createdAt = key.getCreatedAt().toEpochMilli();
            entry.expiresAt = key.getExpiresAt().toEpochMilli();
            entry.version = key.getVersion();
            entry.active = key.isActive();
            return entry;
        }

        RotatingKey toKey() {
            return new RotatingKey(id, keyPair.toKeyPair(), Instant.ofEpochMilli(createdAt),
                Instant.ofEpochMilli(expiresAt), version, active);
        }
    }
}
