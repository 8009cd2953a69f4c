package net.kinvault.e2ee.identity;

import net.kinvault.e2ee.KeyExhaustedException;
import net.kinvault.e2ee.KeyGenerationException;
import net.kinvault.e2ee.StorageFailureException;
import net.kinvault.e2ee.audit.AuditEventType;
import net.kinvault.e2ee.audit.AuditLogger;
import net.kinvault.e2ee.crypto.Crypto;
import net.kinvault.e2ee.crypto.IdentityKeyPair;
import net.kinvault.e2ee.state.KeyMaterialStore;
import net.kinvault.e2ee.state.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;

/**
 * Owns the local device identity key pair and registration id.
 */
public class IdentityManager {
    private final static Logger logger = LoggerFactory.getLogger(IdentityManager.class);

    private final KeyMaterialStore keyMaterialStore;
    private final SessionStore sessionStore;
    private final AuditLogger auditLogger;

    private volatile IdentityKeyPair identity;

    public IdentityManager(KeyMaterialStore keyMaterialStore, SessionStore sessionStore, AuditLogger auditLogger) {
        this.keyMaterialStore = keyMaterialStore;
        this.sessionStore = sessionStore;
        this.auditLogger = auditLogger;
    }

    /**
     * Generates and stores a fresh identity and registration id, replacing any previous identity.
     */
    public synchronized IdentityKeyPair generateIdentity() throws KeyGenerationException, StorageFailureException {
        IdentityKeyPair generated = IdentityKeyPair.generate();
        int registrationId = Crypto.randomInt(Integer.MAX_VALUE - 1) + 1;
        keyMaterialStore.storeIdentity(generated);
        keyMaterialStore.storeRegistrationId(registrationId);
        identity = generated;
        logger.info("Generated identity {}", generated.getPublicKey().fingerprint());
        auditLogger.log(AuditEventType.ENCRYPTION_KEY_USAGE, "Identity key generated",
            Collections.singletonMap("operation", "generate"));
        return generated;
    }

    /**
     * @return the stored identity, or null if none has been generated
     */
    public IdentityKeyPair getIdentity() throws StorageFailureException {
        IdentityKeyPair current = identity;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (identity == null) {
                identity = keyMaterialStore.loadIdentity();
            }
            return identity;
        }
    }

    /**
     * @throws KeyExhaustedException if no identity exists yet
     */
    public IdentityKeyPair requireIdentity() throws KeyExhaustedException, StorageFailureException {
        IdentityKeyPair current = getIdentity();
        if (current == null) {
            throw new KeyExhaustedException("No local identity; generate or restore one first");
        }
        return current;
    }

    /**
     * Replaces the stored identity. Cached sessions are dropped so they are reloaded against the new identity.
     */
    public synchronized void restoreIdentity(IdentityKeyPair restored) throws StorageFailureException {
        keyMaterialStore.storeIdentity(restored);
        if (keyMaterialStore.loadRegistrationId() == null) {
            keyMaterialStore.storeRegistrationId(Crypto.randomInt(Integer.MAX_VALUE - 1) + 1);
        }
        identity = restored;
        sessionStore.invalidateCache();
        logger.info("Restored identity {}", restored.getPublicKey().fingerprint());
    }

    /**
     * @throws KeyExhaustedException if no identity exists yet
     */
    public int getRegistrationId() throws KeyExhaustedException, StorageFailureException {
        Integer registrationId = keyMaterialStore.loadRegistrationId();
        if (registrationId == null) {
            throw new KeyExhaustedException("No registration id; generate an identity first");
        }
        return registrationId;
    }
}
