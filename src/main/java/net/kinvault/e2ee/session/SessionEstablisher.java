package net.kinvault.e2ee.session;

import net.kinvault.e2ee.DirectoryUnavailableException;
import net.kinvault.e2ee.KeyExhaustedException;
import net.kinvault.e2ee.KeyGenerationException;
import net.kinvault.e2ee.PeerBundleInvalidException;
import net.kinvault.e2ee.StorageFailureException;
import net.kinvault.e2ee.audit.AuditEventType;
import net.kinvault.e2ee.audit.AuditLogger;
import net.kinvault.e2ee.crypto.Crypto;
import net.kinvault.e2ee.crypto.DhKeyPair;
import net.kinvault.e2ee.crypto.IdentityKey;
import net.kinvault.e2ee.crypto.IdentityKeyPair;
import net.kinvault.e2ee.crypto.SecretBytes;
import net.kinvault.e2ee.device.DeviceRecord;
import net.kinvault.e2ee.device.Directory;
import net.kinvault.e2ee.device.PreKey;
import net.kinvault.e2ee.device.SignedPreKey;
import net.kinvault.e2ee.identity.IdentityManager;
import net.kinvault.e2ee.message.InitialHandshake;
import net.kinvault.e2ee.state.ChainKey;
import net.kinvault.e2ee.state.KeyMaterialStore;
import net.kinvault.e2ee.state.PreKeyRecord;
import net.kinvault.e2ee.state.RotatingKey;
import net.kinvault.e2ee.state.SessionCodec;
import net.kinvault.e2ee.state.SessionState;
import net.kinvault.e2ee.state.SignedPreKeyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.InvalidKeyException;
import java.time.Clock;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Builds initial Double Ratchet state from a peer's published bundle (initiator) or from a received
 * handshake (responder).
 * <p>
 * Neither side persists the returned session; the caller commits it once the surrounding operation succeeds.
 */
public class SessionEstablisher {
    private final static Logger logger = LoggerFactory.getLogger(SessionEstablisher.class);

    private final IdentityManager identityManager;
    private final KeyMaterialStore keyMaterialStore;
    private final SessionCodec codec;
    private final Directory directory;
    private final Clock clock;
    private final AuditLogger auditLogger;

    public SessionEstablisher(IdentityManager identityManager, KeyMaterialStore keyMaterialStore, SessionCodec codec,
                              Directory directory, Clock clock, AuditLogger auditLogger) {
        this.identityManager = identityManager;
        this.keyMaterialStore = keyMaterialStore;
        this.codec = codec;
        this.directory = directory;
        this.clock = clock;
        this.auditLogger = auditLogger;
    }

    /**
     * Starts a session with {@code peer} from its bundle. Uses the first advertised one-time pre-key, if any,
     * and reports it consumed to the directory.
     *
     * @throws PeerBundleInvalidException if the signed pre-key signature does not verify or a key is malformed
     * @throws KeyExhaustedException      if the bundle has no signed pre-key or there is no local identity
     * @throws CancellationException      if the calling thread was interrupted; nothing was reported or stored
     */
    public SessionState initiate(SessionAddress peer, DeviceRecord bundle)
        throws PeerBundleInvalidException, KeyExhaustedException, KeyGenerationException, StorageFailureException,
        DirectoryUnavailableException {
        IdentityKeyPair identity = identityManager.requireIdentity();
        IdentityKey theirIdentity = bundle.getIdentityKey();
        SignedPreKey signedPreKey = bundle.getSignedPreKey();
        if (signedPreKey == null) {
            throw new KeyExhaustedException("Device " + peer + " has no signed pre-key");
        }
        if (!Crypto.verify(theirIdentity.getSigningKey(), signedPreKey.getPublicKey(), signedPreKey.getSignature())) {
            auditLogger.securityWarning("Invalid signed pre-key signature", peer.toSessionId(), "bad-signature");
            throw new PeerBundleInvalidException("Signed pre-key signature invalid for " + peer);
        }
        PreKey oneTimePreKey = bundle.getOneTimePreKeys().isEmpty() ? null : bundle.getOneTimePreKeys().get(0);

        int identityVersion = currentIdentityVersion();
        DhKeyPair ephemeral = Crypto.generateDh();
        SessionState state = null;
        byte[] dh1 = null, dh2 = null, dh3 = null, dh4 = null, secret = null, ratchetInput = null, derived = null;
        try {
            dh1 = Crypto.dh(identity.getAgreementKeyPair(), signedPreKey.getPublicKey());
            dh2 = Crypto.dh(ephemeral, theirIdentity.getAgreementKey());
            dh3 = Crypto.dh(ephemeral, signedPreKey.getPublicKey());
            dh4 = oneTimePreKey == null ? new byte[0] : Crypto.dh(ephemeral, oneTimePreKey.getPublicKey());
            secret = Crypto.kdf(Crypto.concat(dh1, dh2, dh3, dh4));
            ratchetInput = Crypto.dh(ephemeral, signedPreKey.getPublicKey());
            derived = Crypto.kdfRk(secret, ratchetInput);

            byte[] associatedData = Crypto.concat(identity.getPublicKey().serialize(), theirIdentity.serialize());
            state = new SessionState(peer.toSessionId(), theirIdentity, associatedData, ephemeral.getPublicKey(),
                clock.instant(), codec.newSkippedMessageKeys());
            state.setRootKey(SecretBytes.copyOfRange(derived, 0, Crypto.KEY_SIZE_BYTES));
            state.setSendingChain(new ChainKey(SecretBytes.copyOfRange(derived, Crypto.KEY_SIZE_BYTES, derived.length), 0));
            state.setSendingRatchetKey(ephemeral);
            state.setReceivingRatchetKey(signedPreKey.getPublicKey());
            state.setLocalIdentityVersion(identityVersion);
            state.setPendingHandshake(new InitialHandshake(identity.getPublicKey(), ephemeral.getPublicKey(),
                signedPreKey.getId(), oneTimePreKey == null ? null : oneTimePreKey.getId(),
                identityManager.getRegistrationId()));

            checkNotCancelled();
            if (oneTimePreKey != null) {
                directory.consumeOneTimePreKey(peer.getUserId(), peer.getDeviceId(), oneTimePreKey.getId());
            }
        } catch (InvalidKeyException e) {
            destroy(state, ephemeral);
            throw new PeerBundleInvalidException("Malformed key in bundle for " + peer, e);
        } catch (IOException e) {
            destroy(state, ephemeral);
            throw new DirectoryUnavailableException("Failed to report one-time pre-key use for " + peer, e);
        } catch (RuntimeException | KeyExhaustedException | StorageFailureException e) {
            destroy(state, ephemeral);
            throw e;
        } finally {
            Crypto.wipe(dh1, dh2, dh3, dh4, secret, ratchetInput, derived);
        }

        logger.info("Initiated session with {} (one-time pre-key: {})", peer, oneTimePreKey != null);
        auditLogger.log(AuditEventType.DEVICE_MANAGEMENT, "Session initiated", sessionMetadata(peer, "initiate"));
        return state;
    }

    /**
     * Responds to a handshake received from {@code peer}. The one-time pre-key it names stays stored until
     * {@link #consumeLocalPreKey(InitialHandshake)} is called after the first message decrypts.
     *
     * @throws KeyExhaustedException if the named signed or one-time pre-key is not (or no longer) stored
     */
    public SessionState accept(SessionAddress peer, InitialHandshake handshake)
        throws KeyExhaustedException, PeerBundleInvalidException, KeyGenerationException, StorageFailureException {
        IdentityKeyPair identity = identityManager.requireIdentity();
        SignedPreKeyRecord signedPreKey = keyMaterialStore.loadSignedPreKey(handshake.getSignedPreKeyId());
        if (signedPreKey == null) {
            throw new KeyExhaustedException("Unknown signed pre-key " + handshake.getSignedPreKeyId());
        }
        PreKeyRecord oneTimePreKey = null;
        if (handshake.getOneTimePreKeyId() != null) {
            oneTimePreKey = keyMaterialStore.loadPreKey(handshake.getOneTimePreKeyId());
            if (oneTimePreKey == null) {
                auditLogger.securityWarning("Handshake names a consumed one-time pre-key", peer.toSessionId(),
                    "pre-key-reuse");
                throw new KeyExhaustedException("One-time pre-key " + handshake.getOneTimePreKeyId() + " already used");
            }
        }

        IdentityKey theirIdentity = handshake.getInitiatorIdentityKey();
        byte[] theirEphemeral = handshake.getEphemeralKey();
        int identityVersion = currentIdentityVersion();
        DhKeyPair ratchetKeyPair = Crypto.generateDh();
        SessionState state = null;
        byte[] dh1 = null, dh2 = null, dh3 = null, dh4 = null, secret = null;
        byte[] receivingInput = null, receiving = null, rootKey = null, sendingInput = null, sending = null;
        try {
            dh1 = Crypto.dh(signedPreKey.getKeyPair(), theirIdentity.getAgreementKey());
            dh2 = Crypto.dh(identity.getAgreementKeyPair(), theirEphemeral);
            dh3 = Crypto.dh(signedPreKey.getKeyPair(), theirEphemeral);
            dh4 = oneTimePreKey == null ? new byte[0] : Crypto.dh(oneTimePreKey.getKeyPair(), theirEphemeral);
            secret = Crypto.kdf(Crypto.concat(dh1, dh2, dh3, dh4));

            receivingInput = Crypto.dh(signedPreKey.getKeyPair(), theirEphemeral);
            receiving = Crypto.kdfRk(secret, receivingInput);
            sendingInput = Crypto.dh(ratchetKeyPair, theirEphemeral);
            rootKey = Arrays.copyOfRange(receiving, 0, Crypto.KEY_SIZE_BYTES);
            sending = Crypto.kdfRk(rootKey, sendingInput);

            byte[] associatedData = Crypto.concat(theirIdentity.serialize(), identity.getPublicKey().serialize());
            state = new SessionState(peer.toSessionId(), theirIdentity, associatedData, theirEphemeral,
                clock.instant(), codec.newSkippedMessageKeys());
            state.setReceivingChain(new ChainKey(
                SecretBytes.copyOfRange(receiving, Crypto.KEY_SIZE_BYTES, receiving.length), 0));
            state.setRootKey(SecretBytes.copyOfRange(sending, 0, Crypto.KEY_SIZE_BYTES));
            state.setSendingChain(new ChainKey(SecretBytes.copyOfRange(sending, Crypto.KEY_SIZE_BYTES, sending.length), 0));
            state.setSendingRatchetKey(ratchetKeyPair);
            state.setReceivingRatchetKey(theirEphemeral);
            state.setLocalIdentityVersion(identityVersion);
        } catch (InvalidKeyException e) {
            destroy(state, ratchetKeyPair);
            auditLogger.securityWarning("Malformed handshake key", peer.toSessionId(), "bad-key");
            throw new PeerBundleInvalidException("Malformed key in handshake from " + peer, e);
        } catch (RuntimeException e) {
            destroy(state, ratchetKeyPair);
            throw e;
        } finally {
            Crypto.wipe(dh1, dh2, dh3, dh4, secret, receivingInput, receiving, rootKey, sendingInput, sending);
        }

        logger.info("Accepted session from {}", peer);
        return state;
    }

    /**
     * Deletes the local one-time pre-key named by {@code handshake}, once the session it created is committed.
     */
    public void consumeLocalPreKey(InitialHandshake handshake) throws StorageFailureException {
        if (handshake.getOneTimePreKeyId() != null) {
            keyMaterialStore.removePreKey(handshake.getOneTimePreKeyId());
            logger.debug("Removed one-time pre-key {}", handshake.getOneTimePreKeyId());
        }
    }

    private int currentIdentityVersion() throws StorageFailureException {
        String activeId = keyMaterialStore.loadActiveRotatingKeyId();
        RotatingKey active = activeId == null ? null : keyMaterialStore.loadRotatingKey(activeId);
        if (active == null) {
            return 1;
        }
        active.getKeyPair().destroy();
        return active.getVersion();
    }

    private static void checkNotCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Session establishment cancelled");
        }
    }

    private static void destroy(SessionState state, DhKeyPair keyPair) {
        if (state != null) {
            state.destroy();
        }
        keyPair.destroy();
    }

    private static Map<String, Object> sessionMetadata(SessionAddress peer, String operation) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sessionId", peer.toSessionId());
        metadata.put("operation", operation);
        return metadata;
    }
}
