package net.kinvault.e2ee.message;

import net.kinvault.e2ee.PeerBundleInvalidException;
import net.kinvault.e2ee.crypto.Crypto;
import net.kinvault.e2ee.crypto.IdentityKey;

import java.nio.ByteBuffer;
import java.security.InvalidKeyException;

/**
 * Handshake material the initiator attaches to its messages until the responder replies: the
 * initiator identity, its ephemeral (base) key and which of the responder's pre-keys were used.
 */
public final class InitialHandshake {
    public static final int SERIALIZED_LENGTH = IdentityKey.SERIALIZED_LENGTH + Crypto.KEY_SIZE_BYTES + 4 + 1 + 4 + 4;

    private final IdentityKey initiatorIdentityKey;
    private final byte[] ephemeralKey;
    private final int signedPreKeyId;
    private final Integer oneTimePreKeyId;
    private final int registrationId;

    public InitialHandshake(IdentityKey initiatorIdentityKey, byte[] ephemeralKey, int signedPreKeyId,
                            Integer oneTimePreKeyId, int registrationId) {
        if (ephemeralKey.length != Crypto.KEY_SIZE_BYTES) {
            throw new IllegalArgumentException("Ephemeral key must be " + Crypto.KEY_SIZE_BYTES + " bytes");
        }
        this.initiatorIdentityKey = initiatorIdentityKey;
        this.ephemeralKey = ephemeralKey.clone();
        this.signedPreKeyId = signedPreKeyId;
        this.oneTimePreKeyId = oneTimePreKeyId;
        this.registrationId = registrationId;
    }

    public static InitialHandshake deserialize(byte[] serialized) throws PeerBundleInvalidException {
        if (serialized == null || serialized.length != SERIALIZED_LENGTH) {
            throw new PeerBundleInvalidException("Malformed handshake");
        }
        ByteBuffer buffer = ByteBuffer.wrap(serialized);
        byte[] identity = new byte[IdentityKey.SERIALIZED_LENGTH];
        byte[] ephemeral = new byte[Crypto.KEY_SIZE_BYTES];
        buffer.get(identity).get(ephemeral);
        int signedPreKeyId = buffer.getInt();
        boolean hasOneTimePreKey = buffer.get() != 0;
        int oneTimePreKeyId = buffer.getInt();
        int registrationId = buffer.getInt();
        try {
            return new InitialHandshake(IdentityKey.deserialize(identity), ephemeral, signedPreKeyId,
                hasOneTimePreKey ? oneTimePreKeyId : null, registrationId);
        } catch (InvalidKeyException e) {
            throw new PeerBundleInvalidException("Malformed handshake identity", e);
        }
    }

    public IdentityKey getInitiatorIdentityKey() {
        return initiatorIdentityKey;
    }

    public byte[] getEphemeralKey() {
        return ephemeralKey.clone();
    }

    public int getSignedPreKeyId() {
        return signedPreKeyId;
    }

    /**
     * @return the consumed one-time pre-key id, or null when the bundle had none left
     */
    public Integer getOneTimePreKeyId() {
        return oneTimePreKeyId;
    }

    public int getRegistrationId() {
        return registrationId;
    }

    public byte[] serialize() {
        return ByteBuffer.allocate(SERIALIZED_LENGTH)
            .put(initiatorIdentityKey.serialize())
            .put(ephemeralKey)
            .putInt(signedPreKeyId)
            .put((byte) (oneTimePreKeyId != null ? 1 : 0))
            .putInt(oneTimePreKeyId != null ? oneTimePreKeyId : 0)
            .putInt(registrationId)
            .array();
    }
}
