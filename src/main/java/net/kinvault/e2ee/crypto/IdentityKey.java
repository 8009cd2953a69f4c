package net.kinvault.e2ee.crypto;

import java.security.InvalidKeyException;
import java.util.Arrays;
import java.util.Base64;

/**
 * Public half of a device identity: an X25519 key used in key agreement and an Ed25519 key that signs
 * pre-keys. Serialized as 64 bytes, agreement key first.
 */
public final class IdentityKey {
    public static final int SERIALIZED_LENGTH = 2 * Crypto.KEY_SIZE_BYTES;

    private final byte[] agreementKey;
    private final byte[] signingKey;

    public IdentityKey(byte[] agreementKey, byte[] signingKey) {
        if (agreementKey.length != Crypto.KEY_SIZE_BYTES || signingKey.length != Crypto.KEY_SIZE_BYTES) {
            throw new IllegalArgumentException("Identity keys must be " + Crypto.KEY_SIZE_BYTES + " bytes");
        }
        this.agreementKey = agreementKey.clone();
        this.signingKey = signingKey.clone();
    }

    public static IdentityKey deserialize(byte[] serialized) throws InvalidKeyException {
        if (serialized == null || serialized.length != SERIALIZED_LENGTH) {
            throw new InvalidKeyException("Bad identity key length");
        }
        return new IdentityKey(Arrays.copyOfRange(serialized, 0, Crypto.KEY_SIZE_BYTES),
            Arrays.copyOfRange(serialized, Crypto.KEY_SIZE_BYTES, SERIALIZED_LENGTH));
    }

    public byte[] getAgreementKey() {
        return agreementKey.clone();
    }

    public byte[] getSigningKey() {
        return signingKey.clone();
    }

    public byte[] serialize() {
        return Crypto.concat(agreementKey, signingKey);
    }

    /**
     * Short printable form for logs.
     */
    public String fingerprint() {
        return Base64.getEncoder().encodeToString(Arrays.copyOf(Crypto.sha256(serialize()), 8));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof IdentityKey)) return false;
        IdentityKey that = (IdentityKey) other;
        return Arrays.equals(agreementKey, that.agreementKey) && Arrays.equals(signingKey, that.signingKey);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(agreementKey) + Arrays.hashCode(signingKey);
    }

    @Override
    public String toString() {
        return "IdentityKey[" + fingerprint() + "]";
    }
}
