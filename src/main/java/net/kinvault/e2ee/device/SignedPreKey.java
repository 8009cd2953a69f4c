package net.kinvault.e2ee.device;

import java.time.Instant;

/**
 * Published half of a signed pre-key with the identity signature over its public key.
 */
public final class SignedPreKey {
    private final int id;
    private final byte[] publicKey;
    private final byte[] signature;
    private final Instant timestamp;

    public SignedPreKey(int id, byte[] publicKey, byte[] signature, Instant timestamp) {
        this.id = id;
        this.publicKey = publicKey.clone();
        this.signature = signature.clone();
        this.timestamp = timestamp;
    }

    public int getId() {
        return id;
    }

    public byte[] getPublicKey() {
        return publicKey.clone();
    }

    public byte[] getSignature() {
        return signature.clone();
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
