package net.kinvault.e2ee.state;

import net.kinvault.e2ee.crypto.DhKeyPair;

import java.time.Instant;

/**
 * Local half of a signed pre-key together with the identity signature published alongside it.
 */
public final class SignedPreKeyRecord {
    private final int id;
    private final DhKeyPair keyPair;
    private final byte[] signature;
    private final Instant timestamp;

    public SignedPreKeyRecord(int id, DhKeyPair keyPair, byte[] signature, Instant timestamp) {
        this.id = id;
        this.keyPair = keyPair;
        this.signature = signature.clone();
        this.timestamp = timestamp;
    }

    public int getId() {
        return id;
    }

    public DhKeyPair getKeyPair() {
        return keyPair;
    }

    public byte[] getSignature() {
        return signature.clone();
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
