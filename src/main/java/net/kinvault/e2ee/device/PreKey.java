package net.kinvault.e2ee.device;

/**
 * Published half of a one-time pre-key.
 */
public final class PreKey {
    private final int id;
    private final byte[] publicKey;

    public PreKey(int id, byte[] publicKey) {
        this.id = id;
        this.publicKey = publicKey.clone();
    }

    public int getId() {
        return id;
    }

    public byte[] getPublicKey() {
        return publicKey.clone();
    }
}
