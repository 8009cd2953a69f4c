package net.kinvault.e2ee.state;

import net.kinvault.e2ee.crypto.DhKeyPair;

/**
 * Local half of a one-time pre-key. Deleted as soon as a handshake consumes it.
 */
public final class PreKeyRecord {
    private final int id;
    private final DhKeyPair keyPair;

    public PreKeyRecord(int id, DhKeyPair keyPair) {
        this.id = id;
        this.keyPair = keyPair;
    }

    public int getId() {
        return id;
    }

    public DhKeyPair getKeyPair() {
        return keyPair;
    }
}
