package net.kinvault.e2ee.message;

import net.kinvault.e2ee.AuthenticationFailedException;
import net.kinvault.e2ee.crypto.Crypto;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Per-message ratchet header: sender's current DH public key, length of the sender's previous
 * sending chain, and the index of this message in the current chain.
 */
public final class RatchetHeader {
    public static final int SERIALIZED_LENGTH = Crypto.KEY_SIZE_BYTES + 4 + 4;

    private final byte[] dh;
    private final int pn;
    private final int n;

    public RatchetHeader(byte[] dh, int pn, int n) {
        if (dh.length != Crypto.KEY_SIZE_BYTES) {
            throw new IllegalArgumentException("Ratchet key must be " + Crypto.KEY_SIZE_BYTES + " bytes");
        }
        this.dh = dh.clone();
        this.pn = pn;
        this.n = n;
    }

    public static RatchetHeader deserialize(byte[] serialized) throws AuthenticationFailedException {
        if (serialized == null || serialized.length != SERIALIZED_LENGTH) {
            throw new AuthenticationFailedException("Malformed ratchet header");
        }
        ByteBuffer buffer = ByteBuffer.wrap(serialized);
        byte[] dh = new byte[Crypto.KEY_SIZE_BYTES];
        buffer.get(dh);
        return new RatchetHeader(dh, buffer.getInt(), buffer.getInt());
    }

    public byte[] getDh() {
        return dh.clone();
    }

    public int getPn() {
        return pn;
    }

    public int getN() {
        return n;
    }

    /**
     * Canonical encoding, also used as authenticated data.
     */
    public byte[] serialize() {
        return ByteBuffer.allocate(SERIALIZED_LENGTH).put(dh).putInt(pn).putInt(n).array();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof RatchetHeader)) return false;
        RatchetHeader that = (RatchetHeader) other;
        return pn == that.pn && n == that.n && Arrays.equals(dh, that.dh);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(dh) + pn) + n;
    }

    @Override
    public String toString() {
        return "RatchetHeader[pn=" + pn + ", n=" + n + "]";
    }
}
