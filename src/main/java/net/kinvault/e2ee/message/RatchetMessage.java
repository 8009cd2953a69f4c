package net.kinvault.e2ee.message;

import net.kinvault.e2ee.AuthenticationFailedException;
import net.kinvault.e2ee.crypto.Crypto;

import java.util.Arrays;

/**
 * One Double Ratchet message. Wire form: {@code header(40) || mac(32) || ciphertext}.
 */
public final class RatchetMessage {
    private final RatchetHeader header;
    private final byte[] ciphertext;
    private final byte[] mac;

    public RatchetMessage(RatchetHeader header, byte[] ciphertext, byte[] mac) {
        this.header = header;
        this.ciphertext = ciphertext.clone();
        this.mac = mac.clone();
    }

    public static RatchetMessage deserialize(byte[] serialized) throws AuthenticationFailedException {
        int prefix = RatchetHeader.SERIALIZED_LENGTH + Crypto.MAC_SIZE_BYTES;
        if (serialized == null || serialized.length <= prefix) {
            throw new AuthenticationFailedException("Malformed ratchet message");
        }
        RatchetHeader header = RatchetHeader.deserialize(Arrays.copyOfRange(serialized, 0, RatchetHeader.SERIALIZED_LENGTH));
        byte[] mac = Arrays.copyOfRange(serialized, RatchetHeader.SERIALIZED_LENGTH, prefix);
        byte[] ciphertext = Arrays.copyOfRange(serialized, prefix, serialized.length);
        return new RatchetMessage(header, ciphertext, mac);
    }

    public RatchetHeader getHeader() {
        return header;
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    public byte[] getMac() {
        return mac.clone();
    }

    public byte[] serialize() {
        return Crypto.concat(header.serialize(), mac, ciphertext);
    }
}
