package net.kinvault.e2ee.message;

import net.kinvault.e2ee.AuthenticationFailedException;
import net.kinvault.e2ee.PeerBundleInvalidException;

import java.util.Arrays;

/**
 * What is delivered to one recipient device: a ratchet message, preceded by the initial handshake
 * while the session is still unacknowledged.
 */
public final class EncryptedEnvelope {
    private static final byte WITHOUT_HANDSHAKE = 0;
    private static final byte WITH_HANDSHAKE = 1;

    private final RatchetMessage message;
    private final InitialHandshake handshake;

    public EncryptedEnvelope(RatchetMessage message, InitialHandshake handshake) {
        this.message = message;
        this.handshake = handshake;
    }

    public static EncryptedEnvelope deserialize(byte[] serialized)
        throws AuthenticationFailedException, PeerBundleInvalidException {
        if (serialized == null || serialized.length < 1) {
            throw new AuthenticationFailedException("Empty envelope");
        }
        if (serialized[0] == WITH_HANDSHAKE) {
            int end = 1 + InitialHandshake.SERIALIZED_LENGTH;
            if (serialized.length <= end) {
                throw new AuthenticationFailedException("Truncated envelope");
            }
            InitialHandshake handshake = InitialHandshake.deserialize(Arrays.copyOfRange(serialized, 1, end));
            return new EncryptedEnvelope(RatchetMessage.deserialize(Arrays.copyOfRange(serialized, end, serialized.length)), handshake);
        } else if (serialized[0] == WITHOUT_HANDSHAKE) {
            return new EncryptedEnvelope(RatchetMessage.deserialize(Arrays.copyOfRange(serialized, 1, serialized.length)), null);
        }
        throw new AuthenticationFailedException("Unknown envelope type: " + serialized[0]);
    }

    public RatchetMessage getMessage() {
        return message;
    }

    /**
     * @return the handshake, or null once the session has been acknowledged by the recipient
     */
    public InitialHandshake getHandshake() {
        return handshake;
    }

    public boolean hasHandshake() {
        return handshake != null;
    }

    public byte[] serialize() {
        byte[] body = message.serialize();
        if (handshake == null) {
            byte[] out = new byte[1 + body.length];
            out[0] = WITHOUT_HANDSHAKE;
            System.arraycopy(body, 0, out, 1, body.length);
            return out;
        }
        byte[] handshakeBytes = handshake.serialize();
        byte[] out = new byte[1 + handshakeBytes.length + body.length];
        out[0] = WITH_HANDSHAKE;
        System.arraycopy(handshakeBytes, 0, out, 1, handshakeBytes.length);
        System.arraycopy(body, 0, out, 1 + handshakeBytes.length, body.length);
        return out;
    }
}
