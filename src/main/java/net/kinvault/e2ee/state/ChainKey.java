package net.kinvault.e2ee.state;

import net.kinvault.e2ee.crypto.Crypto;
import net.kinvault.e2ee.crypto.SecretBytes;

import javax.security.auth.Destroyable;
import java.util.Arrays;

/**
 * Symmetric ratchet position: a chain key and the index of the next message it will key.
 * <p>
 * {@link #advance()} consumes this chain key exactly once and wipes it.
 */
public final class ChainKey implements Destroyable {
    private final SecretBytes key;
    private final int index;

    public ChainKey(SecretBytes key, int index) {
        this.key = key;
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    /**
     * @return a copy of the key bytes
     * @throws IllegalStateException if this chain key was already advanced or destroyed
     */
    public byte[] getKey() {
        return key.copy();
    }

    SecretBytes getSecret() {
        return key;
    }

    /**
     * Derives the message key for {@link #getIndex()} and the next chain key, then destroys this one.
     */
    public Step advance() {
        byte[] derived = Crypto.kdfCk(key.bytes());
        try {
            ChainKey next = new ChainKey(SecretBytes.copyOfRange(derived, 0, Crypto.KEY_SIZE_BYTES), index + 1);
            SecretBytes messageKey = SecretBytes.copyOfRange(derived, Crypto.KEY_SIZE_BYTES, derived.length);
            return new Step(next, messageKey, index);
        } finally {
            Arrays.fill(derived, (byte) 0);
            destroy();
        }
    }

    public ChainKey copy() {
        return new ChainKey(key.duplicate(), index);
    }

    @Override
    public void destroy() {
        key.destroy();
    }

    @Override
    public boolean isDestroyed() {
        return key.isDestroyed();
    }

    /**
     * Output of one chain step. The caller owns {@link #getMessageKey()}.
     */
    public static final class Step {
        private final ChainKey next;
        private final SecretBytes messageKey;
        private final int index;

        private Step(ChainKey next, SecretBytes messageKey, int index) {
            this.next = next;
            this.messageKey = messageKey;
            this.index = index;
        }

        public ChainKey getNext() {
            return next;
        }

        public SecretBytes getMessageKey() {
            return messageKey;
        }

        public int getIndex() {
            return index;
        }
    }
}
