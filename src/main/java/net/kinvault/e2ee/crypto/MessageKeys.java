package net.kinvault.e2ee.crypto;

import javax.security.auth.Destroyable;
import java.util.Arrays;

/**
 * Per-message key material expanded from one message key: AES key, HMAC key and GCM nonce.
 */
public final class MessageKeys implements AutoCloseable, Destroyable {
    private final SecretBytes encryptionKey;
    private final SecretBytes macKey;
    private final byte[] iv;

    MessageKeys(SecretBytes encryptionKey, SecretBytes macKey, byte[] iv) {
        this.encryptionKey = encryptionKey;
        this.macKey = macKey;
        this.iv = iv;
    }

    public SecretBytes getEncryptionKey() {
        return encryptionKey;
    }

    public SecretBytes getMacKey() {
        return macKey;
    }

    public byte[] getIv() {
        return iv.clone();
    }

    @Override
    public void destroy() {
        encryptionKey.destroy();
        macKey.destroy();
        Arrays.fill(iv, (byte) 0);
    }

    @Override
    public boolean isDestroyed() {
        return encryptionKey.isDestroyed() && macKey.isDestroyed();
    }

    @Override
    public void close() {
        destroy();
    }
}
