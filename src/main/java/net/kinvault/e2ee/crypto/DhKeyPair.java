package net.kinvault.e2ee.crypto;

import javax.security.auth.Destroyable;

/**
 * Raw X25519 key pair. The private half is held in a {@link SecretBytes} and wiped by {@link #destroy()}.
 */
public final class DhKeyPair implements AutoCloseable, Destroyable {
    private final byte[] publicKey;
    private final SecretBytes privateKey;

    public DhKeyPair(byte[] publicKey, SecretBytes privateKey) {
        if (publicKey.length != Crypto.KEY_SIZE_BYTES || privateKey.length() != Crypto.KEY_SIZE_BYTES) {
            throw new IllegalArgumentException("X25519 keys must be " + Crypto.KEY_SIZE_BYTES + " bytes");
        }
        this.publicKey = publicKey.clone();
        this.privateKey = privateKey;
    }

    public byte[] getPublicKey() {
        return publicKey.clone();
    }

    public SecretBytes getPrivateKey() {
        return privateKey;
    }

    public DhKeyPair copy() {
        return new DhKeyPair(publicKey, privateKey.duplicate());
    }

    @Override
    public void destroy() {
        privateKey.destroy();
    }

    @Override
    public boolean isDestroyed() {
        return privateKey.isDestroyed();
    }

    @Override
    public void close() {
        destroy();
    }
}
