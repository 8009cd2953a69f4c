package net.kinvault.e2ee.crypto;

import javax.security.auth.Destroyable;
import java.util.Arrays;

/**
 * Owns a buffer of secret key material and zeroes it on {@link #close()} / {@link #destroy()}.
 * <p>
 * Intended for try-with-resources so that a secret only lives for the duration of one operation.
 */
public final class SecretBytes implements AutoCloseable, Destroyable {
    private final byte[] bytes;
    private volatile boolean destroyed;

    private SecretBytes(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Takes ownership of {@code bytes}; the caller must not keep using the array.
     */
    public static SecretBytes wrap(byte[] bytes) {
        return new SecretBytes(bytes);
    }

    public static SecretBytes copyOf(byte[] bytes) {
        return new SecretBytes(bytes.clone());
    }

    public static SecretBytes copyOfRange(byte[] bytes, int from, int to) {
        return new SecretBytes(Arrays.copyOfRange(bytes, from, to));
    }

    /**
     * @return the backing array, valid until this secret is destroyed
     */
    public byte[] bytes() {
        checkAlive();
        return bytes;
    }

    public byte[] copy() {
        checkAlive();
        return bytes.clone();
    }

    public SecretBytes duplicate() {
        return new SecretBytes(copy());
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public void destroy() {
        Arrays.fill(bytes, (byte) 0);
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        destroy();
    }

    private void checkAlive() {
        if (destroyed) {
            throw new IllegalStateException("Secret has been destroyed");
        }
    }

    @Override
    public String toString() {
        return destroyed ? "SecretBytes[destroyed]" : "SecretBytes[" + bytes.length + " bytes]";
    }
}
