package net.kinvault.e2ee;

/**
 * Thrown when fresh key material cannot be produced. Not retryable without new entropy.
 */
public class KeyGenerationException extends E2eeException {
    public KeyGenerationException(String message) {
        super(ErrorKind.KEY_GENERATION, message);
    }

    public KeyGenerationException(String message, Throwable cause) {
        super(ErrorKind.KEY_GENERATION, message, cause);
    }
}
