package net.kinvault.e2ee;

/**
 * Key rotation did not complete. The previously active key stays in use and rotation is retried later.
 */
public class RotationFailureException extends E2eeException {
    public RotationFailureException(String message) {
        super(ErrorKind.ROTATION_FAILURE, message);
    }

    public RotationFailureException(String message, Throwable cause) {
        super(ErrorKind.ROTATION_FAILURE, message, cause);
    }
}
