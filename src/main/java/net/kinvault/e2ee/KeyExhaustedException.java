package net.kinvault.e2ee;

public class KeyExhaustedException extends E2eeException {
    public KeyExhaustedException(String message) {
        super(ErrorKind.KEY_EXHAUSTED, message);
    }

    public KeyExhaustedException(String message, Throwable cause) {
        super(ErrorKind.KEY_EXHAUSTED, message, cause);
    }
}
