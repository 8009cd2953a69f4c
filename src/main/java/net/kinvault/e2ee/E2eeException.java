package net.kinvault.e2ee;

/**
 * Base of every checked failure raised by the engine. Each subclass maps to exactly one {@link ErrorKind}.
 */
public abstract class E2eeException extends Exception {
    private final ErrorKind kind;

    protected E2eeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected E2eeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
