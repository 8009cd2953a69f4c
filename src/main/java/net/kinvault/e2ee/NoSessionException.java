package net.kinvault.e2ee;

public class NoSessionException extends E2eeException {
    private final String sessionId;

    public NoSessionException(String message) {
        this(null, message);
    }

    public NoSessionException(String sessionId, String message) {
        super(ErrorKind.SESSION_NOT_FOUND, message);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
