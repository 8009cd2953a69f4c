package net.kinvault.e2ee;

public class TooManySkippedMessagesException extends E2eeException {
    public TooManySkippedMessagesException(String message) {
        super(ErrorKind.TOO_MANY_SKIPPED_MESSAGES, message);
    }

    public TooManySkippedMessagesException(String message, Throwable cause) {
        super(ErrorKind.TOO_MANY_SKIPPED_MESSAGES, message, cause);
    }
}
