package net.kinvault.e2ee;

public class DirectoryUnavailableException extends E2eeException {
    public DirectoryUnavailableException(String message) {
        super(ErrorKind.DIRECTORY_UNAVAILABLE, message);
    }

    public DirectoryUnavailableException(String message, Throwable cause) {
        super(ErrorKind.DIRECTORY_UNAVAILABLE, message, cause);
    }
}
