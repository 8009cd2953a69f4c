package net.kinvault.e2ee;

public class StorageFailureException extends E2eeException {
    public StorageFailureException(String message) {
        super(ErrorKind.STORAGE_FAILURE, message);
    }

    public StorageFailureException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_FAILURE, message, cause);
    }
}
