package net.kinvault.e2ee;

import java.util.Objects;

/**
 * Outcome of an {@link EncryptionEngine} call: either a value or an {@link ErrorKind} with a message.
 *
 * @param <T> the value type
 */
public final class Result<T> {
    private final T value;
    private final ErrorKind error;
    private final String errorMessage;

    private Result(T value, ErrorKind error, String errorMessage) {
        this.value = value;
        this.error = error;
        this.errorMessage = errorMessage;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null, null);
    }

    public static <T> Result<T> failure(ErrorKind error, String errorMessage) {
        return new Result<>(null, Objects.requireNonNull(error, "error"), errorMessage);
    }

    public static <T> Result<T> failure(E2eeException exception) {
        return failure(exception.getKind(), exception.getMessage());
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the value of a successful result
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Result is a failure: " + error + " (" + errorMessage + ")");
        }
        return value;
    }

    public T orElse(T other) {
        return error == null ? value : other;
    }

    public ErrorKind getError() {
        return error;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return error == null ? "Result[success]" : "Result[" + error + ": " + errorMessage + "]";
    }
}
