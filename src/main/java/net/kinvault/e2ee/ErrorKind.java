package net.kinvault.e2ee;

/**
 * Closed set of failure kinds reported by the engine.
 * <p>
 * Integrity failures ({@link #AUTHENTICATION_FAILED}, {@link #PEER_BUNDLE_INVALID}) must be treated as
 * possible tampering. Retryable failures may succeed if the same call is made again later.
 */
public enum ErrorKind {
    /**
     * The RNG or curve operation failed while generating key material.
     */
    KEY_GENERATION(1),
    /**
     * The signed pre-key signature of a peer bundle did not verify, or the bundle carried malformed keys.
     */
    PEER_BUNDLE_INVALID(2),
    /**
     * No session is established for the requested peer device.
     */
    SESSION_NOT_FOUND(3),
    /**
     * A message failed MAC or AEAD verification, or its key was already consumed.
     */
    AUTHENTICATION_FAILED(4),
    /**
     * A message would require caching more skipped message keys than allowed.
     */
    TOO_MANY_SKIPPED_MESSAGES(5),
    /**
     * No usable pre-key (or local identity) exists for a handshake.
     */
    KEY_EXHAUSTED(6),
    /**
     * Key rotation failed; the previous key remains active.
     */
    ROTATION_FAILURE(7),
    /**
     * The secure storage boundary failed.
     */
    STORAGE_FAILURE(8),
    /**
     * The directory service could not be reached.
     */
    DIRECTORY_UNAVAILABLE(9);

    private final int value;

    ErrorKind(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public boolean isIntegrityFailure() {
        return this == AUTHENTICATION_FAILED || this == PEER_BUNDLE_INVALID;
    }

    public boolean isRetryable() {
        return this == DIRECTORY_UNAVAILABLE || this == ROTATION_FAILURE;
    }

    public static ErrorKind fromValue(int value) {
        for (ErrorKind kind : values()) {
            if (kind.value == value) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown ErrorKind value: " + value);
    }
}
