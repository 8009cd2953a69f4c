package net.kinvault.e2ee;

public class PeerBundleInvalidException extends E2eeException {
    public PeerBundleInvalidException(String message) {
        super(ErrorKind.PEER_BUNDLE_INVALID, message);
    }

    public PeerBundleInvalidException(String message, Throwable cause) {
        super(ErrorKind.PEER_BUNDLE_INVALID, message, cause);
    }
}
