package net.kinvault.e2ee;

/**
 * A message did not authenticate. The session it was addressed to is left unchanged.
 */
public class AuthenticationFailedException extends E2eeException {
    public AuthenticationFailedException(String message) {
        super(ErrorKind.AUTHENTICATION_FAILED, message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(ErrorKind.AUTHENTICATION_FAILED, message, cause);
    }
}
