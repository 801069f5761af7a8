package warden.core.exception;

/**
 * The bearer token was rejected: bad signature, wrong issuer, or refused by the
 * identity provider.
 */
public class InvalidTokenException extends AuthenticationException {

    public InvalidTokenException(String message) {
        super(message);
    }
}
