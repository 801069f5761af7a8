package warden.core.exception;

/**
 * The bearer token is past its expiry.
 */
public class TokenExpiredException extends AuthenticationException {

    public TokenExpiredException(String message) {
        super(message);
    }
}
