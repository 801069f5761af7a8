package warden.core.exception;

/**
 * The bearer token could not be decoded.
 */
public class TokenDecodeException extends AuthenticationException {

    public TokenDecodeException(String message) {
        super(message);
    }
}
