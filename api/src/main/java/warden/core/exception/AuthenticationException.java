package warden.core.exception;

/**
 * Authentication failed or is missing. Maps to HTTP 401.
 */
public class AuthenticationException extends RuntimeException {

    public static final int STATUS_CODE = 401;

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }

    public int statusCode() {
        return STATUS_CODE;
    }
}
