package warden.core.exception;

/**
 * An authenticated caller is not allowed to perform an operation. Maps to HTTP 403.
 */
public class AuthorizationException extends RuntimeException {

    public static final int STATUS_CODE = 403;

    public AuthorizationException(String message) {
        super(message);
    }

    public int statusCode() {
        return STATUS_CODE;
    }
}
