package warden.adapter.out.auth;

/**
 * A realm's signing keys could not be downloaded or parsed.
 */
public class JwksUnavailableException extends RuntimeException {

    public JwksUnavailableException(String message) {
        super(message);
    }

    public JwksUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
