package warden.spi;

/**
 * Failure reported by an {@link IdentityProviderClient}.
 *
 * <p>Clients classify their own errors into a {@link Reason} so that callers
 * never depend on provider-specific exception types.
 */
public class IdentityProviderException extends RuntimeException {

    /**
     * Classification of a provider failure.
     */
    public enum Reason {
        /** Token validity window elapsed, as judged by the provider. */
        EXPIRED,
        /** Signature, issuer or credential check failed, or the provider refused. */
        REJECTED,
        /** Input could not be parsed. */
        MALFORMED
    }

    private final Reason reason;

    public IdentityProviderException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public IdentityProviderException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
