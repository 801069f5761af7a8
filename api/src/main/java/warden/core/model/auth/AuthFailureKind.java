package warden.core.model.auth;

import warden.core.exception.AuthenticationException;
import warden.core.exception.InvalidTokenException;
import warden.core.exception.TokenDecodeException;
import warden.core.exception.TokenExpiredException;

/**
 * Why a token failed authentication.
 *
 * <p>Each kind carries the prefix used in client-facing messages and the
 * status labels used when recording auth attempts and token validations.
 */
public enum AuthFailureKind {

    /** The identity provider reports the token's validity window has elapsed. */
    EXPIRED("token_expired", "expired", "expired"),

    /** Bad signature, issuer mismatch, or rejected by the provider. */
    INVALID_CREDENTIALS("invalid_credentials", "invalid", "invalid"),

    /** The token could not be parsed at all. */
    DECODE_ERROR("token_decode_error", "error", "error");

    private final String code;
    private final String attemptStatus;
    private final String validationStatus;

    AuthFailureKind(String code, String attemptStatus, String validationStatus) {
        this.code = code;
        this.attemptStatus = attemptStatus;
        this.validationStatus = validationStatus;
    }

    /** Message prefix, e.g. {@code token_expired}. */
    public String code() {
        return code;
    }

    /** Label for the auth-attempt counter. */
    public String attemptStatus() {
        return attemptStatus;
    }

    /** Label for the token-validation counter. */
    public String validationStatus() {
        return validationStatus;
    }

    /**
     * Format a client-facing message, e.g. {@code "token_expired: JWT expired"}.
     */
    public String message(String detail) {
        return code + ": " + (detail == null ? "" : detail);
    }

    /**
     * The 401 exception matching this kind.
     */
    public AuthenticationException toException(String detail) {
        final var message = message(detail);
        return switch (this) {
            case EXPIRED -> new TokenExpiredException(message);
            case INVALID_CREDENTIALS -> new InvalidTokenException(message);
            case DECODE_ERROR -> new TokenDecodeException(message);
        };
    }
}
