package warden.core.model.auth;

/**
 * Result of validating a bearer token with the identity provider.
 */
public sealed interface TokenValidationResult {

    /**
     * Token was accepted.
     *
     * @param claims the decoded claims
     */
    record Valid(RawClaims claims) implements TokenValidationResult {
        public Valid {
            if (claims == null) {
                throw new IllegalArgumentException("Claims cannot be null");
            }
        }
    }

    /**
     * Token was refused.
     *
     * @param kind   failure classification
     * @param reason description of why validation failed
     */
    record Failed(AuthFailureKind kind, String reason) implements TokenValidationResult {
        public Failed {
            if (kind == null) {
                throw new IllegalArgumentException("Failure kind cannot be null");
            }
            if (reason == null || reason.isBlank()) {
                reason = "Token validation failed";
            }
        }
    }
}
