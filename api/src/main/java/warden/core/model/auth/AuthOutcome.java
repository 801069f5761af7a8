package warden.core.model.auth;

/**
 * Result of authenticating one inbound connection.
 */
public sealed interface AuthOutcome {

    static AuthOutcome authenticated(UserPrincipal principal) {
        return new Authenticated(principal);
    }

    static AuthOutcome exempt() {
        return Exempt.INSTANCE;
    }

    static AuthOutcome failed(AuthFailureKind kind, String detail) {
        return new Failed(kind, detail);
    }

    /**
     * The token was valid.
     *
     * @param principal the authenticated user
     */
    record Authenticated(UserPrincipal principal) implements AuthOutcome {
        public Authenticated {
            if (principal == null) {
                throw new IllegalArgumentException("Principal cannot be null");
            }
        }
    }

    /**
     * The connection matched an exclusion rule. No token was read.
     */
    record Exempt() implements AuthOutcome {
        private static final Exempt INSTANCE = new Exempt();
    }

    /**
     * Authentication failed. Terminal for this attempt.
     *
     * @param kind   failure classification
     * @param detail provider or parser detail
     */
    record Failed(AuthFailureKind kind, String detail) implements AuthOutcome {
        public Failed {
            if (kind == null) {
                throw new IllegalArgumentException("Failure kind cannot be null");
            }
            if (detail == null) {
                detail = "";
            }
        }

        /** Client-facing message, e.g. {@code "invalid_credentials: bad signature"}. */
        public String message() {
            return kind.message(detail);
        }
    }
}
