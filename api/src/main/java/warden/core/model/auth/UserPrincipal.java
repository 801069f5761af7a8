package warden.core.model.auth;

import java.security.Principal;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Authenticated user derived from validated token claims.
 *
 * <p>Built fresh on every authentication and never re-validated. Two principals
 * are equal when their subject ids match, even if their roles differ: role
 * assignments can change between two authentications of the same user.
 *
 * @param id        subject identifier ({@code sub})
 * @param username  preferred username
 * @param expiresAt token expiry in Unix seconds
 * @param roles     client roles in claim order, without duplicates
 */
public record UserPrincipal(String id, String username, long expiresAt, List<String> roles) implements Principal {

    public UserPrincipal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Principal id cannot be null or blank");
        }
        Objects.requireNonNull(username, "username");
        roles = roles == null ? List.of() : List.copyOf(new LinkedHashSet<>(roles));
    }

    /**
     * Build a principal from decoded claims.
     *
     * @param claims validated token claims
     * @return the principal
     * @throws IllegalArgumentException if {@code sub}, {@code exp} or
     *         {@code preferred_username} is missing
     */
    public static UserPrincipal fromClaims(RawClaims claims) {
        final var id = claims.subject().orElseThrow(() -> missing(RawClaims.SUBJECT));
        final var expiresAt = claims.expiresAt().orElseThrow(() -> missing(RawClaims.EXPIRES_AT));
        final var username =
                claims.preferredUsername().orElseThrow(() -> missing(RawClaims.PREFERRED_USERNAME));
        return new UserPrincipal(id, username, expiresAt, claims.clientRoles());
    }

    private static IllegalArgumentException missing(String claim) {
        return new IllegalArgumentException("Missing required claim: " + claim);
    }

    /**
     * Seconds until the token expires. Negative once it has expired.
     */
    public long secondsRemaining(Clock clock) {
        return expiresAt - clock.instant().getEpochSecond();
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    @Override
    public String getName() {
        return username;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof UserPrincipal that && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }
}
