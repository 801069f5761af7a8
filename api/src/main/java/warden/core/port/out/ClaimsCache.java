package warden.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.RawClaims;

/**
 * Cache of decoded token claims, keyed by a one-way fingerprint of the token.
 *
 * <p>Implementations are fail-open: backend errors are logged and surface as a
 * miss (for {@link #lookup}) or a completed no-op (for {@link #store} and
 * {@link #invalidate}). None of the returned {@code Uni}s may fail because of
 * the backend.
 *
 * <p>Raw tokens are never used as keys or written to the backend.
 */
public interface ClaimsCache {

    /**
     * Whether a real backend sits behind this cache.
     *
     * <p>When false, callers skip the cache entirely.
     *
     * @return true if caching is active
     */
    default boolean isEnabled() {
        return true;
    }

    /**
     * Look up previously cached claims for a token.
     *
     * @param token the raw bearer token
     * @return Uni with the cached claims, or empty on miss or backend error
     */
    Uni<Optional<RawClaims>> lookup(String token);

    /**
     * Cache claims for a token.
     *
     * <p>The TTL is {@code exp - now - ttlBuffer}, floored at one second. Claims
     * without {@code exp} are not written.
     *
     * @param token  the raw bearer token
     * @param claims the validated claims
     * @return Uni completing when the write finishes or is dropped
     */
    Uni<Void> store(String token, RawClaims claims);

    /**
     * Remove the cached claims for a token. Safe to call repeatedly.
     *
     * @param token the raw bearer token
     * @return Uni completing when the delete finishes or is dropped
     */
    Uni<Void> invalidate(String token);
}
