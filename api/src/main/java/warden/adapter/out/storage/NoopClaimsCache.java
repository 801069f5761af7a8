package warden.adapter.out.storage;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.RawClaims;
import warden.core.port.out.ClaimsCache;

/**
 * Claims cache used when no backend is configured.
 *
 * <p>{@link #isEnabled()} is false, so the authentication flow never calls it.
 */
public final class NoopClaimsCache implements ClaimsCache {

    public static final NoopClaimsCache INSTANCE = new NoopClaimsCache();

    private NoopClaimsCache() {}

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public Uni<Optional<RawClaims>> lookup(String token) {
        return Uni.createFrom().item(Optional.empty());
    }

    @Override
    public Uni<Void> store(String token, RawClaims claims) {
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Void> invalidate(String token) {
        return Uni.createFrom().voidItem();
    }
}
