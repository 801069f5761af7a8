package warden.core.port.out;

import java.net.URI;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;

/**
 * Port for caching and retrieving a realm's JSON Web Key Set.
 */
public interface JwksCache {

    /**
     * Get the key set, fetching it when not cached.
     *
     * @param jwksUri the JWKS endpoint URI
     * @return the key set
     */
    Uni<JsonWebKeySet> getKeySet(URI jwksUri);

    /**
     * Get a specific key by ID.
     *
     * @param jwksUri the JWKS endpoint URI
     * @param keyId   the key ID (kid), or null to accept a single-key set
     * @return the key if found
     */
    Uni<Optional<JsonWebKey>> getKey(URI jwksUri, String keyId);

    /**
     * Force refresh keys from the remote endpoint.
     *
     * <p>Used when a token names a key id the cached set does not contain.
     *
     * @param jwksUri the JWKS endpoint URI
     * @return the refreshed key set
     */
    Uni<JsonWebKeySet> refresh(URI jwksUri);
}
