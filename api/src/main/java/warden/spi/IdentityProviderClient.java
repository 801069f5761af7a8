package warden.spi;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.RawClaims;
import warden.core.model.auth.TokenSet;

/**
 * Client for the external identity provider.
 *
 * <p>The built-in implementation talks to a Keycloak realm. Platform teams can
 * supply their own by registering an alternative CDI bean.
 *
 * <p>Implementations must not block the calling thread and must not retry
 * internally. Every failure is reported once, as an
 * {@link IdentityProviderException}.
 */
public interface IdentityProviderClient {

    /**
     * Unique name identifying this client (e.g. {@code keycloak}).
     *
     * @return the client name
     */
    String name();

    /**
     * Validate a bearer token and return its claims.
     *
     * @param token the raw access token
     * @return Uni with the decoded claims; fails with {@link IdentityProviderException}
     */
    Uni<RawClaims> decodeToken(String token);

    /**
     * Exchange user credentials for tokens (resource owner password grant).
     *
     * @param username the user name
     * @param password the password
     * @return Uni with the issued tokens; fails with {@link IdentityProviderException}
     */
    Uni<TokenSet> login(String username, String password);
}
