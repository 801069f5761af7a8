package warden.adapter.out.auth;

import java.net.URI;

/**
 * Endpoints of one Keycloak realm.
 *
 * @param issuer        expected {@code iss} claim
 * @param jwksUri       realm signing keys
 * @param tokenEndpoint OAuth 2.0 token endpoint
 */
public record KeycloakRealm(URI issuer, URI jwksUri, URI tokenEndpoint) {

    private static final String OIDC_PATH = "/protocol/openid-connect";

    /**
     * Derive realm endpoints from the server base URL and realm name.
     *
     * @param serverUrl Keycloak base URL, with or without a trailing slash
     * @param realm     realm name
     * @return the realm endpoints
     * @throws IllegalArgumentException if the URL is not valid
     */
    public static KeycloakRealm of(String serverUrl, String realm) {
        if (realm == null || realm.isBlank()) {
            throw new IllegalArgumentException("Keycloak realm cannot be blank");
        }
        var base = serverUrl.strip();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        final var issuer = base + "/realms/" + realm;
        return new KeycloakRealm(
                URI.create(issuer), URI.create(issuer + OIDC_PATH + "/certs"), URI.create(issuer + OIDC_PATH + "/token"));
    }
}
