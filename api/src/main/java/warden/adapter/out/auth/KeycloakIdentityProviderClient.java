package warden.adapter.out.auth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import warden.core.config.WardenAuthConfig;
import warden.core.model.auth.RawClaims;
import warden.core.model.auth.TokenSet;
import warden.core.port.out.JwksCache;
import warden.spi.IdentityProviderClient;
import warden.spi.IdentityProviderException;
import warden.spi.IdentityProviderException.Reason;

/**
 * Identity provider client for a Keycloak realm.
 *
 * <p>Tokens are verified locally against the realm's JWKS:
 * <ul>
 *   <li>signature, using the key named by the token's {@code kid}</li>
 *   <li>issuer, {@code {url}/realms/{realm}}</li>
 *   <li>{@code exp} and {@code sub} present, with 30 seconds of clock skew</li>
 * </ul>
 * An unknown {@code kid} triggers one JWKS refresh to pick up rotated keys.
 *
 * <p>Logins use the resource owner password grant against the realm token endpoint.
 */
@ApplicationScoped
public class KeycloakIdentityProviderClient implements IdentityProviderClient {

    private static final Logger LOG = Logger.getLogger(KeycloakIdentityProviderClient.class);
    private static final int CLOCK_SKEW_SECONDS = 30;

    private final WebClient webClient;
    private final KeycloakRealm realm;
    private final WardenAuthConfig.ProviderConfig config;
    private final JwksCache jwksCache;

    @Inject
    public KeycloakIdentityProviderClient(Vertx vertx, WardenAuthConfig config, JwksCache jwksCache) {
        this(WebClient.create(vertx), config.provider(), jwksCache);
    }

    KeycloakIdentityProviderClient(WebClient webClient, WardenAuthConfig.ProviderConfig config, JwksCache jwksCache) {
        this.webClient = webClient;
        this.config = config;
        this.realm = KeycloakRealm.of(config.url(), config.realm());
        this.jwksCache = jwksCache;
        LOG.infov("Keycloak client configured for issuer {0}", realm.issuer());
    }

    @Override
    public String name() {
        return "keycloak";
    }

    @Override
    public Uni<RawClaims> decodeToken(String token) {
        return Uni.createFrom()
                .item(() -> keyIdOf(token))
                .flatMap(keyId -> jwksCache
                        .getKey(realm.jwksUri(), keyId.orElse(null))
                        .flatMap(key -> key.isPresent()
                                ? Uni.createFrom().item(key.get())
                                : refreshAndFind(keyId.orElse(null))))
                .map(key -> verify(token, key))
                .onFailure(error -> !(error instanceof IdentityProviderException))
                .transform(error -> new IdentityProviderException(
                        Reason.REJECTED, "Signing keys unavailable: " + error.getMessage(), error));
    }

    @Override
    public Uni<TokenSet> login(String username, String password) {
        if (config.clientId().isEmpty()) {
            return Uni.createFrom()
                    .failure(new IdentityProviderException(Reason.REJECTED, "No client id configured for login"));
        }
        LOG.debugv("Requesting password grant for {0} from {1}", username, realm.tokenEndpoint());

        return webClient
                .postAbs(realm.tokenEndpoint().toString())
                .timeout(config.timeout().toMillis())
                .putHeader("Content-Type", "application/x-www-form-urlencoded")
                .putHeader("Accept", "application/json")
                .sendBuffer(Buffer.buffer(passwordGrantBody(username, password)))
                .map(this::parseTokenResponse)
                .onFailure(error -> !(error instanceof IdentityProviderException))
                .transform(error -> {
                    LOG.errorv(error, "Token request to {0} failed", realm.tokenEndpoint());
                    return new IdentityProviderException(
                            Reason.REJECTED, "Token request failed: " + error.getMessage(), error);
                });
    }

    private Optional<String> keyIdOf(String token) {
        try {
            final var jws = new JsonWebSignature();
            jws.setCompactSerialization(token);
            return Optional.ofNullable(jws.getKeyIdHeaderValue());
        } catch (JoseException e) {
            throw new IdentityProviderException(Reason.MALFORMED, "Failed to parse token: " + e.getMessage(), e);
        }
    }

    private Uni<JsonWebKey> refreshAndFind(String keyId) {
        LOG.infov("Signing key {0} not cached, refreshing JWKS", keyId);
        return jwksCache.refresh(realm.jwksUri()).map(keySet -> KeycloakJwksCache.findKey(keySet, keyId)
                .orElseThrow(() -> new IdentityProviderException(Reason.REJECTED, "Signing key not found in JWKS")));
    }

    private RawClaims verify(String token, JsonWebKey key) {
        final JwtConsumer consumer = new JwtConsumerBuilder()
                .setRequireSubject()
                .setRequireExpirationTime()
                .setAllowedClockSkewInSeconds(CLOCK_SKEW_SECONDS)
                .setExpectedIssuer(realm.issuer().toString())
                .setSkipDefaultAudienceValidation()
                .setVerificationKey(key.getKey())
                .build();
        try {
            return RawClaims.of(consumer.processToClaims(token).getClaimsMap());
        } catch (InvalidJwtException e) {
            LOG.debugv("JWT validation failed: {0}", e.getMessage());
            if (e.hasExpired()) {
                throw new IdentityProviderException(Reason.EXPIRED, "Token has expired", e);
            }
            throw new IdentityProviderException(Reason.REJECTED, summarize(e), e);
        }
    }

    private static String summarize(InvalidJwtException e) {
        final var message = String.valueOf(e.getMessage());
        if (message.contains("issuer")) {
            return "Invalid token issuer";
        }
        if (message.contains("signature")) {
            return "Invalid token signature";
        }
        return "Token validation failed";
    }

    String passwordGrantBody(String username, String password) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("grant_type", "password");
        params.put("client_id", config.clientId().orElse(""));
        config.clientSecret().ifPresent(secret -> params.put("client_secret", secret));
        params.put("username", username);
        params.put("password", password);
        return params.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private TokenSet parseTokenResponse(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            LOG.infov("Token endpoint rejected login with status {0}", response.statusCode());
            throw new IdentityProviderException(
                    Reason.REJECTED, "Identity provider returned status " + response.statusCode());
        }
        return toTokenSet(response.bodyAsJsonObject());
    }

    static TokenSet toTokenSet(JsonObject json) {
        final var accessToken = json == null ? null : json.getString("access_token");
        if (accessToken == null || accessToken.isBlank()) {
            throw new IdentityProviderException(Reason.REJECTED, "Token response missing access_token");
        }
        return new TokenSet(
                accessToken,
                Optional.ofNullable(json.getString("refresh_token")),
                json.getString("token_type", "Bearer"),
                json.getLong("expires_in", 0L),
                json.getLong("refresh_expires_in", 0L),
                Optional.ofNullable(json.getString("scope")));
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
