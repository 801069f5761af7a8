package warden.adapter.out.auth;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.lang.JoseException;

import warden.core.config.WardenAuthConfig;
import warden.core.port.out.JwksCache;

/**
 * Realm signing keys, downloaded from Keycloak and held for
 * {@code warden.auth.provider.jwks-cache-ttl}.
 *
 * <p>At most one download per realm is in progress at a time; callers arriving
 * meanwhile share its result. If a download fails, the key set from the last
 * successful download is served instead.
 */
@ApplicationScoped
public class KeycloakJwksCache implements JwksCache {

    private static final Logger LOG = Logger.getLogger(KeycloakJwksCache.class);
    private static final int MAX_REALMS = 16;

    private final WebClient webClient;
    private final Duration downloadTimeout;
    private final Cache<URI, JsonWebKeySet> keySets;
    private final Map<URI, JsonWebKeySet> lastDownloaded = new ConcurrentHashMap<>();
    private final Map<URI, Uni<JsonWebKeySet>> pendingDownloads = new ConcurrentHashMap<>();

    @Inject
    public KeycloakJwksCache(Vertx vertx, WardenAuthConfig config, MeterRegistry meterRegistry) {
        this.webClient = WebClient.create(vertx);
        this.downloadTimeout = config.provider().timeout();
        this.keySets = Caffeine.newBuilder()
                .maximumSize(MAX_REALMS)
                .expireAfterWrite(config.provider().jwksCacheTtl())
                .recordStats()
                .build();

        CaffeineCacheMetrics.monitor(meterRegistry, keySets, "warden.jwks.cache");
    }

    @Override
    public Uni<JsonWebKeySet> getKeySet(URI jwksUri) {
        final var keySet = keySets.getIfPresent(jwksUri);
        return keySet != null ? Uni.createFrom().item(keySet) : download(jwksUri);
    }

    @Override
    public Uni<Optional<JsonWebKey>> getKey(URI jwksUri, String keyId) {
        return getKeySet(jwksUri).map(keySet -> findKey(keySet, keyId));
    }

    @Override
    public Uni<JsonWebKeySet> refresh(URI jwksUri) {
        LOG.debugv("Key set for {0} refreshed on demand", jwksUri);
        pendingDownloads.remove(jwksUri);
        return download(jwksUri);
    }

    private Uni<JsonWebKeySet> download(URI jwksUri) {
        return Uni.createFrom().deferred(() -> pendingDownloads.computeIfAbsent(jwksUri, uri -> requestKeys(uri)
                .onTermination()
                .invoke(() -> pendingDownloads.remove(uri))
                .memoize()
                .indefinitely()));
    }

    private Uni<JsonWebKeySet> requestKeys(URI jwksUri) {
        LOG.debugv("Downloading realm keys from {0}", jwksUri);
        return webClient
                .getAbs(jwksUri.toString())
                .ssl("https".equals(jwksUri.getScheme()))
                .send()
                .ifNoItem()
                .after(downloadTimeout)
                .failWith(() -> new JwksUnavailableException(
                        "No key set from " + jwksUri + " within " + downloadTimeout.toMillis() + "ms"))
                .map(KeycloakJwksCache::toKeySet)
                .invoke(keySet -> remember(jwksUri, keySet))
                .onFailure()
                .recoverWithUni(error -> fallBackToLastDownload(jwksUri, error));
    }

    private void remember(URI jwksUri, JsonWebKeySet keySet) {
        keySets.put(jwksUri, keySet);
        lastDownloaded.put(jwksUri, keySet);
        LOG.infov("Realm key set from {0} holds {1} key(s)", jwksUri, keySet.getJsonWebKeys().size());
    }

    private Uni<JsonWebKeySet> fallBackToLastDownload(URI jwksUri, Throwable error) {
        final var previous = lastDownloaded.get(jwksUri);
        if (previous == null) {
            LOG.errorv(error, "Realm keys from {0} unavailable and none downloaded before", jwksUri);
            return Uni.createFrom().failure(error);
        }
        LOG.warnv("Realm keys from {0} unavailable ({1}), verifying with the previous key set",
                jwksUri, error.getMessage());
        return Uni.createFrom().item(previous);
    }

    static JsonWebKeySet toKeySet(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            throw new JwksUnavailableException("Key set request answered with HTTP " + response.statusCode());
        }
        try {
            return new JsonWebKeySet(response.bodyAsString());
        } catch (JoseException e) {
            throw new JwksUnavailableException("Key set is not valid JWKS JSON: " + e.getMessage(), e);
        }
    }

    static Optional<JsonWebKey> findKey(JsonWebKeySet keySet, String keyId) {
        final var keys = keySet.getJsonWebKeys();
        if (keyId == null) {
            // a token without kid is only accepted against a single-key realm
            return keys.size() == 1 ? Optional.of(keys.get(0)) : Optional.empty();
        }
        for (var key : keys) {
            if (keyId.equals(key.getKeyId())) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }
}
