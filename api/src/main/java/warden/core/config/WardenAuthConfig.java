package warden.core.config;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Pattern;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for bearer-token authentication.
 *
 * <p>Configuration prefix: {@code warden.auth}
 *
 * <p>Example configuration:
 * <pre>{@code
 * warden.auth.provider.url=http://keycloak:8080/
 * warden.auth.provider.realm=myrealm
 * warden.auth.provider.client-id=myapp
 * warden.auth.excluded-paths=^(/docs|/health)$
 * warden.auth.cache.url=redis://localhost:6379/1
 * warden.auth.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "warden.auth")
public interface WardenAuthConfig {

    /**
     * Identity provider settings.
     */
    ProviderConfig provider();

    /**
     * Request paths that skip authentication, matched from the start of the path.
     *
     * <p>Typed as a {@link Pattern} so a malformed expression fails configuration
     * loading at startup.
     */
    @WithName("excluded-paths")
    @WithDefault("^(/docs|/openapi.json|/health|/metrics)$")
    Pattern excludedPaths();

    /**
     * Claims cache settings.
     */
    CacheConfig cache();

    /**
     * Metrics settings.
     */
    MetricsConfig metrics();

    /**
     * Keycloak connection settings.
     */
    interface ProviderConfig {

        /**
         * Keycloak base URL.
         */
        @WithDefault("http://localhost:8080/")
        String url();

        /**
         * Realm name.
         */
        @WithDefault("master")
        String realm();

        /**
         * Client id used for the password grant.
         */
        @WithName("client-id")
        Optional<String> clientId();

        /**
         * Client secret for confidential clients.
         */
        @WithName("client-secret")
        Optional<String> clientSecret();

        /**
         * Timeout for HTTP calls to the identity provider.
         */
        @WithDefault("PT10S")
        Duration timeout();

        /**
         * How long a fetched JWKS is trusted before it is fetched again.
         */
        @WithName("jwks-cache-ttl")
        @WithDefault("PT1H")
        Duration jwksCacheTtl();
    }

    /**
     * Claims cache configuration.
     *
     * <p>Redis is used when {@code url} is set. Otherwise the in-process cache is
     * used when {@code local.enabled} is true. With neither, caching is off.
     */
    interface CacheConfig {

        /**
         * Redis URL (e.g. {@code redis://localhost:6379/1}).
         */
        Optional<String> url();

        /**
         * Subtracted from the token's remaining lifetime when computing entry TTL.
         */
        @WithName("ttl-buffer")
        @WithDefault("PT30S")
        Duration ttlBuffer();

        /**
         * Upper bound on a single Redis operation. A timed-out lookup is a miss.
         */
        @WithDefault("PT1S")
        Duration timeout();

        /**
         * In-process cache used when no Redis URL is configured.
         */
        LocalCacheConfig local();
    }

    /**
     * In-process claims cache configuration.
     */
    interface LocalCacheConfig {

        @WithDefault("false")
        boolean enabled();

        @WithName("max-size")
        @WithDefault("10000")
        long maxSize();
    }

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {

        @WithDefault("false")
        boolean enabled();
    }
}
