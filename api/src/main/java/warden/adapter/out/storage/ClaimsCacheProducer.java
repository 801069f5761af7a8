package warden.adapter.out.storage;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import warden.adapter.out.storage.memory.CaffeineClaimsCache;
import warden.adapter.out.storage.redis.RedisClaimsCache;
import warden.adapter.out.storage.redis.RedisTimeoutHelper;
import warden.core.config.WardenAuthConfig;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.ClaimsCache;

/**
 * CDI producer selecting the claims cache backend at startup.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Redis, when {@code warden.auth.cache.url} is set and a Redis data source
 *       is available</li>
 *   <li>In-process Caffeine, when {@code warden.auth.cache.local.enabled=true}</li>
 *   <li>{@link NoopClaimsCache} otherwise</li>
 * </ol>
 */
@ApplicationScoped
public class ClaimsCacheProducer {

    private static final Logger LOG = Logger.getLogger(ClaimsCacheProducer.class);

    private final WardenAuthConfig.CacheConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final AuthMetrics metrics;
    private final Clock clock;

    @Inject
    public ClaimsCacheProducer(
            WardenAuthConfig config, Instance<ReactiveRedisDataSource> redisDataSource, AuthMetrics metrics) {
        this(config, redisDataSource, metrics, Clock.systemUTC());
    }

    ClaimsCacheProducer(
            WardenAuthConfig config,
            Instance<ReactiveRedisDataSource> redisDataSource,
            AuthMetrics metrics,
            Clock clock) {
        this.config = config.cache();
        this.redisDataSource = redisDataSource;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Produces the claims cache for CDI injection.
     *
     * @return the configured claims cache
     */
    @Produces
    @ApplicationScoped
    public ClaimsCache claimsCache() {
        if (config.url().filter(url -> !url.isBlank()).isPresent()) {
            if (redisDataSource.isResolvable()) {
                LOG.infov("Using Redis claims cache (ttlBuffer={0}, timeout={1})", config.ttlBuffer(), config.timeout());
                final var timeoutHelper = new RedisTimeoutHelper(config.timeout(), metrics, "claims-cache");
                return new RedisClaimsCache(redisDataSource.get(), config.ttlBuffer(), clock, timeoutHelper);
            }
            LOG.warn("Claims cache URL configured but ReactiveRedisDataSource not available");
        }
        if (config.local().enabled()) {
            LOG.info("Using local claims cache");
            return new CaffeineClaimsCache(config.local().maxSize(), config.ttlBuffer(), clock);
        }
        LOG.info("Claims cache disabled");
        return NoopClaimsCache.INSTANCE;
    }
}
