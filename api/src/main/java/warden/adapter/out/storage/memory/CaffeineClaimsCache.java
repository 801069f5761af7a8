package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.RawClaims;
import warden.core.port.out.ClaimsCache;
import warden.core.util.SecureHash;

/**
 * In-process {@link ClaimsCache} backed by Caffeine.
 *
 * <p>For single-instance deployments. Each entry expires after its own TTL,
 * computed the same way as the Redis cache. Keys are token fingerprints.
 */
public class CaffeineClaimsCache implements ClaimsCache {

    private static final Logger LOG = Logger.getLogger(CaffeineClaimsCache.class);

    private final Cache<String, Entry> cache;
    private final Duration ttlBuffer;
    private final Clock clock;

    public CaffeineClaimsCache(long maxSize, Duration ttlBuffer, Clock clock) {
        this(maxSize, ttlBuffer, clock, Ticker.systemTicker());
    }

    /**
     * Constructor allowing a custom ticker, for tests that advance time.
     */
    public CaffeineClaimsCache(long maxSize, Duration ttlBuffer, Clock clock, Ticker ticker) {
        this.ttlBuffer = ttlBuffer;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfter(new EntryExpiry())
                .ticker(ticker)
                .build();
        LOG.infov("Local claims cache initialized (maxSize={0}, ttlBuffer={1})", maxSize, ttlBuffer);
    }

    @Override
    public Uni<Optional<RawClaims>> lookup(String token) {
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(cache.getIfPresent(SecureHash.sha256Hex(token))).map(Entry::claims));
    }

    @Override
    public Uni<Void> store(String token, RawClaims claims) {
        return Uni.createFrom().item(() -> {
            claims.cacheTtl(clock.instant(), ttlBuffer)
                    .ifPresent(ttl -> cache.put(SecureHash.sha256Hex(token), new Entry(claims, ttl)));
            return null;
        });
    }

    @Override
    public Uni<Void> invalidate(String token) {
        return Uni.createFrom().item(() -> {
            cache.invalidate(SecureHash.sha256Hex(token));
            return null;
        });
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record Entry(RawClaims claims, Duration ttl) {}

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
