package warden.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.RawClaims;
import warden.core.port.out.ClaimsCache;
import warden.core.util.SecureHash;

/**
 * Redis implementation of {@link ClaimsCache}.
 *
 * <h2>Cache Format</h2>
 * <p>Keys are {@code warden:claims:} followed by the SHA-256 hex digest of the
 * token. Values are the claims serialized as a JSON object. Entries expire
 * through {@code SETEX} shortly before the token itself does.
 *
 * <p>All calls go through {@link RedisTimeoutHelper}; a slow or broken Redis
 * behaves like an empty cache.
 */
public class RedisClaimsCache implements ClaimsCache {

    private static final Logger LOG = Logger.getLogger(RedisClaimsCache.class);

    static final String KEY_PREFIX = "warden:claims:";

    // jose4j hands out integral claims as Long
    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().enable(DeserializationFeature.USE_LONG_FOR_INTS);
    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {};

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final Duration ttlBuffer;
    private final Clock clock;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisClaimsCache(
            ReactiveRedisDataSource ds, Duration ttlBuffer, Clock clock, RedisTimeoutHelper timeoutHelper) {
        this.valueCommands = ds.value(String.class, String.class);
        this.keyCommands = ds.key(String.class);
        this.ttlBuffer = ttlBuffer;
        this.clock = clock;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Optional<RawClaims>> lookup(String token) {
        final var key = keyFor(token);
        return timeoutHelper
                .withTimeoutGraceful(Uni.createFrom().deferred(() -> valueCommands.get(key)), "lookup")
                .map(cached -> cached.flatMap(this::deserialize));
    }

    @Override
    public Uni<Void> store(String token, RawClaims claims) {
        final var ttl = claims.cacheTtl(clock.instant(), ttlBuffer);
        if (ttl.isEmpty()) {
            LOG.debug("Claims carry no exp, not caching");
            return Uni.createFrom().voidItem();
        }
        final String json;
        try {
            json = OBJECT_MAPPER.writeValueAsString(claims.values());
        } catch (JsonProcessingException e) {
            LOG.warnv("Claims could not be serialized, not caching: {0}", e.getOriginalMessage());
            return Uni.createFrom().voidItem();
        }
        final var key = keyFor(token);
        final long seconds = ttl.get().toSeconds();
        LOG.debugv("Caching claims for {0}s", seconds);
        return timeoutHelper.withTimeoutSilent(
                Uni.createFrom().deferred(() -> valueCommands.setex(key, seconds, json)), "store");
    }

    @Override
    public Uni<Void> invalidate(String token) {
        final var key = keyFor(token);
        return timeoutHelper.withTimeoutSilent(
                Uni.createFrom().deferred(() -> keyCommands.del(key)).replaceWithVoid(), "invalidate");
    }

    static String keyFor(String token) {
        return KEY_PREFIX + SecureHash.sha256Hex(token);
    }

    private Optional<RawClaims> deserialize(String json) {
        try {
            return Optional.of(RawClaims.of(OBJECT_MAPPER.readValue(json, CLAIMS_TYPE)));
        } catch (JsonProcessingException e) {
            LOG.warnv("Cached claims unreadable, treating as miss: {0}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
