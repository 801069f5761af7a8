package warden.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.AuthMetrics;

/**
 * Bounds Redis calls with a timeout and turns every backend problem into a
 * harmless result.
 *
 * <ul>
 *   <li>{@link #withTimeoutGraceful} - reads: timeout or failure yields an empty
 *       Optional, which callers treat as a cache miss.</li>
 *   <li>{@link #withTimeoutSilent} - writes and deletes: timeout or failure is
 *       logged and the operation completes normally.</li>
 * </ul>
 *
 * <p>Timeouts and failures are counted separately through
 * {@link AuthMetrics#recordCacheError}.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    static final String TIMEOUT = "timeout";
    static final String FAILURE = "failure";

    private final Duration timeout;
    private final AuthMetrics metrics;
    private final String cacheName;

    /**
     * @param timeout   upper bound for a single Redis call
     * @param metrics   metrics sink (may be null)
     * @param cacheName name used in log messages
     */
    public RedisTimeoutHelper(Duration timeout, AuthMetrics metrics, String cacheName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.cacheName = cacheName;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Apply the timeout, degrading to an empty Optional.
     *
     * @param operation     the Redis call
     * @param operationName name for logging and metrics
     * @param <T>           the result type
     * @return Uni with the result, or empty on null, timeout or failure
     */
    public <T> Uni<Optional<T>> withTimeoutGraceful(Uni<T> operation, String operationName) {
        return operation
                .map(Optional::ofNullable)
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv("Redis {0} timed out in {1} after {2}, treating as miss", operationName, cacheName, timeout);
                    recordError(operationName, TIMEOUT);
                    return Optional.empty();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Redis {0} failed in {1}, treating as miss: {2}", operationName, cacheName, error.getMessage());
                    recordError(operationName, FAILURE);
                    return Optional.empty();
                });
    }

    /**
     * Apply the timeout, ignoring any problem.
     *
     * @param operation     the Redis call
     * @param operationName name for logging and metrics
     * @return Uni that always completes with void
     */
    public Uni<Void> withTimeoutSilent(Uni<Void> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv("Redis {0} timed out in {1} after {2} (ignored)", operationName, cacheName, timeout);
                    recordError(operationName, TIMEOUT);
                    return null;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Redis {0} failed in {1} (ignored): {2}", operationName, cacheName, error.getMessage());
                    recordError(operationName, FAILURE);
                    return null;
                });
    }

    private void recordError(String operationName, String type) {
        if (metrics == null) {
            return;
        }
        try {
            metrics.recordCacheError(operationName, type);
        } catch (RuntimeException e) {
            LOG.debugv("Metrics recording failed (ignored): {0}", e.getMessage());
        }
    }
}
