package warden.adapter.out.telemetry;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import warden.core.config.WardenAuthConfig;
import warden.core.port.out.AuthMetrics;

/**
 * Records authentication metrics with Micrometer.
 *
 * <p>All methods are no-ops when {@code warden.auth.metrics.enabled} is false,
 * so callers never check configuration themselves.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.auth.attempts.total} - auth attempts by status</li>
 *   <li>{@code warden.token.validations.total} - identity provider validations by status</li>
 *   <li>{@code warden.idp.operation.duration} - identity provider call latency by operation</li>
 *   <li>{@code warden.token.cache.hits} / {@code warden.token.cache.misses} - claims cache effectiveness</li>
 *   <li>{@code warden.token.cache.errors} - claims cache backend timeouts and failures</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAuthMetrics implements AuthMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerAuthMetrics(MeterRegistry registry, WardenAuthConfig config) {
        this(registry, config.metrics().enabled());
    }

    MicrometerAuthMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordAuthAttempt(String status) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.auth.attempts.total")
                .description("Authentication attempts")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    @Override
    public void recordTokenValidation(String status) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.token.validations.total")
                .description("Token validations against the identity provider")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    @Override
    public void recordIdpDuration(String operation, Duration duration) {
        if (!enabled) {
            return;
        }

        Timer.builder("warden.idp.operation.duration")
                .description("Identity provider operation latency")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    @Override
    public void recordCacheHit() {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.token.cache.hits")
                .description("Claims cache hits")
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheMiss() {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.token.cache.misses")
                .description("Claims cache misses")
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheError(String operation, String type) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.token.cache.errors")
                .description("Claims cache backend errors")
                .tag("operation", operation)
                .tag("type", type)
                .register(registry)
                .increment();
    }
}
