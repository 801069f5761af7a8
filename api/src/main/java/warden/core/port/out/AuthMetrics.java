package warden.core.port.out;

import java.time.Duration;

/**
 * Port for recording authentication metrics.
 *
 * <p>Fire-and-forget: implementations are no-ops when metrics are disabled.
 */
public interface AuthMetrics {

    String OPERATION_VALIDATE_TOKEN = "validate_token";
    String OPERATION_LOGIN = "login";

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record an authentication attempt.
     *
     * @param status one of {@code success}, {@code expired}, {@code invalid}, {@code error}
     */
    void recordAuthAttempt(String status);

    /**
     * Record the result of a token validation against the identity provider.
     *
     * @param status one of {@code valid}, {@code expired}, {@code invalid}, {@code error}
     */
    void recordTokenValidation(String status);

    /**
     * Record the duration of an identity provider call.
     *
     * @param operation {@code validate_token} or {@code login}
     * @param duration  elapsed time
     */
    void recordIdpDuration(String operation, Duration duration);

    void recordCacheHit();

    void recordCacheMiss();

    /**
     * Record a claims cache backend problem.
     *
     * @param operation the cache operation (lookup, store, invalidate)
     * @param type      {@code timeout} or {@code failure}
     */
    void recordCacheError(String operation, String type);
}
