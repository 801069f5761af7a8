package warden.core.service.auth;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.WardenAuthConfig;
import warden.core.model.auth.AuthFailureKind;
import warden.core.model.auth.AuthOutcome;
import warden.core.model.auth.ConnectionKind;
import warden.core.model.auth.InboundConnection;
import warden.core.model.auth.RawClaims;
import warden.core.model.auth.TokenValidationResult;
import warden.core.model.auth.UserPrincipal;
import warden.core.port.in.AuthenticationUseCase;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.ClaimsCache;

/**
 * Per-connection authentication.
 *
 * <p>Flow for one connection:
 * <ol>
 *   <li>HTTP paths matching the exclusion pattern are {@link AuthOutcome.Exempt}.
 *       WebSocket connections are never exempt.</li>
 *   <li>The credential is read from the header or the WebSocket query string.</li>
 *   <li>If a claims cache is active, a hit skips validation.</li>
 *   <li>Otherwise the token is validated; valid claims are written to the cache.</li>
 *   <li>A {@link UserPrincipal} is built from the claims.</li>
 * </ol>
 *
 * <p>No state is kept between calls. Cache and metrics problems never change the
 * outcome.
 */
@ApplicationScoped
public class AuthenticationService implements AuthenticationUseCase {

    private static final Logger LOG = Logger.getLogger(AuthenticationService.class);

    private static final String SUCCESS = "success";
    private static final String VALID = "valid";

    private final Pattern excludedPaths;
    private final TokenValidator tokenValidator;
    private final ClaimsCache claimsCache;
    private final AuthMetrics metrics;

    @Inject
    public AuthenticationService(
            WardenAuthConfig config, TokenValidator tokenValidator, ClaimsCache claimsCache, AuthMetrics metrics) {
        this.excludedPaths = config.excludedPaths();
        this.tokenValidator = tokenValidator;
        this.claimsCache = claimsCache;
        this.metrics = metrics;
        LOG.infov(
                "AuthenticationService initialized (excludedPaths={0}, claimsCache={1})",
                excludedPaths.pattern(), claimsCache.isEnabled() ? "enabled" : "disabled");
    }

    @Override
    public boolean isExempt(InboundConnection connection) {
        if (connection.kind() != ConnectionKind.HTTP) {
            return false;
        }
        final var path = connection.path();
        return path != null && excludedPaths.matcher(path).lookingAt();
    }

    @Override
    public Uni<AuthOutcome> authenticate(InboundConnection connection) {
        LOG.debugv("Authenticating {0} connection", connection.kind());
        if (isExempt(connection)) {
            LOG.debugv("Path {0} is excluded from authentication", connection.path());
            return Uni.createFrom().item(AuthOutcome.exempt());
        }
        return authenticateToken(BearerCredentials.extract(connection));
    }

    /**
     * Authenticate a raw credential, consulting the claims cache first.
     *
     * @param token the raw bearer credential
     * @return the outcome; never a failed Uni
     */
    public Uni<AuthOutcome> authenticateToken(String token) {
        if (!claimsCache.isEnabled()) {
            return validateAndStore(token);
        }
        return lookupCached(token).flatMap(cached -> {
            if (cached.isPresent()) {
                LOG.debug("Token claims served from cache");
                record(metrics::recordCacheHit);
                return Uni.createFrom().item(toOutcome(cached.get()));
            }
            record(metrics::recordCacheMiss);
            return validateAndStore(token);
        });
    }

    @Override
    public Uni<Void> invalidate(String token) {
        if (!claimsCache.isEnabled()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom()
                .deferred(() -> claimsCache.invalidate(token))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Claims cache invalidate failed (ignored): {0}", error.getMessage());
                    return null;
                });
    }

    private Uni<Optional<RawClaims>> lookupCached(String token) {
        return Uni.createFrom()
                .deferred(() -> claimsCache.lookup(token))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Claims cache lookup failed, treating as miss: {0}", error.getMessage());
                    return Optional.empty();
                });
    }

    private Uni<Void> storeCached(String token, RawClaims claims) {
        if (!claimsCache.isEnabled()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom()
                .deferred(() -> claimsCache.store(token, claims))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Claims cache store failed (ignored): {0}", error.getMessage());
                    return null;
                });
    }

    private Uni<AuthOutcome> validateAndStore(String token) {
        final long start = System.nanoTime();
        return tokenValidator.validate(token).flatMap(result -> {
            final var elapsed = Duration.ofNanos(System.nanoTime() - start);
            record(() -> metrics.recordIdpDuration(AuthMetrics.OPERATION_VALIDATE_TOKEN, elapsed));

            if (result instanceof TokenValidationResult.Valid valid) {
                record(() -> metrics.recordTokenValidation(VALID));
                return storeCached(token, valid.claims()).map(ignored -> toOutcome(valid.claims()));
            }

            final var failed = (TokenValidationResult.Failed) result;
            record(() -> metrics.recordTokenValidation(failed.kind().validationStatus()));
            record(() -> metrics.recordAuthAttempt(failed.kind().attemptStatus()));
            LOG.warnv("Authentication failed: {0}", failed.kind().message(failed.reason()));
            return Uni.createFrom().item(AuthOutcome.failed(failed.kind(), failed.reason()));
        });
    }

    private AuthOutcome toOutcome(RawClaims claims) {
        final UserPrincipal principal;
        try {
            principal = UserPrincipal.fromClaims(claims);
        } catch (IllegalArgumentException e) {
            record(() -> metrics.recordAuthAttempt(AuthFailureKind.DECODE_ERROR.attemptStatus()));
            LOG.warnv("Token claims unusable: {0}", e.getMessage());
            return AuthOutcome.failed(AuthFailureKind.DECODE_ERROR, e.getMessage());
        }
        record(() -> metrics.recordAuthAttempt(SUCCESS));
        LOG.debugv("Authenticated user {0} with roles {1}", principal.username(), principal.roles());
        return AuthOutcome.authenticated(principal);
    }

    private void record(Runnable metric) {
        try {
            metric.run();
        } catch (RuntimeException e) {
            LOG.debugv("Metrics recording failed (ignored): {0}", e.getMessage());
        }
    }
}
