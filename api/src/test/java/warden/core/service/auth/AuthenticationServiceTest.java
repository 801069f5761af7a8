package warden.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.config.WardenAuthConfig;
import warden.core.model.auth.AuthFailureKind;
import warden.core.model.auth.AuthOutcome;
import warden.core.model.auth.RawClaims;
import warden.core.model.auth.StubConnection;
import warden.core.model.auth.TokenValidationResult;
import warden.core.model.auth.UserPrincipal;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.ClaimsCache;

@DisplayName("AuthenticationService")
class AuthenticationServiceTest {

    private static final String TOKEN = "header.payload.signature";

    private WardenAuthConfig config;
    private TokenValidator validator;
    private ClaimsCache cache;
    private AuthMetrics metrics;

    @BeforeEach
    void setUp() {
        config = mock(WardenAuthConfig.class);
        validator = mock(TokenValidator.class);
        cache = mock(ClaimsCache.class);
        metrics = mock(AuthMetrics.class);

        when(config.excludedPaths()).thenReturn(Pattern.compile("^(/docs|/openapi.json|/health|/metrics)$"));
        when(cache.isEnabled()).thenReturn(true);
        when(cache.lookup(anyString())).thenReturn(Uni.createFrom().item(Optional.empty()));
        when(cache.store(anyString(), any())).thenReturn(Uni.createFrom().voidItem());
        when(cache.invalidate(anyString())).thenReturn(Uni.createFrom().voidItem());
    }

    private AuthenticationService service() {
        return new AuthenticationService(config, validator, cache, metrics);
    }

    private static RawClaims aliceClaims() {
        return RawClaims.of(Map.of(
                "sub", "u1",
                "preferred_username", "alice",
                "exp", 4_102_444_800L,
                "azp", "app",
                "resource_access", Map.of("app", Map.of("roles", List.of("admin", "viewer")))));
    }

    private void validatorReturns(TokenValidationResult result) {
        when(validator.validate(anyString())).thenReturn(Uni.createFrom().item(result));
    }

    private AuthOutcome authenticate(AuthenticationService service, String authorization) {
        return service.authenticate(StubConnection.http("/api/things", authorization))
                .await()
                .indefinitely();
    }

    @Nested
    @DisplayName("exemption")
    class ExemptionTests {

        @Test
        @DisplayName("should exempt an excluded path without validating")
        void shouldExemptExcludedPath() {
            when(config.excludedPaths()).thenReturn(Pattern.compile("^(/health)$"));

            final var outcome = service().authenticate(StubConnection.http("/health")).await().indefinitely();

            assertInstanceOf(AuthOutcome.Exempt.class, outcome);
            verifyNoInteractions(validator);
            verify(cache, never()).lookup(anyString());
        }

        @Test
        @DisplayName("should match the pattern from the start of the path only")
        void shouldMatchFromStart() {
            when(config.excludedPaths()).thenReturn(Pattern.compile("/docs"));
            final var service = service();

            assertTrue(service.isExempt(StubConnection.http("/docs/index.html")));
            assertFalse(service.isExempt(StubConnection.http("/api/docs")));
        }

        @Test
        @DisplayName("should never exempt WebSocket connections")
        void shouldNeverExemptWebSocket() {
            validatorReturns(new TokenValidationResult.Failed(AuthFailureKind.DECODE_ERROR, "empty"));

            final var connection = StubConnection.webSocket("/health", "");
            final var service = service();
            final var outcome = service.authenticate(connection).await().indefinitely();

            assertFalse(service.isExempt(connection));
            assertInstanceOf(AuthOutcome.Failed.class, outcome);
            verify(validator).validate("");
        }
    }

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("should authenticate a valid token and cache its claims")
        void shouldAuthenticateValidToken() {
            validatorReturns(new TokenValidationResult.Valid(aliceClaims()));

            final var outcome = authenticate(service(), "Bearer " + TOKEN);

            final var authenticated = assertInstanceOf(AuthOutcome.Authenticated.class, outcome);
            assertEquals(new UserPrincipal("u1", "alice", 4_102_444_800L, List.of()), authenticated.principal());
            assertEquals(List.of("admin", "viewer"), authenticated.principal().roles());
            verify(validator).validate(TOKEN);
            verify(cache).store(TOKEN, aliceClaims());
            verify(metrics).recordCacheMiss();
            verify(metrics).recordTokenValidation("valid");
            verify(metrics).recordAuthAttempt("success");
            verify(metrics).recordIdpDuration(eq(AuthMetrics.OPERATION_VALIDATE_TOKEN), any(Duration.class));
        }

        @Test
        @DisplayName("should fail with Expired and not cache")
        void shouldFailExpiredToken() {
            validatorReturns(new TokenValidationResult.Failed(AuthFailureKind.EXPIRED, "Token has expired"));

            final var outcome = authenticate(service(), "Bearer " + TOKEN);

            final var failed = assertInstanceOf(AuthOutcome.Failed.class, outcome);
            assertEquals(AuthFailureKind.EXPIRED, failed.kind());
            assertEquals("token_expired: Token has expired", failed.message());
            verify(cache, never()).store(anyString(), any());
            verify(metrics).recordTokenValidation("expired");
            verify(metrics).recordAuthAttempt("expired");
        }

        @Test
        @DisplayName("should validate an empty credential when the header is missing")
        void shouldValidateEmptyCredential() {
            validatorReturns(new TokenValidationResult.Failed(AuthFailureKind.DECODE_ERROR, "not a JWT"));

            final var outcome =
                    service().authenticate(StubConnection.http("/api")).await().indefinitely();

            assertEquals(AuthFailureKind.DECODE_ERROR, ((AuthOutcome.Failed) outcome).kind());
            verify(validator).validate("");
        }

        @Test
        @DisplayName("should fail with DecodeError when required claims are missing")
        void shouldFailOnMissingClaims() {
            validatorReturns(new TokenValidationResult.Valid(RawClaims.of(Map.of("sub", "u1", "exp", 1L))));

            final var outcome = authenticate(service(), "Bearer " + TOKEN);

            final var failed = assertInstanceOf(AuthOutcome.Failed.class, outcome);
            assertEquals(AuthFailureKind.DECODE_ERROR, failed.kind());
            assertTrue(failed.message().contains("preferred_username"));
            verify(metrics).recordAuthAttempt("error");
        }

        @Test
        @DisplayName("should build principal without roles when azp is missing")
        void shouldBuildPrincipalWithoutAzp() {
            final var values = new HashMap<>(aliceClaims().values());
            values.remove("azp");
            validatorReturns(new TokenValidationResult.Valid(RawClaims.of(values)));

            final var outcome = (AuthOutcome.Authenticated) authenticate(service(), "Bearer " + TOKEN);

            assertEquals(List.of(), outcome.principal().roles());
        }
    }

    @Nested
    @DisplayName("claims cache")
    class CacheTests {

        @Test
        @DisplayName("should serve a cache hit without validating")
        void shouldServeCacheHit() {
            when(cache.lookup(TOKEN)).thenReturn(Uni.createFrom().item(Optional.of(aliceClaims())));

            final var outcome = authenticate(service(), "Bearer " + TOKEN);

            assertInstanceOf(AuthOutcome.Authenticated.class, outcome);
            verifyNoInteractions(validator);
            verify(metrics).recordCacheHit();
            verify(metrics).recordAuthAttempt("success");
            verify(cache, never()).store(anyString(), any());
        }

        @Test
        @DisplayName("should never touch the cache when it is disabled")
        void shouldSkipDisabledCache() {
            when(cache.isEnabled()).thenReturn(false);
            validatorReturns(new TokenValidationResult.Valid(aliceClaims()));

            authenticate(service(), "Bearer " + TOKEN);

            verify(validator, times(1)).validate(TOKEN);
            verify(cache, never()).lookup(anyString());
            verify(cache, never()).store(anyString(), any());
            verify(metrics, never()).recordCacheMiss();
        }

        @Test
        @DisplayName("should authenticate when every cache operation fails")
        void shouldSurviveFailingCache() {
            when(cache.lookup(anyString())).thenReturn(Uni.createFrom().failure(new RuntimeException("down")));
            when(cache.store(anyString(), any())).thenThrow(new RuntimeException("down"));
            validatorReturns(new TokenValidationResult.Valid(aliceClaims()));

            final var outcome = authenticate(service(), "Bearer " + TOKEN);

            assertInstanceOf(AuthOutcome.Authenticated.class, outcome);
            verify(validator).validate(TOKEN);
        }

        @Test
        @DisplayName("should invalidate repeatedly without raising")
        void shouldInvalidateRepeatedly() {
            when(cache.invalidate(TOKEN))
                    .thenReturn(Uni.createFrom().voidItem())
                    .thenReturn(Uni.createFrom().failure(new RuntimeException("down")));
            final var service = service();

            assertDoesNotThrow(() -> service.invalidate(TOKEN).await().indefinitely());
            assertDoesNotThrow(() -> service.invalidate(TOKEN).await().indefinitely());
            verify(cache, times(2)).invalidate(TOKEN);
        }
    }

    @Test
    @DisplayName("should ignore failures of the metrics sink")
    void shouldIgnoreMetricsFailures() {
        validatorReturns(new TokenValidationResult.Valid(aliceClaims()));
        doThrow(new IllegalStateException("sink down")).when(metrics).recordAuthAttempt(anyString());
        doThrow(new IllegalStateException("sink down")).when(metrics).recordTokenValidation(anyString());
        doThrow(new IllegalStateException("sink down")).when(metrics).recordCacheMiss();
        doThrow(new IllegalStateException("sink down"))
                .when(metrics)
                .recordIdpDuration(anyString(), any());

        final var outcome = authenticate(service(), "Bearer " + TOKEN);

        assertInstanceOf(AuthOutcome.Authenticated.class, outcome);
    }
}
