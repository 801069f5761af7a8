package warden.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WardenAuthConfig")
class WardenAuthConfigTest {

    private static WardenAuthConfig load(Map<String, String> properties) {
        return new SmallRyeConfigBuilder()
                .withMapping(WardenAuthConfig.class)
                .withSources(new PropertiesConfigSource(properties, "test", 100))
                .build()
                .getConfigMapping(WardenAuthConfig.class);
    }

    @Test
    @DisplayName("should apply defaults")
    void shouldApplyDefaults() {
        final var config = load(Map.of());

        assertEquals("http://localhost:8080/", config.provider().url());
        assertEquals("master", config.provider().realm());
        assertTrue(config.provider().clientId().isEmpty());
        assertEquals("^(/docs|/openapi.json|/health|/metrics)$", config.excludedPaths().pattern());
        assertEquals(Optional.empty(), config.cache().url());
        assertEquals(Duration.ofSeconds(30), config.cache().ttlBuffer());
        assertFalse(config.cache().local().enabled());
        assertFalse(config.metrics().enabled());
    }

    @Test
    @DisplayName("should read configured values")
    void shouldReadConfiguredValues() {
        final var config = load(Map.of(
                "warden.auth.provider.url", "https://sso.example.com",
                "warden.auth.provider.realm", "acme",
                "warden.auth.provider.client-id", "portal",
                "warden.auth.excluded-paths", "^/public",
                "warden.auth.cache.url", "redis://cache:6379/1",
                "warden.auth.cache.ttl-buffer", "PT10S",
                "warden.auth.metrics.enabled", "true"));

        assertEquals("acme", config.provider().realm());
        assertEquals(Optional.of("portal"), config.provider().clientId());
        assertTrue(config.excludedPaths().matcher("/public/logo.png").lookingAt());
        assertEquals(Optional.of("redis://cache:6379/1"), config.cache().url());
        assertEquals(Duration.ofSeconds(10), config.cache().ttlBuffer());
        assertTrue(config.metrics().enabled());
    }

    @Test
    @DisplayName("should fail to load an invalid exclusion pattern")
    void shouldRejectInvalidPattern() {
        final var error =
                assertThrows(RuntimeException.class, () -> load(Map.of("warden.auth.excluded-paths", "^(/docs")));

        assertTrue(
                namesExcludedPaths(error) || causedByPatternSyntax(error),
                () -> "Expected a pattern error for excluded-paths but got: " + error);
    }

    @Test
    @DisplayName("should load a valid exclusion pattern")
    void shouldLoadValidPattern() {
        final var config = load(Map.of("warden.auth.excluded-paths", "^(/docs|/health)$"));

        assertTrue(config.excludedPaths().matcher("/health").matches());
        assertFalse(config.excludedPaths().matcher("/me").lookingAt());
    }

    private static boolean namesExcludedPaths(Throwable error) {
        return error.getMessage() != null && error.getMessage().contains("warden.auth.excluded-paths");
    }

    private static boolean causedByPatternSyntax(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof PatternSyntaxException) {
                return true;
            }
        }
        return false;
    }
}
