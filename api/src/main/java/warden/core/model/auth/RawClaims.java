package warden.core.model.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decoded token claims as returned by the identity provider.
 *
 * <p>Claims are kept untyped. Accessors for the claims this gateway relies on
 * never throw: a missing or wrong-shaped value reads as absent.
 *
 * @param values claim name to claim value
 */
public record RawClaims(Map<String, Object> values) {

    public static final String SUBJECT = "sub";
    public static final String EXPIRES_AT = "exp";
    public static final String PREFERRED_USERNAME = "preferred_username";
    public static final String AUTHORIZED_PARTY = "azp";
    public static final String RESOURCE_ACCESS = "resource_access";
    public static final String ROLES = "roles";

    private static final long MIN_CACHE_TTL_SECONDS = 1;

    public RawClaims {
        // claim values may legitimately be JSON null, so Map.copyOf is not an option
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static RawClaims of(Map<String, Object> values) {
        return new RawClaims(values);
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Optional<String> getString(String name) {
        return get(name).filter(String.class::isInstance).map(String.class::cast);
    }

    public Optional<String> subject() {
        return getString(SUBJECT);
    }

    public Optional<String> preferredUsername() {
        return getString(PREFERRED_USERNAME);
    }

    /**
     * The authorized party (client id), or the empty string when absent.
     */
    public String authorizedParty() {
        return getString(AUTHORIZED_PARTY).orElse("");
    }

    /**
     * Token expiry as Unix seconds.
     *
     * <p>Accepts any numeric type and numeric strings.
     */
    public Optional<Long> expiresAt() {
        return get(EXPIRES_AT).flatMap(RawClaims::asEpochSeconds);
    }

    /**
     * Client roles granted to the authorized party.
     *
     * <p>Resolves {@code resource_access[azp].roles}. Each step falls back to an
     * empty list when the key is missing or the value has the wrong shape.
     * Non-string role entries are dropped.
     */
    public List<String> clientRoles() {
        return asMap(values.get(RESOURCE_ACCESS))
                .flatMap(access -> asMap(access.get(authorizedParty())))
                .flatMap(client -> asList(client.get(ROLES)))
                .map(RawClaims::strings)
                .orElse(List.of());
    }

    /**
     * Time-to-live for caching these claims.
     *
     * <p>{@code exp - now - buffer}, never less than one second. Empty when the
     * claims carry no usable {@code exp}, in which case they must not be cached.
     *
     * @param now    the current instant
     * @param buffer safety margin subtracted from the remaining lifetime
     * @return the TTL, or empty if no expiry is known
     */
    public Optional<Duration> cacheTtl(Instant now, Duration buffer) {
        return expiresAt().map(exp -> {
            final long remaining = exp - now.getEpochSecond() - buffer.toSeconds();
            return Duration.ofSeconds(Math.max(remaining, MIN_CACHE_TTL_SECONDS));
        });
    }

    private static Optional<Long> asEpochSeconds(Object value) {
        if (value instanceof Number number) {
            return Optional.of(number.longValue());
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<Map<?, ?>> asMap(Object value) {
        return value instanceof Map<?, ?> map ? Optional.of(map) : Optional.empty();
    }

    private static Optional<List<?>> asList(Object value) {
        return value instanceof List<?> list ? Optional.of(list) : Optional.empty();
    }

    private static List<String> strings(List<?> raw) {
        final var result = new ArrayList<String>(raw.size());
        for (var item : raw) {
            if (item instanceof String role) {
                result.add(role);
            }
        }
        return List.copyOf(result);
    }
}
