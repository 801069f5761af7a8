package warden.core.service.auth;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

import warden.core.model.auth.ConnectionKind;
import warden.core.model.auth.InboundConnection;

/**
 * Extracts the raw credential from an inbound connection.
 *
 * <p>Request/response connections carry it in the {@code Authorization} header.
 * WebSocket connections carry it in an {@code Authorization} query parameter of
 * the opening request. In both cases the value is split on the first space into
 * scheme and credential, and the credential is returned.
 *
 * <p>A missing value yields an empty credential rather than an error. The empty
 * string is handed to validation, which rejects it.
 */
public final class BearerCredentials {

    public static final String AUTHORIZATION = "Authorization";

    private BearerCredentials() {
        // utility class
    }

    /**
     * Read the credential for a connection.
     *
     * @param connection the inbound connection
     * @return the credential, possibly empty, never null
     */
    public static String extract(InboundConnection connection) {
        final String authorization;
        if (connection.kind() == ConnectionKind.WEBSOCKET) {
            authorization = queryParameter(connection.queryString(), AUTHORIZATION);
        } else {
            authorization = connection.header(AUTHORIZATION).orElse("");
        }
        return credentialOf(authorization);
    }

    /**
     * Split {@code "<scheme> <credential>"} and return the credential part.
     *
     * <p>Only the first space separates; the credential is not trimmed. A value
     * without a space has no credential.
     *
     * @param authorization header or query value, may be null
     * @return the credential, or empty
     */
    public static String credentialOf(String authorization) {
        if (authorization == null || authorization.isEmpty()) {
            return "";
        }
        final int space = authorization.indexOf(' ');
        if (space < 0) {
            return "";
        }
        return authorization.substring(space + 1);
    }

    /**
     * URL-decoded value of a query parameter. When repeated, the last non-empty
     * occurrence wins.
     *
     * @param query raw query string without the leading {@code ?}, may be null
     * @param name  parameter name, matched exactly after decoding
     * @return the decoded value, or empty
     */
    static String queryParameter(String query, String name) {
        if (query == null || query.isEmpty()) {
            return "";
        }
        var value = "";
        for (var pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            final int eq = pair.indexOf('=');
            final var key = decode(eq < 0 ? pair : pair.substring(0, eq));
            final var raw = eq < 0 ? "" : decode(pair.substring(eq + 1));
            if (name.equals(key) && !raw.isEmpty()) {
                value = raw;
            }
        }
        return value;
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // malformed percent-escape: keep the raw text
            return value;
        }
    }
}
