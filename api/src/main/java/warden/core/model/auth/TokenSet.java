package warden.core.model.auth;

import java.util.Optional;

/**
 * Tokens returned by the identity provider's token endpoint.
 *
 * @param accessToken      the access token
 * @param refreshToken     refresh token, if issued
 * @param tokenType        token type (usually {@code Bearer})
 * @param expiresIn        access token lifetime in seconds
 * @param refreshExpiresIn refresh token lifetime in seconds (0 if none)
 * @param scope            granted scopes, if reported
 */
public record TokenSet(
        String accessToken,
        Optional<String> refreshToken,
        String tokenType,
        long expiresIn,
        long refreshExpiresIn,
        Optional<String> scope) {

    public TokenSet {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token cannot be null or blank");
        }
        if (tokenType == null || tokenType.isBlank()) {
            tokenType = "Bearer";
        }
        refreshToken = refreshToken == null ? Optional.empty() : refreshToken;
        scope = scope == null ? Optional.empty() : scope;
    }
}
