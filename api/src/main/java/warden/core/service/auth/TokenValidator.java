package warden.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.AuthFailureKind;
import warden.core.model.auth.TokenValidationResult;
import warden.spi.IdentityProviderClient;
import warden.spi.IdentityProviderException;

/**
 * Validates bearer tokens against the identity provider.
 *
 * <p>Normalizes every provider outcome into a {@link TokenValidationResult}. The
 * returned Uni never fails: provider errors become
 * {@link TokenValidationResult.Failed} with one of three kinds. No retries.
 */
@ApplicationScoped
public class TokenValidator {

    private static final Logger LOG = Logger.getLogger(TokenValidator.class);

    private final IdentityProviderClient identityProvider;

    @Inject
    public TokenValidator(IdentityProviderClient identityProvider) {
        this.identityProvider = identityProvider;
    }

    /**
     * Validate a token.
     *
     * @param token the raw bearer credential (may be empty)
     * @return the validation result
     */
    public Uni<TokenValidationResult> validate(String token) {
        return Uni.createFrom()
                .deferred(() -> identityProvider.decodeToken(token))
                .map(claims -> (TokenValidationResult) new TokenValidationResult.Valid(claims))
                .onFailure()
                .recoverWithItem(this::classify);
    }

    TokenValidationResult classify(Throwable error) {
        if (error instanceof IdentityProviderException providerError) {
            final var kind =
                    switch (providerError.reason()) {
                        case EXPIRED -> AuthFailureKind.EXPIRED;
                        case REJECTED -> AuthFailureKind.INVALID_CREDENTIALS;
                        case MALFORMED -> AuthFailureKind.DECODE_ERROR;
                    };
            LOG.debugv("Token rejected by {0}: {1} ({2})", identityProvider.name(), kind, error.getMessage());
            return new TokenValidationResult.Failed(kind, error.getMessage());
        }
        if (error instanceof IllegalArgumentException) {
            LOG.debugv("Token could not be decoded: {0}", error.getMessage());
            return new TokenValidationResult.Failed(AuthFailureKind.DECODE_ERROR, error.getMessage());
        }
        // unclassified provider errors fail closed
        LOG.errorv(error, "Unexpected error validating token with {0}", identityProvider.name());
        return new TokenValidationResult.Failed(AuthFailureKind.INVALID_CREDENTIALS, error.getMessage());
    }
}
