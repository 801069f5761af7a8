package warden.core.service.auth;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.exception.AuthenticationException;
import warden.core.model.auth.AuthFailureKind;
import warden.core.model.auth.TokenSet;
import warden.core.port.out.AuthMetrics;
import warden.spi.IdentityProviderClient;
import warden.spi.IdentityProviderException;

/**
 * Obtains tokens for a user from the identity provider.
 *
 * <p>Provider failures surface as {@link AuthenticationException} subtypes.
 */
@ApplicationScoped
public class LoginService {

    private static final Logger LOG = Logger.getLogger(LoginService.class);

    private final IdentityProviderClient identityProvider;
    private final AuthMetrics metrics;

    @Inject
    public LoginService(IdentityProviderClient identityProvider, AuthMetrics metrics) {
        this.identityProvider = identityProvider;
        this.metrics = metrics;
    }

    /**
     * Authenticate a user with a password and obtain tokens.
     *
     * @param username the user name
     * @param password the password
     * @return Uni with the issued tokens
     */
    public Uni<TokenSet> login(String username, String password) {
        final long start = System.nanoTime();
        return Uni.createFrom()
                .deferred(() -> identityProvider.login(username, password))
                .onTermination()
                .invoke(() -> recordDuration(start))
                .invoke(tokens -> LOG.debugv("Login succeeded for {0}", username))
                .onFailure(IdentityProviderException.class)
                .transform(error -> {
                    final var providerError = (IdentityProviderException) error;
                    LOG.infov("Login failed for {0}: {1}", username, providerError.getMessage());
                    return kindOf(providerError).toException(providerError.getMessage());
                });
    }

    private static AuthFailureKind kindOf(IdentityProviderException error) {
        return switch (error.reason()) {
            case EXPIRED -> AuthFailureKind.EXPIRED;
            case REJECTED -> AuthFailureKind.INVALID_CREDENTIALS;
            case MALFORMED -> AuthFailureKind.DECODE_ERROR;
        };
    }

    private void recordDuration(long start) {
        try {
            metrics.recordIdpDuration(AuthMetrics.OPERATION_LOGIN, Duration.ofNanos(System.nanoTime() - start));
        } catch (RuntimeException e) {
            LOG.debugv("Metrics recording failed (ignored): {0}", e.getMessage());
        }
    }
}
