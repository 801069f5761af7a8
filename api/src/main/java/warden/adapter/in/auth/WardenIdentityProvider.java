package warden.adapter.in.auth;

import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.identity.AuthenticationRequestContext;
import io.quarkus.security.identity.IdentityProvider;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.AuthOutcome;
import warden.core.model.auth.UserPrincipal;
import warden.core.port.in.AuthenticationUseCase;

/**
 * Quarkus identity provider backed by {@link AuthenticationUseCase}.
 *
 * <p>The resulting {@link SecurityIdentity} contains:
 * <ul>
 *   <li>Principal: the {@link UserPrincipal}</li>
 *   <li>Roles: the principal's client roles, usable with {@code @RolesAllowed}</li>
 *   <li>Attribute {@value #PRINCIPAL_ATTRIBUTE}: the principal again, for code
 *       that reads attributes</li>
 * </ul>
 *
 * <p>A failed outcome fails with {@link AuthenticationFailedException} whose
 * message names the failure kind, e.g. {@code token_expired: Token has expired}.
 */
@ApplicationScoped
public class WardenIdentityProvider implements IdentityProvider<WardenAuthenticationRequest> {

    private static final Logger LOG = Logger.getLogger(WardenIdentityProvider.class);

    public static final String PRINCIPAL_ATTRIBUTE = "warden.principal";

    private final AuthenticationUseCase authentication;

    @Inject
    public WardenIdentityProvider(AuthenticationUseCase authentication) {
        this.authentication = authentication;
    }

    @Override
    public Class<WardenAuthenticationRequest> getRequestType() {
        return WardenAuthenticationRequest.class;
    }

    @Override
    public Uni<SecurityIdentity> authenticate(
            WardenAuthenticationRequest request, AuthenticationRequestContext context) {
        return authentication.authenticate(request.getConnection()).flatMap(outcome -> {
            if (outcome instanceof AuthOutcome.Authenticated authenticated) {
                return Uni.createFrom().item(buildIdentity(authenticated.principal()));
            }
            if (outcome instanceof AuthOutcome.Failed failed) {
                LOG.debugv("Bearer authentication failed: {0}", failed.message());
                return Uni.createFrom()
                        .failure(new AuthenticationFailedException(
                                failed.message(), failed.kind().toException(failed.detail())));
            }
            return Uni.createFrom().nullItem();
        });
    }

    static SecurityIdentity buildIdentity(UserPrincipal principal) {
        return QuarkusSecurityIdentity.builder()
                .setPrincipal(principal)
                .addRoles(Set.copyOf(principal.roles()))
                .addAttribute(PRINCIPAL_ATTRIBUTE, principal)
                .build();
    }
}
