package warden.adapter.in.rest;

import java.time.Clock;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.quarkus.security.identity.CurrentIdentityAssociation;
import io.smallrye.mutiny.Uni;

import warden.adapter.in.auth.RequireRoles;
import warden.adapter.in.dto.PrincipalResponse;
import warden.core.exception.AuthenticationException;
import warden.core.model.auth.UserPrincipal;

/**
 * Protected endpoints for the authenticated caller.
 *
 * <p>{@code /me} needs any valid token. {@code /admin} and {@code /reports}
 * need client roles.
 */
@Path("/")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AccountResource {

    private final CurrentIdentityAssociation identityAssociation;
    private final Clock clock;

    @Inject
    public AccountResource(CurrentIdentityAssociation identityAssociation) {
        this(identityAssociation, Clock.systemUTC());
    }

    AccountResource(CurrentIdentityAssociation identityAssociation, Clock clock) {
        this.identityAssociation = identityAssociation;
        this.clock = clock;
    }

    @GET
    @Path("me")
    @RequireRoles
    public Uni<PrincipalResponse> me() {
        return currentPrincipal().map(principal -> PrincipalResponse.fromModel(principal, clock));
    }

    @GET
    @Path("admin")
    @RequireRoles("admin")
    public Uni<Map<String, String>> admin() {
        return currentPrincipal().map(principal -> Map.of("message", "Welcome, " + principal.username()));
    }

    @GET
    @Path("reports")
    @RequireRoles({"admin", "reports"})
    public Uni<Map<String, String>> reports() {
        return currentPrincipal().map(principal -> Map.of("message", "Reports for " + principal.username()));
    }

    private Uni<UserPrincipal> currentPrincipal() {
        return identityAssociation.getDeferredIdentity().map(identity -> {
            if (identity.getPrincipal() instanceof UserPrincipal principal) {
                return principal;
            }
            throw new AuthenticationException("Authentication required");
        });
    }
}
