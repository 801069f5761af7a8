package warden.adapter.in.auth;

import java.lang.reflect.Method;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ResourceInfo;

import io.quarkus.security.identity.CurrentIdentityAssociation;
import io.quarkus.security.identity.SecurityIdentity;
import io.smallrye.mutiny.Uni;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;

import warden.core.model.auth.UserPrincipal;
import warden.core.service.auth.AuthorizationService;

/**
 * Authenticates every REST request and enforces {@link RequireRoles}.
 *
 * <p>Resolving the deferred identity runs {@link BearerAuthenticationMechanism}, so a
 * request with a bad token fails here even when the method is not annotated.
 * Excluded paths resolve to an anonymous identity.
 */
public class RequireRolesFilter {

    private final CurrentIdentityAssociation identityAssociation;
    private final AuthorizationService authorizationService;

    @Inject
    public RequireRolesFilter(
            CurrentIdentityAssociation identityAssociation, AuthorizationService authorizationService) {
        this.identityAssociation = identityAssociation;
        this.authorizationService = authorizationService;
    }

    @ServerRequestFilter(priority = Priorities.AUTHORIZATION)
    public Uni<Void> filter(ResourceInfo resourceInfo) {
        return identityAssociation.getDeferredIdentity().invoke(identity -> {
            final var required = requiredRoles(resourceInfo.getResourceMethod(), resourceInfo.getResourceClass());
            if (required != null) {
                authorizationService.requireRoles(required.value()).check(principalOf(identity));
            }
        }).replaceWithVoid();
    }

    static RequireRoles requiredRoles(Method method, Class<?> resourceClass) {
        if (method != null && method.isAnnotationPresent(RequireRoles.class)) {
            return method.getAnnotation(RequireRoles.class);
        }
        return resourceClass == null ? null : resourceClass.getAnnotation(RequireRoles.class);
    }

    static UserPrincipal principalOf(SecurityIdentity identity) {
        if (identity == null || identity.isAnonymous()) {
            return null;
        }
        return identity.getPrincipal() instanceof UserPrincipal principal ? principal : null;
    }
}
