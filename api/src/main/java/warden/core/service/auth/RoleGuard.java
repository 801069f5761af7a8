package warden.core.service.auth;

import java.util.List;

import org.jboss.logging.Logger;

import warden.core.exception.AuthenticationException;
import warden.core.exception.PermissionDeniedException;
import warden.core.model.auth.AuthOutcome;
import warden.core.model.auth.UserPrincipal;

/**
 * Reusable authorization check bound to a fixed set of required roles.
 *
 * <p>Created by {@link AuthorizationService#requireRoles}. Passing silently
 * means access is granted.
 */
public final class RoleGuard {

    private static final Logger LOG = Logger.getLogger(RoleGuard.class);

    static final String AUTHENTICATION_REQUIRED = "Authentication required";

    private final AuthorizationService authorizationService;
    private final List<String> requiredRoles;

    RoleGuard(AuthorizationService authorizationService, List<String> requiredRoles) {
        this.authorizationService = authorizationService;
        this.requiredRoles = List.copyOf(requiredRoles);
    }

    public List<String> requiredRoles() {
        return requiredRoles;
    }

    /**
     * Check a request's authentication outcome.
     *
     * @param outcome the outcome, or null when authentication never ran
     * @throws AuthenticationException   if there is no authenticated principal
     * @throws PermissionDeniedException if required roles are missing
     */
    public void check(AuthOutcome outcome) {
        check(outcome instanceof AuthOutcome.Authenticated authenticated ? authenticated.principal() : null);
    }

    /**
     * Check a principal.
     *
     * @param principal the authenticated principal, or null for anonymous requests
     * @throws AuthenticationException   if the principal is null
     * @throws PermissionDeniedException if required roles are missing
     */
    public void check(UserPrincipal principal) {
        if (principal == null) {
            throw new AuthenticationException(AUTHENTICATION_REQUIRED);
        }
        final var result = authorizationService.hasRoles(principal, requiredRoles);
        if (!result.granted()) {
            LOG.infov(
                    "Permission denied for user {0}: required={1}, held={2}, missing={3}",
                    principal.username(), requiredRoles, principal.roles(), result.missing());
            throw new PermissionDeniedException(result.missing());
        }
    }
}
