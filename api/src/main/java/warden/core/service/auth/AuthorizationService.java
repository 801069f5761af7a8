package warden.core.service.auth;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import warden.core.model.auth.RoleCheck;
import warden.core.model.auth.UserPrincipal;

/**
 * Role-based authorization decisions.
 *
 * <p>Matching is exact string membership: no hierarchy, no wildcards, no case
 * folding. A principal must hold every required role.
 */
@ApplicationScoped
public class AuthorizationService {

    private static final Logger LOG = Logger.getLogger(AuthorizationService.class);

    /**
     * Compare a principal's roles against required roles.
     *
     * @param principal the authenticated principal
     * @param required  required roles, in the order the caller declared them
     * @return granted with no missing roles, or denied with the missing roles in
     *         request order
     */
    public RoleCheck hasRoles(UserPrincipal principal, List<String> required) {
        if (required == null || required.isEmpty()) {
            return RoleCheck.allow();
        }
        final var missing = new ArrayList<String>();
        for (var role : required) {
            if (!principal.hasRole(role)) {
                missing.add(role);
            }
        }
        return missing.isEmpty() ? RoleCheck.allow() : RoleCheck.deny(missing);
    }

    /**
     * Build a guard requiring all of the given roles.
     *
     * <p>A guard with no roles only requires an authenticated principal.
     *
     * @param roles required roles
     * @return a reusable guard
     */
    public RoleGuard requireRoles(String... roles) {
        return requireRoles(Arrays.asList(roles));
    }

    public RoleGuard requireRoles(List<String> roles) {
        return new RoleGuard(this, roles);
    }

    /**
     * Check access to a WebSocket handler.
     *
     * <p>Handlers absent from the registry require no roles.
     *
     * @param principal  the authenticated principal
     * @param handlerId  id of the handler being accessed
     * @param registry   handler id to required roles
     * @return true if access is granted
     */
    public boolean checkPermission(UserPrincipal principal, Object handlerId, Map<?, List<String>> registry) {
        final var required = registry.getOrDefault(handlerId, List.of());
        final var result = hasRoles(principal, required);
        if (!result.granted()) {
            LOG.infov(
                    "Permission denied for user {0} on handler {1}: required={2}, held={3}, missing={4}",
                    principal.username(), handlerId, required, principal.roles(), result.missing());
        }
        return result.granted();
    }
}
