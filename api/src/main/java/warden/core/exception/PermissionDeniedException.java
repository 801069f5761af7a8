package warden.core.exception;

import java.util.List;

/**
 * The caller lacks one or more required roles.
 *
 * <p>The message lists the missing roles comma-joined in request order,
 * e.g. {@code "Missing required roles: reports, audit"}.
 */
public class PermissionDeniedException extends AuthorizationException {

    private final List<String> missingRoles;

    public PermissionDeniedException(List<String> missingRoles) {
        super("Missing required roles: " + String.join(", ", missingRoles));
        this.missingRoles = List.copyOf(missingRoles);
    }

    public List<String> missingRoles() {
        return missingRoles;
    }
}
