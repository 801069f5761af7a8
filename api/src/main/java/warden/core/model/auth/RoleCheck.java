package warden.core.model.auth;

import java.util.List;

/**
 * Outcome of comparing a principal's roles against required roles.
 *
 * @param granted whether every required role is held
 * @param missing required roles the principal lacks, in request order
 */
public record RoleCheck(boolean granted, List<String> missing) {

    private static final RoleCheck ALLOWED = new RoleCheck(true, List.of());

    public RoleCheck {
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public static RoleCheck allow() {
        return ALLOWED;
    }

    public static RoleCheck deny(List<String> missing) {
        return new RoleCheck(false, missing);
    }
}
