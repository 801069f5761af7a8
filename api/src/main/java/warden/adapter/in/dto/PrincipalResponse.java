package warden.adapter.in.dto;

import java.time.Clock;
import java.util.List;

import warden.core.model.auth.UserPrincipal;

/**
 * Response body describing the authenticated caller.
 */
public record PrincipalResponse(String id, String username, List<String> roles, long expiresIn) {

    public static PrincipalResponse fromModel(UserPrincipal principal, Clock clock) {
        return new PrincipalResponse(
                principal.id(),
                principal.username(),
                principal.roles(),
                Math.max(principal.secondsRemaining(clock), 0));
    }
}
