package warden.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import io.quarkus.security.AuthenticationFailedException;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import warden.core.exception.AuthenticationException;
import warden.core.exception.AuthorizationException;
import warden.core.exception.PermissionDeniedException;

/**
 * Maps authentication and authorization failures to RFC 7807 Problem Details.
 *
 * <p>Raw tokens never appear in responses or logs.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";
    private static final String AUTHENTICATION_REQUIRED = "Authentication required";
    private static final String WWW_AUTHENTICATE = "WWW-Authenticate";
    private static final String BEARER_CHALLENGE = "Bearer realm=\"warden\"";

    @ServerExceptionMapper
    public Response mapAuthenticationFailed(AuthenticationFailedException e) {
        final var detail = e.getMessage() == null || e.getMessage().isBlank() ? AUTHENTICATION_REQUIRED : e.getMessage();
        LOG.debugv("Authentication failed: {0}", detail);
        return challenge(WardenProblem.unauthorized(detail));
    }

    @ServerExceptionMapper
    public Response mapAuthenticationException(AuthenticationException e) {
        LOG.debugv("Authentication error: {0}", e.getMessage());
        return challenge(WardenProblem.unauthorized(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapAuthorizationException(AuthorizationException e) {
        LOG.debugv("Authorization denied: {0}", e.getMessage());
        if (e instanceof PermissionDeniedException denied) {
            return toResponse(WardenProblem.missingRoles(denied.getMessage(), denied.missingRoles()));
        }
        return toResponse(WardenProblem.forbidden(e.getMessage()));
    }

    private Response challenge(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .header(WWW_AUTHENTICATE, BEARER_CHALLENGE)
                .entity(problem)
                .build();
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
