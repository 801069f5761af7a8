package warden.adapter.in.problem;

import java.util.List;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for authentication and authorization errors.
 */
public final class WardenProblem {

    private WardenProblem() {}

    public static HttpProblem unauthorized(String detail) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem forbidden(String detail) {
        return HttpProblem.builder()
                .withTitle("Forbidden")
                .withStatus(Status.FORBIDDEN)
                .withDetail(detail)
                .build();
    }

    /**
     * 403 listing the roles the caller is missing.
     */
    public static HttpProblem missingRoles(String detail, List<String> missingRoles) {
        return HttpProblem.builder()
                .withTitle("Forbidden")
                .withStatus(Status.FORBIDDEN)
                .withDetail(detail)
                .with("missingRoles", missingRoles)
                .build();
    }
}
