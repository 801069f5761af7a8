package warden.adapter.in.websocket;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.vertx.web.RouteFilter;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

import warden.adapter.in.auth.RoutingContextConnection;
import warden.core.model.auth.AuthOutcome;
import warden.core.model.auth.ConnectionKind;
import warden.core.model.auth.UserPrincipal;
import warden.core.port.in.AuthenticationUseCase;

/**
 * Vert.x route filter that authenticates WebSocket handshakes before they are
 * upgraded.
 *
 * <p>Browsers cannot set headers on a WebSocket handshake, so the token is read
 * from the {@code Authorization} query parameter. A failed handshake is
 * answered with 401 and the failure message. On success the principal is stored
 * in the routing context under {@link #PRINCIPAL_KEY} for the WebSocket handler,
 * which can then call
 * {@link warden.core.service.auth.AuthorizationService#checkPermission}.
 */
@ApplicationScoped
public class WebSocketAuthenticationFilter {

    private static final Logger LOG = Logger.getLogger(WebSocketAuthenticationFilter.class);

    public static final String PRINCIPAL_KEY = "warden.principal";

    private final AuthenticationUseCase authentication;

    @Inject
    public WebSocketAuthenticationFilter(AuthenticationUseCase authentication) {
        this.authentication = authentication;
    }

    /**
     * Principal stored by this filter for the current handshake.
     */
    public static Optional<UserPrincipal> principalOf(RoutingContext ctx) {
        return ctx.get(PRINCIPAL_KEY) instanceof UserPrincipal principal ? Optional.of(principal) : Optional.empty();
    }

    @RouteFilter(50)
    void authenticateHandshake(RoutingContext ctx) {
        final var connection = RoutingContextConnection.of(ctx);
        if (connection.kind() != ConnectionKind.WEBSOCKET) {
            ctx.next();
            return;
        }

        LOG.debugv("Authenticating WebSocket handshake: {0}", connection.path());
        authentication
                .authenticate(connection)
                .subscribe()
                .with(outcome -> onOutcome(ctx, outcome), error -> {
                    LOG.errorv(error, "WebSocket authentication error on {0}", connection.path());
                    ctx.fail(500, error);
                });
    }

    private void onOutcome(RoutingContext ctx, AuthOutcome outcome) {
        if (outcome instanceof AuthOutcome.Authenticated authenticated) {
            ctx.put(PRINCIPAL_KEY, authenticated.principal());
            ctx.next();
        } else if (outcome instanceof AuthOutcome.Failed failed) {
            LOG.infov("WebSocket handshake rejected: {0}", failed.message());
            ctx.response()
                    .setStatusCode(401)
                    .putHeader("Content-Type", "text/plain")
                    .end(failed.message());
        } else {
            ctx.next();
        }
    }
}
