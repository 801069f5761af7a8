package warden.adapter.in.auth;

import java.util.Optional;

import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;

import warden.core.model.auth.ConnectionKind;
import warden.core.model.auth.InboundConnection;

/**
 * {@link InboundConnection} over a Vert.x request.
 *
 * <p>A request carrying {@code Upgrade: websocket} and a {@code Connection}
 * header containing {@code upgrade} is a WebSocket handshake.
 */
public final class RoutingContextConnection implements InboundConnection {

    private final HttpServerRequest request;

    RoutingContextConnection(HttpServerRequest request) {
        this.request = request;
    }

    public static RoutingContextConnection of(RoutingContext context) {
        return new RoutingContextConnection(context.request());
    }

    @Override
    public ConnectionKind kind() {
        return isWebSocketUpgrade() ? ConnectionKind.WEBSOCKET : ConnectionKind.HTTP;
    }

    @Override
    public String path() {
        return request.path();
    }

    @Override
    public Optional<String> header(String name) {
        return Optional.ofNullable(request.getHeader(name));
    }

    @Override
    public String queryString() {
        final var query = request.query();
        return query == null ? "" : query;
    }

    private boolean isWebSocketUpgrade() {
        final var upgrade = request.getHeader("Upgrade");
        final var connection = request.getHeader("Connection");

        return "websocket".equalsIgnoreCase(upgrade)
                && connection != null
                && connection.toLowerCase().contains("upgrade");
    }
}
