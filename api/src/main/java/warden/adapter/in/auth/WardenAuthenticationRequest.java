package warden.adapter.in.auth;

import io.quarkus.security.identity.request.BaseAuthenticationRequest;

import warden.core.model.auth.InboundConnection;

/**
 * Authentication request carrying the connection to authenticate.
 *
 * <p>The credential is read from the connection by
 * {@link WardenIdentityProvider}, so header and query-string handling stays in
 * one place.
 */
public class WardenAuthenticationRequest extends BaseAuthenticationRequest {

    private final InboundConnection connection;

    public WardenAuthenticationRequest(InboundConnection connection) {
        this.connection = connection;
    }

    public InboundConnection getConnection() {
        return connection;
    }
}
