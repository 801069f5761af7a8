package warden.core.port.in;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.AuthOutcome;
import warden.core.model.auth.InboundConnection;

/**
 * Port for authenticating inbound connections.
 */
public interface AuthenticationUseCase {

    /**
     * Whether the connection bypasses authentication entirely.
     *
     * <p>Only request/response connections can be exempt.
     *
     * @param connection the inbound connection
     * @return true if no token should be read
     */
    boolean isExempt(InboundConnection connection);

    /**
     * Authenticate a connection.
     *
     * <p>The returned Uni never fails for token problems; those are reported as
     * {@link AuthOutcome.Failed}.
     *
     * @param connection the inbound connection
     * @return the outcome
     */
    Uni<AuthOutcome> authenticate(InboundConnection connection);

    /**
     * Drop any cached claims for a token.
     *
     * @param token the raw bearer token
     * @return Uni completing when done; never fails
     */
    Uni<Void> invalidate(String token);
}
