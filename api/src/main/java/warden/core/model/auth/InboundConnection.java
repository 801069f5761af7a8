package warden.core.model.auth;

import java.util.Optional;

/**
 * Read-only view of a connection as seen by the authentication layer.
 *
 * <p>Adapters implement this over the host framework's request type.
 */
public interface InboundConnection {

    ConnectionKind kind();

    /**
     * Request path. Only meaningful for {@link ConnectionKind#HTTP}.
     */
    String path();

    /**
     * Header lookup, case-insensitive. Only meaningful for {@link ConnectionKind#HTTP}.
     */
    Optional<String> header(String name);

    /**
     * Raw query string of the opening request, without the leading {@code ?}.
     * Empty when there is none.
     */
    String queryString();
}
