package warden.core.model.auth;

/**
 * Transport shape of an inbound connection.
 */
public enum ConnectionKind {

    /** Request/response. Token travels in the {@code Authorization} header. */
    HTTP,

    /** Long-lived stream. Token travels in the initial query string. */
    WEBSOCKET
}
