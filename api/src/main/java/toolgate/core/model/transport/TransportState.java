package toolgate.core.model.transport;

/**
 * What the registry knows about a session's transport.
 */
public enum TransportState {
    /** No existence record and no local handle. */
    UNKNOWN,
    /** Existence record present but no local handle; the transport must be recreated. */
    DETACHED,
    /** A local handle serves the session. */
    LIVE
}
