package toolgate.core.service.discovery;

/**
 * What passive discovery did with one diagnostic line.
 */
public enum DiscoveryResult {
    /** The line mentions no session keyword. */
    IGNORED,
    /** A session keyword matched but no session id could be extracted. */
    NO_SESSION_ID,
    /** The session id was already processed. */
    DUPLICATE,
    /** The session was found or created and its transport registered. */
    TRACKED,
    /** Processing failed; the failure was logged and counted. */
    FAILED
}
