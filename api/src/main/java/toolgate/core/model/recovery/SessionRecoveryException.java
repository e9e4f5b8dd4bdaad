package toolgate.core.model.recovery;

/**
 * An admitted recovery failed part way through.
 *
 * <p>The cause is the backend or transport failure that stopped it. Recovery is
 * never retried within the same call.
 */
public class SessionRecoveryException extends RuntimeException {

    private final String sessionId;

    public SessionRecoveryException(String sessionId, Throwable cause) {
        super("Recovery failed for session " + sessionId + ": " + (cause != null ? cause.getMessage() : "unknown"),
                cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
