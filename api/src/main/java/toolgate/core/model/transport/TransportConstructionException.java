package toolgate.core.model.transport;

/**
 * A transport could not be constructed for a session.
 */
public class TransportConstructionException extends RuntimeException {

    private final String sessionId;

    public TransportConstructionException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public TransportConstructionException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
