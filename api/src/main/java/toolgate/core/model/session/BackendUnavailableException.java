package toolgate.core.model.session;

/**
 * The session backend could not be reached or did not answer in time.
 */
public class BackendUnavailableException extends RuntimeException {

    private final String backend;
    private final String operation;

    public BackendUnavailableException(String backend, String operation, Throwable cause) {
        super("Session backend '" + backend + "' unavailable during " + operation, cause);
        this.backend = backend;
        this.operation = operation;
    }

    public BackendUnavailableException(String backend, String operation) {
        this(backend, operation, null);
    }

    public String getBackend() {
        return backend;
    }

    public String getOperation() {
        return operation;
    }
}
