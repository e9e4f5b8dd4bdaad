package toolgate.core.port.out;

/**
 * Port for recording session subsystem metrics.
 */
public interface SessionMetrics {

    boolean isEnabled();

    /**
     * @param scope {@code shared} or {@code identity}
     */
    void recordSessionCreated(String scope);

    /**
     * @param branch {@code exact} when the requested id matched, {@code window} when a recent session was reused
     */
    void recordSessionReused(String branch);

    void recordSessionDeactivated();

    /**
     * @param outcome recovery stage name, {@code exhausted} or {@code failed}
     */
    void recordRecovery(String outcome);

    /**
     * @param result discovery result name
     */
    void recordDiscovery(String result);

    void recordBackendTimeout(String backend, String operation);

    void recordBackendFailure(String backend, String operation);
}
