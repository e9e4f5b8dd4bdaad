package toolgate.core.model.diagnostics;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of the session subsystem.
 *
 * <p>When the backend is unreachable the counts are zero and
 * {@link #backendError()} explains why.
 */
public record SessionHealthSnapshot(
        Instant timestamp,
        String backend,
        boolean backendReachable,
        String backendError,
        long applicationSessions,
        long activeApplicationSessions,
        long transportSessions,
        long userIndexes,
        int localTransportHandles,
        Map<String, Long> userTypeDistribution,
        int trackedRecoveries,
        long exhaustedRecoveries,
        long discoveryFailures) {

    public SessionHealthSnapshot {
        userTypeDistribution = userTypeDistribution != null ? Map.copyOf(userTypeDistribution) : Map.of();
    }
}
