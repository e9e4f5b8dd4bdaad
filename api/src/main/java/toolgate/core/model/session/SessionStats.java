package toolgate.core.model.session;

import java.util.Map;

/**
 * Aggregate view of stored application sessions and user indexes.
 */
public record SessionStats(
        long totalSessions, long activeSessions, long userIndexes, Map<String, Long> userTypeDistribution) {

    public SessionStats {
        userTypeDistribution = userTypeDistribution != null ? Map.copyOf(userTypeDistribution) : Map.of();
    }
}
