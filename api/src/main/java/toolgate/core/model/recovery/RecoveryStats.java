package toolgate.core.model.recovery;

import java.time.Duration;
import java.util.Map;

/**
 * Snapshot of process-local recovery counters.
 */
public record RecoveryStats(
        int trackedSessions, int maxAttempts, Duration cooldown, Map<String, RecoveryAttempt> attempts) {

    public RecoveryStats {
        attempts = attempts != null ? Map.copyOf(attempts) : Map.of();
    }

    /**
     * Number of tracked sessions currently at or over the attempt budget.
     */
    public long exhaustedSessions() {
        return attempts.values().stream().filter(a -> a.count() >= maxAttempts).count();
    }
}
