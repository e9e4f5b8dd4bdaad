package toolgate.core.service.recovery;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import org.jboss.logging.Logger;

import toolgate.core.config.RecoveryConfig;
import toolgate.core.model.recovery.RecoveryAttempt;
import toolgate.core.model.recovery.RecoveryExhaustedException;
import toolgate.core.model.recovery.RecoveryStats;

/**
 * Per-session recovery budget, local to this process.
 *
 * <p>A session may attempt recovery {@code max-attempts} times; the counter
 * resets once {@code cooldown} passes without an attempt. Admission and the
 * increment happen in one atomic map update, so concurrent callers for the same
 * session can never exceed the budget.
 */
@ApplicationScoped
public class RecoveryAttemptTracker {

    private static final Logger LOG = Logger.getLogger(RecoveryAttemptTracker.class);

    private final RecoveryConfig config;
    private final Clock clock;
    private final ConcurrentMap<String, RecoveryAttempt> attempts = new ConcurrentHashMap<>();

    @Inject
    public RecoveryAttemptTracker(RecoveryConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Record a recovery attempt for the session if its budget allows one.
     *
     * @return the counter after this attempt
     * @throws RecoveryExhaustedException if the budget is spent and the cooldown has not elapsed
     */
    public RecoveryAttempt admit(String sessionId) {
        Instant now = clock.instant();
        AtomicBoolean admitted = new AtomicBoolean(false);
        RecoveryAttempt current = attempts.compute(sessionId, (id, existing) -> {
            if (existing == null || cooldownElapsed(existing, now)) {
                admitted.set(true);
                return RecoveryAttempt.first(now);
            }
            if (existing.count() >= config.maxAttempts()) {
                return existing;
            }
            admitted.set(true);
            return existing.next(now);
        });
        if (!admitted.get()) {
            Duration retryAfter = Duration.between(now, current.lastAttemptAt().plus(config.cooldown()));
            LOG.warnf(
                    "Recovery budget exhausted for session %s (%d attempts), retry after %s",
                    sessionId, current.count(), retryAfter);
            throw new RecoveryExhaustedException(sessionId, current.count(), retryAfter);
        }
        return current;
    }

    /**
     * Forget the counter for a session.
     */
    public void reset(String sessionId) {
        attempts.remove(sessionId);
    }

    /**
     * Discard counters idle for two cooldown windows.
     *
     * @return number of counters removed
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(config.cooldown().multipliedBy(2));
        int before = attempts.size();
        attempts.entrySet().removeIf(e -> !e.getValue().lastAttemptAt().isAfter(cutoff));
        int removed = Math.max(0, before - attempts.size());
        if (removed > 0) {
            LOG.infof("Discarded %d idle recovery counters", removed);
        }
        return removed;
    }

    @Scheduled(
            every = "${toolgate.recovery.cleanup-interval:1h}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledSweep() {
        sweep();
    }

    public RecoveryStats stats() {
        Map<String, RecoveryAttempt> snapshot = Map.copyOf(attempts);
        return new RecoveryStats(snapshot.size(), config.maxAttempts(), config.cooldown(), snapshot);
    }

    private boolean cooldownElapsed(RecoveryAttempt attempt, Instant now) {
        return !now.isBefore(attempt.lastAttemptAt().plus(config.cooldown()));
    }
}
