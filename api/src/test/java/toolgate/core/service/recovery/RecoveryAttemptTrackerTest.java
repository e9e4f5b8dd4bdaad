package toolgate.core.service.recovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import toolgate.core.model.recovery.RecoveryExhaustedException;
import toolgate.support.MutableClock;
import toolgate.support.TestRecoveryConfig;

@DisplayName("RecoveryAttemptTracker")
class RecoveryAttemptTrackerTest {

    private MutableClock clock;
    private RecoveryAttemptTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        tracker = new RecoveryAttemptTracker(TestRecoveryConfig.defaults(), clock);
    }

    @Test
    @DisplayName("should admit attempts up to the budget")
    void shouldAdmitUpToBudget() {
        assertEquals(1, tracker.admit("s1").count());
        assertEquals(2, tracker.admit("s1").count());
        assertEquals(3, tracker.admit("s1").count());
    }

    @Test
    @DisplayName("should reject attempts over the budget with the remaining cooldown")
    void shouldRejectOverBudget() {
        tracker.admit("s1");
        tracker.admit("s1");
        clock.advance(Duration.ofMinutes(1));
        tracker.admit("s1");
        clock.advance(Duration.ofMinutes(2));

        var error = assertThrows(RecoveryExhaustedException.class, () -> tracker.admit("s1"));

        assertEquals("s1", error.getSessionId());
        assertEquals(3, error.getAttempts());
        assertEquals(Duration.ofMinutes(3), error.getRetryAfter());
    }

    @Test
    @DisplayName("rejected attempts should not extend the cooldown")
    void rejectedAttemptsShouldNotExtendCooldown() {
        tracker.admit("s1");
        tracker.admit("s1");
        tracker.admit("s1");
        clock.advance(Duration.ofMinutes(4));
        assertThrows(RecoveryExhaustedException.class, () -> tracker.admit("s1"));
        clock.advance(Duration.ofMinutes(1));

        assertEquals(1, tracker.admit("s1").count());
    }

    @Test
    @DisplayName("should keep budgets per session")
    void shouldKeepBudgetsPerSession() {
        tracker.admit("s1");
        tracker.admit("s1");
        tracker.admit("s1");

        assertEquals(1, tracker.admit("s2").count());
    }

    @Test
    @DisplayName("reset should restore the full budget")
    void resetShouldRestoreBudget() {
        tracker.admit("s1");
        tracker.admit("s1");
        tracker.admit("s1");

        tracker.reset("s1");

        assertEquals(1, tracker.admit("s1").count());
    }

    @Test
    @DisplayName("sweep should drop counters idle for two cooldowns")
    void sweepShouldDropIdleCounters() {
        tracker.admit("old");
        clock.advance(Duration.ofMinutes(6));
        tracker.admit("recent");
        clock.advance(Duration.ofMinutes(4));

        assertEquals(1, tracker.sweep());

        var stats = tracker.stats();
        assertEquals(1, stats.trackedSessions());
        assertEquals(Duration.ofMinutes(5), stats.cooldown());
    }

    @Test
    @DisplayName("stats should count exhausted sessions")
    void statsShouldCountExhausted() {
        tracker.admit("s1");
        tracker.admit("s1");
        tracker.admit("s1");
        tracker.admit("s2");

        var stats = tracker.stats();

        assertEquals(2, stats.trackedSessions());
        assertEquals(1, stats.exhaustedSessions());
        assertEquals(3, stats.maxAttempts());
    }
}
