package toolgate.core.model.recovery;

import java.time.Instant;

/**
 * Process-local recovery counter for one session id.
 *
 * @param count         attempts recorded since the last reset
 * @param lastAttemptAt time of the most recent admitted attempt
 */
public record RecoveryAttempt(int count, Instant lastAttemptAt) {

    public static RecoveryAttempt first(Instant now) {
        return new RecoveryAttempt(1, now);
    }

    public RecoveryAttempt next(Instant now) {
        return new RecoveryAttempt(count + 1, now);
    }
}
