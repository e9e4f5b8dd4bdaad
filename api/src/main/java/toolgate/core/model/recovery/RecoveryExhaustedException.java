package toolgate.core.model.recovery;

import java.time.Duration;

/**
 * Recovery was refused because the session used up its attempt budget.
 *
 * <p>The caller must start a new session, or wait for {@link #getRetryAfter()}.
 */
public class RecoveryExhaustedException extends RuntimeException {

    private final String sessionId;
    private final int attempts;
    private final Duration retryAfter;

    public RecoveryExhaustedException(String sessionId, int attempts, Duration retryAfter) {
        super("Recovery attempts exhausted for session " + sessionId + " after " + attempts + " attempts");
        this.sessionId = sessionId;
        this.attempts = attempts;
        this.retryAfter = retryAfter;
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
