package toolgate.core.model.session;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable record that a transport exists for a session.
 *
 * <p>The transport object itself is process-local; this record only mirrors
 * its existence so other processes (and this one after a restart) can tell a
 * detached session from one that was never registered.
 */
public record TransportSession(
        String sessionId,
        String transportKind,
        String serverName,
        Instant createdAt,
        Instant lastAccessed,
        boolean active) {

    public static final String EXISTENCE_ONLY = "EXISTENCE_ONLY";

    public TransportSession {
        Objects.requireNonNull(sessionId, "sessionId cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        if (transportKind == null) {
            transportKind = EXISTENCE_ONLY;
        }
        if (lastAccessed == null) {
            lastAccessed = createdAt;
        }
    }

    public TransportSession withLastAccessed(Instant now) {
        return new TransportSession(sessionId, transportKind, serverName, createdAt, now, active);
    }
}
