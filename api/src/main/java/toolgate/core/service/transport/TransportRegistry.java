package toolgate.core.service.transport;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import toolgate.core.model.session.StoreOutcome;
import toolgate.core.model.session.TransportSession;
import toolgate.core.model.transport.TransportHandle;
import toolgate.core.model.transport.TransportResolution;
import toolgate.core.service.session.SessionStore;

/**
 * Tracks which in-process transport serves each session.
 *
 * <p>Two tiers: the durable existence record in the {@link SessionStore}, shared
 * by every process, and the local handle map, private to this one. A session
 * with a record but no local handle is detached and needs a new transport.
 */
@ApplicationScoped
public class TransportRegistry {

    private static final Logger LOG = Logger.getLogger(TransportRegistry.class);

    private final SessionStore store;
    private final Clock clock;
    private final ConcurrentMap<String, TransportHandle> handles = new ConcurrentHashMap<>();

    @Inject
    public TransportRegistry(SessionStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Record that a transport serves the session.
     *
     * <p>The existence record is written first; the local handle is only
     * registered once that write succeeds. A {@code null} handle registers
     * existence only. A handle that replaces a different one closes the old one.
     */
    public Uni<Void> bind(String sessionId, TransportHandle handle, String serverName) {
        TransportHandle current = handle != null ? handle : handles.get(sessionId);
        Instant now = clock.instant();
        var record = new TransportSession(
                sessionId,
                current != null ? current.kind() : TransportSession.EXISTENCE_ONLY,
                serverName,
                now,
                now,
                true);
        return store.saveTransport(record).invoke(() -> {
            if (handle == null) {
                LOG.debugf("Registered transport existence for session %s (%s)", sessionId, serverName);
                return;
            }
            TransportHandle previous = handles.put(sessionId, handle);
            if (previous != null && previous != handle) {
                previous.close();
            }
            LOG.infof("Bound %s transport to session %s", handle.kind(), sessionId);
        });
    }

    /**
     * Classify the session's transport as unknown, detached or live.
     *
     * <p>A live hit refreshes the existence record in the background.
     */
    public Uni<TransportResolution> resolve(String sessionId) {
        TransportHandle handle = handles.get(sessionId);
        if (handle != null && handle.isOpen()) {
            touchInBackground(sessionId);
            return Uni.createFrom().item(TransportResolution.live(handle));
        }
        if (handle != null) {
            handles.remove(sessionId, handle);
        }
        return store.getTransport(sessionId).map(record -> record.filter(TransportSession::active)
                .map(TransportResolution::detached)
                .orElseGet(() -> TransportResolution.unknown(sessionId)));
    }

    /**
     * Drop the local handle (closing it) and the existence record.
     *
     * @return true if either tier held the session
     */
    public Uni<Boolean> unbind(String sessionId) {
        TransportHandle local = handles.remove(sessionId);
        if (local != null) {
            local.close();
        }
        return store.deleteTransport(sessionId).map(outcome -> {
            boolean removed = outcome == StoreOutcome.DELETED || local != null;
            if (removed) {
                LOG.infof("Unbound transport from session %s", sessionId);
            }
            return removed;
        });
    }

    /**
     * Refresh the existence record's access time and TTL.
     */
    public Uni<StoreOutcome> touch(String sessionId) {
        return store.touchTransport(sessionId);
    }

    public Uni<Set<String>> listTransports() {
        return store.listTransports();
    }

    public int localHandleCount() {
        return handles.size();
    }

    private void touchInBackground(String sessionId) {
        touch(sessionId)
                .subscribe()
                .with(
                        outcome -> {
                            if (outcome == StoreOutcome.ABSENT) {
                                LOG.debugf("Live transport for session %s has no existence record", sessionId);
                            }
                        },
                        error -> LOG.warnf(
                                "Failed to refresh transport record for session %s: %s",
                                sessionId, error.getMessage()));
    }
}
