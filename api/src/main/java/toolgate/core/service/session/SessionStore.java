package toolgate.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import toolgate.core.config.SessionConfig;
import toolgate.core.model.session.ApplicationSession;
import toolgate.core.model.session.StoreOutcome;
import toolgate.core.model.session.TransportSession;
import toolgate.core.port.out.SessionBackend;

/**
 * CRUD and TTL operations over application sessions and transport records.
 *
 * <p>Every operation touches a single backend key. Writes refresh the key's TTL
 * to {@code toolgate.session.ttl}, except deactivation, which leaves the record
 * readable for {@code toolgate.session.deactivation-grace}.
 *
 * <p>Unscoped operations address the shared scope. Callers working on behalf of
 * an identity use the {@code *Scoped} variants with the identity hash.
 *
 * <p>Backend failures surface as
 * {@link toolgate.core.model.session.BackendUnavailableException}.
 */
@ApplicationScoped
public class SessionStore {

    private static final Logger LOG = Logger.getLogger(SessionStore.class);

    private final SessionBackend backend;
    private final SessionConfig config;
    private final Clock clock;
    private final SessionKeys keys;
    private final SessionRecordCodec codec = new SessionRecordCodec();

    @Inject
    public SessionStore(SessionBackend backend, SessionConfig config, Clock clock) {
        this.backend = backend;
        this.config = config;
        this.clock = clock;
        this.keys = new SessionKeys(config.keyPrefix());
    }

    /**
     * Create a shared-scope session unless one already exists under the id.
     *
     * @return {@link StoreOutcome#CREATED}, or {@link StoreOutcome#ALREADY_PRESENT}
     *     with the existing record left untouched
     */
    public Uni<StoreOutcome> create(String sessionId, String clientId, Map<String, Object> payload) {
        var session = ApplicationSession.shared(sessionId, clientId, payload, clock.instant());
        return backend.setIfAbsent(keys.session(session.scope(), sessionId), config.ttl(), codec.encode(session))
                .map(stored -> {
                    if (stored) {
                        LOG.infof("Created session %s for client %s", sessionId, clientId);
                        return StoreOutcome.CREATED;
                    }
                    LOG.debugf("Session %s already exists, create ignored", sessionId);
                    return StoreOutcome.ALREADY_PRESENT;
                });
    }

    public Uni<Optional<ApplicationSession>> get(String sessionId) {
        return getScoped(ApplicationSession.SHARED_SCOPE, sessionId);
    }

    public Uni<Optional<ApplicationSession>> getScoped(String scope, String sessionId) {
        String key = keys.session(scope, sessionId);
        return backend.get(key).map(value -> value.flatMap(json -> codec.decodeSession(key, json)));
    }

    /**
     * Merge entries into a shared-scope session's payload and refresh its access time and TTL.
     */
    public Uni<StoreOutcome> update(String sessionId, Map<String, Object> partialPayload) {
        return updateScoped(ApplicationSession.SHARED_SCOPE, sessionId, partialPayload);
    }

    public Uni<StoreOutcome> updateScoped(String scope, String sessionId, Map<String, Object> partialPayload) {
        return getScoped(scope, sessionId).flatMap(existing -> {
            if (existing.isEmpty()) {
                return Uni.createFrom().item(StoreOutcome.ABSENT);
            }
            return saveScoped(existing.get().withAccess(clock.instant(), partialPayload))
                    .replaceWith(StoreOutcome.UPDATED);
        });
    }

    /**
     * Write a session under its own scope, replacing any existing record. Active
     * sessions get the default TTL; inactive ones keep the deactivation grace.
     */
    public Uni<ApplicationSession> saveScoped(ApplicationSession session) {
        Duration ttl = session.active() ? config.ttl() : config.deactivationGrace();
        return backend.setex(keys.session(session.scope(), session.sessionId()), ttl, codec.encode(session))
                .replaceWith(session);
    }

    /**
     * Soft-delete a session: mark it inactive and shorten its TTL to the grace period.
     */
    public Uni<StoreOutcome> deactivateScoped(String scope, String sessionId) {
        return getScoped(scope, sessionId).flatMap(existing -> {
            if (existing.isEmpty()) {
                return Uni.createFrom().item(StoreOutcome.ABSENT);
            }
            var deactivated = existing.get().deactivated(clock.instant());
            return backend.setex(keys.session(scope, sessionId), config.deactivationGrace(), codec.encode(deactivated))
                    .invoke(() -> LOG.infof(
                            "Deactivated session %s, readable for %s", sessionId, config.deactivationGrace()))
                    .replaceWith(StoreOutcome.UPDATED);
        });
    }

    /**
     * Remove a shared-scope session. Deleting an absent id is not an error.
     */
    public Uni<StoreOutcome> delete(String sessionId) {
        return deleteScoped(ApplicationSession.SHARED_SCOPE, sessionId);
    }

    public Uni<StoreOutcome> deleteScoped(String scope, String sessionId) {
        return backend.delete(keys.session(scope, sessionId)).map(removed -> {
            if (removed) {
                LOG.infof("Deleted session %s", sessionId);
                return StoreOutcome.DELETED;
            }
            return StoreOutcome.ABSENT;
        });
    }

    public Uni<StoreOutcome> extend(String sessionId) {
        return extend(sessionId, config.ttl());
    }

    /**
     * Reset a shared-scope session's TTL without changing its content.
     */
    public Uni<StoreOutcome> extend(String sessionId, Duration ttl) {
        return backend.expire(keys.session(ApplicationSession.SHARED_SCOPE, sessionId), ttl)
                .map(extended -> extended ? StoreOutcome.UPDATED : StoreOutcome.ABSENT);
    }

    /**
     * Ids of shared-scope sessions. Best effort: ids may expire before they are read.
     */
    public Uni<Set<String>> list() {
        String prefix = keys.scopePrefix(ApplicationSession.SHARED_SCOPE);
        return backend.keys(prefix).map(found -> stripPrefix(found, prefix));
    }

    /**
     * Every readable application session in every scope. Keys that expire
     * between listing and reading are skipped.
     */
    public Uni<List<ApplicationSession>> listAll() {
        return backend.keys(keys.sessionNamespace()).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(List.<ApplicationSession>of());
            }
            List<Uni<Optional<ApplicationSession>>> reads = found.stream()
                    .map(key -> backend.get(key).map(value -> value.flatMap(json -> codec.decodeSession(key, json))))
                    .toList();
            return Uni.join().all(reads).andFailFast().map(results -> {
                List<ApplicationSession> sessions = new ArrayList<>();
                results.forEach(result -> result.ifPresent(sessions::add));
                return sessions;
            });
        });
    }

    public Uni<Void> saveTransport(TransportSession transport) {
        return backend.setex(keys.transport(transport.sessionId()), config.ttl(), codec.encode(transport));
    }

    public Uni<Optional<TransportSession>> getTransport(String sessionId) {
        String key = keys.transport(sessionId);
        return backend.get(key).map(value -> value.flatMap(json -> codec.decodeTransport(key, json)));
    }

    /**
     * Refresh a transport record's access time and TTL.
     */
    public Uni<StoreOutcome> touchTransport(String sessionId) {
        return getTransport(sessionId).flatMap(existing -> {
            if (existing.isEmpty()) {
                return Uni.createFrom().item(StoreOutcome.ABSENT);
            }
            return saveTransport(existing.get().withLastAccessed(clock.instant()))
                    .replaceWith(StoreOutcome.UPDATED);
        });
    }

    public Uni<StoreOutcome> deleteTransport(String sessionId) {
        return backend.delete(keys.transport(sessionId))
                .map(removed -> removed ? StoreOutcome.DELETED : StoreOutcome.ABSENT);
    }

    public Uni<Set<String>> listTransports() {
        String prefix = keys.transportNamespace();
        return backend.keys(prefix).map(found -> stripPrefix(found, prefix));
    }

    private static Set<String> stripPrefix(List<String> found, String prefix) {
        Set<String> ids = new LinkedHashSet<>();
        for (String key : found) {
            if (key.startsWith(prefix)) {
                ids.add(key.substring(prefix.length()));
            }
        }
        return ids;
    }
}
