package toolgate.core.service.tenant;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import toolgate.core.config.SessionConfig;
import toolgate.core.model.identity.UserIdentity;
import toolgate.core.model.session.ApplicationSession;
import toolgate.core.model.session.SessionStats;
import toolgate.core.model.session.StoreOutcome;
import toolgate.core.port.out.SessionBackend;
import toolgate.core.port.out.SessionMetrics;
import toolgate.core.service.session.SessionKeys;
import toolgate.core.service.session.SessionStore;

/**
 * Partitions sessions by caller identity and decides when to reuse them.
 *
 * <p>Each identity hash owns a set of session ids (its user index). Index
 * members can outlive the sessions they name; readers skip and prune them.
 * Session creation and index insertion are separate writes, so a crash in
 * between leaves a session that is reachable only by its id.
 */
@ApplicationScoped
public class MultiTenantSessionService {

    private static final Logger LOG = Logger.getLogger(MultiTenantSessionService.class);
    private static final int CLIENT_ID_HASH_CHARS = 8;
    private static final String UNKNOWN_USER_TYPE = "unknown";

    /** Most recently accessed first, then lexicographically smallest id. */
    static final Comparator<ApplicationSession> REUSE_ORDER = Comparator.<ApplicationSession, Instant>comparing(
                    ApplicationSession::lastAccessed, Comparator.reverseOrder())
            .thenComparing(ApplicationSession::sessionId);

    private final SessionStore store;
    private final SessionBackend backend;
    private final SessionConfig config;
    private final SessionMetrics metrics;
    private final Clock clock;
    private final SessionKeys keys;

    @Inject
    public MultiTenantSessionService(
            SessionStore store, SessionBackend backend, SessionConfig config, SessionMetrics metrics, Clock clock) {
        this.store = store;
        this.backend = backend;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        this.keys = new SessionKeys(config.keyPrefix());
    }

    /**
     * Return the caller's session for the given id, a recently used session of
     * the same caller, or a new session.
     *
     * <ol>
     *   <li>An active session stored under {@code (sessionId, identity)} is refreshed and returned.</li>
     *   <li>Otherwise the caller's most recently accessed active session is returned if it was
     *       used within {@code toolgate.session.reuse-window}.</li>
     *   <li>Otherwise a new session is created under {@code (sessionId, identity)} and indexed.</li>
     * </ol>
     *
     * <p>Every branch refreshes the session and the index TTL. The returned
     * session's id may differ from {@code sessionId} when step 2 applies.
     *
     * @param requestPayload entries merged into the session payload
     */
    public Uni<ApplicationSession> findOrCreate(
            String sessionId, UserIdentity identity, Map<String, Object> requestPayload) {
        String identityHash = identity.identityHash();
        return store.getScoped(identityHash, sessionId).flatMap(existing -> {
            if (existing.isPresent() && existing.get().active()) {
                metrics.recordSessionReused("exact");
                return touch(existing.get(), requestPayload);
            }
            return activeSessions(identityHash).flatMap(candidates -> {
                Instant now = clock.instant();
                Optional<ApplicationSession> recent = candidates.stream()
                        .sorted(REUSE_ORDER)
                        .findFirst()
                        .filter(candidate -> withinReuseWindow(candidate, now));
                if (recent.isPresent()) {
                    LOG.debugf(
                            "Reusing session %s for %s instead of %s",
                            recent.get().sessionId(), identity.userId(), sessionId);
                    metrics.recordSessionReused("window");
                    return touch(recent.get(), requestPayload);
                }
                return create(sessionId, identity, requestPayload, now);
            });
        });
    }

    /**
     * Read a session in the caller's scope without refreshing it.
     */
    public Uni<Optional<ApplicationSession>> getUserSession(String sessionId, UserIdentity identity) {
        return store.getScoped(identity.identityHash(), sessionId);
    }

    /**
     * Active sessions indexed under the caller's identity.
     */
    public Uni<List<ApplicationSession>> getActiveSessions(UserIdentity identity) {
        return activeSessions(identity.identityHash());
    }

    /**
     * Soft-delete a caller's session and drop it from the caller's index.
     */
    public Uni<StoreOutcome> deactivate(String sessionId, UserIdentity identity) {
        String identityHash = identity.identityHash();
        return store.deactivateScoped(identityHash, sessionId).call(outcome -> {
            if (outcome == StoreOutcome.UPDATED) {
                metrics.recordSessionDeactivated();
            }
            return backend.removeFromSet(keys.userIndex(identityHash), sessionId);
        });
    }

    /**
     * Counts over every stored application session and user index.
     */
    public Uni<SessionStats> stats() {
        return store.listAll().flatMap(sessions -> backend.keys(keys.userIndexNamespace())
                .map(indexes -> {
                    Map<String, Long> distribution = sessions.stream()
                            .filter(ApplicationSession::active)
                            .collect(Collectors.groupingBy(
                                    session -> session.userType() != null
                                            ? session.userType().wireName()
                                            : UNKNOWN_USER_TYPE,
                                    TreeMap::new,
                                    Collectors.counting()));
                    long active = sessions.stream()
                            .filter(ApplicationSession::active)
                            .count();
                    return new SessionStats(sessions.size(), active, indexes.size(), distribution);
                }));
    }

    private Uni<ApplicationSession> create(
            String sessionId, UserIdentity identity, Map<String, Object> requestPayload, Instant now) {
        String identityHash = identity.identityHash();
        String clientId = "mcp_client_" + identity.userType().wireName() + "_"
                + identityHash.substring(0, CLIENT_ID_HASH_CHARS);
        var session = ApplicationSession.owned(sessionId, identity, clientId, requestPayload, now);
        return store.saveScoped(session)
                .call(() -> backend.addToSet(keys.userIndex(identityHash), sessionId))
                .call(() -> refreshIndex(identityHash))
                .invoke(() -> {
                    metrics.recordSessionCreated("identity");
                    LOG.infof(
                            "Created session %s for %s user %s",
                            sessionId, identity.userType().wireName(), identity.userId());
                });
    }

    private Uni<ApplicationSession> touch(ApplicationSession session, Map<String, Object> requestPayload) {
        return store.saveScoped(session.withAccess(clock.instant(), requestPayload))
                .call(() -> refreshIndex(session.scope()));
    }

    private Uni<Boolean> refreshIndex(String identityHash) {
        return backend.expire(keys.userIndex(identityHash), config.ttl());
    }

    private Uni<List<ApplicationSession>> activeSessions(String identityHash) {
        String indexKey = keys.userIndex(identityHash);
        return backend.members(indexKey).flatMap(ids -> {
            if (ids.isEmpty()) {
                return Uni.createFrom().item(List.<ApplicationSession>of());
            }
            List<String> orderedIds = ids.stream().sorted().toList();
            List<Uni<Optional<ApplicationSession>>> reads = orderedIds.stream()
                    .map(id -> store.getScoped(identityHash, id))
                    .toList();
            return Uni.join().all(reads).andFailFast().map(results -> {
                List<ApplicationSession> active = new ArrayList<>();
                for (int i = 0; i < results.size(); i++) {
                    Optional<ApplicationSession> result = results.get(i);
                    if (result.isEmpty()) {
                        pruneDangling(indexKey, orderedIds.get(i));
                    } else if (result.get().active()) {
                        active.add(result.get());
                    }
                }
                return active;
            });
        });
    }

    private void pruneDangling(String indexKey, String sessionId) {
        backend.removeFromSet(indexKey, sessionId)
                .subscribe()
                .with(
                        ignored -> LOG.debugf("Pruned expired session %s from user index", sessionId),
                        error -> LOG.warnf(
                                "Failed to prune session %s from user index: %s", sessionId, error.getMessage()));
    }

    private boolean withinReuseWindow(ApplicationSession session, Instant now) {
        return Duration.between(session.lastAccessed(), now).compareTo(config.reuseWindow()) <= 0;
    }

    /**
     * Ids in the given identity's index, dangling members included.
     */
    public Uni<Set<String>> indexedSessionIds(UserIdentity identity) {
        return backend.members(keys.userIndex(identity.identityHash()));
    }
}
