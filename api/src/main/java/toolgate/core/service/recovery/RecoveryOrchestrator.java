package toolgate.core.service.recovery;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import toolgate.core.config.ServerConfig;
import toolgate.core.model.recovery.RecoveryAttempt;
import toolgate.core.model.recovery.RecoveryExhaustedException;
import toolgate.core.model.recovery.RecoveryOutcome;
import toolgate.core.model.recovery.RecoveryStage;
import toolgate.core.model.recovery.RecoveryStats;
import toolgate.core.model.recovery.SessionRecoveryException;
import toolgate.core.model.session.ApplicationSession;
import toolgate.core.model.session.StoreOutcome;
import toolgate.core.port.out.SessionMetrics;
import toolgate.core.port.out.TransportFactory;
import toolgate.core.service.session.SessionStore;
import toolgate.core.service.transport.TransportRegistry;

/**
 * Repairs sessions whose transport is not bound in this process.
 *
 * <p>Once admitted by the {@link RecoveryAttemptTracker}, recovery moves
 * forward through at most three stages:
 * <ol>
 *   <li>Resolve: a live transport ends recovery.</li>
 *   <li>Reattach: if the application session exists, a new transport is created and bound.</li>
 *   <li>Rebuild: otherwise a recovered application session is created, then reattached.</li>
 * </ol>
 *
 * <p>Any backend or transport failure after admission fails the call with
 * {@link SessionRecoveryException}; the spent attempt is not refunded.
 */
@ApplicationScoped
public class RecoveryOrchestrator {

    private static final Logger LOG = Logger.getLogger(RecoveryOrchestrator.class);
    private static final int CLIENT_ID_PREFIX_CHARS = 8;

    private final RecoveryAttemptTracker attemptTracker;
    private final TransportRegistry transportRegistry;
    private final SessionStore store;
    private final TransportFactory transportFactory;
    private final ServerConfig serverConfig;
    private final SessionMetrics metrics;
    private final Clock clock;

    @Inject
    public RecoveryOrchestrator(
            RecoveryAttemptTracker attemptTracker,
            TransportRegistry transportRegistry,
            SessionStore store,
            TransportFactory transportFactory,
            ServerConfig serverConfig,
            SessionMetrics metrics,
            Clock clock) {
        this.attemptTracker = attemptTracker;
        this.transportRegistry = transportRegistry;
        this.store = store;
        this.transportFactory = transportFactory;
        this.serverConfig = serverConfig;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Recover the transport of a shared-scope session.
     *
     * @see #recover(String, String)
     */
    public Uni<RecoveryOutcome> recover(String sessionId) {
        return recover(sessionId, ApplicationSession.SHARED_SCOPE);
    }

    /**
     * Recover the session's transport.
     *
     * <p>The application session is looked up in {@code ownerScope} and then in
     * the shared scope; a rebuilt session is always created in the shared scope.
     *
     * @return the outcome, or a failure with {@link RecoveryExhaustedException}
     *     (nothing was touched) or {@link SessionRecoveryException}
     */
    public Uni<RecoveryOutcome> recover(String sessionId, String ownerScope) {
        return Uni.createFrom()
                .item(() -> attemptTracker.admit(sessionId))
                .onFailure(RecoveryExhaustedException.class)
                .invoke(() -> metrics.recordRecovery("exhausted"))
                .flatMap(attempt -> {
                    LOG.infof("Recovering session %s (attempt %d)", sessionId, attempt.count());
                    return runStages(sessionId, ownerScope, attempt)
                            .onFailure()
                            .transform(error -> error instanceof SessionRecoveryException
                                    ? error
                                    : new SessionRecoveryException(sessionId, error))
                            .onFailure()
                            .invoke(error -> {
                                metrics.recordRecovery("failed");
                                LOG.warnf("Recovery of session %s failed: %s", sessionId, error.getMessage());
                            });
                })
                .invoke(outcome -> {
                    metrics.recordRecovery(outcome.stage().name().toLowerCase(Locale.ROOT));
                    LOG.infof("Session %s recovered: %s", sessionId, outcome.stage());
                });
    }

    /**
     * Drop the recovery budget of a session that was explicitly ended.
     */
    public void forget(String sessionId) {
        attemptTracker.reset(sessionId);
    }

    public RecoveryStats stats() {
        return attemptTracker.stats();
    }

    private Uni<RecoveryOutcome> runStages(String sessionId, String ownerScope, RecoveryAttempt attempt) {
        return transportRegistry.resolve(sessionId).flatMap(resolution -> {
            if (resolution.isLive()) {
                return Uni.createFrom()
                        .item(new RecoveryOutcome(
                                sessionId, RecoveryStage.ALREADY_LIVE, resolution.handle(), attempt.count()));
            }
            return applicationSessionExists(sessionId, ownerScope).flatMap(exists -> exists
                    ? reattach(sessionId, RecoveryStage.REATTACHED, attempt)
                    : rebuild(sessionId, attempt));
        });
    }

    private Uni<Boolean> applicationSessionExists(String sessionId, String ownerScope) {
        if (ApplicationSession.SHARED_SCOPE.equals(ownerScope)) {
            return store.get(sessionId).map(Optional::isPresent);
        }
        return store.getScoped(ownerScope, sessionId).flatMap(owned -> owned.isPresent()
                ? Uni.createFrom().item(true)
                : store.get(sessionId).map(Optional::isPresent));
    }

    private Uni<RecoveryOutcome> rebuild(String sessionId, RecoveryAttempt attempt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recovered", true);
        payload.put("recovery_time", clock.instant().toString());
        String clientId =
                "recovered_client_" + sessionId.substring(0, Math.min(CLIENT_ID_PREFIX_CHARS, sessionId.length()));
        return store.create(sessionId, clientId, payload).flatMap(outcome -> {
            if (outcome == StoreOutcome.ALREADY_PRESENT) {
                LOG.debugf("Session %s was created concurrently, reattaching to it", sessionId);
            }
            return reattach(sessionId, RecoveryStage.REBUILT, attempt);
        });
    }

    private Uni<RecoveryOutcome> reattach(String sessionId, RecoveryStage stage, RecoveryAttempt attempt) {
        String serverName = serverConfig.name();
        return transportFactory.create(sessionId, serverName).flatMap(handle -> transportRegistry
                .bind(sessionId, handle, serverName)
                .onFailure()
                .invoke(handle::close)
                .replaceWith(new RecoveryOutcome(sessionId, stage, handle, attempt.count())));
    }
}
