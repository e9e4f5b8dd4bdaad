package toolgate.core.service.diagnostics;

import java.time.Clock;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import toolgate.core.model.diagnostics.SessionHealthSnapshot;
import toolgate.core.model.recovery.RecoveryStats;
import toolgate.core.model.session.SessionStats;
import toolgate.core.port.out.SessionBackend;
import toolgate.core.service.discovery.SessionDiscoveryService;
import toolgate.core.service.recovery.RecoveryOrchestrator;
import toolgate.core.service.tenant.MultiTenantSessionService;
import toolgate.core.service.transport.TransportRegistry;

/**
 * Builds the read-only health snapshot of the session subsystem.
 *
 * <p>Never fails: an unreachable backend yields a snapshot with zero counts
 * and the error message.
 */
@ApplicationScoped
public class SessionDiagnosticsService {

    private static final Logger LOG = Logger.getLogger(SessionDiagnosticsService.class);

    private final SessionBackend backend;
    private final MultiTenantSessionService tenantSessions;
    private final TransportRegistry transportRegistry;
    private final RecoveryOrchestrator recoveryOrchestrator;
    private final SessionDiscoveryService discoveryService;
    private final Clock clock;

    @Inject
    public SessionDiagnosticsService(
            SessionBackend backend,
            MultiTenantSessionService tenantSessions,
            TransportRegistry transportRegistry,
            RecoveryOrchestrator recoveryOrchestrator,
            SessionDiscoveryService discoveryService,
            Clock clock) {
        this.backend = backend;
        this.tenantSessions = tenantSessions;
        this.transportRegistry = transportRegistry;
        this.recoveryOrchestrator = recoveryOrchestrator;
        this.discoveryService = discoveryService;
        this.clock = clock;
    }

    public Uni<SessionHealthSnapshot> snapshot() {
        return backend.ping()
                .flatMap(reachable -> {
                    if (!reachable) {
                        return Uni.createFrom().item(unreachable("backend did not answer ping"));
                    }
                    return tenantSessions
                            .stats()
                            .flatMap(stats -> transportRegistry
                                    .listTransports()
                                    .map(transports -> reachable(stats, transports.size())));
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Session diagnostics degraded: %s", error.getMessage());
                    return unreachable(error.getMessage());
                });
    }

    private SessionHealthSnapshot reachable(SessionStats stats, int transportSessions) {
        RecoveryStats recovery = recoveryOrchestrator.stats();
        return new SessionHealthSnapshot(
                clock.instant(),
                backend.name(),
                true,
                null,
                stats.totalSessions(),
                stats.activeSessions(),
                transportSessions,
                stats.userIndexes(),
                transportRegistry.localHandleCount(),
                stats.userTypeDistribution(),
                recovery.trackedSessions(),
                recovery.exhaustedSessions(),
                discoveryService.failureCount());
    }

    private SessionHealthSnapshot unreachable(String error) {
        RecoveryStats recovery = recoveryOrchestrator.stats();
        return new SessionHealthSnapshot(
                clock.instant(),
                backend.name(),
                false,
                error,
                0,
                0,
                0,
                0,
                transportRegistry.localHandleCount(),
                Map.of(),
                recovery.trackedSessions(),
                recovery.exhaustedSessions(),
                discoveryService.failureCount());
    }
}
