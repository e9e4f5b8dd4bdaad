package toolgate.core.service.discovery;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import toolgate.core.cache.CaffeineLocalCache;
import toolgate.core.cache.LocalCache;
import toolgate.core.config.DiscoveryConfig;
import toolgate.core.model.identity.UserIdentity;
import toolgate.core.model.transport.TransportState;
import toolgate.core.port.out.SessionMetrics;
import toolgate.core.service.identity.IdentityResolver;
import toolgate.core.service.tenant.MultiTenantSessionService;
import toolgate.core.service.transport.TransportRegistry;

/**
 * Best-effort session discovery from diagnostic log lines.
 *
 * <p>Sessions seen in logs are registered through the same find-or-create and
 * bind paths as live traffic. Nothing depends on discovery for correctness:
 * {@link #track(String)} never fails, and failures are only logged and counted.
 */
@ApplicationScoped
public class SessionDiscoveryService {

    private static final Logger LOG = Logger.getLogger(SessionDiscoveryService.class);
    private static final int EXCERPT_CHARS = 200;

    private final DiagnosticLineParser parser = new DiagnosticLineParser();
    private final IdentityResolver identityResolver;
    private final MultiTenantSessionService tenantSessions;
    private final TransportRegistry transportRegistry;
    private final DiscoveryConfig config;
    private final SessionMetrics metrics;
    private final LocalCache<String, Boolean> processedSessions;
    private final AtomicLong failures = new AtomicLong();

    @Inject
    public SessionDiscoveryService(
            IdentityResolver identityResolver,
            MultiTenantSessionService tenantSessions,
            TransportRegistry transportRegistry,
            DiscoveryConfig config,
            SessionMetrics metrics) {
        this.identityResolver = identityResolver;
        this.tenantSessions = tenantSessions;
        this.transportRegistry = transportRegistry;
        this.config = config;
        this.metrics = metrics;
        this.processedSessions = new CaffeineLocalCache<>(config.maxTrackedSessions());
    }

    /**
     * Process one diagnostic line.
     *
     * @return what was done with the line; never a failure
     */
    public Uni<DiscoveryResult> track(String line) {
        return Uni.createFrom()
                .deferred(() -> process(line))
                .onFailure()
                .recoverWithItem(error -> {
                    failures.incrementAndGet();
                    LOG.warnf("Session discovery failed: %s", error.getMessage());
                    return DiscoveryResult.FAILED;
                })
                .invoke(result -> metrics.recordDiscovery(result.name()));
    }

    /**
     * Process a line in the background.
     */
    public void observe(String line) {
        track(line).subscribe().with(result -> LOG.tracef("Discovery result: %s", result));
    }

    public long failureCount() {
        return failures.get();
    }

    public long trackedSessionCount() {
        return processedSessions.estimatedSize();
    }

    private Uni<DiscoveryResult> process(String line) {
        if (!parser.mentionsSession(line)) {
            return Uni.createFrom().item(DiscoveryResult.IGNORED);
        }
        Optional<String> found = parser.extractSessionId(line);
        if (found.isEmpty()) {
            return Uni.createFrom().item(DiscoveryResult.NO_SESSION_ID);
        }
        String sessionId = found.get();
        if (processedSessions.contains(sessionId)) {
            return Uni.createFrom().item(DiscoveryResult.DUPLICATE);
        }
        UserIdentity identity = identityResolver.resolve(parser.extractRequestMetadata(line));
        return tenantSessions
                .findOrCreate(sessionId, identity, discoveryPayload(sessionId, line))
                .flatMap(session -> transportRegistry.resolve(sessionId))
                .flatMap(resolution -> resolution.state() == TransportState.UNKNOWN
                        ? transportRegistry.bind(sessionId, null, config.serverName())
                        : Uni.createFrom().voidItem())
                .map(ignored -> {
                    if (!processedSessions.putIfAbsent(sessionId, Boolean.TRUE)) {
                        return DiscoveryResult.DUPLICATE;
                    }
                    LOG.infof("Discovered session %s for %s user", sessionId, identity.userType().wireName());
                    return DiscoveryResult.TRACKED;
                });
    }

    private static Map<String, Object> discoveryPayload(String sessionId, String line) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", "log_tracker");
        payload.put("detected_from", "diagnostic_log");
        payload.put("log_excerpt", line.length() > EXCERPT_CHARS ? line.substring(0, EXCERPT_CHARS) : line);
        payload.put("original_session_id", sessionId);
        return payload;
    }
}
