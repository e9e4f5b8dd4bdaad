package toolgate.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import toolgate.core.config.SessionConfig;
import toolgate.core.port.out.SessionBackend;
import toolgate.spi.SessionBackendProvider;

/**
 * Session backend provider keeping everything in process memory.
 *
 * <p>Always available; used when no other provider is configured or reachable.
 */
@ApplicationScoped
public class InMemorySessionBackendProvider implements SessionBackendProvider {

    private static final Logger LOG = Logger.getLogger(InMemorySessionBackendProvider.class);
    private static final int PRIORITY = 0; // Lowest priority - fallback only

    private final Clock clock;
    private final SessionConfig config;
    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private InMemorySessionBackend backend;

    @Inject
    public InMemorySessionBackendProvider(Clock clock, SessionConfig config) {
        this.clock = clock;
        this.config = config;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized SessionBackend createBackend() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Session storage is in-memory only!");
            LOG.warn("  Sessions are lost on restart and cannot be recovered by other instances.");
            LOG.warn("  Configure toolgate.session.storage.provider=redis for production.");
            LOG.warn("========================================================================");
        }
        if (backend == null) {
            backend = new InMemorySessionBackend(clock, config.storage().memory().cleanupInterval());
        }
        return backend;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("session-backend-memory")
                .up()
                .withData("type", "in-memory")
                .withData("entries", backend != null ? backend.size() : 0)
                .build());
    }

    @PreDestroy
    void shutdown() {
        if (backend != null) {
            backend.shutdown();
        }
    }
}
