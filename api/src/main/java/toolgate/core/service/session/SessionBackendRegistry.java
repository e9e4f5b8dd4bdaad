package toolgate.core.service.session;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import toolgate.core.config.SessionConfig;
import toolgate.core.port.out.SessionBackend;
import toolgate.spi.SessionBackendProvider;
import toolgate.spi.StorageProviderException;

/**
 * Registry for session backend providers.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (toolgate.session.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
@ApplicationScoped
public class SessionBackendRegistry {

    private static final Logger LOG = Logger.getLogger(SessionBackendRegistry.class);
    private static final String MEMORY_PROVIDER = "memory";

    private final Instance<SessionBackendProvider> providers;
    private final SessionConfig config;

    private SessionBackendProvider selectedProvider;
    private SessionBackend backend;

    @Inject
    public SessionBackendRegistry(Instance<SessionBackendProvider> providers, SessionConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Select the provider during startup, on a worker thread, so the Redis
     * availability wait never runs on the event loop.
     */
    void onStart(@Observes StartupEvent event) {
        getSelectedProvider();
        LOG.infof("Session backend provider initialized: %s", selectedProvider.name());
    }

    public synchronized SessionBackend getBackend() {
        if (backend == null) {
            backend = getSelectedProvider().createBackend();
        }
        return backend;
    }

    public synchronized SessionBackendProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private SessionBackendProvider selectProvider() {
        String configuredProvider = config.storage().provider();
        List<SessionBackendProvider> availableProviders = getAvailableProviders().stream()
                .sorted(Comparator.comparingInt(SessionBackendProvider::priority)
                        .reversed())
                .toList();

        LOG.debugf(
                "Available session backend providers: %s",
                availableProviders.stream().map(SessionBackendProvider::name).toList());

        Optional<SessionBackendProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();

        if (configured.isPresent()) {
            LOG.infof("Using configured session backend provider: %s", configuredProvider);
            return configured.get();
        }

        if (!MEMORY_PROVIDER.equals(configuredProvider)) {
            LOG.warnf("Configured session backend provider '%s' is not available, falling back", configuredProvider);
        }

        if (!availableProviders.isEmpty()) {
            SessionBackendProvider provider = availableProviders.get(0);
            LOG.infof("Using session backend provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new StorageProviderException("No session backend providers available");
    }

    /**
     * Providers that can currently be used, for health checks.
     */
    public List<SessionBackendProvider> getAvailableProviders() {
        return providers.stream().filter(SessionBackendProvider::isAvailable).toList();
    }
}
