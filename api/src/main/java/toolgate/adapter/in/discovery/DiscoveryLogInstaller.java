package toolgate.adapter.in.discovery;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;

import toolgate.core.config.DiscoveryConfig;
import toolgate.core.service.discovery.SessionDiscoveryService;

/**
 * Attaches the {@link DiscoveryLogHandler} to the configured logger categories
 * when {@code toolgate.discovery.enabled} is set.
 */
@ApplicationScoped
public class DiscoveryLogInstaller {

    private static final org.jboss.logging.Logger LOG = org.jboss.logging.Logger.getLogger(DiscoveryLogInstaller.class);

    private final DiscoveryConfig config;
    private final SessionDiscoveryService discoveryService;
    private final List<Logger> attached = new ArrayList<>();
    private DiscoveryLogHandler handler;

    @Inject
    public DiscoveryLogInstaller(DiscoveryConfig config, SessionDiscoveryService discoveryService) {
        this.config = config;
        this.discoveryService = discoveryService;
    }

    void onStart(@Observes StartupEvent event) {
        install();
    }

    void onStop(@Observes ShutdownEvent event) {
        uninstall();
    }

    synchronized void install() {
        if (!config.enabled() || handler != null) {
            return;
        }
        handler = new DiscoveryLogHandler(discoveryService);
        for (String category : config.loggers()) {
            Logger logger = Logger.getLogger(category);
            logger.addHandler(handler);
            attached.add(logger);
        }
        LOG.infof("Passive session discovery attached to %s", config.loggers());
    }

    synchronized void uninstall() {
        if (handler == null) {
            return;
        }
        attached.forEach(logger -> logger.removeHandler(handler));
        attached.clear();
        handler.close();
        handler = null;
    }

    synchronized boolean isInstalled() {
        return handler != null;
    }
}
