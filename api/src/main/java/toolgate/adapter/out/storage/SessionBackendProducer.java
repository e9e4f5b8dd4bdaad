package toolgate.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import toolgate.core.port.out.SessionBackend;
import toolgate.core.service.session.SessionBackendRegistry;

/**
 * Exposes the backend chosen by {@link SessionBackendRegistry} as an injectable bean.
 */
@ApplicationScoped
public class SessionBackendProducer {

    private final SessionBackendRegistry registry;

    @Inject
    public SessionBackendProducer(SessionBackendRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public SessionBackend sessionBackend() {
        return registry.getBackend();
    }
}
