package toolgate.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import toolgate.core.port.out.SessionBackend;

/**
 * Service provider interface for session backends.
 *
 * <p>Providers are discovered through CDI. Implement this interface and annotate
 * the class {@code @ApplicationScoped} to contribute a backend.
 *
 * <p>Configuration:
 * <pre>{@code
 * toolgate.session.storage.provider=redis
 * }</pre>
 */
public interface SessionBackendProvider {

    /**
     * Provider name used by {@code toolgate.session.storage.provider}.
     */
    String name();

    /**
     * Priority used when the configured provider is unavailable.
     * Built-in priorities: redis 100, memory 0.
     *
     * @return priority (higher = more preferred)
     */
    int priority();

    /**
     * @return true if the backend can be used right now
     */
    boolean isAvailable();

    /**
     * Create the backend. Called once, after selection.
     *
     * @throws StorageProviderException if the backend cannot be created
     */
    SessionBackend createBackend();

    /**
     * Provider-specific health detail, if any.
     */
    Optional<HealthCheckResponse> healthCheck();
}
