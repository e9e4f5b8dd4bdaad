package toolgate.core.config;

import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for passive session discovery from diagnostic logs.
 *
 * <p>Configuration prefix: {@code toolgate.discovery}
 */
@ConfigMapping(prefix = "toolgate.discovery")
public interface DiscoveryConfig {

    /**
     * Attach the discovery log handler at startup.
     *
     * @return true if enabled (default: false)
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * Logger categories whose records are scanned.
     */
    @WithDefault("io.quarkus.http.access-log")
    List<String> loggers();

    /**
     * Capacity of the processed session id set. Once full, older ids are
     * evicted and may be processed again.
     */
    @WithDefault("10000")
    int maxTrackedSessions();

    /**
     * Server name recorded on existence-only transport registrations.
     */
    @WithDefault("LOG_TRACKED")
    String serverName();
}
