package toolgate.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the tool server itself.
 *
 * <p>Configuration prefix: {@code toolgate.server}
 */
@ConfigMapping(prefix = "toolgate.server")
public interface ServerConfig {

    /**
     * Server name recorded on transports created by this process.
     */
    @WithDefault("toolgate-tools")
    String name();
}
