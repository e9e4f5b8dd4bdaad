package toolgate.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for session storage and lifetimes.
 *
 * <p>Configuration prefix: {@code toolgate.session}
 */
@ConfigMapping(prefix = "toolgate.session")
public interface SessionConfig {

    /**
     * Sliding TTL applied on every write.
     *
     * @return session TTL (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration ttl();

    /**
     * Residual TTL of a soft-deleted session.
     *
     * @return grace TTL (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration deactivationGrace();

    /**
     * How recently a caller's session must have been used for find-or-create to
     * hand it back instead of creating a new one.
     *
     * @return reuse window (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration reuseWindow();

    /**
     * Prefix prepended to every backend key.
     */
    @WithDefault("toolgate:")
    String keyPrefix();

    StorageConfig storage();

    interface StorageConfig {

        /**
         * Backend provider name ({@code redis} or {@code memory}).
         *
         * @return provider name (default: redis)
         */
        @WithDefault("redis")
        String provider();

        RedisConfig redis();

        MemoryConfig memory();
    }

    interface RedisConfig {

        /**
         * Upper bound for a single Redis command.
         *
         * @return operation timeout (default: 2 seconds)
         */
        @WithDefault("PT2S")
        Duration timeout();
    }

    interface MemoryConfig {

        /**
         * How often expired in-memory entries are purged.
         *
         * @return cleanup interval (default: 1 minute)
         */
        @WithDefault("PT1M")
        Duration cleanupInterval();
    }
}
