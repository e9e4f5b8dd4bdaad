package toolgate.support;

import java.time.Duration;

import toolgate.core.config.SessionConfig;

/**
 * Session configuration with the production defaults, adjustable per test.
 */
public class TestSessionConfig implements SessionConfig {

    private Duration ttl = Duration.ofHours(1);
    private Duration deactivationGrace = Duration.ofMinutes(5);
    private Duration reuseWindow = Duration.ofMinutes(5);
    private String provider = "memory";

    public TestSessionConfig withReuseWindow(Duration reuseWindow) {
        this.reuseWindow = reuseWindow;
        return this;
    }

    public TestSessionConfig withProvider(String provider) {
        this.provider = provider;
        return this;
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    @Override
    public Duration deactivationGrace() {
        return deactivationGrace;
    }

    @Override
    public Duration reuseWindow() {
        return reuseWindow;
    }

    @Override
    public String keyPrefix() {
        return "toolgate:";
    }

    @Override
    public StorageConfig storage() {
        return new StorageConfig() {
            @Override
            public String provider() {
                return provider;
            }

            @Override
            public RedisConfig redis() {
                return () -> Duration.ofSeconds(2);
            }

            @Override
            public MemoryConfig memory() {
                return () -> Duration.ofMinutes(1);
            }
        };
    }
}
