package toolgate.support;

import java.util.List;

import toolgate.core.config.DiscoveryConfig;

public record TestDiscoveryConfig(boolean enabled, List<String> loggers, int maxTrackedSessions)
        implements DiscoveryConfig {

    public static TestDiscoveryConfig enabledFor(String... loggers) {
        return new TestDiscoveryConfig(true, List.of(loggers), 100);
    }

    @Override
    public String serverName() {
        return "LOG_TRACKED";
    }
}
