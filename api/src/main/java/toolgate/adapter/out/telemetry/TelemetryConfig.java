package toolgate.adapter.out.telemetry;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry features.
 *
 * <p>Example configuration:
 * <pre>{@code
 * toolgate.telemetry.enabled=true
 * toolgate.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "toolgate.telemetry")
public interface TelemetryConfig {

    /**
     * Master toggle. When disabled, all sub-features are disabled regardless of their own settings.
     */
    @WithDefault("true")
    boolean enabled();

    MetricsConfig metrics();

    interface MetricsConfig {

        @WithDefault("true")
        boolean enabled();
    }
}
