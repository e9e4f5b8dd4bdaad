package toolgate.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import toolgate.core.port.out.SessionMetrics;

/**
 * Micrometer implementation of {@link SessionMetrics}.
 *
 * <p>Records:
 * <ul>
 *   <li>{@code toolgate.session.created} - Sessions created, by scope</li>
 *   <li>{@code toolgate.session.reused} - Sessions handed back by find-or-create, by branch</li>
 *   <li>{@code toolgate.session.deactivated} - Soft-deleted sessions</li>
 *   <li>{@code toolgate.recovery.total} - Recovery calls, by outcome</li>
 *   <li>{@code toolgate.discovery.lines} - Diagnostic lines processed, by result</li>
 *   <li>{@code toolgate.backend.timeouts} / {@code toolgate.backend.failures} - Backend errors, by operation</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerSessionMetrics implements SessionMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerSessionMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordSessionCreated(String scope) {
        increment("toolgate.session.created", "Sessions created", "scope", scope);
    }

    @Override
    public void recordSessionReused(String branch) {
        increment("toolgate.session.reused", "Existing sessions returned by find-or-create", "branch", branch);
    }

    @Override
    public void recordSessionDeactivated() {
        if (!enabled) {
            return;
        }

        Counter.builder("toolgate.session.deactivated")
                .description("Sessions soft-deleted")
                .register(registry)
                .increment();
    }

    @Override
    public void recordRecovery(String outcome) {
        increment("toolgate.recovery.total", "Session recovery calls", "outcome", outcome);
    }

    @Override
    public void recordDiscovery(String result) {
        increment("toolgate.discovery.lines", "Diagnostic lines processed by session discovery", "result", result);
    }

    @Override
    public void recordBackendTimeout(String backend, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("toolgate.backend.timeouts")
                .description("Session backend operations that timed out")
                .tag("backend", nullSafe(backend))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordBackendFailure(String backend, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("toolgate.backend.failures")
                .description("Session backend operations that failed")
                .tag("backend", nullSafe(backend))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    private void increment(String name, String description, String tagKey, String tagValue) {
        if (!enabled) {
            return;
        }

        Counter.builder(name)
                .description(description)
                .tag(tagKey, nullSafe(tagValue).toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
