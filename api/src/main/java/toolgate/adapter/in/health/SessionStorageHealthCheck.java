package toolgate.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.health.api.AsyncHealthCheck;
import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import toolgate.core.model.diagnostics.SessionHealthSnapshot;
import toolgate.core.service.diagnostics.SessionDiagnosticsService;
import toolgate.core.service.session.SessionBackendRegistry;

/**
 * Readiness check for the session subsystem.
 *
 * <p>DOWN when the session backend cannot be reached or its provider reports
 * itself down; the counts are informational.
 */
@Readiness
@ApplicationScoped
public class SessionStorageHealthCheck implements AsyncHealthCheck {

    private final SessionDiagnosticsService diagnostics;
    private final SessionBackendRegistry backendRegistry;

    @Inject
    public SessionStorageHealthCheck(SessionDiagnosticsService diagnostics, SessionBackendRegistry backendRegistry) {
        this.diagnostics = diagnostics;
        this.backendRegistry = backendRegistry;
    }

    @Override
    public Uni<HealthCheckResponse> call() {
        return diagnostics.snapshot().map(snapshot -> toResponse(
                snapshot, backendRegistry.getSelectedProvider().healthCheck().orElse(null)));
    }

    static HealthCheckResponse toResponse(SessionHealthSnapshot snapshot, HealthCheckResponse providerHealth) {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("session-storage");
        builder.withData("backend", snapshot.backend());
        builder.withData("backend.reachable", snapshot.backendReachable());
        if (snapshot.backendError() != null) {
            builder.withData("backend.error", snapshot.backendError());
        }
        builder.withData("sessions.total", snapshot.applicationSessions());
        builder.withData("sessions.active", snapshot.activeApplicationSessions());
        builder.withData("transports.total", snapshot.transportSessions());
        builder.withData("transports.local", snapshot.localTransportHandles());
        builder.withData("user_indexes", snapshot.userIndexes());
        snapshot.userTypeDistribution().forEach((type, count) -> builder.withData("sessions.user_type." + type, count));
        builder.withData("recovery.tracked", snapshot.trackedRecoveries());
        builder.withData("recovery.exhausted", snapshot.exhaustedRecoveries());
        builder.withData("discovery.failures", snapshot.discoveryFailures());

        boolean providerUp = true;
        if (providerHealth != null) {
            builder.withData("provider", providerHealth.getName());
            providerHealth.getData().ifPresent(data -> data.forEach(
                    (key, value) -> builder.withData("provider." + key, String.valueOf(value))));
            providerUp = providerHealth.getStatus() == HealthCheckResponse.Status.UP;
        }

        return snapshot.backendReachable() && providerUp ? builder.up().build() : builder.down().build();
    }
}
