package toolgate.adapter.in.rest;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import toolgate.adapter.in.problem.SessionProblem;
import toolgate.core.model.session.StoreOutcome;
import toolgate.core.model.transport.TransportResolution;
import toolgate.core.service.diagnostics.SessionDiagnosticsService;
import toolgate.core.service.recovery.RecoveryOrchestrator;
import toolgate.core.service.session.SessionStore;
import toolgate.core.service.transport.TransportRegistry;

/**
 * Operator endpoints for shared-scope sessions, transports and recovery state.
 */
@Path("/admin")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class SessionAdminResource {

    private static final Logger LOG = Logger.getLogger(SessionAdminResource.class);

    private final SessionStore store;
    private final TransportRegistry transportRegistry;
    private final RecoveryOrchestrator recoveryOrchestrator;
    private final SessionDiagnosticsService diagnostics;

    public SessionAdminResource(
            SessionStore store,
            TransportRegistry transportRegistry,
            RecoveryOrchestrator recoveryOrchestrator,
            SessionDiagnosticsService diagnostics) {
        this.store = store;
        this.transportRegistry = transportRegistry;
        this.recoveryOrchestrator = recoveryOrchestrator;
        this.diagnostics = diagnostics;
    }

    @GET
    @Path("/sessions")
    public Uni<Response> listSessions() {
        return store.list().map(ids -> Response.ok(Map.of("sessions", ids, "count", ids.size()))
                .build());
    }

    @GET
    @Path("/sessions/{sessionId}")
    public Uni<Response> getSession(@PathParam("sessionId") String sessionId) {
        return store.get(sessionId).map(session -> session.map(s -> Response.ok(s).build())
                .orElseThrow(() -> SessionProblem.sessionNotFound(sessionId)));
    }

    /**
     * Create a shared-scope session.
     *
     * @return 201 when created, 409 when the id is taken
     */
    @POST
    @Path("/sessions")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> createSession(CreateSessionRequest request) {
        if (request == null || request.sessionId() == null || request.sessionId().isBlank()) {
            throw SessionProblem.badRequest("session_id is required");
        }
        String clientId = request.clientId() != null ? request.clientId() : "admin";
        return store.create(request.sessionId(), clientId, request.payload()).map(outcome -> {
            if (outcome == StoreOutcome.ALREADY_PRESENT) {
                throw SessionProblem.conflict("Session '%s' already exists".formatted(request.sessionId()));
            }
            LOG.infof("Operator created session %s", request.sessionId());
            return Response.status(Response.Status.CREATED)
                    .entity(Map.of("session_id", request.sessionId(), "outcome", outcome.name()))
                    .build();
        });
    }

    @PATCH
    @Path("/sessions/{sessionId}")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> updateSession(@PathParam("sessionId") String sessionId, Map<String, Object> payload) {
        return store.update(sessionId, payload != null ? payload : Map.of())
                .map(outcome -> outcomeResponse(sessionId, outcome));
    }

    /**
     * Delete a session and its recovery budget. Deleting an absent session
     * succeeds with outcome {@code ABSENT}.
     */
    @DELETE
    @Path("/sessions/{sessionId}")
    public Uni<Response> deleteSession(@PathParam("sessionId") String sessionId) {
        return store.delete(sessionId)
                .invoke(() -> recoveryOrchestrator.forget(sessionId))
                .map(outcome -> Response.ok(Map.of("session_id", sessionId, "outcome", outcome.name()))
                        .build());
    }

    @POST
    @Path("/sessions/{sessionId}/extend")
    public Uni<Response> extendSession(@PathParam("sessionId") String sessionId, @QueryParam("ttl") String ttl) {
        Uni<StoreOutcome> extended = ttl == null || ttl.isBlank()
                ? store.extend(sessionId)
                : store.extend(sessionId, parseTtl(ttl));
        return extended.map(outcome -> outcomeResponse(sessionId, outcome));
    }

    @GET
    @Path("/transports")
    public Uni<Response> listTransports() {
        return transportRegistry.listTransports().map(ids -> Response.ok(Map.of(
                        "transports", ids,
                        "count", ids.size(),
                        "local_handles", transportRegistry.localHandleCount()))
                .build());
    }

    @GET
    @Path("/transports/{sessionId}")
    public Uni<Response> getTransport(@PathParam("sessionId") String sessionId) {
        return transportRegistry.resolve(sessionId).map(resolution -> Response.ok(describe(resolution))
                .build());
    }

    @DELETE
    @Path("/transports/{sessionId}")
    public Uni<Response> unbindTransport(@PathParam("sessionId") String sessionId) {
        return transportRegistry.unbind(sessionId).map(removed -> {
            if (!removed) {
                throw SessionProblem.transportNotFound(sessionId);
            }
            return Response.noContent().build();
        });
    }

    @GET
    @Path("/recovery")
    public Response recoveryStats() {
        return Response.ok(recoveryOrchestrator.stats()).build();
    }

    @GET
    @Path("/diagnostics")
    public Uni<Response> diagnostics() {
        return diagnostics.snapshot().map(snapshot -> Response.ok(snapshot).build());
    }

    private static Response outcomeResponse(String sessionId, StoreOutcome outcome) {
        if (outcome == StoreOutcome.ABSENT) {
            throw SessionProblem.sessionNotFound(sessionId);
        }
        return Response.ok(Map.of("session_id", sessionId, "outcome", outcome.name()))
                .build();
    }

    private static Map<String, Object> describe(TransportResolution resolution) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id", resolution.sessionId());
        body.put("state", resolution.state().name());
        resolution.liveHandle().ifPresent(handle -> {
            body.put("kind", handle.kind());
            body.put("server_name", handle.serverName());
            body.put("exchanges", handle.exchangeCount());
        });
        resolution.existenceRecord().ifPresent(record -> {
            body.put("kind", record.transportKind());
            body.put("server_name", record.serverName());
            body.put("last_accessed", record.lastAccessed().toString());
        });
        return body;
    }

    private static Duration parseTtl(String ttl) {
        try {
            Duration parsed = Duration.parse(ttl);
            if (parsed.isNegative() || parsed.isZero()) {
                throw SessionProblem.badRequest("ttl must be positive");
            }
            return parsed;
        } catch (DateTimeParseException e) {
            throw SessionProblem.badRequest("ttl must be an ISO-8601 duration such as PT30M");
        }
    }

    /**
     * Request body for operator-created sessions.
     */
    public record CreateSessionRequest(
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("client_id") String clientId,
            Map<String, Object> payload) {}
}
