package toolgate.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import toolgate.core.model.recovery.RecoveryExhaustedException;
import toolgate.core.model.recovery.SessionRecoveryException;
import toolgate.core.model.session.BackendUnavailableException;

/**
 * Maps session subsystem exceptions to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapBackendUnavailable(BackendUnavailableException e) {
        LOG.warnv("Session backend unavailable: {0}", e.getMessage());
        return toResponse(SessionProblem.serviceUnavailable("Session storage is temporarily unavailable"));
    }

    @ServerExceptionMapper
    public Response mapRecoveryExhausted(RecoveryExhaustedException e) {
        LOG.debugv("Recovery exhausted: {0}", e.getMessage());
        var problem = SessionProblem.sessionGone(
                "Session '%s' cannot be recovered; start a new session".formatted(e.getSessionId()));
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .header(HttpHeaders.RETRY_AFTER, Math.max(1, e.getRetryAfter().toSeconds()))
                .entity(problem)
                .build();
    }

    @ServerExceptionMapper
    public Response mapSessionRecoveryFailure(SessionRecoveryException e) {
        LOG.warnv("Session recovery failed: {0}", e.getMessage());
        return toResponse(SessionProblem.serviceUnavailable("Session '%s' could not be recovered, retry later"
                .formatted(e.getSessionId())));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(SessionProblem.badRequest(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
