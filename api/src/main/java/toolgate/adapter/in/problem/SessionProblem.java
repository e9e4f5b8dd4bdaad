package toolgate.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for session and tool errors.
 */
public final class SessionProblem {

    private SessionProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Not Found Errors ==========

    public static HttpProblem sessionNotFound(String sessionId) {
        return HttpProblem.builder()
                .withTitle("Session Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail("Session '%s' does not exist or has expired".formatted(sessionId))
                .build();
    }

    public static HttpProblem transportNotFound(String sessionId) {
        return HttpProblem.builder()
                .withTitle("Transport Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail("No transport is registered for session '%s'".formatted(sessionId))
                .build();
    }

    public static HttpProblem unknownTool(String detail) {
        return HttpProblem.builder()
                .withTitle("Unknown Tool")
                .withStatus(Status.NOT_FOUND)
                .withDetail(detail)
                .build();
    }

    // ========== Client Errors ==========

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem conflict(String detail) {
        return HttpProblem.builder()
                .withTitle("Conflict")
                .withStatus(Status.CONFLICT)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem sessionGone(String detail) {
        return HttpProblem.builder()
                .withTitle("Session Recovery Exhausted")
                .withStatus(Status.GONE)
                .withDetail(detail)
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem toolFailed(String detail) {
        return HttpProblem.builder()
                .withTitle("Tool Failed")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem serviceUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }
}
