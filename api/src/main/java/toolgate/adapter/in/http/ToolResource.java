package toolgate.adapter.in.http;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;

import toolgate.adapter.in.problem.SessionProblem;
import toolgate.core.model.identity.RequestMetadata;
import toolgate.core.model.tool.ToolInvocation;
import toolgate.core.model.tool.ToolResult;
import toolgate.core.port.in.ToolGatewayUseCase;

/**
 * Front door for tool calls.
 *
 * <p>The session id is read from the {@code Mcp-Session-Id} header or the
 * {@code session_id} query parameter. The effective session id is always
 * returned in the {@code Mcp-Session-Id} response header.
 */
@Path("/mcp/tools")
@Produces(MediaType.APPLICATION_JSON)
public class ToolResource {

    static final String SESSION_HEADER = "Mcp-Session-Id";
    static final String AUTH_TOKEN_HEADER = "X-Auth-Token";

    private static final Logger LOG = Logger.getLogger(ToolResource.class);

    @Inject
    ToolGatewayUseCase toolGateway;

    @Inject
    ClientAddressExtractor clientAddressExtractor;

    @Context
    HttpServerRequest request;

    @POST
    @Path("/{verb}")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> invoke(
            @PathParam("verb") String verb,
            @QueryParam("session_id") String sessionIdParam,
            Map<String, Object> arguments) {
        String sessionId = request.getHeader(SESSION_HEADER);
        if (sessionId == null || sessionId.isBlank()) {
            sessionId = sessionIdParam;
        }

        var metadata = new RequestMetadata(
                request.getHeader(HttpHeaders.AUTHORIZATION),
                request.getHeader(AUTH_TOKEN_HEADER),
                request.getHeader(HttpHeaders.USER_AGENT),
                clientAddressExtractor.extract(
                        request::getHeader,
                        request.remoteAddress() != null ? request.remoteAddress().host() : null));

        return toolGateway.invoke(sessionId, metadata, verb, arguments).map(this::toResponse);
    }

    private Response toResponse(ToolInvocation invocation) {
        ToolResult result = invocation.result();
        if (result.isError()) {
            LOG.debugf("Tool %s returned %s: %s", invocation.verb(), result.errorKind(), result.message());
            throw switch (result.errorKind()) {
                case UNKNOWN_TOOL -> SessionProblem.unknownTool(result.message());
                case INVALID_ARGUMENTS -> SessionProblem.badRequest(result.message());
                case EXECUTION_FAILED -> SessionProblem.toolFailed(result.message());
            };
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id", invocation.sessionId());
        body.put("tool", invocation.verb());
        body.put("result", result.value());
        return Response.ok(body).header(SESSION_HEADER, invocation.sessionId()).build();
    }
}
