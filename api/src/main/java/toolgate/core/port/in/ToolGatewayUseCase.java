package toolgate.core.port.in;

import java.util.Map;

import io.smallrye.mutiny.Uni;

import toolgate.core.model.identity.RequestMetadata;
import toolgate.core.model.tool.ToolInvocation;

/**
 * Use case for invoking a tool within a caller's session.
 */
public interface ToolGatewayUseCase {

    /**
     * Resolve the caller, find or create their session, make sure a live
     * transport serves it, then run the tool.
     *
     * @param requestedSessionId session id presented by the caller, may be null
     * @param metadata           raw request metadata
     * @param verb               tool to invoke
     * @param arguments          tool arguments
     * @return the invocation, or a failure when the session could not be served
     */
    Uni<ToolInvocation> invoke(
            String requestedSessionId, RequestMetadata metadata, String verb, Map<String, Object> arguments);
}
