package toolgate.core.service.tool;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import toolgate.core.model.identity.RequestMetadata;
import toolgate.core.model.identity.UserIdentity;
import toolgate.core.model.recovery.RecoveryOutcome;
import toolgate.core.model.session.ApplicationSession;
import toolgate.core.model.tool.ToolErrorKind;
import toolgate.core.model.tool.ToolInvocation;
import toolgate.core.model.tool.ToolResult;
import toolgate.core.model.transport.TransportHandle;
import toolgate.core.port.in.ToolGatewayUseCase;
import toolgate.core.port.out.ToolHandler;
import toolgate.core.service.identity.IdentityResolver;
import toolgate.core.service.recovery.RecoveryOrchestrator;
import toolgate.core.service.session.SessionIdGenerator;
import toolgate.core.service.tenant.MultiTenantSessionService;
import toolgate.core.service.transport.TransportRegistry;

/**
 * Runs a tool call inside the caller's session.
 *
 * <p>Flow: resolve identity, find or create the session, make sure a live
 * transport serves it (recovering one if needed), then dispatch to the handler.
 * Unknown verbs are rejected before any session is touched.
 */
@ApplicationScoped
public class ToolGatewayService implements ToolGatewayUseCase {

    private static final Logger LOG = Logger.getLogger(ToolGatewayService.class);

    private final IdentityResolver identityResolver;
    private final MultiTenantSessionService tenantSessions;
    private final TransportRegistry transportRegistry;
    private final RecoveryOrchestrator recoveryOrchestrator;
    private final SessionIdGenerator idGenerator;
    private final ToolCatalog catalog;

    @Inject
    public ToolGatewayService(
            IdentityResolver identityResolver,
            MultiTenantSessionService tenantSessions,
            TransportRegistry transportRegistry,
            RecoveryOrchestrator recoveryOrchestrator,
            SessionIdGenerator idGenerator,
            ToolCatalog catalog) {
        this.identityResolver = identityResolver;
        this.tenantSessions = tenantSessions;
        this.transportRegistry = transportRegistry;
        this.recoveryOrchestrator = recoveryOrchestrator;
        this.idGenerator = idGenerator;
        this.catalog = catalog;
    }

    @Override
    public Uni<ToolInvocation> invoke(
            String requestedSessionId, RequestMetadata metadata, String verb, Map<String, Object> arguments) {
        UserIdentity identity = identityResolver.resolve(metadata);
        ToolHandler handler = catalog.find(verb).orElse(null);
        if (handler == null) {
            return Uni.createFrom()
                    .item(new ToolInvocation(
                            requestedSessionId,
                            identity.userType(),
                            verb,
                            ToolResult.error(ToolErrorKind.UNKNOWN_TOOL, "Unknown tool: " + verb)));
        }

        String sessionId = requestedSessionId == null || requestedSessionId.isBlank()
                ? idGenerator.generate()
                : requestedSessionId.trim();

        return tenantSessions
                .findOrCreate(sessionId, identity, Map.of("last_tool", verb))
                .flatMap(session -> liveTransport(session)
                        .map(transport -> dispatch(session, transport, identity, handler, verb, arguments)));
    }

    private Uni<TransportHandle> liveTransport(ApplicationSession session) {
        return transportRegistry.resolve(session.sessionId()).flatMap(resolution -> {
            if (resolution.isLive()) {
                return Uni.createFrom().item(resolution.handle());
            }
            LOG.debugf("Session %s has %s transport, recovering", session.sessionId(), resolution.state());
            return recoveryOrchestrator
                    .recover(session.sessionId(), session.scope())
                    .map(RecoveryOutcome::handle);
        });
    }

    private ToolInvocation dispatch(
            ApplicationSession session,
            TransportHandle transport,
            UserIdentity identity,
            ToolHandler handler,
            String verb,
            Map<String, Object> arguments) {
        ToolResult result;
        try {
            result = handler.invoke(verb, arguments != null ? arguments : Map.of());
        } catch (RuntimeException e) {
            LOG.warnf(e, "Tool %s failed in session %s", verb, session.sessionId());
            result = ToolResult.error(ToolErrorKind.EXECUTION_FAILED, "Tool execution failed: " + verb);
        }
        transport.recordExchange();
        return new ToolInvocation(session.sessionId(), identity.userType(), verb, result);
    }
}
