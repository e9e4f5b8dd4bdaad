package toolgate.core.service.tool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import toolgate.adapter.out.storage.memory.InMemorySessionBackend;
import toolgate.adapter.out.tool.CalculatorToolHandler;
import toolgate.adapter.out.transport.StreamableHttpTransportFactory;
import toolgate.core.model.identity.RequestMetadata;
import toolgate.core.model.identity.UserType;
import toolgate.core.model.tool.ToolErrorKind;
import toolgate.core.model.tool.ToolResult;
import toolgate.core.model.transport.TransportState;
import toolgate.core.port.out.SessionMetrics;
import toolgate.core.port.out.ToolHandler;
import toolgate.core.service.identity.IdentityResolver;
import toolgate.core.service.recovery.RecoveryAttemptTracker;
import toolgate.core.service.recovery.RecoveryOrchestrator;
import toolgate.core.service.session.SessionIdGenerator;
import toolgate.core.service.session.SessionStore;
import toolgate.core.service.tenant.MultiTenantSessionService;
import toolgate.core.service.transport.TransportRegistry;
import toolgate.support.MutableClock;
import toolgate.support.TestRecoveryConfig;
import toolgate.support.TestSessionConfig;

@DisplayName("ToolGatewayService")
class ToolGatewayServiceTest {

    private static final RequestMetadata CALLER = new RequestMetadata("ApiKey key-1", null, "client/1.0", "10.0.0.1");

    private MutableClock clock;
    private MultiTenantSessionService tenantSessions;
    private TransportRegistry registry;
    private ToolGatewayService gateway;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        var backend = new InMemorySessionBackend(clock);
        var config = new TestSessionConfig();
        var store = new SessionStore(backend, config, clock);
        var metrics = mock(SessionMetrics.class);
        tenantSessions = new MultiTenantSessionService(store, backend, config, metrics, clock);
        registry = new TransportRegistry(store, clock);
        var orchestrator = new RecoveryOrchestrator(
                new RecoveryAttemptTracker(TestRecoveryConfig.defaults(), clock),
                registry,
                store,
                new StreamableHttpTransportFactory(clock),
                () -> "toolgate-tools",
                metrics,
                clock);
        ToolHandler failing = new ToolHandler() {
            @Override
            public Set<String> verbs() {
                return Set.of("explode");
            }

            @Override
            public ToolResult invoke(String verb, Map<String, Object> arguments) {
                throw new IllegalStateException("handler bug");
            }
        };
        gateway = new ToolGatewayService(
                new IdentityResolver(),
                tenantSessions,
                registry,
                orchestrator,
                new SessionIdGenerator(),
                new ToolCatalog(List.of(new CalculatorToolHandler(), failing)));
    }

    @Nested
    @DisplayName("dispatch")
    class DispatchTests {

        @Test
        @DisplayName("should run the tool in a new session with a live transport")
        void shouldRunToolInNewSession() {
            var invocation = gateway.invoke(null, CALLER, "calculator_add", Map.of("a", 2, "b", 3))
                    .await()
                    .indefinitely();

            assertEquals(5.0, invocation.result().value());
            assertEquals(UserType.SERVICE_ACCOUNT, invocation.userType());
            assertTrue(invocation.sessionId().matches("[0-9a-f]{32}"));
            var resolution = registry.resolve(invocation.sessionId()).await().indefinitely();
            assertEquals(TransportState.LIVE, resolution.state());
            assertEquals(1, resolution.handle().exchangeCount());
        }

        @Test
        @DisplayName("should keep using the requested session")
        void shouldReuseRequestedSession() {
            var first = gateway.invoke("s1", CALLER, "calculator_add", Map.of("a", 1, "b", 1))
                    .await()
                    .indefinitely();

            var second = gateway.invoke("s1", CALLER, "calculator_multiply", Map.of("a", 2, "b", 2))
                    .await()
                    .indefinitely();

            assertEquals("s1", first.sessionId());
            assertEquals("s1", second.sessionId());
            assertEquals(2, registry.resolve("s1").await().indefinitely().handle().exchangeCount());
            assertEquals(1, registry.localHandleCount());
        }

        @Test
        @DisplayName("should record the last tool in the session payload")
        void shouldRecordLastTool() {
            gateway.invoke("s1", CALLER, "calculator_add", Map.of("a", 1, "b", 1))
                    .await()
                    .indefinitely();

            var identity = new IdentityResolver().resolve(CALLER);
            var session = tenantSessions.getUserSession("s1", identity).await().indefinitely().orElseThrow();
            assertEquals("calculator_add", session.payload().get("last_tool"));
        }

        @Test
        @DisplayName("should return tool errors as results")
        void shouldReturnToolErrors() {
            var invocation = gateway.invoke("s1", CALLER, "calculator_divide", Map.of("a", 1, "b", 0))
                    .await()
                    .indefinitely();

            assertEquals(ToolErrorKind.INVALID_ARGUMENTS, invocation.result().errorKind());
        }

        @Test
        @DisplayName("should turn a handler exception into an execution failure")
        void shouldContainHandlerExceptions() {
            var invocation = gateway.invoke("s1", CALLER, "explode", Map.of()).await().indefinitely();

            assertEquals(ToolErrorKind.EXECUTION_FAILED, invocation.result().errorKind());
            assertNotNull(invocation.result().message());
        }
    }

    @Test
    @DisplayName("should reject unknown tools without creating a session")
    void shouldRejectUnknownTool() {
        var invocation = gateway.invoke("s1", CALLER, "nope", Map.of()).await().indefinitely();

        assertEquals(ToolErrorKind.UNKNOWN_TOOL, invocation.result().errorKind());
        var identity = new IdentityResolver().resolve(CALLER);
        assertTrue(tenantSessions.getUserSession("s1", identity).await().indefinitely().isEmpty());
        assertEquals(0, registry.localHandleCount());
    }

    @Test
    @DisplayName("should recover a detached transport")
    void shouldRecoverDetachedTransport() {
        var first = gateway.invoke("s1", CALLER, "calculator_add", Map.of("a", 1, "b", 1))
                .await()
                .indefinitely();
        registry.resolve("s1").await().indefinitely().handle().close();
        clock.advance(Duration.ofSeconds(10));

        var second = gateway.invoke("s1", CALLER, "calculator_add", Map.of("a", 1, "b", 1))
                .await()
                .indefinitely();

        assertFalse(second.result().isError());
        assertEquals(first.sessionId(), second.sessionId());
        assertEquals(TransportState.LIVE, registry.resolve("s1").await().indefinitely().state());
    }
}
