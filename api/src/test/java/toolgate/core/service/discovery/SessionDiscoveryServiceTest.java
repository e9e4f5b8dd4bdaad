package toolgate.core.service.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import toolgate.adapter.out.storage.memory.InMemorySessionBackend;
import toolgate.adapter.out.transport.StreamableHttpTransport;
import toolgate.core.model.identity.RequestMetadata;
import toolgate.core.model.session.BackendUnavailableException;
import toolgate.core.model.session.TransportSession;
import toolgate.core.model.transport.TransportState;
import toolgate.core.port.out.SessionMetrics;
import toolgate.core.service.identity.IdentityResolver;
import toolgate.core.service.session.SessionStore;
import toolgate.core.service.tenant.MultiTenantSessionService;
import toolgate.core.service.transport.TransportRegistry;
import toolgate.support.MutableClock;
import toolgate.support.TestDiscoveryConfig;
import toolgate.support.TestSessionConfig;

@DisplayName("SessionDiscoveryService")
class SessionDiscoveryServiceTest {

    private static final String SESSION_ID = "0123456789abcdef0123456789abcdef";
    private static final String LINE = "10.1.2.3 - \"POST /messages/?session_id=" + SESSION_ID + " HTTP/1.1\" 202";

    private final IdentityResolver identityResolver = new IdentityResolver();

    private SessionMetrics metrics;
    private MultiTenantSessionService tenantSessions;
    private TransportRegistry registry;
    private SessionDiscoveryService discovery;

    @BeforeEach
    void setUp() {
        var clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        var backend = new InMemorySessionBackend(clock);
        var config = new TestSessionConfig();
        var store = new SessionStore(backend, config, clock);
        metrics = mock(SessionMetrics.class);
        tenantSessions = new MultiTenantSessionService(store, backend, config, metrics, clock);
        registry = new TransportRegistry(store, clock);
        discovery = new SessionDiscoveryService(
                identityResolver, tenantSessions, registry, TestDiscoveryConfig.enabledFor("access"), metrics);
    }

    private DiscoveryResult track(String line) {
        return discovery.track(line).await().indefinitely();
    }

    @Nested
    @DisplayName("filtering")
    class FilteringTests {

        @Test
        @DisplayName("should ignore lines that do not mention sessions")
        void shouldIgnoreUnrelatedLines() {
            assertEquals(DiscoveryResult.IGNORED, track("GET /health 200"));
            verify(metrics).recordDiscovery("IGNORED");
        }

        @Test
        @DisplayName("should report lines without a session id")
        void shouldReportMissingId() {
            assertEquals(DiscoveryResult.NO_SESSION_ID, track("session store warming up"));
        }
    }

    @Nested
    @DisplayName("tracking")
    class TrackingTests {

        @Test
        @DisplayName("should register the session and its transport existence")
        void shouldRegisterSession() {
            assertEquals(DiscoveryResult.TRACKED, track(LINE));

            var identity = identityResolver.resolve(new RequestMetadata(null, null, null, "10.1.2.3"));
            var session = tenantSessions.getUserSession(SESSION_ID, identity).await().indefinitely().orElseThrow();
            assertEquals("log_tracker", session.payload().get("source"));
            assertEquals("diagnostic_log", session.payload().get("detected_from"));
            assertEquals(SESSION_ID, session.payload().get("original_session_id"));
            assertEquals(LINE, session.payload().get("log_excerpt"));

            var resolution = registry.resolve(SESSION_ID).await().indefinitely();
            assertEquals(TransportState.DETACHED, resolution.state());
            assertEquals(TransportSession.EXISTENCE_ONLY, resolution.existenceRecord().orElseThrow().transportKind());
            assertEquals("LOG_TRACKED", resolution.existenceRecord().orElseThrow().serverName());
            assertEquals(1, discovery.trackedSessionCount());
        }

        @Test
        @DisplayName("should skip sessions already processed")
        void shouldSkipDuplicates() {
            track(LINE);

            assertEquals(DiscoveryResult.DUPLICATE, track(LINE));
        }

        @Test
        @DisplayName("should truncate the excerpt")
        void shouldTruncateExcerpt() {
            var longLine = LINE + " " + "x".repeat(500);

            track(longLine);

            var identity = identityResolver.resolve(new RequestMetadata(null, null, null, "10.1.2.3"));
            var excerpt = tenantSessions.getUserSession(SESSION_ID, identity).await().indefinitely()
                    .orElseThrow()
                    .payload()
                    .get("log_excerpt");
            assertEquals(200, ((String) excerpt).length());
        }

        @Test
        @DisplayName("should leave a live transport alone")
        void shouldLeaveLiveTransportAlone() {
            var handle = new StreamableHttpTransport(SESSION_ID, "toolgate-tools", Instant.EPOCH);
            registry.bind(SESSION_ID, handle, "toolgate-tools").await().indefinitely();

            track(LINE);

            assertSame(handle, registry.resolve(SESSION_ID).await().indefinitely().handle());
            assertEquals(
                    StreamableHttpTransport.KIND,
                    registry.resolve(SESSION_ID).await().indefinitely().handle().kind());
        }
    }

    @Test
    @DisplayName("should never fail and count failures")
    void shouldCountFailures() {
        var failingTenants = mock(MultiTenantSessionService.class);
        when(failingTenants.findOrCreate(anyString(), any(), any()))
                .thenReturn(Uni.createFrom().failure(new BackendUnavailableException("redis", "get")));
        var failing = new SessionDiscoveryService(
                identityResolver, failingTenants, registry, TestDiscoveryConfig.enabledFor("access"), metrics);

        assertEquals(DiscoveryResult.FAILED, failing.track(LINE).await().indefinitely());
        assertEquals(1, failing.failureCount());
        assertEquals(0, failing.trackedSessionCount());
    }

    @Test
    @DisplayName("observe should process the line in the background")
    void observeShouldProcessLine() {
        discovery.observe(LINE);

        assertEquals(DiscoveryResult.DUPLICATE, track(LINE));
        assertEquals(0, discovery.failureCount());
    }
}
