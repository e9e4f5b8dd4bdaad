package toolgate.core.service.tenant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import toolgate.adapter.out.storage.memory.InMemorySessionBackend;
import toolgate.core.model.identity.AuthMethod;
import toolgate.core.model.identity.UserIdentity;
import toolgate.core.model.identity.UserType;
import toolgate.core.model.session.ApplicationSession;
import toolgate.core.model.session.StoreOutcome;
import toolgate.core.port.out.SessionMetrics;
import toolgate.core.service.session.SessionStore;
import toolgate.support.MutableClock;
import toolgate.support.TestSessionConfig;

@DisplayName("MultiTenantSessionService")
@ExtendWith(MockitoExtension.class)
class MultiTenantSessionServiceTest {

    private static final UserIdentity ALICE =
            new UserIdentity("alice", UserType.AUTHENTICATED_USER, Map.of(), AuthMethod.JWT);
    private static final UserIdentity BOB =
            new UserIdentity("bob", UserType.AUTHENTICATED_USER, Map.of(), AuthMethod.JWT);

    @Mock
    private SessionMetrics metrics;

    private MutableClock clock;
    private InMemorySessionBackend backend;
    private SessionStore store;
    private MultiTenantSessionService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        backend = new InMemorySessionBackend(clock);
        var config = new TestSessionConfig();
        store = new SessionStore(backend, config, clock);
        service = new MultiTenantSessionService(store, backend, config, metrics, clock);
    }

    private ApplicationSession findOrCreate(String sessionId, UserIdentity identity) {
        return service.findOrCreate(sessionId, identity, Map.of()).await().indefinitely();
    }

    @Nested
    @DisplayName("findOrCreate")
    class FindOrCreateTests {

        @Test
        @DisplayName("should create an indexed session owned by the caller")
        void shouldCreateOwnedSession() {
            var session = findOrCreate("s1", ALICE);

            assertEquals("s1", session.sessionId());
            assertEquals(ALICE.identityHash(), session.scope());
            assertEquals("alice", session.userId());
            assertEquals(
                    "mcp_client_authenticated_user_" + ALICE.identityHash().substring(0, 8), session.clientId());
            assertEquals(Set.of("s1"), service.indexedSessionIds(ALICE).await().indefinitely());
            verify(metrics).recordSessionCreated("identity");
        }

        @Test
        @DisplayName("should return the same session for the same id and merge the payload")
        void shouldReturnExactMatch() {
            service.findOrCreate("s1", ALICE, Map.of("a", 1)).await().indefinitely();
            clock.advance(Duration.ofMinutes(30));

            var session = service.findOrCreate("s1", ALICE, Map.of("b", 2)).await().indefinitely();

            assertEquals("s1", session.sessionId());
            assertEquals(Map.of("a", 1, "b", 2), session.payload());
            assertEquals(clock.instant(), session.lastAccessed());
            verify(metrics).recordSessionReused("exact");
        }

        @Test
        @DisplayName("should reuse a session used within the reuse window")
        void shouldReuseRecentSession() {
            findOrCreate("s1", ALICE);
            clock.advance(Duration.ofMinutes(2));

            var session = findOrCreate("s2", ALICE);

            assertEquals("s1", session.sessionId());
            assertEquals(Set.of("s1"), service.indexedSessionIds(ALICE).await().indefinitely());
            verify(metrics).recordSessionReused("window");
        }

        @Test
        @DisplayName("should still reuse at exactly the window boundary")
        void shouldReuseAtBoundary() {
            findOrCreate("s1", ALICE);
            clock.advance(Duration.ofMinutes(5));

            assertEquals("s1", findOrCreate("s2", ALICE).sessionId());
        }

        @Test
        @DisplayName("should create a new session once the window has passed")
        void shouldCreateAfterWindow() {
            findOrCreate("s1", ALICE);
            clock.advance(Duration.ofSeconds(301));

            var session = findOrCreate("s2", ALICE);

            assertEquals("s2", session.sessionId());
            assertEquals(Set.of("s1", "s2"), service.indexedSessionIds(ALICE).await().indefinitely());
        }

        @Test
        @DisplayName("should prefer the most recently used session, then the smallest id")
        void shouldBreakTiesById() {
            var now = clock.instant();
            for (String id : new String[] {"s-c", "s-a", "s-b"}) {
                store.saveScoped(ApplicationSession.owned(id, ALICE, "c", Map.of(), now))
                        .await()
                        .indefinitely();
                backend.addToSet("toolgate:user-index:" + ALICE.identityHash(), id)
                        .await()
                        .indefinitely();
            }

            assertEquals("s-a", findOrCreate("new", ALICE).sessionId());

            clock.advance(Duration.ofMinutes(1));
            store.updateScoped(ALICE.identityHash(), "s-c", Map.of()).await().indefinitely();

            assertEquals("s-c", findOrCreate("other", ALICE).sessionId());
        }

        @Test
        @DisplayName("should never hand one caller's session to another")
        void shouldIsolateTenants() {
            var alices = findOrCreate("s1", ALICE);

            var bobs = findOrCreate("s1", BOB);

            assertEquals("s1", bobs.sessionId());
            assertNotEquals(alices.scope(), bobs.scope());
            assertEquals("bob", bobs.userId());
            assertEquals(
                    "alice",
                    service.getUserSession("s1", ALICE).await().indefinitely().orElseThrow().userId());
            assertEquals(1, service.getActiveSessions(BOB).await().indefinitely().size());
        }

        @Test
        @DisplayName("should not reuse anonymous sessions of a different fingerprint")
        void shouldIsolateAnonymousFingerprints() {
            var first = new UserIdentity("anonymous_aaa", UserType.ANONYMOUS, Map.of(), AuthMethod.ANONYMOUS);
            var second = new UserIdentity("anonymous_bbb", UserType.ANONYMOUS, Map.of(), AuthMethod.ANONYMOUS);
            findOrCreate("s1", first);

            assertEquals("s2", findOrCreate("s2", second).sessionId());
        }
    }

    @Nested
    @DisplayName("deactivate")
    class DeactivateTests {

        @Test
        @DisplayName("should deactivate the session and drop it from the index")
        void shouldDeactivateAndUnindex() {
            findOrCreate("s1", ALICE);

            var outcome = service.deactivate("s1", ALICE).await().indefinitely();

            assertEquals(StoreOutcome.UPDATED, outcome);
            assertFalse(service.getUserSession("s1", ALICE).await().indefinitely().orElseThrow().active());
            assertTrue(service.indexedSessionIds(ALICE).await().indefinitely().isEmpty());
            verify(metrics).recordSessionDeactivated();
        }

        @Test
        @DisplayName("should not reuse a deactivated session")
        void shouldNotReuseDeactivated() {
            findOrCreate("s1", ALICE);
            service.deactivate("s1", ALICE).await().indefinitely();

            var session = findOrCreate("s2", ALICE);

            assertEquals("s2", session.sessionId());
        }

        @Test
        @DisplayName("should recreate a deactivated session requested by id")
        void shouldRecreateDeactivatedById() {
            findOrCreate("s1", ALICE);
            service.deactivate("s1", ALICE).await().indefinitely();

            var session = findOrCreate("s1", ALICE);

            assertTrue(session.active());
            assertEquals(Set.of("s1"), service.indexedSessionIds(ALICE).await().indefinitely());
        }
    }

    @Test
    @DisplayName("should skip and prune index members whose session expired")
    void shouldPruneDanglingMembers() {
        backend.addToSet("toolgate:user-index:" + ALICE.identityHash(), "ghost")
                .await()
                .indefinitely();

        assertTrue(service.getActiveSessions(ALICE).await().indefinitely().isEmpty());
        assertTrue(service.indexedSessionIds(ALICE).await().indefinitely().isEmpty());
    }

    @Test
    @DisplayName("stats should count sessions, indexes and user types")
    void statsShouldCount() {
        var service1 = new UserIdentity("svc", UserType.SERVICE_ACCOUNT, Map.of(), AuthMethod.API_KEY);
        findOrCreate("s1", ALICE);
        findOrCreate("s2", BOB);
        findOrCreate("s3", service1);
        service.deactivate("s2", BOB).await().indefinitely();
        store.create("shared-1", "c", Map.of()).await().indefinitely();

        var stats = service.stats().await().indefinitely();

        assertEquals(4, stats.totalSessions());
        assertEquals(3, stats.activeSessions());
        assertEquals(2, stats.userIndexes());
        assertEquals(
                Map.of("authenticated_user", 1L, "service_account", 1L, "unknown", 1L),
                stats.userTypeDistribution());
    }
}
