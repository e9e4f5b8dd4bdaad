package toolgate.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import toolgate.core.port.out.SessionMetrics;
import toolgate.spi.StorageProviderException;
import toolgate.support.TestSessionConfig;

@DisplayName("RedisSessionBackendProvider")
class RedisSessionBackendProviderTest {

    private ReactiveKeyCommands<String> keyCommands;
    private RedisSessionBackendProvider provider;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        var dataSource = mock(ReactiveRedisDataSource.class);
        keyCommands = mock(ReactiveKeyCommands.class);
        when(dataSource.key(String.class)).thenReturn(keyCommands);
        provider = new RedisSessionBackendProvider(dataSource, new TestSessionConfig(), mock(SessionMetrics.class));
    }

    @Test
    @DisplayName("should create the backend once Redis answered the startup check")
    void shouldCreateBackendWhenReachable() {
        when(keyCommands.exists(anyString())).thenReturn(Uni.createFrom().item(false));
        provider.checkAvailability();

        var backend = provider.createBackend();

        assertTrue(provider.isAvailable());
        assertInstanceOf(RedisSessionBackend.class, backend);
        assertSame(backend, provider.createBackend());
        assertEquals(HealthCheckResponse.Status.UP, provider.healthCheck().orElseThrow().getStatus());
    }

    @Test
    @DisplayName("should refuse to create a backend when Redis is unreachable")
    void shouldRefuseBackendWhenUnreachable() {
        when(keyCommands.exists(anyString()))
                .thenReturn(Uni.createFrom().failure(new IllegalStateException("connection refused")));
        provider.checkAvailability();

        var error = assertThrows(StorageProviderException.class, provider::createBackend);

        assertFalse(provider.isAvailable());
        assertTrue(error.getMessage().contains("not reachable"));
        assertEquals(HealthCheckResponse.Status.DOWN, provider.healthCheck().orElseThrow().getStatus());
    }
}
