package toolgate.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import toolgate.core.config.SessionConfig;
import toolgate.core.port.out.SessionBackend;
import toolgate.core.port.out.SessionMetrics;
import toolgate.spi.SessionBackendProvider;
import toolgate.spi.StorageProviderException;

/**
 * Redis-based session backend provider.
 *
 * <p>Recommended for production: records survive restarts and are shared by
 * every instance, which is what lets recovery rebuild a transport on another process.
 */
@ApplicationScoped
public class RedisSessionBackendProvider implements SessionBackendProvider {

    private static final Logger LOG = Logger.getLogger(RedisSessionBackendProvider.class);
    private static final int PRIORITY = 100;
    private static final Duration AVAILABILITY_CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final ReactiveRedisDataSource redisDataSource;
    private final SessionConfig sessionConfig;
    private final SessionMetrics metrics;

    private RedisSessionBackend backend;
    private final AtomicBoolean available = new AtomicBoolean(false);
    private final CountDownLatch checkLatch = new CountDownLatch(1);

    @Inject
    public RedisSessionBackendProvider(
            ReactiveRedisDataSource redisDataSource, SessionConfig sessionConfig, SessionMetrics metrics) {
        this.redisDataSource = redisDataSource;
        this.sessionConfig = sessionConfig;
        this.metrics = metrics;
    }

    @PostConstruct
    void checkAvailability() {
        redisDataSource
                .key(String.class)
                .exists(sessionConfig.keyPrefix() + "connection-check")
                .ifNoItem()
                .after(AVAILABILITY_CHECK_TIMEOUT)
                .fail()
                .subscribe()
                .with(
                        result -> {
                            available.set(true);
                            checkLatch.countDown();
                            LOG.info("Redis session backend is available");
                        },
                        error -> {
                            available.set(false);
                            checkLatch.countDown();
                            LOG.warnf("Redis session backend is not available: %s", error.getMessage());
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        try {
            if (!checkLatch.await(AVAILABILITY_CHECK_TIMEOUT.toSeconds() + 1, TimeUnit.SECONDS)) {
                LOG.warn("Redis availability check timed out");
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return available.get();
    }

    @Override
    public synchronized SessionBackend createBackend() {
        if (backend == null) {
            if (!available.get()) {
                throw new StorageProviderException(
                        "Redis session backend cannot be created: Redis is not reachable at startup");
            }
            var timeoutHelper = new RedisTimeoutHelper(sessionConfig.storage().redis().timeout(), metrics, name());
            backend = new RedisSessionBackend(redisDataSource, timeoutHelper);
            LOG.infof("Created Redis session backend with key prefix: %s", sessionConfig.keyPrefix());
        }
        return backend;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        // Cached state; health probes must not block on Redis
        if (available.get()) {
            return Optional.of(HealthCheckResponse.named("session-backend-redis")
                    .up()
                    .withData("type", "redis")
                    .withData("keyPrefix", sessionConfig.keyPrefix())
                    .build());
        }
        return Optional.of(HealthCheckResponse.named("session-backend-redis")
                .down()
                .withData("type", "redis")
                .withData("error", "Redis not available or check not completed")
                .build());
    }
}
