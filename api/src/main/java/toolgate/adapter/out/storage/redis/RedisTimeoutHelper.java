package toolgate.adapter.out.storage.redis;

import java.time.Duration;
import java.util.function.Supplier;

import io.smallrye.mutiny.TimeoutException;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import toolgate.core.model.session.BackendUnavailableException;
import toolgate.core.port.out.SessionMetrics;

/**
 * Applies timeouts and failure translation to Redis commands.
 *
 * <h2>Operation Modes</h2>
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: timeouts and failures surface as
 *       {@link BackendUnavailableException}. Used for every session read and write.</li>
 *   <li>{@link #withTimeoutFallback} - Fail-open: returns a fallback on timeout or failure.
 *       Used for reachability probes.</li>
 * </ul>
 *
 * <h2>Metrics</h2>
 * Timeouts and other failures are recorded separately through {@link SessionMetrics}.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final SessionMetrics metrics;
    private final String backendName;

    /**
     * @param timeout     upper bound for a single command
     * @param metrics     metrics sink, may be null
     * @param backendName backend name for logs, metrics and exceptions
     */
    public RedisTimeoutHelper(Duration timeout, SessionMetrics metrics, String backendName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.backendName = backendName;
    }

    /**
     * Bound an operation by the configured timeout, translating timeouts and
     * failures into {@link BackendUnavailableException}.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging and metrics
     * @param <T>           the result type
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, backendName, timeout);
                    recordTimeout(operationName);
                    return new TimeoutException();
                })
                .onFailure()
                .transform(error -> {
                    if (error instanceof BackendUnavailableException) {
                        return error;
                    }
                    if (!(error instanceof TimeoutException)) {
                        LOG.warnv(
                                "Redis operation failure: {0} in {1}: {2}",
                                operationName, backendName, error.getMessage());
                        recordFailure(operationName);
                    }
                    return new BackendUnavailableException(backendName, operationName, error);
                });
    }

    /**
     * Bound an operation by the configured timeout, substituting a fallback on
     * timeout or failure.
     */
    public <T> Uni<T> withTimeoutFallback(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (fallback): {0} in {1} after {2}",
                            operationName, backendName, timeout);
                    recordTimeout(operationName);
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Redis operation failure (fallback): {0} in {1}: {2}",
                            operationName, backendName, error.getMessage());
                    recordFailure(operationName);
                    return fallback.get();
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordBackendTimeout(backendName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordBackendFailure(backendName, operationName);
        }
    }
}
