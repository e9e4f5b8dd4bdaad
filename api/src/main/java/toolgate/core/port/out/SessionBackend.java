package toolgate.core.port.out;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

/**
 * Shared key-value backend holding session records and user indexes.
 *
 * <p>Every operation is atomic on a single key; there are no multi-key
 * transactions. Implementations signal an unreachable or slow backend by
 * failing with {@link toolgate.core.model.session.BackendUnavailableException}.
 */
public interface SessionBackend {

    /**
     * Backend name for logs, metrics and diagnostics.
     */
    String name();

    /**
     * Store a value with an expiry, replacing any existing value.
     */
    Uni<Void> setex(String key, Duration ttl, String value);

    /**
     * Store a value with an expiry only if the key does not exist.
     *
     * @return true if the value was stored
     */
    Uni<Boolean> setIfAbsent(String key, Duration ttl, String value);

    Uni<Optional<String>> get(String key);

    /**
     * @return true if a key was removed
     */
    Uni<Boolean> delete(String key);

    /**
     * Reset the expiry of an existing key.
     *
     * @return true if the key existed
     */
    Uni<Boolean> expire(String key, Duration ttl);

    Uni<Void> addToSet(String key, String member);

    Uni<Void> removeFromSet(String key, String member);

    /**
     * @return the set's members, empty if the key does not exist
     */
    Uni<Set<String>> members(String key);

    /**
     * List keys starting with the given prefix. Best effort: results may race with expiry.
     */
    Uni<List<String>> keys(String prefix);

    /**
     * @return true if the backend answered
     */
    Uni<Boolean> ping();
}
