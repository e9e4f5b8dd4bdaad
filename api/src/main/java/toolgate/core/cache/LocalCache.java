package toolgate.core.cache;

import java.util.Optional;

/**
 * Process-local, size-bounded cache.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface LocalCache<K, V> {

    Optional<V> get(K key);

    void put(K key, V value);

    /**
     * Store the value only if the key is not cached.
     *
     * @return true if the value was stored
     */
    boolean putIfAbsent(K key, V value);

    boolean contains(K key);

    void invalidate(K key);

    void invalidateAll();

    /**
     * Approximate number of entries; pending evictions may not be reflected yet.
     */
    long estimatedSize();
}
