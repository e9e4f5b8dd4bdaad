package toolgate.core.cache;

import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * {@link LocalCache} backed by Caffeine with a maximum size and no expiry.
 *
 * <p>Once full, Caffeine's size policy evicts entries that are old and rarely
 * read first.
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private final Cache<K, V> cache;

    public CaffeineLocalCache(long maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Cache size must be positive, got: " + maxSize);
        }
        this.cache = Caffeine.newBuilder().maximumSize(maxSize).build();
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public boolean putIfAbsent(K key, V value) {
        return cache.asMap().putIfAbsent(key, value) == null;
    }

    @Override
    public boolean contains(K key) {
        return cache.getIfPresent(key) != null;
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long estimatedSize() {
        return cache.estimatedSize();
    }

    /**
     * Run pending maintenance, including size-based eviction.
     */
    public void cleanUp() {
        cache.cleanUp();
    }
}
