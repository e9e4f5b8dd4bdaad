package toolgate.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CaffeineLocalCache")
class CaffeineLocalCacheTest {

    @Test
    @DisplayName("putIfAbsent should only succeed for new keys")
    void putIfAbsentShouldOnlySucceedOnce() {
        var cache = new CaffeineLocalCache<String, Boolean>(10);

        assertTrue(cache.putIfAbsent("a", true));
        assertFalse(cache.putIfAbsent("a", true));
        assertTrue(cache.contains("a"));
    }

    @Test
    @DisplayName("should get, invalidate and clear entries")
    void shouldGetAndInvalidate() {
        var cache = new CaffeineLocalCache<String, String>(10);
        cache.put("a", "1");
        cache.put("b", "2");

        assertEquals(Optional.of("1"), cache.get("a"));

        cache.invalidate("a");
        assertTrue(cache.get("a").isEmpty());

        cache.invalidateAll();
        assertFalse(cache.contains("b"));
    }

    @Test
    @DisplayName("should stay within its maximum size")
    void shouldBoundSize() {
        var cache = new CaffeineLocalCache<Integer, Boolean>(5);
        for (int i = 0; i < 50; i++) {
            cache.put(i, true);
        }

        cache.cleanUp();

        assertTrue(cache.estimatedSize() <= 5);
    }

    @Test
    @DisplayName("should reject a non-positive size")
    void shouldRejectNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new CaffeineLocalCache<String, String>(0));
    }
}
