package io.surfworks.tensordict.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Unit tests for EnumerationCache.
 */
@DisplayName("EnumerationCache Unit Tests")
class EnumerationCacheTest {

    @Test
    @DisplayName("values are computed once per stamp")
    void computedOnce() {
        EnumerationCache cache = new EnumerationCache();
        AtomicInteger calls = new AtomicInteger();
        List<String> first = cache.computeIfAbsent("keys", 0, () -> {
            calls.incrementAndGet();
            return List.of("a");
        });
        List<String> second = cache.computeIfAbsent("keys", 0, () -> {
            calls.incrementAndGet();
            return List.of("b");
        });
        assertSame(first, second);
        assertEquals(1, calls.get());
        assertEquals(1, cache.size(0));
    }

    @Test
    @DisplayName("a new stamp discards every entry")
    void staleStamp() {
        EnumerationCache cache = new EnumerationCache();
        cache.computeIfAbsent("a", 0, () -> "x");
        cache.computeIfAbsent("b", 0, () -> "y");
        assertEquals(2, cache.size(0));
        assertEquals(0, cache.size(1));
        assertEquals("z", cache.computeIfAbsent("a", 1, () -> "z"));
    }

    @Test
    @DisplayName("clear empties the cache")
    void clear() {
        EnumerationCache cache = new EnumerationCache();
        cache.computeIfAbsent("a", 3, () -> "x");
        cache.clear();
        assertEquals(0, cache.size(3));
    }
}
