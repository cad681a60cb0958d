package io.surfworks.tensordict.lock;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Per-instance memo of key enumerations, valid only while the owning container is locked.
 *
 * <p>Entries are tagged with a stamp derived from the lock nodes the container depends on.
 * A lookup with a different stamp discards everything, which is how views and stacks notice
 * that their source or children were unlocked in between.
 */
public final class EnumerationCache {

    private final Map<String, Object> entries = new HashMap<>();
    private long stamp;

    /**
     * Return the cached value for {@code key}, computing and storing it if absent or stale.
     */
    @SuppressWarnings("unchecked")
    public <T> T computeIfAbsent(String key, long currentStamp, Supplier<T> supplier) {
        validate(currentStamp);
        Object cached = entries.get(key);
        if (cached == null) {
            cached = supplier.get();
            entries.put(key, cached);
        }
        return (T) cached;
    }

    public void clear() {
        entries.clear();
    }

    public int size(long currentStamp) {
        validate(currentStamp);
        return entries.size();
    }

    private void validate(long currentStamp) {
        if (currentStamp != stamp) {
            entries.clear();
            stamp = currentStamp;
        }
    }
}
