package io.github.cyfko.sdtp.core.cache;

import io.github.cyfko.sdtp.core.config.CachePolicy;
import io.github.cyfko.sdtp.core.validation.ValidatedFilter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Bounded LRU cache of validated filters.
 * <p>
 * Entries are kept in access order and the least recently used one is evicted once the cache
 * holds {@link CachePolicy#cacheSize()} entries. A disabled policy turns every lookup into a
 * computation.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * A lookup in an access-ordered map reorders it, so reads and writes share one lock. The
 * validation itself runs outside the lock; two threads missing on the same key may both validate,
 * and the last one stores its result. Both results are equivalent.
 * </p>
 *
 * <pre>{@code
 * ValidatedFilterCache cache = new ValidatedFilterCache(CachePolicy.defaults());
 * ValidatedFilter filter = cache.computeIfAbsent(key, k -> FilterValidator.validate(document, schema, policy));
 * }</pre>
 *
 * @since 1.0.0
 */
public class ValidatedFilterCache {

    private final CachePolicy policy;
    private final Map<FilterCacheKey, ValidatedFilter> entries;
    private final Lock lock = new ReentrantLock();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ValidatedFilterCache(CachePolicy policy) {
        this.policy = policy;
        int maxSize = policy.cacheSize();
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<FilterCacheKey, ValidatedFilter> eldest) {
                return size() > maxSize;
            }
        };
    }

    /**
     * @param key a cache key
     * @return the cached filter, or {@code null}
     */
    public ValidatedFilter get(FilterCacheKey key) {
        if (!policy.cacheEnabled()) {
            return null;
        }
        lock.lock();
        try {
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    public void put(FilterCacheKey key, ValidatedFilter filter) {
        if (!policy.cacheEnabled()) {
            return;
        }
        lock.lock();
        try {
            entries.put(key, filter);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached filter for {@code key}, validating and caching it on a miss. Validation
     * failures propagate and are not cached.
     *
     * @param key       the cache key
     * @param validator produces the filter on a miss
     * @return the validated filter
     */
    public ValidatedFilter computeIfAbsent(FilterCacheKey key, Function<FilterCacheKey, ValidatedFilter> validator) {
        ValidatedFilter cached = get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        misses.incrementAndGet();
        ValidatedFilter computed = validator.apply(key);
        put(key, computed);
        return computed;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public CachePolicy policy() {
        return policy;
    }
}
