package io.github.cyfko.sdtp.core.config;

/**
 * Sizing of the validated-filter cache.
 * <p>
 * Clients tend to send the same few filters again and again. When enabled, the dispatcher keeps
 * up to {@code cacheSize} validated filters keyed by table, schema fingerprint and canonical filter
 * text, and skips parsing and validation on a hit. Results are the same with the cache on or off.
 * </p>
 *
 * <pre>{@code
 * CachePolicy.defaults();     // enabled, 1000 entries
 * CachePolicy.none();         // disabled
 * CachePolicy.custom(5000);   // enabled, 5000 entries
 * }</pre>
 *
 * @param cacheEnabled whether validated filters are cached
 * @param cacheSize    maximum number of cached filters
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    public static CachePolicy defaults() {
        return new CachePolicy(true, 1000);
    }

    /**
     * Caching completely disabled; every request parses and validates its filter.
     *
     * @return a disabled policy
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
