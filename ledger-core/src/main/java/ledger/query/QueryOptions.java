package ledger.query;

import java.time.Duration;

/**
 * Per-dispatch caching options.
 *
 * @param cache     whether to read through the cache
 * @param cacheTime TTL of a stored result, or {@code null} for the bus default
 * @param cacheKey  explicit cache key, or {@code null} to derive one from the query
 */
public record QueryOptions(boolean cache, Duration cacheTime, String cacheKey) {

    /** Bypasses the cache. */
    public static final QueryOptions NONE = new QueryOptions(false, null, null);

    public QueryOptions {
        if (cacheTime != null && (cacheTime.isZero() || cacheTime.isNegative())) {
            throw new IllegalArgumentException("cacheTime must be positive");
        }
        if (cacheKey != null && cacheKey.isEmpty()) {
            throw new IllegalArgumentException("cacheKey cannot be empty");
        }
    }

    /**
     * Reads through the cache with the bus default TTL.
     */
    public static QueryOptions cached() {
        return new QueryOptions(true, null, null);
    }

    public static QueryOptions cached(Duration cacheTime) {
        return new QueryOptions(true, cacheTime, null);
    }

    public QueryOptions withCacheKey(String cacheKey) {
        return new QueryOptions(cache, cacheTime, cacheKey);
    }
}
