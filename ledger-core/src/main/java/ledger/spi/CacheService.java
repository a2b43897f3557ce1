package ledger.spi;

import ledger.model.CacheStats;

import java.util.List;
import java.util.Optional;

/**
 * Key/value cache with per-entry TTL and glob-based invalidation, consumed by the query bus.
 *
 * <p>Implementations backed by a network store may throw {@link ledger.cache.CacheException}
 * when the store is unreachable. Callers on the read path treat that as a miss.
 *
 * <p>Glob patterns support {@code *} (any run of characters) and {@code ?} (any single
 * character).
 */
public interface CacheService {

    /** Key used by {@link #ping()}. */
    String PING_KEY = "health:ping";

    /**
     * Returns the value for a key, or empty if absent or expired.
     */
    Optional<Object> get(String key);

    /**
     * Stores a value.
     *
     * @param key        the key
     * @param value      a non-null value
     * @param ttlSeconds time to live; zero or negative selects the implementation's default TTL
     * @return {@code true} if the value was stored
     */
    boolean set(String key, Object value, long ttlSeconds);

    /**
     * Removes a key.
     *
     * @return {@code true} if an entry was removed
     */
    boolean del(String key);

    boolean exists(String key);

    /**
     * Removes every entry whose key matches a glob pattern.
     *
     * @return the number of removed entries
     */
    long invalidatePattern(String pattern);

    /**
     * Removes every entry tagged with a user.
     *
     * @return the number of removed entries
     */
    default long invalidateUserCache(String userId) {
        long deleted = 0;
        for (String pattern : userPatterns(userId)) {
            deleted += invalidatePattern(pattern);
        }
        return deleted;
    }

    CacheStats getStats();

    /**
     * Round-trips a short-lived marker key through set, get and delete.
     *
     * @return {@code true} if the marker value was read back
     */
    default boolean ping() {
        String token = Long.toString(System.nanoTime());
        if (!set(PING_KEY, token, 10)) {
            return false;
        }
        boolean readBack = get(PING_KEY).map(token::equals).orElse(false);
        del(PING_KEY);
        return readBack;
    }

    /**
     * Glob patterns covering every key tagged with a user.
     */
    static List<String> userPatterns(String userId) {
        return List.of("user:" + userId + ":*", "*:user:" + userId, "*:user:" + userId + ":*");
    }
}
