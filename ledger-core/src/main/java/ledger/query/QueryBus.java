package ledger.query;

import ledger.ErrorKind;
import ledger.model.CacheStats;
import ledger.spi.CacheService;
import ledger.spi.MetricsExporter;
import ledger.util.JsonCodec;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes each query to the single handler registered for its class, optionally reading
 * through a {@link CacheService}.
 *
 * <p>With {@link QueryOptions#cached()}, the bus looks up the query's cache key first and
 * returns a hit without invoking the handler. On a miss it invokes the handler and stores a
 * non-null result with the requested TTL (default 300 seconds).
 *
 * <p>The cache is fail-open: when it throws, the lookup counts as a miss, the store is
 * skipped and the handler's result is returned as usual. A result computed while an
 * invalidation was in progress is never left in the cache.
 *
 * <p>This class is thread-safe.
 */
public final class QueryBus {
    private static final Logger logger = Logger.getLogger(QueryBus.class.getName());
    static final String INTERNAL_ERROR = "Internal server error";

    private final CacheService cache;
    private final MetricsExporter metrics;
    private final Duration defaultCacheTime;
    private final JsonCodec jsonCodec;
    private final Map<Class<?>, QueryHandler<?, ?>> handlers = new ConcurrentHashMap<>();
    private final AtomicLong invalidations = new AtomicLong();

    private QueryBus(Builder builder) {
        this.cache = builder.cache;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.defaultCacheTime = builder.defaultCacheTime;
        if (defaultCacheTime.isZero() || defaultCacheTime.isNegative()) {
            throw new IllegalArgumentException("defaultCacheTime must be positive");
        }
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers the handler for a query class.
     *
     * @return this bus for chaining
     * @throws IllegalStateException if a handler is already registered for the class
     */
    public <Q extends Query<R>, R> QueryBus register(Class<Q> queryType, QueryHandler<Q, R> handler) {
        Objects.requireNonNull(queryType, "queryType");
        Objects.requireNonNull(handler, "handler");
        if (handlers.putIfAbsent(queryType, handler) != null) {
            throw new IllegalStateException("Query handler for " + queryType.getSimpleName()
                    + " is already registered");
        }
        return this;
    }

    /**
     * Executes a query without caching.
     */
    public <R> R dispatch(Query<R> query) {
        return dispatch(query, QueryOptions.NONE);
    }

    /**
     * Executes a query.
     *
     * @throws QueryException        for expected failures reported by the handler, or with
     *                               {@link ErrorKind#INTERNAL} if the handler failed unexpectedly
     * @throws IllegalStateException if no handler is registered for the query's class
     */
    @SuppressWarnings("unchecked")
    public <R> R dispatch(Query<R> query, QueryOptions options) {
        Objects.requireNonNull(query, "query");
        QueryOptions effective = options != null ? options : QueryOptions.NONE;
        QueryHandler<Query<R>, R> handler = (QueryHandler<Query<R>, R>) handlers.get(query.getClass());
        if (handler == null) {
            throw new IllegalStateException("No handler registered for query type: " + query.type());
        }
        if (!effective.cache() || cache == null) {
            return invoke(handler, query);
        }

        String key = effective.cacheKey() != null ? effective.cacheKey() : CacheKeys.queryKey(query, jsonCodec);
        long generation = invalidations.get();
        Optional<Object> cached = readCache(key);
        if (cached.isPresent()) {
            metrics.incrementQueryCacheHit();
            logger.log(Level.FINE, "Cache hit for {0}", key);
            return (R) cached.get();
        }
        metrics.incrementQueryCacheMiss();
        logger.log(Level.FINE, "Cache miss for {0}", key);

        R result = invoke(handler, query);
        if (result != null && invalidations.get() == generation) {
            Duration ttl = effective.cacheTime() != null ? effective.cacheTime() : defaultCacheTime;
            writeCache(key, result, ttl.toSeconds());
            if (invalidations.get() != generation) {
                // An invalidation raced with the write; drop what may be a stale value.
                deleteQuietly(key);
            }
        }
        return result;
    }

    private <R> R invoke(QueryHandler<Query<R>, R> handler, Query<R> query) {
        try {
            return handler.handle(query);
        } catch (QueryException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Query " + query.type() + " failed for user " + query.userId(), e);
            throw new QueryException(ErrorKind.INTERNAL, INTERNAL_ERROR, e);
        }
    }

    private Optional<Object> readCache(String key) {
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            metrics.incrementQueryCacheError();
            logger.log(Level.WARNING, "Cache read failed for " + key + "; treating as miss", e);
            return Optional.empty();
        }
    }

    private void writeCache(String key, Object value, long ttlSeconds) {
        try {
            cache.set(key, value, ttlSeconds);
        } catch (RuntimeException e) {
            metrics.incrementQueryCacheError();
            logger.log(Level.WARNING, "Cache write failed for " + key, e);
        }
    }

    private void deleteQuietly(String key) {
        try {
            cache.del(key);
        } catch (RuntimeException e) {
            metrics.incrementQueryCacheError();
            logger.log(Level.WARNING, "Cache delete failed for " + key, e);
        }
    }

    /**
     * Removes every cached query result.
     */
    public long invalidateCache() {
        return invalidateCache(CacheKeys.ALL_QUERIES);
    }

    /**
     * Removes cached entries matching a glob pattern. Cache failures are logged and
     * reported as zero removals.
     *
     * @param pattern glob pattern; {@code null} means every cached query result
     * @return the number of removed entries
     */
    public long invalidateCache(String pattern) {
        String effective = pattern != null ? pattern : CacheKeys.ALL_QUERIES;
        invalidations.incrementAndGet();
        if (cache == null) {
            return 0L;
        }
        try {
            long removed = cache.invalidatePattern(effective);
            logger.log(Level.INFO, "Invalidated {0} cache entries matching {1}", new Object[]{removed, effective});
            return removed;
        } catch (RuntimeException e) {
            metrics.incrementQueryCacheError();
            logger.log(Level.SEVERE, "Cache invalidation failed for " + effective, e);
            return 0L;
        }
    }

    /**
     * Removes every cached entry tagged with a user.
     *
     * @return the number of removed entries
     */
    public long invalidateCacheForUser(String userId) {
        Objects.requireNonNull(userId, "userId");
        invalidations.incrementAndGet();
        if (cache == null) {
            return 0L;
        }
        try {
            long removed = cache.invalidateUserCache(userId);
            logger.log(Level.FINE, "Invalidated {0} cache entries for user {1}", new Object[]{removed, userId});
            return removed;
        } catch (RuntimeException e) {
            metrics.incrementQueryCacheError();
            logger.log(Level.SEVERE, "Cache invalidation failed for user " + userId, e);
            return 0L;
        }
    }

    /**
     * Returns the cache's counters, or a disconnected placeholder when the cache is absent
     * or unreachable.
     */
    public CacheStats getCacheStats() {
        if (cache == null) {
            return new CacheStats(0L, 0L, 0L, CacheStats.DISCONNECTED);
        }
        try {
            return cache.getStats();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Could not read cache stats", e);
            return new CacheStats(0L, 0L, -1L, CacheStats.DISCONNECTED);
        }
    }

    public boolean hasHandler(Class<?> queryType) {
        return handlers.containsKey(queryType);
    }

    /**
     * Builder for {@link QueryBus}.
     */
    public static final class Builder {
        private CacheService cache;
        private MetricsExporter metrics;
        private Duration defaultCacheTime = Duration.ofSeconds(300);
        private JsonCodec jsonCodec;

        private Builder() {
        }

        /**
         * Sets the read-through cache. Optional; without one, cached dispatches invoke the
         * handler directly.
         */
        public Builder cache(CacheService cache) {
            this.cache = cache;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * TTL of cached results when the dispatch does not set one. Optional; defaults to 300 seconds.
         */
        public Builder defaultCacheTime(Duration defaultCacheTime) {
            this.defaultCacheTime = Objects.requireNonNull(defaultCacheTime, "defaultCacheTime");
            return this;
        }

        /**
         * Codec used to serialize query arguments into cache keys. Optional.
         */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        public QueryBus build() {
            return new QueryBus(this);
        }
    }
}
