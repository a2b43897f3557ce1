package ledger.cache;

import ledger.model.CacheStats;
import ledger.spi.CacheService;
import ledger.util.DaemonThreadFactory;
import ledger.util.GlobPattern;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process {@link CacheService} bounded by entry count.
 *
 * <p>Entries expire after their TTL; expired entries are never returned and are removed
 * lazily on access and by a periodic sweep once {@link #start()} is called. When the cache is
 * full, the least recently used entry is evicted.
 *
 * <p>This class is thread-safe.
 */
public final class MemoryCacheService implements CacheService, AutoCloseable {
    private static final Logger logger = Logger.getLogger(MemoryCacheService.class.getName());

    private final int maxSize;
    private final Duration defaultTtl;
    private final long cleanupIntervalMs;
    private final Clock clock;
    private final LinkedHashMap<String, Entry> entries;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> cleanupTask;
    private volatile boolean closed;

    private MemoryCacheService(Builder builder) {
        if (builder.maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (builder.defaultTtl.isZero() || builder.defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
        if (builder.cleanupIntervalMs <= 0L) {
            throw new IllegalArgumentException("cleanupIntervalMs must be > 0");
        }
        this.maxSize = builder.maxSize;
        this.defaultTtl = builder.defaultTtl;
        this.cleanupIntervalMs = builder.cleanupIntervalMs;
        this.clock = builder.clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a cache with the default limits: 1000 entries, 300 second TTL.
     */
    public static MemoryCacheService create() {
        return builder().build();
    }

    /**
     * Starts the periodic sweep of expired entries. Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("MemoryCacheService has been closed");
        }
        if (cleanupTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("ledger-cache-cleanup-"));
        cleanupTask = scheduler.scheduleWithFixedDelay(this::cleanup, cleanupIntervalMs, cleanupIntervalMs,
                TimeUnit.MILLISECONDS);
    }

    /**
     * Removes every expired entry.
     *
     * @return the number of removed entries
     */
    public int cleanup() {
        int removed = 0;
        try {
            Instant now = clock.instant();
            synchronized (entries) {
                Iterator<Entry> it = entries.values().iterator();
                while (it.hasNext()) {
                    if (it.next().isExpired(now)) {
                        it.remove();
                        removed++;
                    }
                }
            }
            if (removed > 0) {
                logger.log(Level.FINE, "Removed {0} expired cache entries", removed);
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Cache cleanup failed", e);
        }
        return removed;
    }

    @Override
    public Optional<Object> get(String key) {
        Objects.requireNonNull(key, "key");
        Instant now = clock.instant();
        synchronized (entries) {
            Entry entry = entries.get(key);
            if (entry == null) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                misses.incrementAndGet();
                return Optional.empty();
            }
            hits.incrementAndGet();
            return Optional.of(entry.value);
        }
    }

    @Override
    public boolean set(String key, Object value, long ttlSeconds) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Duration ttl = ttlSeconds > 0 ? Duration.ofSeconds(ttlSeconds) : defaultTtl;
        Entry entry = new Entry(value, clock.instant().plus(ttl));
        synchronized (entries) {
            if (!entries.containsKey(key) && entries.size() >= maxSize) {
                evictOne();
            }
            entries.put(key, entry);
        }
        return true;
    }

    // Prefers an expired entry, otherwise the least recently used one.
    private void evictOne() {
        Instant now = clock.instant();
        Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
        String lru = null;
        while (it.hasNext()) {
            Map.Entry<String, Entry> candidate = it.next();
            if (lru == null) {
                lru = candidate.getKey();
            }
            if (candidate.getValue().isExpired(now)) {
                it.remove();
                return;
            }
        }
        if (lru != null) {
            entries.remove(lru);
        }
    }

    @Override
    public boolean del(String key) {
        synchronized (entries) {
            return entries.remove(key) != null;
        }
    }

    @Override
    public boolean exists(String key) {
        Instant now = clock.instant();
        synchronized (entries) {
            Entry entry = entries.get(key);
            if (entry == null) {
                return false;
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                return false;
            }
            return true;
        }
    }

    @Override
    public long invalidatePattern(String pattern) {
        GlobPattern glob = GlobPattern.compile(pattern);
        long removed = 0;
        synchronized (entries) {
            Iterator<String> it = entries.keySet().iterator();
            while (it.hasNext()) {
                if (glob.matches(it.next())) {
                    it.remove();
                    removed++;
                }
            }
        }
        logger.log(Level.FINE, "Invalidated {0} cache entries matching {1}", new Object[]{removed, pattern});
        return removed;
    }

    @Override
    public CacheStats getStats() {
        int size;
        synchronized (entries) {
            size = entries.size();
        }
        return new CacheStats(hits.get(), misses.get(), size, CacheStats.IN_MEMORY);
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    private static final class Entry {
        private final Object value;
        private final Instant expiresAt;

        private Entry(Object value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    /**
     * Builder for {@link MemoryCacheService}.
     */
    public static final class Builder {
        private int maxSize = 1000;
        private Duration defaultTtl = Duration.ofSeconds(300);
        private long cleanupIntervalMs = 60_000L;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        /**
         * Maximum number of entries. Optional; defaults to 1000.
         */
        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        /**
         * TTL applied when a caller passes a non-positive TTL. Optional; defaults to 300 seconds.
         */
        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
            return this;
        }

        /**
         * Interval of the expired-entry sweep. Optional; defaults to 60 seconds.
         */
        public Builder cleanupIntervalMs(long cleanupIntervalMs) {
            this.cleanupIntervalMs = cleanupIntervalMs;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public MemoryCacheService build() {
            return new MemoryCacheService(this);
        }
    }
}
