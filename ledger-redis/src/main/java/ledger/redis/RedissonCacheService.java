package ledger.redis;

import ledger.cache.CacheException;
import ledger.model.CacheStats;
import ledger.spi.CacheService;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.Codec;
import org.redisson.codec.SerializationCodec;

import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link CacheService} on Redis through a {@link RedissonClient}.
 *
 * <p>Every key is stored under a namespace prefix, so pattern invalidation and key counts only
 * touch this cache's entries. Values are written with Java serialization by default and must
 * be {@link Serializable}.
 *
 * <p>Redis failures are rethrown as {@link CacheException}; the query bus treats them as a
 * miss. {@link #getStats()} never throws and reports {@link CacheStats#DISCONNECTED} instead.
 */
public final class RedissonCacheService implements CacheService, AutoCloseable {
    private static final Logger logger = Logger.getLogger(RedissonCacheService.class.getName());

    private final RedissonClient redisson;
    private final String keyPrefix;
    private final Duration defaultTtl;
    private final Codec codec;
    private final boolean shutdownClientOnClose;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    private RedissonCacheService(Builder builder) {
        this.redisson = Objects.requireNonNull(builder.redisson, "redissonClient");
        this.keyPrefix = Objects.requireNonNull(builder.keyPrefix, "keyPrefix");
        Objects.requireNonNull(builder.defaultTtl, "defaultTtl");
        if (builder.defaultTtl.isZero() || builder.defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
        this.defaultTtl = builder.defaultTtl;
        this.codec = Objects.requireNonNull(builder.codec, "codec");
        this.shutdownClientOnClose = builder.shutdownClientOnClose;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<Object> get(String key) {
        Object value;
        try {
            value = bucket(key).get();
        } catch (RuntimeException e) {
            throw new CacheException("Failed to read cache key " + key, e);
        }
        if (value == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(value);
    }

    @Override
    public boolean set(String key, Object value, long ttlSeconds) {
        Objects.requireNonNull(value, "value");
        if (!(value instanceof Serializable)) {
            logger.log(Level.WARNING, "Not caching {0}: {1} is not Serializable",
                    new Object[]{key, value.getClass().getName()});
            return false;
        }
        Duration ttl = ttlSeconds > 0 ? Duration.ofSeconds(ttlSeconds) : defaultTtl;
        try {
            bucket(key).set(value, ttl);
            return true;
        } catch (RuntimeException e) {
            throw new CacheException("Failed to write cache key " + key, e);
        }
    }

    @Override
    public boolean del(String key) {
        try {
            return bucket(key).delete();
        } catch (RuntimeException e) {
            throw new CacheException("Failed to delete cache key " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            return bucket(key).isExists();
        } catch (RuntimeException e) {
            throw new CacheException("Failed to check cache key " + key, e);
        }
    }

    @Override
    public long invalidatePattern(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        try {
            long deleted = redisson.getKeys().deleteByPattern(escape(keyPrefix) + escape(pattern));
            logger.log(Level.FINE, "Invalidated {0} cache entries matching {1}", new Object[]{deleted, pattern});
            return deleted;
        } catch (RuntimeException e) {
            throw new CacheException("Failed to invalidate cache pattern " + pattern, e);
        }
    }

    @Override
    public CacheStats getStats() {
        try {
            long keys = 0;
            for (String ignored : redisson.getKeys().getKeysByPattern(escape(keyPrefix) + "*")) {
                keys++;
            }
            return new CacheStats(hits.get(), misses.get(), keys, CacheStats.CONNECTED);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Redis is unreachable", e);
            return new CacheStats(hits.get(), misses.get(), -1L, CacheStats.DISCONNECTED);
        }
    }

    @Override
    public boolean ping() {
        try {
            return CacheService.super.ping();
        } catch (CacheException e) {
            logger.log(Level.WARNING, "Redis ping failed", e);
            return false;
        }
    }

    /**
     * Shuts the Redisson client down if this cache was built with
     * {@link Builder#shutdownClientOnClose(boolean)}.
     */
    @Override
    public void close() {
        if (shutdownClientOnClose && !redisson.isShutdown()) {
            redisson.shutdown();
        }
    }

    private RBucket<Object> bucket(String key) {
        Objects.requireNonNull(key, "key");
        return redisson.getBucket(keyPrefix + key, codec);
    }

    // Cache globs only know * and ?, so Redis' other pattern characters are taken literally.
    static String escape(String glob) {
        StringBuilder sb = new StringBuilder(glob.length());
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '[' || c == ']' || c == '\\' || c == '^') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Builder for {@link RedissonCacheService}.
     */
    public static final class Builder {
        private RedissonClient redisson;
        private String keyPrefix = "ledger:";
        private Duration defaultTtl = Duration.ofSeconds(300);
        private Codec codec = new SerializationCodec();
        private boolean shutdownClientOnClose;

        private Builder() {
        }

        /**
         * Sets the client. Required.
         */
        public Builder redissonClient(RedissonClient redisson) {
            this.redisson = redisson;
            return this;
        }

        /**
         * Namespace prepended to every key. Optional; defaults to {@code "ledger:"}.
         */
        public Builder keyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
            return this;
        }

        /**
         * TTL used when a caller passes zero or less. Optional; defaults to 300 seconds.
         */
        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder codec(Codec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Whether {@link RedissonCacheService#close()} shuts the client down. Optional; defaults
         * to {@code false} since the client is usually shared.
         */
        public Builder shutdownClientOnClose(boolean shutdownClientOnClose) {
            this.shutdownClientOnClose = shutdownClientOnClose;
            return this;
        }

        public RedissonCacheService build() {
            return new RedissonCacheService(this);
        }
    }
}
