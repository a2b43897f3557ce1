package ledger.spring.boot;

import ledger.cache.MemoryCacheService;
import ledger.redis.RedissonCacheService;
import ledger.spi.CacheService;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Query cache configurations selected by {@code ledger.cache.type}.
 */
abstract class LedgerCacheConfigurations {

    private static final Logger logger = Logger.getLogger(LedgerCacheConfigurations.class.getName());

    private LedgerCacheConfigurations() {
    }

    static MemoryCacheService memoryCache(LedgerProperties.Cache cache) {
        return MemoryCacheService.builder()
                .maxSize(cache.getMaxSize())
                .defaultTtl(Duration.ofSeconds(cache.getDefaultTtlSeconds()))
                .cleanupIntervalMs(cache.getCleanupIntervalMs())
                .build();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({RedissonCacheService.class, RedissonClient.class})
    @ConditionalOnProperty(prefix = "ledger.cache", name = "type", havingValue = "redis")
    @ConditionalOnBean(RedissonClient.class)
    static class Redis {

        /**
         * Pings Redis once; an unreachable server yields the in-memory cache unless
         * {@code ledger.cache.fallback-to-memory} is false.
         */
        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean(CacheService.class)
        CacheService ledgerCache(RedissonClient redissonClient, LedgerProperties props) {
            LedgerProperties.Cache cache = props.getCache();
            RedissonCacheService redis = RedissonCacheService.builder()
                    .redissonClient(redissonClient)
                    .keyPrefix(cache.getKeyPrefix())
                    .defaultTtl(Duration.ofSeconds(cache.getDefaultTtlSeconds()))
                    .build();
            if (!cache.isFallbackToMemory() || redis.ping()) {
                return redis;
            }
            logger.log(Level.WARNING, "Redis at {0} did not answer the cache ping, using the in-memory cache",
                    redissonClient);
            return memoryCache(cache);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "ledger.cache", name = "type", havingValue = "memory", matchIfMissing = true)
    static class Memory {

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean(CacheService.class)
        MemoryCacheService ledgerCache(LedgerProperties props) {
            return memoryCache(props.getCache());
        }
    }
}
