package ledger.redis;

import ledger.cache.CacheException;
import ledger.model.CacheStats;
import org.junit.jupiter.api.Test;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;

import java.lang.reflect.Proxy;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Failure handling against a client whose every Redis call fails. Behaviour against a live
 * server is covered by {@link RedissonCacheServiceIntegrationTest}.
 */
class RedissonCacheServiceTest {

    private final AtomicInteger shutdowns = new AtomicInteger();
    private final RedissonClient unreachable = (RedissonClient) Proxy.newProxyInstance(
            RedissonClient.class.getClassLoader(),
            new Class<?>[]{RedissonClient.class},
            (proxy, method, args) -> {
                switch (method.getName()) {
                    case "isShutdown":
                        return false;
                    case "shutdown":
                        shutdowns.incrementAndGet();
                        return null;
                    case "toString":
                        return "unreachable";
                    case "hashCode":
                        return 0;
                    case "equals":
                        return proxy == args[0];
                    default:
                        throw new RedisException("Unable to connect to Redis server");
                }
            });

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRequiresClientAndPositiveTtl() {
        assertThrows(NullPointerException.class, () -> RedissonCacheService.builder().build());
        assertThrows(IllegalArgumentException.class, () -> RedissonCacheService.builder()
                .redissonClient(unreachable)
                .defaultTtl(Duration.ZERO)
                .build());
    }

    // ── Failures ────────────────────────────────────────────────────

    @Test
    void redisFailuresSurfaceAsCacheException() {
        RedissonCacheService cache = RedissonCacheService.builder().redissonClient(unreachable).build();

        CacheException e = assertThrows(CacheException.class, () -> cache.get("habit:h1"));
        assertThrows(CacheException.class, () -> cache.set("habit:h1", "v", 60));
        assertThrows(CacheException.class, () -> cache.del("habit:h1"));
        assertThrows(CacheException.class, () -> cache.invalidateUserCache("u1"));
        assertEquals(RedisException.class, e.getCause().getClass());
    }

    @Test
    void statsAndPingReportDisconnectedInsteadOfThrowing() {
        RedissonCacheService cache = RedissonCacheService.builder().redissonClient(unreachable).build();

        CacheStats stats = cache.getStats();

        assertEquals(CacheStats.DISCONNECTED, stats.connectionStatus());
        assertEquals(-1L, stats.keys());
        assertFalse(cache.ping());
    }

    @Test
    void valuesThatCannotBeSerializedAreSkipped() {
        RedissonCacheService cache = RedissonCacheService.builder().redissonClient(unreachable).build();

        assertFalse(cache.set("habit:h1", new Object(), 60));
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    @Test
    void closeShutsDownOnlyAnOwnedClient() {
        RedissonCacheService.builder().redissonClient(unreachable).build().close();
        RedissonCacheService.builder().redissonClient(unreachable).shutdownClientOnClose(true).build().close();

        assertEquals(1, shutdowns.get());
    }

    @Test
    void redisPatternCharactersOutsideGlobsAreEscaped() {
        assertEquals("user:\\[a\\]:*", RedissonCacheService.escape("user:[a]:*"));
        assertEquals("query:?:x", RedissonCacheService.escape("query:?:x"));
    }
}
