package ledger.query;

import ledger.cache.MemoryCacheService;
import ledger.model.CacheStats;
import ledger.spi.CacheService;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory cache whose operations can be switched to throw, as an unreachable Redis would.
 */
final class FlakyCache implements CacheService {
    final MemoryCacheService delegate = MemoryCacheService.create();
    final AtomicInteger sets = new AtomicInteger();
    volatile boolean down;

    private void check() {
        if (down) {
            throw new IllegalStateException("cache unreachable");
        }
    }

    @Override
    public Optional<Object> get(String key) {
        check();
        return delegate.get(key);
    }

    @Override
    public boolean set(String key, Object value, long ttlSeconds) {
        check();
        sets.incrementAndGet();
        return delegate.set(key, value, ttlSeconds);
    }

    @Override
    public boolean del(String key) {
        check();
        return delegate.del(key);
    }

    @Override
    public boolean exists(String key) {
        check();
        return delegate.exists(key);
    }

    @Override
    public long invalidatePattern(String pattern) {
        check();
        return delegate.invalidatePattern(pattern);
    }

    @Override
    public CacheStats getStats() {
        check();
        return delegate.getStats();
    }
}
