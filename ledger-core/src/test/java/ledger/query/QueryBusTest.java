package ledger.query;

import ledger.CountingMetrics;
import ledger.ErrorKind;
import ledger.model.CacheStats;
import ledger.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryBusTest {
    private final FlakyCache cache = new FlakyCache();
    private final CountingMetrics metrics = new CountingMetrics();
    private final AtomicInteger calls = new AtomicInteger();
    private final QueryBus bus = QueryBus.builder().cache(cache).metrics(metrics).build();

    record Count(String userId, String habitId) implements Query<Integer> {
        @Override
        public Map<String, String> cacheArguments() {
            return Query.arguments("userId", userId, "habitId", habitId);
        }
    }

    record Global(String term) implements Query<String> {
        @Override
        public Map<String, String> cacheArguments() {
            return Query.arguments("term", term);
        }
    }

    private void registerCounter() {
        bus.register(Count.class, query -> calls.incrementAndGet());
    }

    // ── Dispatch ────────────────────────────────────────────────────

    @Test
    void uncachedDispatchAlwaysRunsHandler() {
        registerCounter();

        bus.dispatch(new Count("u1", "h1"));
        bus.dispatch(new Count("u1", "h1"));

        assertEquals(2, calls.get());
        assertEquals(0, cache.sets.get());
    }

    @Test
    void cachedDispatchReadsThrough() {
        registerCounter();

        assertEquals(1, bus.dispatch(new Count("u1", "h1"), QueryOptions.cached()));
        assertEquals(1, bus.dispatch(new Count("u1", "h1"), QueryOptions.cached()));
        assertEquals(2, bus.dispatch(new Count("u1", "h2"), QueryOptions.cached()));

        assertEquals(2, calls.get());
        assertEquals(1, metrics.cacheHits.get());
        assertEquals(2, metrics.cacheMisses.get());
    }

    @Test
    void explicitCacheKeyIsUsed() {
        registerCounter();

        bus.dispatch(new Count("u1", "h1"), QueryOptions.cached(Duration.ofSeconds(30)).withCacheKey("custom"));

        assertTrue(cache.delegate.exists("custom"));
    }

    @Test
    void nullResultsAreNotCached() {
        bus.register(Global.class, query -> null);

        assertNull(bus.dispatch(new Global("x"), QueryOptions.cached()));

        assertEquals(0, cache.sets.get());
    }

    @Test
    void unregisteredQueryThrows() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> bus.dispatch(new Global("x")));

        assertEquals("No handler registered for query type: Global", ex.getMessage());
    }

    @Test
    void duplicateRegistrationThrows() {
        registerCounter();

        assertThrows(IllegalStateException.class, () -> bus.register(Count.class, query -> 0));
    }

    @Test
    void expectedFailurePropagatesUnchanged() {
        bus.register(Global.class, query -> {
            throw new QueryException(ErrorKind.VALIDATION, "Search term is required");
        });

        QueryException ex = assertThrows(QueryException.class, () -> bus.dispatch(new Global("")));

        assertEquals(ErrorKind.VALIDATION, ex.kind());
        assertEquals("Search term is required", ex.getMessage());
    }

    @Test
    void unexpectedFailureIsWrappedAsInternal() {
        bus.register(Global.class, query -> {
            throw new IllegalStateException("secret detail");
        });

        QueryException ex = assertThrows(QueryException.class, () -> bus.dispatch(new Global("x")));

        assertEquals(ErrorKind.INTERNAL, ex.kind());
        assertEquals("Internal server error", ex.getMessage());
    }

    // ── Fail-open cache ─────────────────────────────────────────────

    @Test
    void unreachableCacheFallsBackToHandler() {
        registerCounter();
        cache.down = true;

        assertEquals(1, bus.dispatch(new Count("u1", "h1"), QueryOptions.cached()));
        assertEquals(2, bus.dispatch(new Count("u1", "h1"), QueryOptions.cached()));

        assertTrue(metrics.cacheErrors.get() >= 2);
        assertEquals(0L, bus.invalidateCache());
        assertEquals(CacheStats.DISCONNECTED, bus.getCacheStats().connectionStatus());
    }

    @Test
    void busWithoutCacheNeverCaches() {
        QueryBus plain = QueryBus.builder().build();
        plain.register(Count.class, query -> calls.incrementAndGet());

        plain.dispatch(new Count("u1", "h1"), QueryOptions.cached());
        plain.dispatch(new Count("u1", "h1"), QueryOptions.cached());

        assertEquals(2, calls.get());
        assertEquals(0L, plain.invalidateCacheForUser("u1"));
    }

    // ── Invalidation ────────────────────────────────────────────────

    @Test
    void userInvalidationDropsOnlyThatUsersEntries() {
        registerCounter();
        bus.dispatch(new Count("u1", "h1"), QueryOptions.cached());
        bus.dispatch(new Count("u2", "h1"), QueryOptions.cached());

        assertEquals(1L, bus.invalidateCacheForUser("u1"));

        assertEquals(3, bus.dispatch(new Count("u1", "h1"), QueryOptions.cached()));
        assertEquals(2, bus.dispatch(new Count("u2", "h1"), QueryOptions.cached()));
    }

    @Test
    void patternInvalidationDefaultsToAllQueries() {
        registerCounter();
        bus.register(Global.class, query -> "result");
        bus.dispatch(new Count("u1", "h1"), QueryOptions.cached());
        bus.dispatch(new Global("x"), QueryOptions.cached());
        cache.delegate.set("other:key", "kept", 60);

        assertEquals(2L, bus.invalidateCache(null));
        assertTrue(cache.delegate.exists("other:key"));
    }

    @Test
    void invalidationDuringHandlerPreventsStaleWrite() {
        bus.register(Count.class, query -> {
            int value = calls.incrementAndGet();
            bus.invalidateCacheForUser("u1");
            return value;
        });

        bus.dispatch(new Count("u1", "h1"), QueryOptions.cached());

        String key = CacheKeys.queryKey(new Count("u1", "h1"), JsonCodec.getDefault());
        assertFalse(cache.delegate.exists(key));
        assertEquals(0, cache.sets.get());
    }
}
