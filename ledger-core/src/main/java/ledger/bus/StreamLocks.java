package ledger.bus;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per stream id, created on first use and dropped when its last holder or
 * waiter leaves.
 */
final class StreamLocks {
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    <T> T withLock(String streamId, Supplier<T> work) {
        Objects.requireNonNull(streamId, "streamId");
        Entry entry = entries.compute(streamId, (id, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return work.get();
        } finally {
            entry.lock.unlock();
            entries.computeIfPresent(streamId, (id, e) -> --e.users == 0 ? null : e);
        }
    }

    int size() {
        return entries.size();
    }

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        int users;
    }
}
