package ledger.model;

import java.time.Instant;

/**
 * Diagnostic snapshot of an event store.
 *
 * <p>{@code healthy} reflects whether the backing storage could be reached, not whether its
 * data is correct. The timestamps are {@code null} when the store is empty or unreachable.
 */
public record EventStoreHealth(
        boolean healthy,
        long eventCount,
        long streamCount,
        Instant oldestEvent,
        Instant newestEvent,
        Instant lastCheckTime) {

    public static EventStoreHealth unreachable(Instant checkTime) {
        return new EventStoreHealth(false, 0L, 0L, null, null, checkTime);
    }
}
