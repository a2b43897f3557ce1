package ledger.spi;

import ledger.Result;
import ledger.model.DomainEvent;
import ledger.model.EventStoreHealth;
import ledger.model.Snapshot;
import ledger.model.StreamSlice;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable, append-only log of domain events.
 *
 * <p>Appends assign a global, strictly increasing {@code eventNumber} and a per-stream
 * {@code streamVersion}. An append returns only after the events are durable, and a batch is
 * all-or-nothing: either every event is stored or none is. Appends fail with
 * {@link ledger.ErrorKind#STORAGE} on I/O failure and with {@link ledger.ErrorKind#CONFLICT}
 * when an expected stream version does not match.
 *
 * <p>Reads return finite lists in ascending {@code eventNumber} order. They re-scan the
 * store on every call and never consume events; they may run concurrently with appends
 * and observe every event committed before the read started.
 *
 * <p>Implementations must be thread-safe.
 */
public interface EventStore {

    /** Expected version that skips the optimistic stream version check. */
    long ANY_VERSION = -1L;

    /** Expected version of a stream that must not exist yet. */
    long NO_STREAM = 0L;

    /**
     * Appends one event.
     *
     * @param event the event to append
     * @return the assigned global event number
     */
    default Result<Long> append(DomainEvent event) {
        return appendBatch(List.of(event)).map(stored -> stored.get(0).eventNumber());
    }

    /**
     * Appends events atomically, preserving their relative order.
     *
     * @param events events to append, possibly spanning several streams
     * @return the stored events carrying their assigned positions
     */
    Result<List<DomainEvent>> appendBatch(List<DomainEvent> events);

    /**
     * Appends events to a single stream after checking its current version.
     *
     * @param streamId        target stream; every event must belong to it
     * @param expectedVersion current version the caller last observed, {@link #NO_STREAM}
     *                        for a new stream, or {@link #ANY_VERSION} to skip the check
     * @param events          events to append
     * @return the stored events, or {@code CONFLICT} if the stream moved on
     */
    Result<List<DomainEvent>> appendToStream(String streamId, long expectedVersion, List<DomainEvent> events);

    /**
     * Reads events of one type, optionally bounded by an inclusive {@code occurredAt} range.
     *
     * @param eventType the event type
     * @param from      inclusive lower bound, or {@code null}
     * @param to        inclusive upper bound, or {@code null}
     * @return matching events in ascending event number order
     */
    List<DomainEvent> readEventsByType(String eventType, Instant from, Instant to);

    /**
     * Reads events whose metadata names the given user, optionally bounded by an inclusive
     * {@code occurredAt} range.
     *
     * @param userId the originating user
     * @param from   inclusive lower bound, or {@code null}
     * @param to     inclusive upper bound, or {@code null}
     * @return matching events in ascending event number order
     */
    List<DomainEvent> readEventsByUserId(String userId, Instant from, Instant to);

    /**
     * Reads the global log after a position.
     *
     * @param afterEventNumber exclusive lower bound
     * @param maxCount         maximum number of events to return
     * @return up to {@code maxCount} events in ascending event number order
     */
    List<DomainEvent> readAllEvents(long afterEventNumber, int maxCount);

    /**
     * Reads one stream after a version.
     *
     * @param streamId     the stream
     * @param afterVersion exclusive lower bound on stream version
     * @param maxCount     maximum number of events to return
     * @return the slice, empty if the stream does not exist
     */
    StreamSlice readStream(String streamId, long afterVersion, int maxCount);

    /**
     * Returns the current version of a stream, {@code 0} if it has no events.
     */
    long getStreamVersion(String streamId);

    default boolean streamExists(String streamId) {
        return getStreamVersion(streamId) > 0;
    }

    /**
     * Returns the highest assigned event number, {@code 0} for an empty store.
     */
    long lastEventNumber();

    long getEventCount();

    long getStreamCount();

    /**
     * Returns a cheap diagnostic snapshot. Never throws; an unreachable store reports
     * {@code healthy = false}.
     */
    EventStoreHealth getHealthStatus();

    /**
     * Stores a snapshot, replacing any older snapshot of the same stream version.
     */
    Result<Void> saveSnapshot(Snapshot snapshot);

    /**
     * Returns the snapshot with the highest stream version for a stream.
     */
    Optional<Snapshot> latestSnapshot(String streamId);
}
