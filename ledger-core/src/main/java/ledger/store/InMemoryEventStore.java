package ledger.store;

import ledger.ErrorKind;
import ledger.Result;
import ledger.model.DomainEvent;
import ledger.model.EventStoreHealth;
import ledger.model.Snapshot;
import ledger.model.StreamSlice;
import ledger.spi.EventStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local {@link EventStore}, suitable for tests and single-process deployments that do
 * not need durability across restarts.
 *
 * <p>Appends are serialized by a single writer lock and published to readers in one step,
 * so a batch is either fully visible or not visible at all. Reads never take the lock.
 */
public final class InMemoryEventStore implements EventStore {
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final CopyOnWriteArrayList<DomainEvent> log = new CopyOnWriteArrayList<>();
    private final Map<String, CopyOnWriteArrayList<DomainEvent>> streams = new ConcurrentHashMap<>();
    private final Map<String, Snapshot> snapshots = new ConcurrentHashMap<>();

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Result<List<DomainEvent>> appendBatch(List<DomainEvent> events) {
        return appendInternal(null, ANY_VERSION, events);
    }

    @Override
    public Result<List<DomainEvent>> appendToStream(String streamId, long expectedVersion, List<DomainEvent> events) {
        Objects.requireNonNull(streamId, "streamId");
        return appendInternal(streamId, expectedVersion, events);
    }

    private Result<List<DomainEvent>> appendInternal(String streamId, long expectedVersion,
                                                     List<DomainEvent> events) {
        Result<Void> validation = EventBatches.validate(streamId, events);
        if (validation instanceof Result.Err<Void> err) {
            return err.retype();
        }
        if (events.isEmpty()) {
            return Result.ok(List.of());
        }
        writeLock.lock();
        try {
            if (streamId != null && expectedVersion != ANY_VERSION) {
                long current = getStreamVersion(streamId);
                if (current != expectedVersion) {
                    return Result.err(ErrorKind.CONFLICT, EventBatches.versionConflict(streamId, expectedVersion, current));
                }
            }
            long nextNumber = log.size() + 1L;
            Map<String, Long> versions = new HashMap<>();
            List<DomainEvent> stored = new ArrayList<>(events.size());
            for (DomainEvent event : events) {
                long version = versions.computeIfAbsent(event.streamId(), this::getStreamVersion) + 1;
                versions.put(event.streamId(), version);
                stored.add(event.withPosition(nextNumber++, version));
            }
            // Stream indexes are updated before the global log, so any event visible in the
            // log is also visible through readStream.
            for (DomainEvent event : stored) {
                streams.computeIfAbsent(event.streamId(), ignored -> new CopyOnWriteArrayList<>()).add(event);
            }
            log.addAll(stored);
            return Result.ok(List.copyOf(stored));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<DomainEvent> readEventsByType(String eventType, Instant from, Instant to) {
        Objects.requireNonNull(eventType, "eventType");
        List<DomainEvent> result = new ArrayList<>();
        for (DomainEvent event : log) {
            if (eventType.equals(event.eventType()) && EventBatches.inRange(event, from, to)) {
                result.add(event);
            }
        }
        return result;
    }

    @Override
    public List<DomainEvent> readEventsByUserId(String userId, Instant from, Instant to) {
        Objects.requireNonNull(userId, "userId");
        List<DomainEvent> result = new ArrayList<>();
        for (DomainEvent event : log) {
            if (userId.equals(event.userId()) && EventBatches.inRange(event, from, to)) {
                result.add(event);
            }
        }
        return result;
    }

    @Override
    public List<DomainEvent> readAllEvents(long afterEventNumber, int maxCount) {
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be > 0");
        }
        // Event numbers are dense and start at 1, so position n lives at index n - 1.
        Object[] snapshot = log.toArray();
        int from = (int) Math.max(0L, Math.min(afterEventNumber, snapshot.length));
        int to = (int) Math.min(snapshot.length, (long) from + maxCount);
        List<DomainEvent> result = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            result.add((DomainEvent) snapshot[i]);
        }
        return result;
    }

    @Override
    public StreamSlice readStream(String streamId, long afterVersion, int maxCount) {
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be > 0");
        }
        List<DomainEvent> stream = streams.get(streamId);
        if (stream == null) {
            return new StreamSlice(streamId, List.of(), 0L, false);
        }
        Object[] snapshot = stream.toArray();
        int from = (int) Math.max(0L, Math.min(afterVersion, snapshot.length));
        int to = (int) Math.min(snapshot.length, (long) from + maxCount);
        List<DomainEvent> events = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            events.add((DomainEvent) snapshot[i]);
        }
        return new StreamSlice(streamId, events, snapshot.length, to < snapshot.length);
    }

    @Override
    public long getStreamVersion(String streamId) {
        List<DomainEvent> stream = streams.get(streamId);
        return stream == null ? 0L : stream.size();
    }

    @Override
    public long lastEventNumber() {
        return log.size();
    }

    @Override
    public long getEventCount() {
        return log.size();
    }

    @Override
    public long getStreamCount() {
        return streams.size();
    }

    @Override
    public EventStoreHealth getHealthStatus() {
        Object[] snapshot = log.toArray();
        Instant oldest = null;
        Instant newest = null;
        for (Object o : snapshot) {
            Instant at = ((DomainEvent) o).occurredAt();
            if (oldest == null || at.isBefore(oldest)) {
                oldest = at;
            }
            if (newest == null || at.isAfter(newest)) {
                newest = at;
            }
        }
        return new EventStoreHealth(true, snapshot.length, streams.size(), oldest, newest, clock.instant());
    }

    @Override
    public Result<Void> saveSnapshot(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        long current = getStreamVersion(snapshot.streamId());
        if (snapshot.streamVersion() > current) {
            return Result.err(ErrorKind.VALIDATION, "Snapshot version " + snapshot.streamVersion()
                    + " is ahead of stream " + snapshot.streamId() + " at version " + current);
        }
        snapshots.merge(snapshot.streamId(), snapshot,
                (existing, candidate) -> candidate.streamVersion() >= existing.streamVersion() ? candidate : existing);
        return Result.ok(null);
    }

    @Override
    public Optional<Snapshot> latestSnapshot(String streamId) {
        return Optional.ofNullable(snapshots.get(streamId));
    }

    /**
     * Returns every stored event in global order.
     */
    public List<DomainEvent> allEvents() {
        return List.copyOf(log);
    }
}
