package ledger.store;

import ledger.Result;
import ledger.model.DomainEvent;
import ledger.model.EventStoreHealth;
import ledger.model.Snapshot;
import ledger.model.StreamSlice;
import ledger.spi.EventStore;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link InMemoryEventStore} wrapper whose appends and reads can be made to throw.
 */
public class StubEventStore implements EventStore {
    private final InMemoryEventStore delegate;
    public volatile RuntimeException appendFailure;
    public volatile RuntimeException readFailure;
    public final AtomicInteger readAllCalls = new AtomicInteger();

    public StubEventStore() {
        this(new InMemoryEventStore());
    }

    public StubEventStore(InMemoryEventStore delegate) {
        this.delegate = delegate;
    }

    @Override
    public Result<List<DomainEvent>> appendBatch(List<DomainEvent> events) {
        if (appendFailure != null) {
            throw appendFailure;
        }
        return delegate.appendBatch(events);
    }

    @Override
    public Result<List<DomainEvent>> appendToStream(String streamId, long expectedVersion, List<DomainEvent> events) {
        if (appendFailure != null) {
            throw appendFailure;
        }
        return delegate.appendToStream(streamId, expectedVersion, events);
    }

    @Override
    public List<DomainEvent> readEventsByType(String eventType, Instant from, Instant to) {
        return delegate.readEventsByType(eventType, from, to);
    }

    @Override
    public List<DomainEvent> readEventsByUserId(String userId, Instant from, Instant to) {
        return delegate.readEventsByUserId(userId, from, to);
    }

    @Override
    public List<DomainEvent> readAllEvents(long afterEventNumber, int maxCount) {
        readAllCalls.incrementAndGet();
        if (readFailure != null) {
            throw readFailure;
        }
        return delegate.readAllEvents(afterEventNumber, maxCount);
    }

    @Override
    public StreamSlice readStream(String streamId, long afterVersion, int maxCount) {
        return delegate.readStream(streamId, afterVersion, maxCount);
    }

    @Override
    public long getStreamVersion(String streamId) {
        return delegate.getStreamVersion(streamId);
    }

    @Override
    public long lastEventNumber() {
        return delegate.lastEventNumber();
    }

    @Override
    public long getEventCount() {
        return delegate.getEventCount();
    }

    @Override
    public long getStreamCount() {
        return delegate.getStreamCount();
    }

    @Override
    public EventStoreHealth getHealthStatus() {
        return delegate.getHealthStatus();
    }

    @Override
    public Result<Void> saveSnapshot(Snapshot snapshot) {
        return delegate.saveSnapshot(snapshot);
    }

    @Override
    public Optional<Snapshot> latestSnapshot(String streamId) {
        return delegate.latestSnapshot(streamId);
    }
}
