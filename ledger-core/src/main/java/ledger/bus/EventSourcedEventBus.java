package ledger.bus;

import ledger.ErrorKind;
import ledger.EventHandler;
import ledger.Result;
import ledger.model.DomainEvent;
import ledger.model.StreamSlice;
import ledger.registry.DefaultHandlerRegistry;
import ledger.spi.EventStore;
import ledger.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventBus} that appends every published batch to an {@link EventStore} before
 * dispatching it.
 *
 * <p>Dispatch runs on the publishing thread. For each event, type-specific handlers run in
 * registration order, then wildcard handlers. A handler that throws is logged and counted;
 * the remaining handlers still run and the publish still succeeds. After all handlers for a
 * batch have run, registered {@link PublishListener}s are notified; the ledger uses this to
 * trigger projection catch-up.
 *
 * <p>Store rejections such as {@code VALIDATION} or {@code CONFLICT} are returned with their
 * kind; an exception thrown by the store is reported as {@code STORAGE}.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class EventSourcedEventBus implements EventBus {
    private static final Logger logger = Logger.getLogger(EventSourcedEventBus.class.getName());
    private static final int REPLAY_PAGE_SIZE = 500;

    private final EventStore eventStore;
    private final DefaultHandlerRegistry registry;
    private final MetricsExporter metrics;
    private final List<PublishListener> publishListeners = new CopyOnWriteArrayList<>();
    private final StreamLocks streamLocks = new StreamLocks();

    private EventSourcedEventBus(Builder builder) {
        this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
        this.registry = builder.registry != null ? builder.registry : new DefaultHandlerRegistry();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Result<List<DomainEvent>> publishEvents(List<DomainEvent> events) {
        if (events == null) {
            return Result.err(ErrorKind.VALIDATION, "events cannot be null");
        }
        return storeAndDispatch(events, () -> eventStore.appendBatch(events));
    }

    @Override
    public Result<List<DomainEvent>> publishToStream(String streamId, long expectedVersion, List<DomainEvent> events) {
        if (streamId == null || events == null) {
            return Result.err(ErrorKind.VALIDATION, "streamId and events are required");
        }
        return storeAndDispatch(events, () -> eventStore.appendToStream(streamId, expectedVersion, events));
    }

    @Override
    public long streamVersion(String streamId) {
        return eventStore.getStreamVersion(Objects.requireNonNull(streamId, "streamId"));
    }

    @Override
    public <T> Result<T> withStreamLock(String streamId, Supplier<Result<T>> write) {
        Objects.requireNonNull(write, "write");
        return streamLocks.withLock(streamId, write);
    }

    // Store errors keep their kind; only an exception from the store becomes STORAGE.
    private Result<List<DomainEvent>> storeAndDispatch(List<DomainEvent> events,
                                                       Supplier<Result<List<DomainEvent>>> append) {
        if (events.isEmpty()) {
            return Result.ok(List.of());
        }
        Result<List<DomainEvent>> appended;
        try {
            appended = append.get();
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to append " + events.size() + " events", e);
            appended = Result.err(ErrorKind.STORAGE, "Failed to store events: " + e.getMessage());
        }
        if (appended instanceof Result.Err<List<DomainEvent>> err) {
            metrics.incrementAppendFailed();
            logger.log(Level.WARNING, "Event batch of {0} rejected by store ({1}): {2}",
                    new Object[]{events.size(), err.kind(), err.message()});
            return err;
        }
        List<DomainEvent> stored = appended.orElseThrow();
        metrics.incrementEventsAppended(stored.size());

        for (DomainEvent event : stored) {
            dispatch(event);
        }
        for (PublishListener listener : publishListeners) {
            try {
                listener.onPublished(stored);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Publish listener failed", e);
            }
        }
        return Result.ok(stored);
    }

    private void dispatch(DomainEvent event) {
        for (EventHandler handler : registry.handlersFor(event.eventType())) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                metrics.incrementHandlerFailure();
                logger.log(Level.SEVERE, "Event handler failed for " + event.eventType()
                        + " (eventNumber=" + event.eventNumber() + ")", e);
            }
        }
    }

    @Override
    public void subscribe(String eventType, EventHandler handler) {
        registry.register(eventType, handler);
        logger.log(Level.FINE, "Subscribed handler to {0}", eventType);
    }

    @Override
    public boolean unsubscribe(String eventType, EventHandler handler) {
        return registry.unregister(eventType, handler);
    }

    @Override
    public Map<String, Integer> getRegisteredHandlers() {
        return registry.handlerCounts();
    }

    @Override
    public List<DomainEvent> replayStream(String streamId) {
        Objects.requireNonNull(streamId, "streamId");
        List<DomainEvent> events = new ArrayList<>();
        long after = 0L;
        while (true) {
            StreamSlice slice = eventStore.readStream(streamId, after, REPLAY_PAGE_SIZE);
            events.addAll(slice.events());
            if (!slice.hasMoreEvents() || slice.events().isEmpty()) {
                return events;
            }
            after = slice.lastVersionRead();
        }
    }

    int heldStreamLocks() {
        return streamLocks.size();
    }

    /**
     * Adds a callback notified after each stored and dispatched batch.
     */
    public void addPublishListener(PublishListener listener) {
        publishListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Builder for {@link EventSourcedEventBus}.
     */
    public static final class Builder {
        private EventStore eventStore;
        private DefaultHandlerRegistry registry;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the store every published batch is appended to. Required.
         */
        public Builder eventStore(EventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        /**
         * Sets a pre-populated handler registry. Optional; defaults to an empty registry.
         */
        public Builder registry(DefaultHandlerRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public EventSourcedEventBus build() {
            return new EventSourcedEventBus(this);
        }
    }
}
