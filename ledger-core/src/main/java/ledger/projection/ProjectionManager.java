package ledger.projection;

import ledger.ErrorKind;
import ledger.Result;
import ledger.model.DomainEvent;
import ledger.model.ProjectionState;
import ledger.model.ProjectionStatus;
import ledger.spi.EventStore;
import ledger.spi.MetricsExporter;
import ledger.spi.ProjectionStateStore;
import ledger.util.DaemonThreadFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the registered projections and keeps each one caught up with the event log.
 *
 * <p>Catch-up reads events after the projection's checkpoint in ascending event number
 * order, applies the ones the projection handles, and saves the checkpoint after every
 * applied event. A crash therefore reprocesses at most from the last saved checkpoint and
 * never skips an event. When an apply fails, the failure is recorded and that projection
 * alone is stopped; it stays stopped until {@link #resetProjection(String)}.
 *
 * <p>Each projection has at most one catch-up run active at a time. A catch-up requested
 * while another run holds the projection is not lost: the running thread performs one more
 * pass before it lets go.
 *
 * <p>Catch-up is triggered by the event bus after each publish, by the optional background
 * loop started with {@link #start()}, or directly through {@link #catchUp(String)} and
 * {@link #catchUpAll()}.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized.
 */
public final class ProjectionManager implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ProjectionManager.class.getName());

    private final EventStore eventStore;
    private final ProjectionStateStore stateStore;
    private final MetricsExporter metrics;
    private final int batchSize;
    private final long intervalMs;
    private final Clock clock;
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
    private final Object registrationLock = new Object();

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> catchUpTask;
    private volatile boolean closed;

    private ProjectionManager(Builder builder) {
        this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
        this.stateStore = Objects.requireNonNull(builder.stateStore, "stateStore");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.batchSize = builder.batchSize;
        this.intervalMs = builder.intervalMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers a projection and creates its checkpoint if absent. Projections that are not
     * {@linkplain Projection#durable() durable} have their checkpoint reset to zero so they
     * are rebuilt from the start of the log.
     *
     * @throws IllegalStateException if a projection with the same name is already registered
     */
    public void registerProjection(Projection projection) {
        Objects.requireNonNull(projection, "projection");
        String name = projection.name();
        synchronized (registrationLock) {
            if (registrations.containsKey(name)) {
                throw new IllegalStateException("Projection " + name + " is already registered");
            }
            ProjectionState state = stateStore.register(name);
            if (!projection.durable()) {
                projection.reset();
                stateStore.reset(name);
            } else if (!state.running() && state.errorCount() == 0) {
                stateStore.markRunning(name, true);
            }
            registrations.put(name, new Registration(projection));
        }
        logger.log(Level.INFO, "Registered projection {0} (durable={1})", new Object[]{name, projection.durable()});
    }

    /**
     * Starts the background catch-up loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("ProjectionManager has been closed");
        }
        if (catchUpTask != null) {
            logger.log(Level.WARNING, "ProjectionManager already started");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("ledger-projection-"));
        catchUpTask = scheduler.scheduleWithFixedDelay(this::catchUpAllQuietly, 0L, intervalMs, TimeUnit.MILLISECONDS);
        logger.log(Level.INFO, "ProjectionManager started with {0} projections, interval {1} ms",
                new Object[]{registrations.size(), intervalMs});
    }

    public boolean isStarted() {
        return catchUpTask != null && !closed;
    }

    private void catchUpAllQuietly() {
        try {
            catchUpAll();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Projection catch-up cycle failed", t);
        }
    }

    /**
     * Runs catch-up for every registered projection and refreshes the lag gauge.
     */
    public void catchUpAll() {
        if (closed) {
            return;
        }
        for (String name : new ArrayList<>(registrations.keySet())) {
            catchUp(name);
        }
        recordLag();
    }

    /**
     * Brings one projection up to the end of the log.
     *
     * <p>If another thread is already catching up the projection, this call returns
     * immediately and that thread runs an extra pass.
     *
     * @return the projection state after this call, {@code NOT_FOUND} if the name is not
     *         registered, or {@code STORAGE} if the log could not be read
     */
    public Result<ProjectionState> catchUp(String name) {
        Registration registration = registrations.get(name);
        if (registration == null) {
            return notFound(name);
        }
        Result<Void> outcome = Result.ok(null);
        registration.pending.set(true);
        while (registration.pending.get() && registration.lock.tryLock()) {
            try {
                registration.pending.set(false);
                outcome = runCatchUp(registration);
            } finally {
                registration.lock.unlock();
            }
        }
        if (outcome instanceof Result.Err<Void> err) {
            return err.retype();
        }
        return Result.ok(currentState(name));
    }

    private Result<Void> runCatchUp(Registration registration) {
        Projection projection = registration.projection;
        String name = projection.name();
        ProjectionState state = currentState(name);
        if (!state.running()) {
            return Result.ok(null);
        }
        long checkpoint = state.lastProcessedEventNumber();
        long saved = checkpoint;
        while (true) {
            List<DomainEvent> batch;
            try {
                batch = eventStore.readAllEvents(checkpoint, batchSize);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to read events for projection " + name, e);
                return Result.err(ErrorKind.STORAGE, "Failed to read events: " + e.getMessage());
            }
            if (batch.isEmpty()) {
                break;
            }
            for (DomainEvent event : batch) {
                if (projection.handles(event.eventType())) {
                    try {
                        projection.apply(event);
                    } catch (Exception e) {
                        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
                        logger.log(Level.SEVERE, "Projection " + name + " failed to apply " + event.eventType()
                                + " (eventNumber=" + event.eventNumber() + "); stopping it", e);
                        metrics.incrementProjectionFailure();
                        if (saved != checkpoint) {
                            stateStore.saveCheckpoint(name, checkpoint, clock.instant());
                        }
                        stateStore.recordFailure(name, message);
                        return Result.ok(null);
                    }
                    metrics.incrementProjectionApplied();
                    checkpoint = event.eventNumber();
                    stateStore.saveCheckpoint(name, checkpoint, clock.instant());
                    saved = checkpoint;
                } else {
                    checkpoint = event.eventNumber();
                }
            }
            if (batch.size() < batchSize) {
                break;
            }
        }
        if (saved != checkpoint) {
            stateStore.saveCheckpoint(name, checkpoint, clock.instant());
        }
        return Result.ok(null);
    }

    /**
     * Discards a projection's read model, sets its checkpoint to zero, clears its errors and
     * rebuilds it from the whole event history.
     *
     * <p>Waits for an in-flight catch-up of the same projection to finish first.
     *
     * @return the state after the rebuild, or {@code NOT_FOUND} if the name is not registered
     */
    public Result<ProjectionState> resetProjection(String name) {
        Registration registration = registrations.get(name);
        if (registration == null) {
            return notFound(name);
        }
        registration.lock.lock();
        try {
            registration.projection.reset();
            stateStore.reset(name);
        } finally {
            registration.lock.unlock();
        }
        logger.log(Level.INFO, "Reset projection {0}; rebuilding from the start of the log", name);
        return catchUp(name);
    }

    public ProjectionStatus getProjectionStatus() {
        List<ProjectionState> states = getAllProjections();
        int active = 0;
        long total = 0L;
        for (ProjectionState state : states) {
            if (state.running()) {
                active++;
            }
            total += state.lastProcessedEventNumber();
        }
        return new ProjectionStatus(isStarted(), registrations.size(), active, total);
    }

    /**
     * Returns the state of every registered projection, ordered by name.
     */
    public List<ProjectionState> getAllProjections() {
        List<ProjectionState> states = new ArrayList<>();
        for (ProjectionState state : stateStore.findAll()) {
            if (registrations.containsKey(state.projectionName())) {
                states.add(state);
            }
        }
        return states;
    }

    public Optional<ProjectionState> getProjectionState(String name) {
        if (!registrations.containsKey(name)) {
            return Optional.empty();
        }
        return stateStore.find(name);
    }

    /**
     * Returns a registered projection by name, narrowed to its concrete type.
     */
    public <P extends Projection> Optional<P> getProjection(String name, Class<P> type) {
        Registration registration = registrations.get(name);
        if (registration == null || !type.isInstance(registration.projection)) {
            return Optional.empty();
        }
        return Optional.of(type.cast(registration.projection));
    }

    private void recordLag() {
        long lowest = Long.MAX_VALUE;
        for (ProjectionState state : getAllProjections()) {
            if (state.running()) {
                lowest = Math.min(lowest, state.lastProcessedEventNumber());
            }
        }
        if (lowest == Long.MAX_VALUE) {
            metrics.recordProjectionLag(0L);
            return;
        }
        try {
            metrics.recordProjectionLag(Math.max(0L, eventStore.lastEventNumber() - lowest));
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Could not read last event number for lag metric", e);
        }
    }

    private ProjectionState currentState(String name) {
        return stateStore.find(name).orElseThrow(
                () -> new IllegalStateException("Checkpoint for projection " + name + " is missing"));
    }

    private static <T> Result<T> notFound(String name) {
        return Result.err(ErrorKind.NOT_FOUND, "Projection " + name + " not found");
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (catchUpTask != null) {
            catchUpTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    logger.log(Level.WARNING, "Projection catch-up thread did not terminate in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        logger.log(Level.INFO, "ProjectionManager stopped");
    }

    private static final class Registration {
        private final Projection projection;
        private final ReentrantLock lock = new ReentrantLock();
        private final AtomicBoolean pending = new AtomicBoolean();

        private Registration(Projection projection) {
            this.projection = projection;
        }
    }

    /**
     * Builder for {@link ProjectionManager}.
     */
    public static final class Builder {
        private EventStore eventStore;
        private ProjectionStateStore stateStore;
        private MetricsExporter metrics;
        private int batchSize = 100;
        private long intervalMs = 1000L;
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the event log to read from. Required.
         */
        public Builder eventStore(EventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        /**
         * Sets the checkpoint store. Required.
         */
        public Builder stateStore(ProjectionStateStore stateStore) {
            this.stateStore = stateStore;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Maximum events read per round trip. Optional; defaults to 100.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Delay between background catch-up cycles. Optional; defaults to 1000 ms.
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ProjectionManager build() {
            return new ProjectionManager(this);
        }
    }
}
