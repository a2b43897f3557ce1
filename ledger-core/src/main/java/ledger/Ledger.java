package ledger;

import ledger.bus.EventBus;
import ledger.bus.EventSourcedEventBus;
import ledger.command.CommandBus;
import ledger.model.DomainEvent;
import ledger.projection.ProjectionManager;
import ledger.query.QueryBus;
import ledger.registry.DefaultHandlerRegistry;
import ledger.spi.CacheService;
import ledger.spi.EventStore;
import ledger.spi.MetricsExporter;
import ledger.spi.ProjectionStateStore;
import ledger.store.InMemoryEventStore;
import ledger.store.InMemoryProjectionStateStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Explicit application context that wires an {@link EventStore}, {@link EventSourcedEventBus},
 * {@link ProjectionManager}, {@link CommandBus} and {@link QueryBus} into a single
 * {@link AutoCloseable} unit.
 *
 * <p>Besides construction, the ledger connects the components:
 * <ul>
 *   <li>every stored event batch triggers a catch-up of all projections;</li>
 *   <li>every command that succeeded, or failed with {@code STORAGE} after possibly storing
 *       something, invalidates the issuing user's cached queries.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Ledger ledger = Ledger.builder()
 *     .eventStore(eventStore)
 *     .cache(MemoryCacheService.create())
 *     .module(new HabitModule(habits, plans))
 *     .build()) {
 *   ledger.start();
 *   Result<String> id = ledger.commandBus().dispatch(new CreateHabitCommand(userId, planId, "Read", null));
 * }
 * }</pre>
 *
 * <p>Each ledger is independent; nothing is shared between instances.
 */
public final class Ledger implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(Ledger.class.getName());

    private final EventStore eventStore;
    private final EventSourcedEventBus eventBus;
    private final ProjectionManager projectionManager;
    private final CommandBus commandBus;
    private final QueryBus queryBus;
    private final CacheService cache;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final List<AutoCloseable> ownedResources;

    private Ledger(Builder builder) {
        this.eventStore = builder.eventStore != null ? builder.eventStore : new InMemoryEventStore();
        ProjectionStateStore stateStore = builder.stateStore != null
                ? builder.stateStore : new InMemoryProjectionStateStore();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.cache = builder.cache;
        this.ownedResources = List.copyOf(builder.ownedResources);

        this.eventBus = EventSourcedEventBus.builder()
                .eventStore(eventStore)
                .registry(new DefaultHandlerRegistry())
                .metrics(metrics)
                .build();
        this.projectionManager = ProjectionManager.builder()
                .eventStore(eventStore)
                .stateStore(stateStore)
                .metrics(metrics)
                .batchSize(builder.projectionBatchSize)
                .intervalMs(builder.projectionIntervalMs)
                .clock(clock)
                .build();
        this.commandBus = CommandBus.builder().metrics(metrics).build();
        this.queryBus = QueryBus.builder()
                .cache(cache)
                .metrics(metrics)
                .defaultCacheTime(builder.defaultCacheTime)
                .build();

        eventBus.addPublishListener(this::onPublished);
        commandBus.addListener((command, result) -> {
            boolean mayHaveStored = result.isOk()
                    || (result instanceof Result.Err<?> err && err.kind() == ErrorKind.STORAGE);
            if (mayHaveStored && command.userId() != null) {
                queryBus.invalidateCacheForUser(command.userId());
            }
        });
        for (LedgerModule module : builder.modules) {
            module.register(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private void onPublished(List<DomainEvent> events) {
        projectionManager.catchUpAll();
    }

    /**
     * Brings every projection up to date, then starts the background catch-up loop.
     */
    public void start() {
        projectionManager.catchUpAll();
        projectionManager.start();
        logger.log(Level.INFO, "Ledger started: commands={0}, handlers={1}",
                new Object[]{commandBus.registeredCommandTypes(), eventBus.getRegisteredHandlers()});
    }

    public EventStore eventStore() {
        return eventStore;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public ProjectionManager projectionManager() {
        return projectionManager;
    }

    public CommandBus commandBus() {
        return commandBus;
    }

    public QueryBus queryBus() {
        return queryBus;
    }

    /**
     * Returns the configured cache, or {@code null} when queries are never cached.
     */
    public CacheService cache() {
        return cache;
    }

    public MetricsExporter metrics() {
        return metrics;
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Stops the projection manager, then closes the resources handed over with
     * {@link Builder#closeOnShutdown(AutoCloseable)} in registration order.
     */
    @Override
    public void close() {
        RuntimeException first = null;
        try {
            projectionManager.close();
        } catch (RuntimeException e) {
            first = e;
        }
        for (AutoCloseable resource : ownedResources) {
            try {
                resource.close();
            } catch (Exception e) {
                RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
                if (first == null) first = re; else first.addSuppressed(re);
            }
        }
        if (metrics instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
                if (first == null) first = re; else first.addSuppressed(re);
            }
        }
        if (first != null) {
            throw first;
        }
    }

    /**
     * Builder for {@link Ledger}.
     */
    public static final class Builder {
        private EventStore eventStore;
        private ProjectionStateStore stateStore;
        private CacheService cache;
        private MetricsExporter metrics;
        private Clock clock;
        private int projectionBatchSize = 100;
        private long projectionIntervalMs = 1000L;
        private Duration defaultCacheTime = Duration.ofSeconds(300);
        private final List<LedgerModule> modules = new ArrayList<>();
        private final List<AutoCloseable> ownedResources = new ArrayList<>();

        private Builder() {
        }

        /**
         * Sets the event log. Optional; defaults to an {@link InMemoryEventStore}.
         */
        public Builder eventStore(EventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        /**
         * Sets the projection checkpoint store. Optional; defaults to an
         * {@link InMemoryProjectionStateStore}.
         */
        public Builder stateStore(ProjectionStateStore stateStore) {
            this.stateStore = stateStore;
            return this;
        }

        /**
         * Sets the query cache. Optional; without one, queries are never cached.
         */
        public Builder cache(CacheService cache) {
            this.cache = cache;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder projectionBatchSize(int projectionBatchSize) {
            this.projectionBatchSize = projectionBatchSize;
            return this;
        }

        public Builder projectionIntervalMs(long projectionIntervalMs) {
            this.projectionIntervalMs = projectionIntervalMs;
            return this;
        }

        public Builder defaultCacheTime(Duration defaultCacheTime) {
            this.defaultCacheTime = Objects.requireNonNull(defaultCacheTime, "defaultCacheTime");
            return this;
        }

        /**
         * Adds a module; modules register in the order they are added.
         */
        public Builder module(LedgerModule module) {
            modules.add(Objects.requireNonNull(module, "module"));
            return this;
        }

        /**
         * Hands a resource over to the ledger, which closes it on {@link Ledger#close()}.
         */
        public Builder closeOnShutdown(AutoCloseable resource) {
            ownedResources.add(Objects.requireNonNull(resource, "resource"));
            return this;
        }

        public Ledger build() {
            return new Ledger(this);
        }
    }
}
