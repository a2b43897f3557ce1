package ledger.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import ledger.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsExporter} that publishes ledger activity to a Micrometer {@link MeterRegistry}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code ledger.events.appended}: events durably appended</li>
 *   <li>{@code ledger.events.append.failed}: batches the event store rejected</li>
 *   <li>{@code ledger.handler.failure}: event handler invocations that threw</li>
 *   <li>{@code ledger.command.success} and {@code ledger.command.failure}: command results</li>
 *   <li>{@code ledger.query.cache.hit}, {@code .miss} and {@code .error}: query cache lookups</li>
 *   <li>{@code ledger.projection.applied} and {@code ledger.projection.failure}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code ledger.projection.lag}: highest event number minus the lowest running checkpoint</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter eventsAppended;
    private final Counter appendFailed;
    private final Counter handlerFailure;
    private final Counter commandSuccess;
    private final Counter commandFailure;
    private final Counter cacheHit;
    private final Counter cacheMiss;
    private final Counter cacheError;
    private final Counter projectionApplied;
    private final Counter projectionFailure;
    private final Gauge lagGauge;

    private final AtomicLong projectionLag = new AtomicLong();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "ledger"}.
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "ledger");
    }

    /**
     * Creates an exporter with a custom metric name prefix, for running several ledgers
     * against one registry.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "habits.ledger"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.eventsAppended = counter(namePrefix + ".events.appended", "Events durably appended");
        this.appendFailed = counter(namePrefix + ".events.append.failed", "Event batches rejected by the store");
        this.handlerFailure = counter(namePrefix + ".handler.failure", "Event handler invocations that threw");
        this.commandSuccess = counter(namePrefix + ".command.success", "Commands that returned Ok");
        this.commandFailure = counter(namePrefix + ".command.failure", "Commands that returned an error");
        this.cacheHit = counter(namePrefix + ".query.cache.hit", "Query results served from cache");
        this.cacheMiss = counter(namePrefix + ".query.cache.miss", "Query results computed by the handler");
        this.cacheError = counter(namePrefix + ".query.cache.error", "Cache failures treated as a miss");
        this.projectionApplied = counter(namePrefix + ".projection.applied", "Events applied to projections");
        this.projectionFailure = counter(namePrefix + ".projection.failure", "Projections stopped by a failure");

        this.lagGauge = Gauge.builder(namePrefix + ".projection.lag", projectionLag, AtomicLong::get)
                .description("Events the slowest running projection trails the log by")
                .register(registry);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }

    @Override
    public void incrementEventsAppended(int count) {
        if (closed) return;
        eventsAppended.increment(count);
    }

    @Override
    public void incrementAppendFailed() {
        if (closed) return;
        appendFailed.increment();
    }

    @Override
    public void incrementHandlerFailure() {
        if (closed) return;
        handlerFailure.increment();
    }

    @Override
    public void incrementCommandSuccess() {
        if (closed) return;
        commandSuccess.increment();
    }

    @Override
    public void incrementCommandFailure() {
        if (closed) return;
        commandFailure.increment();
    }

    @Override
    public void incrementQueryCacheHit() {
        if (closed) return;
        cacheHit.increment();
    }

    @Override
    public void incrementQueryCacheMiss() {
        if (closed) return;
        cacheMiss.increment();
    }

    @Override
    public void incrementQueryCacheError() {
        if (closed) return;
        cacheError.increment();
    }

    @Override
    public void incrementProjectionApplied() {
        if (closed) return;
        projectionApplied.increment();
    }

    @Override
    public void incrementProjectionFailure() {
        if (closed) return;
        projectionFailure.increment();
    }

    @Override
    public void recordProjectionLag(long lag) {
        if (closed) return;
        projectionLag.set(Math.max(0L, lag));
    }

    /**
     * Removes every meter this exporter registered, so a closed ledger leaves no stale gauge.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(eventsAppended, appendFailed, handlerFailure,
                commandSuccess, commandFailure, cacheHit, cacheMiss, cacheError,
                projectionApplied, projectionFailure, lagGauge)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
