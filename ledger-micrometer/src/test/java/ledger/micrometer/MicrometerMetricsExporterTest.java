package ledger.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import ledger.Ledger;
import ledger.cache.MemoryCacheService;
import ledger.habit.HabitModule;
import ledger.habit.InMemoryHabitRepository;
import ledger.habit.InMemoryPlanRepository;
import ledger.habit.Plan;
import ledger.habit.command.CompleteHabitCommand;
import ledger.habit.command.CreateHabitCommand;
import ledger.habit.query.GetHabitAnalyticsQuery;
import ledger.query.QueryOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MicrometerMetricsExporterTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsExporter exporter;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        exporter = new MicrometerMetricsExporter(registry);
    }

    // ── Counters ────────────────────────────────────────────────────

    @Test
    void eventsAppendedCountsEveryEventInTheBatch() {
        exporter.incrementEventsAppended(3);
        exporter.incrementEventsAppended(1);

        assertEquals(4.0, counter("ledger.events.appended").count());
    }

    @Test
    void commandResults() {
        exporter.incrementCommandSuccess();
        exporter.incrementCommandSuccess();
        exporter.incrementCommandFailure();

        assertEquals(2.0, counter("ledger.command.success").count());
        assertEquals(1.0, counter("ledger.command.failure").count());
    }

    @Test
    void queryCacheLookups() {
        exporter.incrementQueryCacheHit();
        exporter.incrementQueryCacheMiss();
        exporter.incrementQueryCacheMiss();
        exporter.incrementQueryCacheError();

        assertEquals(1.0, counter("ledger.query.cache.hit").count());
        assertEquals(2.0, counter("ledger.query.cache.miss").count());
        assertEquals(1.0, counter("ledger.query.cache.error").count());
    }

    @Test
    void failuresAndProjectionActivity() {
        exporter.incrementAppendFailed();
        exporter.incrementHandlerFailure();
        exporter.incrementProjectionApplied();
        exporter.incrementProjectionApplied();
        exporter.incrementProjectionFailure();

        assertEquals(1.0, counter("ledger.events.append.failed").count());
        assertEquals(1.0, counter("ledger.handler.failure").count());
        assertEquals(2.0, counter("ledger.projection.applied").count());
        assertEquals(1.0, counter("ledger.projection.failure").count());
    }

    // ── Gauges ──────────────────────────────────────────────────────

    @Test
    void projectionLagTracksLatestValue() {
        exporter.recordProjectionLag(42L);
        assertEquals(42.0, gauge("ledger.projection.lag").value());

        exporter.recordProjectionLag(-5L);
        assertEquals(0.0, gauge("ledger.projection.lag").value());
    }

    // ── Naming ──────────────────────────────────────────────────────

    @Test
    void customNamePrefix() {
        MicrometerMetricsExporter custom = new MicrometerMetricsExporter(registry, "habits.ledger");
        custom.incrementCommandSuccess();
        custom.recordProjectionLag(7L);

        assertEquals(1.0, counter("habits.ledger.command.success").count());
        assertEquals(7.0, gauge("habits.ledger.projection.lag").value());
        assertEquals(0.0, counter("ledger.command.success").count());
    }

    @Test
    void invalidArgumentsThrow() {
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "ledger."));
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    @Test
    void closeRemovesMetersAndIgnoresLaterUpdates() {
        exporter.close();
        exporter.incrementCommandSuccess();
        exporter.recordProjectionLag(9L);

        assertNull(registry.find("ledger.command.success").counter());
        assertNull(registry.find("ledger.projection.lag").gauge());
        assertFalse(registry.getMeters().stream()
                .anyMatch(m -> m.getId().getName().startsWith("ledger.")));
    }

    // ── Wired into a ledger ─────────────────────────────────────────

    @Test
    void ledgerReportsCommandsEventsQueriesAndProjections() {
        InMemoryPlanRepository plans = new InMemoryPlanRepository();
        plans.create(new Plan("p1", "u1", "Mornings", Instant.parse("2026-03-01T00:00:00Z")));
        MemoryCacheService cache = MemoryCacheService.builder().build();
        Ledger ledger = Ledger.builder()
                .cache(cache)
                .metrics(exporter)
                .module(new HabitModule(new InMemoryHabitRepository(), plans))
                .closeOnShutdown(cache)
                .build();
        try {
            String habitId = ledger.commandBus()
                    .dispatch(new CreateHabitCommand("u1", "p1", "Read", null))
                    .orElseThrow();
            ledger.commandBus().dispatch(new CompleteHabitCommand("u1", habitId, null));
            ledger.commandBus().dispatch(new CompleteHabitCommand("u1", "missing", null));
            ledger.queryBus().dispatch(new GetHabitAnalyticsQuery("u1"), QueryOptions.cached());
            ledger.queryBus().dispatch(new GetHabitAnalyticsQuery("u1"), QueryOptions.cached());
            ledger.projectionManager().catchUpAll();

            assertEquals(2.0, counter("ledger.command.success").count());
            assertEquals(1.0, counter("ledger.command.failure").count());
            assertEquals(2.0, counter("ledger.events.appended").count());
            assertEquals(1.0, counter("ledger.query.cache.miss").count());
            assertEquals(1.0, counter("ledger.query.cache.hit").count());
            assertEquals(2.0, counter("ledger.projection.applied").count());
            assertEquals(0.0, gauge("ledger.projection.lag").value());
        } finally {
            ledger.close();
        }

        assertNull(registry.find("ledger.command.success").counter());
    }

    private Counter counter(String name) {
        Counter c = registry.find(name).counter();
        assertNotNull(c, "Counter not found: " + name);
        return c;
    }

    private Gauge gauge(String name) {
        Gauge g = registry.find(name).gauge();
        assertNotNull(g, "Gauge not found: " + name);
        return g;
    }
}
