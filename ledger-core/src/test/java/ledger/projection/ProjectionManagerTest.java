package ledger.projection;

import ledger.CountingMetrics;
import ledger.ErrorKind;
import ledger.MutableClock;
import ledger.Result;
import ledger.model.DomainEvent;
import ledger.model.ProjectionState;
import ledger.model.ProjectionStatus;
import ledger.store.InMemoryProjectionStateStore;
import ledger.store.StubEventStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static ledger.store.Events.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProjectionManagerTest {
    private final StubEventStore store = new StubEventStore();
    private final InMemoryProjectionStateStore stateStore = new InMemoryProjectionStateStore();
    private final CountingMetrics metrics = new CountingMetrics();
    private final MutableClock clock = MutableClock.at("2026-03-02T08:00:00Z");
    private final ProjectionManager manager = ProjectionManager.builder()
            .eventStore(store)
            .stateStore(stateStore)
            .metrics(metrics)
            .batchSize(10)
            .intervalMs(20)
            .clock(clock)
            .build();

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private void appendCompletions(int count) {
        for (int i = 0; i < count; i++) {
            store.append(event("HabitCompleted", "h" + (i % 3)));
        }
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsNonPositiveBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> ProjectionManager.builder()
                .eventStore(store).stateStore(stateStore).batchSize(0).build());
    }

    @Test
    void builderRequiresStores() {
        assertThrows(NullPointerException.class, () -> ProjectionManager.builder().stateStore(stateStore).build());
        assertThrows(NullPointerException.class, () -> ProjectionManager.builder().eventStore(store).build());
    }

    // ── Registration ────────────────────────────────────────────────

    @Test
    void duplicateRegistrationIsRejected() {
        manager.registerProjection(new CountingProjection("Counter"));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> manager.registerProjection(new CountingProjection("Counter")));
        assertEquals("Projection Counter is already registered", ex.getMessage());
    }

    @Test
    void nonDurableProjectionRestartsFromZero() {
        stateStore.register("Counter");
        stateStore.saveCheckpoint("Counter", 42L, clock.instant());

        manager.registerProjection(new CountingProjection("Counter"));

        assertEquals(0L, manager.getProjectionState("Counter").orElseThrow().lastProcessedEventNumber());
    }

    @Test
    void durableProjectionResumesFromCheckpoint() {
        appendCompletions(5);
        stateStore.register("Durable");
        stateStore.saveCheckpoint("Durable", 3L, clock.instant());
        CountingProjection projection = new CountingProjection("Durable", true);

        manager.registerProjection(projection);
        manager.catchUp("Durable");

        assertEquals(2, projection.applied.size());
        assertEquals(List.of(4L, 5L), projection.applied);
    }

    // ── Catch-up ────────────────────────────────────────────────────

    @Test
    void catchUpAppliesEventsInOrderAcrossBatches() {
        appendCompletions(25);
        CountingProjection projection = new CountingProjection("Counter");
        manager.registerProjection(projection);

        Result<ProjectionState> result = manager.catchUp("Counter");

        assertEquals(25L, result.orElseThrow().lastProcessedEventNumber());
        assertEquals(25, projection.applied.size());
        for (int i = 0; i < 25; i++) {
            assertEquals(i + 1L, projection.applied.get(i));
        }
        assertEquals(25, metrics.projectionApplied.get());
    }

    @Test
    void unhandledEventsStillAdvanceCheckpoint() {
        store.append(event("HabitCreated", "h1"));
        store.append(event("HabitCompleted", "h1"));
        store.append(event("HabitCreated", "h2"));
        CountingProjection projection = new CountingProjection("Counter");
        manager.registerProjection(projection);

        ProjectionState state = manager.catchUp("Counter").orElseThrow();

        assertEquals(List.of(2L), projection.applied);
        assertEquals(3L, state.lastProcessedEventNumber());
    }

    @Test
    void catchUpIsIdempotent() {
        appendCompletions(3);
        CountingProjection projection = new CountingProjection("Counter");
        manager.registerProjection(projection);

        manager.catchUp("Counter");
        manager.catchUp("Counter");

        assertEquals(3, projection.applied.size());
    }

    @Test
    void unknownProjectionIsNotFound() {
        Result<ProjectionState> result = manager.catchUp("Missing");

        Result.Err<ProjectionState> err = (Result.Err<ProjectionState>) result;
        assertEquals(ErrorKind.NOT_FOUND, err.kind());
        assertEquals("Projection Missing not found", err.message());
        assertFalse(manager.resetProjection("Missing").isOk());
    }

    @Test
    void readFailureIsReportedAsStorage() {
        manager.registerProjection(new CountingProjection("Counter"));
        store.readFailure = new IllegalStateException("database down");

        Result<ProjectionState> result = manager.catchUp("Counter");

        assertEquals(ErrorKind.STORAGE, ((Result.Err<ProjectionState>) result).kind());
    }

    // ── Failures ────────────────────────────────────────────────────

    @Test
    void failingEventStopsProjectionAtPreviousCheckpoint() {
        appendCompletions(5);
        CountingProjection projection = new CountingProjection("Counter");
        projection.failOn = 3L;
        manager.registerProjection(projection);

        ProjectionState state = manager.catchUp("Counter").orElseThrow();

        assertEquals(2L, state.lastProcessedEventNumber());
        assertFalse(state.running());
        assertEquals(1, state.errorCount());
        assertEquals("cannot apply 3", state.lastError());
        assertEquals(1, metrics.projectionFailures.get());

        manager.catchUp("Counter");
        assertEquals(List.of(1L, 2L), projection.applied);
    }

    @Test
    void resetRebuildsStoppedProjection() {
        appendCompletions(5);
        CountingProjection projection = new CountingProjection("Counter");
        projection.failOn = 3L;
        manager.registerProjection(projection);
        manager.catchUp("Counter");
        projection.failOn = -1L;

        ProjectionState state = manager.resetProjection("Counter").orElseThrow();

        assertEquals(5L, state.lastProcessedEventNumber());
        assertTrue(state.running());
        assertEquals(0, state.errorCount());
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), projection.applied);
        assertEquals(2, projection.resets.get());
    }

    // ── Concurrency ─────────────────────────────────────────────────

    @Test
    void concurrentCatchUpsApplyEachEventOnce() throws Exception {
        appendCompletions(200);
        CountingProjection projection = new CountingProjection("Counter");
        manager.registerProjection(projection);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int i = 0; i < 4; i++) {
                pool.submit(() -> {
                    start.await();
                    manager.catchUp("Counter");
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        manager.catchUp("Counter");

        assertEquals(200, projection.applied.size());
        for (int i = 0; i < 200; i++) {
            assertEquals(i + 1L, projection.applied.get(i));
        }
    }

    @Test
    void backgroundLoopCatchesUp() throws Exception {
        CountingProjection projection = new CountingProjection("Counter");
        manager.registerProjection(projection);
        manager.start();
        appendCompletions(7);

        long deadline = System.currentTimeMillis() + 5_000;
        while (projection.applied.size() < 7 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertEquals(7, projection.applied.size());
        assertTrue(manager.isStarted());
    }

    // ── Status ──────────────────────────────────────────────────────

    @Test
    void statusAndLagReflectRegisteredProjections() {
        appendCompletions(4);
        manager.registerProjection(new CountingProjection("A"));
        manager.registerProjection(new CountingProjection("B"));
        manager.catchUp("A");

        ProjectionStatus status = manager.getProjectionStatus();

        assertEquals(2, status.registeredProjections());
        assertEquals(2, status.activeProjections());
        assertEquals(4L, status.totalEventsProcessed());

        manager.catchUpAll();
        assertEquals(0L, metrics.lag.get());
    }

    @Test
    void getProjectionNarrowsType() {
        CountingProjection projection = new CountingProjection("Counter");
        manager.registerProjection(projection);

        assertTrue(manager.getProjection("Counter", CountingProjection.class).isPresent());
        assertFalse(manager.getProjection("Counter", AbstractProjection.class).isPresent());
        assertFalse(manager.getProjection("Missing", CountingProjection.class).isPresent());
    }

    @Test
    void closedManagerCannotStart() {
        manager.close();

        assertThrows(IllegalStateException.class, manager::start);
    }

    static final class CountingProjection implements Projection {
        private final String name;
        private final boolean durable;
        final List<Long> applied = new CopyOnWriteArrayList<>();
        final AtomicInteger resets = new AtomicInteger();
        volatile long failOn = -1L;

        CountingProjection(String name) {
            this(name, false);
        }

        CountingProjection(String name, boolean durable) {
            this.name = name;
            this.durable = durable;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean handles(String eventType) {
            return "HabitCompleted".equals(eventType);
        }

        @Override
        public void apply(DomainEvent event) {
            if (event.eventNumber() == failOn) {
                throw new IllegalArgumentException("cannot apply " + failOn);
            }
            applied.add(event.eventNumber());
        }

        @Override
        public void reset() {
            resets.incrementAndGet();
            applied.clear();
        }

        @Override
        public boolean durable() {
            return durable;
        }
    }
}
