package ledger.habit.command;

import ledger.ErrorKind;
import ledger.MutableClock;
import ledger.Result;
import ledger.bus.EventSourcedEventBus;
import ledger.habit.CountingHabitRepository;
import ledger.habit.Habit;
import ledger.habit.HabitEvents;
import ledger.habit.HabitSchedule;
import ledger.model.DomainEvent;
import ledger.store.InMemoryEventStore;
import ledger.store.StubEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompleteHabitHandlerTest {
    private final MutableClock clock = MutableClock.at("2026-03-02T08:00:00Z");
    private final CountingHabitRepository habits = new CountingHabitRepository();
    private final InMemoryEventStore store = new InMemoryEventStore(clock);
    private final CompleteHabitHandler handler = new CompleteHabitHandler(habits,
            EventSourcedEventBus.builder().eventStore(store).build(), clock);
    private Habit habit;

    @BeforeEach
    void setUp() {
        habit = habits.seed(Habit.create("u1", "p1", "Read", HabitSchedule.DAILY, clock.instant()));
    }

    @Test
    void completesTodayByDefault() {
        assertTrue(handler.handle(new CompleteHabitCommand("u1", habit.id(), null)).isOk());

        Habit stored = habits.findById(habit.id()).orElseThrow();
        assertEquals(1, stored.streakCount());
        assertEquals(LocalDate.of(2026, 3, 2), stored.lastCompletedOn());
        assertEquals(2L, stored.version());
        assertEquals(List.of(HabitEvents.HABIT_COMPLETED),
                store.allEvents().stream().map(DomainEvent::eventType).toList());
    }

    @Test
    void completingTwiceSameDayIsRejectedWithoutSecondUpdate() {
        handler.handle(new CompleteHabitCommand("u1", habit.id(), null));
        habits.resetCounts();

        Result<Void> again = handler.handle(new CompleteHabitCommand("u1", habit.id(), null));

        Result.Err<Void> err = (Result.Err<Void>) again;
        assertEquals(ErrorKind.CONFLICT, err.kind());
        assertEquals("Habit already completed today", err.message());
        assertEquals(0, habits.updates.get());
        assertEquals(1L, store.getEventCount());
    }

    @Test
    void nextDayExtendsStreak() {
        handler.handle(new CompleteHabitCommand("u1", habit.id(), null));
        clock.advance(Duration.ofDays(1));

        handler.handle(new CompleteHabitCommand("u1", habit.id(), null));

        assertEquals(2, habits.findById(habit.id()).orElseThrow().streakCount());
    }

    @Test
    void otherUsersHabitIsUnauthorized() {
        Result.Err<Void> err = (Result.Err<Void>) handler.handle(new CompleteHabitCommand("u2", habit.id(), null));

        assertEquals(ErrorKind.UNAUTHORIZED, err.kind());
        assertEquals("Unauthorized: Habit does not belong to user", err.message());
        assertEquals(0, habits.updates.get());
    }

    @Test
    void missingHabitIsNotFound() {
        Result.Err<Void> err = (Result.Err<Void>) handler.handle(new CompleteHabitCommand("u1", "missing", null));

        assertEquals(ErrorKind.NOT_FOUND, err.kind());
        assertEquals("Habit not found", err.message());
    }

    @Test
    void eventsCarryCommandCorrelationId() {
        handler.handle(new CompleteHabitCommand("u1", habit.id(), null, "corr-42"));

        assertEquals("corr-42", store.allEvents().get(0).metadata().correlationId());
    }

    // ── Concurrency ─────────────────────────────────────────────────

    @Test
    void concurrentCompletionsAreStoredInRepositoryOrder() throws Exception {
        LocalDate day1 = LocalDate.of(2026, 3, 1);
        LocalDate day2 = LocalDate.of(2026, 3, 2);
        GatedStore gated = new GatedStore(new InMemoryEventStore(clock));
        CompleteHabitHandler gatedHandler = new CompleteHabitHandler(habits,
                EventSourcedEventBus.builder().eventStore(gated).build(), clock);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Result<Void>> first = pool.submit(
                    () -> gatedHandler.handle(new CompleteHabitCommand("u1", habit.id(), day1)));
            assertTrue(gated.firstAppendEntered.await(5, TimeUnit.SECONDS));
            Future<Result<Void>> second = pool.submit(
                    () -> gatedHandler.handle(new CompleteHabitCommand("u1", habit.id(), day2)));

            Thread.sleep(100);
            boolean secondFinishedWhileFirstHeld = second.isDone();
            gated.releaseFirstAppend.countDown();

            assertTrue(first.get(5, TimeUnit.SECONDS).isOk());
            assertTrue(second.get(5, TimeUnit.SECONDS).isOk());
            assertFalse(secondFinishedWhileFirstHeld);
        } finally {
            pool.shutdownNow();
        }

        Habit stored = habits.findById(habit.id()).orElseThrow();
        List<DomainEvent> stream = gated.readStream(habit.id(), 0L, 10).events();
        assertEquals(day2, stored.lastCompletedOn());
        assertEquals(2, stored.streakCount());
        assertEquals(List.of("2026-03-01", "2026-03-02"),
                stream.stream().map(e -> e.payload().get(HabitEvents.COMPLETION_DATE)).toList());
        assertEquals("2", stream.get(1).payload().get(HabitEvents.NEW_STREAK_COUNT));
    }

    // Holds the first append until released.
    private static final class GatedStore extends StubEventStore {
        final CountDownLatch firstAppendEntered = new CountDownLatch(1);
        final CountDownLatch releaseFirstAppend = new CountDownLatch(1);
        private final AtomicBoolean gateUsed = new AtomicBoolean();

        GatedStore(InMemoryEventStore delegate) {
            super(delegate);
        }

        @Override
        public Result<List<DomainEvent>> appendToStream(String streamId, long expectedVersion,
                                                        List<DomainEvent> events) {
            if (gateUsed.compareAndSet(false, true)) {
                firstAppendEntered.countDown();
                try {
                    releaseFirstAppend.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return super.appendToStream(streamId, expectedVersion, events);
        }
    }
}
