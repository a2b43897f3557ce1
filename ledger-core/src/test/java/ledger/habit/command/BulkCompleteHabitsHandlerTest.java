package ledger.habit.command;

import ledger.ErrorKind;
import ledger.MutableClock;
import ledger.Result;
import ledger.bus.EventSourcedEventBus;
import ledger.habit.CountingHabitRepository;
import ledger.habit.Habit;
import ledger.habit.HabitEvents;
import ledger.habit.HabitSchedule;
import ledger.habit.command.BulkCompletion.ItemOutcome;
import ledger.store.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BulkCompleteHabitsHandlerTest {
    private final MutableClock clock = MutableClock.at("2026-03-02T08:00:00Z");
    private final CountingHabitRepository habits = new CountingHabitRepository();
    private final InMemoryEventStore store = new InMemoryEventStore(clock);
    private final BulkCompleteHabitsHandler handler = new BulkCompleteHabitsHandler(habits,
            EventSourcedEventBus.builder().eventStore(store).build(), clock);
    private Habit h1;
    private Habit h2;

    @BeforeEach
    void setUp() {
        h1 = habits.seed(Habit.create("u1", "p1", "Read", HabitSchedule.DAILY, clock.instant()));
        h2 = habits.seed(Habit.create("u1", "p1", "Walk", HabitSchedule.DAILY, clock.instant()));
    }

    @Test
    void missingIdIsSkippedAndOthersComplete() {
        BulkCompletion result = handler.handle(
                new BulkCompleteHabitsCommand("u1", List.of(h1.id(), h2.id(), "non-existent"), null)).orElseThrow();

        assertEquals(3, result.requested());
        assertEquals(2, result.completed());
        assertTrue(result.isPartialFailure());
        assertEquals(ItemOutcome.Status.NOT_FOUND, result.outcomes().get(2).status());
        assertEquals(3, habits.finds.get());
        assertEquals(2, habits.updates.get());
        assertEquals(2L, store.readEventsByType(HabitEvents.HABIT_COMPLETED, null, null).size());
    }

    @Test
    void foreignAndAlreadyCompletedHabitsAreReported() {
        Habit foreign = habits.seed(Habit.create("u2", "p2", "Swim", HabitSchedule.DAILY, clock.instant()));
        handler.handle(new BulkCompleteHabitsCommand("u1", List.of(h1.id()), null));

        BulkCompletion result = handler.handle(
                new BulkCompleteHabitsCommand("u1", List.of(h1.id(), foreign.id(), h2.id()), null)).orElseThrow();

        assertEquals(1, result.completed());
        assertEquals(ItemOutcome.Status.REJECTED, result.outcomes().get(0).status());
        assertEquals("Habit already completed today", result.outcomes().get(0).message());
        assertEquals(ItemOutcome.Status.UNAUTHORIZED, result.outcomes().get(1).status());
        assertEquals(ItemOutcome.Status.COMPLETED, result.outcomes().get(2).status());
        assertEquals(0, habits.findById(foreign.id()).orElseThrow().streakCount());
    }

    @Test
    void duplicateIdCompletesOnce() {
        BulkCompletion result = handler.handle(
                new BulkCompleteHabitsCommand("u1", List.of(h1.id(), h1.id()), null)).orElseThrow();

        assertEquals(1, result.completed());
        assertEquals(1L, result.count(ItemOutcome.Status.REJECTED));
    }

    @Test
    void nullIdIsRejectedItem() {
        BulkCompletion result = handler.handle(
                new BulkCompleteHabitsCommand("u1", Arrays.asList(h1.id(), null), null)).orElseThrow();

        assertEquals(1, result.completed());
        assertFalse(result.outcomes().get(1).status() == ItemOutcome.Status.COMPLETED);
    }

    @Test
    void emptyRequestCompletesNothing() {
        BulkCompletion result = handler.handle(new BulkCompleteHabitsCommand("u1", List.of(), null)).orElseThrow();

        assertEquals(0, result.requested());
        assertFalse(result.isPartialFailure());
        assertEquals(0L, store.getEventCount());
    }

    @Test
    void storageFailureAbortsButKeepsEarlierWork() {
        habits.failUpdateFor = h2.id();

        Result<BulkCompletion> result = handler.handle(
                new BulkCompleteHabitsCommand("u1", List.of(h1.id(), h2.id()), null));

        assertEquals(ErrorKind.STORAGE, ((Result.Err<BulkCompletion>) result).kind());
        assertEquals(1, habits.findById(h1.id()).orElseThrow().streakCount());
        assertEquals(1L, store.readEventsByType(HabitEvents.HABIT_COMPLETED, null, null).size());
    }

    @Test
    void nullIdListIsValidationError() {
        Result<BulkCompletion> result = handler.handle(new BulkCompleteHabitsCommand("u1", null, null));

        assertEquals(ErrorKind.VALIDATION, ((Result.Err<BulkCompletion>) result).kind());
    }
}
