package ledger.habit;

import ledger.ErrorKind;
import ledger.Result;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;

class InMemoryHabitRepositoryTest {
    private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");

    private final InMemoryHabitRepository repository = new InMemoryHabitRepository();

    @Test
    void updateFromStaleCopyIsConflict() {
        Habit stored = repository.create(Habit.create("u1", "p1", "Read", HabitSchedule.DAILY, NOW)).orElseThrow();
        Habit first = repository.findById(stored.id()).orElseThrow();
        Habit second = repository.findById(stored.id()).orElseThrow();

        first.markCompleted(LocalDate.of(2026, 3, 2), NOW);
        second.markCompleted(LocalDate.of(2026, 3, 2), NOW);

        assertEquals(2L, repository.update(first).orElseThrow().version());
        Result<Habit> stale = repository.update(second);
        assertEquals(ErrorKind.CONFLICT, ((Result.Err<Habit>) stale).kind());
        assertEquals(1, repository.findById(stored.id()).orElseThrow().streakCount());
    }

    @Test
    void returnsCopies() {
        Habit stored = repository.create(Habit.create("u1", "p1", "Read", HabitSchedule.DAILY, NOW)).orElseThrow();

        assertNotSame(repository.findById(stored.id()).orElseThrow(), repository.findById(stored.id()).orElseThrow());
    }

    @Test
    void duplicateCreateIsConflict() {
        Habit habit = Habit.create("u1", "p1", "Read", HabitSchedule.DAILY, NOW);
        repository.create(habit);

        assertEquals(ErrorKind.CONFLICT, ((Result.Err<Habit>) repository.create(habit)).kind());
    }

    @Test
    void missingHabitIsNotFound() {
        Result.Err<Habit> err = (Result.Err<Habit>) repository.findById("missing");

        assertEquals(ErrorKind.NOT_FOUND, err.kind());
        assertEquals("Habit not found", err.message());
        assertEquals(ErrorKind.NOT_FOUND, ((Result.Err<Void>) repository.delete("missing")).kind());
    }
}
