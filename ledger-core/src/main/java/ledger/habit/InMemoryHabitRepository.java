package ledger.habit;

import ledger.ErrorKind;
import ledger.Result;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link HabitRepository}. Stores and returns copies, so callers never share
 * aggregate instances.
 */
public final class InMemoryHabitRepository implements HabitRepository {
    static final String NOT_FOUND = "Habit not found";

    private final Map<String, Habit> habits = new ConcurrentHashMap<>();

    @Override
    public Result<Habit> create(Habit habit) {
        Habit stored = restoreAt(habit, 1L);
        if (habits.putIfAbsent(habit.id(), stored) != null) {
            return Result.err(ErrorKind.CONFLICT, "Habit " + habit.id() + " already exists");
        }
        return Result.ok(stored.copy());
    }

    @Override
    public Result<Habit> findById(String habitId) {
        Habit habit = habitId == null ? null : habits.get(habitId);
        if (habit == null) {
            return Result.err(ErrorKind.NOT_FOUND, NOT_FOUND);
        }
        return Result.ok(habit.copy());
    }

    @Override
    public Result<List<Habit>> findByUserId(String userId) {
        List<Habit> result = new ArrayList<>();
        for (Habit habit : habits.values()) {
            if (habit.userId().equals(userId)) {
                result.add(habit.copy());
            }
        }
        result.sort(Comparator.comparing(Habit::createdAt).thenComparing(Habit::id));
        return Result.ok(result);
    }

    @Override
    public Result<Habit> update(Habit habit) {
        Habit[] stored = new Habit[1];
        Habit current = habits.computeIfPresent(habit.id(), (id, existing) -> {
            if (existing.version() != habit.version()) {
                return existing;
            }
            stored[0] = restoreAt(habit, habit.version() + 1);
            return stored[0];
        });
        if (current == null) {
            return Result.err(ErrorKind.NOT_FOUND, NOT_FOUND);
        }
        if (stored[0] == null) {
            return Result.err(ErrorKind.CONFLICT, "Habit " + habit.id() + " was modified concurrently");
        }
        return Result.ok(stored[0].copy());
    }

    @Override
    public Result<Void> delete(String habitId) {
        if (habits.remove(habitId) == null) {
            return Result.err(ErrorKind.NOT_FOUND, NOT_FOUND);
        }
        return Result.ok(null);
    }

    public int size() {
        return habits.size();
    }

    private static Habit restoreAt(Habit habit, long version) {
        return Habit.restore(habit.id(), habit.userId(), habit.planId(), habit.title(), habit.schedule(),
                habit.createdAt(), habit.streakCount(), habit.longestStreak(), habit.lastCompletedOn(), version);
    }
}
