package ledger.habit;

import ledger.Result;

import java.util.List;

/**
 * Storage for {@link Habit} aggregates.
 *
 * <p>{@link #update} is an optimistic compare-and-set on {@link Habit#version()}: it fails
 * with {@code CONFLICT} when the stored version differs from the one the caller loaded.
 * I/O failures are reported as {@code STORAGE}.
 */
public interface HabitRepository {

    /**
     * Stores a new habit at version 1.
     */
    Result<Habit> create(Habit habit);

    /**
     * Loads a habit.
     *
     * @return the habit, or {@code NOT_FOUND} with "Habit not found"
     */
    Result<Habit> findById(String habitId);

    Result<List<Habit>> findByUserId(String userId);

    /**
     * Stores the habit's current state if nobody else changed it since it was loaded.
     *
     * @return the stored habit carrying its new version
     */
    Result<Habit> update(Habit habit);

    Result<Void> delete(String habitId);
}
