package ledger.habit.command;

import ledger.ErrorKind;
import ledger.Result;
import ledger.bus.EventBus;
import ledger.habit.Habit;
import ledger.habit.HabitRepository;
import ledger.model.DomainEvent;

import java.util.List;
import java.util.function.LongFunction;

/**
 * Load, authorize and publish steps shared by the habit command handlers.
 */
final class HabitCommandSupport {
    static final String HABIT_NOT_FOUND = "Habit not found";
    static final String HABIT_UNAUTHORIZED = "Unauthorized: Habit does not belong to user";
    static final String PLAN_NOT_FOUND = "Plan not found";
    static final String PLAN_UNAUTHORIZED = "Unauthorized: Plan does not belong to user";

    private HabitCommandSupport() {
    }

    /**
     * Loads a habit and checks that {@code userId} owns it.
     */
    static Result<Habit> loadOwned(HabitRepository habits, String habitId, String userId) {
        Result<Habit> found = habits.findById(habitId);
        if (found instanceof Result.Err<Habit> err) {
            return err.kind() == ErrorKind.NOT_FOUND ? Result.err(ErrorKind.NOT_FOUND, HABIT_NOT_FOUND) : err;
        }
        Habit habit = found.orElseThrow();
        if (!habit.userId().equals(userId)) {
            return Result.err(ErrorKind.UNAUTHORIZED, HABIT_UNAUTHORIZED);
        }
        return Result.ok(habit);
    }

    /**
     * Runs a change to one habit while holding the bus's lock for its stream. The change
     * receives the stream version read under the lock and passes it to
     * {@link #publish(EventBus, String, long, List)}, so the events of successive changes are
     * stored in the order the repository accepted them.
     */
    static <T> Result<T> writeHabit(EventBus eventBus, String habitId, LongFunction<Result<T>> change) {
        if (habitId == null) {
            return Result.err(ErrorKind.NOT_FOUND, HABIT_NOT_FOUND);
        }
        return eventBus.withStreamLock(habitId, () -> {
            long streamVersion;
            try {
                streamVersion = eventBus.streamVersion(habitId);
            } catch (RuntimeException e) {
                return Result.err(ErrorKind.STORAGE, "Failed to read stream " + habitId + ": " + e.getMessage());
            }
            return change.apply(streamVersion);
        });
    }

    /**
     * Stores a habit's events at the stream version read by {@link #writeHabit}.
     *
     * <p>The repository already holds the change, so any failure, including a stream moved on
     * by a writer outside this bus, is reported as {@code STORAGE}.
     */
    static Result<Void> publish(EventBus eventBus, String habitId, long expectedVersion, List<DomainEvent> events) {
        if (events.isEmpty()) {
            return Result.ok(null);
        }
        Result<List<DomainEvent>> published = eventBus.publishToStream(habitId, expectedVersion, events);
        if (published instanceof Result.Err<List<DomainEvent>> err) {
            String message = err.kind() == ErrorKind.CONFLICT
                    ? "Habit " + habitId + " was changed concurrently, its events were not stored: " + err.message()
                    : err.message();
            return Result.err(ErrorKind.STORAGE, message);
        }
        return Result.ok(null);
    }

    static Result<Void> validateId(String value, String name) {
        if (value == null || value.isBlank()) {
            return Result.err(ErrorKind.VALIDATION, name + " is required");
        }
        return Result.ok(null);
    }
}
