package ledger.habit.command;

import ledger.ErrorKind;
import ledger.Result;
import ledger.bus.EventBus;
import ledger.command.CommandHandler;
import ledger.habit.Habit;
import ledger.habit.HabitRepository;
import ledger.habit.command.BulkCompletion.ItemOutcome;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Completes several habits, one at a time in request order.
 *
 * <p>An item that is missing, owned by someone else or rejected by the streak rules is
 * skipped and recorded in the outcome list; processing continues with the next id. Each
 * completed item is stored and its events published before the next item starts, under the
 * same per-habit lock as the single-habit commands.
 *
 * <p>A {@code STORAGE} failure is systemic: items already completed stay completed and the
 * call fails with {@code STORAGE}.
 */
public final class BulkCompleteHabitsHandler implements CommandHandler<BulkCompleteHabitsCommand, BulkCompletion> {
    private static final Logger logger = Logger.getLogger(BulkCompleteHabitsHandler.class.getName());

    private final HabitRepository habits;
    private final EventBus eventBus;
    private final Clock clock;

    public BulkCompleteHabitsHandler(HabitRepository habits, EventBus eventBus, Clock clock) {
        this.habits = Objects.requireNonNull(habits, "habits");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Result<BulkCompletion> handle(BulkCompleteHabitsCommand command) {
        if (command.habitIds() == null) {
            return Result.err(ErrorKind.VALIDATION, "habitIds is required");
        }
        LocalDate date = command.date() != null ? command.date() : LocalDate.now(clock);
        Instant now = clock.instant();
        List<ItemOutcome> outcomes = new ArrayList<>(command.habitIds().size());
        int completed = 0;

        for (String habitId : command.habitIds()) {
            Result<Void> item = HabitCommandSupport.writeHabit(eventBus, habitId,
                    streamVersion -> completeOne(habitId, command, date, now, streamVersion));
            if (item instanceof Result.Err<Void> err) {
                ItemOutcome outcome = skipped(habitId, err);
                if (outcome == null) {
                    logger.log(Level.SEVERE, "Bulk completion for user {0} aborted at {1} after {2} items: {3}",
                            new Object[]{command.userId(), habitId, completed, err.message()});
                    return err.retype();
                }
                outcomes.add(outcome);
            } else {
                outcomes.add(ItemOutcome.completed(habitId));
                completed++;
            }
        }
        return Result.ok(new BulkCompletion(command.habitIds().size(), completed, outcomes));
    }

    private Result<Void> completeOne(String habitId, BulkCompleteHabitsCommand command, LocalDate date,
                                     Instant now, long streamVersion) {
        Result<Habit> loaded = HabitCommandSupport.loadOwned(habits, habitId, command.userId());
        if (loaded instanceof Result.Err<Habit> err) {
            return err.retype();
        }
        Habit habit = loaded.orElseThrow();
        Result<Void> rule = habit.markCompleted(date, now);
        if (rule instanceof Result.Err<Void> err) {
            return err;
        }
        Result<Habit> updated = habits.update(habit);
        if (updated instanceof Result.Err<Habit> err) {
            return err.retype();
        }
        return HabitCommandSupport.publish(eventBus, habitId, streamVersion, habit.pullEvents(command.correlationId()));
    }

    // null for systemic failures, which abort the request
    private static ItemOutcome skipped(String habitId, Result.Err<Void> err) {
        return switch (err.kind()) {
            case NOT_FOUND -> new ItemOutcome(habitId, ItemOutcome.Status.NOT_FOUND, err.message());
            case UNAUTHORIZED -> new ItemOutcome(habitId, ItemOutcome.Status.UNAUTHORIZED, err.message());
            case STORAGE, INTERNAL -> null;
            default -> new ItemOutcome(habitId, ItemOutcome.Status.REJECTED, err.message());
        };
    }
}
