package ledger.habit.command;

import ledger.Result;
import ledger.bus.EventBus;
import ledger.command.CommandHandler;
import ledger.habit.Habit;
import ledger.habit.HabitRepository;

import java.time.Clock;
import java.util.Objects;

/**
 * Deletes a habit owned by the issuing user and records {@code HabitDeleted}. The habit's
 * event stream is kept.
 */
public final class DeleteHabitHandler implements CommandHandler<DeleteHabitCommand, Void> {
    private final HabitRepository habits;
    private final EventBus eventBus;
    private final Clock clock;

    public DeleteHabitHandler(HabitRepository habits, EventBus eventBus, Clock clock) {
        this.habits = Objects.requireNonNull(habits, "habits");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Result<Void> handle(DeleteHabitCommand command) {
        return HabitCommandSupport.writeHabit(eventBus, command.habitId(), streamVersion -> {
            Result<Habit> loaded = HabitCommandSupport.loadOwned(habits, command.habitId(), command.userId());
            if (loaded instanceof Result.Err<Habit> err) {
                return err.retype();
            }
            Habit habit = loaded.orElseThrow();
            Result<Void> deleted = habits.delete(habit.id());
            if (deleted instanceof Result.Err<Void> err) {
                return err;
            }
            habit.markDeleted(clock.instant());
            return HabitCommandSupport.publish(eventBus, habit.id(), streamVersion,
                    habit.pullEvents(command.correlationId()));
        });
    }
}
