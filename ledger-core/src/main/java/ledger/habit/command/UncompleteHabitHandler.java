package ledger.habit.command;

import ledger.Result;
import ledger.bus.EventBus;
import ledger.command.CommandHandler;
import ledger.habit.Habit;
import ledger.habit.HabitRepository;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

public final class UncompleteHabitHandler implements CommandHandler<UncompleteHabitCommand, Void> {
    private final HabitRepository habits;
    private final EventBus eventBus;
    private final Clock clock;

    public UncompleteHabitHandler(HabitRepository habits, EventBus eventBus, Clock clock) {
        this.habits = Objects.requireNonNull(habits, "habits");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Result<Void> handle(UncompleteHabitCommand command) {
        return HabitCommandSupport.writeHabit(eventBus, command.habitId(), streamVersion -> {
            Result<Habit> loaded = HabitCommandSupport.loadOwned(habits, command.habitId(), command.userId());
            if (loaded instanceof Result.Err<Habit> err) {
                return err.retype();
            }
            Habit habit = loaded.orElseThrow();
            LocalDate date = command.date() != null ? command.date() : LocalDate.now(clock);
            Result<Void> undone = habit.markIncomplete(date, clock.instant());
            if (undone instanceof Result.Err<Void> err) {
                return err;
            }
            Result<Habit> updated = habits.update(habit);
            if (updated instanceof Result.Err<Habit> err) {
                return err.retype();
            }
            return HabitCommandSupport.publish(eventBus, habit.id(), streamVersion,
                    habit.pullEvents(command.correlationId()));
        });
    }
}
