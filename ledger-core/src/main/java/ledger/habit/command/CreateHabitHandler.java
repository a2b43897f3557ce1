package ledger.habit.command;

import ledger.ErrorKind;
import ledger.Result;
import ledger.bus.EventBus;
import ledger.command.CommandHandler;
import ledger.habit.Habit;
import ledger.habit.HabitRepository;
import ledger.habit.HabitSchedule;
import ledger.habit.Plan;
import ledger.habit.PlanRepository;
import ledger.spi.EventStore;

import java.time.Clock;
import java.util.Objects;

/**
 * Creates a habit in a plan owned by the issuing user.
 *
 * <p>Fails with {@code NOT_FOUND} "Plan not found" or {@code UNAUTHORIZED}
 * "Unauthorized: Plan does not belong to user" without touching the habit repository.
 */
public final class CreateHabitHandler implements CommandHandler<CreateHabitCommand, String> {
    private final PlanRepository plans;
    private final HabitRepository habits;
    private final EventBus eventBus;
    private final Clock clock;

    public CreateHabitHandler(PlanRepository plans, HabitRepository habits, EventBus eventBus, Clock clock) {
        this.plans = Objects.requireNonNull(plans, "plans");
        this.habits = Objects.requireNonNull(habits, "habits");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Result<String> handle(CreateHabitCommand command) {
        if (command.title() == null || command.title().isBlank()) {
            return Result.err(ErrorKind.VALIDATION, "title is required");
        }
        Result<Void> validPlan = HabitCommandSupport.validateId(command.planId(), "planId");
        if (validPlan instanceof Result.Err<Void> err) {
            return err.retype();
        }

        Result<Plan> found = plans.findById(command.planId());
        if (found instanceof Result.Err<Plan> err) {
            return err.kind() == ErrorKind.NOT_FOUND
                    ? Result.err(ErrorKind.NOT_FOUND, HabitCommandSupport.PLAN_NOT_FOUND)
                    : err.retype();
        }
        if (!found.orElseThrow().userId().equals(command.userId())) {
            return Result.err(ErrorKind.UNAUTHORIZED, HabitCommandSupport.PLAN_UNAUTHORIZED);
        }

        HabitSchedule schedule = command.schedule() != null ? command.schedule() : HabitSchedule.DAILY;
        Habit habit = Habit.create(command.userId(), command.planId(), command.title().trim(), schedule,
                clock.instant());
        Result<Habit> created = habits.create(habit);
        if (created instanceof Result.Err<Habit> err) {
            return err.retype();
        }
        return HabitCommandSupport.publish(eventBus, habit.id(), EventStore.NO_STREAM,
                        habit.pullEvents(command.correlationId()))
                .map(ignored -> habit.id());
    }
}
