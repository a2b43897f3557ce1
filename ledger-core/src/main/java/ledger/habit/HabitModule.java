package ledger.habit;

import ledger.Ledger;
import ledger.LedgerModule;
import ledger.bus.EventBus;
import ledger.habit.command.BulkCompleteHabitsCommand;
import ledger.habit.command.BulkCompleteHabitsHandler;
import ledger.habit.command.CompleteHabitCommand;
import ledger.habit.command.CompleteHabitHandler;
import ledger.habit.command.CreateHabitCommand;
import ledger.habit.command.CreateHabitHandler;
import ledger.habit.command.DeleteHabitCommand;
import ledger.habit.command.DeleteHabitHandler;
import ledger.habit.command.ResetHabitStreakCommand;
import ledger.habit.command.ResetHabitStreakHandler;
import ledger.habit.command.UncompleteHabitCommand;
import ledger.habit.command.UncompleteHabitHandler;
import ledger.habit.projection.HabitAnalyticsProjection;
import ledger.habit.query.GetHabitAnalyticsHandler;
import ledger.habit.query.GetHabitAnalyticsQuery;
import ledger.habit.query.GetHabitByIdHandler;
import ledger.habit.query.GetHabitByIdQuery;
import ledger.habit.query.GetHabitStatisticsHandler;
import ledger.habit.query.GetHabitStatisticsQuery;
import ledger.habit.query.GetHabitsByUserHandler;
import ledger.habit.query.GetHabitsByUserQuery;
import ledger.habit.query.GetTodaysHabitsHandler;
import ledger.habit.query.GetTodaysHabitsQuery;
import ledger.habit.query.SearchHabitsHandler;
import ledger.habit.query.SearchHabitsQuery;

import java.time.Clock;
import java.util.Objects;

/**
 * Registers the habit commands, queries and the analytics projection.
 */
public final class HabitModule implements LedgerModule {
    private final HabitRepository habits;
    private final PlanRepository plans;
    private final HabitAnalyticsProjection analytics;

    public HabitModule(HabitRepository habits, PlanRepository plans) {
        this(habits, plans, new HabitAnalyticsProjection());
    }

    public HabitModule(HabitRepository habits, PlanRepository plans, HabitAnalyticsProjection analytics) {
        this.habits = Objects.requireNonNull(habits, "habits");
        this.plans = Objects.requireNonNull(plans, "plans");
        this.analytics = Objects.requireNonNull(analytics, "analytics");
    }

    @Override
    public void register(Ledger ledger) {
        EventBus eventBus = ledger.eventBus();
        Clock clock = ledger.clock();

        ledger.commandBus()
                .register(CreateHabitCommand.class, new CreateHabitHandler(plans, habits, eventBus, clock))
                .register(CompleteHabitCommand.class, new CompleteHabitHandler(habits, eventBus, clock))
                .register(BulkCompleteHabitsCommand.class, new BulkCompleteHabitsHandler(habits, eventBus, clock))
                .register(UncompleteHabitCommand.class, new UncompleteHabitHandler(habits, eventBus, clock))
                .register(ResetHabitStreakCommand.class, new ResetHabitStreakHandler(habits, eventBus, clock))
                .register(DeleteHabitCommand.class, new DeleteHabitHandler(habits, eventBus, clock));

        ledger.queryBus()
                .register(GetHabitByIdQuery.class, new GetHabitByIdHandler(habits, clock))
                .register(GetHabitsByUserQuery.class, new GetHabitsByUserHandler(habits, clock))
                .register(GetTodaysHabitsQuery.class, new GetTodaysHabitsHandler(habits, clock))
                .register(SearchHabitsQuery.class, new SearchHabitsHandler(habits, clock))
                .register(GetHabitStatisticsQuery.class,
                        new GetHabitStatisticsHandler(habits, ledger.eventStore(), clock))
                .register(GetHabitAnalyticsQuery.class, new GetHabitAnalyticsHandler(analytics, clock));

        ledger.projectionManager().registerProjection(analytics);
    }

    public HabitAnalyticsProjection analytics() {
        return analytics;
    }
}
