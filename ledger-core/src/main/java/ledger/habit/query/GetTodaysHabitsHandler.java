package ledger.habit.query;

import ledger.habit.Habit;
import ledger.habit.HabitRepository;
import ledger.query.QueryHandler;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lists the habits whose schedule is due on the requested day.
 */
public final class GetTodaysHabitsHandler implements QueryHandler<GetTodaysHabitsQuery, List<HabitView>> {
    private final HabitRepository habits;
    private final Clock clock;

    public GetTodaysHabitsHandler(HabitRepository habits, Clock clock) {
        this.habits = Objects.requireNonNull(habits, "habits");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public List<HabitView> handle(GetTodaysHabitsQuery query) {
        LocalDate day = query.date() != null ? query.date() : LocalDate.now(clock);
        List<HabitView> due = new ArrayList<>();
        for (Habit habit : HabitQuerySupport.habitsOf(habits, query.userId())) {
            if (habit.schedule().isDueOn(day)) {
                due.add(HabitView.of(habit, day));
            }
        }
        return due;
    }
}
