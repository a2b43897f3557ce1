package ledger.habit.query;

import ledger.habit.Habit;
import ledger.habit.HabitRepository;
import ledger.query.QueryHandler;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class GetHabitsByUserHandler implements QueryHandler<GetHabitsByUserQuery, Page<HabitView>> {
    private final HabitRepository habits;
    private final Clock clock;

    public GetHabitsByUserHandler(HabitRepository habits, Clock clock) {
        this.habits = Objects.requireNonNull(habits, "habits");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Page<HabitView> handle(GetHabitsByUserQuery query) {
        LocalDate today = LocalDate.now(clock);
        List<HabitView> views = new ArrayList<>();
        for (Habit habit : HabitQuerySupport.habitsOf(habits, query.userId())) {
            if (query.planId() == null || query.planId().equals(habit.planId())) {
                views.add(HabitView.of(habit, today));
            }
        }
        return Page.of(views, query.pageRequest());
    }
}
