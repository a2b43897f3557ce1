package ledger.habit.query;

import ledger.ErrorKind;
import ledger.habit.Habit;
import ledger.habit.HabitRepository;
import ledger.query.QueryException;
import ledger.query.QueryHandler;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

public final class SearchHabitsHandler implements QueryHandler<SearchHabitsQuery, Page<HabitView>> {
    private final HabitRepository habits;
    private final Clock clock;

    public SearchHabitsHandler(HabitRepository habits, Clock clock) {
        this.habits = Objects.requireNonNull(habits, "habits");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Page<HabitView> handle(SearchHabitsQuery query) {
        if (query.searchTerm() == null || query.searchTerm().isBlank()) {
            throw new QueryException(ErrorKind.VALIDATION, "searchTerm is required");
        }
        String term = query.searchTerm().trim().toLowerCase(Locale.ROOT);
        LocalDate today = LocalDate.now(clock);
        List<HabitView> matches = new ArrayList<>();
        for (Habit habit : HabitQuerySupport.habitsOf(habits, query.userId())) {
            if (habit.title().toLowerCase(Locale.ROOT).contains(term)) {
                matches.add(HabitView.of(habit, today));
            }
        }
        return Page.of(matches, query.pageRequest());
    }
}
