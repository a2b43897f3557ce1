package ledger.habit.query;

import ledger.query.Query;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Lists the habits due on a day ({@code null} means today) with their completion flag.
 */
public record GetTodaysHabitsQuery(String userId, LocalDate date) implements Query<List<HabitView>> {

    @Override
    public Map<String, String> cacheArguments() {
        return Query.arguments("userId", userId, "date", date);
    }
}
