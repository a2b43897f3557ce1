package ledger.habit.query;

import ledger.query.Query;

import java.util.Map;

/**
 * Returns one habit, or {@code null} if it does not exist.
 */
public record GetHabitByIdQuery(String habitId, String userId) implements Query<HabitView> {

    @Override
    public Map<String, String> cacheArguments() {
        return Query.arguments("habitId", habitId, "userId", userId);
    }
}
