package ledger.habit.query;

import ledger.query.Query;

import java.util.Map;

/**
 * Returns the analytics projection's view of a user.
 */
public record GetHabitAnalyticsQuery(String userId) implements Query<UserAnalyticsView> {

    @Override
    public Map<String, String> cacheArguments() {
        return Query.arguments("userId", userId);
    }
}
