package ledger.habit.query;

import ledger.query.Query;

import java.util.Map;

/**
 * Case-insensitive title search over a user's habits.
 */
public record SearchHabitsQuery(String userId, String searchTerm, PageRequest pageRequest)
        implements Query<Page<HabitView>> {

    public SearchHabitsQuery {
        pageRequest = pageRequest != null ? pageRequest : PageRequest.FIRST;
    }

    @Override
    public Map<String, String> cacheArguments() {
        return Query.arguments("userId", userId, "searchTerm", searchTerm,
                "page", pageRequest.page(), "limit", pageRequest.limit());
    }
}
