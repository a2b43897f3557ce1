package ledger.habit.query;

import ledger.query.Query;

import java.util.Map;

/**
 * Lists a user's habits, optionally restricted to one plan, oldest first.
 */
public record GetHabitsByUserQuery(String userId, String planId, PageRequest pageRequest)
        implements Query<Page<HabitView>> {

    public GetHabitsByUserQuery {
        pageRequest = pageRequest != null ? pageRequest : PageRequest.FIRST;
    }

    public GetHabitsByUserQuery(String userId) {
        this(userId, null, PageRequest.FIRST);
    }

    @Override
    public Map<String, String> cacheArguments() {
        return Query.arguments("userId", userId, "planId", planId,
                "page", pageRequest.page(), "limit", pageRequest.limit());
    }
}
