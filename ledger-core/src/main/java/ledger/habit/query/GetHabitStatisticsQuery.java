package ledger.habit.query;

import ledger.query.Query;

import java.time.LocalDate;
import java.util.Map;

/**
 * Completion statistics over an inclusive date range. A {@code null} {@code to} means today
 * and a {@code null} {@code from} means 29 days before {@code to}.
 */
public record GetHabitStatisticsQuery(String userId, LocalDate from, LocalDate to)
        implements Query<HabitStatistics> {

    @Override
    public Map<String, String> cacheArguments() {
        return Query.arguments("userId", userId, "from", from, "to", to);
    }
}
