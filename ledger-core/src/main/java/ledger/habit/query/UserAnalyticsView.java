package ledger.habit.query;

import ledger.habit.projection.DailyStats;
import ledger.habit.projection.HabitStats;
import ledger.habit.projection.UserJourney;

import java.io.Serializable;
import java.util.List;

/**
 * A user's analytics as materialized by the analytics projection.
 *
 * @param journey     activity across all habits
 * @param growthScore the journey's growth score (0 to 100)
 * @param habits      per-habit totals, oldest habit first
 * @param recentDays  daily counters for the last 30 days, oldest first
 */
public record UserAnalyticsView(
        UserJourney journey,
        double growthScore,
        List<HabitStats> habits,
        List<DailyStats> recentDays) implements Serializable {

    public UserAnalyticsView {
        habits = List.copyOf(habits);
        recentDays = List.copyOf(recentDays);
    }
}
