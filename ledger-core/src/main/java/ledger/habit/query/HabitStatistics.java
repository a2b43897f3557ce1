package ledger.habit.query;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.List;

/**
 * Completion statistics for a user.
 *
 * @param totalHabits    habits the user has
 * @param completedToday habits completed on the range's last day
 * @param averageStreak  mean current streak
 * @param longestStreak  longest streak of any habit
 * @param completionRate completions in the range as a percentage of due habit-days (0 to 100)
 * @param weeklyProgress the last seven days of the range, oldest first
 */
public record HabitStatistics(
        int totalHabits,
        int completedToday,
        double averageStreak,
        int longestStreak,
        double completionRate,
        List<DailyProgress> weeklyProgress) implements Serializable {

    public HabitStatistics {
        weeklyProgress = List.copyOf(weeklyProgress);
    }

    /**
     * Completions on one day.
     *
     * @param date      the day
     * @param completed habits completed that day
     * @param total     habits that existed and were due that day
     */
    public record DailyProgress(LocalDate date, int completed, int total) implements Serializable {
    }
}
