package ledger.habit.projection;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Per-habit totals maintained by {@link HabitAnalyticsProjection}.
 */
public record HabitStats(
        String habitId,
        String userId,
        String title,
        int totalCompletions,
        int currentStreak,
        int longestStreak,
        LocalDate lastCompletedOn,
        Instant createdAt) implements Serializable {

    HabitStats completed(LocalDate date, int newStreak) {
        return new HabitStats(habitId, userId, title, totalCompletions + 1, newStreak,
                Math.max(longestStreak, newStreak), date, createdAt);
    }

    HabitStats uncompleted(int newStreak) {
        return new HabitStats(habitId, userId, title, Math.max(0, totalCompletions - 1), newStreak,
                longestStreak, null, createdAt);
    }

    HabitStats streakEnded(int previousStreak) {
        return new HabitStats(habitId, userId, title, totalCompletions, 0,
                Math.max(longestStreak, previousStreak), lastCompletedOn, createdAt);
    }
}
