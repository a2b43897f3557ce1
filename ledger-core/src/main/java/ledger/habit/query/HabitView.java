package ledger.habit.query;

import ledger.habit.Habit;
import ledger.habit.HabitSchedule;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Read-side copy of a habit, safe to cache.
 */
public record HabitView(
        String id,
        String userId,
        String planId,
        String title,
        HabitSchedule schedule,
        int streakCount,
        int longestStreak,
        LocalDate lastCompletedOn,
        Instant createdAt,
        boolean completedToday) implements Serializable {

    static HabitView of(Habit habit, LocalDate today) {
        return new HabitView(habit.id(), habit.userId(), habit.planId(), habit.title(), habit.schedule(),
                habit.streakCount(), habit.longestStreak(), habit.lastCompletedOn(), habit.createdAt(),
                habit.isCompletedOn(today));
    }
}
