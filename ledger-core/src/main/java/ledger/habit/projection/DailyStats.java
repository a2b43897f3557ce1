package ledger.habit.projection;

import java.io.Serializable;
import java.time.LocalDate;

/**
 * A user's completions and milestones on one day.
 */
public record DailyStats(String userId, LocalDate date, int habitsCompleted, int milestones) implements Serializable {

    static DailyStats empty(String userId, LocalDate date) {
        return new DailyStats(userId, date, 0, 0);
    }

    DailyStats plus(int completions, int milestoneCount) {
        return new DailyStats(userId, date, Math.max(0, habitsCompleted + completions), milestones + milestoneCount);
    }
}
