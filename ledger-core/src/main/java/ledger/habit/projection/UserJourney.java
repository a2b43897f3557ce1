package ledger.habit.projection;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Set;
import java.util.TreeSet;

/**
 * A user's activity across all habits.
 *
 * @param userId            the user
 * @param activeDays        distinct UTC days with at least one habit event
 * @param habitsCreated     habits created, deleted ones included
 * @param totalCompletions  completions minus undone completions
 * @param milestonesReached streak milestones reached
 * @param lastActivityAt    timestamp of the latest event
 */
public record UserJourney(
        String userId,
        Set<LocalDate> activeDays,
        int habitsCreated,
        int totalCompletions,
        int milestonesReached,
        Instant lastActivityAt) implements Serializable {

    public UserJourney {
        activeDays = Set.copyOf(activeDays);
    }

    public static UserJourney start(String userId) {
        return new UserJourney(userId, Set.of(), 0, 0, 0, null);
    }

    public int totalDaysActive() {
        return activeDays.size();
    }

    /**
     * Growth score between 0 and 100: half a point per completion plus two per milestone.
     */
    public double growthScore() {
        return Math.min(100.0d, totalCompletions * 0.5d + milestonesReached * 2.0d);
    }

    UserJourney record(Instant at, LocalDate day, int created, int completions, int milestones) {
        Set<LocalDate> days = activeDays;
        if (!days.contains(day)) {
            TreeSet<LocalDate> grown = new TreeSet<>(days);
            grown.add(day);
            days = grown;
        }
        Instant last = lastActivityAt == null || at.isAfter(lastActivityAt) ? at : lastActivityAt;
        return new UserJourney(userId, days, habitsCreated + created, Math.max(0, totalCompletions + completions),
                milestonesReached + milestones, last);
    }
}
