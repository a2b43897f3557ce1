package ledger.habit;

import java.util.Optional;

/**
 * Streak lengths worth celebrating.
 */
public enum Milestone {
    WEEK(7, "week"),
    MONTH(30, "month"),
    QUARTER(90, "quarter"),
    YEAR(365, "year");

    private final int days;
    private final String label;

    Milestone(int days, String label) {
        this.days = days;
        this.label = label;
    }

    public int days() {
        return days;
    }

    /**
     * Value stored in the {@code milestoneType} field of milestone events.
     */
    public String label() {
        return label;
    }

    /**
     * Returns the milestone reached at exactly this streak length, if any.
     */
    public static Optional<Milestone> reachedAt(int streakCount) {
        for (Milestone milestone : values()) {
            if (milestone.days == streakCount) {
                return Optional.of(milestone);
            }
        }
        return Optional.empty();
    }
}
