package ledger.habit;

import ledger.model.DomainEvent;
import ledger.model.EventMetadata;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event types emitted by the {@link Habit} aggregate and their payload fields.
 */
public final class HabitEvents {
    public static final String AGGREGATE_TYPE = "Habit";

    public static final String HABIT_CREATED = "HabitCreated";
    public static final String HABIT_COMPLETED = "HabitCompleted";
    public static final String HABIT_UNCOMPLETED = "HabitUncompleted";
    public static final String HABIT_STREAK_BROKEN = "HabitStreakBroken";
    public static final String HABIT_STREAK_RESET = "HabitStreakReset";
    public static final String HABIT_MILESTONE_REACHED = "HabitMilestoneReached";
    public static final String HABIT_DELETED = "HabitDeleted";

    public static final String HABIT_ID = "habitId";
    public static final String USER_ID = "userId";
    public static final String PLAN_ID = "planId";
    public static final String TITLE = "title";
    public static final String SCHEDULE = "schedule";
    public static final String COMPLETION_DATE = "completionDate";
    public static final String NEW_STREAK_COUNT = "newStreakCount";
    public static final String IS_STREAK_MAINTAINED = "isStreakMaintained";
    public static final String PREVIOUS_STREAK_COUNT = "previousStreakCount";
    public static final String DAYS_MISSED = "daysMissed";
    public static final String MILESTONE_TYPE = "milestoneType";
    public static final String STREAK_COUNT = "streakCount";

    private HabitEvents() {
    }

    static DomainEvent created(Habit habit, Instant at) {
        Map<String, String> payload = base(habit);
        payload.put(PLAN_ID, habit.planId());
        payload.put(TITLE, habit.title());
        payload.put(SCHEDULE, habit.schedule().encode());
        return event(HABIT_CREATED, habit, payload, at);
    }

    static DomainEvent completed(Habit habit, LocalDate date, boolean streakMaintained, Instant at) {
        Map<String, String> payload = base(habit);
        payload.put(COMPLETION_DATE, date.toString());
        payload.put(NEW_STREAK_COUNT, Integer.toString(habit.streakCount()));
        payload.put(IS_STREAK_MAINTAINED, Boolean.toString(streakMaintained));
        return event(HABIT_COMPLETED, habit, payload, at);
    }

    static DomainEvent uncompleted(Habit habit, LocalDate date, Instant at) {
        Map<String, String> payload = base(habit);
        payload.put(COMPLETION_DATE, date.toString());
        payload.put(NEW_STREAK_COUNT, Integer.toString(habit.streakCount()));
        return event(HABIT_UNCOMPLETED, habit, payload, at);
    }

    static DomainEvent streakBroken(Habit habit, int previousStreak, long daysMissed, Instant at) {
        Map<String, String> payload = base(habit);
        payload.put(PREVIOUS_STREAK_COUNT, Integer.toString(previousStreak));
        payload.put(DAYS_MISSED, Long.toString(daysMissed));
        return event(HABIT_STREAK_BROKEN, habit, payload, at);
    }

    static DomainEvent streakReset(Habit habit, int previousStreak, Instant at) {
        Map<String, String> payload = base(habit);
        payload.put(PREVIOUS_STREAK_COUNT, Integer.toString(previousStreak));
        return event(HABIT_STREAK_RESET, habit, payload, at);
    }

    static DomainEvent milestoneReached(Habit habit, Milestone milestone, LocalDate date, Instant at) {
        Map<String, String> payload = base(habit);
        payload.put(COMPLETION_DATE, date.toString());
        payload.put(MILESTONE_TYPE, milestone.label());
        payload.put(STREAK_COUNT, Integer.toString(habit.streakCount()));
        return event(HABIT_MILESTONE_REACHED, habit, payload, at);
    }

    static DomainEvent deleted(Habit habit, Instant at) {
        return event(HABIT_DELETED, habit, base(habit), at);
    }

    private static Map<String, String> base(Habit habit) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put(HABIT_ID, habit.id());
        payload.put(USER_ID, habit.userId());
        return payload;
    }

    private static DomainEvent event(String type, Habit habit, Map<String, String> payload, Instant at) {
        return DomainEvent.builder(type)
                .streamId(habit.id())
                .aggregateType(AGGREGATE_TYPE)
                .payload(payload)
                .metadata(EventMetadata.forUser(habit.userId()))
                .occurredAt(at)
                .build();
    }
}
