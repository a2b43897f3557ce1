package ledger.habit.projection;

import ledger.habit.HabitEvents;
import ledger.model.DomainEvent;
import ledger.projection.AbstractProjection;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory analytics read model over habit events: per-habit totals and streaks, per-user
 * daily counters and a per-user journey with a growth score.
 *
 * <p>State is rebuilt from the log on every start. Each stored value is an immutable record,
 * so readers always see a consistent entry.
 */
public final class HabitAnalyticsProjection extends AbstractProjection {
    public static final String NAME = "HabitAnalytics";

    private final Map<String, HabitStats> habits = new ConcurrentHashMap<>();
    private final Map<String, UserJourney> journeys = new ConcurrentHashMap<>();
    private final Map<String, DailyStats> daily = new ConcurrentHashMap<>();

    public HabitAnalyticsProjection() {
        super(NAME);
        on(HabitEvents.HABIT_CREATED, this::onCreated);
        on(HabitEvents.HABIT_COMPLETED, this::onCompleted);
        on(HabitEvents.HABIT_UNCOMPLETED, this::onUncompleted);
        on(HabitEvents.HABIT_STREAK_BROKEN, this::onStreakEnded);
        on(HabitEvents.HABIT_STREAK_RESET, this::onStreakEnded);
        on(HabitEvents.HABIT_MILESTONE_REACHED, this::onMilestone);
        on(HabitEvents.HABIT_DELETED, this::onDeleted);
    }

    private void onCreated(DomainEvent event) {
        String habitId = required(event, HabitEvents.HABIT_ID);
        String userId = required(event, HabitEvents.USER_ID);
        habits.put(habitId, new HabitStats(habitId, userId, event.payload().getOrDefault(HabitEvents.TITLE, ""),
                0, 0, 0, null, event.occurredAt()));
        touch(event, userId, 1, 0, 0);
    }

    private void onCompleted(DomainEvent event) {
        String habitId = required(event, HabitEvents.HABIT_ID);
        String userId = required(event, HabitEvents.USER_ID);
        LocalDate date = LocalDate.parse(required(event, HabitEvents.COMPLETION_DATE));
        int newStreak = Integer.parseInt(required(event, HabitEvents.NEW_STREAK_COUNT));
        habits.computeIfPresent(habitId, (id, stats) -> stats.completed(date, newStreak));
        addDaily(userId, date, 1, 0);
        touch(event, userId, 0, 1, 0);
    }

    private void onUncompleted(DomainEvent event) {
        String habitId = required(event, HabitEvents.HABIT_ID);
        String userId = required(event, HabitEvents.USER_ID);
        LocalDate date = LocalDate.parse(required(event, HabitEvents.COMPLETION_DATE));
        int newStreak = Integer.parseInt(required(event, HabitEvents.NEW_STREAK_COUNT));
        habits.computeIfPresent(habitId, (id, stats) -> stats.uncompleted(newStreak));
        addDaily(userId, date, -1, 0);
        touch(event, userId, 0, -1, 0);
    }

    private void onStreakEnded(DomainEvent event) {
        String habitId = required(event, HabitEvents.HABIT_ID);
        int previous = Integer.parseInt(required(event, HabitEvents.PREVIOUS_STREAK_COUNT));
        habits.computeIfPresent(habitId, (id, stats) -> stats.streakEnded(previous));
        touch(event, required(event, HabitEvents.USER_ID), 0, 0, 0);
    }

    private void onMilestone(DomainEvent event) {
        String userId = required(event, HabitEvents.USER_ID);
        // counted on the completion day; events without one fall back to the UTC day they occurred
        String completionDate = event.payload().get(HabitEvents.COMPLETION_DATE);
        addDaily(userId, completionDate != null ? LocalDate.parse(completionDate) : utcDay(event), 0, 1);
        touch(event, userId, 0, 0, 1);
    }

    private void onDeleted(DomainEvent event) {
        habits.remove(required(event, HabitEvents.HABIT_ID));
        touch(event, required(event, HabitEvents.USER_ID), 0, 0, 0);
    }

    private void touch(DomainEvent event, String userId, int created, int completions, int milestones) {
        journeys.compute(userId, (id, journey) -> (journey != null ? journey : UserJourney.start(id))
                .record(event.occurredAt(), utcDay(event), created, completions, milestones));
    }

    private void addDaily(String userId, LocalDate date, int completions, int milestones) {
        daily.compute(dailyKey(userId, date), (key, stats) ->
                (stats != null ? stats : DailyStats.empty(userId, date)).plus(completions, milestones));
    }

    private static String required(DomainEvent event, String field) {
        String value = event.payload().get(field);
        if (value == null) {
            throw new IllegalArgumentException(event.eventType() + " event " + event.eventId()
                    + " is missing " + field);
        }
        return value;
    }

    private static LocalDate utcDay(DomainEvent event) {
        return LocalDate.ofInstant(event.occurredAt(), ZoneOffset.UTC);
    }

    private static String dailyKey(String userId, LocalDate date) {
        return userId + '|' + date;
    }

    @Override
    public void reset() {
        habits.clear();
        journeys.clear();
        daily.clear();
    }

    public Optional<HabitStats> habitStats(String habitId) {
        return Optional.ofNullable(habits.get(habitId));
    }

    /**
     * Returns a user's habit stats ordered by creation time.
     */
    public List<HabitStats> habitStatsForUser(String userId) {
        List<HabitStats> result = new ArrayList<>();
        for (HabitStats stats : habits.values()) {
            if (stats.userId().equals(userId)) {
                result.add(stats);
            }
        }
        result.sort(Comparator.comparing(HabitStats::createdAt).thenComparing(HabitStats::habitId));
        return result;
    }

    public Optional<UserJourney> journey(String userId) {
        return Optional.ofNullable(journeys.get(userId));
    }

    /**
     * Returns a user's daily counters between two days inclusive, oldest first.
     */
    public List<DailyStats> dailyStats(String userId, LocalDate from, LocalDate to) {
        List<DailyStats> result = new ArrayList<>();
        for (DailyStats stats : daily.values()) {
            if (stats.userId().equals(userId) && !stats.date().isBefore(from) && !stats.date().isAfter(to)) {
                result.add(stats);
            }
        }
        result.sort(Comparator.comparing(DailyStats::date));
        return result;
    }

    /**
     * Returns an immutable copy of the whole read model, for comparison and diagnostics.
     */
    public AnalyticsSnapshot snapshot() {
        return new AnalyticsSnapshot(new TreeMap<>(habits), new TreeMap<>(journeys), new TreeMap<>(daily));
    }

    /**
     * Immutable copy of the read model.
     */
    public record AnalyticsSnapshot(
            Map<String, HabitStats> habits,
            Map<String, UserJourney> journeys,
            Map<String, DailyStats> daily) {

        public AnalyticsSnapshot {
            habits = Map.copyOf(habits);
            journeys = Map.copyOf(journeys);
            daily = Map.copyOf(daily);
        }
    }
}
