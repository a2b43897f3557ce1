package ledger.habit;

import com.github.f4b6a3.ulid.UlidCreator;
import ledger.ErrorKind;
import ledger.Result;
import ledger.model.DomainEvent;
import ledger.model.EventMetadata;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Habit aggregate: owns the streak rules and records the events its mutations produce.
 *
 * <p>Completion rules, by whole days between the last completion and the new one:
 * <ul>
 *   <li>0 days: rejected with {@code CONFLICT} "Habit already completed today";</li>
 *   <li>1 day: the streak grows by one;</li>
 *   <li>more: the streak restarts at 1, and a {@code HabitStreakBroken} event is recorded
 *       first when the previous streak was positive;</li>
 *   <li>negative: rejected with {@code VALIDATION}.</li>
 * </ul>
 * Reaching a streak of 7, 30, 90 or 365 days records a {@code HabitMilestoneReached} event
 * after the {@code HabitCompleted} event.
 *
 * <p>Rejected mutations leave the aggregate unchanged. Instances are not thread-safe;
 * repositories hand out copies.
 */
public final class Habit {
    private final String id;
    private final String userId;
    private final String planId;
    private final String title;
    private final HabitSchedule schedule;
    private final Instant createdAt;
    private int streakCount;
    private int longestStreak;
    private LocalDate lastCompletedOn;
    private long version;
    private final List<DomainEvent> pendingEvents = new ArrayList<>();

    private Habit(String id, String userId, String planId, String title, HabitSchedule schedule,
                  Instant createdAt, int streakCount, int longestStreak, LocalDate lastCompletedOn, long version) {
        this.id = Objects.requireNonNull(id, "id");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.planId = Objects.requireNonNull(planId, "planId");
        this.title = Objects.requireNonNull(title, "title");
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        if (streakCount < 0 || longestStreak < 0 || version < 0) {
            throw new IllegalArgumentException("streakCount, longestStreak and version must be >= 0");
        }
        this.streakCount = streakCount;
        this.longestStreak = Math.max(longestStreak, streakCount);
        this.lastCompletedOn = lastCompletedOn;
        this.version = version;
    }

    /**
     * Creates a new habit with a fresh ULID and records {@code HabitCreated}.
     */
    public static Habit create(String userId, String planId, String title, HabitSchedule schedule, Instant now) {
        Habit habit = new Habit(UlidCreator.getMonotonicUlid().toString(), userId, planId, title, schedule,
                now, 0, 0, null, 0L);
        habit.pendingEvents.add(HabitEvents.created(habit, now));
        return habit;
    }

    /**
     * Rebuilds a habit from stored state without recording events.
     */
    public static Habit restore(String id, String userId, String planId, String title, HabitSchedule schedule,
                                Instant createdAt, int streakCount, int longestStreak, LocalDate lastCompletedOn,
                                long version) {
        return new Habit(id, userId, planId, title, schedule, createdAt, streakCount, longestStreak,
                lastCompletedOn, version);
    }

    /**
     * Returns a copy of the current state without pending events.
     */
    public Habit copy() {
        return restore(id, userId, planId, title, schedule, createdAt, streakCount, longestStreak,
                lastCompletedOn, version);
    }

    /**
     * Records a completion on {@code date}.
     *
     * @param date the completion day
     * @param now  event timestamp
     * @return {@code Ok}, or the rule that rejected the completion
     */
    public Result<Void> markCompleted(LocalDate date, Instant now) {
        Objects.requireNonNull(date, "date");
        int previousStreak = streakCount;
        boolean maintained = false;
        List<DomainEvent> recorded = new ArrayList<>();
        int newStreak;
        if (lastCompletedOn == null) {
            newStreak = 1;
        } else {
            long daysDiff = ChronoUnit.DAYS.between(lastCompletedOn, date);
            if (daysDiff == 0) {
                return Result.err(ErrorKind.CONFLICT, "Habit already completed today");
            }
            if (daysDiff < 0) {
                return Result.err(ErrorKind.VALIDATION, "Completion date " + date
                        + " is before the last completion " + lastCompletedOn);
            }
            if (daysDiff == 1) {
                newStreak = streakCount + 1;
                maintained = true;
            } else {
                if (previousStreak > 0) {
                    recorded.add(HabitEvents.streakBroken(this, previousStreak, daysDiff, now));
                }
                newStreak = 1;
            }
        }
        streakCount = newStreak;
        longestStreak = Math.max(longestStreak, newStreak);
        lastCompletedOn = date;
        recorded.add(HabitEvents.completed(this, date, maintained, now));
        Milestone.reachedAt(newStreak).ifPresent(m -> recorded.add(HabitEvents.milestoneReached(this, m, date, now)));
        pendingEvents.addAll(recorded);
        return Result.ok(null);
    }

    /**
     * Undoes the most recent completion if it happened on {@code date}.
     */
    public Result<Void> markIncomplete(LocalDate date, Instant now) {
        Objects.requireNonNull(date, "date");
        if (lastCompletedOn == null) {
            return Result.err(ErrorKind.CONFLICT, "Habit was not completed");
        }
        if (!lastCompletedOn.equals(date)) {
            return Result.err(ErrorKind.CONFLICT, "Habit was not completed on " + date);
        }
        if (streakCount > 0) {
            streakCount--;
        }
        // The previous completion day is not tracked on the aggregate.
        lastCompletedOn = null;
        pendingEvents.add(HabitEvents.uncompleted(this, date, now));
        return Result.ok(null);
    }

    /**
     * Clears the streak and the last completion.
     */
    public Result<Void> resetStreak(Instant now) {
        int previous = streakCount;
        streakCount = 0;
        lastCompletedOn = null;
        pendingEvents.add(HabitEvents.streakReset(this, previous, now));
        return Result.ok(null);
    }

    /**
     * Records {@code HabitDeleted}; the repository removes the habit.
     */
    public void markDeleted(Instant now) {
        pendingEvents.add(HabitEvents.deleted(this, now));
    }

    /**
     * Returns and clears the recorded events, stamping them with a correlation id.
     *
     * @param correlationId correlation id of the command, or {@code null}
     */
    public List<DomainEvent> pullEvents(String correlationId) {
        List<DomainEvent> events = new ArrayList<>(pendingEvents.size());
        for (DomainEvent event : pendingEvents) {
            EventMetadata metadata = event.metadata();
            events.add(correlationId == null ? event : event.withMetadata(metadata.withCorrelationId(correlationId)));
        }
        pendingEvents.clear();
        return events;
    }

    public boolean hasPendingEvents() {
        return !pendingEvents.isEmpty();
    }

    public boolean isCompletedOn(LocalDate date) {
        return date.equals(lastCompletedOn);
    }

    public String id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    public String planId() {
        return planId;
    }

    public String title() {
        return title;
    }

    public HabitSchedule schedule() {
        return schedule;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public int streakCount() {
        return streakCount;
    }

    public int longestStreak() {
        return longestStreak;
    }

    public LocalDate lastCompletedOn() {
        return lastCompletedOn;
    }

    /**
     * Version the repository last stored; used for optimistic updates.
     */
    public long version() {
        return version;
    }

    @Override
    public String toString() {
        return "Habit{id=" + id + ", userId=" + userId + ", title=" + title
                + ", streakCount=" + streakCount + ", version=" + version + '}';
    }
}
