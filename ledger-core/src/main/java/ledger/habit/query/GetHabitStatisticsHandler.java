package ledger.habit.query;

import ledger.ErrorKind;
import ledger.habit.Habit;
import ledger.habit.HabitEvents;
import ledger.habit.HabitRepository;
import ledger.model.DomainEvent;
import ledger.query.QueryException;
import ledger.query.QueryHandler;
import ledger.spi.EventStore;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Computes completion statistics from the habit repository and the user's completion
 * events.
 *
 * <p>A habit-day counts as completed when a {@code HabitCompleted} event for that day is not
 * followed by a {@code HabitUncompleted} event for the same day. A habit-day is due when the
 * habit existed on that day and its schedule was due.
 */
public final class GetHabitStatisticsHandler implements QueryHandler<GetHabitStatisticsQuery, HabitStatistics> {
    static final int DEFAULT_RANGE_DAYS = 30;
    private static final int WEEK = 7;

    private final HabitRepository habits;
    private final EventStore eventStore;
    private final Clock clock;

    public GetHabitStatisticsHandler(HabitRepository habits, EventStore eventStore, Clock clock) {
        this.habits = Objects.requireNonNull(habits, "habits");
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public HabitStatistics handle(GetHabitStatisticsQuery query) {
        LocalDate to = query.to() != null ? query.to() : LocalDate.now(clock);
        LocalDate from = query.from() != null ? query.from() : to.minusDays(DEFAULT_RANGE_DAYS - 1);
        if (from.isAfter(to)) {
            throw new QueryException(ErrorKind.VALIDATION, "from must not be after to");
        }
        List<Habit> owned = HabitQuerySupport.habitsOf(habits, query.userId());
        Set<String> completedDays = completedHabitDays(query.userId());

        int longest = 0;
        long streakSum = 0;
        int completedToday = 0;
        for (Habit habit : owned) {
            longest = Math.max(longest, habit.longestStreak());
            streakSum += habit.streakCount();
            if (completedDays.contains(key(habit.id(), to))) {
                completedToday++;
            }
        }

        long due = 0;
        long completed = 0;
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            for (Habit habit : owned) {
                if (isDue(habit, day)) {
                    due++;
                    if (completedDays.contains(key(habit.id(), day))) {
                        completed++;
                    }
                }
            }
        }

        List<HabitStatistics.DailyProgress> weekly = new ArrayList<>(WEEK);
        for (LocalDate day = to.minusDays(WEEK - 1); !day.isAfter(to); day = day.plusDays(1)) {
            int dayDue = 0;
            int dayCompleted = 0;
            for (Habit habit : owned) {
                if (isDue(habit, day)) {
                    dayDue++;
                    if (completedDays.contains(key(habit.id(), day))) {
                        dayCompleted++;
                    }
                }
            }
            weekly.add(new HabitStatistics.DailyProgress(day, dayCompleted, dayDue));
        }

        double average = owned.isEmpty() ? 0.0d : (double) streakSum / owned.size();
        double rate = due == 0 ? 0.0d : Math.min(100.0d, completed * 100.0d / due);
        return new HabitStatistics(owned.size(), completedToday, average, longest, rate, weekly);
    }

    private Set<String> completedHabitDays(String userId) {
        Set<String> days = new HashSet<>();
        for (DomainEvent event : eventStore.readEventsByUserId(userId, null, null)) {
            String date = event.payload().get(HabitEvents.COMPLETION_DATE);
            if (date == null) {
                continue;
            }
            String key = key(event.streamId(), LocalDate.parse(date));
            if (HabitEvents.HABIT_COMPLETED.equals(event.eventType())) {
                days.add(key);
            } else if (HabitEvents.HABIT_UNCOMPLETED.equals(event.eventType())) {
                days.remove(key);
            }
        }
        return days;
    }

    private static boolean isDue(Habit habit, LocalDate day) {
        LocalDate created = LocalDate.ofInstant(habit.createdAt(), ZoneOffset.UTC);
        return !day.isBefore(created) && habit.schedule().isDueOn(day);
    }

    private static String key(String habitId, LocalDate day) {
        return habitId + '|' + day;
    }
}
