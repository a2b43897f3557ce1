package ledger.habit.projection;

import ledger.MutableClock;
import ledger.bus.EventSourcedEventBus;
import ledger.habit.Habit;
import ledger.habit.HabitSchedule;
import ledger.model.DomainEvent;
import ledger.model.ProjectionState;
import ledger.projection.ProjectionManager;
import ledger.store.InMemoryEventStore;
import ledger.store.InMemoryProjectionStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HabitAnalyticsProjectionTest {
    private final MutableClock clock = MutableClock.at("2026-03-02T08:00:00Z");
    private final InMemoryEventStore store = new InMemoryEventStore(clock);
    private final EventSourcedEventBus eventBus = EventSourcedEventBus.builder().eventStore(store).build();
    private final HabitAnalyticsProjection projection = new HabitAnalyticsProjection();
    private final ProjectionManager manager = ProjectionManager.builder()
            .eventStore(store)
            .stateStore(new InMemoryProjectionStateStore())
            .clock(clock)
            .build();

    @AfterEach
    void tearDown() {
        manager.close();
    }

    // Daily completions of one habit, publishing every event the aggregate records.
    private Habit recordDays(String userId, int days) {
        Habit habit = Habit.create(userId, "p1", "Read", HabitSchedule.DAILY, clock.instant());
        eventBus.publishEvents(habit.pullEvents(null));
        LocalDate day = LocalDate.now(clock);
        for (int i = 0; i < days; i++) {
            habit.markCompleted(day.plusDays(i), clock.instant());
            eventBus.publishEvents(habit.pullEvents(null));
            clock.advance(Duration.ofDays(1));
        }
        return habit;
    }

    @Test
    void tracksCompletionsStreaksAndMilestones() {
        Habit habit = recordDays("u1", 8);
        manager.registerProjection(projection);
        manager.catchUp(HabitAnalyticsProjection.NAME);

        HabitStats stats = projection.habitStats(habit.id()).orElseThrow();
        assertEquals(8, stats.totalCompletions());
        assertEquals(8, stats.currentStreak());
        assertEquals(8, stats.longestStreak());

        UserJourney journey = projection.journey("u1").orElseThrow();
        assertEquals(1, journey.habitsCreated());
        assertEquals(8, journey.totalCompletions());
        assertEquals(1, journey.milestonesReached());
        assertEquals(8, journey.totalDaysActive());
        assertEquals(6.0d, journey.growthScore(), 1e-9);
    }

    @Test
    void brokenStreakResetsCurrentButKeepsLongest() {
        Habit habit = Habit.create("u1", "p1", "Read", HabitSchedule.DAILY, clock.instant());
        LocalDate day = LocalDate.now(clock);
        habit.markCompleted(day, clock.instant());
        habit.markCompleted(day.plusDays(1), clock.instant());
        habit.markCompleted(day.plusDays(5), clock.instant());
        eventBus.publishEvents(habit.pullEvents(null));
        manager.registerProjection(projection);
        manager.catchUp(HabitAnalyticsProjection.NAME);

        HabitStats stats = projection.habitStats(habit.id()).orElseThrow();
        assertEquals(1, stats.currentStreak());
        assertEquals(2, stats.longestStreak());
        assertEquals(3, stats.totalCompletions());
    }

    @Test
    void dailyStatsCountCompletionsPerDay() {
        recordDays("u1", 3);
        manager.registerProjection(projection);
        manager.catchUp(HabitAnalyticsProjection.NAME);

        LocalDate first = LocalDate.of(2026, 3, 2);
        List<DailyStats> days = projection.dailyStats("u1", first, first.plusDays(1));

        assertEquals(2, days.size());
        assertEquals(first, days.get(0).date());
        assertEquals(1, days.get(0).habitsCompleted());
    }

    @Test
    void backDatedMilestoneCountsOnItsCompletionDay() {
        Habit habit = Habit.create("u1", "p1", "Read", HabitSchedule.DAILY, clock.instant());
        LocalDate start = LocalDate.of(2026, 2, 1);
        for (int i = 0; i < 7; i++) {
            habit.markCompleted(start.plusDays(i), clock.instant());
        }
        eventBus.publishEvents(habit.pullEvents(null));
        manager.registerProjection(projection);
        manager.catchUp(HabitAnalyticsProjection.NAME);

        LocalDate seventh = start.plusDays(6);
        List<DailyStats> milestoneDay = projection.dailyStats("u1", seventh, seventh);
        List<DailyStats> recordedDay = projection.dailyStats("u1", LocalDate.now(clock), LocalDate.now(clock));

        assertEquals(1, milestoneDay.size());
        assertEquals(1, milestoneDay.get(0).milestones());
        assertEquals(1, milestoneDay.get(0).habitsCompleted());
        assertTrue(recordedDay.isEmpty());
    }

    @Test
    void deletedHabitDisappearsFromStats() {
        Habit habit = recordDays("u1", 1);
        habit.markDeleted(clock.instant());
        eventBus.publishEvents(habit.pullEvents(null));
        manager.registerProjection(projection);
        manager.catchUp(HabitAnalyticsProjection.NAME);

        assertTrue(projection.habitStats(habit.id()).isEmpty());
        assertTrue(projection.habitStatsForUser("u1").isEmpty());
    }

    @Test
    void resetAfterHundredEventsRebuildsIdenticalModel() {
        List<DomainEvent> all = new ArrayList<>();
        for (int user = 0; user < 4; user++) {
            recordDays("u" + user, 24);
        }
        all.addAll(store.allEvents());
        assertTrue(all.size() >= 100);
        manager.registerProjection(projection);
        manager.catchUp(HabitAnalyticsProjection.NAME);
        HabitAnalyticsProjection.AnalyticsSnapshot before = projection.snapshot();

        ProjectionState state = manager.resetProjection(HabitAnalyticsProjection.NAME).orElseThrow();

        assertEquals(all.size(), state.lastProcessedEventNumber());
        assertEquals(0, state.errorCount());
        assertTrue(state.running());
        assertEquals(before, projection.snapshot());
    }

    @Test
    void exactlyHundredEventsCheckpointAtHundred() {
        Habit habit = Habit.create("u1", "p1", "Read", HabitSchedule.DAILY, clock.instant());
        eventBus.publishEvents(habit.pullEvents(null));
        LocalDate day = LocalDate.now(clock);
        int offset = 0;
        while (store.getEventCount() < 100) {
            habit.markCompleted(day.plusDays(offset), clock.instant());
            List<DomainEvent> events = habit.pullEvents(null);
            long room = 100 - store.getEventCount();
            eventBus.publishEvents(events.subList(0, (int) Math.min(room, events.size())));
            offset++;
        }
        manager.registerProjection(projection);

        ProjectionState state = manager.resetProjection(HabitAnalyticsProjection.NAME).orElseThrow();

        assertEquals(100L, state.lastProcessedEventNumber());
        assertEquals(0, state.errorCount());
    }

    @Test
    void malformedEventStopsProjection() {
        store.append(DomainEvent.builder("HabitCompleted").streamId("h1").payload(Map.of("habitId", "h1")).build());
        manager.registerProjection(projection);

        ProjectionState state = manager.catchUp(HabitAnalyticsProjection.NAME).orElseThrow();

        assertEquals(0L, state.lastProcessedEventNumber());
        assertEquals(1, state.errorCount());
        assertTrue(state.lastError().contains("userId"));
    }
}
