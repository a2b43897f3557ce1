package ledger.habit;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HabitScheduleTest {
    private static final LocalDate SUNDAY = LocalDate.of(2026, 3, 1);
    private static final LocalDate MONDAY = LocalDate.of(2026, 3, 2);

    @Test
    void dailyIsAlwaysDue() {
        assertTrue(HabitSchedule.DAILY.isDueOn(SUNDAY));
        assertTrue(HabitSchedule.DAILY.isDueOn(MONDAY));
    }

    @Test
    void weeklyUsesZeroForSunday() {
        HabitSchedule schedule = HabitSchedule.weekly(0);

        assertTrue(schedule.isDueOn(SUNDAY));
        assertFalse(schedule.isDueOn(MONDAY));
    }

    @Test
    void weeklyWithoutDaysIsDueEveryDay() {
        assertTrue(HabitSchedule.weekly().isDueOn(MONDAY));
    }

    @Test
    void customRequiresDays() {
        assertThrows(IllegalArgumentException.class, () -> HabitSchedule.custom());
    }

    @Test
    void rejectsOutOfRangeDays() {
        assertThrows(IllegalArgumentException.class, () -> HabitSchedule.weekly(7));
        assertThrows(IllegalArgumentException.class, () -> HabitSchedule.weekly(-1));
    }

    @Test
    void daysAreSortedAndDistinct() {
        assertEquals(List.of(1, 3, 5), HabitSchedule.custom(5, 1, 3, 1).days());
    }

    @Test
    void encodeAndParseAgree() {
        assertEquals("daily", HabitSchedule.DAILY.encode());
        assertEquals("weekly:1,3,5", HabitSchedule.weekly(5, 3, 1).encode());
        assertEquals(HabitSchedule.custom(0, 6), HabitSchedule.parse("custom:0,6"));
        assertEquals(HabitSchedule.DAILY, HabitSchedule.parse("DAILY"));
    }

    @Test
    void parseRejectsUnknownFrequency() {
        assertThrows(IllegalArgumentException.class, () -> HabitSchedule.parse("hourly"));
        assertThrows(IllegalArgumentException.class, () -> HabitSchedule.parse("weekly:x"));
    }

    @Test
    void milestonesAreReachedAtExactStreaks() {
        assertEquals(Optional.of(Milestone.WEEK), Milestone.reachedAt(7));
        assertEquals(Optional.of(Milestone.MONTH), Milestone.reachedAt(30));
        assertEquals(Optional.of(Milestone.QUARTER), Milestone.reachedAt(90));
        assertEquals(Optional.of(Milestone.YEAR), Milestone.reachedAt(365));
        assertEquals(Optional.empty(), Milestone.reachedAt(8));
    }
}
