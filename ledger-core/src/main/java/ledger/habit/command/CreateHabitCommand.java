package ledger.habit.command;

import ledger.command.Command;
import ledger.habit.HabitSchedule;

/**
 * Creates a habit in one of the user's plans. Succeeds with the new habit id.
 */
public record CreateHabitCommand(
        String userId,
        String planId,
        String title,
        HabitSchedule schedule,
        String correlationId) implements Command<String> {

    public CreateHabitCommand(String userId, String planId, String title, HabitSchedule schedule) {
        this(userId, planId, title, schedule, null);
    }
}
