package ledger.habit.command;

import ledger.command.Command;

import java.time.LocalDate;

/**
 * Marks a habit completed on a day ({@code null} means today).
 */
public record CompleteHabitCommand(
        String userId,
        String habitId,
        LocalDate date,
        String correlationId) implements Command<Void> {

    public CompleteHabitCommand(String userId, String habitId, LocalDate date) {
        this(userId, habitId, date, null);
    }
}
