package ledger.habit.command;

import ledger.command.Command;

import java.time.LocalDate;

/**
 * Undoes the completion recorded on a day ({@code null} means today).
 */
public record UncompleteHabitCommand(
        String userId,
        String habitId,
        LocalDate date,
        String correlationId) implements Command<Void> {
}
