package ledger.habit.command;

import ledger.command.Command;

public record DeleteHabitCommand(String userId, String habitId, String correlationId) implements Command<Void> {
}
