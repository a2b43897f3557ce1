package ledger.habit.command;

import ledger.command.Command;

public record ResetHabitStreakCommand(String userId, String habitId, String correlationId) implements Command<Void> {
}
