package ledger.habit.command;

import ledger.command.Command;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Completes several habits on the same day. Repeated ids are processed once per occurrence.
 */
public record BulkCompleteHabitsCommand(
        String userId,
        List<String> habitIds,
        LocalDate date,
        String correlationId) implements Command<BulkCompletion> {

    public BulkCompleteHabitsCommand {
        habitIds = habitIds == null ? null : Collections.unmodifiableList(new ArrayList<>(habitIds));
    }

    public BulkCompleteHabitsCommand(String userId, List<String> habitIds, LocalDate date) {
        this(userId, habitIds, date, null);
    }
}
