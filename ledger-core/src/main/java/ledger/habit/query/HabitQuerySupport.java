package ledger.habit.query;

import ledger.ErrorKind;
import ledger.Result;
import ledger.habit.Habit;
import ledger.habit.HabitRepository;
import ledger.query.QueryException;

import java.util.List;

/**
 * Repository access shared by the habit query handlers. Repository errors become
 * {@link QueryException}s.
 */
final class HabitQuerySupport {

    private HabitQuerySupport() {
    }

    static List<Habit> habitsOf(HabitRepository habits, String userId) {
        requireUser(userId);
        Result<List<Habit>> found = habits.findByUserId(userId);
        if (found instanceof Result.Err<List<Habit>> err) {
            throw new QueryException(err.kind(), err.message());
        }
        return found.orElseThrow();
    }

    static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new QueryException(ErrorKind.VALIDATION, "userId is required");
        }
    }
}
