package ledger.habit.query;

import ledger.ErrorKind;
import ledger.Result;
import ledger.habit.Habit;
import ledger.habit.HabitRepository;
import ledger.query.QueryException;
import ledger.query.QueryHandler;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Returns {@code null} for a missing habit and fails with {@code UNAUTHORIZED} for a habit
 * owned by another user.
 */
public final class GetHabitByIdHandler implements QueryHandler<GetHabitByIdQuery, HabitView> {
    private final HabitRepository habits;
    private final Clock clock;

    public GetHabitByIdHandler(HabitRepository habits, Clock clock) {
        this.habits = Objects.requireNonNull(habits, "habits");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public HabitView handle(GetHabitByIdQuery query) {
        Result<Habit> found = habits.findById(query.habitId());
        if (found instanceof Result.Err<Habit> err) {
            if (err.kind() == ErrorKind.NOT_FOUND) {
                return null;
            }
            throw new QueryException(err.kind(), err.message());
        }
        Habit habit = found.orElseThrow();
        if (!habit.userId().equals(query.userId())) {
            throw new QueryException(ErrorKind.UNAUTHORIZED, "Unauthorized: Habit does not belong to user");
        }
        return HabitView.of(habit, LocalDate.now(clock));
    }
}
