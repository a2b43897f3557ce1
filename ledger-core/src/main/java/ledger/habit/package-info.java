/**
 * Habit tracking reference domain: the habit aggregate, its events and repositories.
 *
 * <p>Command handlers live in {@code ledger.habit.command}, query handlers in
 * {@code ledger.habit.query} and the analytics read model in {@code ledger.habit.projection}.
 * {@link ledger.habit.HabitModule} registers all of them with a {@link ledger.Ledger}.
 */
package ledger.habit;
