/**
 * Habit analytics read model.
 */
package ledger.habit.projection;
