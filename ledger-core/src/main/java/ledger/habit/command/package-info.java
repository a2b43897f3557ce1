/**
 * Habit commands and their handlers.
 *
 * <p>Every handler follows the same steps: load the aggregate, check that the issuing user
 * owns it, apply the aggregate's rule, store the aggregate, then publish the recorded events.
 * Expected failures are returned as {@link ledger.Result.Err} with these messages:
 * "Plan not found", "Unauthorized: Plan does not belong to user", "Habit not found",
 * "Unauthorized: Habit does not belong to user" and the aggregate's rule messages.
 */
package ledger.habit.command;
