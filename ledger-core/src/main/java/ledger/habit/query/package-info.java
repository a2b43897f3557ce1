/**
 * Habit queries, their handlers and cacheable result views.
 */
package ledger.habit.query;
