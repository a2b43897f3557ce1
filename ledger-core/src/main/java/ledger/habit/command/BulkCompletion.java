package ledger.habit.command;

import java.util.List;

/**
 * Outcome of a bulk completion.
 *
 * @param requested number of ids in the request, repeats included
 * @param completed number of items that were completed and stored
 * @param outcomes  one entry per requested id, in request order
 */
public record BulkCompletion(int requested, int completed, List<ItemOutcome> outcomes) {
    public BulkCompletion {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * Returns {@code true} when at least one item was skipped.
     */
    public boolean isPartialFailure() {
        return completed < requested;
    }

    public long count(ItemOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    /**
     * Result of one item of a bulk request.
     *
     * @param habitId the requested id
     * @param status  what happened to it
     * @param message the rejection message, or {@code null} when completed
     */
    public record ItemOutcome(String habitId, Status status, String message) {

        /**
         * Terminal state of an item: {@code COMPLETED} on success, otherwise the check
         * that skipped it.
         */
        public enum Status {
            COMPLETED,
            NOT_FOUND,
            UNAUTHORIZED,
            REJECTED
        }

        static ItemOutcome completed(String habitId) {
            return new ItemOutcome(habitId, Status.COMPLETED, null);
        }
    }
}
