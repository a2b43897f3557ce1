package ledger.model;

/**
 * Aggregate view over every registered projection.
 *
 * @param running                 whether the projection manager's catch-up loop is started
 * @param registeredProjections   number of registered projections
 * @param activeProjections       projections whose state is running
 * @param totalEventsProcessed    sum of all projection checkpoints
 */
public record ProjectionStatus(
        boolean running,
        int registeredProjections,
        int activeProjections,
        long totalEventsProcessed) {
}
