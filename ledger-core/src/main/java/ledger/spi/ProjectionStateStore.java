package ledger.spi;

import ledger.model.ProjectionState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for projection checkpoints.
 *
 * <p>Only the projection manager writes through this interface. Implementations must be
 * thread-safe; the manager guarantees that at most one catch-up run writes a given
 * projection's state at a time.
 */
public interface ProjectionStateStore {

    /**
     * Creates the state row for a projection if absent.
     *
     * @param projectionName the projection
     * @return the stored state, existing or newly created
     */
    ProjectionState register(String projectionName);

    Optional<ProjectionState> find(String projectionName);

    List<ProjectionState> findAll();

    /**
     * Advances the checkpoint.
     *
     * @param projectionName the projection
     * @param eventNumber    the last applied event number
     * @param processedAt    when it was applied
     */
    void saveCheckpoint(String projectionName, long eventNumber, Instant processedAt);

    /**
     * Increments the error count, records the message and marks the projection stopped.
     */
    void recordFailure(String projectionName, String error);

    void markRunning(String projectionName, boolean running);

    /**
     * Sets the checkpoint to zero, clears errors and marks the projection running.
     */
    void reset(String projectionName);
}
