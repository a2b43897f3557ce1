package ledger.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Checkpoint and health of one projection.
 *
 * @param projectionName           unique projection name
 * @param lastProcessedEventNumber global event number of the last applied event, {@code 0} if none
 * @param lastProcessedAt          when the checkpoint last advanced, or {@code null}
 * @param running                  whether catch-up is enabled for the projection
 * @param errorCount               apply failures since the last reset
 * @param lastError                message of the most recent failure, or {@code null}
 */
public record ProjectionState(
        String projectionName,
        long lastProcessedEventNumber,
        Instant lastProcessedAt,
        boolean running,
        int errorCount,
        String lastError) {

    public ProjectionState {
        Objects.requireNonNull(projectionName, "projectionName");
        if (lastProcessedEventNumber < 0) {
            throw new IllegalArgumentException("lastProcessedEventNumber must be >= 0");
        }
    }

    public static ProjectionState initial(String projectionName) {
        return new ProjectionState(projectionName, 0L, null, true, 0, null);
    }

    public ProjectionState withCheckpoint(long eventNumber, Instant processedAt) {
        return new ProjectionState(projectionName, eventNumber, processedAt, running, errorCount, lastError);
    }

    public ProjectionState withFailure(String error) {
        return new ProjectionState(projectionName, lastProcessedEventNumber, lastProcessedAt, false,
                errorCount + 1, error);
    }

    public ProjectionState withRunning(boolean running) {
        return new ProjectionState(projectionName, lastProcessedEventNumber, lastProcessedAt, running,
                errorCount, lastError);
    }
}
