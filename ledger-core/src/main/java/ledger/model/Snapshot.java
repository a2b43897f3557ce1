package ledger.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Serialized aggregate state captured at a stream version, used to shorten rehydration.
 *
 * @param streamId      the aggregate stream
 * @param streamVersion version of the last event folded into {@code state}
 * @param state         flat aggregate state
 * @param takenAt       capture time
 */
public record Snapshot(String streamId, long streamVersion, Map<String, String> state, Instant takenAt) {
    public Snapshot {
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(takenAt, "takenAt");
        if (streamVersion <= 0) {
            throw new IllegalArgumentException("streamVersion must be > 0");
        }
        state = Map.copyOf(state);
    }
}
