package ledger.model;

import java.util.List;
import java.util.Objects;

/**
 * A page of events read from a single stream.
 *
 * @param streamId      the stream that was read
 * @param events        events in ascending stream version order
 * @param streamVersion current version of the whole stream, {@code 0} if it does not exist
 * @param hasMoreEvents whether events beyond this page exist
 */
public record StreamSlice(String streamId, List<DomainEvent> events, long streamVersion, boolean hasMoreEvents) {
    public StreamSlice {
        Objects.requireNonNull(streamId, "streamId");
        events = List.copyOf(events);
    }

    public long lastVersionRead() {
        return events.isEmpty() ? 0L : events.get(events.size() - 1).streamVersion();
    }
}
