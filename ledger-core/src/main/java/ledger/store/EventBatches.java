package ledger.store;

import ledger.ErrorKind;
import ledger.Result;
import ledger.model.DomainEvent;

import java.time.Instant;
import java.util.List;

/**
 * Validation and filtering shared by event store implementations.
 */
public final class EventBatches {

    private EventBatches() {
    }

    /**
     * Checks that a batch can be appended.
     *
     * @param streamId the stream every event must belong to, or {@code null} for a multi-stream batch
     * @param events   the batch
     * @return {@code Ok} or a {@code VALIDATION} error describing the first bad event
     */
    public static Result<Void> validate(String streamId, List<DomainEvent> events) {
        if (events == null) {
            return Result.err(ErrorKind.VALIDATION, "events cannot be null");
        }
        for (DomainEvent event : events) {
            if (event == null) {
                return Result.err(ErrorKind.VALIDATION, "events cannot contain null");
            }
            if (event.isAppended()) {
                return Result.err(ErrorKind.VALIDATION, "Event " + event.eventId() + " has already been appended");
            }
            if (streamId != null && !streamId.equals(event.streamId())) {
                return Result.err(ErrorKind.VALIDATION, "Event " + event.eventId() + " belongs to stream "
                        + event.streamId() + ", not " + streamId);
            }
        }
        return Result.ok(null);
    }

    public static String versionConflict(String streamId, long expected, long actual) {
        return "Expected stream " + streamId + " at version " + expected + " but it is at version " + actual;
    }

    /**
     * Inclusive range check on {@code occurredAt}; {@code null} bounds are open.
     */
    public static boolean inRange(DomainEvent event, Instant from, Instant to) {
        Instant at = event.occurredAt();
        return (from == null || !at.isBefore(from)) && (to == null || !at.isAfter(to));
    }
}
