package ledger.model;

/**
 * Contextual metadata recorded alongside every event.
 *
 * <p>All fields are optional. {@code userId} is the originating user and is indexed by the
 * event store; {@code correlationId} ties together every event produced by one command and
 * {@code causationId} names the event or command that caused this one.
 *
 * @param userId        originating user, or {@code null} for system events
 * @param traceId       distributed trace identifier, or {@code null}
 * @param correlationId correlation identifier, or {@code null}
 * @param causationId   causing message identifier, or {@code null}
 */
public record EventMetadata(String userId, String traceId, String correlationId, String causationId) {

    /** Metadata with every field absent. */
    public static final EventMetadata EMPTY = new EventMetadata(null, null, null, null);

    public static EventMetadata forUser(String userId) {
        return new EventMetadata(userId, null, null, null);
    }

    public EventMetadata withCorrelationId(String correlationId) {
        return new EventMetadata(userId, traceId, correlationId, causationId);
    }

    public EventMetadata withTraceId(String traceId) {
        return new EventMetadata(userId, traceId, correlationId, causationId);
    }
}
