package ledger.bus;

import ledger.EventHandler;
import ledger.Result;
import ledger.model.DomainEvent;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * In-process publish/subscribe dispatcher for domain events.
 *
 * <p>Publishing stores the events first and dispatches them only once they are durable.
 * Delivery is at-least-once within the process lifetime; there is no redelivery across
 * restarts. Durable replay is the job of {@link ledger.projection.ProjectionManager}.
 */
public interface EventBus {

    /**
     * Stores and dispatches one event.
     *
     * @return the stored event list (one element), or a {@code STORAGE} error if the append failed
     */
    default Result<List<DomainEvent>> publish(DomainEvent event) {
        return publishEvents(List.of(event));
    }

    /**
     * Stores a batch atomically, then dispatches each event in input order. Handler failures
     * are isolated and never fail the call.
     *
     * @param events events to publish
     * @return the stored events with their positions, or the store's error (in which case
     *         nothing is dispatched); a store that throws is reported as {@code STORAGE}
     */
    Result<List<DomainEvent>> publishEvents(List<DomainEvent> events);

    /**
     * Stores events of one stream if its version is still {@code expectedVersion}, then
     * dispatches them as {@link #publishEvents} does.
     *
     * @return the stored events, {@code CONFLICT} if the stream moved on, or the store's error
     */
    Result<List<DomainEvent>> publishToStream(String streamId, long expectedVersion, List<DomainEvent> events);

    /**
     * Returns the current version of a stream, {@code 0} if it has no events.
     */
    long streamVersion(String streamId);

    /**
     * Runs {@code write} holding this bus's lock for one stream. Writers of the same stream
     * through the same bus run one at a time, so their events are stored in the order their
     * state changes were made. The lock is reentrant.
     */
    <T> Result<T> withStreamLock(String streamId, Supplier<Result<T>> write);

    /**
     * Registers a handler for an event type, or {@code "*"} for every type.
     */
    void subscribe(String eventType, EventHandler handler);

    /**
     * Removes one registration of a handler.
     *
     * @return {@code true} if it was registered
     */
    boolean unsubscribe(String eventType, EventHandler handler);

    /**
     * Returns the number of handlers registered per event type.
     */
    Map<String, Integer> getRegisteredHandlers();

    /**
     * Reads every stored event of a stream in version order, for aggregate rehydration.
     * Nothing is dispatched.
     */
    List<DomainEvent> replayStream(String streamId);
}
