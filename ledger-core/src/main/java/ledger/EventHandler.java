package ledger;

import ledger.model.DomainEvent;

/**
 * Receives published domain events from the {@link ledger.bus.EventBus}.
 *
 * <p>Handlers run synchronously on the publishing thread after the event is durable.
 * An exception thrown by one handler is logged and does not stop the other handlers
 * or fail the publisher.
 *
 * @see ledger.registry.HandlerRegistry
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * Handles a stored event.
     *
     * @param event the event, carrying its assigned event number
     * @throws Exception if handling fails
     */
    void handle(DomainEvent event) throws Exception;
}
