package ledger.registry;

import ledger.EventHandler;

import java.util.List;
import java.util.Map;

/**
 * Registry for looking up event handlers by event type.
 *
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

    /**
     * Returns the handlers for an event type: handlers registered for the exact type in
     * registration order, followed by wildcard ({@code "*"}) handlers.
     *
     * @param eventType the event type to look up
     * @return immutable list of matching handlers, may be empty
     */
    List<EventHandler> handlersFor(String eventType);

    /**
     * Returns the number of handlers registered per event type key, including {@code "*"}.
     */
    Map<String, Integer> handlerCounts();
}
