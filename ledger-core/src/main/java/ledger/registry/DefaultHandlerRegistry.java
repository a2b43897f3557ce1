package ledger.registry;

import ledger.EventHandler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe registry of event handlers keyed by event type, with wildcard ({@code "*"})
 * support.
 *
 * <pre>{@code
 * DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
 *     .register("HabitCompleted", event -> notifier.congratulate(event))
 *     .registerAll(event -> audit.record(event));
 * }</pre>
 *
 * <p>Registrations and removals may happen while events are being published; lookups
 * return consistent snapshots.
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {
    public static final String ALL_EVENTS = "*";

    private final Map<String, CopyOnWriteArrayList<EventHandler>> handlers = new ConcurrentHashMap<>();

    /**
     * Registers a handler for an event type.
     *
     * @return this registry for chaining
     */
    public DefaultHandlerRegistry register(String eventType, EventHandler handler) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");
        if (eventType.isEmpty()) {
            throw new IllegalArgumentException("eventType cannot be empty");
        }
        handlers.computeIfAbsent(eventType, ignored -> new CopyOnWriteArrayList<>()).add(handler);
        return this;
    }

    /**
     * Registers a handler for every event type.
     *
     * @return this registry for chaining
     */
    public DefaultHandlerRegistry registerAll(EventHandler handler) {
        return register(ALL_EVENTS, handler);
    }

    /**
     * Removes one registration of a handler.
     *
     * @return {@code true} if the handler was registered for the type
     */
    public boolean unregister(String eventType, EventHandler handler) {
        CopyOnWriteArrayList<EventHandler> list = handlers.get(eventType);
        if (list == null) {
            return false;
        }
        boolean removed = list.remove(handler);
        handlers.computeIfPresent(eventType, (type, current) -> current.isEmpty() ? null : current);
        return removed;
    }

    @Override
    public List<EventHandler> handlersFor(String eventType) {
        List<EventHandler> result = new ArrayList<>();
        CopyOnWriteArrayList<EventHandler> specific = handlers.get(eventType);
        if (specific != null) {
            result.addAll(specific);
        }
        if (!ALL_EVENTS.equals(eventType)) {
            CopyOnWriteArrayList<EventHandler> all = handlers.get(ALL_EVENTS);
            if (all != null) {
                result.addAll(all);
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public Map<String, Integer> handlerCounts() {
        Map<String, Integer> counts = new TreeMap<>();
        handlers.forEach((type, list) -> {
            if (!list.isEmpty()) {
                counts.put(type, list.size());
            }
        });
        return Collections.unmodifiableMap(counts);
    }
}
