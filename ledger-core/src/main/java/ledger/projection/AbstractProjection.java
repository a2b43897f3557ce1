package ledger.projection;

import ledger.model.DomainEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Base class mapping event types to apply functions.
 *
 * <pre>{@code
 * final class CompletionCounter extends AbstractProjection {
 *     private final Map<String, Integer> counts = new ConcurrentHashMap<>();
 *
 *     CompletionCounter() {
 *         super("CompletionCounter");
 *         on("HabitCompleted", event -> counts.merge(event.streamId(), 1, Integer::sum));
 *     }
 *
 *     public void reset() {
 *         counts.clear();
 *     }
 * }
 * }</pre>
 */
public abstract class AbstractProjection implements Projection {
    private final String name;
    private final Map<String, Applier> appliers = new LinkedHashMap<>();

    protected AbstractProjection(String name) {
        this.name = Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
    }

    /**
     * Registers the apply function for an event type. Intended to be called from the
     * subclass constructor.
     */
    protected final void on(String eventType, Applier applier) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(applier, "applier");
        if (appliers.putIfAbsent(eventType, applier) != null) {
            throw new IllegalStateException("Applier for " + eventType + " is already registered in " + name);
        }
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public boolean handles(String eventType) {
        return appliers.containsKey(eventType);
    }

    public Set<String> handledEventTypes() {
        return Collections.unmodifiableSet(appliers.keySet());
    }

    @Override
    public void apply(DomainEvent event) throws Exception {
        Applier applier = appliers.get(event.eventType());
        if (applier != null) {
            applier.apply(event);
        }
    }

    /**
     * Apply function for one event type.
     */
    @FunctionalInterface
    protected interface Applier {
        void apply(DomainEvent event) throws Exception;
    }
}
