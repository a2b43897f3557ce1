package ledger.projection;

import ledger.model.DomainEvent;

/**
 * A read model built by applying events from the global log in order.
 *
 * <p>The {@link ProjectionManager} calls {@link #apply} from at most one thread at a time for
 * a given projection, in strictly increasing event number order, and never applies the same
 * event twice between resets. Implementations may therefore mutate their state without
 * locking against other appliers, but should publish it safely to concurrent readers.
 */
public interface Projection {

    /**
     * Unique projection name, also the key of its checkpoint.
     */
    String name();

    /**
     * Returns whether {@link #apply} should be called for events of the given type.
     * Events of other types still advance the checkpoint.
     */
    boolean handles(String eventType);

    /**
     * Folds one event into the read model.
     *
     * @throws Exception if the event cannot be applied; the projection is then stopped
     *                   and its checkpoint stays at the previous event
     */
    void apply(DomainEvent event) throws Exception;

    /**
     * Discards all materialized state.
     */
    void reset();

    /**
     * Returns {@code true} if the read model survives a restart on its own, so catch-up may
     * resume from the stored checkpoint. Projections held only in memory return
     * {@code false} and are rebuilt from the start of the log when registered.
     */
    default boolean durable() {
        return false;
    }
}
