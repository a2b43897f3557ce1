package ledger;

/**
 * A bundle of command handlers, query handlers, event handlers and projections registered
 * with a {@link Ledger} while it is being built.
 */
@FunctionalInterface
public interface LedgerModule {

    /**
     * Registers this module's components.
     *
     * @throws IllegalStateException if a component clashes with one already registered
     */
    void register(Ledger ledger);
}
