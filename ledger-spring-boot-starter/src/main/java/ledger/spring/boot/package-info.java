/**
 * Spring Boot auto-configuration for the ledger runtime.
 *
 * <p>Add the starter, optionally a {@code DataSource} with the bundled schema, and inject
 * {@link ledger.command.CommandBus} and {@link ledger.query.QueryBus}. Event handlers are
 * picked up from beans annotated with {@link ledger.spring.boot.LedgerEventHandler}.
 *
 * @see ledger.spring.boot.LedgerAutoConfiguration
 * @see ledger.spring.boot.LedgerProperties
 */
package ledger.spring.boot;
