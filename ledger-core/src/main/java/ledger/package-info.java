/**
 * Event-sourced CQRS runtime: {@link ledger.Ledger} wires the event store, event bus,
 * projection manager, command bus and query bus; {@link ledger.Result} carries expected
 * failures.
 */
package ledger;
