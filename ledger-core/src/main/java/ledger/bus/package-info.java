/**
 * In-process event bus backed by the event store.
 */
package ledger.bus;
