/**
 * Event handler registration and lookup.
 */
package ledger.registry;
