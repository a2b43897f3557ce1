/**
 * In-memory event and checkpoint stores.
 */
package ledger.store;
