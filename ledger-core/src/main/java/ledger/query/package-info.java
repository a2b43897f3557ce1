/**
 * Query side: queries, handlers, cache keys and the read-through query bus.
 */
package ledger.query;
