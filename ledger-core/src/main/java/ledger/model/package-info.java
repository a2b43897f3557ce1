/**
 * Value types shared by the event store, the projection manager and the cache.
 */
package ledger.model;
