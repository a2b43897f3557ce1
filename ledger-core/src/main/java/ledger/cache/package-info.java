/**
 * Cache implementations and cache failure types.
 */
package ledger.cache;
