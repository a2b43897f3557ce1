/**
 * Redis-backed query cache on Redisson, shared by every application instance.
 */
package ledger.redis;
