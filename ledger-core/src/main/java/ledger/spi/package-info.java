/**
 * Service provider interfaces: event storage, checkpoint storage, caching and metrics.
 */
package ledger.spi;
