/**
 * Projections and the manager that keeps them caught up with the event log.
 */
package ledger.projection;
