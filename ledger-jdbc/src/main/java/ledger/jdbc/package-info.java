/**
 * JDBC persistence for the event log, aggregate snapshots and projection checkpoints.
 *
 * <p>{@link ledger.jdbc.JdbcEventStore} and {@link ledger.jdbc.JdbcProjectionStateStore} run
 * on H2, PostgreSQL and MySQL through the dialects in {@link ledger.jdbc.dialect}. Schema
 * scripts for each database ship under {@code schema/} on the classpath.
 */
package ledger.jdbc;
