package ledger.jdbc.dialect;

import java.util.List;

/**
 * Database-specific SQL for the JDBC event store and projection state store.
 *
 * <p>Register custom dialects via {@code META-INF/services/ledger.jdbc.dialect.Dialect}.
 * Built-in dialects: H2, PostgreSQL, MySQL (+ TiDB).
 *
 * <p>Event queries return the columns {@code event_number, event_id, stream_id,
 * aggregate_type, event_type, stream_version, user_id, trace_id, correlation_id,
 * causation_id, payload, occurred_at}.
 *
 * @see Dialects
 */
public interface Dialect {

    /**
     * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
     */
    String name();

    /**
     * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
     */
    List<String> jdbcUrlPrefixes();

    /**
     * Classpath location of the DDL script creating the default tables.
     */
    default String schemaResource() {
        return "schema/" + name() + ".sql";
    }

    // ── Events ──────────────────────────────────────────────────────

    /**
     * Inserts one event.
     *
     * <p>Parameters: event_number, event_id, stream_id, aggregate_type, event_type,
     * stream_version, user_id, trace_id, correlation_id, causation_id, payload, occurred_at.
     */
    String insertEventSql(String table);

    /** Parameters: after event_number, limit. */
    String selectEventsAfterSql(String table);

    /**
     * Events of one type, with optional inclusive {@code occurred_at} bounds.
     *
     * <p>Parameters: event_type, then from and to when the respective flag is set.
     */
    String selectEventsByTypeSql(String table, boolean fromBound, boolean toBound);

    /** As {@link #selectEventsByTypeSql}, filtered by user_id. */
    String selectEventsByUserSql(String table, boolean fromBound, boolean toBound);

    /** Parameters: stream_id, after stream_version, limit. */
    String selectStreamSql(String table);

    /** Parameters: stream_id. Returns one numeric column, 0 for an unknown stream. */
    String streamVersionSql(String table);

    /** Returns one numeric column, 0 for an empty table. */
    String maxEventNumberSql(String table);

    String countEventsSql(String table);

    String countStreamsSql(String table);

    /** Returns event count, stream count, oldest and newest occurred_at. */
    String healthSql(String table);

    // ── Snapshots ───────────────────────────────────────────────────

    /**
     * Inserts a snapshot or replaces the one stored at the same stream version.
     *
     * <p>Parameters: stream_id, stream_version, state, taken_at.
     */
    String upsertSnapshotSql(String table);

    /** Parameters: stream_id. Returns at most one row with the highest stream_version. */
    String latestSnapshotSql(String table);

    // ── Projections ─────────────────────────────────────────────────

    /**
     * Creates a checkpoint row at zero. Dialects that can skip an existing row do so; the
     * default form fails with a constraint violation instead.
     *
     * <p>Parameters: projection_name.
     */
    String insertProjectionSql(String table);

    /** Parameters: projection_name. */
    String selectProjectionSql(String table);

    String selectAllProjectionsSql(String table);

    /** Parameters: last_event_number, last_processed_at, projection_name. */
    String saveCheckpointSql(String table);

    /** Parameters: last_error, projection_name. */
    String recordFailureSql(String table);

    /** Parameters: running, projection_name. */
    String markRunningSql(String table);

    /** Parameters: projection_name. */
    String resetProjectionSql(String table);
}
