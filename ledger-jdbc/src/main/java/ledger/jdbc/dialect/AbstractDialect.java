package ledger.jdbc.dialect;

/**
 * Base dialect with standard SQL shared by every built-in database.
 *
 * <p>Subclasses override the statements whose syntax differs, mainly upserts.
 */
public abstract class AbstractDialect implements Dialect {

    protected static final String EVENT_COLUMNS = "event_number, event_id, stream_id, aggregate_type, "
            + "event_type, stream_version, user_id, trace_id, correlation_id, causation_id, payload, occurred_at";

    protected static final String PROJECTION_COLUMNS = "projection_name, last_event_number, "
            + "last_processed_at, running, error_count, last_error";

    @Override
    public String insertEventSql(String table) {
        return "INSERT INTO " + table + " (" + EVENT_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
    }

    @Override
    public String selectEventsAfterSql(String table) {
        return "SELECT " + EVENT_COLUMNS + " FROM " + table
                + " WHERE event_number > ? ORDER BY event_number LIMIT ?";
    }

    @Override
    public String selectEventsByTypeSql(String table, boolean fromBound, boolean toBound) {
        return selectEventsByColumn(table, "event_type", fromBound, toBound);
    }

    @Override
    public String selectEventsByUserSql(String table, boolean fromBound, boolean toBound) {
        return selectEventsByColumn(table, "user_id", fromBound, toBound);
    }

    private static String selectEventsByColumn(String table, String column, boolean fromBound, boolean toBound) {
        StringBuilder sql = new StringBuilder("SELECT ").append(EVENT_COLUMNS)
                .append(" FROM ").append(table)
                .append(" WHERE ").append(column).append(" = ?");
        if (fromBound) {
            sql.append(" AND occurred_at >= ?");
        }
        if (toBound) {
            sql.append(" AND occurred_at <= ?");
        }
        return sql.append(" ORDER BY event_number").toString();
    }

    @Override
    public String selectStreamSql(String table) {
        return "SELECT " + EVENT_COLUMNS + " FROM " + table
                + " WHERE stream_id = ? AND stream_version > ? ORDER BY stream_version LIMIT ?";
    }

    @Override
    public String streamVersionSql(String table) {
        return "SELECT COALESCE(MAX(stream_version), 0) FROM " + table + " WHERE stream_id = ?";
    }

    @Override
    public String maxEventNumberSql(String table) {
        return "SELECT COALESCE(MAX(event_number), 0) FROM " + table;
    }

    @Override
    public String countEventsSql(String table) {
        return "SELECT COUNT(*) FROM " + table;
    }

    @Override
    public String countStreamsSql(String table) {
        return "SELECT COUNT(DISTINCT stream_id) FROM " + table;
    }

    @Override
    public String healthSql(String table) {
        return "SELECT COUNT(*), COUNT(DISTINCT stream_id), MIN(occurred_at), MAX(occurred_at) FROM " + table;
    }

    @Override
    public String latestSnapshotSql(String table) {
        return "SELECT stream_id, stream_version, state, taken_at FROM " + table
                + " WHERE stream_id = ? ORDER BY stream_version DESC LIMIT 1";
    }

    @Override
    public String insertProjectionSql(String table) {
        return "INSERT INTO " + table + " (projection_name, last_event_number, running, error_count)"
                + " VALUES (?, 0, TRUE, 0)";
    }

    @Override
    public String selectProjectionSql(String table) {
        return "SELECT " + PROJECTION_COLUMNS + " FROM " + table + " WHERE projection_name = ?";
    }

    @Override
    public String selectAllProjectionsSql(String table) {
        return "SELECT " + PROJECTION_COLUMNS + " FROM " + table + " ORDER BY projection_name";
    }

    @Override
    public String saveCheckpointSql(String table) {
        return "UPDATE " + table + " SET last_event_number = ?, last_processed_at = ? WHERE projection_name = ?";
    }

    @Override
    public String recordFailureSql(String table) {
        return "UPDATE " + table + " SET error_count = error_count + 1, last_error = ?, running = FALSE"
                + " WHERE projection_name = ?";
    }

    @Override
    public String markRunningSql(String table) {
        return "UPDATE " + table + " SET running = ? WHERE projection_name = ?";
    }

    @Override
    public String resetProjectionSql(String table) {
        return "UPDATE " + table + " SET last_event_number = 0, last_processed_at = NULL, running = TRUE,"
                + " error_count = 0, last_error = NULL WHERE projection_name = ?";
    }
}
