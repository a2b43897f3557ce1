package ledger.jdbc.dialect;

import java.util.List;

/**
 * MySQL dialect. Also compatible with TiDB.
 */
public final class MySqlDialect extends AbstractDialect {

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:mysql:", "jdbc:tidb:");
    }

    @Override
    public String upsertSnapshotSql(String table) {
        return "INSERT INTO " + table + " (stream_id, stream_version, state, taken_at) VALUES (?,?,?,?)"
                + " ON DUPLICATE KEY UPDATE state = VALUES(state), taken_at = VALUES(taken_at)";
    }

    @Override
    public String insertProjectionSql(String table) {
        return "INSERT IGNORE INTO " + table + " (projection_name, last_event_number, running, error_count)"
                + " VALUES (?, 0, TRUE, 0)";
    }
}
