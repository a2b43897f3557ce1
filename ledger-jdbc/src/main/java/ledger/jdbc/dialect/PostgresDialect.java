package ledger.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    public String upsertSnapshotSql(String table) {
        return "INSERT INTO " + table + " (stream_id, stream_version, state, taken_at) VALUES (?,?,?,?)"
                + " ON CONFLICT (stream_id, stream_version)"
                + " DO UPDATE SET state = EXCLUDED.state, taken_at = EXCLUDED.taken_at";
    }

    @Override
    public String insertProjectionSql(String table) {
        return super.insertProjectionSql(table) + " ON CONFLICT (projection_name) DO NOTHING";
    }
}
