package ledger.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect, used for tests and embedded deployments.
 */
public final class H2Dialect extends AbstractDialect {

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }

    @Override
    public String upsertSnapshotSql(String table) {
        return "MERGE INTO " + table + " (stream_id, stream_version, state, taken_at)"
                + " KEY (stream_id, stream_version) VALUES (?,?,?,?)";
    }
}
