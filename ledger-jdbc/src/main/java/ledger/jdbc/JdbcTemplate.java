package ledger.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Small JDBC helper used by the stores in this package. Every {@link SQLException} is
 * rethrown as an {@link EventStoreException}.
 */
public final class JdbcTemplate {

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /** Executes an INSERT, UPDATE or DELETE and returns the affected row count. */
    public static int update(Connection conn, String sql, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new EventStoreException("Update failed: " + sql, e);
        }
    }

    /** Executes one statement per parameter row as a single JDBC batch. */
    public static void batchUpdate(Connection conn, String sql, List<Object[]> rows) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (Object[] row : rows) {
                bindParams(ps, row);
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            throw new EventStoreException("Batch of " + rows.size() + " failed: " + sql, e);
        }
    }

    /** Executes a SELECT and maps every row. */
    public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> results = new ArrayList<>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new EventStoreException("Query failed: " + sql, e);
        }
    }

    /** Executes a SELECT returning a single numeric column, {@code 0} when it is null or absent. */
    public static long queryForLong(Connection conn, String sql, Object... params) {
        List<Long> values = query(conn, sql, rs -> rs.getLong(1), params);
        return values.isEmpty() ? 0L : values.get(0);
    }

    /**
     * Returns whether the failure, or any of its causes, is a unique or primary key violation.
     */
    public static boolean isConstraintViolation(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof SQLIntegrityConstraintViolationException) {
                return true;
            }
            if (t instanceof SQLException sql) {
                String state = sql.getSQLState();
                if (state != null && state.startsWith("23")) {
                    return true;
                }
                SQLException next = sql.getNextException();
                if (next != null && next != t && isConstraintViolation(next)) {
                    return true;
                }
            }
        }
        return false;
    }

    // Instants are written as timestamps so every driver maps them to its TIMESTAMP column.
    private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
        int index = 1;
        for (Object param : params) {
            if (param instanceof Instant instant) {
                ps.setTimestamp(index++, Timestamp.from(instant));
            } else if (param instanceof String s) {
                ps.setString(index++, s);
            } else if (param instanceof Long n) {
                ps.setLong(index++, n);
            } else {
                ps.setObject(index++, param);
            }
        }
    }

    private JdbcTemplate() {
    }
}
