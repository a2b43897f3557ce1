package ledger.jdbc;

import ledger.jdbc.dialect.Dialect;
import ledger.model.ProjectionState;
import ledger.spi.ConnectionProvider;
import ledger.spi.ProjectionStateStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ProjectionStateStore} keeping one checkpoint row per projection.
 *
 * <p>Failures surface as {@link EventStoreException}; the projection manager logs them and
 * retries on its next cycle.
 */
public final class JdbcProjectionStateStore implements ProjectionStateStore {
    private static final Logger logger = Logger.getLogger(JdbcProjectionStateStore.class.getName());
    private static final int MAX_ERROR_LENGTH = 4000;

    private static final JdbcTemplate.RowMapper<ProjectionState> STATE_ROW_MAPPER = rs -> {
        Timestamp processedAt = rs.getTimestamp("last_processed_at");
        return new ProjectionState(
                rs.getString("projection_name"),
                rs.getLong("last_event_number"),
                processedAt == null ? null : processedAt.toInstant(),
                rs.getBoolean("running"),
                rs.getInt("error_count"),
                rs.getString("last_error"));
    };

    private final ConnectionProvider connectionProvider;
    private final Dialect dialect;
    private final String table;

    public JdbcProjectionStateStore(ConnectionProvider connectionProvider, Dialect dialect) {
        this(connectionProvider, dialect, TableNames.PROJECTION_TABLE);
    }

    public JdbcProjectionStateStore(ConnectionProvider connectionProvider, Dialect dialect, String table) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.table = TableNames.validate(table);
    }

    @Override
    public ProjectionState register(String projectionName) {
        Objects.requireNonNull(projectionName, "projectionName");
        try (Connection conn = connectionProvider.getConnection()) {
            Optional<ProjectionState> existing = select(conn, projectionName);
            if (existing.isPresent()) {
                return existing.get();
            }
            try {
                JdbcTemplate.update(conn, dialect.insertProjectionSql(table), projectionName);
            } catch (EventStoreException e) {
                if (!JdbcTemplate.isConstraintViolation(e)) {
                    throw e;
                }
                logger.log(Level.FINE, "Projection {0} was registered concurrently", projectionName);
            }
            return select(conn, projectionName).orElseThrow(
                    () -> new IllegalStateException("Projection " + projectionName + " was not registered"));
        } catch (SQLException e) {
            throw new EventStoreException("Failed to obtain connection", e);
        }
    }

    @Override
    public Optional<ProjectionState> find(String projectionName) {
        try (Connection conn = connectionProvider.getConnection()) {
            return select(conn, projectionName);
        } catch (SQLException e) {
            throw new EventStoreException("Failed to obtain connection", e);
        }
    }

    @Override
    public List<ProjectionState> findAll() {
        try (Connection conn = connectionProvider.getConnection()) {
            return JdbcTemplate.query(conn, dialect.selectAllProjectionsSql(table), STATE_ROW_MAPPER);
        } catch (SQLException e) {
            throw new EventStoreException("Failed to obtain connection", e);
        }
    }

    @Override
    public void saveCheckpoint(String projectionName, long eventNumber, Instant processedAt) {
        updateRegistered(projectionName, dialect.saveCheckpointSql(table),
                eventNumber, processedAt, projectionName);
    }

    @Override
    public void recordFailure(String projectionName, String error) {
        updateRegistered(projectionName, dialect.recordFailureSql(table), truncateError(error), projectionName);
    }

    @Override
    public void markRunning(String projectionName, boolean running) {
        updateRegistered(projectionName, dialect.markRunningSql(table), running, projectionName);
    }

    @Override
    public void reset(String projectionName) {
        updateRegistered(projectionName, dialect.resetProjectionSql(table), projectionName);
    }

    private Optional<ProjectionState> select(Connection conn, String projectionName) {
        return JdbcTemplate.query(conn, dialect.selectProjectionSql(table), STATE_ROW_MAPPER, projectionName)
                .stream()
                .findFirst();
    }

    private void updateRegistered(String projectionName, String sql, Object... params) {
        int updated;
        try (Connection conn = connectionProvider.getConnection()) {
            updated = JdbcTemplate.update(conn, sql, params);
        } catch (SQLException e) {
            throw new EventStoreException("Failed to obtain connection", e);
        }
        if (updated == 0) {
            throw new IllegalStateException("Projection " + projectionName + " is not registered");
        }
    }

    private static String truncateError(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
