package ledger.jdbc;

import ledger.ErrorKind;
import ledger.Result;
import ledger.jdbc.dialect.Dialect;
import ledger.jdbc.dialect.Dialects;
import ledger.model.DomainEvent;
import ledger.model.EventMetadata;
import ledger.model.EventStoreHealth;
import ledger.model.Snapshot;
import ledger.model.StreamSlice;
import ledger.spi.ConnectionProvider;
import ledger.spi.EventStore;
import ledger.store.EventBatches;
import ledger.util.JsonCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventStore} backed by a relational database.
 *
 * <p>Each append runs in one transaction that reads {@code MAX(event_number)}, assigns the
 * following numbers and stream versions, and inserts the batch. Appends from this instance are
 * serialized by a writer lock, so event numbers stay dense and commit in order. Writers in
 * other processes are caught by the primary key on {@code event_number} and the unique key on
 * {@code (stream_id, stream_version)}: a batch that loses such a race is retried with fresh
 * positions, up to {@link Builder#maxAppendAttempts(int)} times, unless it carried an expected
 * stream version, in which case it fails with {@link ErrorKind#CONFLICT}.
 *
 * <pre>{@code
 * JdbcEventStore store = JdbcEventStore.builder()
 *     .dataSource(dataSource)
 *     .eventTable("ledger_events")
 *     .build();
 * }</pre>
 */
public final class JdbcEventStore implements EventStore {
    private static final Logger logger = Logger.getLogger(JdbcEventStore.class.getName());

    private final ConnectionProvider connectionProvider;
    private final Dialect dialect;
    private final String eventTable;
    private final String snapshotTable;
    private final JsonCodec jsonCodec;
    private final Clock clock;
    private final int maxAppendAttempts;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final JdbcTemplate.RowMapper<DomainEvent> eventRowMapper;

    private JdbcEventStore(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.dialect = Objects.requireNonNull(builder.dialect, "dialect");
        this.eventTable = TableNames.validate(builder.eventTable);
        this.snapshotTable = TableNames.validate(builder.snapshotTable);
        this.jsonCodec = Objects.requireNonNull(builder.jsonCodec, "jsonCodec");
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        if (builder.maxAppendAttempts <= 0) {
            throw new IllegalArgumentException("maxAppendAttempts must be > 0");
        }
        this.maxAppendAttempts = builder.maxAppendAttempts;
        this.eventRowMapper = rs -> DomainEvent.builder(rs.getString("event_type"))
                .eventNumber(rs.getLong("event_number"))
                .eventId(rs.getString("event_id"))
                .streamId(rs.getString("stream_id"))
                .aggregateType(rs.getString("aggregate_type"))
                .streamVersion(rs.getLong("stream_version"))
                .metadata(new EventMetadata(
                        rs.getString("user_id"),
                        rs.getString("trace_id"),
                        rs.getString("correlation_id"),
                        rs.getString("causation_id")))
                .payload(jsonCodec.parseObject(rs.getString("payload")))
                .occurredAt(rs.getTimestamp("occurred_at").toInstant())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Dialect dialect() {
        return dialect;
    }

    // ── Appends ─────────────────────────────────────────────────────

    @Override
    public Result<List<DomainEvent>> appendBatch(List<DomainEvent> events) {
        return appendInternal(null, ANY_VERSION, events);
    }

    @Override
    public Result<List<DomainEvent>> appendToStream(String streamId, long expectedVersion, List<DomainEvent> events) {
        Objects.requireNonNull(streamId, "streamId");
        return appendInternal(streamId, expectedVersion, events);
    }

    private Result<List<DomainEvent>> appendInternal(String streamId, long expectedVersion,
                                                     List<DomainEvent> events) {
        Result<Void> validation = EventBatches.validate(streamId, events);
        if (validation instanceof Result.Err<Void> err) {
            return err.retype();
        }
        if (events.isEmpty()) {
            return Result.ok(List.of());
        }
        boolean versionChecked = streamId != null && expectedVersion != ANY_VERSION;
        writeLock.lock();
        try {
            for (int attempt = 1; ; attempt++) {
                try {
                    return inTransaction(conn -> insertBatch(conn, streamId, expectedVersion, events));
                } catch (EventStoreException e) {
                    if (!JdbcTemplate.isConstraintViolation(e)) {
                        logger.log(Level.WARNING, "Failed to append " + events.size() + " events", e);
                        return Result.err(ErrorKind.STORAGE, "Failed to append events: " + rootMessage(e));
                    }
                    if (versionChecked || attempt >= maxAppendAttempts) {
                        logger.log(Level.FINE, "Append lost a write race", e);
                        return Result.err(ErrorKind.CONFLICT,
                                "Concurrent append detected for " + describe(streamId, events));
                    }
                    logger.log(Level.FINE, "Append attempt {0} lost a write race; retrying", attempt);
                }
            }
        } finally {
            writeLock.unlock();
        }
    }

    private Result<List<DomainEvent>> insertBatch(Connection conn, String streamId, long expectedVersion,
                                                  List<DomainEvent> events) {
        if (streamId != null && expectedVersion != ANY_VERSION) {
            long current = streamVersion(conn, streamId);
            if (current != expectedVersion) {
                return Result.err(ErrorKind.CONFLICT, EventBatches.versionConflict(streamId, expectedVersion, current));
            }
        }
        long nextNumber = JdbcTemplate.queryForLong(conn, dialect.maxEventNumberSql(eventTable)) + 1;
        Map<String, Long> versions = new HashMap<>();
        List<DomainEvent> stored = new ArrayList<>(events.size());
        List<Object[]> rows = new ArrayList<>(events.size());
        for (DomainEvent event : events) {
            Long previous = versions.get(event.streamId());
            long version = (previous != null ? previous : streamVersion(conn, event.streamId())) + 1;
            versions.put(event.streamId(), version);
            DomainEvent positioned = event.withPosition(nextNumber++, version);
            stored.add(positioned);
            rows.add(toRow(positioned));
        }
        JdbcTemplate.batchUpdate(conn, dialect.insertEventSql(eventTable), rows);
        return Result.ok(List.copyOf(stored));
    }

    private Object[] toRow(DomainEvent event) {
        EventMetadata metadata = event.metadata();
        return new Object[]{
                event.eventNumber(),
                event.eventId(),
                event.streamId(),
                event.aggregateType(),
                event.eventType(),
                event.streamVersion(),
                metadata.userId(),
                metadata.traceId(),
                metadata.correlationId(),
                metadata.causationId(),
                jsonCodec.toJson(event.payload()),
                event.occurredAt()
        };
    }

    // ── Reads ───────────────────────────────────────────────────────

    @Override
    public List<DomainEvent> readEventsByType(String eventType, Instant from, Instant to) {
        Objects.requireNonNull(eventType, "eventType");
        String sql = dialect.selectEventsByTypeSql(eventTable, from != null, to != null);
        return withConnection(conn -> JdbcTemplate.query(conn, sql, eventRowMapper, boundedParams(eventType, from, to)));
    }

    @Override
    public List<DomainEvent> readEventsByUserId(String userId, Instant from, Instant to) {
        Objects.requireNonNull(userId, "userId");
        String sql = dialect.selectEventsByUserSql(eventTable, from != null, to != null);
        return withConnection(conn -> JdbcTemplate.query(conn, sql, eventRowMapper, boundedParams(userId, from, to)));
    }

    private static Object[] boundedParams(String key, Instant from, Instant to) {
        List<Object> params = new ArrayList<>(3);
        params.add(key);
        if (from != null) {
            params.add(from);
        }
        if (to != null) {
            params.add(to);
        }
        return params.toArray();
    }

    @Override
    public List<DomainEvent> readAllEvents(long afterEventNumber, int maxCount) {
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be > 0");
        }
        return withConnection(conn -> JdbcTemplate.query(conn, dialect.selectEventsAfterSql(eventTable),
                eventRowMapper, afterEventNumber, maxCount));
    }

    @Override
    public StreamSlice readStream(String streamId, long afterVersion, int maxCount) {
        Objects.requireNonNull(streamId, "streamId");
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be > 0");
        }
        return withConnection(conn -> {
            // Version first: every event read below was committed no later than this version.
            long version = streamVersion(conn, streamId);
            List<DomainEvent> events = JdbcTemplate.query(conn, dialect.selectStreamSql(eventTable),
                    eventRowMapper, streamId, afterVersion, maxCount);
            long lastRead = events.isEmpty() ? 0L : events.get(events.size() - 1).streamVersion();
            long current = Math.max(version, lastRead);
            return new StreamSlice(streamId, events, current, !events.isEmpty() && lastRead < current);
        });
    }

    @Override
    public long getStreamVersion(String streamId) {
        Objects.requireNonNull(streamId, "streamId");
        return withConnection(conn -> streamVersion(conn, streamId));
    }

    private long streamVersion(Connection conn, String streamId) {
        return JdbcTemplate.queryForLong(conn, dialect.streamVersionSql(eventTable), streamId);
    }

    @Override
    public long lastEventNumber() {
        return withConnection(conn -> JdbcTemplate.queryForLong(conn, dialect.maxEventNumberSql(eventTable)));
    }

    @Override
    public long getEventCount() {
        return withConnection(conn -> JdbcTemplate.queryForLong(conn, dialect.countEventsSql(eventTable)));
    }

    @Override
    public long getStreamCount() {
        return withConnection(conn -> JdbcTemplate.queryForLong(conn, dialect.countStreamsSql(eventTable)));
    }

    @Override
    public EventStoreHealth getHealthStatus() {
        Instant checkTime = clock.instant();
        try {
            return withConnection(conn -> JdbcTemplate.query(conn, dialect.healthSql(eventTable),
                    rs -> new EventStoreHealth(
                            true,
                            rs.getLong(1),
                            rs.getLong(2),
                            toInstant(rs.getTimestamp(3)),
                            toInstant(rs.getTimestamp(4)),
                            checkTime)).get(0));
        } catch (EventStoreException e) {
            logger.log(Level.WARNING, "Event store health check failed", e);
            return EventStoreHealth.unreachable(checkTime);
        }
    }

    // ── Snapshots ───────────────────────────────────────────────────

    @Override
    public Result<Void> saveSnapshot(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        try {
            return inTransaction(conn -> {
                long current = streamVersion(conn, snapshot.streamId());
                if (snapshot.streamVersion() > current) {
                    return Result.err(ErrorKind.VALIDATION, "Snapshot version " + snapshot.streamVersion()
                            + " is ahead of stream " + snapshot.streamId() + " at version " + current);
                }
                JdbcTemplate.update(conn, dialect.upsertSnapshotSql(snapshotTable),
                        snapshot.streamId(), snapshot.streamVersion(),
                        jsonCodec.toJson(snapshot.state()), snapshot.takenAt());
                return Result.ok(null);
            });
        } catch (EventStoreException e) {
            logger.log(Level.WARNING, "Failed to save snapshot of stream " + snapshot.streamId(), e);
            return Result.err(ErrorKind.STORAGE, "Failed to save snapshot: " + rootMessage(e));
        }
    }

    @Override
    public Optional<Snapshot> latestSnapshot(String streamId) {
        Objects.requireNonNull(streamId, "streamId");
        List<Snapshot> found = withConnection(conn -> JdbcTemplate.query(conn,
                dialect.latestSnapshotSql(snapshotTable),
                rs -> new Snapshot(
                        rs.getString("stream_id"),
                        rs.getLong("stream_version"),
                        jsonCodec.parseObject(rs.getString("state")),
                        rs.getTimestamp("taken_at").toInstant()),
                streamId));
        return found.stream().findFirst();
    }

    // ── Connection handling ─────────────────────────────────────────

    @FunctionalInterface
    private interface ConnectionWork<T> {
        T execute(Connection conn);
    }

    private <T> T withConnection(ConnectionWork<T> work) {
        try (Connection conn = connectionProvider.getConnection()) {
            return work.execute(conn);
        } catch (SQLException e) {
            throw new EventStoreException("Failed to obtain connection", e);
        }
    }

    private <T> T inTransaction(ConnectionWork<T> work) {
        return withConnection(conn -> {
            try {
                conn.setAutoCommit(false);
            } catch (SQLException e) {
                throw new EventStoreException("Failed to begin transaction", e);
            }
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException e) {
                rollback(conn, e);
                throw new EventStoreException("Failed to commit transaction", e);
            } catch (RuntimeException e) {
                rollback(conn, e);
                throw e;
            } finally {
                restoreAutoCommit(conn);
            }
        });
    }

    private static void rollback(Connection conn, Exception failure) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private static void restoreAutoCommit(Connection conn) {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            logger.log(Level.FINE, "Failed to restore auto-commit", e);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static String rootMessage(Throwable failure) {
        Throwable root = failure;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    private static String describe(String streamId, List<DomainEvent> events) {
        return streamId != null ? "stream " + streamId : events.size() + " events";
    }

    /**
     * Builder for {@link JdbcEventStore}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private Dialect dialect;
        private String eventTable = TableNames.EVENT_TABLE;
        private String snapshotTable = TableNames.SNAPSHOT_TABLE;
        private JsonCodec jsonCodec = JsonCodec.getDefault();
        private Clock clock = Clock.systemUTC();
        private int maxAppendAttempts = 3;

        private Builder() {
        }

        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Uses the data source for connections and, unless {@link #dialect(Dialect)} is set,
         * detects the dialect from its JDBC URL.
         */
        public Builder dataSource(DataSource dataSource) {
            this.connectionProvider = new DataSourceConnectionProvider(dataSource);
            if (this.dialect == null) {
                this.dialect = Dialects.detect(dataSource);
            }
            return this;
        }

        public Builder dialect(Dialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder eventTable(String eventTable) {
            this.eventTable = eventTable;
            return this;
        }

        public Builder snapshotTable(String snapshotTable) {
            this.snapshotTable = snapshotTable;
            return this;
        }

        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /**
         * Clock stamping health checks. Optional; defaults to UTC system time.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * How many times an unversioned append is attempted when another writer takes the same
         * positions. Optional; defaults to 3.
         */
        public Builder maxAppendAttempts(int maxAppendAttempts) {
            this.maxAppendAttempts = maxAppendAttempts;
            return this;
        }

        public JdbcEventStore build() {
            return new JdbcEventStore(this);
        }
    }
}
