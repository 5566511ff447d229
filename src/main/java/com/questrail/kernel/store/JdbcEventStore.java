package com.questrail.kernel.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.kernel.api.Edge;
import com.questrail.kernel.api.EdgeType;
import com.questrail.kernel.api.Event;
import com.questrail.kernel.api.EventIds;
import com.questrail.kernel.api.EventJson;
import com.questrail.kernel.api.EventStatus;
import com.questrail.kernel.api.Span;
import com.questrail.kernel.api.Stage;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JdbcEventStore
 * =============================================================================
 * Durable {@link EventStore} on an embedded H2 database.
 *
 * <h2>Schema</h2>
 * <ul>
 *   <li>{@code ledger_events}: one row per event; {@code row_id} is the arrival
 *       order and {@code event_id} is unique</li>
 *   <li>{@code ledger_edges}: causal edges keyed by
 *       {@code (trace_id, from_event_id, to_event_id, edge_type)}</li>
 *   <li>{@code ledger_spans}: one summary row per span</li>
 * </ul>
 * Indices cover the trace, type, stage and worker filters with the timestamp.
 *
 * <h2>Transactions</h2>
 * Each append writes the event, its edges and its span in one transaction. Each
 * prune pass deletes edges, events and orphaned spans in one transaction.
 *
 * <p>A keep-alive connection is held for the lifetime of the store so that
 * in-memory H2 URLs survive between operations.</p>
 */
public final class JdbcEventStore extends AbstractEventStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private static final String EVENT_COLUMNS =
            "event_id, trace_id, span_id, parent_event_id, event_type, stage, source, worker_id, ts, seq, status, "
            + "payload_json, payload_hash, evidence_json, correlation_id, causation_id, span_generated, "
            + "ack_of_event_id, retry_of_event_id";

    private final DataSource dataSource;
    private final Connection keepAlive;
    private final String url;

    private JdbcEventStore(DataSource dataSource, Connection keepAlive, String url,
                           RetentionPolicy retention, Duration busyTimeout) {
        super(retention, busyTimeout);
        this.dataSource = dataSource;
        this.keepAlive = keepAlive;
        this.url = url;
    }

    /**
     * Open (and if needed create) the ledger at {@code url}.
     *
     * @throws LedgerStorageException if the database cannot be opened or migrated
     */
    public static JdbcEventStore open(String url, String user, String password,
                                      RetentionPolicy retention, Duration busyTimeout) {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL(url);
        ds.setUser(user != null ? user : "sa");
        ds.setPassword(password != null ? password : "");

        Connection keepAlive = null;
        try {
            keepAlive = ds.getConnection();
            createTables(keepAlive);
            log.info("Evidence ledger opened at {}", url);
            return new JdbcEventStore(ds, keepAlive, url, retention, busyTimeout);
        } catch (SQLException e) {
            closeQuietly(keepAlive);
            throw new LedgerStorageException("Failed to open evidence ledger at " + url, e);
        }
    }

    private static void createTables(Connection conn) throws SQLException {
        String createEvents = """
            CREATE TABLE IF NOT EXISTS ledger_events (
                row_id BIGINT AUTO_INCREMENT PRIMARY KEY,
                event_id VARCHAR(128) NOT NULL UNIQUE,
                trace_id VARCHAR(128) NOT NULL,
                span_id VARCHAR(128) NOT NULL,
                parent_event_id VARCHAR(128),
                event_type VARCHAR(255) NOT NULL,
                stage VARCHAR(32) NOT NULL,
                source VARCHAR(255) NOT NULL,
                worker_id VARCHAR(255) NOT NULL,
                ts BIGINT NOT NULL,
                seq BIGINT NOT NULL,
                status VARCHAR(32) NOT NULL,
                payload_json CLOB NOT NULL,
                payload_hash VARCHAR(64) NOT NULL,
                evidence_json CLOB,
                correlation_id VARCHAR(128),
                causation_id VARCHAR(128),
                span_generated BOOLEAN DEFAULT FALSE NOT NULL,
                ack_of_event_id VARCHAR(128),
                retry_of_event_id VARCHAR(128)
            )
            """;

        String createEdges = """
            CREATE TABLE IF NOT EXISTS ledger_edges (
                trace_id VARCHAR(128) NOT NULL,
                from_event_id VARCHAR(128) NOT NULL,
                to_event_id VARCHAR(128) NOT NULL,
                edge_type VARCHAR(32) NOT NULL,
                PRIMARY KEY (trace_id, from_event_id, to_event_id, edge_type)
            )
            """;

        String createSpans = """
            CREATE TABLE IF NOT EXISTS ledger_spans (
                span_id VARCHAR(128) PRIMARY KEY,
                trace_id VARCHAR(128) NOT NULL,
                stage VARCHAR(32) NOT NULL,
                worker_id VARCHAR(255) NOT NULL,
                started_at BIGINT NOT NULL,
                ended_at BIGINT,
                status VARCHAR(32) NOT NULL,
                event_count INT NOT NULL
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(createEvents);
            stmt.execute(createEdges);
            stmt.execute(createSpans);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_ledger_events_trace_ts ON ledger_events(trace_id, ts)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_ledger_events_type_ts ON ledger_events(event_type, ts)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_ledger_events_stage_ts ON ledger_events(stage, ts)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_ledger_events_worker_ts ON ledger_events(worker_id, ts)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_ledger_events_parent ON ledger_events(parent_event_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_ledger_events_span ON ledger_events(span_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_ledger_edges_from ON ledger_edges(from_event_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_ledger_edges_to ON ledger_edges(to_event_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_ledger_spans_trace ON ledger_spans(trace_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_ledger_spans_open ON ledger_spans(ended_at, started_at)");
        }
    }

    // ---------------------------------------------------------------------
    // Write hooks
    // ---------------------------------------------------------------------

    @Override
    protected boolean containsEvent(String eventId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM ledger_events WHERE event_id = ?")) {
            stmt.setString(1, eventId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new LedgerStorageException("Duplicate check failed for " + eventId, e);
        }
    }

    @Override
    protected Span findSpan(String spanId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT * FROM ledger_spans WHERE span_id = ?")) {
            stmt.setString(1, spanId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? mapSpan(rs) : null;
            }
        } catch (SQLException e) {
            throw new LedgerStorageException("Span lookup failed for " + spanId, e);
        }
    }

    @Override
    protected void insert(Event event, List<Edge> edges, Span span) {
        String payloadJson = EventJson.writeTree(event.payload());
        String evidenceJson = event.evidenceRefs().isEmpty()
                ? null
                : EventJson.writeTree(EventJson.evidenceToJson(event.evidenceRefs()));

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "INSERT INTO ledger_events (" + EVENT_COLUMNS + ") "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                    stmt.setString(1, event.eventId());
                    stmt.setString(2, event.traceId());
                    stmt.setString(3, event.spanId());
                    stmt.setString(4, event.parentEventId());
                    stmt.setString(5, event.type());
                    stmt.setString(6, event.stage().wireName());
                    stmt.setString(7, event.source());
                    stmt.setString(8, event.workerId());
                    stmt.setLong(9, event.timestamp());
                    stmt.setLong(10, event.sequence());
                    stmt.setString(11, event.status().wireName());
                    stmt.setString(12, payloadJson);
                    stmt.setString(13, EventIds.sha256Hex(payloadJson));
                    stmt.setString(14, evidenceJson);
                    stmt.setString(15, event.correlationId());
                    stmt.setString(16, event.causationId());
                    stmt.setBoolean(17, event.spanGenerated());
                    stmt.setString(18, event.ackOfEventId());
                    stmt.setString(19, event.retryOfEventId());
                    stmt.executeUpdate();
                }

                if (!edges.isEmpty()) {
                    try (PreparedStatement stmt = conn.prepareStatement(
                            "MERGE INTO ledger_edges (trace_id, from_event_id, to_event_id, edge_type) "
                            + "KEY (trace_id, from_event_id, to_event_id, edge_type) VALUES (?, ?, ?, ?)")) {
                        for (Edge edge : edges) {
                            stmt.setString(1, edge.traceId());
                            stmt.setString(2, edge.fromEventId());
                            stmt.setString(3, edge.toEventId());
                            stmt.setString(4, edge.type().wireName());
                            stmt.addBatch();
                        }
                        stmt.executeBatch();
                    }
                }

                try (PreparedStatement stmt = conn.prepareStatement(
                        "MERGE INTO ledger_spans (span_id, trace_id, stage, worker_id, started_at, ended_at, status, event_count) "
                        + "KEY (span_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?)")) {
                    stmt.setString(1, span.spanId());
                    stmt.setString(2, span.traceId());
                    stmt.setString(3, span.stage().wireName());
                    stmt.setString(4, span.workerId());
                    stmt.setLong(5, span.startedAt());
                    if (span.endedAt() == null) {
                        stmt.setNull(6, Types.BIGINT);
                    } else {
                        stmt.setLong(6, span.endedAt());
                    }
                    stmt.setString(7, span.status().wireName());
                    stmt.setInt(8, span.eventCount());
                    stmt.executeUpdate();
                }

                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new LedgerStorageException("Failed to append " + event.eventId(), e);
        }
    }

    @Override
    protected PruneResult pruneOlderThan(long cutoffMillis, long maxRows) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                long edges = update(conn,
                        "DELETE FROM ledger_edges WHERE from_event_id IN (SELECT event_id FROM ledger_events WHERE ts < ?) "
                        + "OR to_event_id IN (SELECT event_id FROM ledger_events WHERE ts < ?)",
                        cutoffMillis, cutoffMillis);
                long expired = update(conn, "DELETE FROM ledger_events WHERE ts < ?", cutoffMillis);

                long overCap = 0;
                Long keepFrom = firstRowIdToKeep(conn, maxRows);
                if (keepFrom != null) {
                    edges += update(conn,
                            "DELETE FROM ledger_edges WHERE from_event_id IN (SELECT event_id FROM ledger_events WHERE row_id < ?) "
                            + "OR to_event_id IN (SELECT event_id FROM ledger_events WHERE row_id < ?)",
                            keepFrom, keepFrom);
                    overCap = update(conn, "DELETE FROM ledger_events WHERE row_id < ?", keepFrom);
                }

                long spans = 0;
                if (expired + overCap > 0) {
                    spans = update(conn,
                            "DELETE FROM ledger_spans s WHERE NOT EXISTS "
                            + "(SELECT 1 FROM ledger_events e WHERE e.span_id = s.span_id)");
                }
                conn.commit();
                return new PruneResult(expired, overCap, edges, spans);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new LedgerStorageException("Prune failed", e);
        }
    }

    /**
     * The oldest row id that survives the cap, or {@code null} when under it.
     */
    private static Long firstRowIdToKeep(Connection conn, long maxRows) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT row_id FROM ledger_events ORDER BY row_id DESC LIMIT 1 OFFSET ?")) {
            stmt.setLong(1, maxRows);
            try (ResultSet rs = stmt.executeQuery()) {
                // A row at offset maxRows means at least maxRows + 1 rows exist.
                return rs.next() ? rs.getLong(1) + 1 : null;
            }
        }
    }

    @Override
    protected boolean isDurable() {
        return true;
    }

    @Override
    protected String backendName() {
        return "h2";
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    @Override
    public Optional<Event> findById(String eventId) {
        List<Event> found = queryEvents(
                "SELECT " + EVENT_COLUMNS + " FROM ledger_events WHERE event_id = ?", eventId);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<Event> queryByTrace(String traceId, int limit) {
        int max = Math.min(limit <= 0 ? TRACE_DEFAULT_LIMIT : limit, TRACE_MAX_LIMIT);
        return queryEvents(
                "SELECT " + EVENT_COLUMNS + " FROM ledger_events WHERE trace_id = ? ORDER BY row_id LIMIT ?",
                traceId, max);
    }

    @Override
    public List<Event> queryByFilter(EventFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT " + EVENT_COLUMNS + " FROM ledger_events WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (filter.traceId() != null) {
            sql.append(" AND trace_id = ?");
            params.add(filter.traceId());
        }
        if (filter.stage() != null) {
            sql.append(" AND stage = ?");
            params.add(filter.stage().wireName());
        }
        if (filter.type() != null) {
            if (filter.isTypePrefix()) {
                sql.append(" AND event_type LIKE ?");
                params.add(filter.typePrefix() + "%");
            } else {
                sql.append(" AND event_type = ?");
                params.add(filter.type());
            }
        }
        if (filter.workerId() != null) {
            sql.append(" AND worker_id = ?");
            params.add(filter.workerId());
        }
        if (filter.fromTimestamp() != null) {
            sql.append(" AND ts >= ?");
            params.add(filter.fromTimestamp());
        }
        if (filter.toTimestamp() != null) {
            sql.append(" AND ts <= ?");
            params.add(filter.toTimestamp());
        }
        sql.append(filter.newestFirst() ? " ORDER BY ts DESC, row_id DESC" : " ORDER BY ts ASC, row_id ASC");
        sql.append(" LIMIT ?");
        params.add(filter.limit());
        return queryEvents(sql.toString(), params.toArray());
    }

    @Override
    public List<Edge> edgesForTrace(String traceId) {
        List<Edge> edges = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                     "SELECT trace_id, from_event_id, to_event_id, edge_type FROM ledger_edges WHERE trace_id = ?")) {
            stmt.setString(1, traceId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    EdgeType type = EdgeType.fromWire(rs.getString("edge_type"))
                            .orElseThrow(() -> new SQLException("Unknown edge type in ledger"));
                    edges.add(new Edge(rs.getString("trace_id"), rs.getString("from_event_id"),
                            rs.getString("to_event_id"), type));
                }
            }
        } catch (SQLException e) {
            throw new LedgerStorageException("Edge query failed for trace " + traceId, e);
        }
        return edges;
    }

    @Override
    public List<Span> spansForTrace(String traceId) {
        return querySpans("SELECT * FROM ledger_spans WHERE trace_id = ? ORDER BY started_at", traceId);
    }

    @Override
    public List<Span> openSpansStartedBefore(long cutoffMillis, int limit) {
        return querySpans(
                "SELECT * FROM ledger_spans WHERE ended_at IS NULL AND started_at < ? ORDER BY started_at LIMIT ?",
                cutoffMillis, limit);
    }

    @Override
    public long size() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM ledger_events")) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new LedgerStorageException("Count failed", e);
        }
    }

    @Override
    public void close() {
        closeQuietly(keepAlive);
        log.info("Evidence ledger at {} closed", url);
    }

    // ---------------------------------------------------------------------
    // JDBC helpers
    // ---------------------------------------------------------------------

    private List<Event> queryEvents(String sql, Object... params) {
        List<Event> events = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    events.add(mapEvent(rs));
                }
            }
        } catch (SQLException e) {
            throw new LedgerStorageException("Event query failed", e);
        }
        return events;
    }

    private List<Span> querySpans(String sql, Object... params) {
        List<Span> spans = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    spans.add(mapSpan(rs));
                }
            }
        } catch (SQLException e) {
            throw new LedgerStorageException("Span query failed", e);
        }
        return spans;
    }

    private static long update(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            return stmt.executeUpdate();
        }
    }

    private static void bind(PreparedStatement stmt, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            stmt.setObject(i + 1, params[i]);
        }
    }

    private static Event mapEvent(ResultSet rs) throws SQLException {
        try {
            return Event.builder()
                    .eventId(rs.getString("event_id"))
                    .traceId(rs.getString("trace_id"))
                    .spanId(rs.getString("span_id"))
                    .parentEventId(rs.getString("parent_event_id"))
                    .type(rs.getString("event_type"))
                    .stage(Stage.fromWire(rs.getString("stage"))
                            .orElseThrow(() -> new SQLException("Unknown stage in ledger")))
                    .source(rs.getString("source"))
                    .workerId(rs.getString("worker_id"))
                    .timestamp(rs.getLong("ts"))
                    .sequence(rs.getLong("seq"))
                    .status(EventStatus.fromWire(rs.getString("status")).orElse(EventStatus.UNKNOWN))
                    .payload(EventJson.readPayload(rs.getString("payload_json")))
                    .evidenceRefs(EventJson.evidenceFromJson(readTree(rs.getString("evidence_json"))))
                    .correlationId(rs.getString("correlation_id"))
                    .causationId(rs.getString("causation_id"))
                    .spanGenerated(rs.getBoolean("span_generated"))
                    .ackOfEventId(rs.getString("ack_of_event_id"))
                    .retryOfEventId(rs.getString("retry_of_event_id"))
                    .build();
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt JSON column in ledger_events", e);
        }
    }

    private static JsonNode readTree(String json) throws JsonProcessingException {
        return json == null ? null : EventJson.MAPPER.readTree(json);
    }

    private static Span mapSpan(ResultSet rs) throws SQLException {
        long endedAt = rs.getLong("ended_at");
        Long ended = rs.wasNull() ? null : endedAt;
        return new Span(
                rs.getString("span_id"),
                rs.getString("trace_id"),
                Stage.fromWire(rs.getString("stage")).orElse(Stage.SYSTEM),
                rs.getString("worker_id"),
                rs.getLong("started_at"),
                ended,
                EventStatus.fromWire(rs.getString("status")).orElse(EventStatus.UNKNOWN),
                rs.getInt("event_count"));
    }

    private static void closeQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to close ledger connection", e);
        }
    }
}
