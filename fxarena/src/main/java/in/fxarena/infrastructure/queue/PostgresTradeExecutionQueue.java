package in.fxarena.infrastructure.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.fxarena.application.port.output.TradeExecutionQueue;
import in.fxarena.domain.trade.QueueStats;
import in.fxarena.domain.trade.QueuedTrade;
import in.fxarena.domain.trade.TradeAction;
import in.fxarena.infrastructure.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * PostgreSQL implementation of TradeExecutionQueue.
 *
 * Rows live in trade_queue with status PENDING or PROCESSING; a BIGSERIAL
 * seq gives FIFO order. Workers claim with FOR UPDATE SKIP LOCKED so each
 * pending row is handed to exactly one worker across processes. Requeue
 * deletes and re-inserts the row to move it to the tail.
 */
public final class PostgresTradeExecutionQueue implements TradeExecutionQueue {
    private static final Logger log = LoggerFactory.getLogger(PostgresTradeExecutionQueue.class);

    private static final TypeReference<Map<String, String>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final EngineMetrics metrics;

    public PostgresTradeExecutionQueue(DataSource dataSource, EngineMetrics metrics) {
        this.dataSource = dataSource;
        this.objectMapper = new ObjectMapper();
        this.metrics = metrics != null ? metrics : EngineMetrics.noop();
    }

    @Override
    public void enqueue(QueuedTrade trade) {
        try (Connection conn = dataSource.getConnection()) {
            insert(conn, trade.withRetries(0));
            metrics.recordQueueEvent("enqueued");
            log.debug("[QUEUE] Enqueued {} {} for position {}", trade.action(), trade.id(), trade.positionId());
        } catch (SQLException e) {
            log.error("[QUEUE] Failed to enqueue trade {}: {}", trade.id(), e.getMessage());
            throw new RuntimeException("Failed to enqueue trade", e);
        }
    }

    @Override
    public Optional<QueuedTrade> dequeue() {
        String sql = """
            UPDATE trade_queue
               SET status = 'PROCESSING', claimed_at = NOW()
             WHERE id = (
                   SELECT id FROM trade_queue
                    WHERE status = 'PENDING'
                    ORDER BY seq
                    FOR UPDATE SKIP LOCKED
                    LIMIT 1)
            RETURNING id, user_id, position_id, action, payload, created_at, retries
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                return Optional.of(mapRow(rs));
            }
            return Optional.empty();
        } catch (SQLException e) {
            log.error("[QUEUE] Failed to dequeue: {}", e.getMessage());
            throw new RuntimeException("Failed to dequeue trade", e);
        }
    }

    @Override
    public void complete(QueuedTrade trade) {
        String sql = "DELETE FROM trade_queue WHERE id = ? AND status = 'PROCESSING'";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, trade.id());
            int deleted = ps.executeUpdate();
            if (deleted == 0) {
                log.warn("[QUEUE] complete() for trade {} that is not processing", trade.id());
            } else {
                metrics.recordQueueEvent("completed");
            }
        } catch (SQLException e) {
            log.error("[QUEUE] Failed to complete trade {}: {}", trade.id(), e.getMessage());
            throw new RuntimeException("Failed to complete trade", e);
        }
    }

    @Override
    public boolean requeue(QueuedTrade trade) {
        boolean retry = trade.retries() < MAX_RETRIES;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM trade_queue WHERE id = ?")) {
                    ps.setString(1, trade.id());
                    ps.executeUpdate();
                }
                if (retry) {
                    insert(conn, trade.withRetries(trade.retries() + 1));
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.error("[QUEUE] Failed to requeue trade {}: {}", trade.id(), e.getMessage());
            throw new RuntimeException("Failed to requeue trade", e);
        }

        if (retry) {
            metrics.recordQueueEvent("requeued");
            log.warn("[QUEUE] Requeued {} (retry {}/{})", trade.id(), trade.retries() + 1, MAX_RETRIES);
            return true;
        }
        metrics.recordQueueEvent("dropped");
        log.error("[QUEUE] Dropping trade after {} retries: {}", trade.retries(), trade);
        return false;
    }

    @Override
    public QueueStats stats() {
        String sql = """
            SELECT COUNT(*) FILTER (WHERE status = 'PENDING')    AS pending,
                   COUNT(*) FILTER (WHERE status = 'PROCESSING') AS processing
              FROM trade_queue
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            return new QueueStats(rs.getLong("pending"), rs.getLong("processing"));
        } catch (SQLException e) {
            log.error("[QUEUE] Failed to read queue stats: {}", e.getMessage());
            throw new RuntimeException("Failed to read queue stats", e);
        }
    }

    @Override
    public Set<String> positionsWithQueuedClose() {
        String sql = "SELECT DISTINCT position_id FROM trade_queue WHERE action = 'CLOSE'";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            Set<String> ids = new HashSet<>();
            while (rs.next()) {
                ids.add(rs.getString("position_id"));
            }
            return ids;
        } catch (SQLException e) {
            log.error("[QUEUE] Failed to list queued closes: {}", e.getMessage());
            throw new RuntimeException("Failed to list queued closes", e);
        }
    }

    /**
     * Return trades stuck in PROCESSING (worker died mid-settlement) to the
     * pending list. Runs on startup and on the settlement worker's lease timer.
     *
     * @return number of rows released
     */
    @Override
    public int releaseAbandoned(Duration claimedLongerThan) {
        String sql = """
            UPDATE trade_queue
               SET status = 'PENDING', claimed_at = NULL
             WHERE status = 'PROCESSING'
               AND claimed_at < NOW() - (? * INTERVAL '1 second')
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, claimedLongerThan.toSeconds());
            int released = ps.executeUpdate();
            if (released > 0) {
                log.warn("[QUEUE] Released {} abandoned trades back to pending", released);
            }
            return released;
        } catch (SQLException e) {
            log.error("[QUEUE] Failed to release abandoned trades: {}", e.getMessage());
            throw new RuntimeException("Failed to release abandoned trades", e);
        }
    }

    private void insert(Connection conn, QueuedTrade trade) throws SQLException {
        String sql = """
            INSERT INTO trade_queue (id, user_id, position_id, action, payload, created_at, retries, status)
            VALUES (?, ?, ?, ?, ?::jsonb, ?, ?, 'PENDING')
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, trade.id());
            ps.setString(2, trade.userId());
            ps.setString(3, trade.positionId());
            ps.setString(4, trade.action().name());
            ps.setString(5, toJson(trade.payload()));
            ps.setTimestamp(6, Timestamp.from(trade.timestamp()));
            ps.setInt(7, trade.retries());
            ps.executeUpdate();
        }
    }

    private QueuedTrade mapRow(ResultSet rs) throws SQLException {
        return new QueuedTrade(
            rs.getString("id"),
            rs.getString("user_id"),
            rs.getString("position_id"),
            TradeAction.valueOf(rs.getString("action")),
            fromJson(rs.getString("payload")),
            rs.getTimestamp("created_at").toInstant(),
            rs.getInt("retries"));
    }

    private String toJson(Map<String, String> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable trade payload", e);
        }
    }

    private Map<String, String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt trade payload: " + json, e);
        }
    }
}
