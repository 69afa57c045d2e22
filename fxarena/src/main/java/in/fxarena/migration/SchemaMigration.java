package in.fxarena.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the tables the engine owns on startup.
 *
 * - price_cache:       shared price tier, one row per symbol
 * - trade_queue:       durable trade execution queue
 * - position_closures: ledger of closes settled by the engine
 *
 * Position and participant tables belong to the trading platform and are
 * not touched here.
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[MIGRATION] Starting engine schema migration");

        try (Connection conn = dataSource.getConnection()) {
            createIfMissing(conn, "price_cache", """
                CREATE TABLE price_cache (
                    symbol      VARCHAR(16) PRIMARY KEY,
                    bid         NUMERIC(20,8) NOT NULL,
                    ask         NUMERIC(20,8) NOT NULL,
                    quote_ts    TIMESTAMPTZ NOT NULL,
                    source      VARCHAR(16) NOT NULL,
                    updated_at  TIMESTAMPTZ NOT NULL DEFAULT NOW()
                )
                """);

            createIfMissing(conn, "trade_queue", """
                CREATE TABLE trade_queue (
                    seq          BIGSERIAL,
                    id           VARCHAR(64) PRIMARY KEY,
                    user_id      VARCHAR(64),
                    position_id  VARCHAR(64),
                    action       VARCHAR(16) NOT NULL,
                    payload      JSONB NOT NULL DEFAULT '{}'::jsonb,
                    created_at   TIMESTAMPTZ NOT NULL,
                    retries      INT NOT NULL DEFAULT 0,
                    status       VARCHAR(16) NOT NULL DEFAULT 'PENDING',
                    claimed_at   TIMESTAMPTZ,
                    CONSTRAINT trade_queue_status_chk CHECK (status IN ('PENDING', 'PROCESSING'))
                );
                CREATE INDEX idx_trade_queue_pending ON trade_queue (seq) WHERE status = 'PENDING';
                """);

            createIfMissing(conn, "position_closures", """
                CREATE TABLE position_closures (
                    position_id  VARCHAR(64) PRIMARY KEY,
                    realized_pnl NUMERIC(20,2) NOT NULL,
                    close_reason VARCHAR(32) NOT NULL,
                    recorded_at  TIMESTAMPTZ NOT NULL DEFAULT NOW()
                )
                """);

            log.info("[MIGRATION] Migration completed successfully");

        } catch (SQLException e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Schema migration failed", e);
        }
    }

    private void createIfMissing(Connection conn, String table, String ddl) throws SQLException {
        if (tableExists(conn, table)) {
            log.info("[MIGRATION] {} table already exists", table);
            return;
        }
        log.info("[MIGRATION] Creating {} table...", table);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(ddl);
        }
        log.info("[MIGRATION] ✓ {} table created", table);
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }
}
