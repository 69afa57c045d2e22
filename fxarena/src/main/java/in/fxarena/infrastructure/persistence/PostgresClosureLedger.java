package in.fxarena.infrastructure.persistence;

import in.fxarena.application.port.output.ClosureSink;
import in.fxarena.domain.position.CloseReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Records every close the engine settles in position_closures. A position
 * is recorded once; repeats are ignored.
 */
public final class PostgresClosureLedger implements ClosureSink {
    private static final Logger log = LoggerFactory.getLogger(PostgresClosureLedger.class);

    private final DataSource dataSource;

    public PostgresClosureLedger(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void recordClosure(String positionId, BigDecimal pnl, CloseReason reason) {
        String sql = """
            INSERT INTO position_closures (position_id, realized_pnl, close_reason)
            VALUES (?, ?, ?)
            ON CONFLICT (position_id) DO NOTHING
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, positionId);
            ps.setBigDecimal(2, pnl);
            ps.setString(3, reason.code());
            if (ps.executeUpdate() == 0) {
                log.debug("Closure for {} already recorded", positionId);
            }
        } catch (SQLException e) {
            log.error("Error recording closure for {}: {}", positionId, e.getMessage(), e);
            throw new RuntimeException("Failed to record closure", e);
        }
    }
}
