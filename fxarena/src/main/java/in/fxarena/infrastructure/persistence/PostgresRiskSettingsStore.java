package in.fxarena.infrastructure.persistence;

import in.fxarena.application.port.output.RiskSettingsStore;
import in.fxarena.domain.risk.RiskThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Reads admin risk settings from trading_risk_settings. Missing columns
 * (NULL) fall back to the defaults; no row at all means all defaults.
 */
public final class PostgresRiskSettingsStore implements RiskSettingsStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresRiskSettingsStore.class);

    private final DataSource dataSource;

    public PostgresRiskSettingsStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public RiskThresholds getRiskThresholds() {
        String sql = """
            SELECT margin_liquidation, margin_call, margin_warning,
                   max_open_positions, max_leverage, max_lot_size
              FROM trading_risk_settings
             ORDER BY updated_at DESC
             LIMIT 1
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            if (!rs.next()) {
                return RiskThresholds.defaults();
            }
            return mapRow(rs);
        } catch (SQLException e) {
            log.error("Error reading risk settings: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to read risk settings", e);
        }
    }

    private RiskThresholds mapRow(ResultSet rs) throws SQLException {
        double liquidation = doubleOr(rs, "margin_liquidation", RiskThresholds.DEFAULT_LIQUIDATION);
        double marginCall = doubleOr(rs, "margin_call", RiskThresholds.DEFAULT_MARGIN_CALL);
        double warning = doubleOr(rs, "margin_warning", RiskThresholds.DEFAULT_WARNING);
        int maxOpen = intOr(rs, "max_open_positions", RiskThresholds.DEFAULT_MAX_OPEN_POSITIONS);
        int maxLeverage = intOr(rs, "max_leverage", RiskThresholds.DEFAULT_MAX_LEVERAGE);
        BigDecimal maxLot = rs.getBigDecimal("max_lot_size");

        try {
            return new RiskThresholds(liquidation, marginCall, warning, maxOpen, maxLeverage,
                maxLot != null ? maxLot : RiskThresholds.DEFAULT_MAX_LOT_SIZE);
        } catch (IllegalArgumentException e) {
            log.warn("Stored risk settings are inconsistent ({}), using defaults", e.getMessage());
            return RiskThresholds.defaults();
        }
    }

    private static double doubleOr(ResultSet rs, String column, double fallback) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? fallback : value;
    }

    private static int intOr(ResultSet rs, String column, int fallback) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? fallback : value;
    }
}
