package in.fxarena.domain.risk;

import java.math.BigDecimal;

/**
 * Admin-configurable risk limits.
 *
 * Margin thresholds are percentages of margin level and must be ordered
 * liquidation &lt; marginCall &lt; warning.
 */
public record RiskThresholds(
    double liquidation,
    double marginCall,
    double warning,
    int maxOpenPositions,
    int maxLeverage,
    BigDecimal maxLotSize
) {
    public static final double DEFAULT_LIQUIDATION = 50;
    public static final double DEFAULT_MARGIN_CALL = 100;
    public static final double DEFAULT_WARNING = 150;
    /** Level at or above which a book is comfortably healthy. Informational. */
    public static final double SAFE_LEVEL = 200;

    public static final int DEFAULT_MAX_OPEN_POSITIONS = 10;
    public static final int DEFAULT_MAX_LEVERAGE = 500;
    public static final BigDecimal DEFAULT_MAX_LOT_SIZE = new BigDecimal("100");

    public RiskThresholds {
        if (!(liquidation < marginCall && marginCall < warning)) {
            throw new IllegalArgumentException(String.format(
                "Thresholds must satisfy liquidation < marginCall < warning (got %s, %s, %s)",
                liquidation, marginCall, warning));
        }
        if (maxOpenPositions <= 0 || maxLeverage <= 0) {
            throw new IllegalArgumentException("maxOpenPositions and maxLeverage must be positive");
        }
        if (maxLotSize == null || maxLotSize.signum() <= 0) {
            throw new IllegalArgumentException("maxLotSize must be positive");
        }
    }

    public static RiskThresholds defaults() {
        return new RiskThresholds(DEFAULT_LIQUIDATION, DEFAULT_MARGIN_CALL, DEFAULT_WARNING,
            DEFAULT_MAX_OPEN_POSITIONS, DEFAULT_MAX_LEVERAGE, DEFAULT_MAX_LOT_SIZE);
    }
}
