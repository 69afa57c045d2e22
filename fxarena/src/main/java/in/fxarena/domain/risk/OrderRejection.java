package in.fxarena.domain.risk;

/**
 * Reason codes for a rejected order, in the order they are checked.
 */
public enum OrderRejection {
    INSUFFICIENT_CAPITAL,
    MAX_OPEN_POSITIONS,
    MAX_LOT_SIZE,
    MAX_LEVERAGE,
    INVALID_QUANTITY,
    INVALID_EXIT_LEVELS,
    TOTAL_RISK_EXCEEDED
}
