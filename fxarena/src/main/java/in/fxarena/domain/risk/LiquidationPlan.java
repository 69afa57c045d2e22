package in.fxarena.domain.risk;

import in.fxarena.domain.position.BookPosition;

import java.math.BigDecimal;
import java.util.List;

/**
 * Positions to force-close for a book in liquidation, in closing order, with
 * the price each should close at.
 *
 * @param projectedMarginLevel margin level once every planned close settles
 */
public record LiquidationPlan(
    String userId,
    String contextId,
    List<PlannedClose> closes,
    double projectedMarginLevel
) {
    public LiquidationPlan {
        closes = closes == null ? List.of() : List.copyOf(closes);
    }

    public boolean isEmpty() {
        return closes.isEmpty();
    }

    public record PlannedClose(BookPosition position, BigDecimal exitPrice, BigDecimal unrealizedPnl) {
    }
}
