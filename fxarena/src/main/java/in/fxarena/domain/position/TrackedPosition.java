package in.fxarena.domain.position;

import java.math.BigDecimal;

/**
 * Open position as seen by the trigger index and the margin sweep.
 *
 * stopLoss and takeProfit are nullable. quantity is in lots.
 */
public record TrackedPosition(
    String positionId,
    String symbol,
    Side side,
    BigDecimal entryPrice,
    BigDecimal quantity,
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    String userId,
    String contextId
) {
    public TrackedPosition {
        if (positionId == null || symbol == null || side == null || entryPrice == null || quantity == null) {
            throw new IllegalArgumentException("positionId, symbol, side, entryPrice and quantity are required");
        }
    }

    /** True if the position has at least one exit level worth watching. */
    public boolean hasExitLevels() {
        return stopLoss != null || takeProfit != null;
    }

    public TrackedPosition withExitLevels(BigDecimal newStopLoss, BigDecimal newTakeProfit) {
        return new TrackedPosition(positionId, symbol, side, entryPrice, quantity,
            newStopLoss, newTakeProfit, userId, contextId);
    }
}
